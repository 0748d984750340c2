////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.pycoffee.compiler.ast;

/**
 * Base class of the Python syntax tree handed to the renderer. Nodes are
 * immutable once the parser has built them.
 */
public abstract class PyNode {

	private final NodeKind kind;
	private final int lineNumber;

	protected PyNode(NodeKind kind, int lineNumber) {
		this.kind = kind;
		this.lineNumber = lineNumber;
	}

	public NodeKind getKind() {
		return kind;
	}

	/**
	 * @return the 1-based source line, or {@code 0} for nodes without one
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	public boolean hasLineNumber() {
		return lineNumber > 0;
	}

	@Override
	public String toString() {
		return kind.getPythonName() + (hasLineNumber() ? "@" + lineNumber : "");
	}
}
