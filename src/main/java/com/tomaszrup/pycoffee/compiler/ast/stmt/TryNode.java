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
package com.tomaszrup.pycoffee.compiler.ast.stmt;

import java.util.List;

import com.tomaszrup.pycoffee.compiler.ast.NodeKind;
import com.tomaszrup.pycoffee.compiler.ast.PyNode;

public class TryNode extends PyNode {

	private final List<PyNode> body;
	private final List<ExceptHandlerNode> handlers;
	private final List<PyNode> orelse;
	private final int orelseLine;
	private final List<PyNode> finalbody;
	private final int finallyLine;

	public TryNode(int lineNumber, List<PyNode> body, List<ExceptHandlerNode> handlers, List<PyNode> orelse, int orelseLine, List<PyNode> finalbody, int finallyLine) {
		super(NodeKind.TRY, lineNumber);
		this.body = body;
		this.handlers = handlers;
		this.orelse = orelse;
		this.orelseLine = orelseLine;
		this.finalbody = finalbody;
		this.finallyLine = finallyLine;
	}

	public List<PyNode> getBody() {
		return body;
	}

	public List<ExceptHandlerNode> getHandlers() {
		return handlers;
	}

	public List<PyNode> getOrelse() {
		return orelse;
	}

	public int getOrelseLine() {
		return orelseLine;
	}

	public List<PyNode> getFinalbody() {
		return finalbody;
	}

	public int getFinallyLine() {
		return finallyLine;
	}
}
