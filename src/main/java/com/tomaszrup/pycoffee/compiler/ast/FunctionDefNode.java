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

import java.util.List;

/**
 * {@code def} or {@code async def}; the line is the line of the {@code def} keyword.
 */
public class FunctionDefNode extends PyNode {

	private final String name;
	private final ArgumentsNode args;
	private final PyNode returns;
	private final List<PyNode> body;
	private final List<PyNode> decorators;

	public FunctionDefNode(NodeKind kind, int lineNumber, String name, ArgumentsNode args, PyNode returns,
			List<PyNode> body, List<PyNode> decorators) {
		super(kind, lineNumber);
		this.name = name;
		this.args = args;
		this.returns = returns;
		this.body = body;
		this.decorators = decorators;
	}

	public String getName() {
		return name;
	}

	public ArgumentsNode getArgs() {
		return args;
	}

	/**
	 * The {@code -> annotation}, or {@code null}.
	 */
	public PyNode getReturns() {
		return returns;
	}

	public List<PyNode> getBody() {
		return body;
	}

	public List<PyNode> getDecorators() {
		return decorators;
	}
}
