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
package com.tomaszrup.pycoffee.compiler.ast.expr;

import java.util.List;

import com.tomaszrup.pycoffee.compiler.ast.NodeKind;
import com.tomaszrup.pycoffee.compiler.ast.PyNode;

/**
 * A call. Arguments are kept in source order: plain expressions,
 * {@code *x} as a {@link NodeKind#STARRED} wrapper, {@code k=v} and
 * {@code **x} as {@link KeywordNode}s (the latter without a name).
 */
public class CallNode extends PyNode {

	private final PyNode func;
	private final List<PyNode> args;

	public CallNode(int lineNumber, PyNode func, List<PyNode> args) {
		super(NodeKind.CALL, lineNumber);
		this.func = func;
		this.args = args;
	}

	public PyNode getFunc() {
		return func;
	}

	public List<PyNode> getArgs() {
		return args;
	}
}
