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

import com.tomaszrup.pycoffee.compiler.ast.NodeKind;
import com.tomaszrup.pycoffee.compiler.ast.PyNode;

public class IfExpNode extends PyNode {

	private final PyNode test;
	private final PyNode body;
	private final PyNode orelse;

	public IfExpNode(int lineNumber, PyNode test, PyNode body, PyNode orelse) {
		super(NodeKind.IF_EXP, lineNumber);
		this.test = test;
		this.body = body;
		this.orelse = orelse;
	}

	public PyNode getTest() {
		return test;
	}

	public PyNode getBody() {
		return body;
	}

	public PyNode getOrelse() {
		return orelse;
	}
}
