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

import com.tomaszrup.pycoffee.compiler.ast.NodeKind;
import com.tomaszrup.pycoffee.compiler.ast.OperatorKind;
import com.tomaszrup.pycoffee.compiler.ast.PyNode;

public class AugAssignNode extends PyNode {

	private final PyNode target;
	private final OperatorKind op;
	private final PyNode value;

	public AugAssignNode(int lineNumber, PyNode target, OperatorKind op, PyNode value) {
		super(NodeKind.AUG_ASSIGN, lineNumber);
		this.target = target;
		this.op = op;
		this.value = value;
	}

	public PyNode getTarget() {
		return target;
	}

	public OperatorKind getOp() {
		return op;
	}

	public PyNode getValue() {
		return value;
	}
}
