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
import com.tomaszrup.pycoffee.compiler.ast.PyNode;

public class AnnAssignNode extends PyNode {

	private final PyNode target;
	private final PyNode annotation;
	private final PyNode value;

	public AnnAssignNode(int lineNumber, PyNode target, PyNode annotation, PyNode value) {
		super(NodeKind.ANN_ASSIGN, lineNumber);
		this.target = target;
		this.annotation = annotation;
		this.value = value;
	}

	public PyNode getTarget() {
		return target;
	}

	public PyNode getAnnotation() {
		return annotation;
	}

	public PyNode getValue() {
		return value;
	}
}
