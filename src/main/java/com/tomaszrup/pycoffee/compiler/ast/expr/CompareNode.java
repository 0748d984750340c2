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
import com.tomaszrup.pycoffee.compiler.ast.OperatorKind;
import com.tomaszrup.pycoffee.compiler.ast.PyNode;

public class CompareNode extends PyNode {

	private final PyNode left;
	private final List<OperatorKind> ops;
	private final List<PyNode> comparators;

	public CompareNode(int lineNumber, PyNode left, List<OperatorKind> ops, List<PyNode> comparators) {
		super(NodeKind.COMPARE, lineNumber);
		this.left = left;
		this.ops = ops;
		this.comparators = comparators;
	}

	public PyNode getLeft() {
		return left;
	}

	public List<OperatorKind> getOps() {
		return ops;
	}

	public List<PyNode> getComparators() {
		return comparators;
	}
}
