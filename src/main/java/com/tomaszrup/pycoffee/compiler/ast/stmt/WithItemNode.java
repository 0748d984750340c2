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

public class WithItemNode extends PyNode {

	private final PyNode contextExpr;
	private final PyNode optionalVars;

	public WithItemNode(int lineNumber, PyNode contextExpr, PyNode optionalVars) {
		super(NodeKind.WITH_ITEM, lineNumber);
		this.contextExpr = contextExpr;
		this.optionalVars = optionalVars;
	}

	public PyNode getContextExpr() {
		return contextExpr;
	}

	public PyNode getOptionalVars() {
		return optionalVars;
	}
}
