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

/**
 * {@code orelseLine} is the line of the {@code else} keyword, or {@code 0} when
 * there is no {@code else} clause or it came from an {@code elif}.
 */
public class IfNode extends PyNode {

	private final PyNode test;
	private final List<PyNode> body;
	private final List<PyNode> orelse;
	private final int orelseLine;

	public IfNode(int lineNumber, PyNode test, List<PyNode> body, List<PyNode> orelse, int orelseLine) {
		super(NodeKind.IF, lineNumber);
		this.test = test;
		this.body = body;
		this.orelse = orelse;
		this.orelseLine = orelseLine;
	}

	public PyNode getTest() {
		return test;
	}

	public List<PyNode> getBody() {
		return body;
	}

	public List<PyNode> getOrelse() {
		return orelse;
	}

	public int getOrelseLine() {
		return orelseLine;
	}
}
