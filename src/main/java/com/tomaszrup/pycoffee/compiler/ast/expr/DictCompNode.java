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

public class DictCompNode extends PyNode {

	private final PyNode key;
	private final PyNode value;
	private final List<ComprehensionNode> generators;

	public DictCompNode(int lineNumber, PyNode key, PyNode value, List<ComprehensionNode> generators) {
		super(NodeKind.DICT_COMP, lineNumber);
		this.key = key;
		this.value = value;
		this.generators = generators;
	}

	public PyNode getKey() {
		return key;
	}

	public PyNode getValue() {
		return value;
	}

	public List<ComprehensionNode> getGenerators() {
		return generators;
	}
}
