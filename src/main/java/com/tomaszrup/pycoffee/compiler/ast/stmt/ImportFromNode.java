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
 * {@code from <dots><module> import names}; {@code module} is {@code null} for
 * {@code from . import x}.
 */
public class ImportFromNode extends PyNode {

	private final String module;
	private final int level;
	private final List<AliasNode> names;

	public ImportFromNode(int lineNumber, String module, int level, List<AliasNode> names) {
		super(NodeKind.IMPORT_FROM, lineNumber);
		this.module = module;
		this.level = level;
		this.names = names;
	}

	public String getModule() {
		return module;
	}

	public int getLevel() {
		return level;
	}

	public List<AliasNode> getNames() {
		return names;
	}
}
