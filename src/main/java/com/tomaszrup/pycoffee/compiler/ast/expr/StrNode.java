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
 * A string or bytes literal, possibly made of several adjacent literal tokens.
 * {@code tokenLines} holds, per token, the line the token <em>ends</em> on;
 * {@code value} is the literal body without prefix and quotes.
 */
public class StrNode extends PyNode {

	private final String value;
	private final List<Integer> tokenLines;

	public StrNode(NodeKind kind, int lineNumber, String value, List<Integer> tokenLines) {
		super(kind, lineNumber);
		this.value = value;
		this.tokenLines = tokenLines;
	}

	public String getValue() {
		return value;
	}

	public List<Integer> getTokenLines() {
		return tokenLines;
	}
}
