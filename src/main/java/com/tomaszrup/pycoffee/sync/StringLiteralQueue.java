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
package com.tomaszrup.pycoffee.sync;

import java.util.ArrayList;
import java.util.List;

import com.tomaszrup.pycoffee.compiler.lexer.Token;

/**
 * Forward-only cursor over the string tokens that end on one source line.
 */
public final class StringLiteralQueue {

	private final int lineNumber;
	private final List<Token> tokens = new ArrayList<>();
	private int cursor;

	StringLiteralQueue(int lineNumber) {
		this.lineNumber = lineNumber;
	}

	void add(Token token) {
		tokens.add(token);
	}

	public int getLineNumber() {
		return lineNumber;
	}

	public boolean hasNext() {
		return cursor < tokens.size();
	}

	public int remaining() {
		return tokens.size() - cursor;
	}

	/**
	 * Return the original spelling of the next unread string token.
	 */
	public String next() throws StringQueueUnderflowException {
		if (!hasNext()) {
			throw new StringQueueUnderflowException(lineNumber);
		}
		return tokens.get(cursor++).getText();
	}
}
