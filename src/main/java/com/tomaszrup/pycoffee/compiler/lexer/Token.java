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
package com.tomaszrup.pycoffee.compiler.lexer;

/**
 * One lexical token. {@code text} is the token's own spelling, while
 * {@code rawText} is the physical line (or lines, for a multi-line string)
 * the token was read from.
 */
public final class Token {

	private final TokenKind kind;
	private final String text;
	private final String rawText;
	private final SourcePosition start;
	private final SourcePosition end;

	public Token(TokenKind kind, String text, String rawText, SourcePosition start, SourcePosition end) {
		this.kind = kind;
		this.text = text;
		this.rawText = rawText;
		this.start = start;
		this.end = end;
	}

	public TokenKind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	public String getRawText() {
		return rawText;
	}

	public SourcePosition getStart() {
		return start;
	}

	public SourcePosition getEnd() {
		return end;
	}

	public boolean isOp(String op) {
		return kind == TokenKind.OP && text.equals(op);
	}

	public boolean isName(String name) {
		return kind == TokenKind.NAME && text.equals(name);
	}

	@Override
	public String toString() {
		return kind + " " + start + "-" + end + " '" + text.replace("\n", "\\n") + "'";
	}
}
