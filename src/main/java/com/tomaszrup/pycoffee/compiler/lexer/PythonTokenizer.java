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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits Python source into the same token stream CPython's
 * {@code tokenize} module produces: comments and non-logical line breaks
 * ({@link TokenKind#NL}) are kept, every token remembers its physical line,
 * rows are 1-based and columns 0-based.
 *
 * <p>The scanner works one physical line at a time and keeps three pieces
 * of state between lines:
 * <ul>
 *   <li>the bracket nesting depth, which turns line breaks into {@code NL}</li>
 *   <li>a pending backslash continuation</li>
 *   <li>a string literal that has not been closed yet</li>
 * </ul>
 */
public class PythonTokenizer {

	private static final Logger logger = LoggerFactory.getLogger(PythonTokenizer.class);

	private static final int TAB_SIZE = 8;

	private static final Set<String> STRING_PREFIXES = Set.of(
			"r", "u", "b", "f", "br", "rb", "fr", "rf");

	private static final Set<String> THREE_CHAR_OPERATORS = Set.of(
			"**=", "//=", ">>=", "<<=", "...");

	private static final Set<String> TWO_CHAR_OPERATORS = Set.of(
			"**", "//", ">>", "<<", "<=", ">=", "==", "!=", "->", ":=",
			"+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=");

	private static final String ONE_CHAR_OPERATORS = "+-*/%@&|^~<>()[]{},:;.=";

	/**
	 * A string literal whose closing quote has not been seen on its first line.
	 */
	private static final class PendingString {
		private final SourcePosition start;
		private final String quote;
		private final boolean needsContinuation;
		private final StringBuilder text = new StringBuilder();
		private final StringBuilder rawText = new StringBuilder();

		private PendingString(SourcePosition start, String quote, boolean needsContinuation) {
			this.start = start;
			this.quote = quote;
			this.needsContinuation = needsContinuation;
		}
	}

	private final List<Token> tokens = new ArrayList<>();
	private final Deque<Integer> indents = new ArrayDeque<>();
	private int parenLevel;
	private boolean continued;
	private PendingString pending;

	/**
	 * Tokenize a complete source file.
	 *
	 * @throws LexException if the text cannot be tokenized
	 */
	public static List<Token> tokenize(String source) {
		return new PythonTokenizer().run(source);
	}

	private PythonTokenizer() {
		indents.push(0);
	}

	private List<Token> run(String source) {
		List<String> lines = splitLines(source);
		int lnum = 0;
		String lastLine = "";
		boolean stopped = false;
		for (String line : lines) {
			lnum++;
			lastLine = line;
			if (!tokenizeLine(line, lnum)) {
				stopped = true;
				break;
			}
		}
		if (!stopped) {
			lnum++;
			if (pending != null) {
				throw new LexException("EOF in multi-line string", pending.start.getRow());
			}
			if (continued || parenLevel > 0) {
				throw new LexException("EOF in multi-line statement", lnum);
			}
		}
		if (!lastLine.isBlank() && !lastLine.endsWith("\n") && !lastLine.endsWith("\r")
				&& !lastLine.strip().startsWith("#")) {
			int row = lnum - 1;
			tokens.add(new Token(TokenKind.NEWLINE, "", "",
					new SourcePosition(row, lastLine.length()), new SourcePosition(row, lastLine.length() + 1)));
		}
		SourcePosition eof = new SourcePosition(lnum, 0);
		while (indents.size() > 1) {
			indents.pop();
			tokens.add(new Token(TokenKind.DEDENT, "", "", eof, eof));
		}
		tokens.add(new Token(TokenKind.ENDMARKER, "", "", eof, eof));
		logger.debug("Tokenized {} lines into {} tokens", lines.size(), tokens.size());
		return tokens;
	}

	/**
	 * @return {@code false} when tokenizing must stop (whitespace-only last line)
	 */
	private boolean tokenizeLine(String line, int lnum) {
		int pos = 0;
		int max = line.length();

		if (pending != null) {
			int end = findStringEnd(line, 0, pending.quote, pending.needsContinuation);
			if (end < 0) {
				if (pending.needsContinuation && !endsWithContinuation(line)) {
					throw new LexException("unterminated string literal", pending.start.getRow());
				}
				pending.text.append(line);
				pending.rawText.append(line);
				return true;
			}
			pending.text.append(line, 0, end);
			pending.rawText.append(line);
			tokens.add(new Token(TokenKind.STRING, pending.text.toString(), pending.rawText.toString(),
					pending.start, new SourcePosition(lnum, end)));
			pending = null;
			pos = end;
		} else if (parenLevel == 0 && !continued) {
			int column = 0;
			while (pos < max) {
				char ch = line.charAt(pos);
				if (ch == ' ') {
					column++;
				} else if (ch == '\t') {
					column = (column / TAB_SIZE + 1) * TAB_SIZE;
				} else if (ch == '\f') {
					column = 0;
				} else {
					break;
				}
				pos++;
			}
			if (pos == max) {
				return false;
			}

			char ch = line.charAt(pos);
			if (ch == '#' || ch == '\r' || ch == '\n') {
				if (ch == '#') {
					String comment = stripLineEnd(line.substring(pos));
					tokens.add(new Token(TokenKind.COMMENT, comment, line,
							new SourcePosition(lnum, pos), new SourcePosition(lnum, pos + comment.length())));
					pos += comment.length();
				}
				tokens.add(new Token(TokenKind.NL, line.substring(pos), line,
						new SourcePosition(lnum, pos), new SourcePosition(lnum, max)));
				return true;
			}

			if (column > indents.peek()) {
				indents.push(column);
				tokens.add(new Token(TokenKind.INDENT, line.substring(0, pos), line,
						new SourcePosition(lnum, 0), new SourcePosition(lnum, pos)));
			}
			while (column < indents.peek()) {
				if (!indents.contains(column)) {
					throw new LexException("unindent does not match any outer indentation level", lnum);
				}
				indents.pop();
				tokens.add(new Token(TokenKind.DEDENT, "", line,
						new SourcePosition(lnum, pos), new SourcePosition(lnum, pos)));
			}
		} else {
			continued = false;
		}

		while (pos < max) {
			char ch = line.charAt(pos);
			if (ch == ' ' || ch == '\t' || ch == '\f') {
				pos++;
				continue;
			}
			int start = pos;
			if (Character.isDigit(ch) || (ch == '.' && pos + 1 < max && Character.isDigit(line.charAt(pos + 1)))) {
				pos = scanNumber(line, pos);
				addToken(TokenKind.NUMBER, line, lnum, start, pos);
			} else if (ch == '\r' || ch == '\n') {
				addToken(parenLevel > 0 ? TokenKind.NL : TokenKind.NEWLINE, line, lnum, start, max);
				pos = max;
			} else if (ch == '#') {
				String comment = stripLineEnd(line.substring(pos));
				pos += comment.length();
				addToken(TokenKind.COMMENT, line, lnum, start, pos);
			} else if (startsString(line, pos)) {
				int quoteAt = pos;
				while (line.charAt(quoteAt) != '\'' && line.charAt(quoteAt) != '"') {
					quoteAt++;
				}
				pos = scanString(line, lnum, start, quoteAt);
				if (pos < 0) {
					return true;
				}
			} else if (Character.isLetter(ch) || ch == '_') {
				while (pos < max && (Character.isLetterOrDigit(line.charAt(pos)) || line.charAt(pos) == '_')) {
					pos++;
				}
				addToken(TokenKind.NAME, line, lnum, start, pos);
			} else if (ch == '\\') {
				if (!endsWithContinuation(line.substring(pos))) {
					throw new LexException("unexpected character after line continuation character", lnum);
				}
				continued = true;
				pos = max;
			} else {
				pos = scanOperator(line, lnum, pos);
			}
		}
		return true;
	}

	private void addToken(TokenKind kind, String line, int lnum, int start, int end) {
		tokens.add(new Token(kind, line.substring(start, end), line,
				new SourcePosition(lnum, start), new SourcePosition(lnum, end)));
	}

	/**
	 * @return the position after the literal, or {@code -1} when the literal
	 *         continues on the next line
	 */
	private int scanString(String line, int lnum, int start, int quoteAt) {
		char q = line.charAt(quoteAt);
		boolean triple = line.startsWith(String.valueOf(q).repeat(3), quoteAt);
		String quote = triple ? String.valueOf(q).repeat(3) : String.valueOf(q);
		int bodyStart = quoteAt + quote.length();
		int end = findStringEnd(line, bodyStart, quote, !triple);
		if (end >= 0) {
			addToken(TokenKind.STRING, line, lnum, start, end);
			return end;
		}
		if (!triple && !endsWithContinuation(line)) {
			throw new LexException("unterminated string literal", lnum);
		}
		pending = new PendingString(new SourcePosition(lnum, start), quote, !triple);
		pending.text.append(line.substring(start));
		pending.rawText.append(line);
		return -1;
	}

	private int scanOperator(String line, int lnum, int pos) {
		int max = line.length();
		String op = null;
		if (pos + 3 <= max && THREE_CHAR_OPERATORS.contains(line.substring(pos, pos + 3))) {
			op = line.substring(pos, pos + 3);
		} else if (pos + 2 <= max && TWO_CHAR_OPERATORS.contains(line.substring(pos, pos + 2))) {
			op = line.substring(pos, pos + 2);
		} else if (ONE_CHAR_OPERATORS.indexOf(line.charAt(pos)) >= 0) {
			op = line.substring(pos, pos + 1);
		}
		if (op == null) {
			throw new LexException("invalid character '" + line.charAt(pos) + "'", lnum);
		}
		if (op.equals("(") || op.equals("[") || op.equals("{")) {
			parenLevel++;
		} else if (op.equals(")") || op.equals("]") || op.equals("}")) {
			if (parenLevel == 0) {
				throw new LexException("unmatched '" + op + "'", lnum);
			}
			parenLevel--;
		}
		addToken(TokenKind.OP, line, lnum, pos, pos + op.length());
		return pos + op.length();
	}

	private static boolean startsString(String line, int pos) {
		int i = pos;
		while (i < line.length() && i - pos < 2 && Character.isLetter(line.charAt(i))) {
			i++;
		}
		if (i >= line.length()) {
			return false;
		}
		char ch = line.charAt(i);
		if (ch != '\'' && ch != '"') {
			return false;
		}
		return i == pos || STRING_PREFIXES.contains(line.substring(pos, i).toLowerCase());
	}

	/**
	 * Find the end of a string body, honouring backslash escapes.
	 *
	 * @return the index just after the closing quote, or {@code -1}
	 */
	private static int findStringEnd(String line, int from, String quote, boolean stopAtLineEnd) {
		int i = from;
		while (i < line.length()) {
			char ch = line.charAt(i);
			if (ch == '\\') {
				i += 2;
			} else if (line.startsWith(quote, i)) {
				return i + quote.length();
			} else if (stopAtLineEnd && (ch == '\n' || ch == '\r')) {
				return -1;
			} else {
				i++;
			}
		}
		return -1;
	}

	private static int scanNumber(String line, int pos) {
		int max = line.length();
		int i = pos;
		if (line.charAt(i) == '0' && i + 1 < max && "xXoObB".indexOf(line.charAt(i + 1)) >= 0) {
			i += 2;
			while (i < max && (Character.isLetterOrDigit(line.charAt(i)) || line.charAt(i) == '_')) {
				i++;
			}
			return i;
		}
		i = skipDigits(line, i);
		if (i < max && line.charAt(i) == '.') {
			i = skipDigits(line, i + 1);
		}
		if (i < max && (line.charAt(i) == 'e' || line.charAt(i) == 'E')) {
			int j = i + 1;
			if (j < max && (line.charAt(j) == '+' || line.charAt(j) == '-')) {
				j++;
			}
			if (j < max && Character.isDigit(line.charAt(j))) {
				i = skipDigits(line, j);
			}
		}
		if (i < max && (line.charAt(i) == 'j' || line.charAt(i) == 'J')) {
			i++;
		}
		return i;
	}

	private static int skipDigits(String line, int pos) {
		int i = pos;
		while (i < line.length() && (Character.isDigit(line.charAt(i)) || line.charAt(i) == '_')) {
			i++;
		}
		return i;
	}

	private static boolean endsWithContinuation(String text) {
		return text.endsWith("\\\n") || text.endsWith("\\\r\n");
	}

	private static String stripLineEnd(String text) {
		int end = text.length();
		while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
			end--;
		}
		return text.substring(0, end);
	}

	/**
	 * Split text into physical lines, keeping each line's terminator.
	 */
	public static List<String> splitLines(String text) {
		List<String> lines = new ArrayList<>();
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			char ch = text.charAt(i);
			if (ch == '\n') {
				lines.add(text.substring(start, i + 1));
				start = i + 1;
			} else if (ch == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n')) {
				lines.add(text.substring(start, i + 1));
				start = i + 1;
			}
		}
		if (start < text.length()) {
			lines.add(text.substring(start));
		}
		return lines;
	}
}
