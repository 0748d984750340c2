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
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.pycoffee.compiler.lexer.LexException;
import com.tomaszrup.pycoffee.compiler.lexer.PythonTokenizer;
import com.tomaszrup.pycoffee.compiler.lexer.SourcePosition;
import com.tomaszrup.pycoffee.compiler.lexer.Token;
import com.tomaszrup.pycoffee.compiler.lexer.TokenKind;

/**
 * Reconciles a parse tree with the flat token stream it was built from.
 *
 * <p>The tree drops comments, blank lines and the spelling of string
 * literals. This index recovers them per source line:
 * <ul>
 *   <li>{@link #leading(int)} returns the comment and blank lines above a
 *   node, each at most once over the whole file</li>
 *   <li>{@link #trailingComment(int)} returns the end-of-line comment of a
 *   statement's line</li>
 *   <li>{@link #nextStringLiteral(int)} returns the original text of the
 *   next string literal on a line</li>
 * </ul>
 *
 * <p>Line numbers passed in are 1-based; {@code 0} means the node has no
 * line. Internally line {@code n} lives in bucket {@code n - 1}, and one
 * extra bucket holds the tokens emitted after the last line. Nodes must be
 * queried in increasing line order.
 */
public class TokenSync {

	private static final Logger logger = LoggerFactory.getLogger(TokenSync.class);

	/**
	 * Stand-in for a blank line in the ignored-line index.
	 */
	static final Token BLANK_LINE = new Token(TokenKind.NEWLINE, "\n", "\n",
			new SourcePosition(0, 0), new SourcePosition(0, 0));

	private final List<String> lines;
	private final List<List<Token>> lineTokens;
	private final Set<Integer> blankLines;
	private final List<StringLiteralQueue> stringTokens;
	private final List<Token> ignoredLines;
	private int firstLeadingLine;

	/**
	 * Index {@code tokens}, the complete token stream of {@code rawText}.
	 *
	 * @throws LexException if a token lies outside the text's lines
	 */
	public TokenSync(String rawText, List<Token> tokens) {
		this.lines = makeLines(rawText);
		this.lineTokens = makeLineTokens(tokens);
		this.blankLines = makeBlankLines();
		this.stringTokens = makeStringTokens();
		this.ignoredLines = makeIgnoredLines();
		this.firstLeadingLine = firstIgnoredLine();
		logger.debug("Indexed {} lines: {} blank, {} ignored, first leading line {}",
				lines.size(), blankLines.size(), countIgnored(), firstLeadingLine);
	}

	private static List<String> makeLines(String rawText) {
		List<String> result = new ArrayList<>();
		for (String line : PythonTokenizer.splitLines(rawText)) {
			result.add(line.stripTrailing());
		}
		return Collections.unmodifiableList(result);
	}

	private List<List<Token>> makeLineTokens(List<Token> tokens) {
		List<List<Token>> result = new ArrayList<>();
		for (int i = 0; i <= lines.size(); i++) {
			result.add(new ArrayList<>());
		}
		for (Token token : tokens) {
			int row = token.getKind() == TokenKind.STRING ? token.getEnd().getRow() : token.getStart().getRow();
			int index = row - 1;
			if (index < 0 || index >= result.size()) {
				throw new LexException("token " + token + " lies outside the " + lines.size() + " source lines",
						row);
			}
			result.get(index).add(token);
		}
		return result;
	}

	private Set<Integer> makeBlankLines() {
		Set<Integer> result = new TreeSet<>();
		for (int i = 0; i < lineTokens.size(); i++) {
			List<Token> bucket = lineTokens.get(i);
			if (bucket.size() == 1 && bucket.get(0).getKind() == TokenKind.NL) {
				result.add(i);
			}
		}
		return Collections.unmodifiableSet(result);
	}

	private List<StringLiteralQueue> makeStringTokens() {
		List<StringLiteralQueue> result = new ArrayList<>();
		for (int i = 0; i < lineTokens.size(); i++) {
			StringLiteralQueue queue = new StringLiteralQueue(i + 1);
			for (Token token : lineTokens.get(i)) {
				if (token.getKind() == TokenKind.STRING) {
					queue.add(token);
				}
			}
			result.add(queue);
		}
		return result;
	}

	private List<Token> makeIgnoredLines() {
		List<Token> result = new ArrayList<>();
		for (int i = 0; i < lineTokens.size(); i++) {
			Token ignored = null;
			for (Token token : lineTokens.get(i)) {
				if (isLineComment(token)) {
					ignored = token;
					break;
				}
			}
			if (ignored == null && blankLines.contains(i)) {
				ignored = BLANK_LINE;
			}
			result.add(ignored);
		}
		return result;
	}

	private int firstIgnoredLine() {
		for (int i = 0; i < ignoredLines.size(); i++) {
			if (ignoredLines.get(i) != null) {
				return i;
			}
		}
		return ignoredLines.size();
	}

	private int countIgnored() {
		int count = 0;
		for (Token token : ignoredLines) {
			if (token != null) {
				count++;
			}
		}
		return count;
	}

	/**
	 * A comment is a full-line comment when nothing but whitespace precedes
	 * it on its physical line.
	 */
	static boolean isLineComment(Token token) {
		return token.getKind() == TokenKind.COMMENT && token.getRawText().stripLeading().startsWith("#");
	}

	/**
	 * Return the unread comment and blank lines in front of {@code nodeLine},
	 * each newline-terminated, and mark them read.
	 */
	public List<String> leading(int nodeLine) {
		List<String> result = new ArrayList<>();
		if (nodeLine <= 0) {
			return result;
		}
		int i = firstLeadingLine;
		while (i < nodeLine && i < ignoredLines.size()) {
			Token token = ignoredLines.get(i);
			if (token != null) {
				result.add(token.getRawText().stripTrailing() + "\n");
			}
			i++;
		}
		firstLeadingLine = i;
		return result;
	}

	public String leadingString(int nodeLine) {
		return String.join("", leading(nodeLine));
	}

	/**
	 * Return {@code " <comment>\n"} when the line ends with a comment, or
	 * {@code "\n"} otherwise.
	 */
	public String trailingComment(int nodeLine) {
		if (nodeLine <= 0 || nodeLine > lineTokens.size()) {
			return "\n";
		}
		for (Token token : lineTokens.get(nodeLine - 1)) {
			if (token.getKind() == TokenKind.COMMENT && !isLineComment(token)) {
				return " " + token.getText().stripTrailing() + "\n";
			}
		}
		return "\n";
	}

	/**
	 * Return the original text of the next string literal ending on
	 * {@code nodeLine}.
	 *
	 * @throws StringQueueUnderflowException if every string token of the line
	 *         has already been consumed, or the line has none
	 */
	public String nextStringLiteral(int nodeLine) throws StringQueueUnderflowException {
		if (nodeLine <= 0 || nodeLine > stringTokens.size()) {
			throw new StringQueueUnderflowException(nodeLine);
		}
		return stringTokens.get(nodeLine - 1).next();
	}

	/**
	 * Number of string tokens on {@code nodeLine} not yet returned by
	 * {@link #nextStringLiteral(int)}.
	 */
	public int remainingStringLiterals(int nodeLine) {
		if (nodeLine <= 0 || nodeLine > stringTokens.size()) {
			return 0;
		}
		return stringTokens.get(nodeLine - 1).remaining();
	}

	public List<String> getLines() {
		return lines;
	}

	/**
	 * 0-based indices of lines holding nothing but a line break.
	 */
	public Set<Integer> getBlankLines() {
		return blankLines;
	}

	public boolean isIgnoredLine(int index) {
		return index >= 0 && index < ignoredLines.size() && ignoredLines.get(index) != null;
	}

	public int getBucketCount() {
		return lineTokens.size();
	}

	public int getFirstLeadingLine() {
		return firstLeadingLine;
	}
}
