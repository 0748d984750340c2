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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.pycoffee.compiler.lexer;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PythonTokenizerTests {

	private static List<Token> tokensOfKind(List<Token> tokens, TokenKind kind) {
		List<Token> result = new ArrayList<>();
		for (Token token : tokens) {
			if (token.getKind() == kind) {
				result.add(token);
			}
		}
		return result;
	}

	private static List<Token> tokensOnRow(List<Token> tokens, int row) {
		List<Token> result = new ArrayList<>();
		for (Token token : tokens) {
			if (token.getStart().getRow() == row) {
				result.add(token);
			}
		}
		return result;
	}

	// --- Positions and kinds ---

	@Test
	void testSimpleAssignmentPositions() {
		List<Token> tokens = PythonTokenizer.tokenize("x = 1\n");

		Assertions.assertEquals(5, tokens.size());
		Assertions.assertEquals(TokenKind.NAME, tokens.get(0).getKind());
		Assertions.assertEquals(new SourcePosition(1, 0), tokens.get(0).getStart());
		Assertions.assertEquals(new SourcePosition(1, 1), tokens.get(0).getEnd());
		Assertions.assertTrue(tokens.get(1).isOp("="));
		Assertions.assertEquals(new SourcePosition(1, 2), tokens.get(1).getStart());
		Assertions.assertEquals(TokenKind.NUMBER, tokens.get(2).getKind());
		Assertions.assertEquals(TokenKind.NEWLINE, tokens.get(3).getKind());
		Assertions.assertEquals(new SourcePosition(1, 5), tokens.get(3).getStart());
		Assertions.assertEquals(TokenKind.ENDMARKER, tokens.get(4).getKind());
		Assertions.assertEquals(new SourcePosition(2, 0), tokens.get(4).getStart());
	}

	@Test
	void testRawTextIsPhysicalLine() {
		List<Token> tokens = PythonTokenizer.tokenize("x = 1\ny = 2\n");
		Assertions.assertEquals("y = 2\n", tokensOnRow(tokens, 2).get(0).getRawText());
	}

	@Test
	void testMissingFinalNewlineAddsEmptyNewlineToken() {
		List<Token> tokens = PythonTokenizer.tokenize("x");

		Assertions.assertEquals(3, tokens.size());
		Token newline = tokens.get(1);
		Assertions.assertEquals(TokenKind.NEWLINE, newline.getKind());
		Assertions.assertEquals("", newline.getText());
		Assertions.assertEquals(new SourcePosition(1, 1), newline.getStart());
		Assertions.assertEquals(new SourcePosition(2, 0), tokens.get(2).getStart());
	}

	@Test
	void testEmptySourceHasOnlyEndMarker() {
		List<Token> tokens = PythonTokenizer.tokenize("");
		Assertions.assertEquals(1, tokens.size());
		Assertions.assertEquals(TokenKind.ENDMARKER, tokens.get(0).getKind());
		Assertions.assertEquals(new SourcePosition(1, 0), tokens.get(0).getStart());
	}

	// --- Comments and line breaks ---

	@Test
	void testCommentOnlyLineYieldsCommentAndNl() {
		List<Token> row1 = tokensOnRow(PythonTokenizer.tokenize("# hi\nx = 1\n"), 1);

		Assertions.assertEquals(2, row1.size());
		Assertions.assertEquals(TokenKind.COMMENT, row1.get(0).getKind());
		Assertions.assertEquals("# hi", row1.get(0).getText());
		Assertions.assertEquals("# hi\n", row1.get(0).getRawText());
		Assertions.assertEquals(TokenKind.NL, row1.get(1).getKind());
	}

	@Test
	void testBlankLineYieldsSingleNl() {
		List<Token> row2 = tokensOnRow(PythonTokenizer.tokenize("x = 1\n\ny = 2\n"), 2);
		Assertions.assertEquals(1, row2.size());
		Assertions.assertEquals(TokenKind.NL, row2.get(0).getKind());
	}

	@Test
	void testTrailingCommentKeepsWholeLineAsRawText() {
		List<Token> comments = tokensOfKind(PythonTokenizer.tokenize("x = 1  # note\n"), TokenKind.COMMENT);
		Assertions.assertEquals(1, comments.size());
		Assertions.assertEquals("# note", comments.get(0).getText());
		Assertions.assertEquals("x = 1  # note\n", comments.get(0).getRawText());
		Assertions.assertEquals(new SourcePosition(1, 7), comments.get(0).getStart());
	}

	@Test
	void testLineBreakInsideBracketsIsNl() {
		List<Token> tokens = PythonTokenizer.tokenize("f(1,\n  2)\n");
		List<Token> row1 = tokensOnRow(tokens, 1);
		Assertions.assertEquals(TokenKind.NL, row1.get(row1.size() - 1).getKind());
		Assertions.assertEquals(1, tokensOfKind(tokens, TokenKind.NEWLINE).size());
		Assertions.assertTrue(tokensOfKind(tokens, TokenKind.INDENT).isEmpty());
	}

	@Test
	void testBackslashContinuationJoinsLines() {
		List<Token> tokens = PythonTokenizer.tokenize("x = 1 + \\\n    2\n");
		Assertions.assertEquals(1, tokensOfKind(tokens, TokenKind.NEWLINE).size());
		Assertions.assertTrue(tokensOfKind(tokens, TokenKind.INDENT).isEmpty());
		Assertions.assertEquals(2, tokensOfKind(tokens, TokenKind.NUMBER).get(1).getStart().getRow());
	}

	// --- Indentation ---

	@Test
	void testIndentAndDedent() {
		List<Token> tokens = PythonTokenizer.tokenize("if x:\n    y\nz\n");

		List<Token> indents = tokensOfKind(tokens, TokenKind.INDENT);
		List<Token> dedents = tokensOfKind(tokens, TokenKind.DEDENT);
		Assertions.assertEquals(1, indents.size());
		Assertions.assertEquals("    ", indents.get(0).getText());
		Assertions.assertEquals(2, indents.get(0).getStart().getRow());
		Assertions.assertEquals(1, dedents.size());
		Assertions.assertEquals(3, dedents.get(0).getStart().getRow());
	}

	@Test
	void testDedentsAtEndOfFileSitOnEndMarkerRow() {
		List<Token> tokens = PythonTokenizer.tokenize("if x:\n    if y:\n        z\n");
		List<Token> dedents = tokensOfKind(tokens, TokenKind.DEDENT);
		Assertions.assertEquals(2, dedents.size());
		for (Token dedent : dedents) {
			Assertions.assertEquals(4, dedent.getStart().getRow());
		}
	}

	@Test
	void testCommentLineDoesNotChangeIndentation() {
		List<Token> tokens = PythonTokenizer.tokenize("if x:\n# c\n    y\n");
		Assertions.assertEquals(3, tokensOfKind(tokens, TokenKind.INDENT).get(0).getStart().getRow());
	}

	@Test
	void testInconsistentDedentFails() {
		LexException e = Assertions.assertThrows(LexException.class,
				() -> PythonTokenizer.tokenize("if x:\n        y\n    z\n"));
		Assertions.assertEquals(3, e.getLineNumber());
	}

	// --- Literals and operators ---

	@Test
	void testStringPrefixAndEscapesKeptVerbatim() {
		List<Token> strings = tokensOfKind(PythonTokenizer.tokenize("x = rb'\\d' + \"it's\"\n"), TokenKind.STRING);
		Assertions.assertEquals(2, strings.size());
		Assertions.assertEquals("rb'\\d'", strings.get(0).getText());
		Assertions.assertEquals("\"it's\"", strings.get(1).getText());
	}

	@Test
	void testTripleQuotedStringSpansRows() {
		String source = "s = \"\"\"a\nb\"\"\"\n";
		List<Token> strings = tokensOfKind(PythonTokenizer.tokenize(source), TokenKind.STRING);

		Assertions.assertEquals(1, strings.size());
		Token string = strings.get(0);
		Assertions.assertEquals("\"\"\"a\nb\"\"\"", string.getText());
		Assertions.assertEquals(new SourcePosition(1, 4), string.getStart());
		Assertions.assertEquals(new SourcePosition(2, 4), string.getEnd());
		Assertions.assertEquals("s = \"\"\"a\nb\"\"\"\n", string.getRawText());
	}

	@Test
	void testNumberForms() {
		List<Token> numbers = tokensOfKind(PythonTokenizer.tokenize("n = [0x1F, 1_000, 1.5e-3, 2j, .5]\n"),
				TokenKind.NUMBER);
		List<String> texts = new ArrayList<>();
		for (Token number : numbers) {
			texts.add(number.getText());
		}
		Assertions.assertEquals(List.of("0x1F", "1_000", "1.5e-3", "2j", ".5"), texts);
	}

	@Test
	void testOperatorsUseLongestMatch() {
		List<Token> ops = tokensOfKind(PythonTokenizer.tokenize("a **= b // c ... d\n"), TokenKind.OP);
		Assertions.assertEquals("**=", ops.get(0).getText());
		Assertions.assertEquals("//", ops.get(1).getText());
		Assertions.assertEquals("...", ops.get(2).getText());
	}

	// --- Errors ---

	@Test
	void testUnterminatedStringFails() {
		Assertions.assertThrows(LexException.class, () -> PythonTokenizer.tokenize("x = 'abc\n"));
	}

	@Test
	void testEofInMultiLineStringFails() {
		Assertions.assertThrows(LexException.class, () -> PythonTokenizer.tokenize("x = '''abc\n"));
	}

	@Test
	void testEofInMultiLineStatementFails() {
		Assertions.assertThrows(LexException.class, () -> PythonTokenizer.tokenize("f(1,\n"));
	}

	@Test
	void testUnmatchedCloserFails() {
		Assertions.assertThrows(LexException.class, () -> PythonTokenizer.tokenize("x)\n"));
	}

	@Test
	void testInvalidCharacterFails() {
		LexException e = Assertions.assertThrows(LexException.class,
				() -> PythonTokenizer.tokenize("x = 1\ny = $\n"));
		Assertions.assertEquals(2, e.getLineNumber());
	}

	// --- splitLines ---

	@Test
	void testSplitLinesKeepsTerminators() {
		Assertions.assertEquals(List.of("a\n", "b\r\n", "c"), PythonTokenizer.splitLines("a\nb\r\nc"));
		Assertions.assertTrue(PythonTokenizer.splitLines("").isEmpty());
	}
}
