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
package com.tomaszrup.pycoffee.sync;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.pycoffee.compiler.lexer.LexException;
import com.tomaszrup.pycoffee.compiler.lexer.PythonTokenizer;
import com.tomaszrup.pycoffee.compiler.lexer.SourcePosition;
import com.tomaszrup.pycoffee.compiler.lexer.Token;
import com.tomaszrup.pycoffee.compiler.lexer.TokenKind;

class TokenSyncTests {

	private static TokenSync sync(String source) {
		return new TokenSync(source, PythonTokenizer.tokenize(source));
	}

	// --- Construction ---

	@Test
	void testBucketCountIsLineCountPlusOne() {
		TokenSync sync = sync("x = 1\ny = 2\n");
		Assertions.assertEquals(2, sync.getLines().size());
		Assertions.assertEquals(3, sync.getBucketCount());
	}

	@Test
	void testLinesAreStrippedOfTrailingWhitespace() {
		TokenSync sync = sync("x = 1   \ny = 2\t\n");
		Assertions.assertEquals(List.of("x = 1", "y = 2"), sync.getLines());
	}

	@Test
	void testBlankLinesDetected() {
		TokenSync sync = sync("x = 1\n\n   \ny = 2\n");
		Assertions.assertEquals(Set.of(1, 2), sync.getBlankLines());
	}

	@Test
	void testTokenOutsideLinesFails() {
		List<Token> tokens = new ArrayList<>(PythonTokenizer.tokenize("x\n"));
		tokens.add(new Token(TokenKind.NAME, "y", "y\n", new SourcePosition(10, 0), new SourcePosition(10, 1)));
		LexException e = Assertions.assertThrows(LexException.class, () -> new TokenSync("x\n", tokens));
		Assertions.assertEquals(10, e.getLineNumber());
	}

	@Test
	void testCommentAfterCodeIsNotAnIgnoredLine() {
		TokenSync sync = sync("x = 1  # c\n# full\n");
		Assertions.assertFalse(sync.isIgnoredLine(0));
		Assertions.assertTrue(sync.isIgnoredLine(1));
	}

	@Test
	void testFirstLeadingLineStartsAtFirstIgnoredLine() {
		Assertions.assertEquals(1, sync("x = 1\n# c\n").getFirstLeadingLine());
		Assertions.assertEquals(2, sync("x = 1\n").getFirstLeadingLine());
	}

	// --- leading ---

	@Test
	void testLeadingReturnsIgnoredLinesOnce() {
		TokenSync sync = sync("# a\n\nx = 1\n# b\ny = 2\n");

		Assertions.assertEquals(List.of("# a\n", "\n"), sync.leading(3));
		Assertions.assertEquals(List.of(), sync.leading(3));
		Assertions.assertEquals(List.of("# b\n"), sync.leading(5));
	}

	@Test
	void testLeadingBelowWatermarkDoesNotMoveIt() {
		TokenSync sync = sync("# a\nx = 1\n# b\ny = 2\n");
		sync.leading(4);
		int watermark = sync.getFirstLeadingLine();

		Assertions.assertTrue(sync.leading(2).isEmpty());
		Assertions.assertEquals(watermark, sync.getFirstLeadingLine());
	}

	@Test
	void testLeadingWithoutLineReturnsNothing() {
		TokenSync sync = sync("# a\nx = 1\n");
		Assertions.assertTrue(sync.leading(0).isEmpty());
		Assertions.assertEquals(List.of("# a\n"), sync.leading(2));
	}

	@Test
	void testLeadingKeepsIndentationAndStripsTrailingSpace() {
		TokenSync sync = sync("if x:\n    # c   \n    y = 1\n");
		Assertions.assertEquals("    # c\n", sync.leadingString(3));
	}

	@Test
	void testLeadingConcatenationCoversEveryIgnoredLineExactlyOnce() {
		String source = "# 1\n"
				+ "a = 1\n"
				+ "\n"
				+ "# 4\n"
				+ "b = 2\n"
				+ "# 6\n"
				+ "# 7\n"
				+ "\n"
				+ "c = 3\n";
		TokenSync sync = sync(source);

		StringBuilder all = new StringBuilder();
		for (int line : new int[] {2, 5, 9}) {
			all.append(sync.leadingString(line));
		}

		Assertions.assertEquals("# 1\n\n# 4\n# 6\n# 7\n\n", all.toString());
		Assertions.assertEquals("", sync.leadingString(sync.getBucketCount()));
	}

	// --- trailingComment ---

	@Test
	void testTrailingComment() {
		TokenSync sync = sync("x = 1  # note   \ny = 2\n# own line\n");

		Assertions.assertEquals(" # note\n", sync.trailingComment(1));
		Assertions.assertEquals("\n", sync.trailingComment(2));
		Assertions.assertEquals("\n", sync.trailingComment(3));
		Assertions.assertEquals("\n", sync.trailingComment(0));
		Assertions.assertEquals("\n", sync.trailingComment(99));
	}

	// --- nextStringLiteral ---

	@Test
	void testNextStringLiteralPopsInSourceOrder() throws StringQueueUnderflowException {
		TokenSync sync = sync("x = 'a' + \"b\"\n");

		Assertions.assertEquals("'a'", sync.nextStringLiteral(1));
		Assertions.assertEquals("\"b\"", sync.nextStringLiteral(1));
		StringQueueUnderflowException e = Assertions.assertThrows(StringQueueUnderflowException.class,
				() -> sync.nextStringLiteral(1));
		Assertions.assertEquals(1, e.getLineNumber());
	}

	@Test
	void testMultiLineStringQueuedOnItsEndRow() throws StringQueueUnderflowException {
		TokenSync sync = sync("s = '''a\nb'''\n");

		Assertions.assertThrows(StringQueueUnderflowException.class, () -> sync.nextStringLiteral(1));
		Assertions.assertEquals("'''a\nb'''", sync.nextStringLiteral(2));
	}

	@Test
	void testNextStringLiteralOutsideLinesUnderflows() {
		TokenSync sync = sync("x = 1\n");
		Assertions.assertThrows(StringQueueUnderflowException.class, () -> sync.nextStringLiteral(0));
		Assertions.assertThrows(StringQueueUnderflowException.class, () -> sync.nextStringLiteral(7));
	}

	@Test
	void testRemainingStringLiteralsCountsDown() throws StringQueueUnderflowException {
		TokenSync sync = sync("x = 'a' + 'b'\n");
		Assertions.assertEquals(2, sync.remainingStringLiterals(1));
		sync.nextStringLiteral(1);
		Assertions.assertEquals(1, sync.remainingStringLiterals(1));
		Assertions.assertEquals(0, sync.remainingStringLiterals(0));
		Assertions.assertEquals(0, sync.remainingStringLiterals(9));
	}
}
