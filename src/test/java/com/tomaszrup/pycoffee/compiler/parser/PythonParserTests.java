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
package com.tomaszrup.pycoffee.compiler.parser;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.pycoffee.compiler.ast.ArgumentsNode;
import com.tomaszrup.pycoffee.compiler.ast.ClassDefNode;
import com.tomaszrup.pycoffee.compiler.ast.FunctionDefNode;
import com.tomaszrup.pycoffee.compiler.ast.ModuleNode;
import com.tomaszrup.pycoffee.compiler.ast.NodeKind;
import com.tomaszrup.pycoffee.compiler.ast.OperatorKind;
import com.tomaszrup.pycoffee.compiler.ast.PyNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.BinOpNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.CallNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.CompareNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.ComprehensionExprNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.DictNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.ExtSliceNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.KeywordNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.SliceNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.StrNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.SubscriptNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.AssignNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.AugAssignNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.ExprStmtNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.IfNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.ImportFromNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.ImportNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.RaiseNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.ReturnNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.TryNode;
import com.tomaszrup.pycoffee.compiler.lexer.PythonTokenizer;

class PythonParserTests {

	private static ModuleNode parse(String source) {
		return PythonParser.parse(PythonTokenizer.tokenize(source));
	}

	private static PyNode onlyStatement(String source) {
		List<PyNode> body = parse(source).getBody();
		Assertions.assertEquals(1, body.size());
		return body.get(0);
	}

	private static PyNode expression(String source) {
		return ((ExprStmtNode) onlyStatement(source)).getValue();
	}

	// --- Definitions ---

	@Test
	void testFunctionDefWithDefaults() {
		FunctionDefNode def = (FunctionDefNode) onlyStatement("def f(a, b=1):\n    return a+b\n");

		Assertions.assertEquals("f", def.getName());
		Assertions.assertEquals(1, def.getLineNumber());
		Assertions.assertEquals(2, def.getArgs().getArgs().size());
		Assertions.assertEquals(1, def.getArgs().getDefaults().size());
		ReturnNode ret = (ReturnNode) def.getBody().get(0);
		Assertions.assertEquals(2, ret.getLineNumber());
		Assertions.assertEquals(OperatorKind.ADD, ((BinOpNode) ret.getValue()).getOp());
	}

	@Test
	void testClassWithBasesAndMethod() {
		ClassDefNode cls = (ClassDefNode) onlyStatement(
				"class C(Base, Mixin):\n    def m(self, x):\n        return self.x\n");

		Assertions.assertEquals("C", cls.getName());
		Assertions.assertEquals(2, cls.getArguments().size());
		Assertions.assertEquals(NodeKind.FUNCTION_DEF, cls.getBody().get(0).getKind());
	}

	@Test
	void testClassKeywordsKeptInHeader() {
		ClassDefNode cls = (ClassDefNode) onlyStatement("class C(B, metaclass='m'):\n    pass\n");
		Assertions.assertEquals(2, cls.getArguments().size());
		Assertions.assertEquals(NodeKind.NAME, cls.getArguments().get(0).getKind());
		Assertions.assertEquals(NodeKind.KEYWORD, cls.getArguments().get(1).getKind());
	}

	@Test
	void testDecoratorsAndKeywordOnlyParameters() {
		FunctionDefNode def = (FunctionDefNode) onlyStatement(
				"@dec\n@other(1)\ndef f(a, *args, k=1, j, **kw) -> int:\n    pass\n");

		Assertions.assertEquals(3, def.getLineNumber());
		Assertions.assertEquals(2, def.getDecorators().size());
		Assertions.assertEquals(1, def.getDecorators().get(0).getLineNumber());
		ArgumentsNode args = def.getArgs();
		Assertions.assertEquals(NodeKind.NAME, def.getReturns().getKind());
		Assertions.assertEquals("args", args.getVararg().getName());
		Assertions.assertEquals(2, args.getKwonlyArgs().size());
		Assertions.assertNotNull(args.getKwDefaults().get(0));
		Assertions.assertNull(args.getKwDefaults().get(1));
		Assertions.assertEquals("kw", args.getKwarg().getName());
	}

	@Test
	void testAsyncDefParsesToAsyncKind() {
		Assertions.assertEquals(NodeKind.ASYNC_FUNCTION_DEF, onlyStatement("async def f():\n    pass\n").getKind());
	}

	// --- Statements ---

	@Test
	void testChainedAssignmentKeepsAllTargets() {
		AssignNode assign = (AssignNode) onlyStatement("a = b = 1\n");
		Assertions.assertEquals(2, assign.getTargets().size());
		Assertions.assertEquals(NodeKind.NUM, assign.getValue().getKind());
	}

	@Test
	void testTupleUnpackingAssignment() {
		AssignNode assign = (AssignNode) onlyStatement("a, b = b, a\n");
		Assertions.assertEquals(NodeKind.TUPLE, assign.getTargets().get(0).getKind());
		Assertions.assertEquals(NodeKind.TUPLE, assign.getValue().getKind());
	}

	@Test
	void testAugmentedAndAnnotatedAssignment() {
		AugAssignNode aug = (AugAssignNode) onlyStatement("x //= 2\n");
		Assertions.assertEquals(OperatorKind.FLOOR_DIV, aug.getOp());
		Assertions.assertEquals(NodeKind.ANN_ASSIGN, onlyStatement("x: int = 5\n").getKind());
	}

	@Test
	void testElifNestsIfWithoutClauseLine() {
		IfNode outer = (IfNode) onlyStatement(
				"if a:\n    pass\nelif b:\n    pass\nelse:\n    pass\n");

		Assertions.assertEquals(0, outer.getOrelseLine());
		IfNode inner = (IfNode) outer.getOrelse().get(0);
		Assertions.assertEquals(3, inner.getLineNumber());
		Assertions.assertEquals(5, inner.getOrelseLine());
	}

	@Test
	void testTryRecordsClauseLines() {
		TryNode tryNode = (TryNode) onlyStatement(
				"try:\n    f()\nexcept E as e:\n    pass\nelse:\n    g()\nfinally:\n    h()\n");

		Assertions.assertEquals(1, tryNode.getHandlers().size());
		Assertions.assertEquals("e", tryNode.getHandlers().get(0).getName());
		Assertions.assertEquals(3, tryNode.getHandlers().get(0).getLineNumber());
		Assertions.assertEquals(5, tryNode.getOrelseLine());
		Assertions.assertEquals(7, tryNode.getFinallyLine());
	}

	@Test
	void testImportForms() {
		List<PyNode> body = parse("import os.path as p, sys\nfrom ..pkg import (a, b as c,)\nfrom . import x\n").getBody();

		ImportNode imp = (ImportNode) body.get(0);
		Assertions.assertEquals("os.path", imp.getNames().get(0).getName());
		Assertions.assertEquals("p", imp.getNames().get(0).getAsname());
		Assertions.assertEquals("sys", imp.getNames().get(1).getName());
		ImportFromNode from = (ImportFromNode) body.get(1);
		Assertions.assertEquals(2, from.getLevel());
		Assertions.assertEquals("pkg", from.getModule());
		Assertions.assertEquals(2, from.getNames().size());
		Assertions.assertEquals("c", from.getNames().get(1).getAsname());
		ImportFromNode relative = (ImportFromNode) body.get(2);
		Assertions.assertEquals(1, relative.getLevel());
		Assertions.assertNull(relative.getModule());
	}

	@Test
	void testRaiseFromKeepsCause() {
		RaiseNode raise = (RaiseNode) onlyStatement("raise E('x') from err\n");
		Assertions.assertEquals(NodeKind.CALL, raise.getExc().getKind());
		Assertions.assertEquals(NodeKind.NAME, raise.getCause().getKind());
	}

	@Test
	void testSemicolonSeparatedStatements() {
		List<PyNode> body = parse("a = 1; b = 2;\n").getBody();
		Assertions.assertEquals(2, body.size());
	}

	@Test
	void testCommentsAndBlankLinesDoNotProduceStatements() {
		List<PyNode> body = parse("# c\n\nx = 1  # t\n").getBody();
		Assertions.assertEquals(1, body.size());
		Assertions.assertEquals(3, body.get(0).getLineNumber());
	}

	@Test
	void testNonlocalParses() {
		Assertions.assertEquals(NodeKind.NONLOCAL, onlyStatement("nonlocal x, y\n").getKind());
	}

	// --- Expressions ---

	@Test
	void testChainedComparison() {
		CompareNode compare = (CompareNode) expression("a < b <= c not in d is not e\n");
		Assertions.assertEquals(List.of(OperatorKind.LT, OperatorKind.LT_E, OperatorKind.NOT_IN, OperatorKind.IS_NOT),
				compare.getOps());
		Assertions.assertEquals(4, compare.getComparators().size());
	}

	@Test
	void testOperatorPrecedence() {
		BinOpNode add = (BinOpNode) expression("a + b * c ** d\n");
		Assertions.assertEquals(OperatorKind.ADD, add.getOp());
		BinOpNode mult = (BinOpNode) add.getRight();
		Assertions.assertEquals(OperatorKind.MULT, mult.getOp());
		Assertions.assertEquals(OperatorKind.POW, ((BinOpNode) mult.getRight()).getOp());
	}

	@Test
	void testStringRecordsEndRowOfEachToken() {
		StrNode multi = (StrNode) expression("\"\"\"a\nb\"\"\"\n");
		Assertions.assertEquals(2, multi.getLineNumber());
		Assertions.assertEquals(List.of(2), multi.getTokenLines());
		Assertions.assertEquals("a\nb", multi.getValue());

		StrNode adjacent = (StrNode) expression("'a' \"b\"\n");
		Assertions.assertEquals(List.of(1, 1), adjacent.getTokenLines());
		Assertions.assertEquals("ab", adjacent.getValue());
		Assertions.assertEquals(NodeKind.STR, adjacent.getKind());
	}

	@Test
	void testBytesLiteral() {
		Assertions.assertEquals(NodeKind.BYTES, expression("b'\\x00'\n").getKind());
	}

	@Test
	void testCallArgumentsKeepSourceOrder() {
		CallNode call = (CallNode) expression("f(*s, a, k=v, **kw, *t)\n");
		List<PyNode> args = call.getArgs();
		Assertions.assertEquals(5, args.size());
		Assertions.assertEquals(NodeKind.STARRED, args.get(0).getKind());
		Assertions.assertEquals(NodeKind.NAME, args.get(1).getKind());
		Assertions.assertEquals("k", ((KeywordNode) args.get(2)).getArg());
		Assertions.assertNull(((KeywordNode) args.get(3)).getArg());
		Assertions.assertEquals(NodeKind.STARRED, args.get(4).getKind());
	}

	@Test
	void testRepeatedStarArguments() {
		Assertions.assertEquals(2, ((CallNode) expression("f(*a, *b)\n")).getArgs().size());
		Assertions.assertEquals(2, ((CallNode) expression("f(**a, **b)\n")).getArgs().size());
	}

	@Test
	void testGeneratorAsSoleCallArgument() {
		CallNode call = (CallNode) expression("sum(x for x in xs)\n");
		Assertions.assertEquals(NodeKind.GENERATOR_EXP, call.getArgs().get(0).getKind());
	}

	@Test
	void testSlices() {
		SubscriptNode simple = (SubscriptNode) expression("x[::2]\n");
		SliceNode slice = (SliceNode) simple.getSlice();
		Assertions.assertNull(slice.getLower());
		Assertions.assertNull(slice.getUpper());
		Assertions.assertNotNull(slice.getStep());

		SubscriptNode extended = (SubscriptNode) expression("x[1:2, 3]\n");
		ExtSliceNode ext = (ExtSliceNode) extended.getSlice();
		Assertions.assertEquals(NodeKind.SLICE, ext.getDims().get(0).getKind());
		Assertions.assertEquals(NodeKind.INDEX, ext.getDims().get(1).getKind());

		Assertions.assertEquals(NodeKind.INDEX, ((SubscriptNode) expression("x[i]\n")).getSlice().getKind());
	}

	@Test
	void testDisplays() {
		Assertions.assertEquals(NodeKind.TUPLE, expression("()\n").getKind());
		Assertions.assertEquals(NodeKind.TUPLE, expression("(1,)\n").getKind());
		Assertions.assertEquals(NodeKind.NUM, expression("(1)\n").getKind());
		Assertions.assertEquals(NodeKind.LIST, expression("[1, 2]\n").getKind());
		Assertions.assertEquals(NodeKind.SET, expression("{1, 2}\n").getKind());
		Assertions.assertEquals(NodeKind.DICT_COMP, expression("{k: v for k, v in items}\n").getKind());
		Assertions.assertEquals(NodeKind.SET_COMP, expression("{k for k in items}\n").getKind());
	}

	@Test
	void testDictWithUnpacking() {
		DictNode dict = (DictNode) expression("{'a': 1, **rest}\n");
		Assertions.assertEquals(2, dict.getKeys().size());
		Assertions.assertNull(dict.getKeys().get(1));
		Assertions.assertEquals(NodeKind.NAME, dict.getValues().get(1).getKind());
	}

	@Test
	void testListComprehensionClauses() {
		ComprehensionExprNode comp = (ComprehensionExprNode) expression("[x for x in y if x if z for w in x]\n");
		Assertions.assertEquals(NodeKind.LIST_COMP, comp.getKind());
		Assertions.assertEquals(2, comp.getGenerators().size());
		Assertions.assertEquals(2, comp.getGenerators().get(0).getIfs().size());
	}

	@Test
	void testLambdaAndConditionalExpression() {
		Assertions.assertEquals(NodeKind.LAMBDA, expression("lambda a, b=1: a\n").getKind());
		Assertions.assertEquals(NodeKind.LAMBDA, expression("lambda: 0\n").getKind());
		Assertions.assertEquals(NodeKind.IF_EXP, expression("a if b else c\n").getKind());
	}

	@Test
	void testExpressionKindsWithoutRendering() {
		Assertions.assertEquals(NodeKind.NAMED_EXPR, expression("(n := 10)\n").getKind());
		Assertions.assertEquals(NodeKind.NAME_CONSTANT, expression("None\n").getKind());
		Assertions.assertEquals(NodeKind.ELLIPSIS, expression("...\n").getKind());
	}

	// --- Errors ---

	@Test
	void testSyntaxErrorReportsLine() {
		PythonSyntaxException e = Assertions.assertThrows(PythonSyntaxException.class,
				() -> parse("x = 1\ny = = 2\n"));
		Assertions.assertEquals(2, e.getLineNumber());
	}

	@Test
	void testNonDefaultParameterAfterDefaultFails() {
		Assertions.assertThrows(PythonSyntaxException.class, () -> parse("def f(a=1, b):\n    pass\n"));
	}

	@Test
	void testTryWithoutHandlerFails() {
		Assertions.assertThrows(PythonSyntaxException.class, () -> parse("try:\n    pass\nx = 1\n"));
	}

	@Test
	void testUnexpectedIndentFails() {
		Assertions.assertThrows(PythonSyntaxException.class, () -> parse("x = 1\n    y = 2\n"));
	}
}
