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
package com.tomaszrup.pycoffee.compiler.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.pycoffee.compiler.ast.ArgNode;
import com.tomaszrup.pycoffee.compiler.ast.ArgumentsNode;
import com.tomaszrup.pycoffee.compiler.ast.ClassDefNode;
import com.tomaszrup.pycoffee.compiler.ast.FunctionDefNode;
import com.tomaszrup.pycoffee.compiler.ast.ModuleNode;
import com.tomaszrup.pycoffee.compiler.ast.NodeKind;
import com.tomaszrup.pycoffee.compiler.ast.OperatorKind;
import com.tomaszrup.pycoffee.compiler.ast.PyNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.AttributeNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.BinOpNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.BoolOpNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.CallNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.CompareNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.ComprehensionExprNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.ComprehensionNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.DictCompNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.DictNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.EllipsisNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.ExtSliceNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.IfExpNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.IndexNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.KeywordNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.LambdaNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.NameConstantNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.NameNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.NamedExprNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.NumNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.SequenceNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.SliceNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.StrNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.SubscriptNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.UnaryOpNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.WrappedExprNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.YieldNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.AliasNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.AnnAssignNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.AssertNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.AssignNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.AugAssignNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.DeleteNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.ExceptHandlerNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.ExprStmtNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.ForNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.IfNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.ImportFromNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.ImportNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.KeywordStatementNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.NameListStatementNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.RaiseNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.ReturnNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.TryNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.WhileNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.WithItemNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.WithNode;
import com.tomaszrup.pycoffee.compiler.lexer.Token;
import com.tomaszrup.pycoffee.compiler.lexer.TokenKind;

/**
 * Recursive-descent parser for Python 3 statements and expressions.
 *
 * <p>Comments and {@code NL} tokens carry no syntax and are skipped; the
 * renderer recovers them later from the full token stream. Every node gets
 * the row its first token starts on, except string literals, which record
 * the row each literal token <em>ends</em> on.
 */
public class PythonParser {

	private static final Logger logger = LoggerFactory.getLogger(PythonParser.class);

	private static final Set<String> KEYWORDS = Set.of(
			"False", "None", "True", "and", "as", "assert", "async", "await", "break",
			"class", "continue", "def", "del", "elif", "else", "except", "finally", "for",
			"from", "global", "if", "import", "in", "is", "lambda", "nonlocal", "not", "or",
			"pass", "raise", "return", "try", "while", "with", "yield");

	private static final Set<String> NAME_CONSTANTS = Set.of("True", "False", "None");

	private static final Map<String, OperatorKind> AUGMENTED_ASSIGNMENTS = Map.ofEntries(
			Map.entry("+=", OperatorKind.ADD),
			Map.entry("-=", OperatorKind.SUB),
			Map.entry("*=", OperatorKind.MULT),
			Map.entry("@=", OperatorKind.MAT_MULT),
			Map.entry("/=", OperatorKind.DIV),
			Map.entry("%=", OperatorKind.MOD),
			Map.entry("&=", OperatorKind.BIT_AND),
			Map.entry("|=", OperatorKind.BIT_OR),
			Map.entry("^=", OperatorKind.BIT_XOR),
			Map.entry("<<=", OperatorKind.LSHIFT),
			Map.entry(">>=", OperatorKind.RSHIFT),
			Map.entry("**=", OperatorKind.POW),
			Map.entry("//=", OperatorKind.FLOOR_DIV));

	private static final Map<String, OperatorKind> COMPARISONS = Map.of(
			"<", OperatorKind.LT,
			">", OperatorKind.GT,
			"==", OperatorKind.EQ,
			">=", OperatorKind.GT_E,
			"<=", OperatorKind.LT_E,
			"!=", OperatorKind.NOT_EQ);

	private static final Map<String, OperatorKind> TERM_OPERATORS = Map.of(
			"*", OperatorKind.MULT,
			"/", OperatorKind.DIV,
			"%", OperatorKind.MOD,
			"//", OperatorKind.FLOOR_DIV,
			"@", OperatorKind.MAT_MULT);

	private static final Map<String, OperatorKind> FACTOR_OPERATORS = Map.of(
			"+", OperatorKind.U_ADD,
			"-", OperatorKind.U_SUB,
			"~", OperatorKind.INVERT);

	private final List<Token> tokens;
	private int pos;

	/**
	 * Parse a complete token stream, as produced by
	 * {@link com.tomaszrup.pycoffee.compiler.lexer.PythonTokenizer}.
	 *
	 * @throws PythonSyntaxException if the tokens do not form a module
	 */
	public static ModuleNode parse(List<Token> tokenStream) {
		List<Token> significant = new ArrayList<>();
		for (Token token : tokenStream) {
			if (token.getKind() != TokenKind.COMMENT && token.getKind() != TokenKind.NL) {
				significant.add(token);
			}
		}
		if (significant.isEmpty() || significant.get(significant.size() - 1).getKind() != TokenKind.ENDMARKER) {
			throw new PythonSyntaxException("token stream does not end with ENDMARKER", 0);
		}
		ModuleNode module = new PythonParser(significant).parseModule();
		logger.debug("Parsed module with {} top-level statements", module.getBody().size());
		return module;
	}

	private PythonParser(List<Token> tokens) {
		this.tokens = tokens;
	}

	// ------------------------------------------------------------------
	// Token helpers
	// ------------------------------------------------------------------

	private Token peek() {
		return tokens.get(pos);
	}

	private Token peekAhead(int offset) {
		int index = Math.min(pos + offset, tokens.size() - 1);
		return tokens.get(index);
	}

	private Token advance() {
		Token token = tokens.get(pos);
		if (token.getKind() != TokenKind.ENDMARKER) {
			pos++;
		}
		return token;
	}

	private boolean atOp(String op) {
		return peek().isOp(op);
	}

	private boolean atKeyword(String keyword) {
		return peek().isName(keyword);
	}

	private boolean at(TokenKind kind) {
		return peek().getKind() == kind;
	}

	private Token expectOp(String op) {
		if (!atOp(op)) {
			throw error("expected '" + op + "'");
		}
		return advance();
	}

	private Token expectKeyword(String keyword) {
		if (!atKeyword(keyword)) {
			throw error("expected '" + keyword + "'");
		}
		return advance();
	}

	private Token expect(TokenKind kind) {
		if (!at(kind)) {
			throw error("expected " + kind);
		}
		return advance();
	}

	private String expectName() {
		Token token = peek();
		if (token.getKind() != TokenKind.NAME || KEYWORDS.contains(token.getText())) {
			throw error("expected a name");
		}
		return advance().getText();
	}

	private int line() {
		return peek().getStart().getRow();
	}

	private PythonSyntaxException error(String message) {
		Token token = peek();
		String found = token.getKind() == TokenKind.NEWLINE || token.getKind() == TokenKind.ENDMARKER
				? token.getKind().name()
				: "'" + token.getText() + "'";
		return new PythonSyntaxException("invalid syntax: " + message + ", found " + found,
				token.getStart().getRow());
	}

	// ------------------------------------------------------------------
	// Statements
	// ------------------------------------------------------------------

	private ModuleNode parseModule() {
		List<PyNode> body = new ArrayList<>();
		while (!at(TokenKind.ENDMARKER)) {
			if (at(TokenKind.NEWLINE)) {
				advance();
			} else if (at(TokenKind.INDENT)) {
				throw error("unexpected indent");
			} else {
				body.addAll(parseStatement());
			}
		}
		return new ModuleNode(body);
	}

	private List<PyNode> parseStatement() {
		Token token = peek();
		if (token.isOp("@")) {
			return List.of(parseDecorated());
		}
		if (token.getKind() == TokenKind.NAME) {
			switch (token.getText()) {
				case "if":
					return List.of(parseIf());
				case "while":
					return List.of(parseWhile());
				case "for":
					return List.of(parseFor());
				case "try":
					return List.of(parseTry());
				case "with":
					return List.of(parseWith());
				case "def":
					return List.of(parseFunctionDef(Collections.emptyList()));
				case "class":
					return List.of(parseClassDef(Collections.emptyList()));
				case "async":
					if (peekAhead(1).isName("def")) {
						return List.of(parseFunctionDef(Collections.emptyList()));
					}
					throw error("async statements other than 'async def' are not supported");
				default:
					break;
			}
		}
		return parseSimpleStatement();
	}

	private List<PyNode> parseSuite() {
		if (!at(TokenKind.NEWLINE)) {
			return parseSimpleStatement();
		}
		advance();
		expect(TokenKind.INDENT);
		List<PyNode> body = new ArrayList<>();
		while (!at(TokenKind.DEDENT) && !at(TokenKind.ENDMARKER)) {
			if (at(TokenKind.NEWLINE)) {
				advance();
			} else {
				body.addAll(parseStatement());
			}
		}
		expect(TokenKind.DEDENT);
		return body;
	}

	private List<PyNode> parseSimpleStatement() {
		List<PyNode> statements = new ArrayList<>();
		statements.add(parseSmallStatement());
		while (atOp(";")) {
			advance();
			if (at(TokenKind.NEWLINE)) {
				break;
			}
			statements.add(parseSmallStatement());
		}
		expect(TokenKind.NEWLINE);
		return statements;
	}

	private PyNode parseSmallStatement() {
		int line = line();
		Token token = peek();
		if (token.getKind() == TokenKind.NAME) {
			switch (token.getText()) {
				case "pass":
					advance();
					return new KeywordStatementNode(NodeKind.PASS, line);
				case "break":
					advance();
					return new KeywordStatementNode(NodeKind.BREAK, line);
				case "continue":
					advance();
					return new KeywordStatementNode(NodeKind.CONTINUE, line);
				case "del":
					advance();
					return new DeleteNode(line, parseExprList());
				case "return":
					advance();
					return new ReturnNode(line, startsExpression() ? parseTestListStarExpr() : null);
				case "raise":
					return parseRaise();
				case "global":
				case "nonlocal":
					return parseNameList(token.getText().equals("global") ? NodeKind.GLOBAL : NodeKind.NONLOCAL);
				case "import":
					return parseImport();
				case "from":
					return parseImportFrom();
				case "assert":
					advance();
					PyNode test = parseTest();
					PyNode msg = null;
					if (atOp(",")) {
						advance();
						msg = parseTest();
					}
					return new AssertNode(line, test, msg);
				default:
					break;
			}
		}
		return parseExprStatement();
	}

	private PyNode parseExprStatement() {
		int line = line();
		PyNode first = atKeyword("yield") ? parseYield() : parseTestListStarExpr();
		if (at(TokenKind.OP) && AUGMENTED_ASSIGNMENTS.containsKey(peek().getText())) {
			OperatorKind op = AUGMENTED_ASSIGNMENTS.get(advance().getText());
			PyNode value = atKeyword("yield") ? parseYield() : parseTestList();
			return new AugAssignNode(line, first, op, value);
		}
		if (atOp(":")) {
			advance();
			PyNode annotation = parseTest();
			PyNode value = null;
			if (atOp("=")) {
				advance();
				value = atKeyword("yield") ? parseYield() : parseTestListStarExpr();
			}
			return new AnnAssignNode(line, first, annotation, value);
		}
		if (atOp("=")) {
			List<PyNode> targets = new ArrayList<>();
			targets.add(first);
			while (atOp("=")) {
				advance();
				targets.add(atKeyword("yield") ? parseYield() : parseTestListStarExpr());
			}
			PyNode value = targets.remove(targets.size() - 1);
			return new AssignNode(line, targets, value);
		}
		return new ExprStmtNode(line, first);
	}

	private PyNode parseRaise() {
		int line = line();
		expectKeyword("raise");
		PyNode exc = null;
		PyNode cause = null;
		if (startsExpression()) {
			exc = parseTest();
			if (atKeyword("from")) {
				advance();
				cause = parseTest();
			}
		}
		return new RaiseNode(line, exc, cause);
	}

	private PyNode parseNameList(NodeKind kind) {
		int line = line();
		advance();
		List<String> names = new ArrayList<>();
		names.add(expectName());
		while (atOp(",")) {
			advance();
			names.add(expectName());
		}
		return new NameListStatementNode(kind, line, names);
	}

	private PyNode parseImport() {
		int line = line();
		expectKeyword("import");
		List<AliasNode> names = new ArrayList<>();
		do {
			if (!names.isEmpty()) {
				advance();
			}
			int aliasLine = line();
			String name = parseDottedName();
			String asname = null;
			if (atKeyword("as")) {
				advance();
				asname = expectName();
			}
			names.add(new AliasNode(aliasLine, name, asname));
		} while (atOp(","));
		return new ImportNode(line, names);
	}

	private PyNode parseImportFrom() {
		int line = line();
		expectKeyword("from");
		int level = 0;
		while (atOp(".") || atOp("...")) {
			level += advance().getText().length();
		}
		String module = null;
		if (!atKeyword("import")) {
			module = parseDottedName();
		} else if (level == 0) {
			throw error("expected a module name");
		}
		expectKeyword("import");
		List<AliasNode> names = new ArrayList<>();
		if (atOp("*")) {
			names.add(new AliasNode(line(), advance().getText(), null));
			return new ImportFromNode(line, module, level, names);
		}
		boolean parenthesized = atOp("(");
		if (parenthesized) {
			advance();
		}
		while (true) {
			int aliasLine = line();
			String name = expectName();
			String asname = null;
			if (atKeyword("as")) {
				advance();
				asname = expectName();
			}
			names.add(new AliasNode(aliasLine, name, asname));
			if (!atOp(",")) {
				break;
			}
			advance();
			if (parenthesized && atOp(")")) {
				break;
			}
		}
		if (parenthesized) {
			expectOp(")");
		}
		return new ImportFromNode(line, module, level, names);
	}

	private String parseDottedName() {
		StringBuilder name = new StringBuilder(expectName());
		while (atOp(".")) {
			advance();
			name.append('.').append(expectName());
		}
		return name.toString();
	}

	private PyNode parseIf() {
		int line = line();
		advance();
		PyNode test = parseNamedExprTest();
		expectOp(":");
		List<PyNode> body = parseSuite();
		List<PyNode> orelse = Collections.emptyList();
		int orelseLine = 0;
		if (atKeyword("elif")) {
			orelse = List.of(parseIf());
		} else if (atKeyword("else")) {
			orelseLine = line();
			advance();
			expectOp(":");
			orelse = parseSuite();
		}
		return new IfNode(line, test, body, orelse, orelseLine);
	}

	private PyNode parseWhile() {
		int line = line();
		expectKeyword("while");
		PyNode test = parseNamedExprTest();
		expectOp(":");
		List<PyNode> body = parseSuite();
		int orelseLine = 0;
		List<PyNode> orelse = Collections.emptyList();
		if (atKeyword("else")) {
			orelseLine = line();
			advance();
			expectOp(":");
			orelse = parseSuite();
		}
		return new WhileNode(line, test, body, orelse, orelseLine);
	}

	private PyNode parseFor() {
		int line = line();
		expectKeyword("for");
		PyNode target = parseExprListAsTarget();
		expectKeyword("in");
		PyNode iter = parseTestList();
		expectOp(":");
		List<PyNode> body = parseSuite();
		int orelseLine = 0;
		List<PyNode> orelse = Collections.emptyList();
		if (atKeyword("else")) {
			orelseLine = line();
			advance();
			expectOp(":");
			orelse = parseSuite();
		}
		return new ForNode(line, target, iter, body, orelse, orelseLine);
	}

	private PyNode parseTry() {
		int line = line();
		expectKeyword("try");
		expectOp(":");
		List<PyNode> body = parseSuite();
		List<ExceptHandlerNode> handlers = new ArrayList<>();
		while (atKeyword("except")) {
			int handlerLine = line();
			advance();
			PyNode type = null;
			String name = null;
			if (!atOp(":")) {
				type = parseTest();
				if (atKeyword("as")) {
					advance();
					name = expectName();
				}
			}
			expectOp(":");
			handlers.add(new ExceptHandlerNode(handlerLine, type, name, parseSuite()));
		}
		int orelseLine = 0;
		List<PyNode> orelse = Collections.emptyList();
		if (atKeyword("else")) {
			if (handlers.isEmpty()) {
				throw error("'else' without 'except'");
			}
			orelseLine = line();
			advance();
			expectOp(":");
			orelse = parseSuite();
		}
		int finallyLine = 0;
		List<PyNode> finalbody = Collections.emptyList();
		if (atKeyword("finally")) {
			finallyLine = line();
			advance();
			expectOp(":");
			finalbody = parseSuite();
		}
		if (handlers.isEmpty() && finalbody.isEmpty()) {
			throw error("expected 'except' or 'finally' block");
		}
		return new TryNode(line, body, handlers, orelse, orelseLine, finalbody, finallyLine);
	}

	private PyNode parseWith() {
		int line = line();
		expectKeyword("with");
		List<WithItemNode> items = new ArrayList<>();
		do {
			if (!items.isEmpty()) {
				advance();
			}
			int itemLine = line();
			PyNode context = parseTest();
			PyNode vars = null;
			if (atKeyword("as")) {
				advance();
				vars = parseExpr();
			}
			items.add(new WithItemNode(itemLine, context, vars));
		} while (atOp(","));
		expectOp(":");
		return new WithNode(line, items, parseSuite());
	}

	private PyNode parseDecorated() {
		List<PyNode> decorators = new ArrayList<>();
		while (atOp("@")) {
			advance();
			decorators.add(parseNamedExprTest());
			expect(TokenKind.NEWLINE);
		}
		if (atKeyword("class")) {
			return parseClassDef(decorators);
		}
		if (atKeyword("def") || (atKeyword("async") && peekAhead(1).isName("def"))) {
			return parseFunctionDef(decorators);
		}
		throw error("expected 'def' or 'class' after decorator");
	}

	private PyNode parseFunctionDef(List<PyNode> decorators) {
		int line = line();
		NodeKind kind = NodeKind.FUNCTION_DEF;
		if (atKeyword("async")) {
			advance();
			kind = NodeKind.ASYNC_FUNCTION_DEF;
		}
		expectKeyword("def");
		String name = expectName();
		expectOp("(");
		ArgumentsNode args = parseParameters(")", true);
		expectOp(")");
		PyNode returns = null;
		if (atOp("->")) {
			advance();
			returns = parseTest();
		}
		expectOp(":");
		return new FunctionDefNode(kind, line, name, args, returns, parseSuite(), decorators);
	}

	private PyNode parseClassDef(List<PyNode> decorators) {
		int line = line();
		expectKeyword("class");
		String name = expectName();
		List<PyNode> arguments = new ArrayList<>();
		if (atOp("(")) {
			advance();
			CallNode call = parseArguments(new NameNode(line, name));
			arguments.addAll(call.getArgs());
			expectOp(")");
		}
		expectOp(":");
		return new ClassDefNode(line, name, arguments, parseSuite(), decorators);
	}

	/**
	 * Parse a parameter list up to (not including) {@code terminator}.
	 * Annotations are accepted only for {@code def} parameters.
	 */
	private ArgumentsNode parseParameters(String terminator, boolean annotations) {
		List<ArgNode> args = new ArrayList<>();
		List<PyNode> defaults = new ArrayList<>();
		List<ArgNode> kwonlyArgs = new ArrayList<>();
		List<PyNode> kwDefaults = new ArrayList<>();
		ArgNode vararg = null;
		ArgNode kwarg = null;
		boolean afterStar = false;
		while (!atOp(terminator)) {
			if (atOp("*")) {
				advance();
				afterStar = true;
				if (!atOp(",") && !atOp(terminator)) {
					vararg = parseParameter(annotations);
				}
			} else if (atOp("**")) {
				advance();
				kwarg = parseParameter(annotations);
			} else if (atOp("/")) {
				advance();
			} else {
				ArgNode arg = parseParameter(annotations);
				PyNode defaultValue = null;
				if (atOp("=")) {
					advance();
					defaultValue = parseTest();
				}
				if (afterStar) {
					kwonlyArgs.add(arg);
					kwDefaults.add(defaultValue);
				} else {
					if (defaultValue == null && !defaults.isEmpty()) {
						throw new PythonSyntaxException("non-default argument follows default argument",
								arg.getLineNumber());
					}
					args.add(arg);
					if (defaultValue != null) {
						defaults.add(defaultValue);
					}
				}
			}
			if (!atOp(",")) {
				break;
			}
			advance();
		}
		return new ArgumentsNode(0, args, defaults, vararg, kwonlyArgs, kwDefaults, kwarg);
	}

	private ArgNode parseParameter(boolean annotations) {
		int line = line();
		String name = expectName();
		PyNode annotation = null;
		if (annotations && atOp(":")) {
			advance();
			annotation = parseTest();
		}
		return new ArgNode(line, name, annotation);
	}

	// ------------------------------------------------------------------
	// Expressions
	// ------------------------------------------------------------------

	private boolean startsExpression() {
		Token token = peek();
		switch (token.getKind()) {
			case NUMBER:
			case STRING:
				return true;
			case NAME:
				return !KEYWORDS.contains(token.getText()) || NAME_CONSTANTS.contains(token.getText())
						|| token.getText().equals("not") || token.getText().equals("lambda")
						|| token.getText().equals("await") || token.getText().equals("yield");
			case OP:
				switch (token.getText()) {
					case "(":
					case "[":
					case "{":
					case "-":
					case "+":
					case "~":
					case "*":
					case "...":
						return true;
					default:
						return false;
				}
			default:
				return false;
		}
	}

	private PyNode parseTestList() {
		int line = line();
		PyNode first = parseTest();
		if (!atOp(",")) {
			return first;
		}
		List<PyNode> elts = new ArrayList<>();
		elts.add(first);
		while (atOp(",")) {
			advance();
			if (!startsExpression()) {
				break;
			}
			elts.add(parseTest());
		}
		return new SequenceNode(NodeKind.TUPLE, line, elts);
	}

	private PyNode parseTestListStarExpr() {
		int line = line();
		PyNode first = parseTestOrStar();
		if (!atOp(",")) {
			return first;
		}
		List<PyNode> elts = new ArrayList<>();
		elts.add(first);
		while (atOp(",")) {
			advance();
			if (!startsExpression()) {
				break;
			}
			elts.add(parseTestOrStar());
		}
		return new SequenceNode(NodeKind.TUPLE, line, elts);
	}

	private List<PyNode> parseExprList() {
		List<PyNode> elts = new ArrayList<>();
		elts.add(parseExprOrStar());
		while (atOp(",")) {
			advance();
			if (!startsExpression()) {
				break;
			}
			elts.add(parseExprOrStar());
		}
		return elts;
	}

	private PyNode parseExprListAsTarget() {
		int line = line();
		boolean trailingComma = false;
		List<PyNode> elts = new ArrayList<>();
		elts.add(parseExprOrStar());
		while (atOp(",")) {
			advance();
			trailingComma = true;
			if (!startsExpression()) {
				break;
			}
			elts.add(parseExprOrStar());
		}
		if (elts.size() == 1 && !trailingComma) {
			return elts.get(0);
		}
		return new SequenceNode(NodeKind.TUPLE, line, elts);
	}

	private PyNode parseTestOrStar() {
		return atOp("*") ? parseStarExpr() : parseNamedExprTest();
	}

	private PyNode parseExprOrStar() {
		return atOp("*") ? parseStarExpr() : parseExpr();
	}

	private PyNode parseStarExpr() {
		int line = line();
		expectOp("*");
		return new WrappedExprNode(NodeKind.STARRED, line, parseExpr());
	}

	private PyNode parseNamedExprTest() {
		if (at(TokenKind.NAME) && peekAhead(1).isOp(":=")) {
			int line = line();
			PyNode target = new NameNode(line, expectName());
			advance();
			return new NamedExprNode(line, target, parseTest());
		}
		return parseTest();
	}

	private PyNode parseTest() {
		if (atKeyword("lambda")) {
			return parseLambda();
		}
		int line = line();
		PyNode body = parseOrTest();
		if (atKeyword("if")) {
			advance();
			PyNode test = parseOrTest();
			expectKeyword("else");
			PyNode orelse = parseTest();
			return new IfExpNode(line, test, body, orelse);
		}
		return body;
	}

	private PyNode parseLambda() {
		int line = line();
		expectKeyword("lambda");
		ArgumentsNode args = parseParameters(":", false);
		expectOp(":");
		return new LambdaNode(line, args, parseTest());
	}

	private PyNode parseYield() {
		int line = line();
		expectKeyword("yield");
		if (atKeyword("from")) {
			advance();
			return new YieldNode(NodeKind.YIELD_FROM, line, parseTest());
		}
		PyNode value = startsExpression() ? parseTestListStarExpr() : null;
		return new YieldNode(NodeKind.YIELD, line, value);
	}

	private PyNode parseOrTest() {
		int line = line();
		PyNode first = parseAndTest();
		if (!atKeyword("or")) {
			return first;
		}
		List<PyNode> values = new ArrayList<>();
		values.add(first);
		while (atKeyword("or")) {
			advance();
			values.add(parseAndTest());
		}
		return new BoolOpNode(line, OperatorKind.OR, values);
	}

	private PyNode parseAndTest() {
		int line = line();
		PyNode first = parseNotTest();
		if (!atKeyword("and")) {
			return first;
		}
		List<PyNode> values = new ArrayList<>();
		values.add(first);
		while (atKeyword("and")) {
			advance();
			values.add(parseNotTest());
		}
		return new BoolOpNode(line, OperatorKind.AND, values);
	}

	private PyNode parseNotTest() {
		if (atKeyword("not")) {
			int line = line();
			advance();
			return new UnaryOpNode(line, OperatorKind.NOT, parseNotTest());
		}
		return parseComparison();
	}

	private PyNode parseComparison() {
		int line = line();
		PyNode left = parseExpr();
		List<OperatorKind> ops = new ArrayList<>();
		List<PyNode> comparators = new ArrayList<>();
		while (true) {
			OperatorKind op = parseComparisonOperator();
			if (op == null) {
				break;
			}
			ops.add(op);
			comparators.add(parseExpr());
		}
		if (ops.isEmpty()) {
			return left;
		}
		return new CompareNode(line, left, ops, comparators);
	}

	private OperatorKind parseComparisonOperator() {
		Token token = peek();
		if (token.getKind() == TokenKind.OP && COMPARISONS.containsKey(token.getText())) {
			advance();
			return COMPARISONS.get(token.getText());
		}
		if (token.isName("in")) {
			advance();
			return OperatorKind.IN;
		}
		if (token.isName("not") && peekAhead(1).isName("in")) {
			advance();
			advance();
			return OperatorKind.NOT_IN;
		}
		if (token.isName("is")) {
			advance();
			if (atKeyword("not")) {
				advance();
				return OperatorKind.IS_NOT;
			}
			return OperatorKind.IS;
		}
		return null;
	}

	private PyNode parseExpr() {
		int line = line();
		PyNode left = parseXorExpr();
		while (atOp("|")) {
			advance();
			left = new BinOpNode(line, left, OperatorKind.BIT_OR, parseXorExpr());
		}
		return left;
	}

	private PyNode parseXorExpr() {
		int line = line();
		PyNode left = parseAndExpr();
		while (atOp("^")) {
			advance();
			left = new BinOpNode(line, left, OperatorKind.BIT_XOR, parseAndExpr());
		}
		return left;
	}

	private PyNode parseAndExpr() {
		int line = line();
		PyNode left = parseShiftExpr();
		while (atOp("&")) {
			advance();
			left = new BinOpNode(line, left, OperatorKind.BIT_AND, parseShiftExpr());
		}
		return left;
	}

	private PyNode parseShiftExpr() {
		int line = line();
		PyNode left = parseArithExpr();
		while (atOp("<<") || atOp(">>")) {
			OperatorKind op = advance().getText().equals("<<") ? OperatorKind.LSHIFT : OperatorKind.RSHIFT;
			left = new BinOpNode(line, left, op, parseArithExpr());
		}
		return left;
	}

	private PyNode parseArithExpr() {
		int line = line();
		PyNode left = parseTerm();
		while (atOp("+") || atOp("-")) {
			OperatorKind op = advance().getText().equals("+") ? OperatorKind.ADD : OperatorKind.SUB;
			left = new BinOpNode(line, left, op, parseTerm());
		}
		return left;
	}

	private PyNode parseTerm() {
		int line = line();
		PyNode left = parseFactor();
		while (at(TokenKind.OP) && TERM_OPERATORS.containsKey(peek().getText())) {
			OperatorKind op = TERM_OPERATORS.get(advance().getText());
			left = new BinOpNode(line, left, op, parseFactor());
		}
		return left;
	}

	private PyNode parseFactor() {
		if (at(TokenKind.OP) && FACTOR_OPERATORS.containsKey(peek().getText())) {
			int line = line();
			OperatorKind op = FACTOR_OPERATORS.get(advance().getText());
			return new UnaryOpNode(line, op, parseFactor());
		}
		return parsePower();
	}

	private PyNode parsePower() {
		int line = line();
		PyNode base;
		if (atKeyword("await")) {
			advance();
			base = new WrappedExprNode(NodeKind.AWAIT, line, parseAtomExpr());
		} else {
			base = parseAtomExpr();
		}
		if (atOp("**")) {
			advance();
			return new BinOpNode(line, base, OperatorKind.POW, parseFactor());
		}
		return base;
	}

	private PyNode parseAtomExpr() {
		int line = line();
		PyNode node = parseAtom();
		while (true) {
			if (atOp("(")) {
				advance();
				node = parseArguments(node);
				expectOp(")");
			} else if (atOp("[")) {
				advance();
				node = new SubscriptNode(line, node, parseSubscriptList());
				expectOp("]");
			} else if (atOp(".")) {
				advance();
				node = new AttributeNode(line, node, expectName());
			} else {
				return node;
			}
		}
	}

	/**
	 * Parse call arguments after the opening parenthesis, keeping them in
	 * source order.
	 */
	private CallNode parseArguments(PyNode func) {
		int line = func.getLineNumber() > 0 ? func.getLineNumber() : line();
		List<PyNode> args = new ArrayList<>();
		while (!atOp(")")) {
			int argLine = line();
			if (atOp("*")) {
				advance();
				args.add(new WrappedExprNode(NodeKind.STARRED, argLine, parseTest()));
			} else if (atOp("**")) {
				advance();
				args.add(new KeywordNode(argLine, null, parseTest()));
			} else if (at(TokenKind.NAME) && peekAhead(1).isOp("=")) {
				String name = expectName();
				advance();
				args.add(new KeywordNode(argLine, name, parseTest()));
			} else {
				PyNode arg = parseNamedExprTest();
				if (atKeyword("for")) {
					arg = new ComprehensionExprNode(NodeKind.GENERATOR_EXP, argLine, arg, parseComprehensionClauses());
				}
				args.add(arg);
			}
			if (!atOp(",")) {
				break;
			}
			advance();
		}
		return new CallNode(line, func, args);
	}

	private PyNode parseSubscriptList() {
		int line = line();
		List<PyNode> dims = new ArrayList<>();
		boolean anySlice = false;
		boolean trailingComma = false;
		dims.add(parseSubscript());
		while (atOp(",")) {
			advance();
			trailingComma = true;
			if (atOp("]")) {
				break;
			}
			dims.add(parseSubscript());
		}
		for (PyNode dim : dims) {
			anySlice |= dim.getKind() == NodeKind.SLICE;
		}
		if (dims.size() == 1 && !trailingComma) {
			PyNode only = dims.get(0);
			return only.getKind() == NodeKind.SLICE ? only : new IndexNode(line, only);
		}
		if (!anySlice) {
			return new IndexNode(line, new SequenceNode(NodeKind.TUPLE, line, dims));
		}
		List<PyNode> wrapped = new ArrayList<>();
		for (PyNode dim : dims) {
			wrapped.add(dim.getKind() == NodeKind.SLICE ? dim : new IndexNode(dim.getLineNumber(), dim));
		}
		return new ExtSliceNode(line, wrapped);
	}

	private PyNode parseSubscript() {
		int line = line();
		PyNode lower = null;
		if (!atOp(":")) {
			lower = parseTest();
			if (!atOp(":")) {
				return lower;
			}
		}
		expectOp(":");
		PyNode upper = null;
		PyNode step = null;
		if (!atOp(":") && !atOp("]") && !atOp(",")) {
			upper = parseTest();
		}
		if (atOp(":")) {
			advance();
			if (!atOp("]") && !atOp(",")) {
				step = parseTest();
			}
		}
		return new SliceNode(line, lower, upper, step);
	}

	private List<ComprehensionNode> parseComprehensionClauses() {
		List<ComprehensionNode> generators = new ArrayList<>();
		while (atKeyword("for")) {
			int line = line();
			advance();
			PyNode target = parseExprListAsTarget();
			expectKeyword("in");
			PyNode iter = parseOrTest();
			List<PyNode> ifs = new ArrayList<>();
			while (atKeyword("if")) {
				advance();
				ifs.add(parseOrTest());
			}
			generators.add(new ComprehensionNode(line, target, iter, ifs));
		}
		return generators;
	}

	private PyNode parseAtom() {
		int line = line();
		Token token = peek();
		switch (token.getKind()) {
			case NUMBER:
				advance();
				return new NumNode(line, token.getText());
			case STRING:
				return parseStrings();
			case NAME:
				if (NAME_CONSTANTS.contains(token.getText())) {
					advance();
					return new NameConstantNode(line, token.getText());
				}
				return new NameNode(line, expectName());
			case OP:
				switch (token.getText()) {
					case "(":
						return parseParenthesized();
					case "[":
						return parseListDisplay();
					case "{":
						return parseBraceDisplay();
					case "...":
						advance();
						return new EllipsisNode(line);
					default:
						break;
				}
				break;
			default:
				break;
		}
		throw error("expected an expression");
	}

	private PyNode parseStrings() {
		int line = peek().getEnd().getRow();
		List<Integer> tokenLines = new ArrayList<>();
		StringBuilder value = new StringBuilder();
		boolean bytes = false;
		while (at(TokenKind.STRING)) {
			Token token = advance();
			tokenLines.add(token.getEnd().getRow());
			String text = token.getText();
			int quoteAt = 0;
			while (text.charAt(quoteAt) != '\'' && text.charAt(quoteAt) != '"') {
				quoteAt++;
			}
			bytes |= text.substring(0, quoteAt).toLowerCase().contains("b");
			String body = text.substring(quoteAt);
			int quoteLength = body.startsWith("\"\"\"") || body.startsWith("'''") ? 3 : 1;
			value.append(body, quoteLength, body.length() - quoteLength);
		}
		return new StrNode(bytes ? NodeKind.BYTES : NodeKind.STR, line, value.toString(), tokenLines);
	}

	private PyNode parseParenthesized() {
		int line = line();
		expectOp("(");
		if (atOp(")")) {
			advance();
			return new SequenceNode(NodeKind.TUPLE, line, new ArrayList<>());
		}
		if (atKeyword("yield")) {
			PyNode yield = parseYield();
			expectOp(")");
			return yield;
		}
		PyNode first = parseTestOrStar();
		if (atKeyword("for")) {
			PyNode generator = new ComprehensionExprNode(NodeKind.GENERATOR_EXP, line, first,
					parseComprehensionClauses());
			expectOp(")");
			return generator;
		}
		if (!atOp(",")) {
			expectOp(")");
			return first;
		}
		List<PyNode> elts = new ArrayList<>();
		elts.add(first);
		while (atOp(",")) {
			advance();
			if (atOp(")")) {
				break;
			}
			elts.add(parseTestOrStar());
		}
		expectOp(")");
		return new SequenceNode(NodeKind.TUPLE, line, elts);
	}

	private PyNode parseListDisplay() {
		int line = line();
		expectOp("[");
		List<PyNode> elts = new ArrayList<>();
		if (atOp("]")) {
			advance();
			return new SequenceNode(NodeKind.LIST, line, elts);
		}
		PyNode first = parseTestOrStar();
		if (atKeyword("for")) {
			PyNode comprehension = new ComprehensionExprNode(NodeKind.LIST_COMP, line, first,
					parseComprehensionClauses());
			expectOp("]");
			return comprehension;
		}
		elts.add(first);
		while (atOp(",")) {
			advance();
			if (atOp("]")) {
				break;
			}
			elts.add(parseTestOrStar());
		}
		expectOp("]");
		return new SequenceNode(NodeKind.LIST, line, elts);
	}

	private PyNode parseBraceDisplay() {
		int line = line();
		expectOp("{");
		if (atOp("}")) {
			advance();
			return new DictNode(line, new ArrayList<>(), new ArrayList<>());
		}
		if (atOp("**")) {
			return parseDictEntries(line, new ArrayList<>(), new ArrayList<>());
		}
		PyNode first = parseTestOrStar();
		if (atOp(":")) {
			advance();
			PyNode value = parseTest();
			if (atKeyword("for")) {
				PyNode comprehension = new DictCompNode(line, first, value, parseComprehensionClauses());
				expectOp("}");
				return comprehension;
			}
			List<PyNode> keys = new ArrayList<>();
			List<PyNode> values = new ArrayList<>();
			keys.add(first);
			values.add(value);
			if (atOp(",")) {
				advance();
			}
			return parseDictEntries(line, keys, values);
		}
		if (atKeyword("for")) {
			PyNode comprehension = new ComprehensionExprNode(NodeKind.SET_COMP, line, first,
					parseComprehensionClauses());
			expectOp("}");
			return comprehension;
		}
		List<PyNode> elts = new ArrayList<>();
		elts.add(first);
		while (atOp(",")) {
			advance();
			if (atOp("}")) {
				break;
			}
			elts.add(parseTestOrStar());
		}
		expectOp("}");
		return new SequenceNode(NodeKind.SET, line, elts);
	}

	/**
	 * Parse the remaining {@code key: value} or {@code **mapping} entries of
	 * a dict display. An unpacked mapping is stored with a {@code null} key.
	 */
	private PyNode parseDictEntries(int line, List<PyNode> keys, List<PyNode> values) {
		while (!atOp("}")) {
			if (atOp("**")) {
				advance();
				keys.add(null);
				values.add(parseExpr());
			} else {
				keys.add(parseTest());
				expectOp(":");
				values.add(parseTest());
			}
			if (!atOp(",")) {
				break;
			}
			advance();
		}
		expectOp("}");
		return new DictNode(line, keys, values);
	}
}
