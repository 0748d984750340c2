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
package com.tomaszrup.pycoffee.render;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;

import com.tomaszrup.pycoffee.compiler.ast.ArgNode;
import com.tomaszrup.pycoffee.compiler.ast.ArgumentsNode;
import com.tomaszrup.pycoffee.compiler.ast.ClassDefNode;
import com.tomaszrup.pycoffee.compiler.ast.FunctionDefNode;
import com.tomaszrup.pycoffee.compiler.ast.ModuleNode;
import com.tomaszrup.pycoffee.compiler.ast.NodeKind;
import com.tomaszrup.pycoffee.compiler.ast.PyNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.AttributeNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.BinOpNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.BoolOpNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.CallNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.CompareNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.ComprehensionExprNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.ComprehensionNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.DictNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.ExtSliceNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.IfExpNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.IndexNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.KeywordNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.LambdaNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.NameConstantNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.NameNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.NumNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.SequenceNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.SliceNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.StrNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.SubscriptNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.UnaryOpNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.WrappedExprNode;
import com.tomaszrup.pycoffee.compiler.ast.expr.YieldNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.AliasNode;
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
import com.tomaszrup.pycoffee.compiler.ast.stmt.NameListStatementNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.RaiseNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.ReturnNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.TryNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.WhileNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.WithItemNode;
import com.tomaszrup.pycoffee.compiler.ast.stmt.WithNode;
import com.tomaszrup.pycoffee.config.RendererOptions;
import com.tomaszrup.pycoffee.sync.StringQueueUnderflowException;
import com.tomaszrup.pycoffee.sync.TokenSync;

/**
 * One depth-first walk over a module. Statements come back as complete,
 * newline-terminated lines with their leading comment lines and trailing
 * comment attached; expressions come back as bare fragments.
 */
class RenderPass {

	private final RendererOptions options;
	private final OperatorTable operators;
	private final Logger logger;
	private final TokenSync sync;
	private final RenderState state;

	RenderPass(RendererOptions options, OperatorTable operators, Logger logger, TokenSync sync, RenderState state) {
		this.options = options;
		this.operators = operators;
		this.logger = logger;
		this.sync = sync;
		this.state = state;
	}

	String visit(PyNode node) {
		switch (node.getKind()) {
			// scaffolding
			case MODULE:
				return renderModule((ModuleNode) node);
			case CLASS_DEF:
				return renderClassDef((ClassDefNode) node);
			case FUNCTION_DEF:
				return renderFunctionDef((FunctionDefNode) node);
			case ARGUMENTS:
				return String.join(",", renderParameters((ArgumentsNode) node, false));
			case ARG:
				return receiverAware(((ArgNode) node).getName());

			// statements
			case EXPR:
				return renderExprStatement((ExprStmtNode) node);
			case ASSIGN:
				return renderAssign((AssignNode) node);
			case AUG_ASSIGN:
				return renderAugAssign((AugAssignNode) node);
			case IF:
				return renderIf((IfNode) node);
			case FOR:
				return renderFor((ForNode) node);
			case WHILE:
				return renderWhile((WhileNode) node);
			case TRY:
				return renderTry((TryNode) node);
			case EXCEPT_HANDLER:
				return renderExceptHandler((ExceptHandlerNode) node);
			case WITH:
				return renderWith((WithNode) node);
			case WITH_ITEM:
				return renderWithItem((WithItemNode) node);
			case IMPORT:
				return renderImport((ImportNode) node);
			case IMPORT_FROM:
				return renderImportFrom((ImportFromNode) node);
			case ALIAS:
				return renderAlias((AliasNode) node);
			case RETURN:
				return renderReturn((ReturnNode) node);
			case RAISE:
				return renderRaise((RaiseNode) node);
			case DELETE:
				return renderDelete((DeleteNode) node);
			case ASSERT:
				return renderAssert((AssertNode) node);
			case PASS:
				return renderKeywordStatement(node, "pass");
			case BREAK:
				return renderKeywordStatement(node, "break");
			case CONTINUE:
				return renderKeywordStatement(node, "continue");
			case GLOBAL:
				return renderGlobal((NameListStatementNode) node);

			// expressions
			case NAME:
				return receiverAware(((NameNode) node).getId());
			case ATTRIBUTE:
				return renderAttribute((AttributeNode) node);
			case CALL:
				return renderCall((CallNode) node);
			case KEYWORD:
				return renderKeyword((KeywordNode) node);
			case NUM:
				return ((NumNode) node).getText();
			case STR:
			case BYTES:
				return renderString((StrNode) node);
			case NAME_CONSTANT:
				return ((NameConstantNode) node).getValue();
			case ELLIPSIS:
				return "...";
			case SUBSCRIPT:
				return visit(((SubscriptNode) node).getValue()) + "[" + visit(((SubscriptNode) node).getSlice()) + "]";
			case INDEX:
				return visit(((IndexNode) node).getValue());
			case SLICE:
				return renderSlice((SliceNode) node);
			case EXT_SLICE:
				return join(":", ((ExtSliceNode) node).getDims());
			case TUPLE:
				return "(" + join(", ", ((SequenceNode) node).getElts()) + ")";
			case LIST:
				return "[" + join(",", ((SequenceNode) node).getElts()) + "]";
			case DICT:
				return renderDict((DictNode) node);
			case LIST_COMP:
				return renderListComp((ComprehensionExprNode) node);
			case GENERATOR_EXP:
				return renderGeneratorExp((ComprehensionExprNode) node);
			case COMPREHENSION:
				return renderComprehension((ComprehensionNode) node);
			case IF_EXP:
				return renderIfExp((IfExpNode) node);
			case LAMBDA:
				return renderLambda((LambdaNode) node);
			case YIELD:
				return renderYield((YieldNode) node);

			// operators
			case BIN_OP:
				return renderBinOp((BinOpNode) node);
			case BOOL_OP:
				return renderBoolOp((BoolOpNode) node);
			case COMPARE:
				return renderCompare((CompareNode) node);
			case UNARY_OP:
				return operators.spelling(((UnaryOpNode) node).getOp()) + visit(((UnaryOpNode) node).getOperand());

			// no CoffeeScript rule
			case ASYNC_FUNCTION_DEF:
			case ANN_ASSIGN:
			case NONLOCAL:
			case SET:
			case SET_COMP:
			case DICT_COMP:
			case YIELD_FROM:
			case AWAIT:
			case STARRED:
			case NAMED_EXPR:
				throw new UnsupportedNodeKindException(node.getKind(), node.getLineNumber());
			default:
				throw new IllegalStateException("Node kind " + node.getKind() + " is neither rendered nor rejected");
		}
	}

	// ------------------------------------------------------------------
	// Helpers
	// ------------------------------------------------------------------

	private String indent(String text) {
		return state.indent(text, options.getIndentUnit());
	}

	private String leading(PyNode node) {
		return sync.leadingString(node.getLineNumber());
	}

	private String trailing(PyNode node) {
		return sync.trailingComment(node.getLineNumber());
	}

	private String join(String separator, List<? extends PyNode> nodes) {
		List<String> parts = new ArrayList<>();
		for (PyNode node : nodes) {
			parts.add(visit(node));
		}
		return String.join(separator, parts);
	}

	/**
	 * Walk a node that has no place in the output so the string literals
	 * inside it are still taken from their lines in source order.
	 */
	private void consume(PyNode node) {
		if (node != null) {
			visit(node);
		}
	}

	private String renderBody(List<PyNode> body) {
		StringBuilder result = new StringBuilder();
		state.enterBlock();
		try {
			for (PyNode statement : body) {
				result.append(visit(statement));
			}
		} finally {
			state.exitBlock();
		}
		return result.toString();
	}

	private String renderScopedBody(RenderState.ScopeKind kind, String name, List<PyNode> body) {
		state.pushScope(kind, name);
		try {
			return renderBody(body);
		} finally {
			state.popScope();
		}
	}

	/**
	 * The receiver's name becomes the sigil inside a class or function.
	 */
	private String receiverAware(String name) {
		if (state.inScope() && name.equals(options.getReceiverName())) {
			return options.getReceiverSigil();
		}
		return name;
	}

	/**
	 * Emit an {@code else:} or {@code finally:} clause header recorded at
	 * {@code clauseLine}, followed by its body.
	 */
	private String renderClause(String keyword, int clauseLine, List<PyNode> body) {
		String head = sync.leadingString(clauseLine);
		String tail = sync.trailingComment(clauseLine);
		return head + indent(keyword + ":" + tail) + renderBody(body);
	}

	private String renderOrelse(List<PyNode> orelse, int orelseLine) {
		if (orelse.isEmpty()) {
			return "";
		}
		if (orelseLine == 0) {
			// elif: comments above it go before the synthetic else
			String head = leading(orelse.get(0));
			return head + indent("else:\n") + renderBody(orelse);
		}
		return renderClause("else", orelseLine, orelse);
	}

	// ------------------------------------------------------------------
	// Scaffolding
	// ------------------------------------------------------------------

	private String renderModule(ModuleNode node) {
		StringBuilder result = new StringBuilder();
		for (PyNode statement : node.getBody()) {
			result.append(visit(statement));
		}
		result.append(sync.leadingString(sync.getBucketCount()));
		return result.toString();
	}

	private String renderDecorators(List<PyNode> decorators) {
		StringBuilder result = new StringBuilder();
		for (PyNode decorator : decorators) {
			result.append(leading(decorator));
			String tail = trailing(decorator);
			result.append(indent("@" + visit(decorator) + tail));
		}
		return result.toString();
	}

	private String renderClassDef(ClassDefNode node) {
		StringBuilder result = new StringBuilder();
		result.append(renderDecorators(node.getDecorators()));
		result.append(leading(node));
		String tail = trailing(node);
		List<String> bases = new ArrayList<>();
		for (PyNode argument : node.getArguments()) {
			if (argument.getKind() == NodeKind.KEYWORD) {
				consume(argument);
			} else {
				bases.add(renderArgument(argument));
			}
		}
		String header = "class " + node.getName();
		if (!bases.isEmpty()) {
			header += " extends " + String.join(", ", bases);
		}
		result.append(indent(header + tail));
		result.append(renderScopedBody(RenderState.ScopeKind.CLASS, node.getName(), node.getBody()));
		return result.toString();
	}

	private String renderFunctionDef(FunctionDefNode node) {
		StringBuilder result = new StringBuilder();
		result.append(renderDecorators(node.getDecorators()));
		result.append(leading(node));
		String tail = trailing(node);
		boolean method = state.inClassScope();
		List<String> params = renderParameters(node.getArgs(), method);
		consume(node.getReturns());
		String args = params.isEmpty() ? "" : "(" + String.join(", ", params) + ") ";
		String separator = method ? ": " : " = ";
		result.append(indent(node.getName() + separator + args + "->" + tail));
		result.append(renderScopedBody(RenderState.ScopeKind.FUNCTION, node.getName(), node.getBody()));
		return result.toString();
	}

	/**
	 * Render parameters in declaration order. Defaults belong to the last
	 * positional parameters. With {@code dropReceiver}, a first positional
	 * parameter named like the receiver is left out.
	 */
	private List<String> renderParameters(ArgumentsNode args, boolean dropReceiver) {
		List<String> result = new ArrayList<>();
		List<ArgNode> positional = args.getArgs();
		List<PyNode> defaults = args.getDefaults();
		int plain = positional.size() - defaults.size();
		for (int i = 0; i < positional.size(); i++) {
			String name = positional.get(i).getName();
			consume(positional.get(i).getAnnotation());
			if (i == 0 && dropReceiver && name.equals(options.getReceiverName())) {
				continue;
			}
			String param = receiverAware(name);
			if (i >= plain) {
				param += "=" + visit(defaults.get(i - plain));
			}
			result.add(param);
		}
		if (args.getVararg() != null) {
			consume(args.getVararg().getAnnotation());
			result.add("*" + args.getVararg().getName());
		}
		List<ArgNode> kwonly = args.getKwonlyArgs();
		for (int i = 0; i < kwonly.size(); i++) {
			consume(kwonly.get(i).getAnnotation());
			PyNode defaultValue = args.getKwDefaults().get(i);
			String param = kwonly.get(i).getName();
			result.add(defaultValue == null ? param : param + "=" + visit(defaultValue));
		}
		if (args.getKwarg() != null) {
			consume(args.getKwarg().getAnnotation());
			result.add("**" + args.getKwarg().getName());
		}
		return result;
	}

	// ------------------------------------------------------------------
	// Statements
	// ------------------------------------------------------------------

	private String renderExprStatement(ExprStmtNode node) {
		String head = leading(node);
		String tail = trailing(node);
		return head + indent(visit(node.getValue())) + tail;
	}

	private String renderAssign(AssignNode node) {
		String head = leading(node);
		String tail = trailing(node);
		String targets = join("=", node.getTargets());
		return head + indent(targets + "=" + visit(node.getValue())) + tail;
	}

	private String renderAugAssign(AugAssignNode node) {
		String head = leading(node);
		String tail = trailing(node);
		String text = visit(node.getTarget()) + operators.spelling(node.getOp()) + "=" + visit(node.getValue());
		return head + indent(text) + tail;
	}

	private String renderIf(IfNode node) {
		String head = leading(node);
		String tail = trailing(node);
		return head
				+ indent("if " + visit(node.getTest()) + ":" + tail)
				+ renderBody(node.getBody())
				+ renderOrelse(node.getOrelse(), node.getOrelseLine());
	}

	private String renderFor(ForNode node) {
		String head = leading(node);
		String tail = trailing(node);
		String header = "for " + visit(node.getTarget()) + " in " + visit(node.getIter()) + ":";
		return head
				+ indent(header + tail)
				+ renderBody(node.getBody())
				+ renderOrelse(node.getOrelse(), node.getOrelseLine());
	}

	private String renderWhile(WhileNode node) {
		String head = leading(node);
		String tail = trailing(node);
		return head
				+ indent("while " + visit(node.getTest()) + ":" + tail)
				+ renderBody(node.getBody())
				+ renderOrelse(node.getOrelse(), node.getOrelseLine());
	}

	private String renderTry(TryNode node) {
		StringBuilder result = new StringBuilder(leading(node));
		String tail = trailing(node);
		result.append(indent("try" + tail));
		result.append(renderBody(node.getBody()));
		for (ExceptHandlerNode handler : node.getHandlers()) {
			result.append(visit(handler));
		}
		if (!node.getOrelse().isEmpty()) {
			result.append(renderClause("else", node.getOrelseLine(), node.getOrelse()));
		}
		if (!node.getFinalbody().isEmpty()) {
			result.append(renderClause("finally", node.getFinallyLine(), node.getFinalbody()));
		}
		return result.toString();
	}

	private String renderExceptHandler(ExceptHandlerNode node) {
		String head = leading(node);
		String tail = trailing(node);
		StringBuilder header = new StringBuilder("except");
		if (node.getType() != null) {
			header.append(' ').append(visit(node.getType()));
		}
		if (node.getName() != null) {
			header.append(" as ").append(node.getName());
		}
		return head + indent(header + ":" + tail) + renderBody(node.getBody());
	}

	private String renderWith(WithNode node) {
		String head = leading(node);
		String tail = trailing(node);
		String header = "with " + join(", ", node.getItems()) + ":";
		return head + indent(header + tail) + renderBody(node.getBody());
	}

	private String renderWithItem(WithItemNode node) {
		String context = visit(node.getContextExpr());
		if (node.getOptionalVars() == null) {
			return context;
		}
		return context + " as " + visit(node.getOptionalVars());
	}

	private String renderImport(ImportNode node) {
		String head = leading(node);
		String tail = trailing(node);
		return head + indent("pass # import " + join(",", node.getNames())) + tail;
	}

	private String renderImportFrom(ImportFromNode node) {
		String head = leading(node);
		String tail = trailing(node);
		String module = ".".repeat(node.getLevel()) + (node.getModule() == null ? "" : node.getModule());
		return head + indent("pass # from " + module + " import " + join(",", node.getNames())) + tail;
	}

	private String renderAlias(AliasNode node) {
		return node.getAsname() == null ? node.getName() : node.getName() + " as " + node.getAsname();
	}

	private String renderReturn(ReturnNode node) {
		String head = leading(node);
		String tail = trailing(node);
		String text = node.getValue() == null ? "return" : "return " + visit(node.getValue()).strip();
		return head + indent(text) + tail;
	}

	private String renderRaise(RaiseNode node) {
		String head = leading(node);
		String tail = trailing(node);
		StringBuilder text = new StringBuilder("raise");
		if (node.getExc() != null) {
			text.append(' ').append(visit(node.getExc()));
			if (node.getCause() != null) {
				text.append(", ").append(visit(node.getCause()));
			}
		}
		return head + indent(text.toString()) + tail;
	}

	private String renderDelete(DeleteNode node) {
		String head = leading(node);
		String tail = trailing(node);
		return head + indent("del " + join(",", node.getTargets())) + tail;
	}

	private String renderAssert(AssertNode node) {
		String head = leading(node);
		String tail = trailing(node);
		String text = "assert " + visit(node.getTest());
		if (node.getMsg() != null) {
			text += ", " + visit(node.getMsg());
		}
		return head + indent(text) + tail;
	}

	private String renderKeywordStatement(PyNode node, String keyword) {
		String head = leading(node);
		String tail = trailing(node);
		return head + indent(keyword) + tail;
	}

	private String renderGlobal(NameListStatementNode node) {
		String head = leading(node);
		String tail = trailing(node);
		return head + indent("global " + String.join(",", node.getNames())) + tail;
	}

	// ------------------------------------------------------------------
	// Expressions
	// ------------------------------------------------------------------

	private String renderAttribute(AttributeNode node) {
		String value = visit(node.getValue());
		if (value.equals(options.getReceiverSigil())) {
			return value + node.getAttr();
		}
		return value + "." + node.getAttr();
	}

	private String renderCall(CallNode node) {
		String func = visit(node.getFunc());
		List<String> args = new ArrayList<>();
		for (PyNode arg : node.getArgs()) {
			args.add(renderArgument(arg));
		}
		return func + "(" + String.join(",", args) + ")";
	}

	/**
	 * A call or class-header argument. {@code *x} is only rendered here;
	 * anywhere else a starred expression has no rendering.
	 */
	private String renderArgument(PyNode arg) {
		if (arg.getKind() == NodeKind.STARRED) {
			return "*" + visit(((WrappedExprNode) arg).getValue());
		}
		return visit(arg);
	}

	private String renderKeyword(KeywordNode node) {
		if (node.getArg() == null) {
			return "**" + visit(node.getValue());
		}
		return node.getArg() + "=" + visit(node.getValue());
	}

	/**
	 * Reproduce each literal token's original spelling. Adjacent literals
	 * are joined by a space.
	 */
	private String renderString(StrNode node) {
		List<Integer> tokenLines = node.getTokenLines();
		Map<Integer, Integer> needed = new HashMap<>();
		for (int line : tokenLines) {
			needed.merge(line, 1, Integer::sum);
		}
		// nothing is taken unless every piece has a token
		for (Map.Entry<Integer, Integer> entry : needed.entrySet()) {
			if (sync.remainingStringLiterals(entry.getKey()) < entry.getValue()) {
				logger.debug("String literal on line {} has no source token on line {}, using its value",
						node.getLineNumber(), entry.getKey());
				return node.getValue();
			}
		}
		if (tokenLines.isEmpty()) {
			return node.getValue();
		}
		List<String> pieces = new ArrayList<>();
		try {
			for (int line : tokenLines) {
				pieces.add(sync.nextStringLiteral(line));
			}
		} catch (StringQueueUnderflowException e) {
			throw new IllegalStateException("String token counted but missing on line " + e.getLineNumber(), e);
		}
		return String.join(" ", pieces);
	}

	private String renderSlice(SliceNode node) {
		String lower = node.getLower() == null ? "" : visit(node.getLower());
		String upper = node.getUpper() == null ? "" : visit(node.getUpper());
		if (node.getStep() == null) {
			return lower + ":" + upper;
		}
		return lower + ":" + upper + ":" + visit(node.getStep());
	}

	/**
	 * Render a dict display one entry per line. Comment lines in front of a
	 * key are kept; blank lines there are dropped.
	 */
	private String renderDict(DictNode node) {
		if (node.getKeys().isEmpty()) {
			return "{}";
		}
		StringBuilder result = new StringBuilder("{\n");
		state.enterBlock();
		try {
			for (int i = 0; i < node.getKeys().size(); i++) {
				PyNode key = node.getKeys().get(i);
				PyNode value = node.getValues().get(i);
				if (key != null) {
					for (String line : sync.leading(key.getLineNumber())) {
						if (!line.isBlank()) {
							result.append(line);
						}
					}
				}
				// a comment on the opening line belongs to the enclosing statement
				String tail = value.getLineNumber() == node.getLineNumber() ? "\n" : trailing(value);
				String entry = key == null ? "**" + visit(value) : visit(key) + ":" + visit(value);
				result.append(indent(entry + tail));
			}
		} finally {
			state.exitBlock();
		}
		result.append(indent("}"));
		return result.toString();
	}

	private String renderListComp(ComprehensionExprNode node) {
		return visit(node.getElt()) + " for " + join(" for ", node.getGenerators());
	}

	private String renderGeneratorExp(ComprehensionExprNode node) {
		return "<gen " + visit(node.getElt()) + " for " + join(",", node.getGenerators()) + ">";
	}

	private String renderComprehension(ComprehensionNode node) {
		StringBuilder result = new StringBuilder();
		result.append(visit(node.getTarget())).append(" in ").append(visit(node.getIter()));
		for (PyNode condition : node.getIfs()) {
			result.append(" if ").append(visit(condition));
		}
		return result.toString();
	}

	private String renderIfExp(IfExpNode node) {
		return visit(node.getBody()) + " if " + visit(node.getTest()) + " else " + visit(node.getOrelse());
	}

	private String renderLambda(LambdaNode node) {
		List<String> params = renderParameters(node.getArgs(), false);
		if (params.isEmpty()) {
			return "lambda: " + visit(node.getBody());
		}
		return "lambda " + String.join(",", params) + ": " + visit(node.getBody());
	}

	private String renderYield(YieldNode node) {
		return node.getValue() == null ? "yield" : "yield " + visit(node.getValue());
	}

	// ------------------------------------------------------------------
	// Operators
	// ------------------------------------------------------------------

	private String renderBinOp(BinOpNode node) {
		return visit(node.getLeft()) + operators.spelling(node.getOp()) + visit(node.getRight());
	}

	private String renderBoolOp(BoolOpNode node) {
		String spelling = operators.spelling(node.getOp());
		return join(spelling, node.getValues());
	}

	/**
	 * Chained comparisons interleave operators and comparators. When their
	 * counts differ only the left operand is rendered.
	 */
	private String renderCompare(CompareNode node) {
		StringBuilder result = new StringBuilder(visit(node.getLeft()));
		List<String> ops = new ArrayList<>();
		for (int i = 0; i < node.getOps().size(); i++) {
			ops.add(operators.spelling(node.getOps().get(i)));
		}
		List<String> comparators = new ArrayList<>();
		for (PyNode comparator : node.getComparators()) {
			comparators.add(visit(comparator));
		}
		if (ops.size() != comparators.size()) {
			logger.warn("Malformed comparison on line {}: {} operators {} but {} comparators {}",
					node.getLineNumber(), ops.size(), ops, comparators.size(), comparators);
			return result.toString();
		}
		for (int i = 0; i < ops.size(); i++) {
			result.append(ops.get(i)).append(comparators.get(i));
		}
		return result.toString();
	}
}
