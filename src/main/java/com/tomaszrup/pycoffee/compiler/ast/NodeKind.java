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
package com.tomaszrup.pycoffee.compiler.ast;

/**
 * Closed set of syntax-tree node kinds. Each constant carries the class
 * name Python's {@code ast} module uses for the same construct.
 */
public enum NodeKind {
	// scaffolding
	MODULE("Module"),
	CLASS_DEF("ClassDef"),
	FUNCTION_DEF("FunctionDef"),
	ASYNC_FUNCTION_DEF("AsyncFunctionDef"),
	ARGUMENTS("arguments"),
	ARG("arg"),

	// statements
	EXPR("Expr"),
	ASSIGN("Assign"),
	AUG_ASSIGN("AugAssign"),
	ANN_ASSIGN("AnnAssign"),
	IF("If"),
	FOR("For"),
	WHILE("While"),
	TRY("Try"),
	EXCEPT_HANDLER("ExceptHandler"),
	WITH("With"),
	WITH_ITEM("withitem"),
	IMPORT("Import"),
	IMPORT_FROM("ImportFrom"),
	ALIAS("alias"),
	RETURN("Return"),
	RAISE("Raise"),
	DELETE("Delete"),
	ASSERT("Assert"),
	PASS("Pass"),
	BREAK("Break"),
	CONTINUE("Continue"),
	GLOBAL("Global"),
	NONLOCAL("Nonlocal"),

	// expressions
	NAME("Name"),
	ATTRIBUTE("Attribute"),
	CALL("Call"),
	KEYWORD("keyword"),
	NUM("Num"),
	STR("Str"),
	BYTES("Bytes"),
	NAME_CONSTANT("NameConstant"),
	ELLIPSIS("Ellipsis"),
	SUBSCRIPT("Subscript"),
	INDEX("Index"),
	SLICE("Slice"),
	EXT_SLICE("ExtSlice"),
	TUPLE("Tuple"),
	LIST("List"),
	SET("Set"),
	DICT("Dict"),
	LIST_COMP("ListComp"),
	GENERATOR_EXP("GeneratorExp"),
	SET_COMP("SetComp"),
	DICT_COMP("DictComp"),
	COMPREHENSION("comprehension"),
	IF_EXP("IfExp"),
	LAMBDA("Lambda"),
	YIELD("Yield"),
	YIELD_FROM("YieldFrom"),
	AWAIT("Await"),
	STARRED("Starred"),
	NAMED_EXPR("NamedExpr"),

	// operators
	BIN_OP("BinOp"),
	BOOL_OP("BoolOp"),
	COMPARE("Compare"),
	UNARY_OP("UnaryOp");

	private final String pythonName;

	NodeKind(String pythonName) {
		this.pythonName = pythonName;
	}

	public String getPythonName() {
		return pythonName;
	}
}
