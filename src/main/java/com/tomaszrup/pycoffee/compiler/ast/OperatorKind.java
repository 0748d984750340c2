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
 * Operator kinds that can appear under {@code BinOp}, {@code BoolOp},
 * {@code Compare}, {@code UnaryOp} and {@code AugAssign}, plus the
 * expression-context markers of Python's {@code ast} module.
 */
public enum OperatorKind {
	// binary
	ADD("Add"),
	BIT_AND("BitAnd"),
	BIT_OR("BitOr"),
	BIT_XOR("BitXor"),
	DIV("Div"),
	FLOOR_DIV("FloorDiv"),
	LSHIFT("LShift"),
	MAT_MULT("MatMult"),
	MOD("Mod"),
	MULT("Mult"),
	POW("Pow"),
	RSHIFT("RShift"),
	SUB("Sub"),

	// boolean
	AND("And"),
	OR("Or"),

	// comparison
	EQ("Eq"),
	GT("Gt"),
	GT_E("GtE"),
	IN("In"),
	IS("Is"),
	IS_NOT("IsNot"),
	LT("Lt"),
	LT_E("LtE"),
	NOT_EQ("NotEq"),
	NOT_IN("NotIn"),

	// expression contexts
	AUG_LOAD("AugLoad"),
	AUG_STORE("AugStore"),
	DEL("Del"),
	LOAD("Load"),
	PARAM("Param"),
	STORE("Store"),

	// unary
	INVERT("Invert"),
	NOT("Not"),
	U_ADD("UAdd"),
	U_SUB("USub");

	private final String pythonName;

	OperatorKind(String pythonName) {
		this.pythonName = pythonName;
	}

	public String getPythonName() {
		return pythonName;
	}
}
