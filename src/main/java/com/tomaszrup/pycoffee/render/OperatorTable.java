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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.tomaszrup.pycoffee.compiler.ast.OperatorKind;

/**
 * Fixed operator spellings. Word operators carry their surrounding spaces.
 * {@link OperatorKind#MAT_MULT} has no spelling.
 */
public final class OperatorTable {

	private static final Map<OperatorKind, String> SPELLINGS;

	static {
		Map<OperatorKind, String> map = new EnumMap<>(OperatorKind.class);
		// binary
		map.put(OperatorKind.ADD, "+");
		map.put(OperatorKind.BIT_AND, "&");
		map.put(OperatorKind.BIT_OR, "|");
		map.put(OperatorKind.BIT_XOR, "^");
		map.put(OperatorKind.DIV, "/");
		map.put(OperatorKind.FLOOR_DIV, "//");
		map.put(OperatorKind.LSHIFT, "<<");
		map.put(OperatorKind.MOD, "%");
		map.put(OperatorKind.MULT, "*");
		map.put(OperatorKind.POW, "**");
		map.put(OperatorKind.RSHIFT, ">>");
		map.put(OperatorKind.SUB, "-");
		// boolean
		map.put(OperatorKind.AND, " and ");
		map.put(OperatorKind.OR, " or ");
		// comparison
		map.put(OperatorKind.EQ, "==");
		map.put(OperatorKind.GT, ">");
		map.put(OperatorKind.GT_E, ">=");
		map.put(OperatorKind.IN, " in ");
		map.put(OperatorKind.IS, " is ");
		map.put(OperatorKind.IS_NOT, " is not ");
		map.put(OperatorKind.LT, "<");
		map.put(OperatorKind.LT_E, "<=");
		map.put(OperatorKind.NOT_EQ, "!=");
		map.put(OperatorKind.NOT_IN, " not in ");
		// context
		map.put(OperatorKind.AUG_LOAD, "<AugLoad>");
		map.put(OperatorKind.AUG_STORE, "<AugStore>");
		map.put(OperatorKind.DEL, "<Del>");
		map.put(OperatorKind.LOAD, "<Load>");
		map.put(OperatorKind.PARAM, "<Param>");
		map.put(OperatorKind.STORE, "<Store>");
		// unary
		map.put(OperatorKind.INVERT, "~");
		map.put(OperatorKind.NOT, " not ");
		map.put(OperatorKind.U_ADD, "+");
		map.put(OperatorKind.U_SUB, "-");
		SPELLINGS = Collections.unmodifiableMap(map);
	}

	private final boolean strict;

	public OperatorTable(boolean strict) {
		this.strict = strict;
	}

	public boolean isStrict() {
		return strict;
	}

	public static boolean hasSpelling(OperatorKind operator) {
		return SPELLINGS.containsKey(operator);
	}

	/**
	 * Return the operator's spelling, or {@code <Name>} for an operator the
	 * table lacks.
	 *
	 * @throws UnsupportedOperatorException in strict mode when the table
	 *         lacks the operator
	 */
	public String spelling(OperatorKind operator) {
		String spelling = SPELLINGS.get(operator);
		if (spelling != null) {
			return spelling;
		}
		if (strict) {
			throw new UnsupportedOperatorException(operator);
		}
		return "<" + operator.getPythonName() + ">";
	}
}
