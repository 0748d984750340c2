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
package com.tomaszrup.pycoffee.render;

import java.util.EnumMap;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.pycoffee.compiler.ast.OperatorKind;

class OperatorTableTests {

	private static Map<OperatorKind, String> expectedSpellings() {
		Map<OperatorKind, String> expected = new EnumMap<>(OperatorKind.class);
		expected.put(OperatorKind.ADD, "+");
		expected.put(OperatorKind.BIT_AND, "&");
		expected.put(OperatorKind.BIT_OR, "|");
		expected.put(OperatorKind.BIT_XOR, "^");
		expected.put(OperatorKind.DIV, "/");
		expected.put(OperatorKind.FLOOR_DIV, "//");
		expected.put(OperatorKind.LSHIFT, "<<");
		expected.put(OperatorKind.MOD, "%");
		expected.put(OperatorKind.MULT, "*");
		expected.put(OperatorKind.POW, "**");
		expected.put(OperatorKind.RSHIFT, ">>");
		expected.put(OperatorKind.SUB, "-");
		expected.put(OperatorKind.AND, " and ");
		expected.put(OperatorKind.OR, " or ");
		expected.put(OperatorKind.EQ, "==");
		expected.put(OperatorKind.GT, ">");
		expected.put(OperatorKind.GT_E, ">=");
		expected.put(OperatorKind.IN, " in ");
		expected.put(OperatorKind.IS, " is ");
		expected.put(OperatorKind.IS_NOT, " is not ");
		expected.put(OperatorKind.LT, "<");
		expected.put(OperatorKind.LT_E, "<=");
		expected.put(OperatorKind.NOT_EQ, "!=");
		expected.put(OperatorKind.NOT_IN, " not in ");
		expected.put(OperatorKind.AUG_LOAD, "<AugLoad>");
		expected.put(OperatorKind.AUG_STORE, "<AugStore>");
		expected.put(OperatorKind.DEL, "<Del>");
		expected.put(OperatorKind.LOAD, "<Load>");
		expected.put(OperatorKind.PARAM, "<Param>");
		expected.put(OperatorKind.STORE, "<Store>");
		expected.put(OperatorKind.INVERT, "~");
		expected.put(OperatorKind.NOT, " not ");
		expected.put(OperatorKind.U_ADD, "+");
		expected.put(OperatorKind.U_SUB, "-");
		return expected;
	}

	@Test
	void testEveryTabledOperatorRendersItsSpellingInBothModes() {
		OperatorTable lenient = new OperatorTable(false);
		OperatorTable strict = new OperatorTable(true);
		for (Map.Entry<OperatorKind, String> entry : expectedSpellings().entrySet()) {
			Assertions.assertEquals(entry.getValue(), lenient.spelling(entry.getKey()), entry.getKey().name());
			Assertions.assertEquals(entry.getValue(), strict.spelling(entry.getKey()), entry.getKey().name());
		}
	}

	@Test
	void testOnlyMatMultLacksSpelling() {
		for (OperatorKind operator : OperatorKind.values()) {
			Assertions.assertEquals(operator != OperatorKind.MAT_MULT, OperatorTable.hasSpelling(operator),
					operator.name());
		}
	}

	@Test
	void testMissingOperatorRendersPlaceholderWhenLenient() {
		Assertions.assertEquals("<MatMult>", new OperatorTable(false).spelling(OperatorKind.MAT_MULT));
	}

	@Test
	void testMissingOperatorThrowsWhenStrict() {
		UnsupportedOperatorException e = Assertions.assertThrows(UnsupportedOperatorException.class,
				() -> new OperatorTable(true).spelling(OperatorKind.MAT_MULT));
		Assertions.assertEquals(OperatorKind.MAT_MULT, e.getOperator());
		Assertions.assertTrue(e.getMessage().contains("MatMult"));
	}
}
