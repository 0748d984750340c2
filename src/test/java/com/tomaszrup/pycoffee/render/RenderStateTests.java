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

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RenderStateTests {

	private RenderState state;

	@BeforeEach
	void setup() {
		state = new RenderState();
	}

	@Test
	void testNewStateIsAtTopLevel() {
		Assertions.assertEquals(0, state.getIndentLevel());
		Assertions.assertFalse(state.inScope());
		Assertions.assertFalse(state.inClassScope());
		Assertions.assertTrue(state.getScopeNames().isEmpty());
	}

	@Test
	void testIndentPrefixesAfterLeadingLineBreaks() {
		state.enterBlock();
		state.enterBlock();
		Assertions.assertEquals("\n\n        x\n", state.indent("\n\nx\n", "    "));
		Assertions.assertEquals("\t\t", state.indent("", "\t"));
	}

	@Test
	void testEnterAndExitRestoreLevel() {
		state.enterBlock();
		state.enterBlock();
		state.exitBlock();
		state.exitBlock();
		Assertions.assertEquals(0, state.getIndentLevel());
	}

	@Test
	void testExitBelowZeroFails() {
		Assertions.assertThrows(IllegalStateException.class, () -> state.exitBlock());
	}

	@Test
	void testInnermostScopeDecidesClassScope() {
		state.pushScope(RenderState.ScopeKind.CLASS, "C");
		Assertions.assertTrue(state.inClassScope());
		state.pushScope(RenderState.ScopeKind.FUNCTION, "m");
		Assertions.assertFalse(state.inClassScope());
		Assertions.assertTrue(state.inScope());
		Assertions.assertEquals(List.of("C", "m"), state.getScopeNames());
		state.popScope();
		Assertions.assertTrue(state.inClassScope());
	}

	@Test
	void testPopWithoutScopeFails() {
		Assertions.assertThrows(IllegalStateException.class, () -> state.popScope());
	}
}
