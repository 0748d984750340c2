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
package com.tomaszrup.pycoffee.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonObject;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

class RendererOptionsParserTests {

	// --- Defaults ---

	@Test
	void testEmptyObjectGivesDefaults() {
		Assertions.assertEquals(RendererOptions.defaults(), RendererOptionsParser.parse("{}"));
	}

	@Test
	void testNullObjectGivesDefaults() {
		Assertions.assertEquals(RendererOptions.defaults(), RendererOptionsParser.parse((JsonObject) null));
	}

	@Test
	void testDefaultValues() {
		RendererOptions options = RendererOptions.defaults();
		Assertions.assertEquals("    ", options.getIndentUnit());
		Assertions.assertFalse(options.isStrictOperators());
		Assertions.assertEquals("self", options.getReceiverName());
		Assertions.assertEquals("@", options.getReceiverSigil());
	}

	// --- Recognized options ---

	@Test
	void testAllOptions() {
		RendererOptions options = RendererOptionsParser.parse(
				"{\"indentSize\": 2, \"strictOperators\": true, \"receiverName\": \"this\", \"receiverSigil\": \"$\"}");
		Assertions.assertEquals("  ", options.getIndentUnit());
		Assertions.assertTrue(options.isStrictOperators());
		Assertions.assertEquals("this", options.getReceiverName());
		Assertions.assertEquals("$", options.getReceiverSigil());
	}

	@Test
	void testIndentUnitTakesPrecedenceOverSize() {
		RendererOptions options = RendererOptionsParser.parse("{\"indentUnit\": \"\\t\", \"indentSize\": 2}");
		Assertions.assertEquals("\t", options.getIndentUnit());
	}

	@Test
	void testReceiverNameIsTrimmed() {
		Assertions.assertEquals("me", RendererOptionsParser.parse("{\"receiverName\": \"  me \"}").getReceiverName());
	}

	@Test
	void testUnknownKeysIgnored() {
		Assertions.assertEquals(RendererOptions.defaults(), RendererOptionsParser.parse("{\"colour\": \"blue\"}"));
	}

	// --- Malformed values keep defaults ---

	@Test
	void testNonPositiveIndentSizeKeepsDefault() {
		Assertions.assertEquals("    ", RendererOptionsParser.parse("{\"indentSize\": 0}").getIndentUnit());
		Assertions.assertEquals("    ", RendererOptionsParser.parse("{\"indentSize\": -3}").getIndentUnit());
	}

	@Test
	void testNonNumericIndentSizeKeepsDefault() {
		Assertions.assertEquals("    ", RendererOptionsParser.parse("{\"indentSize\": \"wide\"}").getIndentUnit());
	}

	@Test
	void testNonWhitespaceIndentUnitKeepsDefault() {
		Assertions.assertEquals("    ", RendererOptionsParser.parse("{\"indentUnit\": \"ab\"}").getIndentUnit());
		Assertions.assertEquals("    ", RendererOptionsParser.parse("{\"indentUnit\": \"\"}").getIndentUnit());
	}

	@Test
	void testBlankReceiverKeepsDefault() {
		RendererOptions options = RendererOptionsParser.parse("{\"receiverName\": \"  \", \"receiverSigil\": \"\"}");
		Assertions.assertEquals("self", options.getReceiverName());
		Assertions.assertEquals("@", options.getReceiverSigil());
	}

	@Test
	void testNestedObjectValueIgnored() {
		Assertions.assertEquals(RendererOptions.defaults(),
				RendererOptionsParser.parse("{\"strictOperators\": {\"value\": true}}"));
	}

	// --- Invalid input ---

	@Test
	void testInvalidJsonThrows() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> RendererOptionsParser.parse("{indentSize"));
	}

	@Test
	void testNonObjectThrows() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> RendererOptionsParser.parse("[1, 2]"));
	}

	// --- Log level ---

	@Test
	void testLogLevelChangesRootLogger() {
		Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		Level previous = root.getLevel();
		try {
			RendererOptionsParser.parse("{\"logLevel\": \"debug\"}");
			Assertions.assertEquals(Level.DEBUG, root.getLevel());
		} finally {
			root.setLevel(previous);
		}
	}

	@Test
	void testUnknownLogLevelKeepsRootLevel() {
		Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		Level previous = root.getLevel();
		try {
			RendererOptionsParser.applyLogLevel("LOUD");
			Assertions.assertEquals(previous, root.getLevel());
		} finally {
			root.setLevel(previous);
		}
	}

	// --- Value object ---

	@Test
	void testWithMethodsReturnNewInstances() {
		RendererOptions defaults = RendererOptions.defaults();
		RendererOptions strict = defaults.withStrictOperators(true);
		Assertions.assertNotSame(defaults, strict);
		Assertions.assertFalse(defaults.isStrictOperators());
		Assertions.assertNotEquals(defaults, strict);
		Assertions.assertEquals(strict, RendererOptions.defaults().withStrictOperators(true));
		Assertions.assertEquals(strict.hashCode(), RendererOptions.defaults().withStrictOperators(true).hashCode());
	}
}
