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
package com.tomaszrup.pycoffee;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.pycoffee.compiler.lexer.LexException;
import com.tomaszrup.pycoffee.compiler.parser.PythonSyntaxException;
import com.tomaszrup.pycoffee.config.RendererOptionsParser;

class PythonToCoffeeScriptTests {

	private final PythonToCoffeeScript converter = new PythonToCoffeeScript();

	// --- Conversion ---

	@Test
	void testFunction() {
		Assertions.assertEquals("f = (a, b=1) ->\n    return a+b\n",
				converter.convert("def f(a, b=1):\n    return a+b\n"));
	}

	@Test
	void testClassWithMethod() {
		Assertions.assertEquals("class C extends Base\n    m: (x) ->\n        return @x\n",
				converter.convert("class C(Base):\n    def m(self, x):\n        return self.x\n"));
	}

	@Test
	void testCommentBetweenStatements() {
		Assertions.assertEquals("x=1\n# note\ny=2\n", converter.convert("x = 1\n# note\ny = 2\n"));
	}

	@Test
	void testImport() {
		Assertions.assertEquals("pass # import os\n", PythonToCoffeeScript.convertSource("import os\n"));
	}

	@Test
	void testChainedComparison() {
		Assertions.assertEquals("a<b<c\n", converter.convert("a < b < c\n"));
	}

	@Test
	void testEmptySource() {
		Assertions.assertEquals("", converter.convert(""));
	}

	@Test
	void testSourceWithoutFinalNewline() {
		Assertions.assertEquals("x=1\n", converter.convert("x = 1"));
	}

	@Test
	void testOptionsFromJson() {
		PythonToCoffeeScript twoSpaces = new PythonToCoffeeScript(RendererOptionsParser.parse("{\"indentSize\": 2}"));
		Assertions.assertEquals("f = ->\n  return 1\n", twoSpaces.convert("def f():\n    return 1\n"));
	}

	@Test
	void testSampleModule() {
		String source = "# Module docstring comment\n"
				+ "import os\n"
				+ "\n"
				+ "\n"
				+ "class Greeter(object):\n"
				+ "    \"\"\"Says hello.\"\"\"\n"
				+ "\n"
				+ "    def __init__(self, name):\n"
				+ "        self.name = name  # remember\n"
				+ "\n"
				+ "    # greeting\n"
				+ "    def greet(self, loud=False):\n"
				+ "        msg = 'Hello, ' + self.name\n"
				+ "        if loud:\n"
				+ "            return msg.upper()\n"
				+ "        return msg\n"
				+ "\n"
				+ "\n"
				+ "def main():\n"
				+ "    g = Greeter('world')\n"
				+ "    print(g.greet(True))\n";
		String expected = "# Module docstring comment\n"
				+ "pass # import os\n"
				+ "\n"
				+ "\n"
				+ "class Greeter extends object\n"
				+ "    \"\"\"Says hello.\"\"\"\n"
				+ "\n"
				+ "    __init__: (name) ->\n"
				+ "        @name=name # remember\n"
				+ "\n"
				+ "    # greeting\n"
				+ "    greet: (loud=False) ->\n"
				+ "        msg='Hello, '+@name\n"
				+ "        if loud:\n"
				+ "            return msg.upper()\n"
				+ "        return msg\n"
				+ "\n"
				+ "\n"
				+ "main = ->\n"
				+ "    g=Greeter('world')\n"
				+ "    print(g.greet(True))\n";
		Assertions.assertEquals(expected, converter.convert(source));
	}

	// --- Failures ---

	@Test
	void testUnterminatedBracketFails() {
		Assertions.assertThrows(LexException.class, () -> converter.convert("x = (\n"));
	}

	@Test
	void testSyntaxErrorCarriesLine() {
		PythonSyntaxException e = Assertions.assertThrows(PythonSyntaxException.class,
				() -> converter.convert("x = 1\ndef 1():\n    pass\n"));
		Assertions.assertEquals(2, e.getLineNumber());
	}

	@Test
	void testConvertOrNullReturnsNullOnFailure() {
		Assertions.assertNull(converter.convertOrNull("broken.py", "def 1():\n    pass\n"));
		Assertions.assertNull(converter.convertOrNull("async.py", "async def f():\n    pass\n"));
	}

	@Test
	void testConvertOrNullReturnsText() {
		Assertions.assertEquals("x=1\n", converter.convertOrNull("ok.py", "x = 1\n"));
	}
}
