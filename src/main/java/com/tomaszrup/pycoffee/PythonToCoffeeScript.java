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
package com.tomaszrup.pycoffee;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.pycoffee.compiler.ast.ModuleNode;
import com.tomaszrup.pycoffee.compiler.lexer.PythonTokenizer;
import com.tomaszrup.pycoffee.compiler.lexer.Token;
import com.tomaszrup.pycoffee.compiler.parser.PythonParser;
import com.tomaszrup.pycoffee.config.RendererOptions;
import com.tomaszrup.pycoffee.render.CoffeeScriptRenderer;

/**
 * Converts Python source text to CoffeeScript: tokenize, parse, render.
 */
public class PythonToCoffeeScript {

	private static final Logger logger = LoggerFactory.getLogger(PythonToCoffeeScript.class);

	private final CoffeeScriptRenderer renderer;

	public PythonToCoffeeScript() {
		this(RendererOptions.defaults());
	}

	public PythonToCoffeeScript(RendererOptions options) {
		this.renderer = new CoffeeScriptRenderer(options);
	}

	/**
	 * Convert one file's source text.
	 *
	 * @throws ConversionException if the source cannot be tokenized or
	 *         parsed, or uses a construct with no CoffeeScript rendering
	 */
	public String convert(String source) {
		List<Token> tokens = PythonTokenizer.tokenize(source);
		ModuleNode module = PythonParser.parse(tokens);
		return renderer.render(module, source, tokens);
	}

	/**
	 * Convert with default options.
	 */
	public static String convertSource(String source) {
		return new PythonToCoffeeScript().convert(source);
	}

	/**
	 * Convert a file's source, logging instead of throwing on failure so a
	 * driver can continue with its remaining files.
	 *
	 * @return the converted text, or {@code null} if conversion failed
	 */
	public String convertOrNull(String name, String source) {
		try {
			return convert(source);
		} catch (ConversionException e) {
			logger.error("Failed to convert {}: {}", name, e.getMessage());
			return null;
		}
	}
}
