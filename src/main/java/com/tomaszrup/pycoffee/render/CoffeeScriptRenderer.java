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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.pycoffee.compiler.ast.ModuleNode;
import com.tomaszrup.pycoffee.compiler.lexer.Token;
import com.tomaszrup.pycoffee.config.RendererOptions;
import com.tomaszrup.pycoffee.sync.TokenSync;

/**
 * Renders a parsed Python module as CoffeeScript-flavoured text.
 *
 * <p>The syntax tree has no comments, blank lines or original string
 * spellings, so each call indexes the module's token stream with a fresh
 * {@link TokenSync} and recovers them while walking the tree. Output is a
 * best-effort transliteration meant for manual cleanup.
 *
 * <p>A renderer holds no per-file state: separate files may be rendered
 * concurrently through the same instance.
 */
public class CoffeeScriptRenderer {

	private final RendererOptions options;
	private final OperatorTable operators;
	private final Logger logger;

	public CoffeeScriptRenderer() {
		this(RendererOptions.defaults());
	}

	public CoffeeScriptRenderer(RendererOptions options) {
		this(options, LoggerFactory.getLogger(CoffeeScriptRenderer.class));
	}

	/**
	 * @param logger receives diagnostics about degraded output, such as
	 *               malformed comparisons and unmatched string literals
	 */
	public CoffeeScriptRenderer(RendererOptions options, Logger logger) {
		this.options = options;
		this.operators = new OperatorTable(options.isStrictOperators());
		this.logger = logger;
	}

	/**
	 * Render {@code root}, the tree parsed from {@code rawText}, whose complete
	 * token stream (comments and line breaks included) is {@code tokens}.
	 *
	 * @throws com.tomaszrup.pycoffee.ConversionException if the tokens do not
	 *         fit the text, or the tree holds a construct with no rendering
	 */
	public String render(ModuleNode root, String rawText, List<Token> tokens) {
		return render(root, rawText, tokens, new RenderState());
	}

	String render(ModuleNode root, String rawText, List<Token> tokens, RenderState state) {
		TokenSync sync = new TokenSync(rawText, tokens);
		String result = new RenderPass(options, operators, logger, sync, state).visit(root);
		logger.debug("Rendered {} top-level statements into {} lines", root.getBody().size(),
				result.chars().filter(ch -> ch == '\n').count());
		return result;
	}
}
