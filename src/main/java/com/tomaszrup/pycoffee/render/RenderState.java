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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Indent level and enclosing scopes of one render pass.
 */
public class RenderState {

	public enum ScopeKind {
		CLASS,
		FUNCTION
	}

	private static final class Scope {
		private final ScopeKind kind;
		private final String name;

		private Scope(ScopeKind kind, String name) {
			this.kind = kind;
			this.name = name;
		}
	}

	private final Deque<Scope> scopes = new ArrayDeque<>();
	private int indentLevel;

	public int getIndentLevel() {
		return indentLevel;
	}

	public void enterBlock() {
		indentLevel++;
	}

	public void exitBlock() {
		if (indentLevel == 0) {
			throw new IllegalStateException("indent level is already 0");
		}
		indentLevel--;
	}

	public void pushScope(ScopeKind kind, String name) {
		scopes.push(new Scope(kind, name));
	}

	public void popScope() {
		if (scopes.isEmpty()) {
			throw new IllegalStateException("no scope to pop");
		}
		scopes.pop();
	}

	/**
	 * Whether rendering is inside any class or function body.
	 */
	public boolean inScope() {
		return !scopes.isEmpty();
	}

	/**
	 * Whether the innermost enclosing scope is a class body.
	 */
	public boolean inClassScope() {
		return !scopes.isEmpty() && scopes.peek().kind == ScopeKind.CLASS;
	}

	/**
	 * Names of the enclosing scopes, outermost first.
	 */
	public List<String> getScopeNames() {
		List<String> names = new ArrayList<>();
		Iterator<Scope> it = scopes.descendingIterator();
		while (it.hasNext()) {
			names.add(it.next().name);
		}
		return names;
	}

	/**
	 * Prefix {@code text} with {@code unit} once per indent level, keeping
	 * any leading line breaks in front of the prefix.
	 */
	public String indent(String text, String unit) {
		int breaks = 0;
		while (breaks < text.length() && text.charAt(breaks) == '\n') {
			breaks++;
		}
		return text.substring(0, breaks) + unit.repeat(indentLevel) + text.substring(breaks);
	}
}
