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

import java.util.List;

/**
 * Parameter list of a function or lambda. {@code defaults} belong to the last
 * positional parameters; {@code kwDefaults} is parallel to {@code kwonlyArgs}
 * and holds {@code null} where a keyword-only parameter has no default.
 */
public class ArgumentsNode extends PyNode {

	private final List<ArgNode> args;
	private final List<PyNode> defaults;
	private final ArgNode vararg;
	private final List<ArgNode> kwonlyArgs;
	private final List<PyNode> kwDefaults;
	private final ArgNode kwarg;

	public ArgumentsNode(int lineNumber, List<ArgNode> args, List<PyNode> defaults, ArgNode vararg, List<ArgNode> kwonlyArgs, List<PyNode> kwDefaults, ArgNode kwarg) {
		super(NodeKind.ARGUMENTS, lineNumber);
		this.args = args;
		this.defaults = defaults;
		this.vararg = vararg;
		this.kwonlyArgs = kwonlyArgs;
		this.kwDefaults = kwDefaults;
		this.kwarg = kwarg;
	}

	public List<ArgNode> getArgs() {
		return args;
	}

	public List<PyNode> getDefaults() {
		return defaults;
	}

	public ArgNode getVararg() {
		return vararg;
	}

	public List<ArgNode> getKwonlyArgs() {
		return kwonlyArgs;
	}

	public List<PyNode> getKwDefaults() {
		return kwDefaults;
	}

	public ArgNode getKwarg() {
		return kwarg;
	}
}
