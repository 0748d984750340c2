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
package com.tomaszrup.pycoffee.compiler.lexer;

import java.util.Comparator;
import java.util.Objects;

/**
 * A position in Python source: 1-based row, 0-based column.
 */
public final class SourcePosition {

	public static final Comparator<SourcePosition> COMPARATOR = (SourcePosition p1, SourcePosition p2) -> {
		if (p1.getRow() != p2.getRow()) {
			return p1.getRow() - p2.getRow();
		}
		return p1.getColumn() - p2.getColumn();
	};

	private final int row;
	private final int column;

	public SourcePosition(int row, int column) {
		this.row = row;
		this.column = column;
	}

	public int getRow() {
		return row;
	}

	public int getColumn() {
		return column;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof SourcePosition)) return false;
		SourcePosition other = (SourcePosition) o;
		return row == other.row && column == other.column;
	}

	@Override
	public int hashCode() {
		return Objects.hash(row, column);
	}

	@Override
	public String toString() {
		return "(" + row + "," + column + ")";
	}
}
