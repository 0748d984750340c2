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

/**
 * Base class of every error that aborts the conversion of a single file.
 * Callers converting several files catch it per file and carry on with
 * the rest; no partial output of the failed file should be used.
 */
public class ConversionException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int lineNumber;

	public ConversionException(String message, int lineNumber) {
		super(lineNumber > 0 ? message + " (line " + lineNumber + ")" : message);
		this.lineNumber = lineNumber;
	}

	public ConversionException(String message) {
		this(message, 0);
	}

	/**
	 * @return the 1-based source line the error refers to, or {@code 0}
	 *         when it is not tied to a line
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
