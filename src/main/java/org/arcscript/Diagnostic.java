/*
 * Copyright 2017-18 White Label Dev Ltd, and contributors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.arcscript;

/**
 * A single reported problem, kept by the engine until {@link Arcscript#diagnosticsClear()}
 *
 * @version 1.0
 * @since 1.0
 */
public final class Diagnostic {
	private final ErrorType type;
	private final int lineNumber;
	private final String message;

	Diagnostic (ErrorType type, int lineNumber, String message) {
		this.type = type;
		this.lineNumber = lineNumber;
		this.message = message;
	}

	public ErrorType type () {
		return type;
	}

	/**
	 * @return The 1-based script line the problem was found on, or 0 if not tied to a line
	 */
	public int lineNumber () {
		return lineNumber;
	}

	public String message () {
		return message;
	}

	@Override
	public String toString () {
		return (lineNumber > 0 ? "Line " + lineNumber + ": " : "") + message;
	}
}
