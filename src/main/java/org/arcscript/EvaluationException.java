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
 * Raised by the lexer, parser and expression tree; never escapes {@link Arcscript}, which turns it into a
 * {@link Diagnostic} and a safe default value.
 *
 * @version 1.0
 * @since 1.0
 */
public class EvaluationException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final ErrorType type;

	public EvaluationException (ErrorType type, String message) {
		super (message);
		this.type = type;
	}

	public ErrorType type () {
		return type;
	}
}
