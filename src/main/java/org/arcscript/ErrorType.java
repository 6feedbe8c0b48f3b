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
 * Kinds of problem the engine reports through {@link Arcscript#diagnosticsGet()}
 *
 * @version 1.0
 * @since 1.0
 */
public enum ErrorType {
	/** Malformed expression syntax, the expression yields null */
	PARSE_ERROR,

	/** Runtime failure such as division by zero or bad operand types, the expression yields null */
	EXECUTION_ERROR,

	/** Unmatched endif, dangling elseif/else or a missing endif */
	MALFORMED_CONTROL_FLOW,

	/** Read of a variable which is not in the store, or reset of an unknown name */
	UNKNOWN_VARIABLE,

	/** Write to a shadow variable */
	READ_ONLY_VARIABLE,

	/** Call to a function which is neither built in nor registered */
	UNKNOWN_FUNCTION,

	/** Branch or jumper chain that loops or runs past the hop limit */
	CYCLIC_GRAPH
}
