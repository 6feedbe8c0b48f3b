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

import java.util.HashMap;

/**
 * The mutable state of one story session: variables, shadow variables, visit counts and the element being evaluated
 * <p>A single instance is shared by the interpreter, the choice resolver and the host. Nothing in the engine ever
 * copies it, so a write made by one line is seen by the next read in the same turn.</p>
 *
 * @version 1.0
 * @since 1.0
 */
public final class StoryState {
	private HashMap<String, Value> variables = new HashMap<String, Value> ();
	private final HashMap<String, Value> initialValues = new HashMap<String, Value> ();
	private final HashMap<String, Arcscript.ShadowVariable> shadows = new HashMap<String, Arcscript.ShadowVariable> ();
	private final HashMap<String, Integer> visits = new HashMap<String, Integer> ();
	private String currentElementId = null;

	/**
	 * @return The live variable store (not a copy)
	 */
	public HashMap<String, Value> variables () {
		return variables;
	}

	/**
	 * Replaces the variable store, for example with one restored by the host
	 *
	 * @param variables Map of name to value, used as is
	 */
	public void variables (HashMap<String, Value> variables) {
		this.variables = (variables == null ? new HashMap<String, Value> () : variables);
	}

	/**
	 * @return Declared starting values, used by the default {@link Arcscript.InitialValues}
	 */
	public HashMap<String, Value> initialValues () {
		return initialValues;
	}

	public HashMap<String, Arcscript.ShadowVariable> shadows () {
		return shadows;
	}

	public HashMap<String, Integer> visits () {
		return visits;
	}

	/**
	 * @param key Element id or cleaned element title
	 * @return Number of arrivals recorded for the key, 0 if never visited
	 */
	public int visitsGet (String key) {
		Integer count = visits.get (key);
		return count == null ? 0 : count.intValue ();
	}

	/**
	 * Counts one arrival for the key
	 *
	 * @param key Element id or cleaned element title
	 */
	public void visitsIncrement (String key) {
		visits.put (key, Integer.valueOf (visitsGet (key) + 1));
	}

	public void visitsClear () {
		visits.clear ();
	}

	public String currentElementId () {
		return currentElementId;
	}

	public void currentElementId (String currentElementId) {
		this.currentElementId = currentElementId;
	}
}
