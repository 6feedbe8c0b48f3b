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

import static org.arcscript.Arcscript.logD;

import java.util.HashMap;

/**
 * This function is used by ArcscriptTest.java to test both that host functions can be registered and that they can
 * read and write host storage from scripts.
 * <pre>
 * store(key)          the stored value, null if none
 * store(key, value)   stores the value, returns it
 * </pre>
 *
 * @version 1.0
 * @since 1.0
 */
public class ArcscriptTestFunction implements Arcscript.Function {
	private static final String LOG_TAG = ArcscriptTestFunction.class.getSimpleName ();
	static final String NAME = "store";

	private boolean DEBUG = false;
	private HashMap<String, Value> backingStore; // An in-memory storage pool for our testing
	private int calls = 0;

	/**
	 * Constructor, add some test values to the backing store
	 */
	public ArcscriptTestFunction () {
		reset ();
	}

	/**
	 * Resets the backing store
	 */
	public void reset () {
		if (DEBUG)
			logD (LOG_TAG, "Resetting backing store");

		backingStore = new HashMap<String, Value> ();
		backingStore.put ("foo", Value.of ("bar"));
		calls = 0;
	}

	public Value call (Arcscript arcscript, Arguments arguments) {
		++calls;

		if (arguments.size () < 1 || arguments.size () > 2)
			throw new EvaluationException (ErrorType.EXECUTION_ERROR, NAME + "() takes a key and an optional value");

		String key = arguments.name (0);

		if (arguments.size () == 1) {
			Value value = backingStore.get (key);

			if (DEBUG)
				logD (LOG_TAG, "Read " + key + "=" + value);

			return value;
		}

		Value value = arguments.value (1);
		backingStore.put (key, value);

		if (DEBUG)
			logD (LOG_TAG, "Wrote " + key + "=" + value);

		return value;
	}

	/**
	 * @return How often scripts called this function since the last reset
	 */
	public int calls () {
		return calls;
	}

	public Value stored (String key) {
		return backingStore.get (key);
	}
}
