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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The functions every engine starts with
 * <pre>
 * sqr(x)  sqrt(x)  abs(x)  round(x)  min(a, ...)  max(a, ...)
 * random()                 float in [0, 1)
 * roll(max, multiplier=1)  whole number in [1, max], times multiplier
 * visits(id="")            arrivals at an element, default the one being evaluated
 * reset(names...)          back to initial values
 * resetAll(exclude...)     every variable except those named
 * resetVisits()            forget all arrivals
 * </pre>
 *
 * @version 1.0
 * @since 1.0
 */
final class BuiltIns {
	private static final String LOG_TAG = BuiltIns.class.getSimpleName ();
	private static final boolean DEBUG = false;

	private BuiltIns () {
	}

	/**
	 * Adds the built-in functions to an engine
	 *
	 * @param arcscript The engine
	 */
	static void install (Arcscript arcscript) {
		arcscript.functionAdd ("sqr", new Arcscript.Function () {
			public Value call (Arcscript arcscript, Arguments arguments) {
				Value x = arguments.value (0);
				return Value.multiply (x, x);
			}
		});

		arcscript.functionAdd ("sqrt", new Arcscript.Function () {
			public Value call (Arcscript arcscript, Arguments arguments) {
				double x = arguments.value (0).asDouble ();
				if (x < 0)
					throw new EvaluationException (ErrorType.EXECUTION_ERROR, "sqrt() of a negative number");

				return Value.of (Math.sqrt (x));
			}
		});

		arcscript.functionAdd ("abs", new Arcscript.Function () {
			public Value call (Arcscript arcscript, Arguments arguments) {
				Value x = arguments.value (0);
				return Value.compare (x, Value.ZERO) < 0 ? Value.negate (x) : Value.subtract (x, Value.ZERO);
			}
		});

		arcscript.functionAdd ("round", new Arcscript.Function () {
			public Value call (Arcscript arcscript, Arguments arguments) {
				return Value.of (Math.round (arguments.value (0).asDouble ()));
			}
		});

		arcscript.functionAdd ("min", new Arcscript.Function () {
			public Value call (Arcscript arcscript, Arguments arguments) {
				return extreme (arguments, "min", -1);
			}
		});

		arcscript.functionAdd ("max", new Arcscript.Function () {
			public Value call (Arcscript arcscript, Arguments arguments) {
				return extreme (arguments, "max", 1);
			}
		});

		arcscript.functionAdd ("random", new Arcscript.Function () {
			public Value call (Arcscript arcscript, Arguments arguments) {
				return Value.of (arcscript.randomGet ().nextDouble ());
			}
		});

		arcscript.functionAdd ("roll", new Arcscript.Function () {
			public Value call (Arcscript arcscript, Arguments arguments) {
				long max = arguments.value (0).asLong ();
				long multiplier = arguments.value (1, Value.of (1)).asLong ();

				if (max < 1 || max > Integer.MAX_VALUE)
					throw new EvaluationException (ErrorType.EXECUTION_ERROR, "roll() needs a maximum from 1 to " + Integer.MAX_VALUE + ", got " + max);

				return Value.of ((1 + arcscript.randomGet ().nextInt ((int) max)) * multiplier);
			}
		});

		arcscript.functionAdd ("visits", new Arcscript.Function () {
			public Value call (Arcscript arcscript, Arguments arguments) {
				String key = (arguments.size () > 0 ? arguments.name (0) : "");
				if (key.isEmpty ())
					key = arcscript.stateGet ().currentElementId ();

				return Value.of (key == null ? 0 : arcscript.visitsGet (key));
			}
		});

		arcscript.functionAdd ("reset", new Arcscript.Function () {
			public Value call (Arcscript arcscript, Arguments arguments) {
				for (String name : arguments.names ()) {
					if (!arcscript.variableHas (name)) {
						arcscript.error (ErrorType.UNKNOWN_VARIABLE, "Cannot reset unknown variable: " + name);
						continue;
					}

					resetVariable (arcscript, name);
				}

				return Value.NULL;
			}
		});

		arcscript.functionAdd ("resetAll", new Arcscript.Function () {
			public Value call (Arcscript arcscript, Arguments arguments) {
				Set<String> excluded = new HashSet<String> (arguments.names ());

				for (String name : new ArrayList<String> (arcscript.variableStoreGet ().keySet ())) {
					if (excluded.contains (name) || arcscript.stateGet ().shadows ().containsKey (name))
						continue;

					resetVariable (arcscript, name);
				}

				return Value.NULL;
			}
		});

		arcscript.functionAdd ("resetVisits", new Arcscript.Function () {
			public Value call (Arcscript arcscript, Arguments arguments) {
				if (DEBUG)
					Arcscript.logD (LOG_TAG, "Clearing " + arcscript.stateGet ().visits ().size () + " visit counters");

				arcscript.stateGet ().visitsClear ();
				return Value.NULL;
			}
		});
	}

	private static void resetVariable (Arcscript arcscript, String name) {
		Value initial = arcscript.initialValue (name);
		if (initial == null) {
			arcscript.error (ErrorType.UNKNOWN_VARIABLE, "No initial value for variable: " + name);
			return;
		}

		if (DEBUG)
			Arcscript.logV (LOG_TAG, "Resetting " + name + "=" + initial);

		arcscript.variableWrite (name, initial);
	}

	/**
	 * @param direction -1 for the smallest argument, 1 for the largest
	 */
	private static Value extreme (Arguments arguments, String name, int direction) {
		List<Value> values = arguments.values ();
		if (values.isEmpty ())
			throw new EvaluationException (ErrorType.EXECUTION_ERROR, name + "() needs at least one argument");

		Value best = values.get (0);
		for (int i = 1, j = values.size (); i < j; ++i) {
			if (Value.compare (values.get (i), best) * direction > 0)
				best = values.get (i);
		}

		return best;
	}
}
