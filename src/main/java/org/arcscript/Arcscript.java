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

import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Arcscript for Java
 * <p>Evaluates Arcscript content (text with conditionals, assignments, <code>show()</code> calls and
 * <code>{expr}</code> interpolation) and conditions against one shared {@link StoryState}. Problems never
 * escape as exceptions: each is recorded as a {@link Diagnostic}, the latest also in {@link #stderr}, and
 * evaluation carries on with a safe default.</p>
 *
 * @version 1.0
 * @since 1.0
 */
public class Arcscript {
	// Public information
	public static final int VERSION_MAJOR = 1;
	public static final int VERSION_MINOR = 0;

	// Internal settings
	private static final String LOG_TAG = Arcscript.class.getSimpleName ();
	private static final boolean DEBUG = false;

	// Engine defaults
	private static final int decimalScaleDefault = 3;
	private static final int resolveDepthDefault = 32;
	private static final int diagnosticsLimitDefault = 256;

	private int decimalScale = decimalScaleDefault;
	private int resolveDepth = resolveDepthDefault;
	private int diagnosticsLimit = diagnosticsLimitDefault;
	private DecimalFormat decimalFormat;

	// Engine internals
	private StoryState state = new StoryState ();
	private HashMap<String, Function> functions = null;
	private VariableObserver observer = null;
	private InitialValues initialValues = null;
	private Random random = new Random ();
	private List<Diagnostic> diagnostics = new ArrayList<Diagnostic> ();
	private int lineNumber = 0;

	/** Text of the most recently reported problem, populated with {@link #error(ErrorType, String)} */
	public String stderr = "";

	/**
	 * A function callable from scripts, built in or registered by the host with {@link #functionAdd(String, Function)}
	 */
	public interface Function {
		/**
		 * @param arcscript The calling engine, giving access to variables, visits and formatting
		 * @param arguments The call arguments, evaluated on demand
		 * @return The result, null is treated as {@link Value#NULL}
		 * @throws EvaluationException To report a failure, the call then yields null
		 */
		Value call (Arcscript arcscript, Arguments arguments);
	}

	/**
	 * A read-only variable whose value is computed by the host on every read
	 */
	public interface ShadowVariable {
		Value read ();
	}

	/**
	 * Single listener told about every successful variable write made by a script
	 */
	public interface VariableObserver {
		void variableChanged (String name, Value value);
	}

	/**
	 * Supplies the starting value of a variable for <code>reset()</code> and <code>resetAll()</code>
	 */
	public interface InitialValues {
		/**
		 * @param name Variable name
		 * @return Initial value, or null if the variable has none
		 */
		Value initialValue (String name);
	}

	/**
	 * Constructor, prepare built-in functions
	 */
	public Arcscript () {
		if (DEBUG)
			logD (LOG_TAG, "Instantiating Arcscript");

		scaleSet (decimalScaleDefault);
		functionRemoveAll ();
	}

	/**
	 * Puts every variable back to its initial value, clears visits and forgets reported problems
	 */
	public void reset () {
		lineNumber = 0;
		diagnosticsClear ();

		for (String name : new ArrayList<String> (state.variables ().keySet ())) {
			if (state.shadows ().containsKey (name))
				continue;

			Value value = initialValue (name);
			if (value != null)
				state.variables ().put (name, value);
		}

		state.visitsClear ();

		if (DEBUG)
			logD (LOG_TAG, "Arcscript engine reset");
	}

	/**
	 * @return The shared session state
	 */
	public StoryState stateGet () {
		return state;
	}

	/**
	 * Replaces the session state, for example with one restored by the host
	 *
	 * @param state The state to use from now on
	 */
	public void stateSet (StoryState state) {
		this.state = (state == null ? new StoryState () : state);
	}

	/**
	 * Returns whether a variable is set
	 *
	 * @param name Name of variable
	 * @return True if the variable is in the store
	 */
	public boolean variableHas (String name) {
		return state.variables ().containsKey (name);
	}

	/**
	 * Gets a variable, shadow variables are computed
	 *
	 * @param name Name of variable
	 * @return Variable value or null if the variable is not set, {@link Value#NULL} if a shadow variable fails
	 */
	public Value variableGet (String name) {
		ShadowVariable shadow = state.shadows ().get (name);
		if (shadow != null) {
			try {
				return shadowRead (name, shadow);
			} catch (EvaluationException e) {
				error (e.type (), e.getMessage ());
				return Value.NULL;
			}
		}

		return state.variables ().get (name);
	}

	/**
	 * Sets a variable directly; the observer is not told and shadow variables are not protected
	 *
	 * @param name Name of variable
	 * @param value Content of variable
	 */
	public void variableSet (String name, Value value) {
		if (DEBUG)
			logV (LOG_TAG, "Setting variable: " + name + "=" + value);

		state.variables ().put (name, value == null ? Value.NULL : value);
	}

	/**
	 * Sets a variable
	 *
	 * @param name Name of variable
	 * @param value Content of variable
	 */
	public void variableSet (String name, long value) {
		variableSet (name, Value.of (value));
	}

	/**
	 * Sets a variable
	 *
	 * @param name Name of variable
	 * @param value Content of variable
	 */
	public void variableSet (String name, double value) {
		variableSet (name, Value.of (value));
	}

	/**
	 * Sets a variable
	 *
	 * @param name Name of variable
	 * @param value Content of variable
	 */
	public void variableSet (String name, boolean value) {
		variableSet (name, Value.of (value));
	}

	/**
	 * Sets a variable
	 *
	 * @param name Name of variable
	 * @param value Content of variable
	 */
	public void variableSet (String name, String value) {
		variableSet (name, Value.of (value));
	}

	/**
	 * Declares a variable, recording the value both as current and as the one <code>reset()</code> returns to
	 *
	 * @param name Name of variable
	 * @param value Initial content of variable
	 */
	public void variableDeclare (String name, Value value) {
		Value initial = (value == null ? Value.NULL : value);
		state.initialValues ().put (name, initial);
		variableSet (name, initial);
	}

	/**
	 * Unset a variable
	 *
	 * @param name Name of variable
	 */
	public void variableRemove (String name) {
		if (DEBUG)
			logV (LOG_TAG, "Removing variable: " + name);

		state.variables ().remove (name);
	}

	/**
	 * Retrieves the complete variable store, the live instance used by scripts
	 */
	public HashMap<String, Value> variableStoreGet () {
		return state.variables ();
	}

	/**
	 * Stores the complete variable store
	 *
	 * @param variables HashMap of name to value, used as is (not copied)
	 */
	public void variableStoreSet (HashMap<String, Value> variables) {
		if (DEBUG)
			logV (LOG_TAG, "Setting variable store with " + (variables == null ? 0 : variables.size ()) + " variables");

		state.variables (variables);
	}

	/**
	 * Reads a variable for a script, reporting unknown names
	 */
	Value variableRead (String name) {
		ShadowVariable shadow = state.shadows ().get (name);
		if (shadow != null)
			return shadowRead (name, shadow);

		Value value = state.variables ().get (name);
		if (value == null) {
			error (ErrorType.UNKNOWN_VARIABLE, "Unknown variable: " + name);
			return Value.NULL;
		}

		return value;
	}

	/**
	 * Writes a variable for a script, refusing shadow variables and telling the observer on success
	 *
	 * @return True if the store was changed
	 */
	boolean variableWrite (String name, Value value) {
		if (state.shadows ().containsKey (name))
			return error (ErrorType.READ_ONLY_VARIABLE, "Variable is read only: " + name);

		if (DEBUG)
			logV (LOG_TAG, "Writing variable: " + name + "=" + value);

		state.variables ().put (name, value);

		if (observer != null)
			observer.variableChanged (name, value);

		return true;
	}

	private Value shadowRead (String name, ShadowVariable shadow) {
		Value value;
		try {
			value = shadow.read ();
		} catch (EvaluationException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new EvaluationException (ErrorType.EXECUTION_ERROR, "Shadow variable " + name + " failed: " + e.getMessage ());
		}

		if (DEBUG)
			logV (LOG_TAG, "Shadow variable " + name + " read as " + value);

		return value == null ? Value.NULL : value;
	}

	/**
	 * Registers a shadow variable; reads call back to the host and writes from scripts are refused
	 * <p>A placeholder is put in the variable store when the name is not there yet, so the name resolves.</p>
	 *
	 * @param name Name of variable
	 * @param shadow Callback computing the value
	 */
	public void shadowAdd (String name, ShadowVariable shadow) {
		if (DEBUG)
			logD (LOG_TAG, "Adding shadow variable: " + name);

		state.shadows ().put (name, shadow);
		if (!state.variables ().containsKey (name))
			state.variables ().put (name, Value.NULL);
	}

	/**
	 * Removes a shadow variable, the placeholder stays in the store
	 *
	 * @param name Name of variable
	 * @return True if a shadow variable was removed
	 */
	public boolean shadowRemove (String name) {
		return state.shadows ().remove (name) != null;
	}

	/**
	 * Registers a function callable from scripts, replacing any built-in or earlier function of the same name
	 *
	 * @param name Function name as written in scripts
	 * @param function The implementation
	 * @return True if the function was added, false if the name is not a valid identifier
	 */
	public boolean functionAdd (String name, Function function) {
		if (name == null || function == null || !name.matches ("[A-Za-z_][A-Za-z0-9_]*"))
			return false;

		if (DEBUG)
			logD (LOG_TAG, "Adding function: " + name + (functions.containsKey (name) ? " (replacing)" : ""));

		functions.put (name, function);
		return true;
	}

	/**
	 * Removes a function
	 *
	 * @param name Function name
	 * @return True if the function was found and removed
	 */
	public boolean functionRemove (String name) {
		if (DEBUG)
			logD (LOG_TAG, "Removing function: " + name);

		return functions.remove (name) != null;
	}

	/**
	 * Removes all host functions (re-adds the built-in functions afterwards)
	 */
	public void functionRemoveAll () {
		if (DEBUG)
			logD (LOG_TAG, "Removing all functions");

		functions = new HashMap<String, Function> ();
		BuiltIns.install (this);
	}

	/**
	 * @param name Function name
	 * @return The function or null if there is none by that name
	 */
	public Function functionGet (String name) {
		return functions.get (name);
	}

	/**
	 * Sets the single observer told about script variable writes
	 *
	 * @param observer The observer, or null for none
	 */
	public void observerSet (VariableObserver observer) {
		this.observer = observer;
	}

	/**
	 * Sets where <code>reset()</code> and <code>resetAll()</code> get initial values from
	 *
	 * @param initialValues The provider, or null to use the values given to {@link #variableDeclare(String, Value)}
	 */
	public void initialValuesSet (InitialValues initialValues) {
		this.initialValues = initialValues;
	}

	/**
	 * @param name Variable name
	 * @return The initial value from the provider, or null if there is none
	 */
	public Value initialValue (String name) {
		if (initialValues != null)
			return initialValues.initialValue (name);

		return state.initialValues ().get (name);
	}

	/**
	 * Gets the decimal scale used when floats become text
	 *
	 * @return Number of decimal places used
	 */
	public int scaleGet () {
		return decimalScale;
	}

	/**
	 * Sets the decimal scale used when floats become text
	 *
	 * @param decimalScale Number of decimal places to use, negative for the default
	 */
	public void scaleSet (int decimalScale) {
		if (decimalScale < 0)
			decimalScale = decimalScaleDefault;

		this.decimalScale = decimalScale;
		decimalFormat = Value.decimalFormat (decimalScale);

		if (DEBUG)
			logD (LOG_TAG, "Set decimal scale=" + decimalScale + "; pattern=" + decimalFormat.toPattern ());
	}

	DecimalFormat decimalFormat () {
		return decimalFormat;
	}

	/**
	 * Text form of a value, floats formatted with the current scale
	 *
	 * @param value The value
	 * @return The text, empty for null
	 */
	public String format (Value value) {
		return value == null ? "" : value.asString (decimalFormat);
	}

	/**
	 * Gets the hop limit for branch and jumper chains
	 *
	 * @return Maximum number of hops
	 */
	public int resolveDepthGet () {
		return resolveDepth;
	}

	/**
	 * Sets the hop limit for branch and jumper chains
	 *
	 * @param resolveDepth Maximum number of hops, negative for the default
	 */
	public void resolveDepthSet (int resolveDepth) {
		this.resolveDepth = (resolveDepth < 0 ? resolveDepthDefault : resolveDepth);

		if (DEBUG)
			logD (LOG_TAG, "Set resolve depth=" + this.resolveDepth);
	}

	public Random randomGet () {
		return random;
	}

	/**
	 * @param random Source used by <code>random()</code> and <code>roll()</code>
	 */
	public void randomSet (Random random) {
		this.random = (random == null ? new Random () : random);
	}

	/**
	 * @param key Element id or cleaned element title
	 * @return Number of recorded arrivals
	 */
	public int visitsGet (String key) {
		return state.visitsGet (key);
	}

	/**
	 * Sets the element that <code>visits()</code> without arguments refers to
	 *
	 * @param elementId Element id, or null
	 */
	public void currentElementSet (String elementId) {
		state.currentElementId (elementId);
	}

	/**
	 * Evaluates Arcscript content and applies its assignments
	 *
	 * @param script Script text
	 * @return The produced text
	 */
	public String evaluate (String script) {
		return evaluate (script, false);
	}

	/**
	 * Evaluates Arcscript content
	 *
	 * @param script Script text
	 * @param suppressAssignments True to evaluate for display only, assignments are then parsed but not applied
	 * @return The produced text, problems are in {@link #diagnosticsGet()}
	 */
	public String evaluate (String script, boolean suppressAssignments) {
		if (script == null || script.isEmpty ())
			return "";

		int lineNumberOuter = lineNumber;
		try {
			return new BlockInterpreter (this, LineScanner.scan (script), suppressAssignments).run ();
		} finally {
			lineNumber = lineNumberOuter;
		}
	}

	/**
	 * Evaluates a condition; a bare function call is compared <code>&gt; 0</code>
	 *
	 * @param script Condition expression
	 * @return The truth of the condition, false if it fails to evaluate
	 */
	public boolean evaluateCondition (String script) {
		try {
			Expression expression = Parser.parse (script);
			if (expression instanceof Expression.Call)
				expression = new Expression.Binary (Lexer.TokenType.GT, expression, new Expression.Literal (Value.ZERO));

			return expression.evaluate (this).asBoolean ();
		} catch (EvaluationException e) {
			error (e.type (), e.getMessage ());
			return false;
		}
	}

	/**
	 * Evaluates a single expression
	 *
	 * @param script Expression text
	 * @return The value, {@link Value#NULL} if it fails to evaluate
	 */
	public Value evaluateExpression (String script) {
		try {
			return Parser.parse (script).evaluate (this);
		} catch (EvaluationException e) {
			error (e.type (), e.getMessage ());
			return Value.NULL;
		}
	}

	/**
	 * Returns the problems reported since the last {@link #diagnosticsClear()}, oldest first
	 * <p>Only the most recent {@link #diagnosticsLimitGet()} are kept; hosts reading them after each evaluation
	 * should clear them as well.</p>
	 *
	 * @return The kept problems
	 */
	public List<Diagnostic> diagnosticsGet () {
		return Collections.unmodifiableList (diagnostics);
	}

	/**
	 * Forgets reported problems and empties {@link #stderr}
	 */
	public void diagnosticsClear () {
		diagnostics = new ArrayList<Diagnostic> ();
		stderr = "";
	}

	/**
	 * Gets how many reported problems are kept
	 *
	 * @return Maximum size of {@link #diagnosticsGet()}
	 */
	public int diagnosticsLimitGet () {
		return diagnosticsLimit;
	}

	/**
	 * Sets how many reported problems are kept, the oldest are dropped first
	 *
	 * @param diagnosticsLimit Maximum number kept, at least 1, negative for the default
	 */
	public void diagnosticsLimitSet (int diagnosticsLimit) {
		this.diagnosticsLimit = (diagnosticsLimit < 0 ? diagnosticsLimitDefault : Math.max (1, diagnosticsLimit));

		while (diagnostics.size () > this.diagnosticsLimit)
			diagnostics.remove (0);

		if (DEBUG)
			logD (LOG_TAG, "Set diagnostics limit=" + this.diagnosticsLimit);
	}

	void lineNumberSet (int lineNumber) {
		this.lineNumber = lineNumber;
	}

	/**
	 * Reports a problem to stderr and the diagnostics, with line number (if available)
	 *
	 * @param type Kind of problem
	 * @param message Optional string or null of the message to record
	 * @return False (used as a placeholder for returns in other methods)
	 */
	public boolean error (ErrorType type, String message) {
		Diagnostic diagnostic = new Diagnostic (type, lineNumber, message != null ? message : "Unknown error");
		diagnostics.add (diagnostic);
		if (diagnostics.size () > diagnosticsLimit)
			diagnostics.remove (0);

		stderr = diagnostic.toString ();

		if (DEBUG)
			logD (LOG_TAG, type + " " + stderr);

		return false;
	}

	/**
	 * Dumps variables and visits to the verbose log
	 */
	void debugDumpState () {
		if (DEBUG) {
			logV (LOG_TAG, "**************************************************************");

			logV (LOG_TAG, "Variables:");
			for (Map.Entry<String, Value> entry : state.variables ().entrySet ())
				logV (LOG_TAG, "	" + entry.getKey () + "	" + entry.getValue ().type () + "	" + entry.getValue ());

			logV (LOG_TAG, "Visits:");
			logV (LOG_TAG, "" + state.visits ());

			logV (LOG_TAG, "**************************************************************");
		}
	}

	/**
	 * Implementation specific logging for Verbose messages
	 *
	 * @param msg The message to log
	 */
	public static void logV (String tag, String msg) {
		System.out.println ("V: " + (tag.isEmpty () ? "" : tag + ": ") + msg);
	}

	/**
	 * Implementation specific logging for Debug messages
	 *
	 * @param msg The message to log
	 */
	public static void logD (String tag, String msg) {
		System.out.println ("D: " + (tag.isEmpty () ? "" : tag + ": ") + msg);
	}
}
