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

package org.arcscript.story;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.arcscript.Arcscript;
import org.arcscript.ErrorType;

/**
 * Turns the outgoing connections of an element into the choices currently open to the player
 * <p>Each connection is followed through branches and jumpers until it reaches an element or dead-ends. A branch
 * takes the output of its first true condition; a jumper redirects to its target. The label of a choice is the
 * nearest non-empty connection label walking back from the element reached, or <code>"Continue"</code>.</p>
 * <pre>
 * A --"Fallback"--&gt; branch --if x--"Go"--&gt; B     label "Go"
 *                          --else-------&gt; C     label "Fallback"
 * </pre>
 *
 * @version 1.0
 * @since 1.0
 */
public class ChoiceResolver {
	private static final String LOG_TAG = ChoiceResolver.class.getSimpleName ();
	private static final boolean DEBUG = false;

	/** Label of a choice when no connection on its path has one */
	public static final String LABEL_DEFAULT = "Continue";

	private final Arcscript arcscript;
	private final StoryGraph graph;
	private final Localization localization;

	/**
	 * @param arcscript Engine whose variables and visits conditions are evaluated against
	 * @param graph The story graph
	 * @param localization Label text for the active locale
	 */
	public ChoiceResolver (Arcscript arcscript, StoryGraph graph, Localization localization) {
		this.arcscript = arcscript;
		this.graph = graph;
		this.localization = localization;
	}

	/**
	 * Resolves the choices of an element, in the order of its outgoing connections
	 *
	 * @param elementId Element id
	 * @return The choices, empty at the end of the story or for an unknown element
	 * @throws CyclicGraphException If a chain of branches and jumpers loops or is too long
	 */
	public List<Choice> resolveChoices (String elementId) {
		List<Choice> choices = new ArrayList<Choice> ();

		Element element = graph.element (elementId);
		if (element == null) {
			if (DEBUG)
				Arcscript.logD (LOG_TAG, "No element " + elementId + " to resolve choices for");

			return choices;
		}

		arcscript.currentElementSet (elementId);

		for (String connectionId : element.outputs ()) {
			Choice choice = follow (connectionId, connectionId, null, "", new HashSet<String> (), 0);
			if (choice != null)
				choices.add (choice);
		}

		if (DEBUG)
			Arcscript.logV (LOG_TAG, element + " has " + choices.size () + " choices " + choices);

		return choices;
	}

	/**
	 * @param elementId Element id
	 * @return True if no choice leads on from the element
	 */
	public boolean isTerminal (String elementId) {
		return resolveChoices (elementId).isEmpty ();
	}

	/**
	 * Follows one connection to an element
	 *
	 * @param connectionId Connection being followed
	 * @param originId The element's own outgoing connection this chain started from
	 * @param branchId First branch passed, or null
	 * @param fallback Nearest non-empty label seen so far, or empty
	 * @param seen Branches and jumpers already passed on this chain
	 * @param hops Branches and jumpers passed so far
	 * @return The choice, or null if the chain dead-ends
	 */
	private Choice follow (String connectionId, String originId, String branchId, String fallback, Set<String> seen, int hops) {
		Connection connection = graph.connection (connectionId);
		if (connection == null) {
			if (DEBUG)
				Arcscript.logD (LOG_TAG, "Dangling connection " + connectionId);

			return null;
		}

		String label = localization.linkLabel (connectionId);
		if (label == null || label.trim ().isEmpty ())
			label = fallback;

		String targetId = connection.targetId ();
		if (graph.element (targetId) != null)
			return choice (label, targetId, branchId, originId);

		Branch branch = graph.branch (targetId);
		if (branch != null) {
			passing (branch.id (), originId, seen, hops);

			for (String conditionId : branch.conditionIds ()) {
				Condition condition = graph.condition (conditionId);
				if (condition == null) {
					if (DEBUG)
						Arcscript.logD (LOG_TAG, "Branch " + branch.id () + " has dangling condition " + conditionId);

					continue;
				}

				if (condition.isUnconditional () || arcscript.evaluateCondition (condition.script ()))
					return follow (condition.outputId (), originId, branchId == null ? branch.id () : branchId, label, seen, hops + 1);
			}

			if (DEBUG)
				Arcscript.logD (LOG_TAG, "No condition of branch " + branch.id () + " holds");

			return null;
		}

		Jumper jumper = graph.jumper (targetId);
		if (jumper != null) {
			passing (jumper.id (), originId, seen, hops);

			if (graph.element (jumper.targetId ()) == null) {
				if (DEBUG)
					Arcscript.logD (LOG_TAG, "Jumper " + jumper.id () + " leads to unknown element " + jumper.targetId ());

				return null;
			}

			return choice (label, jumper.targetId (), branchId, originId);
		}

		if (DEBUG)
			Arcscript.logD (LOG_TAG, "Connection " + connectionId + " leads to unknown " + targetId);

		return null;
	}

	/**
	 * Records a branch or jumper on the chain, failing if it was passed before or the chain is too long
	 */
	private void passing (String id, String originId, Set<String> seen, int hops) {
		String message = null;

		if (!seen.add (id)) {
			message = "Connection " + originId + " loops back to " + id;
		} else if (hops >= arcscript.resolveDepthGet ()) {
			message = "Connection " + originId + " passes more than " + arcscript.resolveDepthGet () + " branches and jumpers";
		}

		if (message != null) {
			arcscript.error (ErrorType.CYCLIC_GRAPH, message);
			throw new CyclicGraphException (originId, message);
		}
	}

	private Choice choice (String rawLabel, String targetId, String branchId, String originId) {
		String label = arcscript.evaluate (rawLabel, true).trim ();
		if (label.isEmpty ())
			label = LABEL_DEFAULT;

		return new Choice (label, rawLabel, targetId, branchId, originId);
	}
}
