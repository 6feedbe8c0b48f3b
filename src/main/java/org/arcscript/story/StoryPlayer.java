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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;

import org.arcscript.Arcscript;

/**
 * Walks a story: arrives at elements, offers their choices and follows the one picked
 * <p>On arrival the visit counters of the element (by id and by cleaned title) go up by one, its content is
 * evaluated with assignments applied, then its choices are resolved for display. Picking a choice applies the
 * assignments in its label before moving on. Going back neither counts a visit nor applies assignments.</p>
 *
 * @version 1.0
 * @since 1.0
 */
public class StoryPlayer {
	private static final String LOG_TAG = StoryPlayer.class.getSimpleName ();
	private static final boolean DEBUG = false;

	private final Arcscript arcscript;
	private final StoryGraph graph;
	private final Localization localization;
	private final ChoiceResolver resolver;

	private final ArrayList<String> history = new ArrayList<String> ();
	private String startingElementId = null;
	private Element current = null;
	private String content = "";
	private List<Choice> choices = Collections.<Choice>emptyList ();

	public StoryPlayer (Arcscript arcscript, StoryGraph graph, Localization localization) {
		this.arcscript = arcscript;
		this.graph = graph;
		this.localization = localization;
		this.resolver = new ChoiceResolver (arcscript, graph, localization);
	}

	/**
	 * @param arcscript Engine holding the story state
	 * @param graph Graph that also serves its own text
	 */
	public StoryPlayer (Arcscript arcscript, MapStoryGraph graph) {
		this (arcscript, graph, graph);
	}

	/**
	 * Starts at an element, forgetting any history
	 *
	 * @param elementId Element id
	 * @throws IllegalArgumentException If the element is unknown
	 * @throws CyclicGraphException If the choices of the element cannot be resolved
	 */
	public void start (String elementId) {
		if (graph.element (elementId) == null)
			throw new IllegalArgumentException ("Unknown element: " + elementId);

		arrive (elementId, false);
		startingElementId = elementId;
		history.clear ();
	}

	/**
	 * Follows a choice currently on offer
	 *
	 * @param choice One of {@link #choices()}
	 * @throws IllegalArgumentException If the choice is not on offer
	 * @throws CyclicGraphException If the choices of the target cannot be resolved; the player stays where it was
	 */
	public void choose (Choice choice) {
		if (!choices.contains (choice))
			throw new IllegalArgumentException ("Choice is not on offer: " + choice);

		if (DEBUG)
			Arcscript.logD (LOG_TAG, "Chose " + choice);

		// Label assignments count now that the choice is taken
		arcscript.evaluate (choice.rawLabel (), false);

		String from = current.id ();
		arrive (choice.targetId (), false);
		history.add (from);
	}

	/**
	 * Follows a choice by position
	 *
	 * @param index Index into {@link #choices()}
	 * @throws IndexOutOfBoundsException If there is no such choice
	 */
	public void choose (int index) {
		choose (choices.get (index));
	}

	/**
	 * Returns to the previous element
	 *
	 * @return False if there is nothing to go back to
	 * @throws CyclicGraphException If the choices of the previous element cannot be resolved; the player stays where
	 * it was
	 */
	public boolean back () {
		if (history.isEmpty ())
			return false;

		int last = history.size () - 1;
		arrive (history.get (last), true);
		history.remove (last);
		return true;
	}

	/**
	 * Resets variables and visits and starts again from where {@link #start(String)} began
	 *
	 * @throws IllegalStateException If the story was never started
	 */
	public void restart () {
		if (startingElementId == null)
			throw new IllegalStateException ("Story was never started");

		arcscript.reset ();
		start (startingElementId);
	}

	/**
	 * Moves to an element; nothing changes unless its choices resolve, apart from assignments its content made
	 */
	private void arrive (String elementId, boolean returning) {
		Element element = graph.element (elementId);
		if (element == null)
			throw new IllegalArgumentException ("Unknown element: " + elementId);

		HashMap<String, Integer> visits = arcscript.stateGet ().visits ();
		String titleKey = element.titleKey ();
		boolean countTitle = !returning && !titleKey.isEmpty () && !titleKey.equals (elementId);
		Integer visitsBefore = visits.get (elementId);
		Integer titleVisitsBefore = visits.get (titleKey);

		arcscript.currentElementSet (elementId);

		if (!returning) {
			arcscript.stateGet ().visitsIncrement (elementId);

			if (countTitle)
				arcscript.stateGet ().visitsIncrement (titleKey);
		}

		if (DEBUG)
			Arcscript.logD (LOG_TAG, (returning ? "Back at " : "Arrived at ") + element + ", visits " + arcscript.visitsGet (elementId));

		String arrivedContent;
		List<Choice> arrivedChoices;
		try {
			arrivedContent = arcscript.evaluate (localization.contentText (elementId), returning).trim ();
			arrivedChoices = resolver.resolveChoices (elementId);
		} catch (CyclicGraphException e) {
			if (DEBUG)
				Arcscript.logD (LOG_TAG, "Staying at " + current + ", " + e.getMessage ());

			if (!returning) {
				visitsRestore (visits, elementId, visitsBefore);

				if (countTitle)
					visitsRestore (visits, titleKey, titleVisitsBefore);
			}

			arcscript.currentElementSet (current == null ? null : current.id ());
			throw e;
		}

		current = element;
		content = arrivedContent;
		choices = Collections.unmodifiableList (arrivedChoices);
	}

	private static void visitsRestore (HashMap<String, Integer> visits, String key, Integer count) {
		if (count == null) {
			visits.remove (key);
		} else {
			visits.put (key, count);
		}
	}

	/**
	 * @return The evaluated content of the current element
	 */
	public String content () {
		return content;
	}

	public List<Choice> choices () {
		return choices;
	}

	/**
	 * @return The element the story is at, or null before {@link #start(String)}
	 */
	public Element currentElement () {
		return current;
	}

	/**
	 * @return True once started and at an element with no choices
	 */
	public boolean isEnded () {
		return current != null && choices.isEmpty ();
	}

	public boolean canGoBack () {
		return !history.isEmpty ();
	}
}
