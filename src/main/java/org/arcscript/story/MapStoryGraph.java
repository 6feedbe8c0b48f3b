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

import java.util.HashMap;
import java.util.List;

import org.arcscript.Arcscript;

/**
 * In-memory story graph, filled by whatever loads a project
 * <p>Serves entity text as its own localization, so content and labels come straight from
 * {@link Element#content()} and {@link Connection#label()}.</p>
 *
 * @version 1.0
 * @since 1.0
 */
public class MapStoryGraph implements StoryGraph, Localization {
	private static final String LOG_TAG = MapStoryGraph.class.getSimpleName ();
	private static final boolean DEBUG = false;

	private final HashMap<String, Element> elements = new HashMap<String, Element> ();
	private final HashMap<String, Connection> connections = new HashMap<String, Connection> ();
	private final HashMap<String, Branch> branches = new HashMap<String, Branch> ();
	private final HashMap<String, Condition> conditions = new HashMap<String, Condition> ();
	private final HashMap<String, Jumper> jumpers = new HashMap<String, Jumper> ();
	private String startingElementId = null;

	public MapStoryGraph elementAdd (Element element) {
		elements.put (element.id (), element);

		// First element added is the start unless told otherwise
		if (startingElementId == null)
			startingElementId = element.id ();

		return this;
	}

	public MapStoryGraph connectionAdd (Connection connection) {
		connections.put (connection.id (), connection);
		return this;
	}

	public MapStoryGraph conditionAdd (Condition condition) {
		conditions.put (condition.id (), condition);
		return this;
	}

	/**
	 * Adds a branch; its conditions must have been added already
	 *
	 * @param branch The branch
	 * @return This graph
	 * @throws IllegalArgumentException If a condition is unknown, or an unconditional one is not last
	 */
	public MapStoryGraph branchAdd (Branch branch) {
		List<String> ids = branch.conditionIds ();

		for (int i = 0, j = ids.size (); i < j; ++i) {
			Condition condition = conditions.get (ids.get (i));
			if (condition == null)
				throw new IllegalArgumentException ("Branch " + branch.id () + " refers to unknown condition " + ids.get (i));

			if (condition.isUnconditional () && i < j - 1)
				throw new IllegalArgumentException ("Branch " + branch.id () + " has else condition " + condition.id () + " before its last position");
		}

		if (DEBUG)
			Arcscript.logV (LOG_TAG, "Branch " + branch.id () + " with " + ids.size () + " conditions");

		branches.put (branch.id (), branch);
		return this;
	}

	public MapStoryGraph jumperAdd (Jumper jumper) {
		jumpers.put (jumper.id (), jumper);
		return this;
	}

	public String startingElementGet () {
		return startingElementId;
	}

	public void startingElementSet (String elementId) {
		startingElementId = elementId;
	}

	@Override
	public Element element (String id) {
		return elements.get (id);
	}

	@Override
	public Connection connection (String id) {
		return connections.get (id);
	}

	@Override
	public Branch branch (String id) {
		return branches.get (id);
	}

	@Override
	public Condition condition (String id) {
		return conditions.get (id);
	}

	@Override
	public Jumper jumper (String id) {
		return jumpers.get (id);
	}

	@Override
	public String contentText (String elementId) {
		Element element = elements.get (elementId);
		return element == null ? "" : element.content ();
	}

	@Override
	public String linkLabel (String connectionId) {
		Connection connection = connections.get (connectionId);
		return connection == null ? "" : connection.label ();
	}
}
