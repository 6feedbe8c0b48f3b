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

/**
 * A resolved, labelled option at a decision point
 *
 * @version 1.0
 * @since 1.0
 */
public final class Choice {
	private final String label;
	private final String rawLabel;
	private final String targetId;
	private final String branchId;
	private final String connectionId;

	Choice (String label, String rawLabel, String targetId, String branchId, String connectionId) {
		this.label = label;
		this.rawLabel = rawLabel;
		this.targetId = targetId;
		this.branchId = branchId;
		this.connectionId = connectionId;
	}

	/**
	 * @return The label as displayed, evaluated without applying its assignments
	 */
	public String label () {
		return label;
	}

	/**
	 * @return The label script it was evaluated from, empty when the default label is used
	 */
	public String rawLabel () {
		return rawLabel;
	}

	/**
	 * @return Id of the element the choice leads to
	 */
	public String targetId () {
		return targetId;
	}

	/**
	 * @return Id of the first branch passed on the way, or null
	 */
	public String branchId () {
		return branchId;
	}

	/**
	 * @return Id of the outgoing connection of the element the choice was offered at
	 */
	public String connectionId () {
		return connectionId;
	}

	@Override
	public String toString () {
		return "[" + label + "] -> " + targetId;
	}
}
