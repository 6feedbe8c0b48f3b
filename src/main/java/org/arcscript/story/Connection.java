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
 * A directed link from an element (or a condition) to an element, branch or jumper
 *
 * @version 1.0
 * @since 1.0
 */
public final class Connection {
	private final String id;
	private final String label;
	private final String sourceId;
	private final String targetId;

	/**
	 * @param id Unique id
	 * @param label Label script, null or empty for none
	 * @param sourceId Id of the element or condition the link leaves
	 * @param targetId Id of the element, branch or jumper the link enters
	 */
	public Connection (String id, String label, String sourceId, String targetId) {
		this.id = id;
		this.label = (label == null ? "" : label);
		this.sourceId = sourceId;
		this.targetId = targetId;
	}

	public String id () {
		return id;
	}

	public String label () {
		return label;
	}

	public String sourceId () {
		return sourceId;
	}

	public String targetId () {
		return targetId;
	}
}
