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
 * A guarded way out of a branch; without a script it is the branch's else
 *
 * @version 1.0
 * @since 1.0
 */
public final class Condition {
	private final String id;
	private final String script;
	private final String outputId;

	/**
	 * @param id Unique id
	 * @param script Condition expression, null or blank when unconditional
	 * @param outputId Id of the connection followed when the condition holds
	 */
	public Condition (String id, String script, String outputId) {
		this.id = id;
		this.script = script;
		this.outputId = outputId;
	}

	public String id () {
		return id;
	}

	public String script () {
		return script;
	}

	public String outputId () {
		return outputId;
	}

	public boolean isUnconditional () {
		return script == null || script.trim ().isEmpty ();
	}
}
