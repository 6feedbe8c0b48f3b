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
import java.util.List;

/**
 * An ordered set of conditions of which the first true one picks the way on
 *
 * @version 1.0
 * @since 1.0
 */
public final class Branch {
	private final String id;
	private final List<String> conditionIds;

	/**
	 * @param id Unique id
	 * @param conditionIds The if, elseif and optional trailing else conditions, in order
	 */
	public Branch (String id, List<String> conditionIds) {
		this.id = id;
		this.conditionIds = Collections.unmodifiableList (new ArrayList<String> (conditionIds == null ? Collections.<String>emptyList () : conditionIds));
	}

	public String id () {
		return id;
	}

	public List<String> conditionIds () {
		return conditionIds;
	}
}
