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
 * Redirects to another element
 *
 * @version 1.0
 * @since 1.0
 */
public final class Jumper {
	private final String id;
	private final String targetId;

	public Jumper (String id, String targetId) {
		this.id = id;
		this.targetId = targetId;
	}

	public String id () {
		return id;
	}

	public String targetId () {
		return targetId;
	}
}
