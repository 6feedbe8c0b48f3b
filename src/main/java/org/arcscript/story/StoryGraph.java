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
 * Lookup of the story entities by id, supplied by whatever loaded the project
 * <p>Every method returns null for an id it does not know. Ids are unique across all entity kinds.</p>
 *
 * @version 1.0
 * @since 1.0
 */
public interface StoryGraph {
	Element element (String id);

	Connection connection (String id);

	Branch branch (String id);

	Condition condition (String id);

	Jumper jumper (String id);
}
