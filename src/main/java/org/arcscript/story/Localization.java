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
 * Text for the active locale; choosing the locale and any fallback is up to the implementation
 *
 * @version 1.0
 * @since 1.0
 */
public interface Localization {
	/**
	 * @param elementId Element id
	 * @return The content script of the element, empty if none
	 */
	String contentText (String elementId);

	/**
	 * @param connectionId Connection id
	 * @return The label script of the connection, empty if none
	 */
	String linkLabel (String connectionId);
}
