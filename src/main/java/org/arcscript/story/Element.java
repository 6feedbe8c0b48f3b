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
 * A narrative node: content script plus the ordered connections leaving it
 *
 * @version 1.0
 * @since 1.0
 */
public final class Element {
	private final String id;
	private final String title;
	private final String content;
	private final List<String> outputs;

	/**
	 * @param id Unique id
	 * @param title Title as authored, may contain markup, may be null
	 * @param content Arcscript content, may be null
	 * @param outputs Ids of outgoing connections in display order
	 */
	public Element (String id, String title, String content, List<String> outputs) {
		this.id = id;
		this.title = (title == null ? "" : title);
		this.content = (content == null ? "" : content);
		this.outputs = Collections.unmodifiableList (new ArrayList<String> (outputs == null ? Collections.<String>emptyList () : outputs));
	}

	public String id () {
		return id;
	}

	public String title () {
		return title;
	}

	/**
	 * @return The title without markup and surrounding whitespace, the second key visits are counted under
	 */
	public String titleKey () {
		return title.replaceAll ("<[^>]*>", "").replace ("&nbsp;", " ").trim ();
	}

	public String content () {
		return content;
	}

	public List<String> outputs () {
		return outputs;
	}

	@Override
	public String toString () {
		return "Element " + id + (title.isEmpty () ? "" : " (" + titleKey () + ")");
	}
}
