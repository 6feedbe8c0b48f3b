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
 * Thrown when a chain of branches and jumpers loops or runs past {@link org.arcscript.Arcscript#resolveDepthGet()}
 * hops. The story graph is broken; this is not something a script can cause or recover from.
 *
 * @version 1.0
 * @since 1.0
 */
public class CyclicGraphException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final String connectionId;

	public CyclicGraphException (String connectionId, String message) {
		super (message);
		this.connectionId = connectionId;
	}

	/**
	 * @return The outgoing connection whose resolution failed
	 */
	public String connectionId () {
		return connectionId;
	}
}
