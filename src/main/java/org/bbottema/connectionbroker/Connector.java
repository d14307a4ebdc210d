/*
 * Copyright (C) 2019 Benny Bottema (benny@bennybottema.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.bbottema.connectionbroker;

import org.jetbrains.annotations.NotNull;

/**
 * Adapter-specific side of a connection: how to establish it (handshakes, authentication, TLS), check it and close it. Each
 * {@link ConnectionWorker} uses it for the one connection it owns; the pool never calls it directly.
 *
 * @param <T> the connection type
 */
@SuppressWarnings("unused")
public abstract class Connector<T> {
	
	/**
	 * @return A new, fully set up connection. Any exception makes the worker back off and try again.
	 */
	@NotNull
	public abstract T connect() throws Exception;
	
	/**
	 * Checks a connection that has been idle for a while. Throwing marks the connection as failed.
	 */
	public void ping(@NotNull T connection) throws Exception {
		// overridable hook
	}
	
	/**
	 * Closes a connection that is no longer in use by the pool, because it failed or because the pool shuts down.
	 */
	public void disconnect(@NotNull T connection) throws Exception {
		// overridable hook
	}
}
