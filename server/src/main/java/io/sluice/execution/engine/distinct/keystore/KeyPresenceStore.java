/*
 * Licensed to Crate under one or more contributor license agreements.
 * See the NOTICE file distributed with this work for additional
 * information regarding copyright ownership.  Crate licenses this file
 * to you under the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.  You may
 * obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or
 * implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 *
 * However, if you have executed another commercial license agreement
 * with Crate these terms will supersede the license and you may use the
 * software solely pursuant to the terms of the relevant commercial
 * agreement.
 */

package io.sluice.execution.engine.distinct.keystore;

import java.io.Closeable;
import java.io.IOException;

import javax.annotation.Nullable;

import io.sluice.execution.engine.distinct.DistinctKey;

/**
 * Ephemeral store recording which {@link DistinctKey}s have been seen during one execution.
 *
 * A store is created empty, filled monotonically and destroyed as a whole via {@link #drop()}.
 * It is used by a single thread and never shared between executions.
 * {@link #close()} drops the store, so it can be scoped with try-with-resources.
 */
public interface KeyPresenceStore extends Closeable {

    /**
     * @return the marker stored for the key, or null if the key is absent
     */
    @Nullable
    Boolean get(DistinctKey key) throws IOException;

    /**
     * @throws DuplicateKeyException if the store was created as unique and already contains the key
     */
    void set(DistinctKey key, boolean value) throws IOException;

    /**
     * Destroys all contents and releases the resources held by the store.
     * Calling it again has no effect. Any other operation fails after the store has been dropped.
     */
    void drop() throws IOException;

    @Override
    default void close() throws IOException {
        drop();
    }
}
