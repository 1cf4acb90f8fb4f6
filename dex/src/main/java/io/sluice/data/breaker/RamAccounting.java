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

package io.sluice.data.breaker;

public interface RamAccounting extends AutoCloseable {

    /**
     * Accounts for the given bytes; may trip a circuit breaker.
     *
     * @throws RuntimeException (typically a circuit breaking exception) if the limit is exceeded.
     *         The bytes are not accounted in that case.
     */
    void addBytes(long bytes);

    long totalBytes();

    /**
     * Stops accounting for the bytes added so far. Can be called multiple times.
     */
    void release();

    @Override
    void close();
}
