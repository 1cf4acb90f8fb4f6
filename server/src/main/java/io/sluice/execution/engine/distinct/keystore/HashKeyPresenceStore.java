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

import java.util.HashMap;
import java.util.Locale;

import javax.annotation.Nullable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.lucene.util.RamUsageEstimator;

import io.sluice.breaker.KeySizeEstimator;
import io.sluice.data.breaker.RamAccounting;
import io.sluice.execution.engine.distinct.DistinctKey;

/**
 * Heap based {@link KeyPresenceStore}.
 *
 * Every new entry is accounted against a {@link RamAccounting} before it is inserted, so an entry
 * that would exceed the memory limit is never stored. Dropping the store releases all accounted bytes.
 */
public final class HashKeyPresenceStore implements KeyPresenceStore {

    private static final Logger LOGGER = LogManager.getLogger(HashKeyPresenceStore.class);

    // HashMap.Node (header, hash, key, value, next) plus the bucket slot referencing it
    static final long ENTRY_OVERHEAD = RamUsageEstimator.alignObjectSize(
        RamUsageEstimator.NUM_BYTES_OBJECT_HEADER + Integer.BYTES + 3L * RamUsageEstimator.NUM_BYTES_OBJECT_REF)
        + RamUsageEstimator.NUM_BYTES_OBJECT_REF;

    private final String label;
    private final boolean unique;
    private final RamAccounting ramAccounting;

    @Nullable
    private HashMap<DistinctKey, Boolean> entries = new HashMap<>();

    public HashKeyPresenceStore(String label, boolean unique, RamAccounting ramAccounting) {
        this.label = label;
        this.unique = unique;
        this.ramAccounting = ramAccounting;
    }

    @Nullable
    @Override
    public Boolean get(DistinctKey key) {
        return entries().get(key);
    }

    @Override
    public void set(DistinctKey key, boolean value) {
        HashMap<DistinctKey, Boolean> entries = entries();
        if (entries.containsKey(key)) {
            if (unique) {
                throw new DuplicateKeyException(label, key);
            }
            entries.put(key, value);
            return;
        }
        ramAccounting.addBytes(KeySizeEstimator.estimate(key) + ENTRY_OVERHEAD);
        entries.put(key, value);
    }

    @Override
    public void drop() {
        if (entries == null) {
            return;
        }
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Dropping key presence store \"{}\" with {} keys ({} bytes)",
                label, entries.size(), ramAccounting.totalBytes());
        }
        entries = null;
        ramAccounting.close();
    }

    public int size() {
        return entries().size();
    }

    public boolean isDropped() {
        return entries == null;
    }

    private HashMap<DistinctKey, Boolean> entries() {
        if (entries == null) {
            throw new IllegalStateException(String.format(
                Locale.ENGLISH, "Key presence store \"%s\" has already been dropped", label));
        }
        return entries;
    }

    @Override
    public String toString() {
        return "HashKeyPresenceStore{label=" + label + ", unique=" + unique + '}';
    }
}
