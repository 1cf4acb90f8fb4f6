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

package io.sluice.breaker;

import java.util.Collection;
import java.util.Map;

import javax.annotation.Nullable;

import org.apache.lucene.util.RamUsageEstimator;

import io.sluice.execution.engine.distinct.DistinctKey;

/**
 * Best-effort estimation of the heap used by a {@link DistinctKey} and its values.
 *
 * The value types are guessed per cell, as the operator doesn't know the column types.
 */
public final class KeySizeEstimator {

    // used for values whose structure isn't inspected (maps, collections, unknown objects)
    static final long UNKNOWN_VALUE_SIZE = 256L;

    private static final long SHALLOW_KEY_SIZE = RamUsageEstimator.shallowSizeOfInstance(DistinctKey.class);

    private KeySizeEstimator() {
    }

    public static long estimate(DistinctKey key) {
        int size = key.size();
        long bytes = SHALLOW_KEY_SIZE + arraySize(size);
        for (int i = 0; i < size; i++) {
            bytes += estimateValue(key.get(i));
        }
        return bytes;
    }

    /**
     * Size of the value itself; the reference pointing to it is accounted by the container.
     */
    static long estimateValue(@Nullable Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof String) {
            return RamUsageEstimator.sizeOf((String) value);
        }
        if (value instanceof Object[]) {
            Object[] values = (Object[]) value;
            long bytes = arraySize(values.length);
            for (Object o : values) {
                bytes += estimateValue(o);
            }
            return bytes;
        }
        if (value instanceof Map || value instanceof Collection) {
            return UNKNOWN_VALUE_SIZE;
        }
        // boxed primitives and primitive arrays are fully covered by their shallow size
        return RamUsageEstimator.shallowSizeOf(value);
    }

    private static long arraySize(int length) {
        return RamUsageEstimator.alignObjectSize(
            RamUsageEstimator.NUM_BYTES_ARRAY_HEADER + (long) RamUsageEstimator.NUM_BYTES_OBJECT_REF * length);
    }
}
