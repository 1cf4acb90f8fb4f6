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

package io.sluice.execution.engine.distinct;

import java.util.Arrays;
import java.util.Locale;

import io.sluice.data.Row;

/**
 * The visible prefix of a row, {@code row[0:hiddenFieldOffset]}.
 *
 * Two rows belong to the same group if their keys are equal element-wise.
 * Array cells are compared by content. The key holds its own copy of the values, so it stays
 * valid after the row it was built from has been re-used by its producer.
 */
public final class DistinctKey {

    private final Object[] values;
    private final int hashCode;

    public static DistinctKey of(Row row, int hiddenFieldOffset) {
        int numColumns = row.numColumns();
        if (hiddenFieldOffset > numColumns) {
            throw new IllegalArgumentException(String.format(
                Locale.ENGLISH,
                "Row has %d columns but the distinct key spans the first %d columns",
                numColumns,
                hiddenFieldOffset
            ));
        }
        Object[] values = new Object[hiddenFieldOffset];
        for (int i = 0; i < hiddenFieldOffset; i++) {
            values[i] = row.get(i);
        }
        return new DistinctKey(values);
    }

    private DistinctKey(Object[] values) {
        this.values = values;
        this.hashCode = Arrays.deepHashCode(values);
    }

    public int size() {
        return values.length;
    }

    public Object get(int index) {
        return values[index];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DistinctKey that = (DistinctKey) o;
        return hashCode == that.hashCode && Arrays.deepEquals(values, that.values);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return Arrays.deepToString(values);
    }
}
