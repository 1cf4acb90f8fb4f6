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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.apache.lucene.util.RamUsageEstimator;
import org.junit.Test;

import io.sluice.data.RowN;
import io.sluice.execution.engine.distinct.DistinctKey;

public class KeySizeEstimatorTest {

    @Test
    public void test_null_value_has_no_size_of_its_own() {
        assertThat(KeySizeEstimator.estimateValue(null)).isEqualTo(0L);
    }

    @Test
    public void test_string_value() {
        assertThat(KeySizeEstimator.estimateValue("hello")).isEqualTo(RamUsageEstimator.sizeOf("hello"));
        assertThat(KeySizeEstimator.estimateValue("hello world")).isGreaterThan(KeySizeEstimator.estimateValue("hello"));
    }

    @Test
    public void test_boxed_numbers_use_shallow_size() {
        assertThat(KeySizeEstimator.estimateValue(42L)).isEqualTo(RamUsageEstimator.shallowSizeOf(42L));
        assertThat(KeySizeEstimator.estimateValue(1.5d)).isEqualTo(RamUsageEstimator.shallowSizeOf(1.5d));
    }

    @Test
    public void test_object_array_includes_its_elements() {
        Object[] values = new Object[]{"a", "b"};

        assertThat(KeySizeEstimator.estimateValue(values)).isEqualTo(
            RamUsageEstimator.shallowSizeOf(values) + RamUsageEstimator.sizeOf("a") + RamUsageEstimator.sizeOf("b"));
    }

    @Test
    public void test_collections_and_maps_use_fixed_estimate() {
        assertThat(KeySizeEstimator.estimateValue(List.of(1, 2, 3))).isEqualTo(KeySizeEstimator.UNKNOWN_VALUE_SIZE);
        assertThat(KeySizeEstimator.estimateValue(Map.of("x", 1))).isEqualTo(KeySizeEstimator.UNKNOWN_VALUE_SIZE);
    }

    @Test
    public void test_key_size_grows_with_values() {
        long empty = KeySizeEstimator.estimate(DistinctKey.of(new RowN(new Object[]{"x"}), 0));
        long single = KeySizeEstimator.estimate(DistinctKey.of(new RowN(new Object[]{"x"}), 1));
        long withNull = KeySizeEstimator.estimate(DistinctKey.of(new RowN(new Object[]{null}), 1));

        assertThat(empty).isGreaterThan(0L);
        assertThat(single).isEqualTo(withNull + RamUsageEstimator.sizeOf("x"));
        assertThat(withNull).isGreaterThanOrEqualTo(empty);
    }
}
