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

import java.io.IOException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.elasticsearch.common.breaker.CircuitBreaker;
import org.elasticsearch.common.breaker.MemoryCircuitBreaker;
import org.elasticsearch.common.settings.Setting;
import org.elasticsearch.common.settings.Setting.Property;
import org.elasticsearch.common.settings.Settings;
import org.elasticsearch.common.unit.ByteSizeValue;

import com.google.common.annotations.VisibleForTesting;

import io.sluice.breaker.ConcurrentRamAccounting;

/**
 * Creates the {@link KeyPresenceStore}s used by distinct operators.
 *
 * All stores created by one factory account their memory against a shared circuit breaker.
 * Each store additionally gets its own per-operation limit.
 */
public class KeyPresenceStoreFactory {

    private static final Logger LOGGER = LogManager.getLogger(KeyPresenceStoreFactory.class);

    public static final Setting<ByteSizeValue> OPERATION_MEMORY_LIMIT_SETTING = Setting.byteSizeSetting(
        "distinct.key_store.operation_memory_limit", new ByteSizeValue(0), Property.NodeScope);

    public static final Setting<ByteSizeValue> BREAKER_LIMIT_SETTING = Setting.memorySizeSetting(
        "distinct.key_store.breaker.limit", "60%", Property.NodeScope);

    public static final Setting<Double> BREAKER_OVERHEAD_SETTING = Setting.doubleSetting(
        "distinct.key_store.breaker.overhead", 1.0d, 0.0d, Property.NodeScope);

    private final CircuitBreaker breaker;
    private final long operationMemoryLimit;

    public KeyPresenceStoreFactory(Settings settings) {
        this(
            new MemoryCircuitBreaker(
                BREAKER_LIMIT_SETTING.get(settings),
                BREAKER_OVERHEAD_SETTING.get(settings),
                LOGGER),
            OPERATION_MEMORY_LIMIT_SETTING.get(settings).getBytes()
        );
    }

    @VisibleForTesting
    KeyPresenceStoreFactory(CircuitBreaker breaker, long operationMemoryLimit) {
        this.breaker = breaker;
        this.operationMemoryLimit = operationMemoryLimit;
        LOGGER.debug("Key presence stores limited to {} per operation, breaker limit {}",
            operationMemoryLimit > 0 ? new ByteSizeValue(operationMemoryLimit) : "-",
            new ByteSizeValue(breaker.getLimit()));
    }

    /**
     * Creates a new, empty store. The caller owns the store and must {@link KeyPresenceStore#drop()} it.
     *
     * @param label  identifies the store in circuit breaker messages and logs
     * @param unique if true the store rejects setting a key twice
     */
    public KeyPresenceStore create(String label, boolean unique) throws IOException {
        LOGGER.trace("Creating key presence store \"{}\" unique={}", label, unique);
        return new HashKeyPresenceStore(
            label,
            unique,
            ConcurrentRamAccounting.forCircuitBreaker(label, breaker, operationMemoryLimit)
        );
    }

    public CircuitBreaker breaker() {
        return breaker;
    }
}
