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

package io.sluice.testing;

import java.util.ArrayList;
import java.util.List;

import org.elasticsearch.common.settings.Settings;

import io.sluice.data.Row;
import io.sluice.execution.ExecutionContext;
import io.sluice.execution.engine.distinct.keystore.KeyPresenceStoreFactory;
import io.sluice.planner.operators.Operator;

public final class TestingHelpers {

    private TestingHelpers() {
    }

    public static KeyPresenceStoreFactory storeFactory() {
        return storeFactory(Settings.EMPTY);
    }

    /**
     * A factory with a fixed breaker limit so that tests don't depend on the heap size.
     */
    public static KeyPresenceStoreFactory storeFactory(Settings settings) {
        return new KeyPresenceStoreFactory(Settings.builder()
            .put(KeyPresenceStoreFactory.BREAKER_LIMIT_SETTING.getKey(), "64mb")
            .put(settings)
            .build());
    }

    public static List<Object[]> pushAll(Operator operator, ExecutionContext ctx) throws Exception {
        CollectingRowReceiver receiver = new CollectingRowReceiver();
        operator.run(ctx, receiver);
        return receiver.rows();
    }

    public static List<Object[]> pullAll(Operator operator, ExecutionContext ctx) throws Exception {
        ArrayList<Object[]> rows = new ArrayList<>();
        Row row;
        while ((row = operator.next(ctx)) != null) {
            rows.add(row.materialize());
        }
        return rows;
    }
}
