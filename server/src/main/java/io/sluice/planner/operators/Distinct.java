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

package io.sluice.planner.operators;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

import javax.annotation.Nullable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;

import io.sluice.data.Row;
import io.sluice.data.RowReceiver;
import io.sluice.execution.ExecutionContext;
import io.sluice.execution.engine.distinct.DistinctKey;
import io.sluice.execution.engine.distinct.keystore.KeyPresenceStore;
import io.sluice.execution.engine.distinct.keystore.KeyPresenceStoreFactory;

/**
 * Emits one row per distinct value of the visible columns of its source, e.g. {@code SELECT DISTINCT id FROM t}.
 *
 * The first {@code hiddenFieldOffset} columns form the {@link DistinctKey}; the remaining hidden columns are
 * passed through unchanged but don't take part in the comparison. Out of several rows with the same key the
 * first one in source order is emitted, and the output keeps the source order.
 *
 * Keys seen so far are tracked in a {@link KeyPresenceStore} that lives for exactly one execution:
 * one {@link #run(ExecutionContext, RowReceiver)} call, or the materialization done by the first
 * {@link #next(ExecutionContext)} call. The store is dropped on every exit path.
 *
 * Pull mode materializes the whole result on the first call and replays it afterwards.
 * The replayed rows are read-only and stay valid after further {@link #next(ExecutionContext)} calls.
 */
public class Distinct implements Operator {

    private static final Logger LOGGER = LogManager.getLogger(Distinct.class);

    private enum State {
        UNMATERIALIZED,
        REPLAYING,
        EXHAUSTED,
        FAILED
    }

    private final Operator source;
    private final List<String> outputNames;
    private final int hiddenFieldOffset;
    private final KeyPresenceStoreFactory storeFactory;

    private State state = State.UNMATERIALIZED;
    private List<Row> rows = List.of();
    private int cursor = 0;

    @Nullable
    private Throwable materializationFailure;

    /**
     * @param outputNames       names of the visible columns, one per column of the distinct key
     * @param hiddenFieldOffset number of leading columns forming the distinct key
     */
    public Distinct(Operator source,
                    List<String> outputNames,
                    int hiddenFieldOffset,
                    KeyPresenceStoreFactory storeFactory) {
        Preconditions.checkArgument(hiddenFieldOffset >= 0, "hiddenFieldOffset must not be negative");
        Preconditions.checkArgument(
            outputNames.size() == hiddenFieldOffset,
            "Expected %s output names, got %s",
            hiddenFieldOffset,
            outputNames.size());
        this.source = source;
        this.outputNames = List.copyOf(outputNames);
        this.hiddenFieldOffset = hiddenFieldOffset;
        this.storeFactory = storeFactory;
    }

    @Override
    public void explain(PrintContext ctx) {
        source.explain(ctx);
        ctx.format("┌Compute distinct rows\n└Output field names %s\n", outputNames);
    }

    @Override
    public void run(ExecutionContext ctx, RowReceiver receiver) throws Exception {
        try (KeyPresenceStore store = storeFactory.create(storeLabel(ctx), true)) {
            source.run(ctx, row -> {
                ctx.ensureNotKilled();
                if (firstOccurrence(store, row)) {
                    return receiver.setNextRow(row);
                }
                return RowReceiver.Result.CONTINUE;
            });
        }
    }

    @Nullable
    @Override
    public Row next(ExecutionContext ctx) throws Exception {
        if (state == State.UNMATERIALIZED) {
            materialize(ctx);
        }
        switch (state) {
            case REPLAYING:
                if (cursor < rows.size()) {
                    return rows.get(cursor++);
                }
                state = State.EXHAUSTED;
                return null;

            case EXHAUSTED:
                return null;

            case FAILED:
                throw new IllegalStateException(
                    "Distinct rows are not available, computing them failed", materializationFailure);

            default:
                throw new AssertionError("Unexpected state: " + state);
        }
    }

    private void materialize(ExecutionContext ctx) throws Exception {
        ArrayList<Row> distinctRows = new ArrayList<>();
        long numSourceRows = 0;
        try (KeyPresenceStore store = storeFactory.create(storeLabel(ctx), true)) {
            Row row;
            while ((row = source.next(ctx)) != null) {
                ctx.ensureNotKilled();
                numSourceRows++;
                if (firstOccurrence(store, row)) {
                    distinctRows.add(new ReplayRow(row.materialize()));
                }
            }
        } catch (Throwable t) {
            materializationFailure = t;
            state = State.FAILED;
            throw t;
        }
        LOGGER.debug("Distinct job={} reduced {} source rows to {} rows", ctx.jobId(), numSourceRows, distinctRows.size());
        rows = distinctRows;
        cursor = 0;
        state = State.REPLAYING;
    }

    /**
     * Records the key of the row and returns true if it hasn't been seen before.
     */
    private boolean firstOccurrence(KeyPresenceStore store, Row row) throws Exception {
        DistinctKey key = DistinctKey.of(row, hiddenFieldOffset);
        if (store.get(key) == null) {
            store.set(key, true);
            return true;
        }
        return false;
    }

    private static String storeLabel(ExecutionContext ctx) {
        return "distinct: " + ctx.jobId();
    }

    @Override
    public void close() throws Exception {
        source.close();
    }

    /**
     * Filters are never pushed below a distinct; the rows seen here must not depend on where a filter is applied.
     */
    @Override
    public FilterPushDown filter(ExecutionContext ctx, Predicate<Row> condition) {
        return FilterPushDown.declined(this);
    }

    @Override
    public boolean prefersPull() {
        return source.prefersPull();
    }

    @Override
    public String toString() {
        return "Distinct{source=" + source + ", outputNames=" + outputNames + '}';
    }

    private static final class ReplayRow implements Row {

        private final Object[] cells;

        ReplayRow(Object[] cells) {
            this.cells = cells;
        }

        @Override
        public int numColumns() {
            return cells.length;
        }

        @Override
        public Object get(int index) {
            return cells[index];
        }

        @Override
        public Object[] materialize() {
            return Arrays.copyOf(cells, cells.length);
        }

        @Override
        public String toString() {
            return "ReplayRow{" + Arrays.deepToString(cells) + '}';
        }
    }
}
