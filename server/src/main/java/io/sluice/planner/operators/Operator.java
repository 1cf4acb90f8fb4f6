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

import java.util.function.Predicate;

import javax.annotation.Nullable;

import io.sluice.data.Row;
import io.sluice.data.RowReceiver;
import io.sluice.execution.ExecutionContext;

/**
 * A node of an executable operator tree.
 *
 * Operators support two execution protocols and consumers pick one of them per execution:
 *
 * <ul>
 *     <li>push: {@link #run(ExecutionContext, RowReceiver)} emits every row to a receiver until the source is
 *     exhausted or the receiver asks to stop.</li>
 *     <li>pull: {@link #next(ExecutionContext)} is called repeatedly, returning one row per call.</li>
 * </ul>
 *
 * An operator consumes its source using the same protocol it is driven with, so operators compose into chains.
 *
 * Thread-safety notes:
 *
 * Concurrent usage of an Operator is not supported.
 */
public interface Operator {

    /**
     * Writes a human readable description of this operator, including its sources, to the context.
     */
    void explain(PrintContext ctx);

    /**
     * Pushes all rows to the receiver.
     * Returns normally once the source is exhausted or the receiver returned {@link RowReceiver.Result#STOP}.
     *
     * @throws Exception if the source, the operator itself or the receiver failed.
     *         Rows emitted before the failure have been consumed by the receiver already.
     */
    void run(ExecutionContext ctx, RowReceiver receiver) throws Exception;

    /**
     * Pulls the next row.
     *
     * The returned row is only valid until the next call; consumers which keep rows must
     * {@link Row#materialize()} them.
     *
     * @return the next row or null if there are no more rows.
     */
    @Nullable
    Row next(ExecutionContext ctx) throws Exception;

    /**
     * Releases the resources held by this operator and its sources.
     */
    void close() throws Exception;

    /**
     * Offers a filter condition to this operator.
     *
     * @return the result holding the operator to use in place of this one, and whether the condition
     *         is taken care of by that operator.
     */
    FilterPushDown filter(ExecutionContext ctx, Predicate<Row> condition);

    /**
     * @return true if this operator should be consumed with {@link #next(ExecutionContext)}
     *         instead of {@link #run(ExecutionContext, RowReceiver)}
     */
    default boolean prefersPull() {
        return false;
    }
}
