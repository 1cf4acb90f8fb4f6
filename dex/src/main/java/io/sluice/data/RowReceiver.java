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

package io.sluice.data;

/**
 * Push-side counterpart of a row source.
 * An upstream calls {@link #setNextRow(Row)} once per row and must stop emitting as soon as
 * {@link Result#STOP} is returned.
 *
 * The row passed in may be re-used by the upstream once this method returns;
 * receivers that keep rows around have to {@link Row#materialize()} them.
 */
@FunctionalInterface
public interface RowReceiver {

    enum Result {
        CONTINUE,
        STOP
    }

    /**
     * Feeds the next row.
     *
     * @return {@link Result#CONTINUE} if more rows are wanted, {@link Result#STOP} otherwise.
     * @throws Exception if the row could not be processed; the upstream propagates it to its caller.
     */
    Result setNextRow(Row row) throws Exception;
}
