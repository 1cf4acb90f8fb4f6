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

/**
 * Outcome of {@link Operator#filter}: the operator to use from now on, and whether it absorbed the filter.
 * If the filter was not absorbed the caller has to keep evaluating it above the operator.
 */
public final class FilterPushDown {

    private final Operator operator;
    private final boolean absorbed;

    public static FilterPushDown declined(Operator operator) {
        return new FilterPushDown(operator, false);
    }

    public static FilterPushDown absorbed(Operator operator) {
        return new FilterPushDown(operator, true);
    }

    private FilterPushDown(Operator operator, boolean absorbed) {
        this.operator = operator;
        this.absorbed = absorbed;
    }

    public Operator operator() {
        return operator;
    }

    public boolean absorbed() {
        return absorbed;
    }

    @Override
    public String toString() {
        return "FilterPushDown{operator=" + operator + ", absorbed=" + absorbed + '}';
    }
}
