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

package io.sluice.execution;

import java.util.UUID;

import javax.annotation.Nullable;

import io.sluice.exceptions.JobKilledException;

/**
 * State shared by all operators taking part in one execution of a query.
 *
 * Operators check {@link #ensureNotKilled()} while driving their upstream so that a
 * {@link #kill(Throwable)} stops the execution at the next row.
 */
public final class ExecutionContext {

    private final UUID jobId;

    private volatile boolean killed = false;

    @Nullable
    private volatile Throwable killReason;

    public ExecutionContext(UUID jobId) {
        this.jobId = jobId;
    }

    public static ExecutionContext newContext() {
        return new ExecutionContext(UUID.randomUUID());
    }

    public UUID jobId() {
        return jobId;
    }

    /**
     * Requests the termination of the execution. Only the first call has an effect.
     */
    public synchronized void kill(@Nullable Throwable reason) {
        if (!killed) {
            killReason = reason;
            killed = true;
        }
    }

    public boolean isKilled() {
        return killed;
    }

    /**
     * @throws JobKilledException a new instance on every call, with the kill reason as cause,
     *         if {@link #kill(Throwable)} has been called
     */
    public void ensureNotKilled() {
        if (killed) {
            throw JobKilledException.of(killReason);
        }
    }

    @Override
    public String toString() {
        return "ExecutionContext{jobId=" + jobId + ", killed=" + isKilled() + '}';
    }
}
