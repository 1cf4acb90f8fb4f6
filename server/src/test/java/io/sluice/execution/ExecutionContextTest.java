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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import java.io.IOException;
import java.util.UUID;

import org.junit.Test;

import io.sluice.exceptions.JobKilledException;

public class ExecutionContextTest {

    @Test
    public void test_new_context_is_not_killed() {
        ExecutionContext ctx = new ExecutionContext(UUID.randomUUID());

        assertThat(ctx.isKilled()).isFalse();
        ctx.ensureNotKilled();
    }

    @Test
    public void test_kill_without_reason() {
        ExecutionContext ctx = ExecutionContext.newContext();
        ctx.kill(null);

        assertThat(ctx.isKilled()).isTrue();
        assertThatThrownBy(ctx::ensureNotKilled)
            .isExactlyInstanceOf(JobKilledException.class)
            .hasMessage("Job killed");
    }

    @Test
    public void test_kill_reason_is_part_of_the_message_and_first_kill_wins() {
        ExecutionContext ctx = ExecutionContext.newContext();
        ctx.kill(new IllegalStateException("client disconnected"));
        ctx.kill(new IllegalStateException("shutdown"));

        assertThatThrownBy(ctx::ensureNotKilled)
            .isExactlyInstanceOf(JobKilledException.class)
            .hasMessage("Job killed. client disconnected");
    }

    @Test
    public void test_kill_reason_is_kept_as_cause() {
        ExecutionContext ctx = ExecutionContext.newContext();
        IllegalStateException reason = new IllegalStateException("client disconnected");
        ctx.kill(reason);

        assertThatThrownBy(ctx::ensureNotKilled)
            .isExactlyInstanceOf(JobKilledException.class)
            .hasCause(reason);
    }

    @Test
    public void test_every_check_throws_a_new_exception() {
        ExecutionContext ctx = ExecutionContext.newContext();
        ctx.kill(new JobKilledException());

        JobKilledException first = catchThrowableOfType(ctx::ensureNotKilled, JobKilledException.class);
        first.addSuppressed(new IOException("drop failed"));
        JobKilledException second = catchThrowableOfType(ctx::ensureNotKilled, JobKilledException.class);

        assertThat(second).isNotSameAs(first);
        assertThat(second.getSuppressed()).isEmpty();
        assertThat(second).hasMessage("Job killed");
    }
}
