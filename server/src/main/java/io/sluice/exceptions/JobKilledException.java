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

package io.sluice.exceptions;

import java.util.Locale;

import javax.annotation.Nullable;

public class JobKilledException extends RuntimeException {

    public static final String MESSAGE = "Job killed";

    /**
     * Creates a new exception for a job killed because of {@code reason}, which becomes the cause.
     */
    public static JobKilledException of(@Nullable Throwable reason) {
        if (reason == null) {
            return new JobKilledException();
        }
        if (reason instanceof JobKilledException || reason.getMessage() == null) {
            return new JobKilledException(reason.getMessage() == null ? MESSAGE : reason.getMessage(), reason);
        }
        return new JobKilledException(String.format(Locale.ENGLISH, "%s. %s", MESSAGE, reason.getMessage()), reason);
    }

    private JobKilledException(String message, Throwable cause) {
        super(message, cause);
    }

    public JobKilledException() {
        super(MESSAGE);
    }
}
