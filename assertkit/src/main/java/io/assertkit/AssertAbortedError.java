/*
 * Copyright 2025 The AssertKit Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.assertkit;

/**
 * Thrown to unwind a test when an aborting check fails, i.e. {@link AssertKit#requireNoError(AssertReporter,
 * Throwable, String) requireNoError(..)}, {@link AssertKit#requireError(AssertReporter, Throwable, String)
 * requireError(..)} or one of the steps of {@link AssertKit#createFile(AssertReporter, byte[]) createFile(..)}.
 * <p>
 * It is an {@link AssertionError}, so every test framework reports it as a failed test rather than an errored one.
 */
public class AssertAbortedError extends AssertionError {
    private static final long serialVersionUID = 1L;

    public AssertAbortedError(String diagnostic) {
        super(diagnostic);
    }

    public AssertAbortedError(String diagnostic, Throwable cause) {
        super(diagnostic, cause);
    }
}
