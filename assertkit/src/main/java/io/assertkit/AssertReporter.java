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
 * The test-execution context that {@link AssertKit} signals failures to. The helper never creates or holds on to a
 * reporter, it is passed in on every call.
 * <p>
 * Two capabilities are needed:
 * <ul>
 * <li>{@link #markFailed()}: record that the current test has failed, but let it continue running, so that a single
 * test can report several independent failures.</li>
 * <li>{@link #abortNow()}: record that the current test has failed, and stop it immediately. In Java this means
 * throwing, typically an {@link AssertAbortedError}. An implementation that returns normally is tolerated:
 * {@link AssertKit} then throws {@link AssertAbortedError} itself, so no statement after an aborting check runs.</li>
 * </ul>
 * The two variants taking the printed diagnostic default to the no-args methods; adapters that want to summarize
 * what failed override those.
 *
 * @see io.assertkit.abstractunit.AbstractAssertReporter
 * @see RecordingAssertReporter
 */
public interface AssertReporter {
    /**
     * Records a failure; the test continues.
     */
    void markFailed();

    /**
     * Records a failure and unwinds the current test. Should not return normally.
     */
    void abortNow();

    /**
     * Same as {@link #markFailed()}, with the diagnostic that was printed for the failure.
     *
     * @param diagnostic
     *            the failure's diagnostic text, location included.
     */
    default void markFailed(String diagnostic) {
        markFailed();
    }

    /**
     * Same as {@link #abortNow()}, with the diagnostic that was printed for the failure.
     *
     * @param diagnostic
     *            the failure's diagnostic text, location included.
     */
    default void abortNow(String diagnostic) {
        abortNow();
    }

    /**
     * Same as {@link #abortNow(String)}, also carrying the error that caused the abort, if any.
     *
     * @param diagnostic
     *            the failure's diagnostic text, location included.
     * @param cause
     *            the unexpected error, or <code>null</code> if the abort was due to a missing error.
     */
    default void abortNow(String diagnostic, Throwable cause) {
        abortNow(diagnostic);
    }
}
