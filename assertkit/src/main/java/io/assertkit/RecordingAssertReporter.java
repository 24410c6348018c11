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

import io.assertkit.abstractunit.AbstractAssertReporter;

/**
 * Framework-neutral {@link AssertReporter}, for when the test harness is neither JUnit 4 nor Jupiter, e.g. a
 * <code>main()</code> driven smoke test. Call {@link #beforeEach(String)} and {@link #afterEach(String)} around each
 * test yourself, or just inspect {@link #isFailed()} and {@link #getFailures()}.
 */
public class RecordingAssertReporter extends AbstractAssertReporter {

    protected RecordingAssertReporter(AssertKit assertKit) {
        super(assertKit);
    }

    /**
     * Creates a {@link RecordingAssertReporter} using {@link AssertKit#create() the default AssertKit}.
     */
    public static RecordingAssertReporter create() {
        return new RecordingAssertReporter(AssertKit.create());
    }

    /**
     * Creates a {@link RecordingAssertReporter} using the given AssertKit configuration.
     */
    public static RecordingAssertReporter create(AssertKit assertKit) {
        return new RecordingAssertReporter(assertKit);
    }
}
