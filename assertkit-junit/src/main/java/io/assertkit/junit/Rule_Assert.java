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

package io.assertkit.junit;

import org.junit.ClassRule;
import org.junit.Rule;
import org.junit.rules.TestRule;
import org.junit.runner.Description;
import org.junit.runners.model.Statement;

import io.assertkit.AssertKit;
import io.assertkit.abstractunit.AbstractAssertReporter;

/**
 * {@link Rule} which acts as the {@link io.assertkit.AssertReporter AssertReporter} for the current JUnit 4 test:
 * aborting checks throw out of the test method right away, while continuing checks are collected, and fail the test
 * when its body has finished.
 * <p>
 * {@link Rule_Assert} shall be considered a {@link Rule}, <b>not</b> a {@link ClassRule}, since it tracks the failures
 * of one test method at a time. Therefore to utilize {@link Rule_Assert} one should add it to a test class in this
 * fashion:
 *
 * <pre>
 *     public class YourTestClass {
 *         &#64;Rule
 *         public final Rule_Assert _assert = Rule_Assert.create();
 *
 *         &#64;Test
 *         public void yourTest() {
 *             String file = _assert.createFile("some content");
 *             _assert.requireNoError(doSetup(file), "Setup must work");
 *             _assert.assertEqual(compute(), 42, "Wrong answer");
 *             _assert.assertContains(describe(), "answer", "Description lacks the answer");
 *         }
 *     }
 * </pre>
 *
 * The rule can also be handed to a shared {@link AssertKit} as the reporter, e.g.
 * <code>KIT.assertEqual(_assert, actual, expected, "msg")</code>.
 */
public class Rule_Assert extends AbstractAssertReporter implements TestRule {

    protected Rule_Assert(AssertKit assertKit) {
        super(assertKit);
    }

    /**
     * Creates a {@link Rule_Assert} using {@link AssertKit#create() the default AssertKit}.
     */
    public static Rule_Assert create() {
        return new Rule_Assert(AssertKit.create());
    }

    /**
     * Creates a {@link Rule_Assert} using the given AssertKit configuration, e.g. with other skips or output.
     */
    public static Rule_Assert create(AssertKit assertKit) {
        return new Rule_Assert(assertKit);
    }

    // ================== Junit LifeCycle =============================================================================

    @Override
    public Statement apply(Statement base, Description description) {
        // :: Rule handling.
        if (!description.isTest()) {
            throw new IllegalStateException("The Rule_Assert should be applied as a @Rule, NOT as a @ClassRule");
        }
        String testName = description.getDisplayName();
        return new Statement() {
            public void evaluate() throws Throwable {
                beforeEach(testName);
                try {
                    base.evaluate();
                }
                catch (Throwable t) {
                    // :: The test threw, e.g. aborted: keep any earlier marked failures with it.
                    attachMarkedFailures(t);
                    throw t;
                }
                afterEach(testName);
            }
        };
    }
}
