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

package io.assertkit.jupiter;

import java.util.Set;

import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.assertkit.AssertKit;
import io.assertkit.AssertReporter;
import io.assertkit.abstractunit.AbstractAssertReporter;

/**
 * Jupiter extension which acts as the {@link AssertReporter} for the current test: aborting checks throw out of the
 * test method right away, while continuing checks are collected, and fail the test in the
 * {@link AfterEachCallback after each} phase.
 * <p>
 * {@link Extension_Assert} shall be annotated with
 * {@link org.junit.jupiter.api.extension.RegisterExtension @RegisterExtension} on an instance field, as it tracks the
 * failures of one test method at a time. It can be viewed in the same manner as one would view a Rule in JUnit4.
 * <p>
 * Example:
 *
 * <pre>
 *     public class YourTestClass {
 *         &#64;RegisterExtension
 *         public final Extension_Assert _assert = Extension_Assert.create();
 *
 *         &#64;Test
 *         public void yourTest() {
 *             _assert.requireNoError(doSetup(), "Setup must work");
 *             _assert.assertEqual(compute(), 42, "Wrong answer");
 *         }
 *     }
 * </pre>
 *
 * It may also be used with {@link org.junit.jupiter.api.extension.ExtendWith @ExtendWith}, in which case the reporter
 * is injected as a test method parameter of type {@link AssertReporter}, {@link AssertKit} or {@link Extension_Assert}:
 *
 * <pre>
 *     &#64;ExtendWith(Extension_Assert.class)
 *     public class YourTestClass {
 *         &#64;Test
 *         public void yourTest(Extension_Assert asserts) {
 *             asserts.assertContains(describe(), "answer", "Description lacks the answer");
 *         }
 *     }
 * </pre>
 *
 * Note that the {@link AssertKit} parameter is bound to nothing: pass the {@link AssertReporter} parameter along to
 * its methods.
 */
public class Extension_Assert extends AbstractAssertReporter implements BeforeEachCallback, AfterEachCallback,
        ParameterResolver {
    private static final Logger log = LoggerFactory.getLogger(Extension_Assert.class);

    // This corresponds to what #resolveParameter hands out
    private static final Set<Class<?>> SUPPORTED_TYPES = Set.of(
            Extension_Assert.class, AssertReporter.class, AssertKit.class);

    /**
     * For {@link org.junit.jupiter.api.extension.ExtendWith @ExtendWith}: uses {@link AssertKit#create() the default
     * AssertKit}. Use {@link #create()} or {@link #create(AssertKit)} with
     * {@link org.junit.jupiter.api.extension.RegisterExtension @RegisterExtension}.
     */
    public Extension_Assert() {
        this(AssertKit.create());
    }

    protected Extension_Assert(AssertKit assertKit) {
        super(assertKit);
    }

    /**
     * Creates an {@link Extension_Assert} using {@link AssertKit#create() the default AssertKit}.
     */
    public static Extension_Assert create() {
        return new Extension_Assert(AssertKit.create());
    }

    /**
     * Creates an {@link Extension_Assert} using the given AssertKit configuration, e.g. with other skips or output.
     */
    public static Extension_Assert create(AssertKit assertKit) {
        return new Extension_Assert(assertKit);
    }

    /**
     * Executed by Jupiter before each test method.
     */
    @Override
    public void beforeEach(ExtensionContext context) {
        beforeEach(context.getUniqueId());
    }

    /**
     * Executed by Jupiter after each test method, also when it threw. Throwing from here fails the test, or, if it
     * already failed, attaches our summary to the failure as suppressed.
     */
    @Override
    public void afterEach(ExtensionContext context) {
        if (context.getExecutionException().isPresent() && log.isDebugEnabled()) {
            log.debug(LOG_PREFIX + "afterEach: test [" + context.getDisplayName() + "] threw ["
                    + context.getExecutionException().get().getClass().getSimpleName() + "], verifying anyway.");
        }
        afterEach(context.getUniqueId());
    }

    // ================== ParameterResolver ===========================================================================

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        return SUPPORTED_TYPES.contains(parameterContext.getParameter().getType());
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        Class<?> type = parameterContext.getParameter().getType();
        if (type.equals(Extension_Assert.class) || type.equals(AssertReporter.class)) {
            return this;
        }
        if (type.equals(AssertKit.class)) {
            return getAssertKit();
        }
        throw new IllegalStateException("Could not resolve parameter [" + parameterContext.getParameter() + "].");
    }
}
