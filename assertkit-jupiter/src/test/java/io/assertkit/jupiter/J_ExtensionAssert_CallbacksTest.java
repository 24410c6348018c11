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

import static org.mockito.Mockito.when;

import java.lang.reflect.Parameter;
import java.util.Optional;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.assertkit.AssertAbortedError;
import io.assertkit.AssertKit;
import io.assertkit.AssertReporter;

/**
 * Drives the Jupiter callbacks of {@link Extension_Assert} directly, with Mockito standing in for Jupiter.
 */
@ExtendWith(MockitoExtension.class)
public class J_ExtensionAssert_CallbacksTest {

    @Mock
    private ExtensionContext _context;

    @Mock
    private ParameterContext _parameterContext;

    @Test
    void afterEach_withMarkedFailure_throws() {
        when(_context.getUniqueId()).thenReturn("[engine:junit-jupiter]/[method:mocked()]");
        when(_context.getExecutionException()).thenReturn(Optional.empty());
        Extension_Assert extension = Extension_Assert.create();

        extension.beforeEach(_context);
        extension.assertEqual(1, 2, "mocked mismatch");
        AssertionError summary = Assertions.assertThrows(AssertionError.class, () -> extension.afterEach(_context));

        Assertions.assertTrue(summary.getMessage().contains("mocked mismatch"));
    }

    @Test
    void afterEach_withoutFailures_passes() {
        when(_context.getUniqueId()).thenReturn("[engine:junit-jupiter]/[method:mocked()]");
        when(_context.getExecutionException()).thenReturn(Optional.empty());
        Extension_Assert extension = Extension_Assert.create();

        extension.beforeEach(_context);
        extension.assertEqual(1, 1, "fine");
        extension.afterEach(_context);
    }

    @Test
    void beforeEach_clearsPreviousFailures() {
        when(_context.getUniqueId()).thenReturn("[engine:junit-jupiter]/[method:mocked()]");
        Extension_Assert extension = Extension_Assert.create();

        Assertions.assertThrows(AssertAbortedError.class, () -> extension.requireError(null, "left over"));
        Assertions.assertTrue(extension.isFailed());

        extension.beforeEach(_context);

        Assertions.assertFalse(extension.isFailed());
    }

    @Test
    void parameterResolution() throws NoSuchMethodException {
        Extension_Assert extension = Extension_Assert.create();
        Parameter[] parameters = Sample.class.getDeclaredMethod("sample", AssertReporter.class, AssertKit.class,
                Extension_Assert.class, String.class).getParameters();

        when(_parameterContext.getParameter()).thenReturn(parameters[0]);
        Assertions.assertTrue(extension.supportsParameter(_parameterContext, _context));
        Assertions.assertSame(extension, extension.resolveParameter(_parameterContext, _context));

        when(_parameterContext.getParameter()).thenReturn(parameters[1]);
        Assertions.assertTrue(extension.supportsParameter(_parameterContext, _context));
        Assertions.assertSame(extension.getAssertKit(), extension.resolveParameter(_parameterContext, _context));

        when(_parameterContext.getParameter()).thenReturn(parameters[2]);
        Assertions.assertSame(extension, extension.resolveParameter(_parameterContext, _context));

        when(_parameterContext.getParameter()).thenReturn(parameters[3]);
        Assertions.assertFalse(extension.supportsParameter(_parameterContext, _context));
        Assertions.assertThrows(IllegalStateException.class,
                () -> extension.resolveParameter(_parameterContext, _context));
    }

    static class Sample {
        void sample(AssertReporter reporter, AssertKit kit, Extension_Assert extension, String other) {
        }
    }
}
