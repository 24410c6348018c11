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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the aborting checks {@link AssertKit#requireNoError(AssertReporter, Throwable, String)} and
 * {@link AssertKit#requireError(AssertReporter, Throwable, String)}.
 */
public class Test_AssertKit_Aborting {
    private static final String FILE = "Test_AssertKit_Aborting.java";

    private ByteArrayOutputStream _out;
    private AssertKit _kit;

    @Before
    public void setupKit() {
        _out = new ByteArrayOutputStream();
        _kit = AssertKit.create().withOutput(new PrintStream(_out, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return _out.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void requireNoError_null_doesNothing() {
        AssertReporter reporter = mock(AssertReporter.class);

        _kit.requireNoError(reporter, null, "should not print");

        verifyNoInteractions(reporter);
        Assert.assertEquals("", output());
    }

    @Test
    public void requireNoError_error_printsTwoLinesAndAborts() {
        RecordingAssertReporter reporter = RecordingAssertReporter.create(_kit);
        IOException err = new IOException("disk on fire");

        int line = CallerLocation.here().getLineNumber() + 2;
        try {
            _kit.requireNoError(reporter, err, "setup failed");
            Assert.fail("Should have aborted.");
        }
        catch (AssertAbortedError e) {
            Assert.assertSame(err, e.getCause());
        }

        Assert.assertEquals("\t" + FILE + ":" + line + ": setup failed\n"
                + "\t" + FILE + ":" + line + ": java.io.IOException: disk on fire\n\n", output());
        Assert.assertTrue(reporter.isAborted());
        Assert.assertTrue(reporter.getMarkedFailures().isEmpty());
    }

    @Test
    public void requireNoError_statementsAfterAbortDoNotRun() {
        RecordingAssertReporter reporter = RecordingAssertReporter.create(_kit);
        boolean sentinel = false;
        try {
            _kit.requireNoError(reporter, new IllegalStateException("boom"), "setup failed");
            sentinel = true;
        }
        catch (AssertAbortedError e) {
            Assert.assertTrue(e.getMessage().contains("setup failed"));
        }
        Assert.assertFalse("The statement after an aborting check must not run.", sentinel);
    }

    @Test
    public void requireNoError_reporterThatReturns_isStillUnwound() {
        // A mock's abortNow(..) just returns - the kit must then throw by itself.
        AssertReporter reporter = mock(AssertReporter.class);
        RuntimeException err = new RuntimeException("nope");
        boolean sentinel = false;
        try {
            _kit.requireNoError(reporter, err, "setup failed");
            sentinel = true;
        }
        catch (AssertAbortedError e) {
            Assert.assertSame(err, e.getCause());
        }
        Assert.assertFalse(sentinel);
        verify(reporter).abortNow(anyString(), same(err));
        verify(reporter, never()).markFailed(anyString());
    }

    @Test
    public void requireError_error_doesNothing() {
        AssertReporter reporter = mock(AssertReporter.class);

        _kit.requireError(reporter, new IOException("expected"), "should not print");

        verifyNoInteractions(reporter);
        Assert.assertEquals("", output());
    }

    @Test
    public void requireError_null_printsOneLineAndAborts() {
        AssertReporter reporter = mock(AssertReporter.class);

        int line = CallerLocation.here().getLineNumber() + 2;
        try {
            _kit.requireError(reporter, null, "expected parse to fail");
            Assert.fail("Should have aborted.");
        }
        catch (AssertAbortedError e) {
            Assert.assertNull(e.getCause());
        }

        Assert.assertEquals("\t" + FILE + ":" + line + ": expected parse to fail\n", output());
        verify(reporter).abortNow(anyString(), isNull());
    }

    @Test
    public void abortingChecks_requireReporter() {
        Assert.assertThrows(NullPointerException.class,
                () -> _kit.requireNoError(null, new IOException(), "x"));
        Assert.assertThrows(NullPointerException.class,
                () -> _kit.requireError(null, null, "x"));
    }

    @Test
    public void diagnosticIsHandedToReporter() {
        AssertReporter reporter = mock(AssertReporter.class);
        int line = CallerLocation.here().getLineNumber() + 2;
        try {
            _kit.requireNoError(reporter, new IOException("gone"), "load failed");
        }
        catch (AssertAbortedError e) {
            Assert.assertEquals("\t" + FILE + ":" + line + ": load failed\n"
                    + "\t" + FILE + ":" + line + ": java.io.IOException: gone", e.getMessage());
        }
        verify(reporter).abortNow(any(String.class), any(IOException.class));
    }
}
