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

package io.assertkit.abstractunit;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.assertkit.AssertAbortedError;
import io.assertkit.AssertKit;
import io.assertkit.AssertReporter;

/**
 * Base class containing common code for the reporters located in the following modules:
 * <ul>
 * <li>assertkit - {@link io.assertkit.RecordingAssertReporter RecordingAssertReporter}</li>
 * <li>assertkit-junit - <code>Rule_Assert</code></li>
 * <li>assertkit-jupiter - <code>Extension_Assert</code></li>
 * </ul>
 * Keeps the failures of the current test: {@link #markFailed(String) marked} failures are recorded and the test goes
 * on, while {@link #abortNow(String, Throwable) aborts} are recorded and then thrown as {@link AssertAbortedError}.
 * When the test body is done, {@link #afterEach(String)} throws an {@link AssertionError} summarizing the marked
 * failures, if any - this is what makes the host framework report the test as failed.
 * <p>
 * The life cycle methods {@link #beforeEach(String)} and {@link #afterEach(String)} should be called through the use of
 * JUnit's and Jupiter's life cycle mechanisms.
 * <p>
 * For convenience, the {@link AssertKit} operations are also available directly on the reporter, bound to itself,
 * e.g. {@link #assertEqual(Object, Object, Object)}. The reported location is still the test's line, as the frames of
 * the reporter class hierarchy are registered as {@link AssertKit#withWrapperClasses(Class[]) wrapper classes}.
 */
public abstract class AbstractAssertReporter implements AssertReporter {
    private static final Logger log = LoggerFactory.getLogger(AbstractAssertReporter.class);
    protected static final String LOG_PREFIX = AssertKit.LOG_PREFIX;

    protected final AssertKit _assertKit;
    protected final CopyOnWriteArrayList<RecordedFailure> _failures = new CopyOnWriteArrayList<>();

    protected AbstractAssertReporter(AssertKit assertKit) {
        _assertKit = withOwnFrames(assertKit);
    }

    private AssertKit withOwnFrames(AssertKit assertKit) {
        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> clazz = getClass(); clazz != null && clazz != Object.class; clazz = clazz.getSuperclass()) {
            hierarchy.add(clazz);
        }
        return assertKit.withWrapperClasses(hierarchy.toArray(new Class<?>[0]));
    }

    // ================== Life cycle ==================================================================================

    /**
     * Clears the failures from any previous test. Called before each test.
     */
    public void beforeEach(String testName) {
        if (log.isDebugEnabled()) log.debug(LOG_PREFIX + "beforeEach: [" + testName + "] on " + idThis());
        _failures.clear();
    }

    /**
     * Throws an {@link AssertionError} if any failures were {@link #markFailed(String) marked} during the test. Called
     * after each test.
     */
    public void afterEach(String testName) {
        if (log.isDebugEnabled()) log.debug(LOG_PREFIX + "afterEach: [" + testName + "] on " + idThis());
        List<String> marked = getMarkedFailures();
        if (!marked.isEmpty()) {
            log.info(LOG_PREFIX + "Test [" + testName + "] had [" + marked.size() + "] failed assertion(s),"
                    + " failing it.");
        }
        verify();
    }

    /**
     * @throws AssertionError
     *             summarizing all {@link #markFailed(String) marked} failures, if there were any.
     */
    public void verify() throws AssertionError {
        AssertionError summary = summarizeMarkedFailures();
        if (summary != null) {
            throw summary;
        }
    }

    /**
     * If the test threw, e.g. by an {@link #abortNow(String, Throwable) abort}, any failures marked before that are
     * attached to the thrown as suppressed, so that they are not lost.
     */
    public void attachMarkedFailures(Throwable thrown) {
        AssertionError summary = summarizeMarkedFailures();
        if (summary != null) {
            thrown.addSuppressed(summary);
        }
    }

    private AssertionError summarizeMarkedFailures() {
        List<String> marked = getMarkedFailures();
        if (marked.isEmpty()) {
            return null;
        }
        StringBuilder buf = new StringBuilder();
        buf.append(marked.size()).append(" assertion(s) failed:");
        for (String diagnostic : marked) {
            buf.append('\n').append(diagnostic);
        }
        return new AssertionError(buf.toString());
    }

    // ================== AssertReporter ==============================================================================

    @Override
    public void markFailed() {
        markFailed("Failure marked without diagnostic.");
    }

    @Override
    public void markFailed(String diagnostic) {
        if (log.isDebugEnabled()) log.debug(LOG_PREFIX + "markFailed on " + idThis() + ": " + diagnostic);
        _failures.add(new RecordedFailure(false, diagnostic));
    }

    @Override
    public void abortNow() {
        abortNow("Test aborted without diagnostic.", null);
    }

    @Override
    public void abortNow(String diagnostic) {
        abortNow(diagnostic, null);
    }

    @Override
    public void abortNow(String diagnostic, Throwable cause) {
        if (log.isDebugEnabled()) log.debug(LOG_PREFIX + "abortNow on " + idThis() + ": " + diagnostic);
        _failures.add(new RecordedFailure(true, diagnostic));
        throw new AssertAbortedError(diagnostic, cause);
    }

    // ================== State =======================================================================================

    /**
     * @return whether any failure, marked or aborting, has been recorded for the current test.
     */
    public boolean isFailed() {
        return !_failures.isEmpty();
    }

    /**
     * @return whether the current test has been aborted.
     */
    public boolean isAborted() {
        for (RecordedFailure failure : _failures) {
            if (failure.isAbort()) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return all failures of the current test, in the order they happened.
     */
    public List<RecordedFailure> getFailures() {
        return new ArrayList<>(_failures);
    }

    /**
     * @return the diagnostics of the {@link #markFailed(String) marked} (non-aborting) failures of the current test.
     */
    public List<String> getMarkedFailures() {
        List<String> marked = new ArrayList<>();
        for (RecordedFailure failure : _failures) {
            if (!failure.isAbort()) {
                marked.add(failure.getDiagnostic());
            }
        }
        return marked;
    }

    /**
     * @return the {@link AssertKit} bound to this reporter, i.e. the one used by the convenience methods.
     */
    public AssertKit getAssertKit() {
        return _assertKit;
    }

    // ================== Convenience: AssertKit operations bound to this reporter ====================================

    /**
     * @see AssertKit#requireNoError(AssertReporter, Throwable, String)
     */
    public void requireNoError(Throwable err, String message) {
        _assertKit.requireNoError(this, err, message);
    }

    /**
     * @see AssertKit#requireError(AssertReporter, Throwable, String)
     */
    public void requireError(Throwable err, String message) {
        _assertKit.requireError(this, err, message);
    }

    /**
     * @see AssertKit#assertEqual(AssertReporter, Object, Object, Object)
     */
    public void assertEqual(Object actual, Object expected, Object message) {
        _assertKit.assertEqual(this, actual, expected, message);
    }

    /**
     * @see AssertKit#assertContains(AssertReporter, String, String, String)
     */
    public void assertContains(String total, String part, String message) {
        _assertKit.assertContains(this, total, part, message);
    }

    /**
     * @see AssertKit#createFile(AssertReporter, String)
     */
    public String createFile(String content) {
        return _assertKit.createFile(this, content);
    }

    /**
     * @see AssertKit#createFile(AssertReporter, byte[])
     */
    public String createFile(byte[] content) {
        return _assertKit.createFile(this, content);
    }

    protected String idThis() {
        return getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(this));
    }

    /**
     * A failure recorded by the reporter: its printed diagnostic, and whether it aborted the test.
     */
    public static final class RecordedFailure {
        private final boolean _abort;
        private final String _diagnostic;

        RecordedFailure(boolean abort, String diagnostic) {
            _abort = abort;
            _diagnostic = diagnostic;
        }

        public boolean isAbort() {
            return _abort;
        }

        public String getDiagnostic() {
            return _diagnostic;
        }

        @Override
        public String toString() {
            return (_abort ? "ABORT: " : "FAILED: ") + _diagnostic;
        }
    }
}
