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

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Small assertion helpers for tests, signalling failures to an {@link AssertReporter} that is passed in on every
 * call:
 * <ul>
 * <li><b>Aborting</b>: {@link #requireNoError(AssertReporter, Throwable, String) requireNoError(..)} and
 * {@link #requireError(AssertReporter, Throwable, String) requireError(..)} - on failure the test is stopped at once,
 * typically used for setup whose failure makes the rest of the test meaningless.</li>
 * <li><b>Continuing</b>: {@link #assertEqual(AssertReporter, Object, Object, Object) assertEqual(..)} (deep structural
 * equality, see {@link DeepEquals}) and {@link #assertContains(AssertReporter, String, String, String)
 * assertContains(..)} - on failure the test is marked failed, but runs on, so that one test can report several
 * independent failures.</li>
 * <li>{@link #createFile(AssertReporter, String) createFile(..)} - writes a temporary file, aborting on any I/O
 * problem. <b>The caller must delete the file.</b></li>
 * </ul>
 * A failing check prints a diagnostic to standard out (or {@link #withOutput(PrintStream) the configured stream}), in
 * the format
 *
 * <pre>
 * \t{file}:{line}: {message}
 * \t{file}:{line}: {detail}
 * </pre>
 *
 * followed by an empty line, where file and line is the {@link CallerLocation} of the failing call.
 * {@link #requireError(AssertReporter, Throwable, String) requireError(..)} has no detail, and thus prints only the
 * first line.
 * <p>
 * Instances are immutable and thread-safe: the <code>with...</code> methods return new instances. The defaults for
 * skips and temp file prefix can be set with the system properties {@value #SYSTEM_PROPERTY_SKIPS} and
 * {@value #SYSTEM_PROPERTY_TEMP_FILE_PREFIX}, read when this class is loaded.
 * <p>
 * Usage, with some reporter - see the <code>assertkit-junit</code> and <code>assertkit-jupiter</code> modules for
 * ready-made ones:
 *
 * <pre>
 * private static final AssertKit ASSERT = AssertKit.create();
 *
 * &#64;Test
 * public void parseConfig() {
 *     String file = ASSERT.createFile(reporter, "name=value\n");
 *     ASSERT.requireNoError(reporter, loadConfigError(file), "Expected config to load");
 *     ASSERT.assertEqual(reporter, config.get("name"), "value", "Wrong value for 'name'");
 * }
 * </pre>
 */
public final class AssertKit {
    private static final Logger log = LoggerFactory.getLogger(AssertKit.class);
    /**
     * Prefix of all AssertKit log lines, also used by the reporters.
     */
    public static final String LOG_PREFIX = "#ASSERTKIT# ";

    public static final String SYSTEM_PROPERTY_SKIPS = "assertkit.skips";
    public static final String SYSTEM_PROPERTY_TEMP_FILE_PREFIX = "assertkit.tempFilePrefix";

    /**
     * The default skips, from system property {@value #SYSTEM_PROPERTY_SKIPS}, falling back to <code>1</code>, which
     * is the direct caller of the assertion method.
     */
    public static final int DEFAULT_SKIPS;

    /**
     * The default temp file name prefix, from system property {@value #SYSTEM_PROPERTY_TEMP_FILE_PREFIX}, falling
     * back to <code>"assertkit"</code>.
     */
    public static final String DEFAULT_TEMP_FILE_PREFIX;

    static {
        DEFAULT_SKIPS = parseSkips(System.getProperty(SYSTEM_PROPERTY_SKIPS));
        DEFAULT_TEMP_FILE_PREFIX = parsePrefix(System.getProperty(SYSTEM_PROPERTY_TEMP_FILE_PREFIX));
    }

    /**
     * @return the skips given by the property value, or <code>1</code> if <code>null</code>, not an integer or
     *         negative, the latter two logged at WARN.
     */
    static int parseSkips(String skipsProperty) {
        int skips = 1;
        if (skipsProperty == null) {
            return skips;
        }
        try {
            int parsed = Integer.parseInt(skipsProperty.trim());
            if (parsed >= 0) {
                return parsed;
            }
            log.warn(LOG_PREFIX + "System property [" + SYSTEM_PROPERTY_SKIPS + "] is negative ["
                    + skipsProperty + "], using default [" + skips + "].");
        }
        catch (NumberFormatException e) {
            log.warn(LOG_PREFIX + "System property [" + SYSTEM_PROPERTY_SKIPS + "] is not an integer ["
                    + skipsProperty + "], using default [" + skips + "].");
        }
        return skips;
    }

    /**
     * @return the prefix given by the property value, or <code>"assertkit"</code> if <code>null</code>, empty or
     *         containing a path separator, the latter two logged at WARN.
     */
    static String parsePrefix(String prefixProperty) {
        String prefix = "assertkit";
        if (prefixProperty == null) {
            return prefix;
        }
        if (!isValidTempFilePrefix(prefixProperty)) {
            log.warn(LOG_PREFIX + "System property [" + SYSTEM_PROPERTY_TEMP_FILE_PREFIX + "] is not a valid file"
                    + " name prefix [" + prefixProperty + "], using default [" + prefix + "].");
            return prefix;
        }
        return prefixProperty;
    }

    private static final AssertKit DEFAULT = new AssertKit(DEFAULT_SKIPS, null, DEFAULT_TEMP_FILE_PREFIX, null,
            Collections.singleton(AssertKit.class.getName()), null);

    private final int _skips;
    private final PrintStream _output;
    private final String _tempFilePrefix;
    private final Path _tempDirectory;
    private final Set<String> _wrapperClassNames;
    private final CallerLocation _fixedLocation;

    private AssertKit(int skips, PrintStream output, String tempFilePrefix, Path tempDirectory,
            Set<String> wrapperClassNames, CallerLocation fixedLocation) {
        _skips = skips;
        _output = output;
        _tempFilePrefix = tempFilePrefix;
        _tempDirectory = tempDirectory;
        _wrapperClassNames = wrapperClassNames;
        _fixedLocation = fixedLocation;
    }

    /**
     * @return an AssertKit with the default settings: skips {@link #DEFAULT_SKIPS}, printing to
     *         <code>System.out</code>, temp file prefix {@link #DEFAULT_TEMP_FILE_PREFIX}.
     */
    public static AssertKit create() {
        return DEFAULT;
    }

    // ===== Configuration

    /**
     * @param skips
     *            how many stack frames above the assertion helper's own frames the reported location is taken from.
     *            <code>1</code> is the direct caller of the assertion method, add one for each level of your own
     *            wrapper methods. <code>0</code> reports the helper's own frame.
     * @return a new AssertKit with the given skips.
     */
    public AssertKit withSkips(int skips) {
        if (skips < 0) {
            throw new IllegalArgumentException("skips must be >= 0, was [" + skips + "].");
        }
        return new AssertKit(skips, _output, _tempFilePrefix, _tempDirectory, _wrapperClassNames, _fixedLocation);
    }

    /**
     * @param output
     *            the stream to print diagnostics to. <code>null</code> means whatever <code>System.out</code> is at the
     *            time of the failing check.
     * @return a new AssertKit printing to the given stream.
     */
    public AssertKit withOutput(PrintStream output) {
        return new AssertKit(_skips, output, _tempFilePrefix, _tempDirectory, _wrapperClassNames, _fixedLocation);
    }

    /**
     * @param tempFilePrefix
     *            the name prefix for files made by {@link #createFile(AssertReporter, byte[]) createFile(..)}. Must be
     *            non-empty, and not contain a path separator.
     * @return a new AssertKit using the given prefix.
     */
    public AssertKit withTempFilePrefix(String tempFilePrefix) {
        if (!isValidTempFilePrefix(tempFilePrefix)) {
            throw new IllegalArgumentException("tempFilePrefix must be non-empty and not contain path separators,"
                    + " was [" + tempFilePrefix + "].");
        }
        return new AssertKit(_skips, _output, tempFilePrefix, _tempDirectory, _wrapperClassNames, _fixedLocation);
    }

    /**
     * Registers your own wrapper classes around the assertion methods: their frames are skipped before
     * {@link #withSkips(int) skips} is counted, so that the reported location still is your test's line, not your
     * wrapper's. Frames of nested classes of the given classes are skipped too.
     *
     * @param wrapperClasses
     *            classes whose methods call into this AssertKit on behalf of the test.
     * @return a new AssertKit also skipping frames of the given classes.
     */
    public AssertKit withWrapperClasses(Class<?>... wrapperClasses) {
        Set<String> names = new LinkedHashSet<>(_wrapperClassNames);
        for (Class<?> wrapperClass : wrapperClasses) {
            names.add(wrapperClass.getName());
        }
        return new AssertKit(_skips, _output, _tempFilePrefix, _tempDirectory, Collections.unmodifiableSet(names),
                _fixedLocation);
    }

    /**
     * @param location
     *            a location captured by the caller, typically by {@link CallerLocation#here()}.
     * @return a new AssertKit reporting the given location for all failures, instead of inspecting the stack.
     */
    public AssertKit at(CallerLocation location) {
        return new AssertKit(_skips, _output, _tempFilePrefix, _tempDirectory, _wrapperClassNames,
                Objects.requireNonNull(location, "location"));
    }

    /**
     * Only for tests: makes {@link #createFile(AssertReporter, byte[]) createFile(..)} create its files in the given
     * directory instead of <code>java.io.tmpdir</code>.
     */
    AssertKit withTempDirectory(Path tempDirectory) {
        return new AssertKit(_skips, _output, _tempFilePrefix, Objects.requireNonNull(tempDirectory,
                "tempDirectory"), _wrapperClassNames, _fixedLocation);
    }

    public int getSkips() {
        return _skips;
    }

    /**
     * @return the configured output stream, or <code>null</code> if printing to <code>System.out</code>.
     */
    public PrintStream getOutput() {
        return _output;
    }

    public String getTempFilePrefix() {
        return _tempFilePrefix;
    }

    /**
     * @return the names of the classes whose frames are skipped, this class included.
     */
    public Set<String> getWrapperClassNames() {
        return _wrapperClassNames;
    }

    // ===== Aborting checks

    /**
     * Verifies that <code>err</code> is <code>null</code>. If not, prints the message and the error's description, and
     * aborts the test through {@link AssertReporter#abortNow(String, Throwable)}.
     *
     * @param reporter
     *            the current test's reporter.
     * @param err
     *            the error to check, <code>null</code> meaning success.
     * @param message
     *            what was expected, printed on failure.
     */
    public void requireNoError(AssertReporter reporter, Throwable err, String message) {
        Objects.requireNonNull(reporter, "reporter");
        if (err != null) {
            String diagnostic = printDiagnostic(locate(), message, err.toString());
            abort(reporter, diagnostic, err);
        }
    }

    /**
     * Verifies that <code>err</code> is not <code>null</code>, i.e. that an expected failure did occur. If it is
     * <code>null</code>, prints the message and aborts the test through
     * {@link AssertReporter#abortNow(String, Throwable)}.
     *
     * @param reporter
     *            the current test's reporter.
     * @param err
     *            the error that should have been raised.
     * @param message
     *            what was expected, printed on failure.
     */
    public void requireError(AssertReporter reporter, Throwable err, String message) {
        Objects.requireNonNull(reporter, "reporter");
        if (err == null) {
            String diagnostic = printDiagnostic(locate(), message, null);
            abort(reporter, diagnostic, null);
        }
    }

    // ===== Continuing checks

    /**
     * Verifies that <code>actual</code> is structurally equal to <code>expected</code>, as defined by
     * {@link DeepEquals}. If not, prints the message and both values, and marks the test failed through
     * {@link AssertReporter#markFailed(String)} - the test continues.
     *
     * @param reporter
     *            the current test's reporter.
     * @param actual
     *            the value produced.
     * @param expected
     *            the value wanted.
     * @param message
     *            printed on failure, using {@link String#valueOf(Object)}.
     */
    public void assertEqual(AssertReporter reporter, Object actual, Object expected, Object message) {
        Objects.requireNonNull(reporter, "reporter");
        if (!DeepEquals.deepEquals(actual, expected)) {
            String diagnostic = printDiagnostic(locate(), message,
                    ValueRenderer.render(actual) + " != " + ValueRenderer.render(expected));
            reporter.markFailed(diagnostic);
        }
    }

    /**
     * Verifies that <code>part</code> is a substring of <code>total</code>. The empty string is contained in every
     * string. If not contained, prints the message and both strings, and marks the test failed through
     * {@link AssertReporter#markFailed(String)} - the test continues. A <code>null</code> on either side is never
     * contained.
     *
     * @param reporter
     *            the current test's reporter.
     * @param total
     *            the string to search in.
     * @param part
     *            the string to search for.
     * @param message
     *            printed on failure.
     */
    public void assertContains(AssertReporter reporter, String total, String part, String message) {
        Objects.requireNonNull(reporter, "reporter");
        if (total == null || part == null || !total.contains(part)) {
            String diagnostic = printDiagnostic(locate(), message,
                    ValueRenderer.quote(total) + " doesn't contain " + ValueRenderer.quote(part));
            reporter.markFailed(diagnostic);
        }
    }

    // ===== Temporary files

    /**
     * Creates a temporary file containing the UTF-8 bytes of the given string.
     *
     * @see #createFile(AssertReporter, byte[])
     */
    public String createFile(AssertReporter reporter, String content) {
        return createFile(reporter, Objects.requireNonNull(content, "content").getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Creates a uniquely named file in the default temporary directory (<code>java.io.tmpdir</code>), named with
     * {@link #getTempFilePrefix() the prefix} and no suffix, writes the content, and closes it. Each of the steps create, write and
     * close is checked as with {@link #requireNoError(AssertReporter, Throwable, String) requireNoError(..)}, so any
     * I/O problem aborts the test. On such an abort, the file is left as it is, no cleanup is attempted.
     * <p>
     * <b>The caller owns the file, and must delete it.</b>
     *
     * @param reporter
     *            the current test's reporter.
     * @param content
     *            the bytes to write.
     * @return the absolute path of the created file.
     */
    public String createFile(AssertReporter reporter, byte[] content) {
        Objects.requireNonNull(reporter, "reporter");
        Objects.requireNonNull(content, "content");

        Path file = null;
        OutputStream out = null;
        IOException createError = null;
        try {
            // No suffix: the name is the prefix followed by a random number.
            file = _tempDirectory != null
                    ? Files.createTempFile(_tempDirectory, _tempFilePrefix, "")
                    : Files.createTempFile(_tempFilePrefix, "");
            out = Files.newOutputStream(file);
        }
        catch (IOException e) {
            createError = e;
        }
        requireNoError(reporter, createError, "Expected no error creating temporary file");

        IOException writeError = null;
        try {
            out.write(content);
        }
        catch (IOException e) {
            writeError = e;
            // The file stays, but don't leak the open handle.
            try {
                out.close();
            }
            catch (IOException closeError) {
                writeError.addSuppressed(closeError);
            }
        }
        requireNoError(reporter, writeError, "Expected no error writing to temporary file");

        IOException closeError = null;
        try {
            out.close();
        }
        catch (IOException e) {
            closeError = e;
        }
        requireNoError(reporter, closeError, "Expected no error closing temporary file");

        String path = file.toAbsolutePath().toString();
        if (log.isDebugEnabled()) log.debug(LOG_PREFIX + "Created temporary file [" + path + "] with ["
                + content.length + "] bytes - the caller must delete it.");
        return path;
    }

    // ===== Internals

    private CallerLocation locate() {
        return _fixedLocation != null
                ? _fixedLocation
                : CallerLocation.locate(_skips, _wrapperClassNames);
    }

    private String printDiagnostic(CallerLocation location, Object message, String detail) {
        List<String> lines = new ArrayList<>(2);
        lines.add("\t" + location + ": " + message);
        if (detail != null) {
            lines.add("\t" + location + ": " + detail);
        }

        StringBuilder buf = new StringBuilder();
        for (String line : lines) {
            buf.append(line).append('\n');
        }
        // The two-line variants are separated from whatever comes next by an empty line.
        if (detail != null) {
            buf.append('\n');
        }
        PrintStream out = _output != null ? _output : System.out;
        out.print(buf);
        out.flush();

        return String.join("\n", lines);
    }

    private static void abort(AssertReporter reporter, String diagnostic, Throwable cause) {
        reporter.abortNow(diagnostic, cause);
        // ?: Still here? The reporter didn't unwind, so we do it.
        throw new AssertAbortedError(diagnostic, cause);
    }

    private static boolean isValidTempFilePrefix(String prefix) {
        return prefix != null && !prefix.isEmpty() && prefix.indexOf('/') < 0 && prefix.indexOf('\\') < 0;
    }
}
