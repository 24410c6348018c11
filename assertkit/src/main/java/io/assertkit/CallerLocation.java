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

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * The source position of an assertion's caller: the base name of the source file and the line number. Used purely for
 * diagnostics.
 * <p>
 * Normally computed by {@link AssertKit} on every failing check, by walking the current thread's stack: frames
 * belonging to the helper classes are skipped, and then the configured <i>skips</i> count is applied from the first
 * foreign frame, <code>1</code> being the direct caller of the assertion method. If you wrap the assertions in your
 * own helper methods, either raise skips by one per wrapper level, or register the wrapper class with
 * {@link AssertKit#withWrapperClasses(Class[])}.
 * <p>
 * Alternatively, capture the position explicitly with {@link #here()} and hand it to {@link AssertKit#at(CallerLocation)}
 * - this is immune to wrapping.
 */
public final class CallerLocation {
    /**
     * File name used when the stack frame carries no source information, or when skips walks off the stack.
     */
    public static final String UNKNOWN_FILE = "???";

    private final String _fileName;
    private final int _lineNumber;

    private CallerLocation(String fileName, int lineNumber) {
        _fileName = fileName;
        _lineNumber = lineNumber;
    }

    /**
     * @param fileName
     *            the source file; any directory part is stripped. <code>null</code> gives {@link #UNKNOWN_FILE}.
     * @param lineNumber
     *            the line; negative values (as used by {@link StackTraceElement} for "unknown") give <code>0</code>.
     * @return a location.
     */
    public static CallerLocation of(String fileName, int lineNumber) {
        return new CallerLocation(baseName(fileName), Math.max(lineNumber, 0));
    }

    /**
     * @return the location of the line invoking this method.
     */
    public static CallerLocation here() {
        return locate(1, Set.of());
    }

    /**
     * Locates a caller on the current thread's stack.
     *
     * @param skips
     *            how many frames to go up from the first frame not belonging to a helper class; <code>1</code> is that
     *            frame itself, <code>0</code> is the outermost helper frame.
     * @param helperClassNames
     *            fully qualified names of classes whose frames are skipped before counting (nested classes included).
     *            This class is always skipped.
     * @return the location, with {@link #UNKNOWN_FILE} and line <code>0</code> if the stack is not that deep.
     */
    public static CallerLocation locate(int skips, Collection<String> helperClassNames) {
        return fromStackTrace(Thread.currentThread().getStackTrace(), skips, helperClassNames);
    }

    static CallerLocation fromStackTrace(StackTraceElement[] stack, int skips, Collection<String> helperClassNames) {
        if (skips < 0) {
            throw new IllegalArgumentException("skips must be >= 0, was [" + skips + "].");
        }
        int firstForeign = 0;
        while (firstForeign < stack.length
                && isHelperFrame(stack[firstForeign].getClassName(), helperClassNames)) {
            firstForeign++;
        }
        int target = firstForeign + skips - 1;
        if (target < 0 || target >= stack.length) {
            return new CallerLocation(UNKNOWN_FILE, 0);
        }
        StackTraceElement frame = stack[target];
        return of(frame.getFileName(), frame.getLineNumber());
    }

    private static boolean isHelperFrame(String className, Collection<String> helperClassNames) {
        // Thread.getStackTrace() itself is the top frame.
        if (className.equals(Thread.class.getName()) || isSameOrNested(className, CallerLocation.class.getName())) {
            return true;
        }
        for (String helperClassName : helperClassNames) {
            if (isSameOrNested(className, helperClassName)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isSameOrNested(String className, String outerClassName) {
        return className.equals(outerClassName) || className.startsWith(outerClassName + '$');
    }

    private static String baseName(String fileName) {
        if (fileName == null || fileName.isEmpty()) {
            return UNKNOWN_FILE;
        }
        int lastSlash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        return lastSlash >= 0 ? fileName.substring(lastSlash + 1) : fileName;
    }

    public String getFileName() {
        return _fileName;
    }

    public int getLineNumber() {
        return _lineNumber;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CallerLocation)) {
            return false;
        }
        CallerLocation that = (CallerLocation) o;
        return _lineNumber == that._lineNumber && _fileName.equals(that._fileName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_fileName, _lineNumber);
    }

    /**
     * @return <code>"{fileName}:{lineNumber}"</code>, the form used in the diagnostics.
     */
    @Override
    public String toString() {
        return _fileName + ':' + _lineNumber;
    }
}
