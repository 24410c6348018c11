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

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Structural equality over arbitrary object graphs, as used by
 * {@link AssertKit#assertEqual(AssertReporter, Object, Object, Object) assertEqual(..)}.
 * <p>
 * Two values are equal iff they have the same runtime class and recursively identical content:
 * <ul>
 * <li>Arrays, primitive or not: same length, element-wise deep equal.</li>
 * <li>{@link List}s and other non-{@link Set} {@link Collection}s: same size, deep equal in iteration order.</li>
 * <li>{@link Set}s: same size, and every element has its own deep-equal partner in the other set.</li>
 * <li>{@link Map}s: same size, every key of one is a key of the other (by the map's own lookup), deep-equal
 * values.</li>
 * <li>{@link Optional}, {@link Entry Map.Entry}, {@link AtomicReference}: deep equal contents. {@link AtomicInteger},
 * {@link AtomicLong}, {@link AtomicBoolean}: equal current values. {@link StringBuilder} and other mutable JDK
 * {@link CharSequence}s: equal characters.</li>
 * <li>Strings, boxed primitives, enums, and other JDK types: {@link Object#equals(Object)}.</li>
 * <li>Any other class: every non-static field of the class and its superclasses, deep equal. If the fields cannot be
 * made accessible, falls back to {@link Object#equals(Object)}.</li>
 * </ul>
 * Note that "same runtime class" is strict: an {@link java.util.ArrayList} never equals a
 * {@link java.util.LinkedList}, even with identical elements.
 * <p>
 * Floating point values follow {@link Double#equals(Object)} and {@link Float#equals(Object)}, not <code>==</code>:
 * <code>NaN</code> equals <code>NaN</code>, while <code>0.0</code> and <code>-0.0</code> differ. Thus a value
 * containing <code>NaN</code> is always equal to itself.
 * <p>
 * Cycles: each pair of (reference) values under comparison is remembered by identity. Meeting the same pair again
 * counts as equal, so two cyclic graphs are equal when their cycles have the same shape, and the comparison always
 * terminates.
 * <p>
 * Not thread-safe: create one instance per comparison, or use {@link #deepEquals(Object, Object)}.
 */
public final class DeepEquals {
    private final Set<VisitedPair> _visited;

    private DeepEquals(Set<VisitedPair> visited) {
        _visited = visited;
    }

    /**
     * @return whether the two values are structurally equal, as described in the class JavaDoc.
     */
    public static boolean deepEquals(Object a, Object b) {
        return new DeepEquals(new HashSet<>()).equal(a, b);
    }

    private boolean equal(Object a, Object b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        Class<?> type = a.getClass();
        if (type != b.getClass()) {
            return false;
        }
        if (isValueType(type)) {
            return a.equals(b);
        }
        // ?: Have we been here before with this exact pair?
        if (!_visited.add(new VisitedPair(a, b))) {
            // -> Yes, so we're in a cycle that has matched so far.
            return true;
        }
        if (type.isArray()) {
            return arraysEqual(a, b);
        }
        if (a instanceof Map) {
            return mapsEqual((Map<?, ?>) a, (Map<?, ?>) b);
        }
        if (a instanceof Set) {
            return setsEqual((Set<?>) a, (Set<?>) b);
        }
        if (a instanceof Collection) {
            return orderedEqual((Collection<?>) a, (Collection<?>) b);
        }
        if (isJdkType(type)) {
            return jdkTypesEqual(a, b);
        }
        return fieldsEqual(a, b, type);
    }

    private boolean arraysEqual(Object a, Object b) {
        int length = Array.getLength(a);
        if (length != Array.getLength(b)) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (!equal(Array.get(a, i), Array.get(b, i))) {
                return false;
            }
        }
        return true;
    }

    private boolean orderedEqual(Collection<?> a, Collection<?> b) {
        if (a.size() != b.size()) {
            return false;
        }
        Iterator<?> itA = a.iterator();
        Iterator<?> itB = b.iterator();
        while (itA.hasNext() && itB.hasNext()) {
            if (!equal(itA.next(), itB.next())) {
                return false;
            }
        }
        return itA.hasNext() == itB.hasNext();
    }

    private boolean setsEqual(Set<?> a, Set<?> b) {
        if (a.size() != b.size()) {
            return false;
        }
        List<Object> unmatched = new ArrayList<>(b);
        for (Object elementA : a) {
            boolean found = false;
            for (Iterator<Object> it = unmatched.iterator(); it.hasNext();) {
                // Probe on a copy of the visited pairs, so that a failed probe leaves no "assumed equal" pairs behind.
                if (new DeepEquals(new HashSet<>(_visited)).equal(elementA, it.next())) {
                    it.remove();
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    private boolean mapsEqual(Map<?, ?> a, Map<?, ?> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (Entry<?, ?> entry : a.entrySet()) {
            if (!b.containsKey(entry.getKey())) {
                return false;
            }
            if (!equal(entry.getValue(), b.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private boolean jdkTypesEqual(Object a, Object b) {
        if (a instanceof Optional) {
            Optional<?> optionalA = (Optional<?>) a;
            Optional<?> optionalB = (Optional<?>) b;
            if (optionalA.isPresent() != optionalB.isPresent()) {
                return false;
            }
            return optionalA.isEmpty() || equal(optionalA.get(), optionalB.get());
        }
        if (a instanceof Entry) {
            Entry<?, ?> entryA = (Entry<?, ?>) a;
            Entry<?, ?> entryB = (Entry<?, ?>) b;
            return equal(entryA.getKey(), entryB.getKey()) && equal(entryA.getValue(), entryB.getValue());
        }
        if (a instanceof AtomicReference) {
            return equal(((AtomicReference<?>) a).get(), ((AtomicReference<?>) b).get());
        }
        if (a instanceof AtomicInteger) {
            return ((AtomicInteger) a).get() == ((AtomicInteger) b).get();
        }
        if (a instanceof AtomicLong) {
            return ((AtomicLong) a).get() == ((AtomicLong) b).get();
        }
        if (a instanceof AtomicBoolean) {
            return ((AtomicBoolean) a).get() == ((AtomicBoolean) b).get();
        }
        // StringBuilder, StringBuffer, CharBuffer: identity equals, so compare the characters.
        if (a instanceof CharSequence) {
            return a.toString().equals(b.toString());
        }
        return a.equals(b);
    }

    private boolean fieldsEqual(Object a, Object b, Class<?> type) {
        for (Class<?> clazz = type; clazz != null && clazz != Object.class; clazz = clazz.getSuperclass()) {
            for (Field field : clazz.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers())) {
                    continue;
                }
                // ?: Can we read it? (Classes in non-open named modules refuse.)
                if (!field.trySetAccessible()) {
                    // -> No, so let the class decide for itself.
                    return a.equals(b);
                }
                Object valueA;
                Object valueB;
                try {
                    valueA = field.get(a);
                    valueB = field.get(b);
                }
                catch (IllegalAccessException e) {
                    throw new IllegalStateException("Field [" + field + "] was made accessible, but could still"
                            + " not be read.", e);
                }
                if (!equal(valueA, valueB)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean isValueType(Class<?> type) {
        return type == String.class
                || type == Boolean.class
                || type == Character.class
                || type == Class.class
                || type.isEnum()
                || (type.getSuperclass() != null && type.getSuperclass().isEnum())
                || (Number.class.isAssignableFrom(type) && isJdkType(type) && !isAtomic(type));
    }

    private static boolean isAtomic(Class<?> type) {
        return type.getName().startsWith("java.util.concurrent.atomic.");
    }

    private static boolean isJdkType(Class<?> type) {
        String name = type.getName();
        return name.startsWith("java.") || name.startsWith("javax.") || name.startsWith("jdk.")
                || name.startsWith("sun.") || name.startsWith("com.sun.");
    }

    /**
     * Identity-based pair of the two sides of a comparison.
     */
    private static final class VisitedPair {
        private final Object _a;
        private final Object _b;

        private VisitedPair(Object a, Object b) {
            _a = a;
            _b = b;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof VisitedPair)) {
                return false;
            }
            VisitedPair that = (VisitedPair) o;
            return _a == that._a && _b == that._b;
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(_a) + System.identityHashCode(_b);
        }
    }
}
