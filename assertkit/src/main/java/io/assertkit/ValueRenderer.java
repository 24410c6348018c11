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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Renders values for the diagnostic lines, as <code>"({SimpleTypeName}) {json}"</code>, e.g.
 * <code>(Integer) 5</code> or <code>(Customer) {"id":123,"name":"Endre"}</code>, so that two values which print the
 * same but differ in type are still told apart.
 * <p>
 * Uses a field-based Jackson ObjectMapper: only fields are serialized, of any access modifier, and classes without
 * fields are allowed. {@link java.util.Optional} renders as its contents, and <code>java.time</code> values as ISO-8601
 * strings. If Jackson cannot serialize a value (cyclic graphs, JDK types it does not know), the value's
 * own <code>toString()</code> is used, and if even that fails, <code>{SimpleTypeName}@{identityHash}</code>.
 * Rendering never throws.
 */
final class ValueRenderer {
    private static final Logger log = LoggerFactory.getLogger(ValueRenderer.class);

    private ValueRenderer() {
        // Utility class
    }

    // "Initialization-on-demand holder idiom", only paying for the ObjectMapper when a check actually fails.
    private static class ObjectMapperHolder {
        private static final ObjectMapper INSTANCE = createFieldBasedObjectMapper();
    }

    private static ObjectMapper createFieldBasedObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        // Read any access modifier fields, and nothing else
        mapper.setVisibility(PropertyAccessor.ALL, Visibility.NONE);
        mapper.setVisibility(PropertyAccessor.FIELD, Visibility.ANY);
        // Empty objects are fine, render as {}
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        // Handle the java.time classes sanely, i.e. as dates, not a bunch of integers.
        mapper.registerModule(new JavaTimeModule());
        // .. and write dates and times as Strings, e.g. 2020-11-15
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // Handle JDK8 Optionals as their contents.
        mapper.registerModule(new Jdk8Module());
        return mapper;
    }

    /**
     * @return the type-qualified rendering of the value, <code>"null"</code> for null.
     */
    static String render(Object value) {
        if (value == null) {
            return "null";
        }
        return "(" + value.getClass().getSimpleName() + ") " + json(value);
    }

    /**
     * @return the value as a JSON string literal, i.e. quoted and escaped; <code>"null"</code> for null.
     */
    static String quote(String value) {
        if (value == null) {
            return "null";
        }
        return json(value);
    }

    private static String json(Object value) {
        try {
            return ObjectMapperHolder.INSTANCE.writeValueAsString(value);
        }
        // A self-containing collection can blow the stack inside Jackson instead of being reported as a cycle.
        catch (JsonProcessingException | RuntimeException | StackOverflowError e) {
            if (log.isDebugEnabled()) log.debug(AssertKit.LOG_PREFIX + "Could not render ["
                    + value.getClass().getName() + "] as JSON, falling back to toString(): " + e);
            return fallback(value);
        }
    }

    private static String fallback(Object value) {
        try {
            return String.valueOf(value);
        }
        catch (RuntimeException | StackOverflowError e) {
            return value.getClass().getSimpleName() + '@' + Integer.toHexString(System.identityHashCode(value));
        }
    }
}
