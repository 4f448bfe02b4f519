package me.golemcore.thread.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Collections;
import java.util.regex.Pattern;

/**
 * Produces a JSON-safe copy of an arbitrary payload before it leaves the
 * process on the stream.
 *
 * <ul>
 * <li>values under credential-like keys become {@value #REDACTED}</li>
 * <li>strings above the size limit become {@value #TRUNCATED}</li>
 * <li>self references become {@value #CIRCULAR}</li>
 * </ul>
 */
public final class PayloadSanitizer {

    public static final String REDACTED = "[redacted]";
    public static final String TRUNCATED = "[truncated-string]";
    public static final String CIRCULAR = "[circular]";
    public static final int DEFAULT_MAX_STRING_CHARS = 20_000;

    private static final Pattern SECRET_KEY = Pattern.compile(
            "token|authorization|cookie|secret|api[_-]?key|password", Pattern.CASE_INSENSITIVE);

    private PayloadSanitizer() {
    }

    public static boolean isSecretKey(String key) {
        return key != null && SECRET_KEY.matcher(key).find();
    }

    public static Object sanitize(Object value) {
        return sanitize(value, DEFAULT_MAX_STRING_CHARS);
    }

    public static Object sanitize(Object value, int maxStringChars) {
        Set<Object> path = Collections.newSetFromMap(new IdentityHashMap<>());
        return sanitizeValue(value, maxStringChars, path);
    }

    private static Object sanitizeValue(Object value, int maxStringChars, Set<Object> path) {
        if (value == null || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof CharSequence text) {
            return text.length() > maxStringChars ? TRUNCATED : text.toString();
        }
        if (value instanceof Enum<?> constant) {
            return constant.toString();
        }
        if (value instanceof Map<?, ?> map) {
            if (!path.add(map)) {
                return CIRCULAR;
            }
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                copy.put(key, isSecretKey(key) ? REDACTED : sanitizeValue(entry.getValue(), maxStringChars, path));
            }
            path.remove(map);
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            if (!path.add(collection)) {
                return CIRCULAR;
            }
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(sanitizeValue(element, maxStringChars, path));
            }
            path.remove(collection);
            return copy;
        }
        if (value instanceof Object[] array) {
            return sanitizeValue(Arrays.asList(array), maxStringChars, path);
        }
        return sanitizeValue(String.valueOf(value), maxStringChars, path);
    }
}
