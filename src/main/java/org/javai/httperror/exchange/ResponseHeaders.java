package org.javai.httperror.exchange;

import java.net.http.HttpHeaders;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable response headers with case-insensitive names.
 */
public final class ResponseHeaders {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String LOCATION = "Location";

    private static final ResponseHeaders EMPTY = new ResponseHeaders(new TreeMap<>(String.CASE_INSENSITIVE_ORDER));

    private final Map<String, List<String>> values;

    private ResponseHeaders(TreeMap<String, List<String>> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static ResponseHeaders empty() {
        return EMPTY;
    }

    /**
     * Creates headers from a multi-valued map. Names differing only in case are merged.
     */
    public static ResponseHeaders of(Map<String, ? extends List<String>> headers) {
        Objects.requireNonNull(headers, "headers must not be null");
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((name, list) -> {
            Objects.requireNonNull(name, "header name must not be null");
            Objects.requireNonNull(list, "header values must not be null");
            copy.computeIfAbsent(name, n -> new ArrayList<>()).addAll(list);
        });
        copy.replaceAll((name, list) -> List.copyOf(list));
        return new ResponseHeaders(copy);
    }

    /**
     * Creates headers from alternating names and values, e.g.
     * {@code of("Content-Type", "application/json", "Location", "/next")}.
     */
    public static ResponseHeaders of(String... namesAndValues) {
        Objects.requireNonNull(namesAndValues, "namesAndValues must not be null");
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("namesAndValues must contain name/value pairs");
        }
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (int i = 0; i < namesAndValues.length; i += 2) {
            String name = Objects.requireNonNull(namesAndValues[i], "header name must not be null");
            String value = Objects.requireNonNull(namesAndValues[i + 1], "header value must not be null");
            copy.computeIfAbsent(name, n -> new ArrayList<>()).add(value);
        }
        copy.replaceAll((name, list) -> List.copyOf(list));
        return new ResponseHeaders(copy);
    }

    public static ResponseHeaders from(HttpHeaders headers) {
        Objects.requireNonNull(headers, "headers must not be null");
        return of(headers.map());
    }

    public Optional<String> firstValue(String name) {
        return allValues(name).stream().findFirst();
    }

    public List<String> allValues(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return values.getOrDefault(name, List.of());
    }

    public boolean contains(String name) {
        return !allValues(name).isEmpty();
    }

    public Set<String> names() {
        return values.keySet();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ResponseHeaders other && values.equals(other.values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
