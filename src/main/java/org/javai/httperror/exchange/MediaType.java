package org.javai.httperror.exchange;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed Content-Type value such as {@code application/problem+json; charset=utf-8}.
 *
 * @param type the lower-cased top-level type, or {@code *}
 * @param subtype the lower-cased subtype, or {@code *}, or a {@code *+suffix} pattern
 * @param parameters parameters with lower-cased names and unquoted values
 */
public record MediaType(String type, String subtype, Map<String, String> parameters) {

    private static final String WILDCARD = "*";

    public MediaType {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(subtype, "subtype must not be null");
        if (!isToken(type) || !isToken(subtype)) {
            throw new IllegalArgumentException("Invalid media type: " + type + "/" + subtype);
        }
        if (WILDCARD.equals(type) && !subtype.startsWith(WILDCARD)) {
            throw new IllegalArgumentException("Wildcard type requires wildcard subtype: " + type + "/" + subtype);
        }
        type = type.toLowerCase(Locale.ROOT);
        subtype = subtype.toLowerCase(Locale.ROOT);
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Parses a Content-Type header value.
     *
     * @throws IllegalArgumentException if the value is not a valid media type
     */
    public static MediaType parse(String value) {
        Objects.requireNonNull(value, "value must not be null");
        String[] parts = value.split(";");
        String essence = parts[0].trim();
        int slash = essence.indexOf('/');
        if (slash <= 0 || slash == essence.length() - 1) {
            throw new IllegalArgumentException("Invalid media type: " + value);
        }
        Map<String, String> parameters = new LinkedHashMap<>();
        for (int i = 1; i < parts.length; i++) {
            String parameter = parts[i].trim();
            int equals = parameter.indexOf('=');
            if (equals <= 0) {
                continue;
            }
            String name = parameter.substring(0, equals).trim().toLowerCase(Locale.ROOT);
            parameters.putIfAbsent(name, unquote(parameter.substring(equals + 1).trim()));
        }
        return new MediaType(essence.substring(0, slash).trim(), essence.substring(slash + 1).trim(), parameters);
    }

    /**
     * Parses a Content-Type header value, returning empty if it is malformed.
     */
    public static Optional<MediaType> tryParse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(parse(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Returns {@code type/subtype} without parameters.
     */
    public String essence() {
        return type + "/" + subtype;
    }

    /**
     * Returns the structured syntax suffix, e.g. {@code json} for {@code application/problem+json}.
     */
    public Optional<String> suffix() {
        int plus = subtype.lastIndexOf('+');
        if (plus < 0 || plus == subtype.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(subtype.substring(plus + 1));
    }

    public Optional<String> parameter(String name) {
        return Optional.ofNullable(parameters.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * Returns whether this media type, used as a pattern, includes the given one.
     * Parameters are ignored. {@code *}{@code /*} includes everything, {@code text/*} every
     * text type and {@code *}{@code /*+json} every type with a {@code +json} suffix.
     */
    public boolean includes(MediaType other) {
        Objects.requireNonNull(other, "other must not be null");
        if (!WILDCARD.equals(type) && !type.equals(other.type)) {
            return false;
        }
        if (WILDCARD.equals(subtype)) {
            return true;
        }
        if (subtype.startsWith("*+")) {
            return other.subtype.endsWith(subtype.substring(1));
        }
        return subtype.equals(other.subtype);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(essence());
        parameters.forEach((name, value) -> sb.append("; ").append(name).append('=').append(value));
        return sb.toString();
    }

    private static boolean isToken(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c <= ' ' || c >= 127 || "()<>@,;:\\\"/[]?={}".indexOf(c) >= 0) {
                return false;
            }
        }
        return true;
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
