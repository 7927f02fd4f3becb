package org.javai.httperror;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Stable identifiers for the contextual fields an {@link HttpError} may carry.
 *
 * <p>Each key has a fixed value type (as found in {@link HttpError#payload()}) and a
 * fixed set of kinds it may appear on. Keys are never mandatory: absence is meaningful.
 */
public enum HttpErrorKey {
    /**
     * The HTTP status code of the response.
     */
    STATUS_CODE("status_code", Integer.class,
            EnumSet.of(HttpErrorKind.FAILED_RESPONSE, HttpErrorKind.UNEXPECTED_REDIRECT)),

    /**
     * The raw, unparsed response body.
     */
    BODY_DATA("body_data", byte[].class,
            EnumSet.of(HttpErrorKind.FAILED_RESPONSE, HttpErrorKind.UNEXPECTED_CONTENT_TYPE,
                    HttpErrorKind.UNEXPECTED_REDIRECT)),

    /**
     * The response body decoded as a JSON object, without top-level null values.
     * Only present when the Content-Type is JSON-compatible, the decode succeeds
     * and the top-level value is an object.
     */
    BODY_JSON("body_json", ObjectNode.class,
            EnumSet.of(HttpErrorKind.FAILED_RESPONSE)),

    /**
     * The Content-Type header value that failed validation.
     */
    CONTENT_TYPE("content_type", String.class,
            EnumSet.of(HttpErrorKind.UNEXPECTED_CONTENT_TYPE)),

    /**
     * The Location header of a redirect. May be absent even on a redirect.
     */
    LOCATION("location", String.class,
            EnumSet.of(HttpErrorKind.UNEXPECTED_REDIRECT));

    private final String id;
    private final Class<?> valueType;
    private final Set<HttpErrorKind> validKinds;

    HttpErrorKey(String id, Class<?> valueType, EnumSet<HttpErrorKind> validKinds) {
        this.id = id;
        this.valueType = valueType;
        this.validKinds = validKinds;
    }

    public String id() {
        return id;
    }

    public Class<?> valueType() {
        return valueType;
    }

    public boolean isValidFor(HttpErrorKind kind) {
        return validKinds.contains(kind);
    }

    /**
     * Returns the keys that may appear on errors of the given kind, in declaration order.
     */
    public static List<HttpErrorKey> keysFor(HttpErrorKind kind) {
        return Arrays.stream(values())
                .filter(key -> key.isValidFor(kind))
                .toList();
    }

    /**
     * Resolves a key from its stable string identifier.
     *
     * @throws IllegalArgumentException if no key has that identifier
     */
    public static HttpErrorKey fromId(String id) {
        for (HttpErrorKey key : values()) {
            if (key.id.equals(id)) {
                return key;
            }
        }
        throw new IllegalArgumentException("Unknown HTTP error key: " + id);
    }
}
