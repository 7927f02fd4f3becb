package org.javai.httperror;

/**
 * The closed set of reasons a completed HTTP exchange is treated as a failure.
 *
 * <p>Codes and names are stable. Adding a kind is a breaking change for any caller
 * that switches over this enum.
 */
public enum HttpErrorKind {
    /**
     * The response status code indicates failure per the caller's success policy.
     */
    FAILED_RESPONSE(1, "failed_response"),

    /**
     * The response succeeded but its Content-Type does not match what the caller required.
     */
    UNEXPECTED_CONTENT_TYPE(2, "unexpected_content_type"),

    /**
     * The response was a 204 No Content but the caller required an entity body.
     */
    UNEXPECTED_NO_CONTENT(3, "unexpected_no_content"),

    /**
     * A redirect response was received while the caller had redirects disabled.
     */
    UNEXPECTED_REDIRECT(4, "unexpected_redirect");

    private final int code;
    private final String id;

    HttpErrorKind(int code, String id) {
        this.code = code;
        this.id = id;
    }

    public int code() {
        return code;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves a kind from its stable integer code.
     *
     * @throws IllegalArgumentException if no kind has that code
     */
    public static HttpErrorKind fromCode(int code) {
        for (HttpErrorKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown HTTP error code: " + code);
    }
}
