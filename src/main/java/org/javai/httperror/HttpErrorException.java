package org.javai.httperror;

import java.util.Objects;

/**
 * Unchecked carrier for an {@link HttpError}, for callers that prefer exceptions
 * over inspecting a {@link ResponseOutcome}.
 */
public class HttpErrorException extends RuntimeException {

    private final HttpError error;

    public HttpErrorException(HttpError error) {
        super(Objects.requireNonNull(error, "error must not be null").message());
        this.error = error;
    }

    public HttpError error() {
        return error;
    }

    public HttpErrorKind kind() {
        return error.kind();
    }
}
