package org.javai.httperror.ops;

import org.javai.httperror.HttpError;

/**
 * Reports classified HTTP errors for observability.
 * Implementations might emit metrics or structured logs.
 */
@FunctionalInterface
public interface HttpErrorReporter {

    /**
     * Reports an error produced while handling the named operation.
     *
     * @param operation the operation that received the response (e.g. "OrdersApi.fetchOrder")
     * @param error the classified error
     */
    void report(String operation, HttpError error);

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static HttpErrorReporter noOp() {
        return (operation, error) -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     */
    static HttpErrorReporter composite(HttpErrorReporter... reporters) {
        return CompositeHttpErrorReporter.of(reporters);
    }
}
