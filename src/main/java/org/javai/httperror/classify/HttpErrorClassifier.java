package org.javai.httperror.classify;

import org.javai.httperror.HttpError;
import org.javai.httperror.exchange.HttpExchange;

import java.util.Optional;

/**
 * Decides whether a completed exchange satisfies the caller's expectations.
 * Implementations must be pure and deterministic: no I/O, no mutation of the exchange.
 */
@FunctionalInterface
public interface HttpErrorClassifier {

    /**
     * Classifies an exchange.
     *
     * @param exchange the completed exchange
     * @param expectations what the caller requires of the response
     * @return empty on success, otherwise the single error describing the failure
     */
    Optional<HttpError> classify(HttpExchange exchange, ResponseExpectations expectations);
}
