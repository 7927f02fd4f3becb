package org.javai.httperror.classify;

import org.javai.httperror.exchange.HttpExchange;

import java.io.IOException;

/**
 * Reads the value of an accepted response.
 *
 * @param <T> The type of value read
 */
@FunctionalInterface
public interface BodyReader<T> {

    T read(HttpExchange exchange) throws IOException;
}
