package org.javai.httperror.exchange;

import org.javai.httperror.ResponseBody;

import java.net.URI;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.Optional;

/**
 * A completed HTTP request/response pair, as handed over by the transport.
 *
 * @param statusCode the response status code, any three-digit value
 * @param headers the response headers
 * @param body the raw response body, possibly empty
 * @param method the request method, when known
 * @param uri the request URI, when known
 */
public record HttpExchange(
        int statusCode,
        ResponseHeaders headers,
        ResponseBody body,
        Optional<String> method,
        Optional<URI> uri
) {

    public HttpExchange {
        // any three-digit code, some servers answer outside the registered 1xx-5xx classes
        if (statusCode < 100 || statusCode > 999) {
            throw new IllegalArgumentException("statusCode out of range: " + statusCode);
        }
        Objects.requireNonNull(headers, "headers must not be null");
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(method, "method must not be null, use Optional.empty()");
        Objects.requireNonNull(uri, "uri must not be null, use Optional.empty()");
    }

    public static HttpExchange of(int statusCode, ResponseHeaders headers, byte[] body) {
        return new HttpExchange(statusCode, headers, ResponseBody.of(body), Optional.empty(), Optional.empty());
    }

    public static HttpExchange of(int statusCode, ResponseHeaders headers) {
        return new HttpExchange(statusCode, headers, ResponseBody.empty(), Optional.empty(), Optional.empty());
    }

    /**
     * Creates an exchange from a response received with {@link java.net.http.HttpClient}.
     */
    public static HttpExchange from(HttpResponse<byte[]> response) {
        Objects.requireNonNull(response, "response must not be null");
        byte[] body = response.body();
        return new HttpExchange(
                response.statusCode(),
                ResponseHeaders.from(response.headers()),
                body == null ? ResponseBody.empty() : ResponseBody.of(body),
                Optional.of(response.request().method()),
                Optional.of(response.uri()));
    }

    /**
     * Returns a copy of this exchange carrying the request method and URI.
     */
    public HttpExchange withRequest(String method, URI uri) {
        return new HttpExchange(statusCode, headers, body, Optional.of(method), Optional.of(uri));
    }

    /**
     * The Content-Type header value. Empty when the header is missing or blank.
     */
    public Optional<String> contentType() {
        return nonBlankHeader(ResponseHeaders.CONTENT_TYPE);
    }

    /**
     * The Location header value. Empty when the header is missing or blank.
     */
    public Optional<String> location() {
        return nonBlankHeader(ResponseHeaders.LOCATION);
    }

    private Optional<String> nonBlankHeader(String name) {
        return headers.firstValue(name).filter(value -> !value.isBlank());
    }
}
