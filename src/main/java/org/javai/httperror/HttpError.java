package org.javai.httperror;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Describes why a completed HTTP exchange was treated as a failure.
 *
 * <p>Exactly one of four cases, one per {@link HttpErrorKind}. Each case carries only
 * the fields valid for its kind, so illegal key/kind combinations cannot be built.
 * Values are immutable and hold no reference to the exchange they were derived from.
 *
 * <p>Typical consumption:
 * <pre>{@code
 * if (error instanceof HttpError.FailedResponse failed && failed.statusCode() == 404) {
 *     return Optional.empty();
 * }
 * }</pre>
 */
public sealed interface HttpError
        permits HttpError.FailedResponse, HttpError.UnexpectedContentType,
                HttpError.UnexpectedNoContent, HttpError.UnexpectedRedirect {

    /**
     * The error domain, distinguishing these errors from other error sources.
     */
    String DOMAIN = "org.javai.httperror";

    /**
     * The response status code indicates failure.
     *
     * @param statusCode the HTTP status code of the response
     * @param body the raw response body, absent when the body was empty
     * @param bodyJson the body decoded as a JSON object with top-level nulls removed
     */
    record FailedResponse(int statusCode, Optional<ResponseBody> body, Optional<ObjectNode> bodyJson)
            implements HttpError {

        public FailedResponse {
            requireStatusCode(statusCode);
            body = requireNonEmptyBody(body);
            Objects.requireNonNull(bodyJson, "bodyJson must not be null, use Optional.empty()");
            if (bodyJson.isPresent()) {
                if (body.isEmpty()) {
                    throw new IllegalArgumentException("bodyJson requires body");
                }
                if (containsTopLevelNull(bodyJson.get())) {
                    throw new IllegalArgumentException("bodyJson must not contain null values");
                }
                bodyJson = Optional.of(bodyJson.get().deepCopy());
            }
        }

        public FailedResponse(int statusCode) {
            this(statusCode, Optional.empty(), Optional.empty());
        }

        /**
         * Returns a copy of the decoded JSON body, so callers cannot alter this error.
         */
        @Override
        public Optional<ObjectNode> bodyJson() {
            return bodyJson.map(ObjectNode::deepCopy);
        }

        @Override
        public HttpErrorKind kind() {
            return HttpErrorKind.FAILED_RESPONSE;
        }

        @Override
        public String message() {
            return "HTTP response failed with status " + statusCode;
        }

        @Override
        public Map<HttpErrorKey, Object> payload() {
            Map<HttpErrorKey, Object> payload = new EnumMap<>(HttpErrorKey.class);
            payload.put(HttpErrorKey.STATUS_CODE, statusCode);
            body.ifPresent(b -> payload.put(HttpErrorKey.BODY_DATA, b.bytes()));
            bodyJson().ifPresent(json -> payload.put(HttpErrorKey.BODY_JSON, json));
            return Collections.unmodifiableMap(payload);
        }
    }

    /**
     * The response Content-Type does not satisfy the caller's requirement.
     *
     * @param contentType the raw Content-Type header value, absent when the header was missing
     * @param body the raw response body, absent when the body was empty
     */
    record UnexpectedContentType(Optional<String> contentType, Optional<ResponseBody> body)
            implements HttpError {

        public UnexpectedContentType {
            requireNonEmptyHeader(contentType, "contentType");
            body = requireNonEmptyBody(body);
        }

        @Override
        public HttpErrorKind kind() {
            return HttpErrorKind.UNEXPECTED_CONTENT_TYPE;
        }

        @Override
        public String message() {
            return contentType
                    .map(value -> "Unexpected Content-Type: " + value)
                    .orElse("Response is missing a Content-Type header");
        }

        @Override
        public Map<HttpErrorKey, Object> payload() {
            Map<HttpErrorKey, Object> payload = new EnumMap<>(HttpErrorKey.class);
            body.ifPresent(b -> payload.put(HttpErrorKey.BODY_DATA, b.bytes()));
            contentType.ifPresent(value -> payload.put(HttpErrorKey.CONTENT_TYPE, value));
            return Collections.unmodifiableMap(payload);
        }
    }

    /**
     * The response was a 204 No Content where an entity body was required.
     */
    record UnexpectedNoContent() implements HttpError {

        @Override
        public HttpErrorKind kind() {
            return HttpErrorKind.UNEXPECTED_NO_CONTENT;
        }

        @Override
        public String message() {
            return "Unexpected 204 No Content where an entity body was required";
        }

        @Override
        public Map<HttpErrorKey, Object> payload() {
            return Map.of();
        }
    }

    /**
     * A redirect was received while redirects were disabled.
     *
     * @param statusCode the HTTP status code of the response
     * @param location the Location header value, absent when the header was missing
     * @param body the raw response body, absent when the body was empty
     */
    record UnexpectedRedirect(int statusCode, Optional<String> location, Optional<ResponseBody> body)
            implements HttpError {

        public UnexpectedRedirect {
            requireStatusCode(statusCode);
            requireNonEmptyHeader(location, "location");
            body = requireNonEmptyBody(body);
        }

        /**
         * Parses the location as a URI. Empty if there is no location or it is not a valid URI.
         */
        public Optional<URI> locationUri() {
            if (location.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(new URI(location.get()));
            } catch (URISyntaxException e) {
                return Optional.empty();
            }
        }

        @Override
        public HttpErrorKind kind() {
            return HttpErrorKind.UNEXPECTED_REDIRECT;
        }

        @Override
        public String message() {
            return location
                    .map(target -> "Unexpected redirect (" + statusCode + ") to " + target)
                    .orElse("Unexpected redirect (" + statusCode + ") without a Location header");
        }

        @Override
        public Map<HttpErrorKey, Object> payload() {
            Map<HttpErrorKey, Object> payload = new EnumMap<>(HttpErrorKey.class);
            payload.put(HttpErrorKey.STATUS_CODE, statusCode);
            body.ifPresent(b -> payload.put(HttpErrorKey.BODY_DATA, b.bytes()));
            location.ifPresent(value -> payload.put(HttpErrorKey.LOCATION, value));
            return Collections.unmodifiableMap(payload);
        }
    }

    HttpErrorKind kind();

    /**
     * Human-readable description of the failure.
     */
    String message();

    /**
     * Returns the contextual fields of this error keyed by their stable identifiers.
     *
     * <p>The map only holds keys valid for {@link #kind()} and only those that are present.
     * Mutable values ({@code byte[]}, {@code ObjectNode}) are fresh copies.
     */
    Map<HttpErrorKey, Object> payload();

    default int code() {
        return kind().code();
    }

    /**
     * Returns the namespaced identifier of this failure, e.g. {@code org.javai.httperror:failed_response}.
     */
    default String failureCode() {
        return DOMAIN + ":" + kind().id();
    }

    default HttpErrorException toException() {
        return new HttpErrorException(this);
    }

    private static void requireStatusCode(int statusCode) {
        if (statusCode < 100 || statusCode > 999) {
            throw new IllegalArgumentException("statusCode out of range: " + statusCode);
        }
    }

    private static void requireNonEmptyHeader(Optional<String> value, String name) {
        Objects.requireNonNull(value, name + " must not be null, use Optional.empty()");
        if (value.isPresent() && value.get().isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty, use Optional.empty()");
        }
    }

    private static Optional<ResponseBody> requireNonEmptyBody(Optional<ResponseBody> body) {
        Objects.requireNonNull(body, "body must not be null, use Optional.empty()");
        if (body.isPresent() && body.get().isEmpty()) {
            throw new IllegalArgumentException("body must not be empty, use Optional.empty()");
        }
        return body;
    }

    private static boolean containsTopLevelNull(ObjectNode node) {
        Iterator<JsonNode> values = node.elements();
        while (values.hasNext()) {
            if (values.next().isNull()) {
                return true;
            }
        }
        return false;
    }
}
