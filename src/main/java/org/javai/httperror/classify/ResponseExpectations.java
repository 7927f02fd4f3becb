package org.javai.httperror.classify;

import org.javai.httperror.exchange.ContentTypeMatcher;

import java.util.Objects;
import java.util.Optional;
import java.util.function.IntPredicate;

/**
 * What the caller requires of a response for it to count as a success.
 *
 * <p>By default the redirect class is 3xx <em>without</em> 304 Not Modified, so a 304 is
 * judged by {@code successStatus} instead of being reported as a redirect. Pass
 * {@link #ALL_3XX} to {@link Builder#redirectStatus} to treat every 3xx as a redirect.
 *
 * @param allowsRedirects whether redirect responses are acceptable
 * @param redirectStatus which status codes count as redirects
 * @param requiredContentType the Content-Type the response must have, if any
 * @param requiresEntity whether a 204 No Content is unacceptable
 * @param successStatus which status codes count as success
 * @param jsonContentTypes which Content-Types signal a JSON body worth decoding on failure
 */
public record ResponseExpectations(
        boolean allowsRedirects,
        IntPredicate redirectStatus,
        Optional<ContentTypeMatcher> requiredContentType,
        boolean requiresEntity,
        IntPredicate successStatus,
        ContentTypeMatcher jsonContentTypes
) {

    /**
     * 3xx except 304 Not Modified, which carries no redirect target. The default redirect class.
     */
    public static final IntPredicate REDIRECTION = status -> status >= 300 && status < 400 && status != 304;

    /**
     * Every 3xx status, 304 included.
     */
    public static final IntPredicate ALL_3XX = status -> status >= 300 && status < 400;

    public static final IntPredicate SUCCESSFUL = status -> status >= 200 && status < 300;

    private static final ResponseExpectations DEFAULTS = builder().build();

    public ResponseExpectations {
        Objects.requireNonNull(redirectStatus, "redirectStatus must not be null");
        Objects.requireNonNull(requiredContentType, "requiredContentType must not be null, use Optional.empty()");
        Objects.requireNonNull(successStatus, "successStatus must not be null");
        Objects.requireNonNull(jsonContentTypes, "jsonContentTypes must not be null");
    }

    /**
     * Redirects allowed, any 2xx accepted, any Content-Type accepted, 204 accepted.
     */
    public static ResponseExpectations defaults() {
        return DEFAULTS;
    }

    /**
     * A JSON entity is required: the response must not be 204 and must have a JSON Content-Type.
     */
    public static ResponseExpectations jsonEntity() {
        return builder()
                .requireContentType(ContentTypeMatcher.json())
                .requireEntity(true)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .allowRedirects(allowsRedirects)
                .redirectStatus(redirectStatus)
                .requireEntity(requiresEntity)
                .successStatus(successStatus)
                .jsonContentTypes(jsonContentTypes);
        requiredContentType.ifPresent(builder::requireContentType);
        return builder;
    }

    public static class Builder {
        private boolean allowsRedirects = true;
        private IntPredicate redirectStatus = REDIRECTION;
        private ContentTypeMatcher requiredContentType;
        private boolean requiresEntity;
        private IntPredicate successStatus = SUCCESSFUL;
        private ContentTypeMatcher jsonContentTypes = ContentTypeMatcher.json();

        private Builder() {
        }

        public Builder allowRedirects(boolean allowsRedirects) {
            this.allowsRedirects = allowsRedirects;
            return this;
        }

        public Builder redirectStatus(IntPredicate redirectStatus) {
            this.redirectStatus = Objects.requireNonNull(redirectStatus);
            return this;
        }

        public Builder requireContentType(ContentTypeMatcher matcher) {
            this.requiredContentType = Objects.requireNonNull(matcher);
            return this;
        }

        /**
         * Requires a Content-Type matching any of the given patterns.
         */
        public Builder requireContentType(String... patterns) {
            return requireContentType(ContentTypeMatcher.of(patterns));
        }

        public Builder requireEntity(boolean requiresEntity) {
            this.requiresEntity = requiresEntity;
            return this;
        }

        public Builder successStatus(IntPredicate successStatus) {
            this.successStatus = Objects.requireNonNull(successStatus);
            return this;
        }

        public Builder jsonContentTypes(ContentTypeMatcher jsonContentTypes) {
            this.jsonContentTypes = Objects.requireNonNull(jsonContentTypes);
            return this;
        }

        public ResponseExpectations build() {
            return new ResponseExpectations(allowsRedirects, redirectStatus,
                    Optional.ofNullable(requiredContentType), requiresEntity, successStatus, jsonContentTypes);
        }
    }
}
