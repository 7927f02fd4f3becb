package org.javai.httperror.exchange;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether a response media type is acceptable.
 */
@FunctionalInterface
public interface ContentTypeMatcher {

    boolean matches(MediaType mediaType);

    /**
     * Matches any of the given media type patterns. Wildcards are allowed,
     * e.g. {@code text/*} or {@code *}{@code /*+json}; parameters are ignored.
     *
     * @throws IllegalArgumentException if a pattern is not a valid media type
     */
    static ContentTypeMatcher of(String... patterns) {
        Objects.requireNonNull(patterns, "patterns must not be null");
        if (patterns.length == 0) {
            throw new IllegalArgumentException("at least one pattern is required");
        }
        List<MediaType> parsed = Arrays.stream(patterns).map(MediaType::parse).toList();
        return mediaType -> parsed.stream().anyMatch(pattern -> pattern.includes(mediaType));
    }

    /**
     * Matches {@code application/json} and any type with a {@code +json} suffix.
     */
    static ContentTypeMatcher json() {
        return of("application/json", "*/*+json");
    }

    default ContentTypeMatcher or(ContentTypeMatcher other) {
        Objects.requireNonNull(other, "other must not be null");
        return mediaType -> matches(mediaType) || other.matches(mediaType);
    }
}
