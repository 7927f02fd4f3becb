package org.javai.httperror.classify;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.httperror.HttpError;
import org.javai.httperror.ResponseBody;
import org.javai.httperror.exchange.ContentTypeMatcher;
import org.javai.httperror.exchange.HttpExchange;
import org.javai.httperror.exchange.MediaType;

import java.util.Objects;
import java.util.Optional;

/**
 * Classifies exchanges using a fixed precedence, first applicable rule wins:
 * <ol>
 *   <li>redirect while redirects are disabled: {@link HttpError.UnexpectedRedirect}</li>
 *   <li>status rejected by the success predicate: {@link HttpError.FailedResponse}</li>
 *   <li>204 where an entity is required: {@link HttpError.UnexpectedNoContent}</li>
 *   <li>Content-Type missing or not matched: {@link HttpError.UnexpectedContentType}</li>
 * </ol>
 *
 * <p>Empty bodies and absent or blank headers are omitted from the error rather than
 * attached as empty values.
 */
public class DefaultHttpErrorClassifier implements HttpErrorClassifier {

    private static final int NO_CONTENT = 204;

    private final JsonBodyDecoder jsonBodyDecoder;

    public DefaultHttpErrorClassifier() {
        this(new JsonBodyDecoder());
    }

    public DefaultHttpErrorClassifier(JsonBodyDecoder jsonBodyDecoder) {
        this.jsonBodyDecoder = Objects.requireNonNull(jsonBodyDecoder, "jsonBodyDecoder must not be null");
    }

    @Override
    public Optional<HttpError> classify(HttpExchange exchange, ResponseExpectations expectations) {
        Objects.requireNonNull(exchange, "exchange must not be null");
        Objects.requireNonNull(expectations, "expectations must not be null");

        int status = exchange.statusCode();

        if (!expectations.allowsRedirects() && expectations.redirectStatus().test(status)) {
            return Optional.of(new HttpError.UnexpectedRedirect(status, exchange.location(), bodyOf(exchange)));
        }

        if (!expectations.successStatus().test(status)) {
            return Optional.of(failedResponse(exchange, expectations));
        }

        if (status == NO_CONTENT && expectations.requiresEntity()) {
            return Optional.of(new HttpError.UnexpectedNoContent());
        }

        if (expectations.requiredContentType().isPresent()
                && !contentTypeMatches(exchange, expectations.requiredContentType().get())) {
            return Optional.of(new HttpError.UnexpectedContentType(exchange.contentType(), bodyOf(exchange)));
        }

        return Optional.empty();
    }

    private HttpError.FailedResponse failedResponse(HttpExchange exchange, ResponseExpectations expectations) {
        Optional<ResponseBody> body = bodyOf(exchange);
        Optional<ObjectNode> json = Optional.empty();
        if (body.isPresent() && contentTypeMatches(exchange, expectations.jsonContentTypes())) {
            json = jsonBodyDecoder.decodeObject(body.get());
        }
        return new HttpError.FailedResponse(exchange.statusCode(), body, json);
    }

    // A missing or unparseable Content-Type matches nothing.
    private static boolean contentTypeMatches(HttpExchange exchange, ContentTypeMatcher matcher) {
        return exchange.contentType()
                .flatMap(MediaType::tryParse)
                .map(matcher::matches)
                .orElse(false);
    }

    private static Optional<ResponseBody> bodyOf(HttpExchange exchange) {
        return exchange.body().isEmpty() ? Optional.empty() : Optional.of(exchange.body());
    }
}
