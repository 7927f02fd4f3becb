package org.javai.httperror.classify;

import org.javai.httperror.HttpError;
import org.javai.httperror.ResponseOutcome;
import org.javai.httperror.exchange.HttpExchange;
import org.javai.httperror.ops.HttpErrorReporter;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * The point where a completed exchange enters outcome-space.
 * Classifies the exchange, reports any error and returns a {@link ResponseOutcome}.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ResponseHandler handler = ResponseHandler.withReporter(new Log4jHttpErrorReporter());
 *
 * ResponseOutcome<Order> order = handler.handle(
 *     "OrdersApi.fetchOrder",
 *     HttpExchange.from(response),
 *     ResponseExpectations.jsonEntity(),
 *     exchange -> mapper.readValue(exchange.body().bytes(), Order.class)
 * );
 * }</pre>
 */
public final class ResponseHandler {

    private static final HttpErrorClassifier DEFAULT_CLASSIFIER = new DefaultHttpErrorClassifier();

    private final HttpErrorClassifier classifier;
    private final HttpErrorReporter reporter;

    /**
     * Creates a handler that classifies with the default classifier and reports nothing.
     */
    public static ResponseHandler silent() {
        return new ResponseHandler(DEFAULT_CLASSIFIER, HttpErrorReporter.noOp());
    }

    public static ResponseHandler withReporter(HttpErrorReporter reporter) {
        return new ResponseHandler(DEFAULT_CLASSIFIER, reporter);
    }

    public static ResponseHandler of(HttpErrorClassifier classifier, HttpErrorReporter reporter) {
        return new ResponseHandler(classifier, reporter);
    }

    public ResponseHandler(HttpErrorClassifier classifier, HttpErrorReporter reporter) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Checks the exchange against the expectations.
     *
     * @param operation the operation name for reporting (e.g. "OrdersApi.fetchOrder")
     * @return Ok with the exchange itself, or Fail with the classified error
     */
    public ResponseOutcome<HttpExchange> check(String operation, HttpExchange exchange,
                                               ResponseExpectations expectations) {
        Objects.requireNonNull(operation, "operation must not be null");
        Optional<HttpError> error = classifier.classify(exchange, expectations);
        if (error.isPresent()) {
            reporter.report(operation, error.get());
            return ResponseOutcome.fail(error.get());
        }
        return ResponseOutcome.ok(exchange);
    }

    /**
     * Checks the exchange and, if accepted, reads its value.
     *
     * @throws IOException if the reader fails on an accepted response
     */
    public <T> ResponseOutcome<T> handle(String operation, HttpExchange exchange,
                                         ResponseExpectations expectations, BodyReader<T> reader) throws IOException {
        Objects.requireNonNull(reader, "reader must not be null");
        ResponseOutcome<HttpExchange> checked = check(operation, exchange, expectations);
        if (checked instanceof ResponseOutcome.Fail<HttpExchange> fail) {
            return ResponseOutcome.fail(fail.failure());
        }
        return ResponseOutcome.ok(reader.read(exchange));
    }
}
