package org.javai.httperror.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.httperror.HttpError;
import org.javai.httperror.ops.HttpErrorReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.format.DateTimeFormatter;

/**
 * Reports HTTP errors as JSON-lines metrics via SLF4J.
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"http_error","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.orders.fetch","domain":"org.javai.httperror","kind":"failed_response","code":1,"operation":"orders.fetch","statusCode":503,"bodyBytes":42}
 * }</pre>
 *
 * <p>The no-argument constructor reads the tracking key namespace from the system property
 * {@code httperror.metrics.namespace}, falling back to the environment variable
 * {@code HTTPERROR_METRICS_NAMESPACE}.
 */
public class MetricsHttpErrorReporter implements HttpErrorReporter {

	static final String NAMESPACE_PROPERTY = "httperror.metrics.namespace";
	static final String NAMESPACE_ENV = "HTTPERROR_METRICS_NAMESPACE";

	private static final String DEFAULT_LOGGER_NAME = "org.javai.httperror.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final ObjectMapper MAPPER = new ObjectMapper();
	private static final Logger selfLogger = LoggerFactory.getLogger(MetricsHttpErrorReporter.class);

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	public MetricsHttpErrorReporter() {
		this(resolveConfig(NAMESPACE_PROPERTY, NAMESPACE_ENV));
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsHttpErrorReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	public MetricsHttpErrorReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	// Package-private for testing.
	MetricsHttpErrorReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void report(String operation, HttpError error) {
		try {
			logger.info(MAPPER.writeValueAsString(buildEvent(operation, error)));
		} catch (JsonProcessingException e) {
			selfLogger.warn("Could not serialize metrics event for {}", error.failureCode(), e);
		}
	}

	ObjectNode buildEvent(String operation, HttpError error) {
		ObjectNode event = MAPPER.createObjectNode();
		event.put("eventType", "http_error");
		event.put("timestamp", ISO_FORMATTER.format(clock.instant()));
		event.put("trackingKey", buildTrackingKey(operation));
		event.put("domain", HttpError.DOMAIN);
		event.put("kind", error.kind().id());
		event.put("code", error.code());
		event.put("operation", operation);
		if (error instanceof HttpError.FailedResponse failed) {
			event.put("statusCode", failed.statusCode());
			failed.body().ifPresent(body -> event.put("bodyBytes", body.size()));
		} else if (error instanceof HttpError.UnexpectedContentType unexpected) {
			unexpected.contentType().ifPresent(contentType -> event.put("contentType", contentType));
			unexpected.body().ifPresent(body -> event.put("bodyBytes", body.size()));
		} else if (error instanceof HttpError.UnexpectedRedirect redirect) {
			event.put("statusCode", redirect.statusCode());
			redirect.location().ifPresent(location -> event.put("location", location));
			redirect.body().ifPresent(body -> event.put("bodyBytes", body.size()));
		}
		return event;
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	private static String resolveConfig(String propertyName, String envName) {
		String value = System.getProperty(propertyName);
		if (value == null || value.isBlank()) {
			value = System.getenv(envName);
		}
		return value;
	}
}
