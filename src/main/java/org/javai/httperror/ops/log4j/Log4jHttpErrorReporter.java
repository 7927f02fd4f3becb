package org.javai.httperror.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.httperror.HttpError;
import org.javai.httperror.ResponseBody;
import org.javai.httperror.ops.HttpErrorReporter;

import java.util.Optional;

/**
 * Reports HTTP errors using Log4j2.
 *
 * <p>Log levels by error:
 * <ul>
 *   <li>{@code FailedResponse} with a 5xx status → ERROR</li>
 *   <li>other {@code FailedResponse}, {@code UnexpectedContentType}, {@code UnexpectedNoContent} → WARN</li>
 *   <li>{@code UnexpectedRedirect} → INFO</li>
 * </ul>
 *
 * <p>Only the status and the body size are logged, never the body or its decoded JSON.
 */
public class Log4jHttpErrorReporter implements HttpErrorReporter {

	static final Marker HTTP_ERROR_MARKER = MarkerManager.getMarker("HTTP_ERROR");

	private final Logger logger;

	/**
	 * Creates a Log4jHttpErrorReporter using the default logger name.
	 */
	public Log4jHttpErrorReporter() {
		this(LogManager.getLogger("org.javai.httperror.HttpErrorReporter"));
	}

	/**
	 * Creates a Log4jHttpErrorReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jHttpErrorReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jHttpErrorReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jHttpErrorReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(String operation, HttpError error) {
		logger.atLevel(levelFor(error))
			.withMarker(HTTP_ERROR_MARKER)
			.log("HTTP error in operation [{}]: {} | code={}{}",
				operation,
				error.message(),
				error.failureCode(),
				formatDetails(error));
	}

	static Level levelFor(HttpError error) {
		if (error instanceof HttpError.FailedResponse failed) {
			return failed.statusCode() >= 500 ? Level.ERROR : Level.WARN;
		}
		if (error instanceof HttpError.UnexpectedRedirect) {
			return Level.INFO;
		}
		return Level.WARN;
	}

	private static String formatDetails(HttpError error) {
		if (error instanceof HttpError.FailedResponse failed) {
			return ", status=" + failed.statusCode() + formatBody(failed.body());
		}
		if (error instanceof HttpError.UnexpectedContentType unexpected) {
			return formatBody(unexpected.body());
		}
		if (error instanceof HttpError.UnexpectedRedirect redirect) {
			return ", status=" + redirect.statusCode() + formatBody(redirect.body());
		}
		return "";
	}

	private static String formatBody(Optional<ResponseBody> body) {
		return body.map(b -> ", bodyBytes=" + b.size()).orElse("");
	}
}
