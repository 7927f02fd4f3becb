package org.javai.httperror.ops.log4j;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.javai.httperror.HttpError;
import org.javai.httperror.ResponseBody;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class Log4jHttpErrorReporterTest {

	private CapturingAppender appender;
	private Logger logger;
	private Log4jHttpErrorReporter reporter;

	@BeforeEach
	void setUp() {
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		logger = context.getLogger("org.javai.httperror.test.Log4jHttpErrorReporter");
		appender = new CapturingAppender();
		appender.start();
		logger.addAppender(appender);
		logger.setAdditive(false);
		logger.setLevel(Level.DEBUG);
		reporter = new Log4jHttpErrorReporter(logger);
	}

	@AfterEach
	void tearDown() {
		logger.removeAppender(appender);
		appender.stop();
	}

	@Test
	void serverFailure_isLoggedAtError() {
		HttpError error = new HttpError.FailedResponse(502,
				Optional.of(ResponseBody.of("oops".getBytes(StandardCharsets.UTF_8))), Optional.empty());

		reporter.report("Payments.charge", error);

		assertThat(appender.events).hasSize(1);
		LogEvent event = appender.events.get(0);
		assertThat(event.getLevel()).isEqualTo(Level.ERROR);
		assertThat(event.getMarker().getName()).isEqualTo("HTTP_ERROR");
		assertThat(event.getMessage().getFormattedMessage())
				.isEqualTo("HTTP error in operation [Payments.charge]: HTTP response failed with status 502"
						+ " | code=org.javai.httperror:failed_response, status=502, bodyBytes=4");
	}

	@Test
	void jsonBody_isNotWrittenToLog() {
		ObjectNode json = JsonNodeFactory.instance.objectNode().put("email", "alice@example.com");
		HttpError error = new HttpError.FailedResponse(500,
				Optional.of(ResponseBody.of("{\"email\":\"alice@example.com\"}".getBytes(StandardCharsets.UTF_8))),
				Optional.of(json));

		reporter.report("Accounts.create", error);

		assertThat(appender.events.get(0).getMessage().getFormattedMessage())
				.endsWith("code=org.javai.httperror:failed_response, status=500, bodyBytes=29")
				.doesNotContain("alice@example.com");
	}

	@Test
	void namedReporter_logsToThatLogger() {
		new Log4jHttpErrorReporter("org.javai.httperror.test.Log4jHttpErrorReporter")
				.report("Search", new HttpError.UnexpectedNoContent());

		assertThat(appender.events).hasSize(1);
		assertThat(appender.events.get(0).getLevel()).isEqualTo(Level.WARN);
	}

	@Test
	void levels_followErrorKind() {
		assertThat(Log4jHttpErrorReporter.levelFor(new HttpError.FailedResponse(404))).isEqualTo(Level.WARN);
		assertThat(Log4jHttpErrorReporter.levelFor(new HttpError.FailedResponse(500))).isEqualTo(Level.ERROR);
		assertThat(Log4jHttpErrorReporter.levelFor(new HttpError.UnexpectedNoContent())).isEqualTo(Level.WARN);
		assertThat(Log4jHttpErrorReporter.levelFor(
				new HttpError.UnexpectedContentType(Optional.of("text/html"), Optional.empty()))).isEqualTo(Level.WARN);
		assertThat(Log4jHttpErrorReporter.levelFor(
				new HttpError.UnexpectedRedirect(302, Optional.empty(), Optional.empty()))).isEqualTo(Level.INFO);
	}

	@Test
	void redirect_isLoggedWithTarget() {
		reporter.report("Login", new HttpError.UnexpectedRedirect(303, Optional.of("/home"), Optional.empty()));

		LogEvent event = appender.events.get(0);
		assertThat(event.getLevel()).isEqualTo(Level.INFO);
		assertThat(event.getMessage().getFormattedMessage())
				.contains("Unexpected redirect (303) to /home")
				.contains("status=303");
	}

	private static final class CapturingAppender extends AbstractAppender {
		private final List<LogEvent> events = new ArrayList<>();

		CapturingAppender() {
			super("capture", null, null, true, Property.EMPTY_ARRAY);
		}

		@Override
		public void append(LogEvent event) {
			events.add(event.toImmutable());
		}
	}
}
