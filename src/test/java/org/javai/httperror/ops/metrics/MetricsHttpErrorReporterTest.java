package org.javai.httperror.ops.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.httperror.HttpError;
import org.javai.httperror.ResponseBody;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.helpers.LegacyAbstractLogger;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class MetricsHttpErrorReporterTest {

	private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-01-20T10:30:00Z"), ZoneOffset.UTC);

	private List<String> capturedMessages;
	private CapturingLogger capturingLogger;
	private MetricsHttpErrorReporter reporter;
	private ObjectMapper objectMapper;

	@BeforeEach
	void setUp() {
		capturedMessages = new ArrayList<>();
		capturingLogger = new CapturingLogger(capturedMessages);
		reporter = new MetricsHttpErrorReporter(null, capturingLogger, FIXED_CLOCK);
		objectMapper = new ObjectMapper();
	}

	@Test
	void report_emitsFailedResponseAsJsonLine() throws Exception {
		HttpError error = new HttpError.FailedResponse(503,
				Optional.of(ResponseBody.of("busy".getBytes(StandardCharsets.UTF_8))), Optional.empty());

		reporter.report("orders.fetch", error);

		assertThat(capturedMessages).hasSize(1);
		JsonNode event = objectMapper.readTree(capturedMessages.get(0));
		assertThat(event.get("eventType").asText()).isEqualTo("http_error");
		assertThat(event.get("timestamp").asText()).isEqualTo("2024-01-20T10:30:00Z");
		assertThat(event.get("trackingKey").asText()).isEqualTo("orders.fetch");
		assertThat(event.get("domain").asText()).isEqualTo("org.javai.httperror");
		assertThat(event.get("kind").asText()).isEqualTo("failed_response");
		assertThat(event.get("code").asInt()).isEqualTo(1);
		assertThat(event.get("statusCode").asInt()).isEqualTo(503);
		assertThat(event.get("bodyBytes").asInt()).isEqualTo(4);
	}

	@Test
	void report_redirectIncludesLocation() throws Exception {
		reporter.report("login", new HttpError.UnexpectedRedirect(302, Optional.of("/sso"), Optional.empty()));

		JsonNode event = objectMapper.readTree(capturedMessages.get(0));
		assertThat(event.get("kind").asText()).isEqualTo("unexpected_redirect");
		assertThat(event.get("location").asText()).isEqualTo("/sso");
		assertThat(event.has("bodyBytes")).isFalse();
	}

	@Test
	void report_contentTypeOmittedWhenAbsent() throws Exception {
		reporter.report("export", new HttpError.UnexpectedContentType(Optional.empty(), Optional.empty()));

		JsonNode event = objectMapper.readTree(capturedMessages.get(0));
		assertThat(event.get("code").asInt()).isEqualTo(2);
		assertThat(event.has("contentType")).isFalse();
	}

	@Test
	void report_withNamespace_prependsToTrackingKey() throws Exception {
		MetricsHttpErrorReporter namespaced = new MetricsHttpErrorReporter(" myapp ", capturingLogger, FIXED_CLOCK);

		namespaced.report("orders.fetch", new HttpError.UnexpectedNoContent());

		JsonNode event = objectMapper.readTree(capturedMessages.get(0));
		assertThat(event.get("trackingKey").asText()).isEqualTo("myapp.orders.fetch");
	}

	@Test
	void report_withBlankNamespace_usesOperationOnly() {
		MetricsHttpErrorReporter blank = new MetricsHttpErrorReporter("  ", capturingLogger, FIXED_CLOCK);

		assertThat(blank.buildTrackingKey("orders.fetch")).isEqualTo("orders.fetch");
	}

	@Test
	void report_escapesOperationNames() throws Exception {
		reporter.report("say \"hi\"\n", new HttpError.UnexpectedNoContent());

		JsonNode event = objectMapper.readTree(capturedMessages.get(0));
		assertThat(event.get("operation").asText()).isEqualTo("say \"hi\"\n");
	}

	private static final class CapturingLogger extends LegacyAbstractLogger {
		private final List<String> messages;

		CapturingLogger(List<String> messages) {
			this.messages = messages;
			this.name = "test";
		}

		@Override
		public boolean isTraceEnabled() { return false; }

		@Override
		public boolean isDebugEnabled() { return false; }

		@Override
		public boolean isInfoEnabled() { return true; }

		@Override
		public boolean isWarnEnabled() { return true; }

		@Override
		public boolean isErrorEnabled() { return true; }

		@Override
		protected String getFullyQualifiedCallerName() { return null; }

		@Override
		protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
				Object[] arguments, Throwable throwable) {
			if (level == Level.INFO) {
				messages.add(messagePattern);
			}
		}
	}
}
