package org.javai.httperror.ops;

import org.javai.httperror.HttpError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * An {@link HttpErrorReporter} that delegates to multiple reporters.
 *
 * <p>Every delegate receives every error. A delegate that throws is logged and
 * skipped so the remaining delegates still run.
 *
 * <pre>{@code
 * HttpErrorReporter reporter = CompositeHttpErrorReporter.of(
 *     new Log4jHttpErrorReporter(),
 *     new MetricsHttpErrorReporter("myapp")
 * );
 * }</pre>
 */
public final class CompositeHttpErrorReporter implements HttpErrorReporter {

	private static final Logger logger = LoggerFactory.getLogger(CompositeHttpErrorReporter.class);

	private final List<HttpErrorReporter> reporters;

	private CompositeHttpErrorReporter(List<HttpErrorReporter> reporters) {
		reporters.forEach(r -> Objects.requireNonNull(r, "reporter must not be null"));
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeHttpErrorReporter of(HttpErrorReporter... reporters) {
		return new CompositeHttpErrorReporter(Arrays.asList(reporters));
	}

	public static CompositeHttpErrorReporter of(Collection<? extends HttpErrorReporter> reporters) {
		return new CompositeHttpErrorReporter(List.copyOf(reporters));
	}

	public int size() {
		return reporters.size();
	}

	@Override
	public void report(String operation, HttpError error) {
		for (HttpErrorReporter reporter : reporters) {
			try {
				reporter.report(operation, error);
			} catch (RuntimeException e) {
				logger.warn("Reporter {} failed to report {} for operation [{}]",
						reporter.getClass().getName(), error.failureCode(), operation, e);
			}
		}
	}
}
