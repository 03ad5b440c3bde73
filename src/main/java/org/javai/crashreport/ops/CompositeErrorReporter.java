package org.javai.crashreport.ops;

import org.javai.crashreport.ExceptionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * An {@link ErrorReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every report. If a reporter throws an exception,
 * it is caught and logged, allowing remaining reporters to execute.
 *
 * <p>Example usage:
 * <pre>{@code
 * ErrorReporter reporter = CompositeErrorReporter.of(
 *     new Log4jErrorReporter(),
 *     new JsonLinesErrorReporter()
 * );
 * }</pre>
 */
public final class CompositeErrorReporter implements ErrorReporter {

	private static final Logger log = LoggerFactory.getLogger(CompositeErrorReporter.class);

	private final List<ErrorReporter> reporters;

	private CompositeErrorReporter(List<ErrorReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeErrorReporter of(ErrorReporter... reporters) {
		return new CompositeErrorReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeErrorReporter of(Collection<? extends ErrorReporter> reporters) {
		return new CompositeErrorReporter(new ArrayList<>(reporters));
	}

	/**
	 * Creates a builder for constructing a composite reporter.
	 *
	 * @return a new builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(ExceptionReport report) {
		for (ErrorReporter reporter : reporters) {
			try {
				reporter.report(report);
			} catch (Exception e) {
				log.warn("ErrorReporter.report failed for {}: {}", reporter.getClass().getName(), e.getMessage(), e);
			}
		}
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	/**
	 * Builder for creating a {@link CompositeErrorReporter}.
	 */
	public static final class Builder {
		private final List<ErrorReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter to the composite. Null is ignored.
		 */
		public Builder add(ErrorReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		/**
		 * Conditionally adds a reporter based on a flag.
		 */
		public Builder addIf(boolean condition, ErrorReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeErrorReporter build() {
			return new CompositeErrorReporter(reporters);
		}
	}
}
