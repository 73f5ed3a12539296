package org.javai.result.ops.log4j;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.result.ops.OpReporter;

/**
 * Reports failures and defects using Log4j2.
 *
 * <p>Failures captured at a boundary are expected outcomes and are logged at WARN with the
 * {@code FAILURE} marker. Defects are bugs and are logged at ERROR with the {@code DEFECT}
 * marker, together with their stack trace.
 */
public class Log4jOpReporter implements OpReporter {

	static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	static final Marker DEFECT_MARKER = MarkerManager.getMarker("DEFECT");

	private final Logger logger;

	/**
	 * Creates a Log4jOpReporter using the default logger name.
	 */
	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.result.OpReporter"));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportFailure(String operation, Exception failure) {
		logger.atWarn()
			.withMarker(FAILURE_MARKER)
			.log("Failure in operation [{}]: {} | type={}",
				operation,
				failure.getMessage(),
				failure.getClass().getName());
	}

	@Override
	public void reportDefect(String operation, Throwable defect) {
		logger.atError()
			.withMarker(DEFECT_MARKER)
			.withThrowable(defect)
			.log("Defect in operation [{}]: {}", operation, defect.toString());
	}
}
