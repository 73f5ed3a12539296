package org.javai.result.examples;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.http.HttpConnectTimeoutException;
import java.util.ArrayList;
import java.util.List;

import org.javai.result.Result;
import org.javai.result.boundary.Boundary;
import org.javai.result.ops.OpReporter;
import org.javai.result.ops.log4j.Log4jOpReporter;
import org.junit.jupiter.api.Test;

/**
 * Demonstrates composing multiple OpReporters together.
 *
 * <p>Each reporter receives every failure captured at the boundary, so the same failure can
 * go to logs and to a collector (or metrics, alerts) at once.
 */
public class CompositeReporterTest {

	@Test
	void compositeReporterFansOutToAllReporters() {
		Log4jOpReporter logReporter = new Log4jOpReporter();

		List<String> collectedOperations = new ArrayList<>();
		OpReporter collectingReporter = (operation, failure) -> collectedOperations.add(operation);

		Boundary boundary = Boundary.withReporter(OpReporter.composite(logReporter, collectingReporter));
		ServiceUnavailableApi api = new ServiceUnavailableApi();

		Result<String, Exception> first = boundary.call("OrderApi.submit", api::submit);
		Result<String, Exception> second = first.orElse(e -> boundary.call("OrderApi.submit", api::submit));

		assertThat(second.isFailure()).isTrue();
		assertThat(second.unwrapFailure()).isInstanceOf(HttpConnectTimeoutException.class);
		assertThat(collectedOperations).containsExactly("OrderApi.submit", "OrderApi.submit");
	}

	@Test
	void defectsAreLoggedAndCollected() {
		List<Throwable> defects = new ArrayList<>();
		OpReporter collectingReporter = new OpReporter() {
			@Override
			public void reportFailure(String operation, Exception failure) {
			}

			@Override
			public void reportDefect(String operation, Throwable defect) {
				defects.add(defect);
			}
		};
		OpReporter reporter = OpReporter.composite(new Log4jOpReporter("org.javai.result.examples"), collectingReporter);

		IllegalStateException bug = new IllegalStateException("unexpected state");
		reporter.reportDefect("Worker.run", bug);

		assertThat(defects).containsExactly(bug);
	}

	/** Simulates a service returning HTTP 503 Service Unavailable. */
	private static class ServiceUnavailableApi {
		String submit() throws HttpConnectTimeoutException {
			throw new HttpConnectTimeoutException("503 Service Unavailable");
		}
	}
}
