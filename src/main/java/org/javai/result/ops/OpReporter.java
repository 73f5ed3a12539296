package org.javai.result.ops;

/**
 * Reports failures and defects for observability and operator notification.
 * Implementations might emit structured logs, metrics or alerts.
 */
@FunctionalInterface
public interface OpReporter {

    /**
     * Reports a failure captured at a boundary and turned into a {@link org.javai.result.Result.Failure}.
     *
     * @param operation the operation that failed (e.g. "OrdersApi.fetch")
     * @param failure the checked exception that was captured
     */
    void reportFailure(String operation, Exception failure);

    /**
     * Reports a defect: a runtime exception or error that escaped to the top of a thread,
     * including misuse of {@link org.javai.result.Result#unwrap()}.
     *
     * @param operation where the defect surfaced
     * @param defect the uncaught throwable
     */
    default void reportDefect(String operation, Throwable defect) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static OpReporter noOp() {
        return (operation, failure) -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}
