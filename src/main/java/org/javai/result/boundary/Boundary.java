package org.javai.result.boundary;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import org.javai.result.Result;
import org.javai.result.Unit;
import org.javai.result.ops.OpReporter;

/**
 * The boundary adapter for integrating APIs that signal failure by throwing checked exceptions.
 * Catches the exception once, reports it, and returns it as a {@link Result.Failure}.
 *
 * <p>This is the single point where checked exceptions are translated into results. After
 * passing through a Boundary, code composes failures with the {@link Result} combinators
 * instead of try/catch.</p>
 *
 * <p>For synchronous work, RuntimeExceptions and Errors (defects) are not caught. They propagate
 * up to be handled by {@link org.javai.result.ops.OperationalExceptionHandler} at the top of the
 * stack. Asynchronous work settled with {@link #settle} has already left the caller's stack, so
 * any exception it fails with becomes the failure; only errors and cancellation stay defects.</p>
 *
 * <pre>{@code
 * Boundary boundary = Boundary.withReporter(new Log4jOpReporter());
 *
 * Result<Config, IOException> config = boundary.call(
 *     "Config.load",
 *     IOException.class,
 *     () -> loader.load(path)
 * );
 *
 * // Asynchronous work is settled once, when it completes; any exception it fails with
 * // becomes the failure value
 * CompletionStage<Result<Response, Exception>> response =
 *     boundary.settle("HttpClient.sendAsync", client.sendAsync(request, handler));
 * }</pre>
 */
public final class Boundary {

    private final OpReporter reporter;

    /**
     * Creates a silent Boundary that converts failures but does not report them.
     */
    public static Boundary silent() {
        return new Boundary(OpReporter.noOp());
    }

    /**
     * Creates a Boundary that reports every captured failure to {@code reporter}.
     */
    public static Boundary withReporter(OpReporter reporter) {
        return new Boundary(reporter);
    }

    public Boundary(OpReporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Executes work that may throw checked exceptions, translating any checked exception into a failure.
     *
     * @param operation The operation name for context and reporting
     * @param work The work to execute; must not return null
     * @return Success with the value, or Failure with the checked exception
     */
    public <T> Result<T, Exception> call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        return call(operation, Exception.class, work);
    }

    /**
     * Executes work whose checked failures are all of type {@code failureType}.
     *
     * @param operation The operation name for context and reporting
     * @param failureType The checked exception type that becomes the failure value
     * @param work The work to execute; must not return null
     * @return Success with the value, or Failure with the exception
     * @throws IllegalArgumentException if {@code failureType} is a RuntimeException type
     */
    public <T, X extends Exception> Result<T, X> call(
            String operation,
            Class<X> failureType,
            ThrowingSupplier<T, ? extends X> work
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        requireCheckedType(failureType);
        Objects.requireNonNull(work, "work must not be null");

        T value;
        try {
            value = work.get();
        } catch (RuntimeException e) {
            // Defects propagate; they are not operational failures.
            throw e;
        } catch (Exception e) {
            return capture(operation, failureType, e);
        }
        return Result.success(requireValue(operation, value));
    }

    /**
     * Executes work that produces no value, translating any checked exception into a failure.
     *
     * @return Success holding {@link Unit}, or Failure with the checked exception
     */
    public Result<Unit, Exception> run(String operation, ThrowingRunnable<? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        return call(operation, Exception.class, () -> {
            work.run();
            return Unit.INSTANCE;
        });
    }

    /**
     * Converts the single completion of an asynchronous operation into a result.
     *
     * @param operation The operation name for context and reporting
     * @param stage The asynchronous operation
     * @return a stage completing with Success or Failure; it completes exceptionally only for defects
     */
    public <T> CompletionStage<Result<T, Exception>> settle(String operation, CompletionStage<T> stage) {
        return settle(operation, Exception.class, stage);
    }

    /**
     * Converts the single completion of an asynchronous operation into a result whose failure
     * type is {@code failureType}.
     *
     * <p>Normal completion becomes a success. Exceptional completion with an exception of
     * {@code failureType} becomes a failure, after unwrapping {@link CompletionException} and
     * {@link ExecutionException}. Unlike {@link #call}, unchecked exceptions are accepted here:
     * work run through {@code supplyAsync} can only fail with one. Errors, cancellation, runtime
     * exceptions outside {@code failureType} and undeclared checked exceptions complete the
     * returned stage exceptionally.
     */
    public <T, X extends Exception> CompletionStage<Result<T, X>> settle(
            String operation,
            Class<X> failureType,
            CompletionStage<T> stage
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(failureType, "failureType must not be null");
        Objects.requireNonNull(stage, "stage must not be null");

        CompletableFuture<Result<T, X>> settled = new CompletableFuture<>();
        stage.whenComplete((value, thrown) -> {
            try {
                if (thrown == null) {
                    settled.complete(Result.success(requireValue(operation, value)));
                    return;
                }
                Throwable cause = unwrapCompletion(thrown);
                if (isSettledFailure(cause, failureType)) {
                    settled.complete(capture(operation, failureType, (Exception) cause));
                } else {
                    settled.completeExceptionally(cause);
                }
            } catch (RuntimeException | Error e) {
                settled.completeExceptionally(e);
            }
        });
        return settled;
    }

    private <T, X extends Exception> Result<T, X> capture(String operation, Class<X> failureType, Exception e) {
        if (!failureType.isInstance(e)) {
            throw new IllegalStateException(
                    "Operation [" + operation + "] threw undeclared " + e.getClass().getName(), e);
        }
        reporter.reportFailure(operation, e);
        return Result.failure(failureType.cast(e));
    }

    private static boolean isSettledFailure(Throwable cause, Class<? extends Exception> failureType) {
        if (!(cause instanceof Exception) || cause instanceof CancellationException) {
            return false;
        }
        // Checked exceptions outside failureType are captured and rejected as undeclared.
        return failureType.isInstance(cause) || !(cause instanceof RuntimeException);
    }

    private static <T> T requireValue(String operation, T value) {
        return Objects.requireNonNull(value,
                () -> "Operation [" + operation + "] produced null; return Unit for value-less success");
    }

    private static void requireCheckedType(Class<? extends Exception> failureType) {
        Objects.requireNonNull(failureType, "failureType must not be null");
        if (RuntimeException.class.isAssignableFrom(failureType)) {
            throw new IllegalArgumentException(
                    "failureType must be a checked exception, got " + failureType.getName());
        }
    }

    private static Throwable unwrapCompletion(Throwable thrown) {
        Throwable cause = thrown;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
