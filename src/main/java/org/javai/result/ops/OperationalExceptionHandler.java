package org.javai.result.ops;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Catches uncaught exceptions (defects) at the top of the stack and reports them to operations.
 *
 * <p>This handler complements {@link org.javai.result.boundary.Boundary}: the boundary turns
 * checked exceptions into failures and lets runtime exceptions propagate, and this handler
 * reports those at the thread level before the thread dies. An
 * {@link org.javai.result.UnwrapException} thrown by misusing a result ends up here too.
 *
 * <pre>{@code
 * OperationalExceptionHandler handler = new OperationalExceptionHandler(reporter);
 * ExecutorService executor = Executors.newFixedThreadPool(4, handler.threadFactory("worker"));
 * }</pre>
 */
public final class OperationalExceptionHandler implements UncaughtExceptionHandler {

    private final OpReporter reporter;

    public OperationalExceptionHandler(OpReporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    @Override
    public void uncaughtException(Thread thread, Throwable throwable) {
        reporter.reportDefect("UncaughtException:" + thread.getName(), throwable);
    }

    /**
     * Installs this handler as the default for all threads.
     */
    public void installAsDefault() {
        Thread.setDefaultUncaughtExceptionHandler(this);
    }

    /**
     * Installs this handler on a specific thread.
     */
    public void installOn(Thread thread) {
        thread.setUncaughtExceptionHandler(this);
    }

    /**
     * Creates a named ThreadFactory that installs this handler on all created threads.
     */
    public ThreadFactory threadFactory(String namePrefix) {
        return new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
                thread.setUncaughtExceptionHandler(OperationalExceptionHandler.this);
                return thread;
            }
        };
    }
}
