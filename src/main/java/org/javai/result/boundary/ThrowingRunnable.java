package org.javai.result.boundary;

/**
 * A runnable that may throw a checked exception.
 *
 * @param <X> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingRunnable<X extends Exception> {

    void run() throws X;
}
