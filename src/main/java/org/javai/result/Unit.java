package org.javai.result;

/**
 * The success value of an operation that produces nothing meaningful.
 *
 * <p>All instances are equal and share the same hash code, so {@code new Unit()} and
 * {@link #INSTANCE} are interchangeable.
 */
public record Unit() {

    public static final Unit INSTANCE = new Unit();

    @Override
    public int hashCode() {
        return 0;
    }

    @Override
    public String toString() {
        return "Unit";
    }
}
