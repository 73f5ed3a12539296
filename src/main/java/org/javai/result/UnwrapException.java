package org.javai.result;

/**
 * Thrown when a {@link Result} accessor is called on the wrong variant, such as
 * {@link Result#unwrap()} on a failure. This is an unchecked exception because it indicates
 * misuse of the API; the caller should have checked the tag first or used a defaulting
 * combinator.
 */
public class UnwrapException extends RuntimeException {

    private final String accessor;
    private final Tag actualTag;
    private final transient Object heldValue;

    public UnwrapException(String accessor, Tag actualTag, Object heldValue) {
        super("called " + accessor + " on a " + actualTag.label() + " value: " + heldValue);
        this.accessor = accessor;
        this.actualTag = actualTag;
        this.heldValue = heldValue;
    }

    /**
     * The accessor that was misused, e.g. {@code "unwrap()"}.
     */
    public String accessor() {
        return accessor;
    }

    public Tag actualTag() {
        return actualTag;
    }

    public Object heldValue() {
        return heldValue;
    }
}
