package org.javai.result;

/**
 * The discriminant of a {@link Result}. Exactly one tag holds for any result.
 */
public enum Tag {

    SUCCESS("Success"),
    FAILURE("Failure");

    private final String label;

    Tag(String label) {
        this.label = label;
    }

    /**
     * Returns the stable label used when rendering and hashing results.
     */
    public String label() {
        return label;
    }
}
