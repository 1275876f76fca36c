package org.monkey.interpreter.runtime.model;

/**
 * A boolean value. Only the two shared instances {@link #TRUE} and {@link #FALSE} exist.
 */
public final class BooleanObject implements EvalObject {

    /** The shared {@code true} value. */
    public static final BooleanObject TRUE = new BooleanObject(true);
    /** The shared {@code false} value. */
    public static final BooleanObject FALSE = new BooleanObject(false);

    private final boolean value;

    private BooleanObject(boolean value) {
        this.value = value;
    }

    /**
     * Returns the shared instance for a boolean.
     * @param value The boolean.
     * @return {@link #TRUE} or {@link #FALSE}.
     */
    public static BooleanObject of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Gets the boolean value.
     * @return The value.
     */
    public boolean value() {
        return value;
    }

    @Override
    public ObjectType type() {
        return ObjectType.BOOLEAN;
    }

    @Override
    public String inspect() {
        return Boolean.toString(value);
    }

    @Override
    public String toString() {
        return "BooleanObject[" + value + "]";
    }
}
