package org.monkey.interpreter.runtime.model;

/**
 * The absence of a meaningful value, e.g. the result of an operator applied to unsupported types.
 * {@link #NULL} is the only instance.
 */
public final class NullObject implements EvalObject {

    /** The shared null value. */
    public static final NullObject NULL = new NullObject();

    private NullObject() {
    }

    @Override
    public ObjectType type() {
        return ObjectType.NULL;
    }

    @Override
    public String inspect() {
        return "null";
    }

    @Override
    public String toString() {
        return "NullObject";
    }
}
