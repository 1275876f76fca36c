package org.monkey.interpreter.runtime.model;

/**
 * A signed 64-bit integer value. Every arithmetic result is a fresh instance.
 *
 * @param value The numeric value.
 */
public record IntegerObject(long value) implements EvalObject {

    @Override
    public ObjectType type() {
        return ObjectType.INTEGER;
    }

    @Override
    public String inspect() {
        return Long.toString(value);
    }
}
