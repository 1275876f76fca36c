package org.monkey.interpreter.runtime.model;

/**
 * A runtime value produced by evaluation.
 * The set of value kinds is closed; {@link #type()} tells them apart.
 */
public sealed interface EvalObject permits IntegerObject, BooleanObject, NullObject {

    /**
     * Gets the kind of this value.
     * @return The object type.
     */
    ObjectType type();

    /**
     * Renders the value for display, e.g. in a REPL.
     * @return The textual rendering.
     */
    String inspect();
}
