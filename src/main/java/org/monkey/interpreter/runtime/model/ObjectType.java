package org.monkey.interpreter.runtime.model;

/**
 * Discriminator of the runtime value kinds.
 */
public enum ObjectType {
    INTEGER,
    BOOLEAN,
    NULL
}
