package org.pointerviz.model;

/**
 * The closed set of declared entity kinds.
 */
public enum ObjectKind {
    VARIABLE,
    POINTER,
    REFERENCE
}
