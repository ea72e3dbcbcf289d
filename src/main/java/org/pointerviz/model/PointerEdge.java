package org.pointerviz.model;

/**
 * A directed indirection link from a pointer or reference to the object it targets.
 *
 * @param fromAddress Address of the pointer or reference.
 * @param toAddress   Address of the target object.
 * @param kind        Kind of the source object, {@link ObjectKind#POINTER} or {@link ObjectKind#REFERENCE}.
 */
public record PointerEdge(String fromAddress, String toAddress, ObjectKind kind) {
}
