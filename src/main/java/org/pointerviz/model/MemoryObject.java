package org.pointerviz.model;

import java.util.List;
import java.util.Optional;

/**
 * One declared entity of a program: a plain variable, a pointer, or a reference.
 * <p>
 * Instances are created exactly once by the resolver, in declaration order, and are immutable.
 * Kind-specific fields live on the implementing records, so invalid combinations (a variable
 * with an indirection level, a reference with a const binding) cannot be expressed.
 */
public sealed interface MemoryObject permits Variable, Pointer, Reference {

    /** Identifier as declared. Not guaranteed unique. */
    String name();

    /** Base type name as written, e.g. {@code int}. */
    String declaredType();

    /** Synthetic address, unique within one resolution run. */
    String address();

    /** Whether the value (or pointee/referent) is immutable. */
    boolean isValueConst();

    ObjectKind kind();

    /**
     * The address this object points to or binds to.
     *
     * @return the target address, {@link MemoryGraph#NULL_SENTINEL} for a deliberate null pointer,
     *         or empty when the object has no target or the target could not be resolved.
     */
    Optional<String> pointsTo();

    /**
     * The stored value: a literal for variables, the mirrored target for pointers, the
     * referent's value for references.
     */
    Optional<Object> value();

    /**
     * Human-readable type, e.g. {@code const int* const} or {@code int &}.
     */
    String typeDescription();

    /**
     * Summary of which parts of the object may be modified.
     */
    String modifiability();

    /**
     * The value line shown inside a diagram node.
     */
    String valueOrTarget();

    /**
     * All text lines a renderer puts into the node box. Used to estimate node widths.
     */
    default List<String> displayLines() {
        return List.of(name(), typeDescription(), valueOrTarget(), "Address: " + address());
    }

    /**
     * @return true if {@link #pointsTo()} names a real address (neither empty nor the null sentinel).
     */
    default boolean hasResolvedTarget() {
        return pointsTo().filter(target -> !MemoryGraph.NULL_SENTINEL.equals(target)).isPresent();
    }
}
