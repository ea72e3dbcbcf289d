package org.pointerviz.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A pointer of one or more levels of indirection.
 *
 * @param name             The declared identifier.
 * @param declaredType     The base type as written (without stars).
 * @param address          The synthetic address.
 * @param target           The pointee address, {@link MemoryGraph#NULL_SENTINEL}, or {@code null} if unresolved.
 * @param isValueConst     Whether the pointee is const ({@code const int *p}).
 * @param isPointerConst   Whether the pointer itself is const ({@code int* const p}).
 * @param indirectionLevel Number of stars in the declaration, at least 1.
 */
public record Pointer(
        String name,
        String declaredType,
        String address,
        String target,
        boolean isValueConst,
        boolean isPointerConst,
        int indirectionLevel
) implements MemoryObject {

    public Pointer {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(declaredType, "declaredType");
        Objects.requireNonNull(address, "address");
        if (indirectionLevel < 1) {
            throw new IllegalArgumentException("Indirection level must be at least 1, got " + indirectionLevel);
        }
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.POINTER;
    }

    @Override
    public Optional<String> pointsTo() {
        return Optional.ofNullable(target);
    }

    /**
     * Mirrors {@link #pointsTo()} for display.
     */
    @Override
    public Optional<Object> value() {
        return Optional.ofNullable(target);
    }

    /**
     * @return true if this pointer was initialized with {@code nullptr}, {@code NULL} or {@code 0}.
     */
    public boolean isNull() {
        return MemoryGraph.NULL_SENTINEL.equals(target);
    }

    @Override
    public String typeDescription() {
        return (isValueConst ? "const " : "") + declaredType + "*".repeat(indirectionLevel)
                + (isPointerConst ? " const" : "");
    }

    @Override
    public String modifiability() {
        return (isValueConst ? "*p NOT modifiable" : "*p modifiable")
                + ", " + (isPointerConst ? "p NOT modifiable" : "p modifiable");
    }

    @Override
    public String valueOrTarget() {
        return "-> " + (target != null ? target : "?");
    }
}
