package org.pointerviz.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A reference bound once to an existing object. The binding can never change, so there is no
 * counterpart of {@link Pointer#isPointerConst()}.
 *
 * @param name                  The declared identifier.
 * @param declaredType          The base type as written.
 * @param address               The synthetic address of the reference itself.
 * @param target                The referent's address, or {@code null} if it could not be resolved.
 * @param referentValue         The referent's value at declaration time, or {@code null}.
 * @param isValueConst          Whether the referent is accessed as const.
 * @param targetIndirectionLevel Stars in the referenced type, e.g. 1 for {@code int* &r}.
 */
public record Reference(
        String name,
        String declaredType,
        String address,
        String target,
        Object referentValue,
        boolean isValueConst,
        int targetIndirectionLevel
) implements MemoryObject {

    public Reference {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(declaredType, "declaredType");
        Objects.requireNonNull(address, "address");
        if (targetIndirectionLevel < 0) {
            throw new IllegalArgumentException("Indirection level must not be negative, got " + targetIndirectionLevel);
        }
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.REFERENCE;
    }

    @Override
    public Optional<String> pointsTo() {
        return Optional.ofNullable(target);
    }

    @Override
    public Optional<Object> value() {
        return Optional.ofNullable(referentValue);
    }

    @Override
    public String typeDescription() {
        return (isValueConst ? "const " : "") + declaredType + "*".repeat(targetIndirectionLevel) + " &";
    }

    @Override
    public String modifiability() {
        return "ref NOT rebindable (always), " + (isValueConst ? "*ref NOT modifiable" : "*ref modifiable");
    }

    @Override
    public String valueOrTarget() {
        return "-> " + (target != null ? target : "?");
    }
}
