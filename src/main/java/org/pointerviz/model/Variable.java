package org.pointerviz.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A plain variable holding a literal value.
 *
 * @param name         The declared identifier.
 * @param declaredType The base type as written.
 * @param address      The synthetic address.
 * @param literal      The parsed initializer: {@link Integer}, {@link Double}, a de-quoted {@link String},
 *                     or the raw initializer text.
 * @param isValueConst Whether the variable was declared {@code const}.
 */
public record Variable(
        String name,
        String declaredType,
        String address,
        Object literal,
        boolean isValueConst
) implements MemoryObject {

    public Variable {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(declaredType, "declaredType");
        Objects.requireNonNull(address, "address");
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.VARIABLE;
    }

    @Override
    public Optional<String> pointsTo() {
        return Optional.empty();
    }

    @Override
    public Optional<Object> value() {
        return Optional.ofNullable(literal);
    }

    @Override
    public String typeDescription() {
        return (isValueConst ? "const " : "") + declaredType;
    }

    @Override
    public String modifiability() {
        return isValueConst ? "value NOT modifiable" : "value modifiable";
    }

    @Override
    public String valueOrTarget() {
        return "Value: " + literal;
    }
}
