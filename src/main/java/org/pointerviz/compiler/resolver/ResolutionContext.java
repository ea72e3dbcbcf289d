package org.pointerviz.compiler.resolver;

import org.pointerviz.model.MemoryObject;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Per-run state of a resolution: the address counter and the prefix of objects declared so far.
 * <p>
 * A fresh context is created for every {@link DeclarationResolver#resolve} call, so addresses restart at
 * {@link #BASE_ADDRESS} and concurrent resolutions never share state. Name lookups only ever see objects
 * declared before the statement being resolved; among duplicates the first declaration wins.
 */
final class ResolutionContext {

    static final int BASE_ADDRESS = 0x1000;
    static final int ADDRESS_STRIDE = 4;

    private final List<MemoryObject> declared = new ArrayList<>();
    private final Map<String, MemoryObject> firstByName = new HashMap<>();
    private final Map<String, MemoryObject> byAddress = new HashMap<>();
    private int nextAddress = BASE_ADDRESS;

    /**
     * Allocates the next synthetic address, e.g. {@code 0x1000}, {@code 0x1004}.
     */
    String allocateAddress() {
        String address = String.format(Locale.ROOT, "0x%04X", nextAddress);
        nextAddress += ADDRESS_STRIDE;
        return address;
    }

    /**
     * Appends a resolved object to the declared prefix.
     */
    void declare(MemoryObject object) {
        declared.add(object);
        firstByName.putIfAbsent(object.name(), object);
        byAddress.put(object.address(), object);
    }

    Optional<MemoryObject> lookup(String name) {
        return Optional.ofNullable(firstByName.get(name));
    }

    Optional<MemoryObject> lookupAddress(String address) {
        return Optional.ofNullable(byAddress.get(address));
    }

    List<MemoryObject> declared() {
        return declared;
    }
}
