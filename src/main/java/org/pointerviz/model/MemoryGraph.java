package org.pointerviz.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The ordered list of declared objects plus the derived address index and indirection edges.
 * <p>
 * Declaration order is preserved. The resolver guarantees that every resolved target was declared
 * earlier in the list; a graph built by hand is only checked for unique addresses, so consumers such as
 * the layout engine must tolerate targets that break that ordering (including cycles).
 * <p>
 * Instances are immutable and safe to share between threads.
 */
public final class MemoryGraph {

    /** Reserved target value meaning "deliberately null", as opposed to unresolved. */
    public static final String NULL_SENTINEL = "nullptr";

    private static final MemoryGraph EMPTY = new MemoryGraph(List.of());

    private final List<MemoryObject> objects;
    private final Map<String, MemoryObject> byAddress;
    private final Map<String, Integer> positions;

    /**
     * Creates a graph over the given objects, in declaration order.
     *
     * @param objects The declared objects.
     * @throws IllegalArgumentException if two objects share an address or an object uses the null sentinel as address.
     */
    public MemoryGraph(List<? extends MemoryObject> objects) {
        Objects.requireNonNull(objects, "objects");
        Map<String, MemoryObject> index = new LinkedHashMap<>();
        Map<String, Integer> order = new LinkedHashMap<>();
        for (MemoryObject object : objects) {
            if (NULL_SENTINEL.equals(object.address())) {
                throw new IllegalArgumentException("Address '" + NULL_SENTINEL + "' is reserved: " + object.name());
            }
            MemoryObject previous = index.putIfAbsent(object.address(), object);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate address " + object.address()
                        + " for '" + previous.name() + "' and '" + object.name() + "'");
            }
            order.put(object.address(), order.size());
        }
        this.objects = List.copyOf(objects);
        this.byAddress = Collections.unmodifiableMap(index);
        this.positions = Collections.unmodifiableMap(order);
    }

    public static MemoryGraph empty() {
        return EMPTY;
    }

    /**
     * @return the objects in declaration order.
     */
    public List<MemoryObject> objects() {
        return objects;
    }

    public int size() {
        return objects.size();
    }

    public boolean isEmpty() {
        return objects.isEmpty();
    }

    /**
     * Looks up an object by name. Duplicate names are legal; the first declared match wins.
     */
    public Optional<MemoryObject> findByName(String name) {
        for (MemoryObject object : objects) {
            if (object.name().equals(name)) {
                return Optional.of(object);
            }
        }
        return Optional.empty();
    }

    public Optional<MemoryObject> findByAddress(String address) {
        return Optional.ofNullable(byAddress.get(address));
    }

    /**
     * Returns the position of the object in declaration order, or -1 if the address is unknown.
     */
    public int indexOf(String address) {
        return positions.getOrDefault(address, -1);
    }

    /**
     * Returns one edge per pointer or reference whose target is a real address present in this graph.
     * Null and unresolved targets, and targets outside the graph, produce no edge.
     *
     * @return edges in declaration order of their source.
     */
    public List<PointerEdge> edges() {
        List<PointerEdge> edges = new ArrayList<>();
        for (MemoryObject object : objects) {
            if (!object.hasResolvedTarget()) continue;
            String target = object.pointsTo().orElseThrow();
            if (byAddress.containsKey(target)) {
                edges.add(new PointerEdge(object.address(), target, object.kind()));
            }
        }
        return edges;
    }

    /**
     * Checks the ordering invariant: every resolved target was declared strictly earlier than its source.
     *
     * @return true if no target refers forward or to an unknown address.
     */
    public boolean isDeclarationOrdered() {
        for (int i = 0; i < objects.size(); i++) {
            MemoryObject object = objects.get(i);
            if (!object.hasResolvedTarget()) continue;
            int targetIndex = indexOf(object.pointsTo().orElseThrow());
            if (targetIndex < 0 || targetIndex >= i) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemoryGraph other)) return false;
        return objects.equals(other.objects);
    }

    @Override
    public int hashCode() {
        return objects.hashCode();
    }

    @Override
    public String toString() {
        return "MemoryGraph" + objects;
    }
}
