package proof;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only collection of named theorems. {@link #with(String, Theorem)} returns a new library; existing
 * libraries never change.
 */
public final class Library {
    private static final Library EMPTY = new Library(Map.of());

    private final Map<String, Theorem> theorems;

    private Library(Map<String, Theorem> theorems) {
        this.theorems = Collections.unmodifiableMap(new LinkedHashMap<>(theorems));
    }

    public static Library empty() {
        return EMPTY;
    }

    public Library with(String name, Theorem theorem) {
        if (theorems.containsKey(name)) {
            throw new IllegalArgumentException("Theorem " + name + " is already in the library");
        }
        Map<String, Theorem> extended = new LinkedHashMap<>(theorems);
        extended.put(name, theorem);
        return new Library(extended);
    }

    public Optional<Theorem> get(String name) {
        return Optional.ofNullable(theorems.get(name));
    }

    /**
     * Theorem names in the order they were added.
     */
    public Set<String> names() {
        return theorems.keySet();
    }

    public Map<String, Theorem> asMap() {
        return theorems;
    }

    public int size() {
        return theorems.size();
    }
}
