package fol.formula;

/**
 * Predicate symbol; {@code true} is the only reserved nullary one.
 */
public record PSymbol(String name, int arity) {
    public PSymbol {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Predicate symbol without a name");
        if (arity < 0) throw new IllegalArgumentException("Negative arity for " + name);
    }

    @Override
    public String toString() {
        return name + "\\" + arity;
    }
}
