package fol.term;

import fol.Substitution;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

public record Variable(String name) implements Term {

    public Variable {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Variable name must not be empty");
        }
        if (name.startsWith("#")) {
            throw new IllegalArgumentException("Variable names starting with '#' are reserved: " + name);
        }
    }

    /**
     * Primed variant of this variable that does not occur in {@code avoid}.
     */
    public Variable freshVariant(Set<Variable> avoid) {
        Variable candidate = this;
        while (avoid.contains(candidate)) {
            candidate = new Variable(candidate.name + "'");
        }
        return candidate;
    }

    @Override
    public Term applySub(Substitution substitution) {
        return substitution.getOrDefault(this, this);
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public Set<Variable> vars() {
        return new HashSet<>(Set.of(this));
    }

    /**
     * Bound variables print as their canonical {@code #n}, free ones as {@code ?name} so they never read like a
     * constant.
     */
    @Override
    public String getEqString(Map<Variable, String> bound) {
        return bound.getOrDefault(this, "?" + name);
    }

    @Override
    public int hashCode() {
        return ("V:" + this).hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Variable other)) return false;
        return name.equals(other.name);
    }
}
