package fol.term;

import fol.Substitution;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

public record Constant(String name) implements Term {
    public Constant {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Constant without a name");
        // '#' and '?' prefix the canonical names of bound and free variables
        if (name.startsWith("#") || name.startsWith("?")) {
            throw new IllegalArgumentException("Constant names starting with '#' or '?' are reserved: " + name);
        }
    }

    @Override
    public Term applySub(Substitution substitution) {
        return this;
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public Set<Variable> vars() {
        return new HashSet<>();
    }

    @Override
    public String getEqString(Map<Variable, String> bound) {
        return name;
    }
}
