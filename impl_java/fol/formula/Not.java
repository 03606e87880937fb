package fol.formula;

import fol.Substitution;
import fol.term.Variable;

import java.util.Map;
import java.util.Set;

public record Not(Formula formula) implements Formula {
    public Not {
        if (formula == null) throw new IllegalArgumentException("Negation of nothing");
    }

    /**
     * The formula without one leading negation, or its negation if it has none.
     */
    public static Formula negate(Formula formula) {
        return formula instanceof Not not ? not.formula() : new Not(formula);
    }

    @Override
    public Formula applySub(Substitution substitution) {
        return new Not(formula.applySub(substitution));
    }

    @Override
    public String toString() {
        return "¬" + formula;
    }

    @Override
    public Set<Variable> freeVars() {
        return formula.freeVars();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Not other && formula.equals(other.formula);
    }

    @Override
    public int hashCode() {
        return ("N:" + getEqString()).hashCode();
    }

    @Override
    public String getEqString(Map<Variable, String> bound) {
        return "¬" + formula.getEqString(bound);
    }
}
