package fol.formula;

import fol.Substitution;
import fol.term.Variable;

import java.util.List;
import java.util.Map;
import java.util.Set;

public record Or(Formula left, Formula right) implements Formula {
    @Override
    public Formula applySub(Substitution substitution) {
        return new Or(left.applySub(substitution), right.applySub(substitution));
    }

    @Override
    public String toString() {
        return "(" + left + " ∨ " + right + ")";
    }

    @Override
    public String getEqString(Map<Variable, String> bound) {
        return "(" + left.getEqString(bound) + " ∨ " + right.getEqString(bound) + ")";
    }

    @Override
    public int hashCode() {
        return getEqString().hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Or other)) return false;
        return left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public Set<Variable> freeVars() {
        Set<Variable> out = left.freeVars();
        out.addAll(right.freeVars());
        return out;
    }

    /**
     * Right-nested disjunction of the formulas, {@link Predicate#FALSE} when there are none.
     */
    public static Formula of(List<? extends Formula> formulas) {
        if (formulas.isEmpty()) return Predicate.FALSE;
        Formula out = formulas.get(formulas.size() - 1);
        for (int i = formulas.size() - 2; i >= 0; i--) {
            out = new Or(formulas.get(i), out);
        }
        return out;
    }
}
