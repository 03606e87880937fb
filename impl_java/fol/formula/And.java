package fol.formula;

import fol.Substitution;
import fol.term.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record And(Formula left, Formula right) implements Formula {
    @Override
    public Formula applySub(Substitution substitution) {
        return new And(left.applySub(substitution), right.applySub(substitution));
    }

    @Override
    public String toString() {
        return "(" + left + " ∧ " + right + ")";
    }

    @Override
    public String getEqString(Map<Variable, String> bound) {
        return "(" + left.getEqString(bound) + " ∧ " + right.getEqString(bound) + ")";
    }

    @Override
    public int hashCode() {
        return getEqString().hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof And other)) return false;
        return left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public Set<Variable> freeVars() {
        Set<Variable> out = left.freeVars();
        out.addAll(right.freeVars());
        return out;
    }

    /**
     * Right-nested conjunction of the formulas, {@link Predicate#TRUE} when there are none.
     */
    public static Formula of(List<? extends Formula> formulas) {
        if (formulas.isEmpty()) return Predicate.TRUE;
        Formula out = formulas.get(formulas.size() - 1);
        for (int i = formulas.size() - 2; i >= 0; i--) {
            out = new And(formulas.get(i), out);
        }
        return out;
    }

    public static Formula of(Formula... formulas) {
        return of(List.of(formulas));
    }

    /**
     * The conjuncts of a (possibly nested) conjunction, left to right.
     */
    public static List<Formula> conjuncts(Formula formula) {
        List<Formula> out = new ArrayList<>();
        collect(formula, out);
        return out;
    }

    private static void collect(Formula formula, List<Formula> out) {
        if (formula instanceof And and) {
            collect(and.left, out);
            collect(and.right, out);
        } else {
            out.add(formula);
        }
    }
}
