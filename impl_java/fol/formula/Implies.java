package fol.formula;

import fol.Substitution;
import fol.term.Variable;

import java.util.Map;
import java.util.Set;

public record Implies(Formula left, Formula right) implements Formula {
    @Override
    public Formula applySub(Substitution substitution) {
        return new Implies(left.applySub(substitution), right.applySub(substitution));
    }

    @Override
    public String toString() {
        return "(" + left + " ⇒ " + right + ")";
    }

    @Override
    public String getEqString(Map<Variable, String> bound) {
        return "(" + left.getEqString(bound) + " ⇒ " + right.getEqString(bound) + ")";
    }

    @Override
    public int hashCode() {
        return getEqString().hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Implies other)) return false;
        return left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public Set<Variable> freeVars() {
        Set<Variable> out = left.freeVars();
        out.addAll(right.freeVars());
        return out;
    }
}
