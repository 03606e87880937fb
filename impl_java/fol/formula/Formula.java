package fol.formula;

import fol.Substitution;
import fol.term.Variable;

import java.util.Map;
import java.util.Set;

public interface Formula {
    /**
     * Apply a substitution to the free variables of the formula, renaming binders that would capture a
     * variable of a substituted term.
     */
    Formula applySub(Substitution substitution);

    /**
     * Get a set of the current free variables inside the formula
     * @return a fresh, mutable set of free variables in the current formula
     */
    Set<Variable> freeVars();

    /**
     * Canonical text of the formula: bound variables are named after the depth of their binder, so two formulas
     * have the same canonical text iff they are alpha-equivalent.
     *
     * @param bound canonical names of the variables bound around this formula
     */
    String getEqString(Map<Variable, String> bound);

    default String getEqString() {
        return getEqString(Map.of());
    }
}
