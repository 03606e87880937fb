package fol.term;

import fol.Substitution;

import java.util.Map;
import java.util.Set;

public sealed interface Term permits Constant, Function, Variable {
    Term applySub(Substitution substitution);

    /**
     * Get the set of variables occurring in the term. Terms have no binders, so all of them are free.
     *
     * @return a fresh, mutable set of variables
     */
    Set<Variable> vars();

    /**
     * Text of the term where variables bound by an enclosing quantifier are replaced by their canonical names.
     *
     * @param bound canonical names of the variables bound around this term
     * @return the canonical text
     */
    String getEqString(Map<Variable, String> bound);

    default String getEqString() {
        return getEqString(Map.of());
    }
}
