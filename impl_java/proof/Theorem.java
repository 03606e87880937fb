package proof;

import fol.Substitution;
import fol.formula.Formula;
import fol.term.Term;
import fol.term.Variable;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A verified sequent. Only the kernel ({@link Rules}, {@link Axioms}, {@link Definitions}) creates theorems;
 * once created they are immutable and can be cited any number of times.
 */
public final class Theorem {
    private final Sequent sequent;
    private final String rule;
    private final List<Theorem> premises;

    Theorem(Sequent sequent, String rule, List<Theorem> premises) {
        this.sequent = sequent;
        this.rule = rule;
        this.premises = List.copyOf(premises);
    }

    public Sequent sequent() {
        return sequent;
    }

    public Set<Formula> left() {
        return sequent.left();
    }

    public Set<Formula> right() {
        return sequent.right();
    }

    /**
     * The single conclusion of the theorem.
     *
     * @throws IllegalStateException if the theorem does not have exactly one conclusion
     */
    public Formula conclusion() {
        if (sequent.right().size() != 1) {
            throw new IllegalStateException("Theorem has " + sequent.right().size() + " conclusions: " + sequent);
        }
        return sequent.right().iterator().next();
    }

    /**
     * Name of the rule that produced this theorem.
     */
    public String rule() {
        return rule;
    }

    public List<Theorem> premises() {
        return premises;
    }

    /**
     * Instance of this theorem for the given values of its free variables.
     */
    public Theorem of(Map<Variable, ? extends Term> instantiation) {
        return Rules.instantiate(this, Substitution.of(instantiation));
    }

    /**
     * Number of distinct steps in the derivation of this theorem, itself included.
     */
    public int derivationSize() {
        Set<Theorem> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        countSteps(this, seen);
        return seen.size();
    }

    private static void countSteps(Theorem theorem, Set<Theorem> seen) {
        if (!seen.add(theorem)) return;
        for (Theorem premise : theorem.premises) countSteps(premise, seen);
    }

    @Override
    public String toString() {
        return sequent.toString();
    }
}
