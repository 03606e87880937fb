package proof;

import fol.formula.Equals;
import fol.formula.Formula;
import fol.formula.Implies;
import fol.term.Term;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Derived steps, built only from {@link Rules}.
 */
public final class Tactics {

    private Tactics() {
    }

    /**
     * The same statement in a propositionally equivalent (or weaker) form.
     */
    public static Theorem restate(Theorem premise, Sequent goal) {
        return Rules.tautology(goal, premise);
    }

    /**
     * From {@code Γ ⊢ a ⇒ b} conclude {@code Γ, a ⊢ b}.
     */
    public static Theorem assumeAntecedent(Theorem premise) {
        if (premise.right().size() != 1 || !(premise.conclusion() instanceof Implies implies)) {
            throw new StepRejectedException("AssumeAntecedent", "expected a single implication in " + premise);
        }
        Set<Formula> left = new LinkedHashSet<>(premise.left());
        left.add(implies.left());
        return restate(premise, new Sequent(left, Set.of(implies.right())));
    }

    /**
     * From {@code Γ ⊢ ∀x. (a(x) ⇒ b(x))} conclude {@code Γ, a(t) ⊢ b(t)}.
     */
    public static Theorem instantiateGuarded(Theorem premise, Term term) {
        return assumeAntecedent(Rules.instantiateForall(premise, term));
    }

    /**
     * {@code Γ ⊢ t0 = tn} from facts that give each link {@code ti = ti+1} propositionally under {@code Γ}.
     */
    public static Theorem chainEqualities(Collection<? extends Formula> assumptions, List<? extends Term> terms,
                                          Theorem... facts) {
        if (terms.size() < 2) {
            throw new StepRejectedException("ChainEqualities", "a chain needs at least two terms, got " + terms);
        }
        Term first = terms.get(0);
        Theorem chained = restate(facts, assumptions, new Equals(first, terms.get(1)));
        for (int i = 1; i + 1 < terms.size(); i++) {
            Theorem link = restate(facts, assumptions, new Equals(terms.get(i), terms.get(i + 1)));
            chained = Rules.cut(Rules.rightAnd(chained, link),
                    Rules.equalityTransitivity(first, terms.get(i), terms.get(i + 1)));
        }
        return chained;
    }

    private static Theorem restate(Theorem[] facts, Collection<? extends Formula> assumptions, Formula conclusion) {
        return Rules.tautology(Sequent.assuming(assumptions).proves(conclusion), facts);
    }
}
