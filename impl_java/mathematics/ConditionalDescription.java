package mathematics;

import fol.formula.Formula;
import fol.term.Term;
import fol.term.Variable;
import proof.DefiniteDescription;
import proof.Theorem;

/**
 * A description whose defining formula is {@code (prem ⇒ f(u)) ∧ (¬prem ⇒ u = default)}, justified without
 * assumptions. Built by {@link ConditionalDescriptions#theConditional}.
 */
public final class ConditionalDescription extends DefiniteDescription {
    private final Formula partialFormula;
    private final Formula premise;
    private final Term defaultValue;
    private final Theorem agreement;

    ConditionalDescription(Variable boundVariable, Formula completeDefinition, Theorem justification,
                           Formula partialFormula, Formula premise, Term defaultValue, Theorem agreement) {
        super(boundVariable, completeDefinition, justification);
        this.partialFormula = partialFormula;
        this.premise = premise;
        this.defaultValue = defaultValue;
        this.agreement = agreement;
    }

    /**
     * The formula {@code f} the description was requested for.
     */
    public Formula partialFormula() {
        return partialFormula;
    }

    /**
     * The normalized assumptions under which {@code f} has a unique solution.
     */
    public Formula premise() {
        return premise;
    }

    public Term defaultValue() {
        return defaultValue;
    }

    /**
     * {@code prem ⊢ ∀u. f(u) ⇔ completeDef(u)}: where the premise holds, the description denotes the same value
     * as a direct description of {@code f}.
     */
    public Theorem agreement() {
        return agreement;
    }
}
