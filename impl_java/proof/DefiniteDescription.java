package proof;

import fol.formula.ExistsOne;
import fol.formula.Formula;
import fol.term.Variable;

import java.util.Set;

/**
 * "The u such that f(u)", together with the theorem {@code Γ ⊢ ∃!u. f(u)} that makes it meaningful.
 */
public class DefiniteDescription {
    private final Variable boundVariable;
    private final Formula formula;
    private final Theorem justification;

    protected DefiniteDescription(Variable boundVariable, Formula formula, Theorem justification) {
        if (boundVariable == null) throw new MalformedRequestException("bound variable", "missing");
        if (formula == null) throw new MalformedRequestException("formula", "missing");
        if (justification == null) throw new MalformedRequestException("justification", "missing");
        Formula expected = new ExistsOne(boundVariable, formula);
        if (!justification.right().equals(Set.of(expected))) {
            throw new MalformedRequestException("justification",
                    String.format("%s does not prove %s", justification, expected));
        }
        this.boundVariable = boundVariable;
        this.formula = formula;
        this.justification = justification;
    }

    public static DefiniteDescription the(Variable boundVariable, Formula formula, Theorem justification) {
        return new DefiniteDescription(boundVariable, formula, justification);
    }

    public Variable boundVariable() {
        return boundVariable;
    }

    /**
     * The defining formula, in which {@link #boundVariable()} is free.
     */
    public Formula formula() {
        return formula;
    }

    public Theorem justification() {
        return justification;
    }

    public boolean isUnconditional() {
        return justification.left().isEmpty();
    }

    @Override
    public String toString() {
        return "The " + boundVariable + ". " + formula;
    }
}
