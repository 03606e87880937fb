package proof.tableau;

import fol.formula.Formula;
import fol.formula.Not;

import java.util.List;
import java.util.Optional;

public interface TableauRule {

    /**
     * Expand a formula into the alternatives a branch containing it splits into. A non-branching rule always
     * returns a single alternative.
     *
     * @param formula the formula to expand
     * @return the alternatives, each a list of formulas added to the branch, or empty if the rule does not apply
     */
    Optional<List<List<Formula>>> expand(Formula formula);

    boolean isBranching();

    static Formula negation(Formula formula) {
        return Not.negate(formula);
    }
}
