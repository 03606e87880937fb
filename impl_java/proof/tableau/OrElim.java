package proof.tableau;

import fol.formula.And;
import fol.formula.Formula;
import fol.formula.Implies;
import fol.formula.Not;
import fol.formula.Or;

import java.util.List;
import java.util.Optional;

import static proof.tableau.TableauRule.negation;

/**
 * Disjunctive formulas: {@code a ∨ b}, {@code ¬(a ∧ b)} and {@code a ⇒ b}.
 */
public class OrElim implements TableauRule {

    @Override
    public Optional<List<List<Formula>>> expand(Formula formula) {
        if (formula instanceof Or or) {
            return Optional.of(List.of(List.of(or.left()), List.of(or.right())));
        }
        if (formula instanceof Not not && not.formula() instanceof And and) {
            return Optional.of(List.of(List.of(negation(and.left())), List.of(negation(and.right()))));
        }
        if (formula instanceof Implies implies) {
            return Optional.of(List.of(List.of(negation(implies.left())), List.of(implies.right())));
        }
        return Optional.empty();
    }

    @Override
    public boolean isBranching() {
        return true;
    }
}
