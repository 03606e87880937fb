package proof.tableau;

import fol.formula.Formula;
import fol.formula.Iff;
import fol.formula.Not;

import java.util.List;
import java.util.Optional;

import static proof.tableau.TableauRule.negation;

public class IffElim implements TableauRule {

    @Override
    public Optional<List<List<Formula>>> expand(Formula formula) {
        if (formula instanceof Iff iff) {
            return Optional.of(List.of(
                    List.of(iff.left(), iff.right()),
                    List.of(negation(iff.left()), negation(iff.right()))));
        }
        if (formula instanceof Not not && not.formula() instanceof Iff iff) {
            return Optional.of(List.of(
                    List.of(iff.left(), negation(iff.right())),
                    List.of(negation(iff.left()), iff.right())));
        }
        return Optional.empty();
    }

    @Override
    public boolean isBranching() {
        return true;
    }
}
