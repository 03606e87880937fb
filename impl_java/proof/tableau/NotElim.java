package proof.tableau;

import fol.formula.Formula;
import fol.formula.Not;

import java.util.List;
import java.util.Optional;

public class NotElim implements TableauRule {

    @Override
    public Optional<List<List<Formula>>> expand(Formula formula) {
        if (formula instanceof Not not && not.formula() instanceof Not inner) {
            // Double negation: ¬¬A → A
            return Optional.of(List.of(List.of(inner.formula())));
        }
        return Optional.empty();
    }

    @Override
    public boolean isBranching() {
        return false;
    }
}
