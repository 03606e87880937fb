package fol.formula;

import fol.term.Variable;

public class Forall extends Quantifier {

    public Forall(Variable var, Formula formula) {
        super(var, formula);
    }

    @Override
    protected String quantifierSymbol() {
        return "∀";
    }

    @Override
    protected Quantifier rebuild(Variable var, Formula formula) {
        return new Forall(var, formula);
    }
}
