package fol.formula;

import fol.term.Variable;

public class Exists extends Quantifier {

    public Exists(Variable var, Formula formula) {
        super(var, formula);
    }

    @Override
    protected String quantifierSymbol() {
        return "∃";
    }

    @Override
    protected Quantifier rebuild(Variable var, Formula formula) {
        return new Exists(var, formula);
    }
}
