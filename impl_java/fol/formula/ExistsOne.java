package fol.formula;

import fol.term.Variable;

public class ExistsOne extends Quantifier {

    public ExistsOne(Variable var, Formula formula) {
        super(var, formula);
    }

    @Override
    protected String quantifierSymbol() {
        return "∃!";
    }

    @Override
    protected Quantifier rebuild(Variable var, Formula formula) {
        return new ExistsOne(var, formula);
    }
}
