package fol.formula;

import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * A formula binding one variable in its body.
 */
public abstract class Quantifier implements Formula {

    private final Variable var;
    private final Formula formula;

    protected Quantifier(Variable var, Formula formula) {
        if (var == null || formula == null) {
            throw new IllegalArgumentException("Quantifier needs a variable and a body");
        }
        this.var = var;
        this.formula = formula;
    }

    public Variable var() {
        return var;
    }

    public Formula formula() {
        return formula;
    }

    protected abstract String quantifierSymbol();

    protected abstract Quantifier rebuild(Variable var, Formula formula);

    @Override
    public Formula applySub(Substitution substitution) {
        var scope = substitution.enterBinder(var, formula.freeVars());
        if (scope.body().isEmpty() && scope.var().equals(var)) return this;
        return rebuild(scope.var(), formula.applySub(scope.body()));
    }

    /**
     * The body with the bound variable replaced by {@code t}.
     */
    public Formula apply(Term t) {
        return formula.applySub(Substitution.of(var, t));
    }

    @Override
    public Set<Variable> freeVars() {
        Set<Variable> out = formula.freeVars();
        out.remove(var);
        return out;
    }

    @Override
    public String toString() {
        return quantifierSymbol() + var + ". " + formula;
    }

    @Override
    public String getEqString(Map<Variable, String> bound) {
        int depth = bound.values().stream()
                .filter(name -> name.startsWith("#"))
                .mapToInt(name -> Integer.parseInt(name.substring(1)) + 1)
                .max()
                .orElse(0);
        String canonical = "#" + depth;
        Map<Variable, String> inner = new HashMap<>(bound);
        inner.put(var, canonical);
        return quantifierSymbol() + canonical + ". " + formula.getEqString(inner);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != getClass()) return false;
        return getEqString().equals(((Quantifier) obj).getEqString());
    }

    @Override
    public int hashCode() {
        return getEqString().hashCode();
    }
}
