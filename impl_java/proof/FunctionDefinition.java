package proof;

import fol.Substitution;
import fol.term.FSymbol;
import fol.term.Function;
import fol.term.Term;
import fol.term.Variable;

import java.util.List;

/**
 * A function symbol introduced by a definite description justified without assumptions.
 */
public final class FunctionDefinition {
    private final FSymbol symbol;
    private final List<Variable> params;
    private final DefiniteDescription description;
    private final Theorem definition;

    FunctionDefinition(FSymbol symbol, List<Variable> params, DefiniteDescription description, Theorem definition) {
        this.symbol = symbol;
        this.params = List.copyOf(params);
        this.description = description;
        this.definition = definition;
    }

    public FSymbol symbol() {
        return symbol;
    }

    public List<Variable> params() {
        return params;
    }

    public DefiniteDescription description() {
        return description;
    }

    public Function of(Term... args) {
        if (args.length != params.size()) {
            throw new MalformedRequestException("arguments",
                    String.format("%s expects %d arguments, got %d", symbol.name(), params.size(), args.length));
        }
        return new Function(symbol, List.of(args));
    }

    /**
     * {@code ⊢ ∀u. (u = f(params)) ⇔ def(u)}
     */
    public Theorem definition() {
        return definition;
    }

    /**
     * {@code ⊢ ∀u. (u = f(args)) ⇔ def(u)[args/params]}
     */
    public Theorem definition(Term... args) {
        of(args);
        Substitution sub = new Substitution();
        for (int i = 0; i < params.size(); i++) sub.put(params.get(i), args[i]);
        return Rules.instantiate(definition, sub);
    }

    @Override
    public String toString() {
        return new Function(symbol, List.copyOf(params)) + " := " + description;
    }
}
