package proof;

import fol.Substitution;
import fol.formula.Formula;
import fol.formula.PSymbol;
import fol.formula.Predicate;
import fol.term.Term;
import fol.term.Variable;

import java.util.List;

/**
 * A predicate symbol introduced as an abbreviation of its body.
 */
public final class PredicateDefinition {
    private final PSymbol symbol;
    private final List<Variable> params;
    private final Formula body;
    private final Theorem definition;

    PredicateDefinition(PSymbol symbol, List<Variable> params, Formula body, Theorem definition) {
        this.symbol = symbol;
        this.params = List.copyOf(params);
        this.body = body;
        this.definition = definition;
    }

    public PSymbol symbol() {
        return symbol;
    }

    public List<Variable> params() {
        return params;
    }

    public Formula body() {
        return body;
    }

    public Predicate of(Term... args) {
        return new Predicate(symbol, checkArity(args));
    }

    /**
     * {@code ⊢ P(params) ⇔ body}
     */
    public Theorem definition() {
        return definition;
    }

    /**
     * {@code ⊢ P(args) ⇔ body[args/params]}
     */
    public Theorem definition(Term... args) {
        return Rules.instantiate(definition, instantiation(args));
    }

    /**
     * The body with the parameters replaced by {@code args}.
     */
    public Formula unfold(Term... args) {
        return body.applySub(instantiation(args));
    }

    private Substitution instantiation(Term... args) {
        List<Term> checked = checkArity(args);
        Substitution sub = new Substitution();
        for (int i = 0; i < params.size(); i++) sub.put(params.get(i), checked.get(i));
        return sub;
    }

    private List<Term> checkArity(Term... args) {
        if (args.length != params.size()) {
            throw new MalformedRequestException("arguments",
                    String.format("%s expects %d arguments, got %d", symbol.name(), params.size(), args.length));
        }
        return List.of(args);
    }

    @Override
    public String toString() {
        return new Predicate(symbol, List.copyOf(params)) + " := " + body;
    }
}
