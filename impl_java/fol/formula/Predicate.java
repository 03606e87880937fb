package fol.formula;

import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class Predicate implements Formula {

    private final PSymbol symbol;
    private final List<Term> args;

    public Predicate(PSymbol symbol, List<Term> args) {
        if (symbol.arity() != args.size()) {
            throw new IllegalArgumentException(String.format("%s applied to %d arguments", symbol, args.size()));
        }
        this.symbol = symbol;
        this.args = List.copyOf(args);
    }

    public Predicate(PSymbol symbol, Term... args) {
        this(symbol, List.of(args));
    }

    public PSymbol symbol() {
        return symbol;
    }

    public List<Term> args() {
        return args;
    }

    public static final Formula TRUE = new Predicate(new PSymbol("true", 0), List.of());
    public static final Formula FALSE = new Not(TRUE);

    @Override
    public Formula applySub(Substitution substitution) {
        List<Term> newArgs = args.stream().map(t -> t.applySub(substitution)).toList();
        return new Predicate(symbol, newArgs);
    }

    @Override
    public String toString() {
        if (args.isEmpty()) {
            return symbol.name();
        }
        return symbol.name() + "(" + String.join(", ", args.stream().map(Object::toString).toArray(String[]::new)) + ")";
    }

    @Override
    public Set<Variable> freeVars() {
        return args.stream()
                .map(Term::vars)
                .reduce(new HashSet<>(), (set1, set2) -> {
                    set1.addAll(set2);
                    return set1;
                });
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Predicate)) return false;
        return getEqString().equals(((Predicate) obj).getEqString());
    }

    @Override
    public int hashCode() {
        return getEqString().hashCode();
    }

    @Override
    public String getEqString(Map<Variable, String> bound) {
        if (args.isEmpty()) {
            return symbol.name();
        }
        return symbol.name() + "(" + String.join(", ", args.stream().map(t -> t.getEqString(bound)).toArray(String[]::new)) + ")";
    }
}
