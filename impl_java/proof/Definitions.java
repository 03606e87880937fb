package proof;

import fol.formula.Equals;
import fol.formula.Forall;
import fol.formula.Formula;
import fol.formula.Iff;
import fol.formula.PSymbol;
import fol.formula.Predicate;
import fol.term.FSymbol;
import fol.term.Function;
import fol.term.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Conservative extensions of the language: new symbols together with their defining theorem. A definition may only
 * use symbols already in the {@link Signature}, and its name must be fresh there.
 */
public final class Definitions {
    private static final Logger LOGGER = LoggerFactory.getLogger(Definitions.class);

    private Definitions() {
    }

    public static PredicateDefinition predicate(String name, List<Variable> params, Formula body) {
        checkParams(name, params);
        Set<Variable> free = body.freeVars();
        free.removeAll(params);
        if (!free.isEmpty()) {
            throw new MalformedRequestException("body", String.format("free variables %s of %s are not parameters", free, name));
        }
        Signature.unknownSymbol(body).ifPresent(unknown -> {
            throw new MalformedRequestException("body", String.format("%s uses the unknown symbol %s", name, unknown));
        });
        PSymbol symbol = new PSymbol(name, params.size());
        Signature.define(name, symbol);
        Predicate head = new Predicate(symbol, List.copyOf(params));
        Theorem definition = new Theorem(Sequent.proving(new Iff(head, body)), "Definition " + name, List.of());
        LOGGER.debug("Defined {} := {}", head, body);
        return new PredicateDefinition(symbol, params, body, definition);
    }

    /**
     * Introduce {@code name(params)} as the value denoted by the description. The description must be justified
     * without assumptions, so the new symbol is total.
     */
    public static FunctionDefinition function(String name, List<Variable> params, DefiniteDescription description) {
        checkParams(name, params);
        if (!description.isUnconditional()) {
            throw new MalformedRequestException("description", String.format(
                    "%s is only justified under %s, use a conditional description", name, description.justification().left()));
        }
        Variable u = description.boundVariable();
        if (params.contains(u)) {
            throw new MalformedRequestException("bound variable", String.format("%s is also a parameter of %s", u, name));
        }
        Set<Variable> free = description.formula().freeVars();
        free.remove(u);
        free.removeAll(params);
        if (!free.isEmpty()) {
            throw new MalformedRequestException("description", String.format("free variables %s of %s are not parameters", free, name));
        }
        Signature.unknownSymbol(description.formula()).ifPresent(unknown -> {
            throw new MalformedRequestException("description", String.format("%s uses the unknown symbol %s", name, unknown));
        });
        FSymbol symbol = new FSymbol(name, params.size());
        Signature.define(name, symbol);
        Function head = new Function(symbol, List.copyOf(params));
        Theorem definition = new Theorem(Sequent.proving(new Forall(u, new Iff(new Equals(u, head), description.formula()))),
                "Definition " + name, List.of(description.justification()));
        LOGGER.debug("Defined {} := {}", head, description);
        return new FunctionDefinition(symbol, params, description, definition);
    }

    private static void checkParams(String name, List<Variable> params) {
        if (name == null || name.isEmpty()) {
            throw new MalformedRequestException("name", "missing");
        }
        if (new HashSet<>(params).size() != params.size()) {
            throw new MalformedRequestException("parameters", String.format("%s has repeated parameters %s", name, params));
        }
    }
}
