package proof;

import fol.formula.And;
import fol.formula.Equals;
import fol.formula.Formula;
import fol.formula.Iff;
import fol.formula.Implies;
import fol.formula.Not;
import fol.formula.Or;
import fol.formula.PSymbol;
import fol.formula.Predicate;
import fol.formula.Quantifier;
import fol.term.Constant;
import fol.term.FSymbol;
import fol.term.Function;
import fol.term.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The symbols known to the kernel, by name. Primitive symbols are declared by the theory that axiomatizes them;
 * defined symbols are registered by {@link Definitions}. A name is taken once: a primitive may be declared again with
 * the same arity, a defined symbol never.
 */
public final class Signature {
    private static final Logger LOGGER = LoggerFactory.getLogger(Signature.class);

    private record Entry(Object symbol, boolean defined) {}

    private static final Map<String, Entry> SYMBOLS = new ConcurrentHashMap<>();

    static {
        SYMBOLS.put(Equals.EQ_PRED_SYM.name(), new Entry(Equals.EQ_PRED_SYM, false));
        SYMBOLS.put("true", new Entry(((Predicate) Predicate.TRUE).symbol(), false));
    }

    private Signature() {
    }

    public static PSymbol declare(PSymbol symbol) {
        declare(symbol.name(), symbol);
        return symbol;
    }

    public static FSymbol declare(FSymbol symbol) {
        declare(symbol.name(), symbol);
        return symbol;
    }

    public static Constant declare(Constant constant) {
        declare(constant.name(), constant);
        return constant;
    }

    private static synchronized void declare(String name, Object symbol) {
        Entry existing = SYMBOLS.get(name);
        if (existing == null) {
            SYMBOLS.put(name, new Entry(symbol, false));
            LOGGER.debug("Declared {}", symbol);
        } else if (existing.defined() || !existing.symbol().equals(symbol)) {
            throw new MalformedRequestException("name", String.format("%s is already %s as %s", name,
                    existing.defined() ? "defined" : "declared", existing.symbol()));
        }
    }

    /**
     * Take {@code name} for a new defined symbol.
     */
    static synchronized void define(String name, Object symbol) {
        Entry existing = SYMBOLS.get(name);
        if (existing != null) {
            throw new MalformedRequestException("name", String.format("%s is already %s as %s", name,
                    existing.defined() ? "defined" : "declared", existing.symbol()));
        }
        SYMBOLS.put(name, new Entry(symbol, true));
    }

    public static boolean isKnown(Object symbol) {
        String name;
        if (symbol instanceof PSymbol p) name = p.name();
        else if (symbol instanceof FSymbol fs) name = fs.name();
        else if (symbol instanceof Constant c) name = c.name();
        else return false;
        Entry entry = SYMBOLS.get(name);
        return entry != null && entry.symbol().equals(symbol);
    }

    /**
     * The first symbol of {@code formula} that is neither declared nor defined, if any.
     */
    public static Optional<Object> unknownSymbol(Formula formula) {
        if (formula instanceof Predicate predicate) {
            if (!isKnown(predicate.symbol())) return Optional.of(predicate.symbol());
            for (Term arg : predicate.args()) {
                Optional<Object> unknown = unknownSymbol(arg);
                if (unknown.isPresent()) return unknown;
            }
            return Optional.empty();
        }
        if (formula instanceof Not not) return unknownSymbol(not.formula());
        if (formula instanceof And and) return unknownSymbol(and.left(), and.right());
        if (formula instanceof Or or) return unknownSymbol(or.left(), or.right());
        if (formula instanceof Implies implies) return unknownSymbol(implies.left(), implies.right());
        if (formula instanceof Iff iff) return unknownSymbol(iff.left(), iff.right());
        if (formula instanceof Quantifier quantifier) return unknownSymbol(quantifier.formula());
        throw new IllegalArgumentException("Unexpected formula " + formula);
    }

    private static Optional<Object> unknownSymbol(Formula left, Formula right) {
        Optional<Object> unknown = unknownSymbol(left);
        return unknown.isPresent() ? unknown : unknownSymbol(right);
    }

    private static Optional<Object> unknownSymbol(Term term) {
        if (term instanceof Constant constant) {
            return isKnown(constant) ? Optional.empty() : Optional.of(constant);
        }
        if (term instanceof Function function) {
            if (!isKnown(function.symbol())) return Optional.of(function.symbol());
            for (Term arg : function.args()) {
                Optional<Object> unknown = unknownSymbol(arg);
                if (unknown.isPresent()) return unknown;
            }
        }
        return Optional.empty();
    }
}
