package semantics;

import fol.formula.And;
import fol.formula.Equals;
import fol.formula.Exists;
import fol.formula.ExistsOne;
import fol.formula.Forall;
import fol.formula.Formula;
import fol.formula.Iff;
import fol.formula.Implies;
import fol.formula.Not;
import fol.formula.Or;
import fol.formula.PSymbol;
import fol.formula.Predicate;
import fol.term.Constant;
import fol.term.FSymbol;
import fol.term.Function;
import fol.term.Term;
import fol.term.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import proof.FunctionDefinition;
import proof.PredicateDefinition;
import proof.Sequent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A finite interpretation of the language. Quantifiers range over the universe; terms may denote values outside
 * of it (sets of elements, operation graphs) when they are given by the valuation or computed by an operation.
 * <p>
 * Defined symbols are interpreted through their definitions: a predicate by its body, a function by the unique
 * element of the universe satisfying its description. Both are cached per argument list, so a structure is meant
 * to be used from one thread.
 */
public final class Structure {
    private static final Logger LOGGER = LoggerFactory.getLogger(Structure.class);

    @FunctionalInterface
    public interface Relation {
        boolean holds(List<Object> args);
    }

    @FunctionalInterface
    public interface Operation {
        Object apply(List<Object> args);
    }

    private final Set<Object> universe;
    private final Map<PSymbol, Relation> relations;
    private final Map<FSymbol, Operation> operations;
    private final Map<String, Object> constants;
    private final Map<PSymbol, PredicateDefinition> predicateDefinitions;
    private final Map<FSymbol, FunctionDefinition> functionDefinitions;
    private final Map<List<Object>, Object> cache = new HashMap<>();

    private Structure(Builder builder) {
        this.universe = Collections.unmodifiableSet(new LinkedHashSet<>(builder.universe));
        this.relations = Map.copyOf(builder.relations);
        this.operations = Map.copyOf(builder.operations);
        this.constants = Map.copyOf(builder.constants);
        this.predicateDefinitions = Map.copyOf(builder.predicateDefinitions);
        this.functionDefinitions = Map.copyOf(builder.functionDefinitions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<Object> universe() {
        return universe;
    }

    public Object evaluate(Term term, Map<Variable, ?> valuation) {
        if (term instanceof Variable variable) {
            if (!valuation.containsKey(variable)) {
                throw new EvaluationException("Unbound variable " + variable);
            }
            return valuation.get(variable);
        }
        if (term instanceof Constant constant) {
            Object value = constants.get(constant.name());
            if (value == null) {
                throw new EvaluationException("Uninterpreted constant " + constant);
            }
            return value;
        }
        Function function = (Function) term;
        List<Object> args = new ArrayList<>();
        for (Term arg : function.args()) {
            args.add(evaluate(arg, valuation));
        }
        FunctionDefinition definition = functionDefinitions.get(function.symbol());
        if (definition != null) {
            return describe(definition, args);
        }
        Operation operation = operations.get(function.symbol());
        if (operation == null) {
            throw new EvaluationException("Uninterpreted function " + function.symbol());
        }
        return operation.apply(args);
    }

    public boolean satisfies(Formula formula, Map<Variable, ?> valuation) {
        if (formula instanceof Equals eq) {
            return Objects.equals(evaluate(eq.left(), valuation), evaluate(eq.right(), valuation));
        }
        if (formula instanceof Predicate predicate) {
            return holds(predicate, valuation);
        }
        if (formula instanceof Not not) {
            return !satisfies(not.formula(), valuation);
        }
        if (formula instanceof And and) {
            return satisfies(and.left(), valuation) && satisfies(and.right(), valuation);
        }
        if (formula instanceof Or or) {
            return satisfies(or.left(), valuation) || satisfies(or.right(), valuation);
        }
        if (formula instanceof Implies implies) {
            return !satisfies(implies.left(), valuation) || satisfies(implies.right(), valuation);
        }
        if (formula instanceof Iff iff) {
            return satisfies(iff.left(), valuation) == satisfies(iff.right(), valuation);
        }
        if (formula instanceof Forall forall) {
            return countWitnesses(forall.var(), new Not(forall.formula()), valuation, 1) == 0;
        }
        if (formula instanceof ExistsOne existsOne) {
            return countWitnesses(existsOne.var(), existsOne.formula(), valuation, 2) == 1;
        }
        if (formula instanceof Exists exists) {
            return countWitnesses(exists.var(), exists.formula(), valuation, 1) == 1;
        }
        throw new EvaluationException("Cannot evaluate " + formula);
    }

    /**
     * Whether the sequent holds under the valuation: some assumption fails or some conclusion holds.
     */
    public boolean satisfies(Sequent sequent, Map<Variable, ?> valuation) {
        for (Formula assumption : sequent.left()) {
            if (!satisfies(assumption, valuation)) return true;
        }
        for (Formula conclusion : sequent.right()) {
            if (satisfies(conclusion, valuation)) return true;
        }
        return false;
    }

    /**
     * Number of universe elements satisfying {@code body} as values of {@code var}, counting stops at
     * {@code limit}.
     */
    private int countWitnesses(Variable var, Formula body, Map<Variable, ?> valuation, int limit) {
        Map<Variable, Object> extended = new HashMap<>(valuation);
        int count = 0;
        for (Object element : universe) {
            extended.put(var, element);
            if (satisfies(body, extended) && ++count >= limit) break;
        }
        return count;
    }

    private boolean holds(Predicate predicate, Map<Variable, ?> valuation) {
        if (predicate.equals(Predicate.TRUE)) return true;
        List<Object> args = new ArrayList<>();
        for (Term arg : predicate.args()) {
            args.add(evaluate(arg, valuation));
        }
        PredicateDefinition definition = predicateDefinitions.get(predicate.symbol());
        if (definition != null) {
            List<Object> key = key(definition.symbol(), args);
            Object cached = cache.get(key);
            if (cached == null) {
                cached = satisfies(definition.body(), bind(definition.params(), args));
                cache.put(key, cached);
            }
            return (Boolean) cached;
        }
        Relation relation = relations.get(predicate.symbol());
        if (relation == null) {
            throw new EvaluationException("Uninterpreted predicate " + predicate.symbol());
        }
        return relation.holds(args);
    }

    private Object describe(FunctionDefinition definition, List<Object> args) {
        List<Object> key = key(definition.symbol(), args);
        Object cached = cache.get(key);
        if (cached != null) return cached;

        Map<Variable, Object> valuation = bind(definition.params(), args);
        Variable u = definition.description().boundVariable();
        Formula formula = definition.description().formula();
        List<Object> values = new ArrayList<>();
        for (Object element : universe) {
            valuation.put(u, element);
            if (satisfies(formula, valuation)) values.add(element);
        }
        if (values.size() != 1) {
            throw new EvaluationException(String.format("%s%s is satisfied by %d elements of the universe",
                    definition.symbol().name(), args, values.size()));
        }
        LOGGER.trace("{}{} = {}", definition.symbol().name(), args, values.get(0));
        cache.put(key, values.get(0));
        return values.get(0);
    }

    private static Map<Variable, Object> bind(List<Variable> params, List<Object> args) {
        Map<Variable, Object> valuation = new HashMap<>();
        for (int i = 0; i < params.size(); i++) valuation.put(params.get(i), args.get(i));
        return valuation;
    }

    private static List<Object> key(Object symbol, List<Object> args) {
        List<Object> key = new ArrayList<>(args.size() + 1);
        key.add(symbol);
        key.addAll(args);
        return key;
    }

    public static final class Builder {
        private final Set<Object> universe = new LinkedHashSet<>();
        private final Map<PSymbol, Relation> relations = new HashMap<>();
        private final Map<FSymbol, Operation> operations = new HashMap<>();
        private final Map<String, Object> constants = new HashMap<>();
        private final Map<PSymbol, PredicateDefinition> predicateDefinitions = new HashMap<>();
        private final Map<FSymbol, FunctionDefinition> functionDefinitions = new HashMap<>();

        private Builder() {
        }

        public Builder element(Object element) {
            universe.add(Objects.requireNonNull(element));
            return this;
        }

        public Builder elements(Collection<?> elements) {
            elements.forEach(this::element);
            return this;
        }

        public Builder relation(PSymbol symbol, Relation relation) {
            relations.put(symbol, relation);
            return this;
        }

        public Builder operation(FSymbol symbol, Operation operation) {
            operations.put(symbol, operation);
            return this;
        }

        public Builder constant(Constant constant, Object value) {
            constants.put(constant.name(), Objects.requireNonNull(value));
            return this;
        }

        public Builder define(PredicateDefinition definition) {
            predicateDefinitions.put(definition.symbol(), definition);
            return this;
        }

        public Builder define(FunctionDefinition definition) {
            functionDefinitions.put(definition.symbol(), definition);
            return this;
        }

        public Builder defineAll(Collection<PredicateDefinition> predicates, Collection<FunctionDefinition> functions) {
            predicates.forEach(this::define);
            functions.forEach(this::define);
            return this;
        }

        public Structure build() {
            return new Structure(this);
        }
    }
}
