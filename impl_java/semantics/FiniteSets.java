package semantics;

import proof.FunctionDefinition;
import proof.PredicateDefinition;
import settheory.SetTheory;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BinaryOperator;

/**
 * Hereditarily finite reading of the set-theory vocabulary: sets are immutable {@link Set}s, pairs are
 * {@link OrderedPair}s and a function is the set of its {@code pair(argument, value)} edges. Anything else is an
 * urelement with no members.
 */
public final class FiniteSets {
    public static final Set<Object> EMPTY = Set.of();

    private FiniteSets() {
    }

    /**
     * The set-theory signature over {@code elements} and the empty set, with {@code app} interpreted through its
     * definition.
     */
    public static Structure.Builder signature(Collection<?> elements) {
        return Structure.builder()
                .elements(elements)
                .element(EMPTY)
                .constant(SetTheory.emptySet, EMPTY)
                .relation(SetTheory.inPSym, args -> members(args.get(1)).contains(args.get(0)))
                .relation(SetTheory.subsetPSym, args -> isSet(args.get(0)) && isSet(args.get(1))
                        && members(args.get(1)).containsAll(members(args.get(0))))
                .relation(SetTheory.functionalPSym, args -> isFunctional(args.get(0)))
                .relation(SetTheory.functionFromPSym, args -> isFunctionFrom(args.get(0), args.get(1), args.get(2)))
                .operation(SetTheory.pairFSym, args -> new OrderedPair(args.get(0), args.get(1)))
                .operation(SetTheory.cartesianProductFSym, args -> cartesianProduct(members(args.get(0)), members(args.get(1))))
                .operation(SetTheory.relationDomainFSym, args -> relationDomain(args.get(0)))
                .operation(SetTheory.restrictedFunctionFSym, args -> restrictedFunction(args.get(0), members(args.get(1))))
                .define(SetTheory.application);
    }

    /**
     * {@link #signature(Collection)} with the given definitions.
     */
    public static Structure structure(Collection<?> elements, List<PredicateDefinition> predicates,
                                      List<FunctionDefinition> functions) {
        return signature(elements).defineAll(predicates, functions).build();
    }

    /**
     * The graph {@code {((a, b), a·b)}} of a binary operation on {@code carrier}.
     */
    public static <T> Set<Object> operationGraph(Collection<T> carrier, BinaryOperator<T> law) {
        Set<Object> graph = new LinkedHashSet<>();
        for (T a : carrier) {
            for (T b : carrier) {
                graph.add(new OrderedPair(new OrderedPair(a, b), law.apply(a, b)));
            }
        }
        return Set.copyOf(graph);
    }

    public static Set<Object> cartesianProduct(Set<?> x, Set<?> y) {
        Set<Object> product = new LinkedHashSet<>();
        for (Object a : x) {
            for (Object b : y) {
                product.add(new OrderedPair(a, b));
            }
        }
        return Set.copyOf(product);
    }

    public static Set<Object> relationDomain(Object relation) {
        Set<Object> domain = new LinkedHashSet<>();
        for (Object edge : members(relation)) {
            if (edge instanceof OrderedPair pair) domain.add(pair.first());
        }
        return Set.copyOf(domain);
    }

    public static Set<Object> restrictedFunction(Object function, Set<?> domain) {
        Set<Object> restricted = new LinkedHashSet<>();
        for (Object edge : members(function)) {
            if (edge instanceof OrderedPair pair && domain.contains(pair.first())) restricted.add(pair);
        }
        return Set.copyOf(restricted);
    }

    public static boolean isFunctional(Object relation) {
        if (!isSet(relation)) return false;
        Map<Object, Object> values = new HashMap<>();
        for (Object edge : members(relation)) {
            if (!(edge instanceof OrderedPair pair)) return false;
            Object previous = values.putIfAbsent(pair.first(), pair.second());
            if (previous != null && !previous.equals(pair.second())) return false;
        }
        return true;
    }

    public static boolean isFunctionFrom(Object function, Object domain, Object codomain) {
        if (!isFunctional(function) || !isSet(domain) || !relationDomain(function).equals(domain)) return false;
        for (Object edge : members(function)) {
            if (!members(codomain).contains(((OrderedPair) edge).second())) return false;
        }
        return true;
    }

    private static boolean isSet(Object value) {
        return value instanceof Set<?>;
    }

    private static Set<?> members(Object value) {
        return value instanceof Set<?> set ? set : EMPTY;
    }
}
