package proof;

import fol.Substitution;
import fol.formula.And;
import fol.formula.Formula;
import fol.formula.Implies;
import fol.formula.Or;
import fol.term.Variable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Assumptions entailing the disjunction of the conclusions. Both sides are sets of formulas up to
 * alpha-equivalence and keep insertion order for printing.
 */
public record Sequent(Set<Formula> left, Set<Formula> right) {

    public Sequent {
        left = Collections.unmodifiableSet(new LinkedHashSet<>(left));
        right = Collections.unmodifiableSet(new LinkedHashSet<>(right));
    }

    public static Sequent assuming(Formula... left) {
        return new Sequent(List.of(left).stream().collect(Collectors.toCollection(LinkedHashSet::new)), Set.of());
    }

    public static Sequent assuming(Collection<? extends Formula> left) {
        return new Sequent(new LinkedHashSet<>(left), Set.of());
    }

    public static Sequent proving(Formula... right) {
        return assuming().proves(right);
    }

    public Sequent proves(Formula... conclusions) {
        Set<Formula> newRight = new LinkedHashSet<>(right);
        newRight.addAll(List.of(conclusions));
        return new Sequent(left, newRight);
    }

    public Sequent applySub(Substitution substitution) {
        return new Sequent(
                left.stream().map(f -> f.applySub(substitution)).collect(Collectors.toCollection(LinkedHashSet::new)),
                right.stream().map(f -> f.applySub(substitution)).collect(Collectors.toCollection(LinkedHashSet::new)));
    }

    public Set<Variable> freeVars() {
        Set<Variable> out = new HashSet<>();
        left.forEach(f -> out.addAll(f.freeVars()));
        right.forEach(f -> out.addAll(f.freeVars()));
        return out;
    }

    /**
     * The sequent read as one formula: conjunction of the assumptions implies disjunction of the conclusions.
     */
    public Formula toFormula() {
        Formula conclusions = Or.of(new ArrayList<>(right));
        if (left.isEmpty()) return conclusions;
        return new Implies(And.of(new ArrayList<>(left)), conclusions);
    }

    @Override
    public String toString() {
        String l = left.stream().map(Object::toString).collect(Collectors.joining(", "));
        String r = right.stream().map(Object::toString).collect(Collectors.joining(", "));
        return (l.isEmpty() ? "" : l + " ") + "⊢ " + r;
    }
}
