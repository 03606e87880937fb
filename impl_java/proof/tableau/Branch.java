package proof.tableau;

import fol.formula.Equals;
import fol.formula.Formula;
import fol.formula.Not;
import fol.formula.Predicate;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * One branch of a tableau: the formulas asserted along it and which of them were already expanded.
 */
public class Branch {
    private final Set<Formula> formulas;
    private final Set<Formula> expanded;
    private boolean closed;
    private final Branch parent;
    public final long id;
    private static final AtomicLong NEXT_ID = new AtomicLong();

    public Branch(Collection<? extends Formula> formulas) {
        this(new LinkedHashSet<>(), new LinkedHashSet<>(), false, null);
        addFormulas(formulas);
    }

    private Branch(Set<Formula> formulas, Set<Formula> expanded, boolean closed, Branch parent) {
        this.formulas = formulas;
        this.expanded = expanded;
        this.closed = closed;
        this.parent = parent;
        this.id = NEXT_ID.getAndIncrement();
    }

    public Branch copy() {
        return new Branch(new LinkedHashSet<>(formulas), new LinkedHashSet<>(expanded), closed, this);
    }

    public Set<Formula> getFormulas() {
        return Collections.unmodifiableSet(formulas);
    }

    public Branch getParent() {
        return parent;
    }

    public void addFormulas(Collection<? extends Formula> newFormulas) {
        for (Formula formula : newFormulas) {
            if (!closed && contradicts(formula)) closed = true;
            formulas.add(formula);
        }
    }

    public void markExpanded(Formula formula) {
        expanded.add(formula);
    }

    public List<Formula> getUnexpanded() {
        return formulas.stream().filter(f -> !expanded.contains(f)).toList();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Whether adding {@code formula} would close this branch.
     */
    public boolean contradicts(Formula formula) {
        if (formula instanceof Not not) {
            Formula inner = not.formula();
            // ¬true; c ≠ c
            if (inner.equals(Predicate.TRUE)) return true;
            if (inner instanceof Equals eq && eq.left().equals(eq.right())) return true;
            // !a; a
            if (formulas.contains(inner)) return true;
        }
        return formulas.contains(new Not(formula));
    }

    /**
     * Whether adding all the formulas together would close this branch.
     */
    public boolean contradictsAll(List<Formula> alternative) {
        for (int i = 0; i < alternative.size(); i++) {
            Formula formula = alternative.get(i);
            if (contradicts(formula)) return true;
            for (int j = i + 1; j < alternative.size(); j++) {
                if (TableauRule.negation(formula).equals(alternative.get(j))) return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return formulas.stream().map(Object::toString).collect(Collectors.joining("; ", "{", "}"));
    }
}
