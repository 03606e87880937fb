package fol;

import fol.term.Term;
import fol.term.Variable;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Simultaneous substitution of terms for free variables.
 * Formulas apply it capture-avoidingly: a binder that would capture a variable of a substituted term is renamed
 * (see {@link #enterBinder(Variable, Set)}).
 */
public class Substitution {
    private final Map<Variable, Term> map;

    public Substitution() {
        this.map = new HashMap<>();
    }

    private Substitution(Map<Variable, Term> map) {
        this.map = map;
    }

    public static Substitution of(Map<Variable, ? extends Term> map) {
        return new Substitution(new HashMap<>(map));
    }

    public static Substitution of(Variable var, Term term) {
        Substitution sub = new Substitution();
        sub.put(var, term);
        return sub;
    }

    public Term getOrDefault(Variable var, Term defaultTerm) {
        return map.getOrDefault(var, defaultTerm);
    }

    public void put(Variable var, Term term) {
        map.put(var, term);
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    public Set<Variable> domain() {
        return new HashSet<>(map.keySet());
    }

    public Substitution compose(Substitution other) {
        Map<Variable, Term> newMap = new HashMap<>();
        for (var e : other.map.entrySet()) {
            newMap.put(e.getKey(), e.getValue().applySub(this));
        }
        for (var e : map.entrySet()) {
            newMap.putIfAbsent(e.getKey(), e.getValue());
        }
        return new Substitution(newMap);
    }

    public Substitution without(Variable var) {
        Map<Variable, Term> newMap = new HashMap<>(map);
        newMap.remove(var);
        return new Substitution(newMap);
    }

    /**
     * Keep only the bindings of the given variables.
     */
    public Substitution restrictedTo(Set<Variable> vars) {
        Map<Variable, Term> newMap = new HashMap<>();
        for (var e : map.entrySet()) {
            if (vars.contains(e.getKey())) newMap.put(e.getKey(), e.getValue());
        }
        return new Substitution(newMap);
    }

    /**
     * Variables occurring in the substituted terms.
     */
    public Set<Variable> rangeVars() {
        Set<Variable> out = new HashSet<>();
        for (Term t : map.values()) out.addAll(t.vars());
        return out;
    }

    /**
     * Prepare the substitution for the body of a binder over {@code var} whose body has the free variables
     * {@code bodyFreeVars}. The binder itself is never substituted. If a substituted term mentions {@code var},
     * the binder is renamed to a fresh variant and the returned substitution also maps {@code var} to it.
     *
     * @return the binder to use and the substitution to apply to the body
     */
    public BinderScope enterBinder(Variable var, Set<Variable> bodyFreeVars) {
        Set<Variable> relevant = new HashSet<>(bodyFreeVars);
        relevant.remove(var);
        Substitution pruned = restrictedTo(relevant);
        if (!pruned.rangeVars().contains(var)) {
            return new BinderScope(var, pruned);
        }
        Set<Variable> avoid = new HashSet<>(bodyFreeVars);
        avoid.addAll(pruned.rangeVars());
        avoid.addAll(pruned.domain());
        Variable fresh = var.freshVariant(avoid);
        pruned.put(var, fresh);
        return new BinderScope(fresh, pruned);
    }

    public record BinderScope(Variable var, Substitution body) {}

    @Override
    public String toString() {
        return map.toString();
    }

    public Substitution copy() {
        return new Substitution(new HashMap<>(map));
    }
}
