package proof;

import fol.Substitution;
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
import fol.term.Term;
import fol.term.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import proof.tableau.Branch;
import proof.tableau.Tableau;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The primitive proof steps. Every method either returns a new {@link Theorem} or throws a
 * {@link StepRejectedException} naming the side condition that does not hold.
 */
public final class Rules {
    private static final Logger LOGGER = LoggerFactory.getLogger(Rules.class);
    private static final Tableau TABLEAU = new Tableau();

    private Rules() {
    }

    /**
     * {@code φ ⊢ φ}
     */
    public static Theorem hypothesis(Formula formula) {
        return new Theorem(Sequent.assuming(formula).proves(formula), "Hypothesis", List.of());
    }

    /**
     * From {@code Γ ⊢ Δ} conclude any sequent with more assumptions and more conclusions.
     */
    public static Theorem weaken(Theorem premise, Sequent target) {
        if (!target.left().containsAll(premise.left()) || !target.right().containsAll(premise.right())) {
            throw reject("Weakening", "%s is not a weakening of %s", target, premise);
        }
        return new Theorem(target, "Weakening", List.of(premise));
    }

    /**
     * Cut along the single conclusion of {@code first}.
     */
    public static Theorem cut(Theorem first, Theorem second) {
        if (first.right().size() != 1) {
            throw reject("Cut", "cut formula is ambiguous, %s has %d conclusions", first, first.right().size());
        }
        return cut(first, second, first.conclusion());
    }

    /**
     * From {@code Γ ⊢ Δ, φ} and {@code Σ, φ ⊢ Π} conclude {@code Γ, Σ ⊢ Δ, Π}.
     */
    public static Theorem cut(Theorem first, Theorem second, Formula phi) {
        if (!first.right().contains(phi)) {
            throw reject("Cut", "%s is not a conclusion of %s", phi, first);
        }
        if (!second.left().contains(phi)) {
            throw reject("Cut", "%s is not an assumption of %s", phi, second);
        }
        Set<Formula> left = new LinkedHashSet<>(first.left());
        second.left().stream().filter(f -> !f.equals(phi)).forEach(left::add);
        Set<Formula> right = new LinkedHashSet<>();
        first.right().stream().filter(f -> !f.equals(phi)).forEach(right::add);
        right.addAll(second.right());
        return new Theorem(new Sequent(left, right), "Cut", List.of(first, second));
    }

    /**
     * From {@code Γ ⊢ Δ, φ} conclude {@code Γ, ¬φ ⊢ Δ}.
     */
    public static Theorem leftNot(Theorem premise, Formula phi) {
        if (!premise.right().contains(phi)) {
            throw reject("LeftNot", "%s is not a conclusion of %s", phi, premise);
        }
        Set<Formula> left = new LinkedHashSet<>(premise.left());
        left.add(new Not(phi));
        return new Theorem(new Sequent(left, without(premise.right(), phi)), "LeftNot", List.of(premise));
    }

    /**
     * From {@code Γ ⊢ a} and {@code Σ ⊢ b} conclude {@code Γ, Σ ⊢ a ∧ b}.
     */
    public static Theorem rightAnd(Theorem first, Theorem second) {
        Formula a = single("RightAnd", first);
        Formula b = single("RightAnd", second);
        return new Theorem(new Sequent(union(first.left(), second.left()), Set.of(new And(a, b))), "RightAnd",
                List.of(first, second));
    }

    /**
     * From {@code Γ ⊢ a ⇒ b} and {@code Σ ⊢ b ⇒ a} conclude {@code Γ, Σ ⊢ a ⇔ b}.
     */
    public static Theorem rightIff(Theorem forward, Theorem backward) {
        Formula f = single("RightIff", forward);
        Formula b = single("RightIff", backward);
        if (!(f instanceof Implies fi) || !(b instanceof Implies bi)
                || !fi.left().equals(bi.right()) || !fi.right().equals(bi.left())) {
            throw reject("RightIff", "%s and %s are not converse implications", f, b);
        }
        return new Theorem(new Sequent(union(forward.left(), backward.left()), Set.of(new Iff(fi.left(), fi.right()))),
                "RightIff", List.of(forward, backward));
    }

    public static Theorem rightForall(Theorem premise, Variable var) {
        return rightForall(premise, single("RightForall", premise), var);
    }

    /**
     * From {@code Γ ⊢ Δ, φ} conclude {@code Γ ⊢ Δ, ∀x. φ}, provided {@code x} is not free in {@code Γ} or {@code Δ}.
     */
    public static Theorem rightForall(Theorem premise, Formula phi, Variable var) {
        if (!premise.right().contains(phi)) {
            throw reject("RightForall", "%s is not a conclusion of %s", phi, premise);
        }
        Set<Formula> others = without(premise.right(), phi);
        for (Formula f : union(premise.left(), others)) {
            if (f.freeVars().contains(var)) {
                throw reject("RightForall", "%s is free in %s", var, f);
            }
        }
        return new Theorem(new Sequent(premise.left(), replace(premise.right(), phi, new Forall(var, phi))),
                "RightForall", List.of(premise));
    }

    /**
     * From {@code Γ ⊢ ∀x. φ} conclude {@code Γ ⊢ φ[t/x]}.
     */
    public static Theorem instantiateForall(Theorem premise, Term term) {
        Formula conclusion = single("InstantiateForall", premise);
        if (!(conclusion instanceof Forall forall)) {
            throw reject("InstantiateForall", "%s is not universally quantified", conclusion);
        }
        return new Theorem(new Sequent(premise.left(), Set.of(forall.apply(term))), "InstantiateForall",
                List.of(premise));
    }

    /**
     * From {@code Γ ⊢ Δ, φ[t/x]} conclude {@code Γ ⊢ Δ, ∃x. φ}.
     */
    public static Theorem rightExists(Theorem premise, Exists target, Term witness) {
        Formula instance = target.apply(witness);
        if (!premise.right().contains(instance)) {
            throw reject("RightExists", "%s is not a conclusion of %s", instance, premise);
        }
        return new Theorem(new Sequent(premise.left(), replace(premise.right(), instance, target)), "RightExists",
                List.of(premise));
    }

    /**
     * {@code ⊢ t = t}
     */
    public static Theorem rightRefl(Term term) {
        return new Theorem(Sequent.proving(new Equals(term, term)), "RightRefl", List.of());
    }

    /**
     * From {@code Γ ⊢ Δ, φ[s/z]} conclude {@code Γ, s = t ⊢ Δ, φ[t/z]}.
     */
    public static Theorem rightSubstEq(Theorem premise, Term from, Term to, Variable hole, Formula context) {
        Formula before = context.applySub(Substitution.of(hole, from));
        if (!premise.right().contains(before)) {
            throw reject("RightSubstEq", "%s is not a conclusion of %s", before, premise);
        }
        Formula after = context.applySub(Substitution.of(hole, to));
        Set<Formula> left = new LinkedHashSet<>(premise.left());
        left.add(new Equals(from, to));
        return new Theorem(new Sequent(left, replace(premise.right(), before, after)), "RightSubstEq",
                List.of(premise));
    }

    /**
     * Instance of a theorem obtained by substituting terms for its free variables.
     */
    public static Theorem instantiate(Theorem premise, Substitution substitution) {
        return new Theorem(premise.sequent().applySub(substitution), "InstantiateSchema", List.of(premise));
    }

    /**
     * Accept {@code goal} if it follows propositionally from the premises, atoms and quantified formulas being
     * opaque.
     */
    public static Theorem tautology(Sequent goal, Theorem... premises) {
        List<Formula> roots = new ArrayList<>();
        for (Theorem premise : premises) {
            roots.add(premise.sequent().toFormula());
        }
        roots.addAll(goal.left());
        for (Formula conclusion : goal.right()) {
            roots.add(new Not(conclusion));
        }
        Optional<Branch> open = TABLEAU.findOpenBranch(roots);
        if (open.isPresent()) {
            throw reject("Tautology", "%s does not follow from %d premise(s), open branch %s", goal, premises.length,
                    open.get());
        }
        return new Theorem(goal, "Tautology", List.of(premises));
    }

    /**
     * Combine one theorem per case into a theorem without the case assumptions. Branch {@code i} proves the goal
     * under guard {@code i}; the disjunction of the guards must be a tautology.
     */
    public static Theorem cases(Formula goal, List<Formula> guards, List<Theorem> branches) {
        if (guards.isEmpty() || guards.size() != branches.size()) {
            throw reject("Cases", "expected one branch per guard, got %d guards and %d branches", guards.size(),
                    branches.size());
        }
        Optional<Branch> open = TABLEAU.findOpenBranch(List.of(new Not(Or.of(guards))));
        if (open.isPresent()) {
            throw reject("Cases", "guards %s are not exhaustive, counterexample %s", guards, open.get());
        }
        Set<Formula> left = new LinkedHashSet<>();
        for (int i = 0; i < guards.size(); i++) {
            Theorem branch = branches.get(i);
            if (!branch.right().equals(Set.of(goal))) {
                throw reject("Cases", "case %d proves %s instead of %s", i, branch.right(), goal);
            }
            left.addAll(without(branch.left(), guards.get(i)));
        }
        return new Theorem(new Sequent(left, Set.of(goal)), "Cases", branches);
    }

    /**
     * {@code (a = b ∧ b = c) ⊢ a = c}
     */
    public static Theorem equalityTransitivity(Term a, Term b, Term c) {
        return new Theorem(Sequent.assuming(new And(new Equals(a, b), new Equals(b, c))).proves(new Equals(a, c)),
                "EqualityTransitivity", List.of());
    }

    /**
     * From an existence proof {@code Γ ⊢ ∃u. φ} and a uniqueness proof {@code Σ, φ, φ[v/u] ⊢ u = v} where neither
     * {@code u} nor {@code v} is free in {@code Σ}, conclude {@code Γ, Σ ⊢ ∃!u. φ}.
     */
    public static Theorem existenceAndUniqueness(Formula formula, Variable var, Theorem existence, Theorem uniqueness) {
        Formula exists = new Exists(var, formula);
        if (!existence.right().equals(Set.of(exists))) {
            throw reject("ExistenceAndUniqueness", "existence proves %s instead of %s", existence.right(), exists);
        }
        Formula conclusion = single("ExistenceAndUniqueness", uniqueness);
        if (!(conclusion instanceof Equals eq) || !(eq.otherSide(var) instanceof Variable other) || other.equals(var)) {
            throw reject("ExistenceAndUniqueness", "uniqueness must conclude %s = v for another variable v, not %s",
                    var, conclusion);
        }
        if (formula.freeVars().contains(other)) {
            throw reject("ExistenceAndUniqueness", "%s is free in %s", other, formula);
        }
        Formula twin = formula.applySub(Substitution.of(var, other));
        if (!uniqueness.left().contains(formula) || !uniqueness.left().contains(twin)) {
            throw reject("ExistenceAndUniqueness", "uniqueness must assume %s and %s", formula, twin);
        }
        Set<Formula> rest = without(without(uniqueness.left(), formula), twin);
        for (Formula f : rest) {
            Set<Variable> free = f.freeVars();
            if (free.contains(var) || free.contains(other)) {
                throw reject("ExistenceAndUniqueness", "%s or %s is free in the assumption %s", var, other, f);
            }
        }
        return new Theorem(new Sequent(union(existence.left(), rest), Set.of(new ExistsOne(var, formula))),
                "ExistenceAndUniqueness", List.of(existence, uniqueness));
    }

    /**
     * {@code ∃!u. P, ∀u. (P ⇔ Q) ⊢ ∃!u. Q}
     */
    public static Theorem substitutionInUniquenessQuantifier(Variable var, Formula from, Formula to) {
        return new Theorem(
                Sequent.assuming(new ExistsOne(var, from), new Forall(var, new Iff(from, to))).proves(new ExistsOne(var, to)),
                "SubstitutionInUniquenessQuantifier", List.of());
    }

    private static Formula single(String rule, Theorem premise) {
        if (premise.right().size() != 1) {
            throw reject(rule, "expected a single conclusion in %s", premise);
        }
        return premise.conclusion();
    }

    private static Set<Formula> union(Set<Formula> a, Set<Formula> b) {
        Set<Formula> out = new LinkedHashSet<>(a);
        out.addAll(b);
        return out;
    }

    private static Set<Formula> without(Set<Formula> set, Formula formula) {
        Set<Formula> out = new LinkedHashSet<>(set);
        out.remove(formula);
        return out;
    }

    private static Set<Formula> replace(Set<Formula> set, Formula old, Formula replacement) {
        Set<Formula> out = new LinkedHashSet<>();
        for (Formula f : set) {
            out.add(f.equals(old) ? replacement : f);
        }
        return out;
    }

    private static StepRejectedException reject(String rule, String format, Object... args) {
        String condition = String.format(format, args);
        LOGGER.debug("Rejected {}: {}", rule, condition);
        return new StepRejectedException(rule, condition);
    }
}
