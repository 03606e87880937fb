package mathematics;

import fol.Substitution;
import fol.formula.And;
import fol.formula.Equals;
import fol.formula.Exists;
import fol.formula.ExistsOne;
import fol.formula.Formula;
import fol.formula.Implies;
import fol.formula.Not;
import fol.term.Term;
import fol.term.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import proof.DefiniteDescription;
import proof.MalformedRequestException;
import proof.Rules;
import proof.Sequent;
import proof.Theorem;
import settheory.SetTheory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

import static proof.Tactics.restate;

/**
 * Total descriptions from partial uniqueness theorems.
 * <p>
 * Given {@code prem ⊢ ∃!u. f(u)}, {@link #theConditional} defines the element that is uniquely given by the
 * theorem, or falls back to a default element when the assumptions of the theorem are not satisfied. The new
 * defining formula {@code completeDef(u) = (prem ⇒ f(u)) ∧ (¬prem ⇒ u = default)} has a unique solution for
 * every value of its parameters, which is proved by cases on {@code prem}:
 * <ul>
 *     <li>under {@code prem}, {@code f} and {@code completeDef} are equivalent, so uniqueness transports;</li>
 *     <li>under {@code ¬prem}, the default is a solution and any two solutions are equal to it.</li>
 * </ul>
 */
public final class ConditionalDescriptions {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConditionalDescriptions.class);

    private ConditionalDescriptions() {
    }

    /**
     * Same as {@link #theConditional(Variable, Formula, Theorem, Term)}, falling back to the empty set.
     */
    public static DefiniteDescription theConditional(Variable u, Formula f, Theorem just) {
        return theConditional(u, f, just, SetTheory.emptySet);
    }

    /**
     * @param u the bound variable
     * @param f the defining formula, possibly mentioning parameters other than {@code u}
     * @param just a theorem {@code prem ⊢ ∃!u. f}
     * @param defaultValue value of the description where {@code prem} fails
     * @return the direct description of {@code f} when {@code just} has no assumptions, a
     * {@link ConditionalDescription} otherwise
     * @throws MalformedRequestException if {@code just} does not prove {@code ∃!u. f}, {@code u} is free in its
     * assumptions, or the default value depends on {@code u}
     */
    public static DefiniteDescription theConditional(Variable u, Formula f, Theorem just, Term defaultValue) {
        DefiniteDescription direct = DefiniteDescription.the(u, f, just);
        if (defaultValue == null) {
            throw new MalformedRequestException("default", "missing");
        }
        if (defaultValue.vars().contains(u)) {
            throw new MalformedRequestException("default", String.format("%s depends on the bound variable %s", defaultValue, u));
        }
        Sequent seq = just.sequent();
        if (seq.left().isEmpty()) {
            LOGGER.debug("{} is justified without assumptions", direct);
            return direct;
        }
        for (Formula assumption : seq.left()) {
            if (assumption.freeVars().contains(u)) {
                throw new MalformedRequestException("justification",
                        String.format("bound variable %s is free in the assumption %s", u, assumption));
            }
        }

        Formula prem = normalizeAssumptions(seq.left());
        Formula completeDef = new And(new Implies(prem, f), new Implies(new Not(prem), new Equals(u, defaultValue)));
        LOGGER.debug("Completing {} under {} with default {}", f, prem, defaultValue);

        Theorem agreement = agreement(u, f, prem, completeDef, defaultValue);
        Theorem premiseCase = premiseCase(u, f, prem, completeDef, just, agreement);
        Theorem fallbackCase = fallbackCase(u, f, prem, completeDef, defaultValue);
        Theorem completeUniqueness = Rules.cases(new ExistsOne(u, completeDef), List.of(prem, new Not(prem)),
                List.of(premiseCase, fallbackCase));

        LOGGER.debug("Proved {} in {} steps", completeUniqueness, completeUniqueness.derivationSize());
        return new ConditionalDescription(u, completeDef, completeUniqueness, f, prem, defaultValue, agreement);
    }

    /**
     * One conjunction of the assumptions, independent of their order, repetitions and grouping: conjunctions are
     * split, duplicates removed and the conjuncts sorted by their canonical text.
     */
    public static Formula normalizeAssumptions(Collection<? extends Formula> assumptions) {
        TreeMap<String, Formula> byText = new TreeMap<>();
        for (Formula assumption : assumptions) {
            for (Formula conjunct : And.conjuncts(assumption)) {
                byText.putIfAbsent(conjunct.getEqString(), conjunct);
            }
        }
        return And.of(new ArrayList<>(byText.values()));
    }

    /**
     * {@code prem ⊢ ∀u. f ⇔ completeDef}
     */
    private static Theorem agreement(Variable u, Formula f, Formula prem, Formula completeDef, Term defaultValue) {
        Formula atDefault = new Equals(u, defaultValue);

        // f gives the first conjunct, the second one is vacuous under prem
        Theorem guarded = restate(Rules.weaken(Rules.hypothesis(f), Sequent.assuming(prem, f).proves(f)),
                Sequent.assuming(f).proves(new Implies(prem, f)));
        Theorem contradiction = Rules.leftNot(Rules.hypothesis(prem), prem);
        Theorem vacuous = restate(
                Rules.weaken(contradiction, Sequent.assuming(prem, new Not(prem)).proves(atDefault)),
                Sequent.assuming(prem).proves(new Implies(new Not(prem), atDefault)));
        Theorem forward = restate(Rules.rightAnd(guarded, vacuous), Sequent.assuming(prem).proves(new Implies(f, completeDef)));

        // completeDef and prem give back f
        Theorem extracted = restate(
                Rules.weaken(Rules.hypothesis(completeDef), Sequent.assuming(prem, completeDef).proves(completeDef)),
                Sequent.assuming(prem, completeDef).proves(f));
        Theorem backward = restate(extracted, Sequent.assuming(prem).proves(new Implies(completeDef, f)));

        return Rules.rightForall(Rules.rightIff(forward, backward), u);
    }

    /**
     * {@code prem ⊢ ∃!u. completeDef}
     */
    private static Theorem premiseCase(Variable u, Formula f, Formula prem, Formula completeDef, Theorem just,
                                       Theorem agreement) {
        Theorem transport = Rules.substitutionInUniquenessQuantifier(u, f, completeDef);
        Theorem implication = Rules.cut(agreement, transport);
        Theorem uniqueness = restate(just, Sequent.assuming(prem).proves(new ExistsOne(u, f)));
        return Rules.cut(uniqueness, implication);
    }

    /**
     * {@code ¬prem ⊢ ∃!u. completeDef}
     */
    private static Theorem fallbackCase(Variable u, Formula f, Formula prem, Formula completeDef, Term defaultValue) {
        Formula notPrem = new Not(prem);

        // The default is a solution: the first conjunct is vacuous, the second one is reflexivity
        Formula fAtDefault = f.applySub(Substitution.of(u, defaultValue));
        Theorem vacuous = Rules.weaken(Rules.leftNot(Rules.hypothesis(prem), prem),
                Sequent.assuming(prem, notPrem).proves(fAtDefault));
        Theorem first = restate(vacuous, Sequent.assuming(notPrem).proves(new Implies(prem, fAtDefault)));
        Theorem second = restate(Rules.rightRefl(defaultValue),
                Sequent.assuming(notPrem).proves(new Implies(notPrem, new Equals(defaultValue, defaultValue))));
        Theorem existence = Rules.rightExists(Rules.rightAnd(first, second), new Exists(u, completeDef), defaultValue);

        // Any two solutions are equal to the default, hence to each other
        Set<Variable> taken = new HashSet<>(completeDef.freeVars());
        taken.addAll(defaultValue.vars());
        Variable v = u.freshVariant(taken);
        Formula twin = completeDef.applySub(Substitution.of(u, v));
        Theorem firstEq = Rules.tautology(Sequent.assuming(notPrem, completeDef).proves(new Equals(u, defaultValue)));
        Theorem secondEq = Rules.tautology(Sequent.assuming(notPrem, twin).proves(new Equals(defaultValue, v)));
        Theorem uniqueness = Rules.cut(Rules.rightAnd(firstEq, secondEq), Rules.equalityTransitivity(u, defaultValue, v));

        return Rules.existenceAndUniqueness(completeDef, u, existence, uniqueness);
    }
}
