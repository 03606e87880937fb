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
import fol.formula.PSymbol;
import fol.formula.Predicate;
import fol.term.Constant;
import fol.term.FSymbol;
import fol.term.Function;
import fol.term.Term;
import fol.term.Variable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.List;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RulesTest {
    private static final Variable x = new Variable("x");
    private static final Variable y = new Variable("y");
    private static final Variable v = new Variable("v");
    private static final Constant k = new Constant("k");
    private static final PSymbol P = new PSymbol("P", 1);
    private static final PSymbol R = new PSymbol("R", 2);
    private static final Formula a = new Predicate(new PSymbol("a", 0), List.of());
    private static final Formula b = new Predicate(new PSymbol("b", 0), List.of());

    private static Formula p(Term t) {
        return new Predicate(P, t);
    }

    private static StepRejectedException rejected(String rule, Executable step) {
        StepRejectedException e = assertThrows(StepRejectedException.class, step);
        assertEquals(rule, e.getRule());
        return e;
    }

    @Test
    void testHypothesisAndWeakening() {
        Theorem hypothesis = Rules.hypothesis(a);
        Theorem weakened = Rules.weaken(hypothesis, Sequent.assuming(a, b).proves(a, b));
        assertEquals(Set.of(a, b), weakened.left());
        assertEquals("Weakening", weakened.rule());
        assertEquals(List.of(hypothesis), weakened.premises());

        rejected("Weakening", () -> Rules.weaken(hypothesis, Sequent.assuming(b).proves(a)));
    }

    @Test
    void testCut() {
        Theorem first = Rules.tautology(Sequent.assuming(a).proves(new Or(a, b)));
        Theorem second = Rules.tautology(Sequent.assuming(new Or(a, b), new Not(a)).proves(b));
        Theorem cut = Rules.cut(first, second);
        assertEquals(Sequent.assuming(a, new Not(a)).proves(b), cut.sequent());

        rejected("Cut", () -> Rules.cut(second, first));
        Theorem twoConclusions = Rules.tautology(Sequent.proving(a, new Not(a)));
        rejected("Cut", () -> Rules.cut(twoConclusions, second));
    }

    @Test
    void testLeftNot() {
        Theorem excludedMiddle = Rules.tautology(Sequent.proving(a, new Not(a)));
        Theorem moved = Rules.leftNot(excludedMiddle, a);
        assertEquals(Set.of(new Not(a)), moved.left());
        assertEquals(Set.of(new Not(a)), moved.right());

        rejected("LeftNot", () -> Rules.leftNot(excludedMiddle, b));
    }

    @Test
    void testRightAndAndIff() {
        Theorem ab = Rules.tautology(Sequent.assuming(a, b).proves(new Implies(a, b)));
        Theorem ba = Rules.tautology(Sequent.assuming(b).proves(new Implies(b, a)));
        assertEquals(new And(new Implies(a, b), new Implies(b, a)), Rules.rightAnd(ab, ba).conclusion());
        assertEquals(new Iff(a, b), Rules.rightIff(ab, ba).conclusion());

        rejected("RightIff", () -> Rules.rightIff(ab, ab));
    }

    @Test
    void testRightForallEigenvariable() {
        Theorem px = Rules.hypothesis(p(x));
        rejected("RightForall", () -> Rules.rightForall(px, x));

        Theorem valid = Rules.tautology(Sequent.proving(new Implies(p(x), p(x))));
        assertEquals(new Forall(y, new Implies(p(y), p(y))), Rules.rightForall(valid, x).conclusion());
    }

    @Test
    void testConstantDoesNotStandForVariableOfSameName() {
        Variable c = new Variable("c");
        Constant constC = new Constant("c");
        rejected("Tautology", () -> Rules.tautology(Sequent.assuming(p(constC)).proves(p(c))));

        Theorem fromConstant = Rules.hypothesis(p(constC));
        rejected("RightForall", () -> Rules.rightForall(fromConstant, p(c), c));
    }

    @Test
    void testInstantiateForallAvoidsCapture() {
        // ∀x. ∃y. R(x, y) instantiated with y gives ∃y'. R(y, y')
        Formula statement = new Forall(x, new Exists(y, new Predicate(R, x, y)));
        Theorem axiom = Axioms.axiom("serial", statement);
        Theorem instance = Rules.instantiateForall(axiom, y);
        assertEquals(new Exists(v, new Predicate(R, y, v)), instance.conclusion());

        rejected("InstantiateForall", () -> Rules.instantiateForall(instance, k));
    }

    @Test
    void testRightExists() {
        Theorem pk = Rules.hypothesis(p(k));
        Theorem exists = Rules.rightExists(pk, new Exists(x, p(x)), k);
        assertEquals(new Exists(y, p(y)), exists.conclusion());

        rejected("RightExists", () -> Rules.rightExists(pk, new Exists(x, p(x)), new Constant("l")));
    }

    @Test
    void testRightSubstEq() {
        Constant l = new Constant("l");
        Theorem pk = Rules.hypothesis(p(k));
        Theorem pl = Rules.rightSubstEq(pk, k, l, x, p(x));
        assertEquals(Sequent.assuming(p(k), new Equals(l, k)).proves(p(l)), pl.sequent());
    }

    @Test
    void testInstantiate() {
        Theorem hypothesis = Rules.hypothesis(new Forall(y, new Predicate(R, x, y)));
        Theorem instance = Rules.instantiate(hypothesis, Substitution.of(x, y));
        Formula expected = new Forall(v, new Predicate(R, y, v));
        assertEquals(Sequent.assuming(expected).proves(expected), instance.sequent());
    }

    @Test
    void testTautology() {
        Theorem fromPremise = Rules.tautology(Sequent.assuming(b).proves(a), Rules.tautology(Sequent.assuming(b).proves(new And(a, b))));
        assertEquals(Set.of(a), fromPremise.right());

        StepRejectedException e = rejected("Tautology", () -> Rules.tautology(Sequent.assuming(new Or(a, b)).proves(a)));
        assertThat(e.getCondition(), containsString("open branch"));
    }

    @Test
    void testCases() {
        Theorem whenA = Rules.tautology(Sequent.assuming(a).proves(new Or(a, b)));
        Theorem whenNotA = Rules.tautology(Sequent.assuming(new Not(a), b).proves(new Or(a, b)));
        Theorem combined = Rules.cases(new Or(a, b), List.of(a, new Not(a)), List.of(whenA, whenNotA));
        assertEquals(Sequent.assuming(b).proves(new Or(a, b)), combined.sequent());

        rejected("Cases", () -> Rules.cases(new Or(a, b), List.of(a, b), List.of(whenA, whenNotA)));
        rejected("Cases", () -> Rules.cases(new Or(a, b), List.of(a), List.of(whenA, whenNotA)));
        rejected("Cases", () -> Rules.cases(a, List.of(a, new Not(a)), List.of(whenA, whenNotA)));
    }

    @Test
    void testEqualityTransitivity() {
        Constant l = new Constant("l");
        Constant m = new Constant("m");
        Theorem transitivity = Rules.equalityTransitivity(k, l, m);
        assertEquals(Sequent.assuming(new And(new Equals(k, l), new Equals(l, m))).proves(new Equals(m, k)),
                transitivity.sequent());
    }

    @Test
    void testExistenceAndUniqueness() {
        // P(x) := x = k has exactly one solution
        Formula isK = new Equals(x, k);
        Theorem existence = Rules.rightExists(Rules.rightRefl(k), new Exists(x, isK), k);
        Theorem uniqueness = Rules.cut(Rules.tautology(Sequent.assuming(isK, new Equals(v, k))
                .proves(new And(new Equals(x, k), new Equals(k, v)))), Rules.equalityTransitivity(x, k, v));

        Theorem unique = Rules.existenceAndUniqueness(isK, x, existence, uniqueness);
        assertTrue(unique.left().isEmpty());
        assertEquals(new ExistsOne(y, new Equals(k, y)), unique.conclusion());

        Theorem wrongConclusion = Rules.hypothesis(new Equals(x, x));
        rejected("ExistenceAndUniqueness", () -> Rules.existenceAndUniqueness(isK, x, existence, wrongConclusion));
        rejected("ExistenceAndUniqueness", () -> Rules.existenceAndUniqueness(isK, x, uniqueness, uniqueness));
        Theorem extraAssumption = Rules.weaken(uniqueness, Sequent.assuming(isK, new Equals(v, k), p(v)).proves(new Equals(x, v)));
        rejected("ExistenceAndUniqueness", () -> Rules.existenceAndUniqueness(isK, x, existence, extraAssumption));
    }

    @Test
    void testSubstitutionInUniquenessQuantifier() {
        Formula from = new And(p(x), a);
        Formula to = new And(a, p(x));
        Theorem transport = Rules.substitutionInUniquenessQuantifier(x, from, to);
        assertEquals(Set.of(new ExistsOne(x, to)), transport.right());
        assertEquals(2, transport.left().size());
    }

    @Test
    void testDerivationSize() {
        Theorem hypothesis = Rules.hypothesis(a);
        Theorem weakened = Rules.weaken(hypothesis, Sequent.assuming(a, b).proves(a));
        Theorem both = Rules.rightAnd(weakened, hypothesis);
        assertEquals(3, both.derivationSize());
        assertThrows(IllegalStateException.class, () -> Rules.tautology(Sequent.proving(a, new Not(a))).conclusion());
    }

    @Test
    void testFunctionTerms() {
        FSymbol f = new FSymbol("f", 1);
        assertThrows(IllegalArgumentException.class, () -> new Function(f, x, y));
    }
}
