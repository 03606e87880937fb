package proof;

import fol.formula.And;
import fol.formula.Equals;
import fol.formula.Forall;
import fol.formula.Formula;
import fol.formula.Implies;
import fol.formula.PSymbol;
import fol.formula.Predicate;
import fol.term.Constant;
import fol.term.Variable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TacticsTest {
    private static final Variable x = new Variable("x");
    private static final PSymbol P = new PSymbol("P", 1);
    private static final PSymbol Q = new PSymbol("Q", 1);

    @Test
    void testRestate() {
        Formula px = new Predicate(P, x);
        Formula qx = new Predicate(Q, x);
        Theorem both = Rules.tautology(Sequent.assuming(px, qx).proves(new And(px, qx)));
        Theorem swapped = Tactics.restate(both, Sequent.assuming(qx, px).proves(new And(qx, px)));
        assertEquals(Set.of(new And(qx, px)), swapped.right());
    }

    @Test
    void testInstantiateGuarded() {
        Constant k = new Constant("k");
        Formula rule = new Forall(x, new Implies(new Predicate(P, x), new Predicate(Q, x)));
        Theorem guarded = Tactics.instantiateGuarded(Axioms.axiom("rule", rule), k);
        assertEquals(Sequent.assuming(new Predicate(P, k)).proves(new Predicate(Q, k)), guarded.sequent());

        assertThrows(StepRejectedException.class, () -> Tactics.assumeAntecedent(Rules.hypothesis(new Predicate(P, k))));
    }

    @Test
    void testChainEqualities() {
        Constant a = new Constant("a");
        Constant b = new Constant("b");
        Constant c = new Constant("c");
        Constant d = new Constant("d");
        Formula ab = new Equals(a, b);
        Formula cb = new Equals(c, b);
        Formula cd = new Equals(c, d);

        Theorem chained = Tactics.chainEqualities(List.of(ab, cb, cd), List.of(a, b, c, d));
        assertEquals(Sequent.assuming(ab, cb, cd).proves(new Equals(a, d)), chained.sequent());

        assertThrows(StepRejectedException.class, () -> Tactics.chainEqualities(List.of(ab), List.of(a)));
        assertThrows(StepRejectedException.class, () -> Tactics.chainEqualities(List.of(ab), List.of(a, b, c)));
    }
}
