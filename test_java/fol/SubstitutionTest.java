package fol;

import fol.formula.Forall;
import fol.formula.Formula;
import fol.formula.PSymbol;
import fol.formula.Predicate;
import fol.formula.Quantifier;
import fol.term.FSymbol;
import fol.term.Function;
import fol.term.Term;
import fol.term.Variable;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubstitutionTest {
    private static final Variable x = new Variable("x");
    private static final Variable y = new Variable("y");
    private static final Variable z = new Variable("z");
    private static final PSymbol R = new PSymbol("R", 2);
    private static final FSymbol g = new FSymbol("g", 1);

    @Test
    void testSimultaneous() {
        Formula formula = new Predicate(R, x, y);
        Substitution swap = Substitution.of(Map.of(x, y, y, x));
        assertEquals(new Predicate(R, y, x), formula.applySub(swap));
    }

    @Test
    void testBoundVariableIsNotSubstituted() {
        Formula formula = new Forall(x, new Predicate(R, x, y));
        Formula result = formula.applySub(Substitution.of(x, z));
        assertEquals(formula, result);
    }

    @Test
    void testUntouchedQuantifierIsReused() {
        Formula formula = new Forall(x, new Predicate(R, x, y));
        assertSame(formula, formula.applySub(Substitution.of(z, x)));
    }

    @Test
    void testBinderIsRenamedToAvoidCapture() {
        // ∀x. R(x, y) with y := g(x) must not capture the x of g(x)
        Term gx = new Function(g, x);
        Formula result = new Forall(x, new Predicate(R, x, y)).applySub(Substitution.of(y, gx));

        Quantifier quantifier = (Quantifier) result;
        assertNotEquals(x, quantifier.var());
        assertEquals(new Predicate(R, quantifier.var(), gx), quantifier.formula());
        assertEquals(Set.of(x), result.freeVars());
    }

    @Test
    void testRenamedBinderAvoidsBodyVariables() {
        Variable xPrime = new Variable("x'");
        Formula formula = new Forall(x, new Predicate(R, x, new Function(g, xPrime)));
        Quantifier result = (Quantifier) formula.applySub(Substitution.of(xPrime, x));
        assertFalse(Set.of(x, xPrime).contains(result.var()));
        assertThat(result.freeVars(), containsInAnyOrder(x));
    }

    @Test
    void testEnterBinderPrunesUnusedBindings() {
        Substitution substitution = Substitution.of(Map.of(y, z, z, x));
        Substitution.BinderScope scope = substitution.enterBinder(x, Set.of(x, y));
        assertEquals(x, scope.var());
        assertEquals(Set.of(y), scope.body().domain());
    }

    @Test
    void testCompose() {
        // second.compose(first) applies first, then second
        Substitution first = Substitution.of(x, new Function(g, y));
        Substitution second = Substitution.of(y, z);
        assertEquals(new Function(g, z), x.applySub(second.compose(first)));
        assertEquals(z, y.applySub(second.compose(first)));
    }

    @Test
    void testFreshVariant() {
        assertEquals(new Variable("x''"), x.freshVariant(Set.of(x, new Variable("x'"))));
        assertEquals(x, x.freshVariant(Set.of(y)));
    }

    @Test
    void testReservedNames() {
        assertThrows(IllegalArgumentException.class, () -> new Variable("#0"));
        assertThrows(IllegalArgumentException.class, () -> new Variable(""));
        assertTrue(new Variable("x#").name().endsWith("#"));
    }
}
