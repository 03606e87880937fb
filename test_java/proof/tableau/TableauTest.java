package proof.tableau;

import fol.formula.And;
import fol.formula.Equals;
import fol.formula.Exists;
import fol.formula.Formula;
import fol.formula.Iff;
import fol.formula.Implies;
import fol.formula.Not;
import fol.formula.Or;
import fol.formula.PSymbol;
import fol.formula.Predicate;
import fol.term.Constant;
import fol.term.Variable;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.api.Test;
import proof.StepRejectedException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TableauTest {
    private static final Formula a = atom("a");
    private static final Formula b = atom("b");
    private static final Formula c = atom("c");

    private final Tableau tableau = new Tableau();

    private static Formula atom(String name) {
        return new Predicate(new PSymbol(name, 0), List.of());
    }

    static Stream<Formula> tautologies() {
        Variable x = new Variable("x");
        Formula px = new Predicate(new PSymbol("P", 1), x);
        return Stream.of(
                new Or(a, new Not(a)),
                new Implies(new Implies(new Implies(a, b), a), a),
                new Iff(new Not(new And(a, b)), new Or(new Not(a), new Not(b))),
                new Implies(new And(new Implies(a, b), new Implies(b, c)), new Implies(a, c)),
                new Iff(new Iff(a, b), new Iff(b, a)),
                new Or(new Exists(x, px), new Not(new Exists(new Variable("y"), new Predicate(new PSymbol("P", 1), new Variable("y"))))),
                new Equals(new Constant("k"), new Constant("k")));
    }

    @ParameterizedTest
    @MethodSource("tautologies")
    void testTautologiesAreRefuted(Formula tautology) {
        assertTrue(tableau.refutes(List.of(new Not(tautology))), tautology::toString);
    }

    @Test
    void testNonTautologyLeavesOpenBranch() {
        Formula formula = new Implies(new Or(a, b), a);
        Optional<Branch> open = tableau.findOpenBranch(List.of(new Not(formula)));
        assertTrue(open.isPresent());
        // The counterexample makes b true and a false
        assertThat(open.get().getFormulas(), hasItem(b));
        assertThat(open.get().getFormulas(), hasItem(new Not(a)));
    }

    @Test
    void testConsistentSetIsNotRefuted() {
        assertFalse(tableau.refutes(List.of(a, new Implies(a, b), new Or(b, c))));
    }

    @Test
    void testSymmetricEqualitiesClose() {
        Constant k = new Constant("k");
        Constant l = new Constant("l");
        assertTrue(tableau.refutes(List.of(new Equals(k, l), new Not(new Equals(l, k)))));
    }

    @Test
    void testBranchBudget() {
        List<Formula> formulas = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            formulas.add(new Or(atom("p" + i), atom("q" + i)));
        }
        Tableau small = new Tableau(List.of(new AndElim(), new NotElim(), new OrElim(), new IffElim()), 3);
        StepRejectedException e = assertThrows(StepRejectedException.class, () -> small.findOpenBranch(formulas));
        assertEquals("Tautology", e.getRule());
    }
}
