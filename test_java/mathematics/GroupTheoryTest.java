package mathematics;

import fol.formula.Equals;
import fol.formula.ExistsOne;
import fol.formula.Forall;
import fol.formula.Formula;
import fol.formula.Iff;
import fol.formula.Implies;
import fol.term.Term;
import fol.term.Variable;
import org.junit.jupiter.api.Test;
import proof.Library;
import proof.Sequent;
import proof.Theorem;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

import static mathematics.GroupTheory.group;
import static mathematics.GroupTheory.identity;
import static mathematics.GroupTheory.inverse;
import static mathematics.GroupTheory.isInverse;
import static mathematics.GroupTheory.isNeutral;
import static mathematics.GroupTheory.op;
import static mathematics.GroupTheory.subgroup;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInRelativeOrder;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static settheory.SetTheory.cartesianProduct;
import static settheory.SetTheory.emptySet;
import static settheory.SetTheory.functional;
import static settheory.SetTheory.in;
import static settheory.SetTheory.pair;
import static settheory.SetTheory.relationDomain;
import static settheory.SetTheory.restrictedFunction;

class GroupTheoryTest {
    private static final Variable G = new Variable("G");
    private static final Variable H = new Variable("H");
    private static final Variable star = new Variable("*");
    private static final Variable e = new Variable("e");
    private static final Variable x = new Variable("x");
    private static final Variable y = new Variable("y");

    @Test
    void testIdentityUniqueness() {
        assertEquals(Sequent.assuming(group.of(G, star)).proves(new ExistsOne(e, isNeutral.of(e, G, star))),
                GroupTheory.identityUniqueness.sequent());
    }

    @Test
    void testIdentityIsConditional() {
        assertThat(identity.description(), instanceOf(ConditionalDescription.class));
        ConditionalDescription description = (ConditionalDescription) identity.description();

        assertEquals(group.of(G, star), description.premise());
        assertEquals(emptySet, description.defaultValue());
        assertTrue(identity.definition().left().isEmpty());
        assertTrue(description.justification().left().isEmpty());
    }

    @Test
    void testIdentityIsNeutral() {
        assertEquals(Sequent.assuming(group.of(G, star)).proves(isNeutral.of(identity.of(G, star), G, star)),
                GroupTheory.identityIsNeutral.sequent());
    }

    @Test
    void testInverseUniqueness() {
        assertEquals(Sequent.assuming(group.of(G, star), in(x, G)).proves(new ExistsOne(y, isInverse.of(y, x, G, star))),
                GroupTheory.inverseUniqueness.sequent());
    }

    @Test
    void testInversePremiseIsNormalized() {
        ConditionalDescription description = (ConditionalDescription) inverse.description();
        assertEquals(ConditionalDescriptions.normalizeAssumptions(Set.of(in(x, G), group.of(G, star))),
                description.premise());
    }

    @Test
    void testInverseCharacterization() {
        Sequent expected = Sequent.assuming(group.of(G, star), in(x, G))
                .proves(new Iff(new Equals(y, inverse.of(x, G, star)), isInverse.of(y, x, G, star)));
        assertEquals(expected, GroupTheory.inverseCharacterization.sequent());
        assertEquals(Sequent.assuming(group.of(G, star), in(x, G)).proves(isInverse.of(inverse.of(x, G, star), x, G, star)),
                GroupTheory.inverseIsInverse.sequent());
    }

    @Test
    void testInverseSymmetry() {
        Formula statement = new Forall(x, new Implies(in(x, G),
                new Implies(isInverse.of(y, x, G, star), isInverse.of(x, y, G, star))));
        assertEquals(Sequent.assuming(group.of(G, star)).proves(statement), GroupTheory.inverseSymmetry.sequent());
    }

    @Test
    void testInverseIsInvolutive() {
        Term twice = inverse.of(inverse.of(x, G, star), G, star);
        Formula statement = new Forall(x, new Implies(in(x, G), new Equals(twice, x)));
        assertEquals(Sequent.assuming(group.of(G, star)).proves(statement), GroupTheory.inverseIsInvolutive.sequent());
    }

    @Test
    void testOperation() {
        assertEquals(Sequent.assuming(group.of(G, star)).proves(functional(star)),
                GroupTheory.groupOperationIsFunctional.sequent());
        assertEquals(Sequent.assuming(group.of(G, star)).proves(new Equals(cartesianProduct(G, G), relationDomain(star))),
                GroupTheory.groupOperationDomain.sequent());
        assertEquals(Sequent.assuming(group.of(G, star), in(x, G), in(y, G)).proves(in(pair(x, y), relationDomain(star))),
                GroupTheory.groupPairInOperationDomain.sequent());
    }

    @Test
    void testSubgroupOperation() {
        Term restricted = restrictedFunction(star, cartesianProduct(H, H));
        Sequent context = Sequent.assuming(subgroup.of(H, G, star), in(x, H), in(y, H));

        assertEquals(context.proves(in(pair(x, y), relationDomain(star))),
                GroupTheory.subgroupPairInParentOperationDomain.sequent());
        assertEquals(context.proves(new Equals(op(x, restricted, y), op(x, star, y))),
                GroupTheory.subgroupOperation.sequent());
    }

    @Test
    void testLibrary() {
        Library library = GroupTheory.library();
        assertEquals(14, library.size());
        assertThat(library.names(), containsInRelativeOrder("identityUniqueness", "identityDefinition",
                "inverseUniqueness", "inverseIsInvolutive", "subgroupOperation"));
        for (Theorem theorem : library.asMap().values()) {
            assertEquals(1, theorem.right().size(), theorem::toString);
        }
    }

    @Test
    void testDerivationsBottomOutInAxiomsAndDefinitions() {
        assertLeaves(GroupTheory.subgroupOperation);
        assertLeaves(GroupTheory.inverseIsInvolutive);
    }

    private static void assertLeaves(Theorem theorem) {
        assertLeaves(theorem, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static void assertLeaves(Theorem theorem, Set<Theorem> seen) {
        if (!seen.add(theorem)) return;
        if (theorem.premises().isEmpty()) {
            String rule = theorem.rule();
            assertTrue(rule.startsWith("Axiom") || rule.startsWith("Definition") || Set.of("Hypothesis", "RightRefl",
                    "EqualityTransitivity", "SubstitutionInUniquenessQuantifier", "Tautology").contains(rule), rule);
            return;
        }
        for (Theorem premise : theorem.premises()) {
            assertLeaves(premise, seen);
        }
    }
}
