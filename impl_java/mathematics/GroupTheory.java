package mathematics;

import fol.Substitution;
import fol.formula.And;
import fol.formula.Equals;
import fol.formula.Exists;
import fol.formula.Forall;
import fol.formula.Formula;
import fol.formula.Iff;
import fol.formula.Implies;
import fol.term.Term;
import fol.term.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import proof.Definitions;
import proof.FunctionDefinition;
import proof.Library;
import proof.PredicateDefinition;
import proof.Rules;
import proof.Sequent;
import proof.Theorem;
import settheory.SetTheory;

import java.util.List;
import java.util.Map;

import static proof.Tactics.chainEqualities;
import static proof.Tactics.instantiateGuarded;
import static proof.Tactics.restate;
import static settheory.SetTheory.app;
import static settheory.SetTheory.cartesianProduct;
import static settheory.SetTheory.functionFrom;
import static settheory.SetTheory.functional;
import static settheory.SetTheory.in;
import static settheory.SetTheory.pair;
import static settheory.SetTheory.relationDomain;
import static settheory.SetTheory.restrictedFunction;
import static settheory.SetTheory.subset;

/**
 * Groups as a carrier {@code G} with a binary operation {@code *}, given by its graph. The identity and the
 * inverse are only unique in a group, so both are introduced as conditional descriptions and denote the empty set
 * outside groups.
 */
public final class GroupTheory {
    private static final Logger LOGGER = LoggerFactory.getLogger(GroupTheory.class);

    private static final Variable G = new Variable("G");
    private static final Variable H = new Variable("H");
    private static final Variable star = new Variable("*");
    private static final Variable e = new Variable("e");
    private static final Variable f = new Variable("f");
    private static final Variable x = new Variable("x");
    private static final Variable y = new Variable("y");
    private static final Variable z = new Variable("z");

    /**
     * {@code x * y}
     */
    public static Term op(Term x, Term star, Term y) {
        return app(star, pair(x, y));
    }

    private static Formula eq(Term left, Term right) {
        return new Equals(left, right);
    }

    // Definitions

    public static final PredicateDefinition binaryFunction = Definitions.predicate("binaryFunction", List.of(G, star),
            functionFrom(star, cartesianProduct(G, G), G));

    public static final PredicateDefinition associativity = Definitions.predicate("associativity", List.of(G, star),
            new Forall(x, new Implies(in(x, G), new Forall(y, new Implies(in(y, G), new Forall(z, new Implies(in(z, G),
                    eq(op(op(x, star, y), star, z), op(x, star, op(y, star, z))))))))));

    public static final PredicateDefinition isNeutral = Definitions.predicate("isNeutral", List.of(e, G, star),
            new And(in(e, G), new Forall(x, new Implies(in(x, G),
                    new And(eq(op(e, star, x), x), eq(op(x, star, e), x))))));

    public static final PredicateDefinition identityExistence = Definitions.predicate("identityExistence",
            List.of(G, star), new Exists(e, isNeutral.of(e, G, star)));

    public static final PredicateDefinition isInverse = Definitions.predicate("isInverse", List.of(y, x, G, star),
            new And(new And(in(y, G), isNeutral.of(op(x, star, y), G, star)), isNeutral.of(op(y, star, x), G, star)));

    public static final PredicateDefinition inverseExistence = Definitions.predicate("inverseExistence",
            List.of(G, star), new Forall(x, new Implies(in(x, G), new Exists(y, isInverse.of(y, x, G, star)))));

    public static final PredicateDefinition group = Definitions.predicate("group", List.of(G, star),
            new And(new And(new And(binaryFunction.of(G, star), associativity.of(G, star)),
                    identityExistence.of(G, star)), inverseExistence.of(G, star)));

    public static final PredicateDefinition subgroup = Definitions.predicate("subgroup", List.of(H, G, star),
            new And(new And(group.of(G, star), subset(H, G)),
                    group.of(H, restrictedFunction(star, cartesianProduct(H, H)))));

    // Identity

    /**
     * {@code group(G, *) ⊢ ∃!e. isNeutral(e, G, *)}
     */
    public static final Theorem identityUniqueness = identityUniqueness();

    /**
     * The neutral element of a group, the empty set otherwise.
     */
    public static final FunctionDefinition identity = Definitions.function("identity", List.of(G, star),
            ConditionalDescriptions.theConditional(e, isNeutral.of(e, G, star), identityUniqueness));

    /**
     * {@code group(G, *) ⊢ isNeutral(identity(G, *), G, *)}
     */
    public static final Theorem identityIsNeutral = satisfiesDefinition(identity,
            Sequent.assuming(group.of(G, star)), isNeutral.of(identity.of(G, star), G, star), G, star);

    // Inverse

    /**
     * {@code group(G, *), x ∈ G ⊢ ∃!y. isInverse(y, x, G, *)}
     */
    public static final Theorem inverseUniqueness = inverseUniqueness();

    /**
     * The inverse of {@code x} in a group containing it, the empty set otherwise.
     */
    public static final FunctionDefinition inverse = Definitions.function("inverse", List.of(x, G, star),
            ConditionalDescriptions.theConditional(y, isInverse.of(y, x, G, star), inverseUniqueness));

    /**
     * {@code group(G, *), x ∈ G ⊢ isInverse(inverse(x, G, *), x, G, *)}
     */
    public static final Theorem inverseIsInverse = satisfiesDefinition(inverse,
            Sequent.assuming(group.of(G, star), in(x, G)), isInverse.of(inverse.of(x, G, star), x, G, star),
            x, G, star);

    /**
     * {@code group(G, *), x ∈ G ⊢ (y = inverse(x, G, *)) ⇔ isInverse(y, x, G, *)}
     */
    public static final Theorem inverseCharacterization = restate(
            Rules.instantiateForall(inverse.definition(x, G, star), y),
            Sequent.assuming(group.of(G, star), in(x, G))
                    .proves(new Iff(eq(y, inverse.of(x, G, star)), isInverse.of(y, x, G, star))));

    /**
     * {@code group(G, *) ⊢ ∀x. (x ∈ G ⇒ (isInverse(y, x, G, *) ⇒ isInverse(x, y, G, *)))}
     */
    public static final Theorem inverseSymmetry = inverseSymmetry();

    /**
     * {@code group(G, *) ⊢ ∀x. (x ∈ G ⇒ inverse(inverse(x, G, *), G, *) = x)}
     */
    public static final Theorem inverseIsInvolutive = inverseIsInvolutive();

    // The operation

    /**
     * {@code group(G, *) ⊢ functional(*)}
     */
    public static final Theorem groupOperationIsFunctional = Rules.tautology(
            Sequent.assuming(group.of(G, star)).proves(functional(star)),
            groupComponent(binaryFunction), binaryFunction.definition(G, star),
            SetTheory.functionFromImpliesFunctional(star, cartesianProduct(G, G), G));

    /**
     * {@code group(G, *) ⊢ relationDomain(*) = G × G}
     */
    public static final Theorem groupOperationDomain = Rules.tautology(
            Sequent.assuming(group.of(G, star)).proves(eq(relationDomain(star), cartesianProduct(G, G))),
            groupComponent(binaryFunction), binaryFunction.definition(G, star),
            SetTheory.functionFromImpliesDomainEq(star, cartesianProduct(G, G), G));

    /**
     * {@code group(G, *), x ∈ G, y ∈ G ⊢ pair(x, y) ∈ relationDomain(*)}
     */
    public static final Theorem groupPairInOperationDomain = groupPairInOperationDomain();

    // Subgroups

    /**
     * {@code subgroup(H, G, *), x ∈ H, y ∈ H ⊢ pair(x, y) ∈ relationDomain(*)}
     */
    public static final Theorem subgroupPairInParentOperationDomain = subgroupPairInParentOperationDomain();

    /**
     * {@code subgroup(H, G, *), x ∈ H, y ∈ H ⊢ x ★ y = x * y} where {@code ★} is {@code *} restricted to
     * {@code H × H}.
     */
    public static final Theorem subgroupOperation = subgroupOperation();

    private static Theorem identityUniqueness() {
        Formula isGroup = group.of(G, star);
        Theorem existence = Rules.tautology(Sequent.assuming(isGroup).proves(new Exists(e, isNeutral.of(e, G, star))),
                groupComponent(identityExistence), identityExistence.definition(G, star));

        // e = e * f = f
        Term ef = op(e, star, f);
        Theorem uniqueness = chainEqualities(List.of(isNeutral.of(e, G, star), isNeutral.of(f, G, star)),
                List.of(e, ef, f),
                neutralLaw(e, f), neutralLaw(f, e), conjunct(isNeutral, 0, e, G, star), conjunct(isNeutral, 0, f, G, star));

        return Rules.existenceAndUniqueness(isNeutral.of(e, G, star), e, existence, uniqueness);
    }

    private static Theorem inverseUniqueness() {
        Formula isGroup = group.of(G, star);
        Theorem existence = instantiateGuarded(
                Rules.cut(groupComponent(inverseExistence), conjunct(inverseExistence, 0, G, star)), x);

        // y = y * (x * z) = (y * x) * z = z
        Term yx = op(y, star, x);
        Term xz = op(x, star, z);
        Theorem uniqueness = chainEqualities(
                List.of(isGroup, in(x, G), isInverse.of(y, x, G, star), isInverse.of(z, x, G, star)),
                List.of(y, op(y, star, xz), op(yx, star, z), z),
                neutralLaw(xz, y), associativityAt(y, x, z), neutralLaw(yx, z),
                conjunct(isInverse, 0, y, x, G, star), conjunct(isInverse, 2, y, x, G, star),
                conjunct(isInverse, 0, z, x, G, star), conjunct(isInverse, 1, z, x, G, star));

        return Rules.existenceAndUniqueness(isInverse.of(y, x, G, star), y, existence, uniqueness);
    }

    private static Theorem inverseSymmetry() {
        Formula statement = new Implies(in(x, G), new Implies(isInverse.of(y, x, G, star), isInverse.of(x, y, G, star)));
        Theorem symmetric = Rules.tautology(Sequent.proving(statement),
                isInverse.definition(y, x, G, star), isInverse.definition(x, y, G, star));
        Theorem inGroup = Rules.weaken(symmetric, Sequent.assuming(group.of(G, star)).proves(statement));
        return Rules.rightForall(inGroup, x);
    }

    private static Theorem inverseIsInvolutive() {
        Formula isGroup = group.of(G, star);
        Term inv = inverse.of(x, G, star);
        Term invInv = inverse.of(inv, G, star);

        // x is an inverse of its inverse, and inverses are unique
        Theorem symmetric = Rules.instantiateForall(Rules.instantiate(inverseSymmetry, Substitution.of(y, inv)), x);
        Theorem characterization = inverseCharacterization.of(Map.of(x, inv, y, x));
        Theorem involution = Rules.tautology(Sequent.assuming(isGroup, in(x, G)).proves(eq(invInv, x)),
                inverseIsInverse, symmetric, isInverse.definition(inv, x, G, star), characterization);

        Theorem guarded = restate(involution, Sequent.assuming(isGroup).proves(new Implies(in(x, G), eq(invInv, x))));
        return Rules.rightForall(guarded, x);
    }

    private static Theorem groupPairInOperationDomain() {
        Variable hole = new Variable("d");
        Term p = pair(x, y);
        Theorem inProduct = restate(SetTheory.pairInCartesianProduct(x, y, G, G),
                Sequent.assuming(in(x, G), in(y, G)).proves(in(p, cartesianProduct(G, G))));
        Theorem inDomain = Rules.rightSubstEq(inProduct, cartesianProduct(G, G), relationDomain(star), hole, in(p, hole));
        return Rules.cut(groupOperationDomain, inDomain);
    }

    private static Theorem subgroupPairInParentOperationDomain() {
        Theorem inclusion = restate(SetTheory.subsetAxiom(H, G),
                Sequent.assuming(subset(H, G)).proves(new Forall(z, new Implies(in(z, H), in(z, G)))));
        return Rules.tautology(
                Sequent.assuming(subgroup.of(H, G, star), in(x, H), in(y, H)).proves(in(pair(x, y), relationDomain(star))),
                conjunct(subgroup, 0, H, G, star), conjunct(subgroup, 1, H, G, star),
                instantiateGuarded(inclusion, x), instantiateGuarded(inclusion, y), groupPairInOperationDomain);
    }

    private static Theorem subgroupOperation() {
        Term product = cartesianProduct(H, H);
        Term restricted = restrictedFunction(star, product);
        Term p = pair(x, y);
        Term r = op(x, star, y);
        Term edge = pair(p, r);
        Sequent context = Sequent.assuming(subgroup.of(H, G, star), in(x, H), in(y, H));
        Map<Variable, Term> toSubgroup = Map.of(G, H, star, restricted);

        // r is the value of * at p
        Theorem inParent = Rules.tautology(context.proves(in(edge, star)),
                Rules.instantiateForall(SetTheory.applicationDefinition(star, p), r), Rules.rightRefl(r),
                conjunct(subgroup, 0, H, G, star), groupOperationIsFunctional, subgroupPairInParentOperationDomain);

        // p has its first component in H × H, so the edge survives the restriction
        Variable a = new Variable("a");
        Variable b = new Variable("b");
        Theorem witness = Rules.tautology(Sequent.assuming(in(x, H), in(y, H)).proves(new And(in(p, product), eq(edge, edge))),
                SetTheory.pairInCartesianProduct(x, y, H, H), Rules.rightRefl(edge));
        Theorem inner = Rules.rightExists(witness, new Exists(b, new And(in(p, product), eq(edge, pair(p, b)))), r);
        Theorem decomposed = Rules.rightExists(inner,
                new Exists(a, new Exists(b, new And(in(a, product), eq(edge, pair(a, b))))), p);
        Theorem inRestricted = Rules.tautology(context.proves(in(edge, restricted)),
                Rules.instantiateForall(SetTheory.restrictedFunctionAxiom(star, product), edge), inParent, decomposed);

        // so r is also the value of the restriction at p
        return Rules.tautology(context.proves(eq(op(x, restricted, y), r)),
                Rules.instantiateForall(SetTheory.applicationDefinition(restricted, p), r),
                conjunct(subgroup, 2, H, G, star), groupOperationIsFunctional.of(toSubgroup),
                groupPairInOperationDomain.of(toSubgroup), inRestricted);
    }

    /**
     * {@code group(G, *) ⊢ P(G, *)} for one of the components of the group definition.
     */
    private static Theorem groupComponent(PredicateDefinition component) {
        return restate(group.definition(G, star),
                Sequent.assuming(group.of(G, star)).proves(component.of(G, star)));
    }

    /**
     * {@code P(args) ⊢ c} where {@code c} is the conjunct at {@code index} of the unfolded body of {@code P}.
     */
    private static Theorem conjunct(PredicateDefinition definition, int index, Term... args) {
        Formula part = And.conjuncts(definition.unfold(args)).get(index);
        return restate(definition.definition(args), Sequent.assuming(definition.of(args)).proves(part));
    }

    /**
     * {@code isNeutral(n, G, *), t ∈ G ⊢ n * t = t ∧ t * n = t}
     */
    private static Theorem neutralLaw(Term n, Term t) {
        return instantiateGuarded(conjunct(isNeutral, 1, n, G, star), t);
    }

    /**
     * {@code group(G, *), a ∈ G, b ∈ G, c ∈ G ⊢ (a * b) * c = a * (b * c)}
     */
    private static Theorem associativityAt(Term a, Term b, Term c) {
        Theorem law = Rules.cut(groupComponent(associativity), conjunct(associativity, 0, G, star));
        return instantiateGuarded(instantiateGuarded(instantiateGuarded(law, a), b), c);
    }

    /**
     * The value of a conditional description satisfies the partial formula where the premise holds:
     * {@code context ⊢ goal}, from {@code ⊢ (v = v) ⇔ completeDef(v)} at the value {@code v = def(args)}.
     */
    private static Theorem satisfiesDefinition(FunctionDefinition definition, Sequent context, Formula goal,
                                               Term... args) {
        Term value = definition.of(args);
        return Rules.tautology(context.proves(goal),
                Rules.instantiateForall(definition.definition(args), value), Rules.rightRefl(value));
    }

    /**
     * Every theorem of the development, in dependency order.
     */
    public static Library library() {
        Library library = Library.empty()
                .with("identityUniqueness", identityUniqueness)
                .with("identityDefinition", identity.definition())
                .with("identityIsNeutral", identityIsNeutral)
                .with("inverseUniqueness", inverseUniqueness)
                .with("inverseDefinition", inverse.definition())
                .with("inverseIsInverse", inverseIsInverse)
                .with("inverseCharacterization", inverseCharacterization)
                .with("inverseSymmetry", inverseSymmetry)
                .with("inverseIsInvolutive", inverseIsInvolutive)
                .with("groupOperationIsFunctional", groupOperationIsFunctional)
                .with("groupOperationDomain", groupOperationDomain)
                .with("groupPairInOperationDomain", groupPairInOperationDomain)
                .with("subgroupPairInParentOperationDomain", subgroupPairInParentOperationDomain)
                .with("subgroupOperation", subgroupOperation);
        LOGGER.debug("Group theory library has {} theorems", library.size());
        return library;
    }

    /**
     * The predicate definitions, each after the ones it refers to.
     */
    public static List<PredicateDefinition> predicateDefinitions() {
        return List.of(binaryFunction, associativity, isNeutral, identityExistence, isInverse, inverseExistence, group,
                subgroup);
    }

    public static List<FunctionDefinition> functionDefinitions() {
        return List.of(identity, inverse);
    }

    private GroupTheory() {
    }
}
