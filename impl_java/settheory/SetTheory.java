package settheory;

import fol.formula.And;
import fol.formula.Equals;
import fol.formula.Exists;
import fol.formula.ExistsOne;
import fol.formula.Forall;
import fol.formula.Formula;
import fol.formula.Iff;
import fol.formula.Implies;
import fol.formula.PSymbol;
import fol.formula.Predicate;
import fol.term.Constant;
import fol.term.FSymbol;
import fol.term.Function;
import fol.term.Term;
import fol.term.Variable;
import mathematics.ConditionalDescriptions;
import proof.Axioms;
import proof.Definitions;
import proof.FunctionDefinition;
import proof.Library;
import proof.Sequent;
import proof.Signature;
import proof.Theorem;

import java.util.List;
import java.util.Map;

/**
 * The set-theoretic vocabulary the group theory is stated in. Axioms are schematic in their free variables; the
 * static accessors return instances.
 */
public final class SetTheory {
    private static final Variable x = new Variable("x");
    private static final Variable y = new Variable("y");
    private static final Variable z = new Variable("z");
    private static final Variable f = new Variable("f");
    private static final Variable a = new Variable("a");
    private static final Variable b = new Variable("b");
    private static final Variable d = new Variable("d");
    private static final Variable u = new Variable("u");

    public static final PSymbol inPSym = Signature.declare(new PSymbol("in", 2));
    public static final PSymbol subsetPSym = Signature.declare(new PSymbol("subset", 2));
    public static final PSymbol functionalPSym = Signature.declare(new PSymbol("functional", 1));
    public static final PSymbol functionFromPSym = Signature.declare(new PSymbol("functionFrom", 3));

    public static final FSymbol pairFSym = Signature.declare(new FSymbol("pair", 2));
    public static final FSymbol cartesianProductFSym = Signature.declare(new FSymbol("cartesianProduct", 2));
    public static final FSymbol relationDomainFSym = Signature.declare(new FSymbol("relationDomain", 1));
    public static final FSymbol restrictedFunctionFSym = Signature.declare(new FSymbol("restrictedFunction", 2));

    public static final Constant emptySet = Signature.declare(new Constant("∅"));

    public static Formula in(Term element, Term set) {
        return new Predicate(inPSym, element, set);
    }

    public static Formula subset(Term x, Term y) {
        return new Predicate(subsetPSym, x, y);
    }

    public static Formula functional(Term f) {
        return new Predicate(functionalPSym, f);
    }

    /**
     * {@code f} is a function with domain {@code x} and values in {@code y}.
     */
    public static Formula functionFrom(Term f, Term x, Term y) {
        return new Predicate(functionFromPSym, f, x, y);
    }

    public static Term pair(Term a, Term b) {
        return new Function(pairFSym, a, b);
    }

    public static Term cartesianProduct(Term x, Term y) {
        return new Function(cartesianProductFSym, x, y);
    }

    public static Term relationDomain(Term f) {
        return new Function(relationDomainFSym, f);
    }

    /**
     * The pairs of {@code f} whose first component is in {@code d}.
     */
    public static Term restrictedFunction(Term f, Term d) {
        return new Function(restrictedFunctionFSym, f, d);
    }

    private static final Theorem subsetAxiom = Axioms.axiom("subsetAxiom",
            new Iff(subset(x, y), new Forall(z, new Implies(in(z, x), in(z, y)))));

    private static final Theorem functionFromImpliesFunctional = Axioms.axiom("functionFromImpliesFunctional",
            Sequent.assuming(functionFrom(f, x, y)).proves(functional(f)));

    private static final Theorem functionFromImpliesDomainEq = Axioms.axiom("functionFromImpliesDomainEq",
            Sequent.assuming(functionFrom(f, x, y)).proves(new Equals(relationDomain(f), x)));

    private static final Theorem pairInCartesianProduct = Axioms.axiom("pairInCartesianProduct",
            new Iff(in(pair(a, b), cartesianProduct(x, y)), new And(in(a, x), in(b, y))));

    private static final Theorem functionApplicationUniqueness = Axioms.axiom("functionApplicationUniqueness",
            Sequent.assuming(functional(f), in(a, relationDomain(f))).proves(new ExistsOne(z, in(pair(a, z), f))));

    private static final Theorem restrictedFunctionAxiom = Axioms.axiom("restrictedFunctionAxiom",
            new Forall(u, new Iff(in(u, restrictedFunction(f, d)),
                    new And(in(u, f), new Exists(y, new Exists(z, new And(in(y, d), new Equals(u, pair(y, z)))))))));

    /**
     * {@code app(f, a)}: the value of {@code f} at {@code a}, the empty set when {@code f} is not functional or
     * {@code a} is outside its domain.
     */
    public static final FunctionDefinition application = Definitions.function("app", List.of(f, a),
            ConditionalDescriptions.theConditional(z, in(pair(a, z), f), functionApplicationUniqueness, emptySet));

    public static Term app(Term f, Term a) {
        return application.of(f, a);
    }

    /**
     * {@code ⊢ subset(x, y) ⇔ ∀z. (z ∈ x ⇒ z ∈ y)}
     */
    public static Theorem subsetAxiom(Term x, Term y) {
        return subsetAxiom.of(Map.of(SetTheory.x, x, SetTheory.y, y));
    }

    /**
     * {@code functionFrom(f, x, y) ⊢ functional(f)}
     */
    public static Theorem functionFromImpliesFunctional(Term f, Term x, Term y) {
        return functionFromImpliesFunctional.of(Map.of(SetTheory.f, f, SetTheory.x, x, SetTheory.y, y));
    }

    /**
     * {@code functionFrom(f, x, y) ⊢ relationDomain(f) = x}
     */
    public static Theorem functionFromImpliesDomainEq(Term f, Term x, Term y) {
        return functionFromImpliesDomainEq.of(Map.of(SetTheory.f, f, SetTheory.x, x, SetTheory.y, y));
    }

    /**
     * {@code ⊢ pair(a, b) ∈ x × y ⇔ (a ∈ x ∧ b ∈ y)}
     */
    public static Theorem pairInCartesianProduct(Term a, Term b, Term x, Term y) {
        return pairInCartesianProduct.of(Map.of(SetTheory.a, a, SetTheory.b, b, SetTheory.x, x, SetTheory.y, y));
    }

    /**
     * {@code functional(f), a ∈ relationDomain(f) ⊢ ∃!z. pair(a, z) ∈ f}
     */
    public static Theorem functionApplicationUniqueness(Term f, Term a) {
        return functionApplicationUniqueness.of(Map.of(SetTheory.f, f, SetTheory.a, a));
    }

    /**
     * {@code ⊢ ∀u. (u ∈ restrictedFunction(f, d) ⇔ (u ∈ f ∧ ∃y. ∃z. (y ∈ d ∧ u = pair(y, z))))}
     */
    public static Theorem restrictedFunctionAxiom(Term f, Term d) {
        return restrictedFunctionAxiom.of(Map.of(SetTheory.f, f, SetTheory.d, d));
    }

    /**
     * {@code ⊢ ∀z. (z = app(f, a)) ⇔ completeDef(z)}
     */
    public static Theorem applicationDefinition(Term f, Term a) {
        return application.definition(f, a);
    }

    /**
     * The axioms and the definition of {@code app}, with their schematic variables.
     */
    public static Library library() {
        return Library.empty()
                .with("subsetAxiom", subsetAxiom)
                .with("functionFromImpliesFunctional", functionFromImpliesFunctional)
                .with("functionFromImpliesDomainEq", functionFromImpliesDomainEq)
                .with("pairInCartesianProduct", pairInCartesianProduct)
                .with("functionApplicationUniqueness", functionApplicationUniqueness)
                .with("restrictedFunctionAxiom", restrictedFunctionAxiom)
                .with("applicationDefinition", application.definition());
    }

    private SetTheory() {
    }
}
