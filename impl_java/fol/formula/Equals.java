package fol.formula;

import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

public class Equals extends Predicate {
    public static final PSymbol EQ_PRED_SYM = new PSymbol("=", 2);

    private final Term left;
    private final Term right;

    public Term left() {
        return left;
    }

    public Term right() {
        return right;
    }

    public Equals(Term left, Term right) {
        super(EQ_PRED_SYM, List.of(left, right));
        this.left = left;
        this.right = right;
    }

    /**
     * The side of the equation facing {@code side}, if {@code side} is one of its sides.
     */
    public Term otherSide(Term side) {
        if (left.equals(side)) return right;
        if (right.equals(side)) return left;
        return null;
    }

    @Override
    public String toString() {
        return left.toString() + " = " + right.toString();
    }

    @Override
    public Formula applySub(Substitution substitution) {
        return new Equals(left.applySub(substitution), right.applySub(substitution));
    }

    @Override
    public String getEqString(Map<Variable, String> bound) {
        // Sides are sorted so that a = b and b = a are the same formula
        return "=(" + String.join(", ", Stream.of(left.getEqString(bound), right.getEqString(bound)).sorted().toList()) + ")";
    }

    @Override
    public int hashCode() {
        return super.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        return super.equals(obj);
    }
}
