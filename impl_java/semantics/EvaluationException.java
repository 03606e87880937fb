package semantics;

/**
 * A term or formula that has no value in a structure: an uninterpreted symbol, an unbound variable, or a
 * description that is not satisfied by exactly one element of the universe.
 */
public class EvaluationException extends RuntimeException {
    public EvaluationException(String message) {
        super(message);
    }
}
