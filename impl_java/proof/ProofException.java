package proof;

/**
 * Failure while constructing a proof. Proof construction is deterministic, so these are never retried.
 */
public abstract class ProofException extends RuntimeException {
    protected ProofException(String message) {
        super(message);
    }
}
