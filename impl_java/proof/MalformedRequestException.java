package proof;

/**
 * A definition or description request that is rejected before any proof step is attempted.
 */
public class MalformedRequestException extends ProofException {
    private final String component;

    public MalformedRequestException(String component, String detail) {
        super("Malformed " + component + ": " + detail);
        this.component = component;
    }

    /**
     * Name of the mismatched part of the request, e.g. {@code "default"} or {@code "justification"}.
     */
    public String getComponent() {
        return component;
    }
}
