package proof;

/**
 * A rule was applied to premises that do not satisfy its side conditions.
 */
public class StepRejectedException extends ProofException {
    private final String rule;
    private final String condition;

    public StepRejectedException(String rule, String condition) {
        super(rule + ": " + condition);
        this.rule = rule;
        this.condition = condition;
    }

    public String getRule() {
        return rule;
    }

    public String getCondition() {
        return condition;
    }
}
