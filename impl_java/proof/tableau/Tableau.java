package proof.tableau;

import fol.formula.Formula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import proof.StepRejectedException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Propositional tableau. Atoms, equalities and quantified formulas are opaque and compared up to
 * alpha-equivalence; a branch closes when it contains a formula and its negation, {@code ¬true} or
 * {@code ¬(t = t)}.
 */
public class Tableau {
    private static final Logger LOGGER = LoggerFactory.getLogger(Tableau.class);

    public static final String MAX_BRANCHES_PROPERTY = "proof.tableau.maxBranches";
    public static final int DEFAULT_MAX_BRANCHES = 100_000;

    private final List<TableauRule> rulesBranching;
    private final List<TableauRule> rulesNonBranching;
    private final int maxBranches;

    public Tableau(List<TableauRule> rules, int maxBranches) {
        rulesBranching = rules.stream().filter(TableauRule::isBranching).toList();
        rulesNonBranching = rules.stream().filter(rule -> !rule.isBranching()).toList();
        this.maxBranches = Math.max(1, maxBranches);
    }

    public Tableau() {
        this(getDefaultRules(), Integer.getInteger(MAX_BRANCHES_PROPERTY, DEFAULT_MAX_BRANCHES));
    }

    private static List<TableauRule> getDefaultRules() {
        return List.of(new AndElim(), new NotElim(), new OrElim(), new IffElim());
    }

    /**
     * Whether the formulas are jointly unsatisfiable.
     */
    public boolean refutes(Collection<? extends Formula> formulas) {
        return findOpenBranch(formulas).isEmpty();
    }

    /**
     * Expand the formulas depth first.
     *
     * @return a saturated branch that did not close, or empty if every branch closes
     * @throws StepRejectedException if more than the configured number of branches is explored
     */
    public Optional<Branch> findOpenBranch(Collection<? extends Formula> formulas) {
        Deque<Branch> searchTree = new ArrayDeque<>();
        searchTree.push(new Branch(formulas));
        int explored = 0;
        int closedBranches = 0;
        while (!searchTree.isEmpty()) {
            if (++explored > maxBranches) {
                throw new StepRejectedException("Tautology", "tableau exceeded " + maxBranches + " branches");
            }
            Branch branch = searchTree.pop();
            saturate(branch);
            if (branch.isClosed()) {
                closedBranches++;
                continue;
            }
            Optional<Split> maybeSplit = chooseSplit(branch);
            if (maybeSplit.isEmpty()) {
                LOGGER.trace("Open branch after {} steps: {}", explored, branch);
                return Optional.of(branch);
            }
            Split split = maybeSplit.get();
            branch.markExpanded(split.formula());
            if (split.alternatives().isEmpty()) {
                closedBranches++;
            } else if (split.alternatives().size() == 1) {
                branch.addFormulas(split.alternatives().get(0));
                searchTree.push(branch);
            } else {
                // Push in reverse so that the first alternative is explored first
                for (int i = split.alternatives().size() - 1; i >= 0; i--) {
                    Branch extension = branch.copy();
                    extension.addFormulas(split.alternatives().get(i));
                    searchTree.push(extension);
                }
            }
        }
        LOGGER.trace("Closed {} branches in {} steps", closedBranches, explored);
        return Optional.empty();
    }

    private void saturate(Branch branch) {
        for (boolean done = false; !done && !branch.isClosed(); ) {
            done = true;
            for (Formula formula : branch.getUnexpanded()) {
                for (TableauRule rule : rulesNonBranching) {
                    var expansion = rule.expand(formula);
                    if (expansion.isEmpty()) continue;
                    branch.markExpanded(formula);
                    branch.addFormulas(expansion.get().get(0));
                    done = false;
                    break;
                }
                if (branch.isClosed()) return;
            }
        }
    }

    /**
     * Pick the branching formula with the fewest alternatives that do not close immediately.
     */
    private Optional<Split> chooseSplit(Branch branch) {
        Split best = null;
        for (Formula formula : branch.getUnexpanded()) {
            for (TableauRule rule : rulesBranching) {
                var expansion = rule.expand(formula);
                if (expansion.isEmpty()) continue;
                List<List<Formula>> surviving = new ArrayList<>();
                for (List<Formula> alternative : expansion.get()) {
                    if (!branch.contradictsAll(alternative)) surviving.add(alternative);
                }
                if (best == null || surviving.size() < best.alternatives().size()) {
                    best = new Split(formula, surviving);
                }
                if (surviving.size() <= 1) return Optional.of(best);
                break;
            }
        }
        return Optional.ofNullable(best);
    }

    private record Split(Formula formula, List<List<Formula>> alternatives) {}
}
