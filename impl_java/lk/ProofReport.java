package lk;

import java.util.List;

/**
 * Outcome of checking every node of a derivation.
 *
 * @param checkedSteps number of nodes examined
 * @param failures the rejected nodes, in pre-order
 */
public record ProofReport(int checkedSteps, List<Failure> failures) {
    public ProofReport {
        failures = List.copyOf(failures);
    }

    public boolean isValid() {
        return failures.isEmpty();
    }

    /**
     * A rejected node.
     *
     * @param path premise indices leading from the root to the node, empty for the root itself
     * @param node the offending node
     */
    public record Failure(List<Integer> path, LK node) {
        public Failure {
            path = List.copyOf(path);
        }

        @Override
        public String toString() {
            return "at " + path + ": " + node.rule().label() + " " + node.conclusion();
        }
    }

    @Override
    public String toString() {
        if (isValid()) return "valid (" + checkedSteps + " steps)";
        return "invalid (" + failures.size() + " of " + checkedSteps + " steps rejected) " + failures;
    }
}
