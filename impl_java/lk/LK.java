package lk;

import java.util.List;

/**
 * A node of an LK derivation: the rule applied, the derivations of its premises and its own conclusion.
 * Trees are built bottom-up, premises first. Equal subtrees may be reused in both branches of a binary rule.
 */
public record LK(Rule rule, List<LK> premises, Sequent conclusion) {
    public LK {
        if (rule == null || conclusion == null) throw new IllegalArgumentException("Rule and conclusion are required");
        premises = List.copyOf(premises);
        if (premises.size() != rule.premiseCount()) {
            throw new IllegalArgumentException(rule + " takes " + rule.premiseCount() + " premises, got " + premises.size());
        }
    }

    public static LK axiom(Sequent conclusion) {
        return new LK(Rule.AXIOM, List.of(), conclusion);
    }

    public static LK of(Rule rule, LK premise, Sequent conclusion) {
        return new LK(rule, List.of(premise), conclusion);
    }

    public static LK of(Rule rule, LK left, LK right, Sequent conclusion) {
        return new LK(rule, List.of(left, right), conclusion);
    }

    public LK premise() {
        if (premises.size() != 1) throw new IllegalStateException(rule + " does not have a single premise");
        return premises.get(0);
    }

    public LK left() {
        if (premises.size() != 2) throw new IllegalStateException(rule + " does not have two premises");
        return premises.get(0);
    }

    public LK right() {
        if (premises.size() != 2) throw new IllegalStateException(rule + " does not have two premises");
        return premises.get(1);
    }

    /**
     * Checks only the inference at this node against the conclusions of its immediate premises.
     * Use {@link ProofChecker#check(LK)} to check every node of the derivation.
     *
     * @throws IllegalStateException if the rule needs a principal formula on a side that is empty
     */
    public boolean isValidStep() {
        return rule.check().isValid(premises.stream().map(LK::conclusion).toList(), conclusion);
    }

    @Override
    public String toString() {
        return rule.label() + " " + conclusion;
    }
}
