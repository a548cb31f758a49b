package lk.rules;

import lk.Sequent;

/**
 * From {@code Γ ⇒ Δ, φ} and {@code φ, Π ⇒ Σ} infer {@code Γ, Π ⇒ Δ, Σ}. The remaining contexts are
 * concatenated in order, without reordering or contraction.
 */
public class Cut extends BinaryRule {

    @Override
    boolean isValid(Sequent left, Sequent right, Sequent conclusion) {
        if (!left.sucLast().equals(right.antFirst())) return false;
        return conclusion.antecedent().equals(concat(left.antecedent(), right.antButFirst()))
                && conclusion.succedent().equals(concat(left.sucButLast(), right.succedent()));
    }
}
