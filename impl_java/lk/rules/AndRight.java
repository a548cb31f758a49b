package lk.rules;

import fol.formula.And;
import lk.Sequent;

/**
 * From {@code Γ ⇒ Δ, φ} and {@code Γ ⇒ Δ, ψ} infer {@code Γ ⇒ Δ, φ ∧ ψ}. Both premises must carry the
 * very same context.
 */
public class AndRight extends BinaryRule {

    @Override
    boolean isValid(Sequent left, Sequent right, Sequent conclusion) {
        if (!(conclusion.sucLast() instanceof And and)) return false;
        return left.antecedent().equals(conclusion.antecedent())
                && right.antecedent().equals(conclusion.antecedent())
                && left.sucButLast().equals(conclusion.sucButLast())
                && right.sucButLast().equals(conclusion.sucButLast())
                && left.sucLast().equals(and.left())
                && right.sucLast().equals(and.right());
    }
}
