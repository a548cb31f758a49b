package lk.rules;

import fol.formula.Implies;
import lk.Sequent;

/**
 * From {@code Γ ⇒ Δ, φ} and {@code ψ, Π ⇒ Σ} infer {@code φ → ψ, Γ, Π ⇒ Δ, Σ}.
 */
public class ImpliesLeft extends BinaryRule {

    @Override
    boolean isValid(Sequent left, Sequent right, Sequent conclusion) {
        if (!(conclusion.antFirst() instanceof Implies implies)) return false;
        return implies.left().equals(left.sucLast())
                && implies.right().equals(right.antFirst())
                && conclusion.antButFirst().equals(concat(left.antecedent(), right.antButFirst()))
                && conclusion.succedent().equals(concat(left.sucButLast(), right.succedent()));
    }
}
