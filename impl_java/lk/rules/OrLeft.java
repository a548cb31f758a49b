package lk.rules;

import fol.formula.Or;
import lk.Sequent;

/**
 * From {@code φ, Γ ⇒ Δ} and {@code ψ, Γ ⇒ Δ} infer {@code φ ∨ ψ, Γ ⇒ Δ}.
 */
public class OrLeft extends BinaryRule {

    @Override
    boolean isValid(Sequent left, Sequent right, Sequent conclusion) {
        if (!(conclusion.antFirst() instanceof Or or)) return false;
        return left.succedent().equals(conclusion.succedent())
                && right.succedent().equals(conclusion.succedent())
                && left.antButFirst().equals(conclusion.antButFirst())
                && right.antButFirst().equals(conclusion.antButFirst())
                && left.antFirst().equals(or.left())
                && right.antFirst().equals(or.right());
    }
}
