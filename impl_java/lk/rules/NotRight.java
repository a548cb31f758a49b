package lk.rules;

import fol.formula.Not;
import lk.Sequent;

/**
 * From {@code φ, Γ ⇒ Δ} infer {@code Γ ⇒ Δ, ¬φ}.
 */
public class NotRight extends UnaryRule {

    @Override
    boolean isValid(Sequent premise, Sequent conclusion) {
        if (!(conclusion.sucLast() instanceof Not not)) return false;
        return not.formula().equals(premise.antFirst())
                && premise.antButFirst().equals(conclusion.antecedent())
                && premise.succedent().equals(conclusion.sucButLast());
    }
}
