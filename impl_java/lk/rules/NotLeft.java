package lk.rules;

import fol.formula.Not;
import lk.Sequent;

/**
 * From {@code Γ ⇒ Δ, φ} infer {@code ¬φ, Γ ⇒ Δ}.
 */
public class NotLeft extends UnaryRule {

    @Override
    boolean isValid(Sequent premise, Sequent conclusion) {
        if (!(conclusion.antFirst() instanceof Not not)) return false;
        return not.formula().equals(premise.sucLast())
                && premise.antecedent().equals(conclusion.antButFirst())
                && premise.sucButLast().equals(conclusion.succedent());
    }
}
