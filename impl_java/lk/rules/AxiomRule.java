package lk.rules;

import fol.formula.Equals;
import fol.formula.Formula;
import lk.Sequent;

import java.util.List;

/**
 * Identity {@code Γ ⇒ Γ} with Γ non-empty, or reflexivity of equality {@code ⇒ t = t}.
 */
public class AxiomRule implements InferenceRule {

    @Override
    public boolean isValid(List<Sequent> premises, Sequent conclusion) {
        if (!premises.isEmpty()) throw new IllegalArgumentException("An axiom has no premises");
        List<Formula> ant = conclusion.antecedent();
        List<Formula> suc = conclusion.succedent();
        if (!ant.isEmpty() && ant.equals(suc)) return true;
        return ant.isEmpty()
                && suc.size() == 1
                && suc.get(0) instanceof Equals eq
                && eq.isReflexive();
    }
}
