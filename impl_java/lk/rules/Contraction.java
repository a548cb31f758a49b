package lk.rules;

import fol.formula.Formula;
import lk.Sequent;

import java.util.List;

/**
 * Merges two equal formulas at the front of the antecedent, or at the back of the succedent, into one.
 * A premise side holding fewer than two formulas is malformed and raises {@link IllegalStateException}.
 */
public class Contraction extends UnaryRule {
    private final Side side;

    public Contraction(Side side) {
        this.side = side;
    }

    @Override
    boolean isValid(Sequent premise, Sequent conclusion) {
        if (side == Side.LEFT) {
            List<Formula> ant = premise.antecedent();
            if (ant.size() < 2) throw new IllegalStateException("Nothing to contract in antecedent of " + premise);
            return ant.get(0).equals(ant.get(1))
                    && premise.antButFirst().equals(conclusion.antecedent())
                    && premise.succedent().equals(conclusion.succedent());
        }
        List<Formula> suc = premise.succedent();
        if (suc.size() < 2) throw new IllegalStateException("Nothing to contract in succedent of " + premise);
        return suc.get(suc.size() - 2).equals(suc.get(suc.size() - 1))
                && premise.sucButLast().equals(conclusion.succedent())
                && premise.antecedent().equals(conclusion.antecedent());
    }
}
