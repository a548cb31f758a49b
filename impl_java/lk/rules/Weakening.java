package lk.rules;

import lk.Sequent;

/**
 * Adds an arbitrary formula at the front of the antecedent or the back of the succedent.
 */
public class Weakening extends UnaryRule {
    private final Side side;

    public Weakening(Side side) {
        this.side = side;
    }

    @Override
    boolean isValid(Sequent premise, Sequent conclusion) {
        if (side == Side.LEFT) {
            return premise.antecedent().equals(conclusion.antButFirst())
                    && premise.succedent().equals(conclusion.succedent());
        }
        return premise.antecedent().equals(conclusion.antecedent())
                && premise.succedent().equals(conclusion.sucButLast());
    }
}
