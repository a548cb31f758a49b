package lk.rules;

import fol.formula.Formula;
import lk.Sequent;

import java.util.List;

/**
 * Swaps two adjacent formulas on one side of the sequent.
 */
public class Exchange extends UnaryRule {
    private final Side side;

    public Exchange(Side side) {
        this.side = side;
    }

    @Override
    boolean isValid(Sequent premise, Sequent conclusion) {
        if (side == Side.LEFT) {
            return premise.succedent().equals(conclusion.succedent())
                    && isAdjacentSwap(premise.antecedent(), conclusion.antecedent());
        }
        return premise.antecedent().equals(conclusion.antecedent())
                && isAdjacentSwap(premise.succedent(), conclusion.succedent());
    }

    static boolean isAdjacentSwap(List<Formula> before, List<Formula> after) {
        if (before.size() != after.size()) return false;
        for (int i = 0; i + 1 < before.size(); i++) {
            if (before.subList(0, i).equals(after.subList(0, i))
                    && before.subList(i + 2, before.size()).equals(after.subList(i + 2, after.size()))
                    && before.get(i).equals(after.get(i + 1))
                    && before.get(i + 1).equals(after.get(i))) {
                return true;
            }
        }
        return false;
    }
}
