package lk.rules;

import fol.formula.Formula;
import lk.Sequent;

import java.util.ArrayList;
import java.util.List;

abstract class BinaryRule implements InferenceRule {

    @Override
    public final boolean isValid(List<Sequent> premises, Sequent conclusion) {
        if (premises.size() != 2) throw new IllegalArgumentException("Expected two premises, got " + premises.size());
        return isValid(premises.get(0), premises.get(1), conclusion);
    }

    abstract boolean isValid(Sequent left, Sequent right, Sequent conclusion);

    static List<Formula> concat(List<Formula> first, List<Formula> second) {
        List<Formula> out = new ArrayList<>(first);
        out.addAll(second);
        return out;
    }
}
