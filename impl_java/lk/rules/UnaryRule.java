package lk.rules;

import lk.Sequent;

import java.util.List;

abstract class UnaryRule implements InferenceRule {

    @Override
    public final boolean isValid(List<Sequent> premises, Sequent conclusion) {
        if (premises.size() != 1) throw new IllegalArgumentException("Expected one premise, got " + premises.size());
        return isValid(premises.get(0), conclusion);
    }

    abstract boolean isValid(Sequent premise, Sequent conclusion);
}
