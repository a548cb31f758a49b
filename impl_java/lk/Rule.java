package lk;

import lk.rules.AndLeft;
import lk.rules.AndRight;
import lk.rules.AxiomRule;
import lk.rules.Contraction;
import lk.rules.Cut;
import lk.rules.Exchange;
import lk.rules.ExistsLeft;
import lk.rules.ExistsRight;
import lk.rules.ForallLeft;
import lk.rules.ForallRight;
import lk.rules.ImpliesLeft;
import lk.rules.ImpliesRight;
import lk.rules.InferenceRule;
import lk.rules.NotLeft;
import lk.rules.NotRight;
import lk.rules.OrLeft;
import lk.rules.OrRight;
import lk.rules.Side;
import lk.rules.Weakening;

/**
 * The node kinds of an LK derivation: the axiom and the rules of the calculus.
 */
public enum Rule {
    AXIOM("(ax)", 0, new AxiomRule()),
    WEAKENING_LEFT("(wL)", 1, new Weakening(Side.LEFT)),
    WEAKENING_RIGHT("(wR)", 1, new Weakening(Side.RIGHT)),
    CONTRACTION_LEFT("(cL)", 1, new Contraction(Side.LEFT)),
    CONTRACTION_RIGHT("(cR)", 1, new Contraction(Side.RIGHT)),
    EXCHANGE_LEFT("(xL)", 1, new Exchange(Side.LEFT)),
    EXCHANGE_RIGHT("(xR)", 1, new Exchange(Side.RIGHT)),
    AND_LEFT_1("(∧L1)", 1, new AndLeft(true)),
    AND_LEFT_2("(∧L2)", 1, new AndLeft(false)),
    AND_RIGHT("(∧R)", 2, new AndRight()),
    OR_LEFT("(∨L)", 2, new OrLeft()),
    OR_RIGHT_1("(∨R1)", 1, new OrRight(true)),
    OR_RIGHT_2("(∨R2)", 1, new OrRight(false)),
    IMPLIES_LEFT("(→L)", 2, new ImpliesLeft()),
    IMPLIES_RIGHT("(→R)", 1, new ImpliesRight()),
    NOT_LEFT("(¬L)", 1, new NotLeft()),
    NOT_RIGHT("(¬R)", 1, new NotRight()),
    FORALL_LEFT("(∀L)", 1, new ForallLeft()),
    FORALL_RIGHT("(∀R)", 1, new ForallRight()),
    EXISTS_LEFT("(∃L)", 1, new ExistsLeft()),
    EXISTS_RIGHT("(∃R)", 1, new ExistsRight()),
    CUT("(Cut)", 2, new Cut());

    private final String label;
    private final int premiseCount;
    private final InferenceRule check;

    Rule(String label, int premiseCount, InferenceRule check) {
        this.label = label;
        this.premiseCount = premiseCount;
        this.check = check;
    }

    /**
     * @return the symbolic name printed next to the inference line, e.g. {@code (∧R)}
     */
    public String label() {
        return label;
    }

    public int premiseCount() {
        return premiseCount;
    }

    InferenceRule check() {
        return check;
    }
}
