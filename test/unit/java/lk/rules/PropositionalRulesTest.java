package lk.rules;

import lk.LK;
import lk.Rule;
import org.junit.Test;

import static lk.Formulas.axiom;
import static lk.Formulas.sequent;
import static lk.Formulas.step;
import static org.junit.Assert.*;

public class PropositionalRulesTest {

    @Test
    public void testAndLeft() {
        assertTrue(step(Rule.AND_LEFT_1, "p, r => s", "(^ p q), r => s").isValidStep());
        assertTrue(step(Rule.AND_LEFT_2, "q, r => s", "(^ p q), r => s").isValidStep());
        assertFalse(step(Rule.AND_LEFT_1, "q, r => s", "(^ p q), r => s").isValidStep());
        assertFalse(step(Rule.AND_LEFT_2, "p, r => s", "(^ p q), r => s").isValidStep());
        assertFalse(step(Rule.AND_LEFT_1, "p, r => s", "(v p q), r => s").isValidStep());
        assertFalse(step(Rule.AND_LEFT_1, "p, r => s", "(^ p q), r => t").isValidStep());
        assertFalse(step(Rule.AND_LEFT_1, "p, r => s", "(^ p q) => s").isValidStep());
    }

    @Test
    public void testAndRightSharesContext() {
        LK valid = step(Rule.AND_RIGHT, "p => p", "p => q", "p => (^ p q)");
        assertTrue(valid.isValidStep());
        assertFalse(step(Rule.AND_RIGHT, "p => p", "r => q", "p => (^ p q)").isValidStep());
        assertFalse(step(Rule.AND_RIGHT, "r => p", "p => q", "p => (^ p q)").isValidStep());
        assertFalse(step(Rule.AND_RIGHT, "p => q", "p => p", "p => (^ p q)").isValidStep());
    }

    @Test
    public void testAndRightContextIsNotMerged() {
        // both premises must carry the whole context, a split context is rejected
        assertTrue(step(Rule.AND_RIGHT, "a, b => c, p", "a, b => c, q", "a, b => c, (^ p q)").isValidStep());
        assertFalse(step(Rule.AND_RIGHT, "a => c, p", "b => c, q", "a, b => c, (^ p q)").isValidStep());
        assertFalse(step(Rule.AND_RIGHT, "a, b => p", "a, b => c, q", "a, b => c, (^ p q)").isValidStep());
    }

    @Test
    public void testOrLeft() {
        assertTrue(step(Rule.OR_LEFT, "p, a => r", "q, a => r", "(v p q), a => r").isValidStep());
        assertFalse(step(Rule.OR_LEFT, "p, a => r", "q, a => r", "(v q p), a => r").isValidStep());
        assertFalse(step(Rule.OR_LEFT, "p, a => r", "q, b => r", "(v p q), a => r").isValidStep());
        assertFalse(step(Rule.OR_LEFT, "p, a => r", "q, a => s", "(v p q), a => r").isValidStep());
    }

    @Test
    public void testOrRight() {
        assertTrue(step(Rule.OR_RIGHT_1, "r => s, p", "r => s, (v p q)").isValidStep());
        assertTrue(step(Rule.OR_RIGHT_2, "r => s, q", "r => s, (v p q)").isValidStep());
        assertFalse(step(Rule.OR_RIGHT_1, "r => s, q", "r => s, (v p q)").isValidStep());
        assertFalse(step(Rule.OR_RIGHT_2, "r => s, q", "r => (v p q)").isValidStep());
        assertFalse(step(Rule.OR_RIGHT_2, "r => s, q", "r => s, (^ p q)").isValidStep());
    }

    @Test
    public void testImpliesLeftSplitsContext() {
        assertTrue(step(Rule.IMPLIES_LEFT, "a => b, p", "q, c => d", "(> p q), a, c => b, d").isValidStep());
        assertFalse(step(Rule.IMPLIES_LEFT, "a => b, p", "q, c => d", "(> p q), c, a => b, d").isValidStep());
        assertFalse(step(Rule.IMPLIES_LEFT, "a => b, p", "q, c => d", "(> p q), a, c => d, b").isValidStep());
        assertFalse(step(Rule.IMPLIES_LEFT, "a => b, p", "q, c => d", "(> q p), a, c => b, d").isValidStep());
        assertTrue(step(Rule.IMPLIES_LEFT, "=> p", "q =>", "(> p q) =>").isValidStep());
    }

    @Test
    public void testImpliesRight() {
        assertTrue(step(Rule.IMPLIES_RIGHT, "p, r => s, q", "r => s, (> p q)").isValidStep());
        assertTrue(step(Rule.IMPLIES_RIGHT, "p => p", "=> (> p p)").isValidStep());
        assertFalse(step(Rule.IMPLIES_RIGHT, "p, r => s, q", "r => s, (> q p)").isValidStep());
        assertFalse(step(Rule.IMPLIES_RIGHT, "r, p => s, q", "r => s, (> p q)").isValidStep());
    }

    @Test
    public void testNotLeft() {
        assertTrue(step(Rule.NOT_LEFT, "r => s, p", "(~ p), r => s").isValidStep());
        assertFalse(step(Rule.NOT_LEFT, "r => p, s", "(~ p), r => s").isValidStep());
        assertFalse(step(Rule.NOT_LEFT, "r => s, p", "r, (~ p) => s").isValidStep());
    }

    @Test
    public void testNotRight() {
        assertTrue(step(Rule.NOT_RIGHT, "p, r => s", "r => s, (~ p)").isValidStep());
        assertFalse(step(Rule.NOT_RIGHT, "r, p => s", "r => s, (~ p)").isValidStep());
        assertFalse(step(Rule.NOT_RIGHT, "p, r => s", "r => (~ p), s").isValidStep());
    }

    @Test(expected = IllegalStateException.class)
    public void testNotRightNeedsPrincipalFormula() {
        step(Rule.NOT_RIGHT, "p => q", "p =>").isValidStep();
    }

    @Test
    public void testCutStandardForm() {
        assertTrue(step(Rule.CUT, "=> p", "p => q", "=> q").isValidStep());
        assertTrue(step(Rule.CUT, "a => b, p", "p, c => d", "a, c => b, d").isValidStep());
        assertFalse(step(Rule.CUT, "a => b, p", "p, c => d", "a, b => c, d").isValidStep());
        assertFalse(step(Rule.CUT, "a => b, p", "p, c => d", "c, a => b, d").isValidStep());
    }

    @Test
    public void testCutFormulaMustMatch() {
        assertFalse(step(Rule.CUT, "=> p", "q => q", "=> q").isValidStep());
        assertFalse(step(Rule.CUT, "=> p, q", "p => q", "=> q").isValidStep());
    }

    @Test
    public void testReusedEqualPremises() {
        LK premise = axiom("p => p");
        assertTrue(LK.of(Rule.CUT, premise, premise, sequent("p => p")).isValidStep());
        assertTrue(LK.of(Rule.AND_RIGHT, premise, axiom("p => p"), sequent("p => (^ p p)")).isValidStep());
    }
}
