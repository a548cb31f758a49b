package lk.rules;

import lk.LK;
import lk.Rule;
import org.junit.Test;

import static lk.Formulas.axiom;
import static lk.Formulas.sequent;
import static lk.Formulas.step;
import static org.junit.Assert.*;

public class StructuralRulesTest {

    @Test
    public void testIdentityAxiom() {
        assertTrue(axiom("p => p").isValidStep());
        assertTrue(axiom("p, (q x) => p, (q x)").isValidStep());
        assertFalse(axiom("p => q").isValidStep());
        assertFalse(axiom("p, q => q, p").isValidStep());
        assertFalse(axiom("=>").isValidStep());
    }

    @Test
    public void testReflexivityAxiom() {
        assertTrue(axiom("=> (= x x)").isValidStep());
        assertTrue(axiom("=> (= (f x) (f x))").isValidStep());
        assertFalse(axiom("=> (= x y)").isValidStep());
        assertFalse(axiom("p => (= x x)").isValidStep());
        assertFalse(axiom("=> (= x x), p").isValidStep());
        assertFalse(axiom("=> p").isValidStep());
    }

    @Test
    public void testWeakeningLeft() {
        assertTrue(step(Rule.WEAKENING_LEFT, "p => p", "q, p => p").isValidStep());
        assertFalse(step(Rule.WEAKENING_LEFT, "p => p", "p, q => p").isValidStep());
        assertFalse(step(Rule.WEAKENING_LEFT, "p => p", "q, p => r").isValidStep());
    }

    @Test(expected = IllegalStateException.class)
    public void testWeakeningLeftNeedsAntecedent() {
        step(Rule.WEAKENING_LEFT, "=> p", "=> p").isValidStep();
    }

    @Test
    public void testWeakeningRight() {
        assertTrue(step(Rule.WEAKENING_RIGHT, "p => p", "p => p, q").isValidStep());
        assertFalse(step(Rule.WEAKENING_RIGHT, "p => p", "p => q, p").isValidStep());
        assertFalse(step(Rule.WEAKENING_RIGHT, "p => p", "r => p, q").isValidStep());
    }

    @Test
    public void testContractionLeft() {
        assertTrue(step(Rule.CONTRACTION_LEFT, "p, p, q => r", "p, q => r").isValidStep());
        assertFalse(step(Rule.CONTRACTION_LEFT, "p, q, q => r", "p, q => r").isValidStep());
        assertFalse(step(Rule.CONTRACTION_LEFT, "p, p, q => r", "p, q => s").isValidStep());
        assertFalse(step(Rule.CONTRACTION_LEFT, "p, p, q => r", "p, r => r").isValidStep());
    }

    @Test(expected = IllegalStateException.class)
    public void testContractionLeftOnSingleFormula() {
        step(Rule.CONTRACTION_LEFT, "p => r", "p => r").isValidStep();
    }

    @Test
    public void testContractionRight() {
        assertTrue(step(Rule.CONTRACTION_RIGHT, "r => q, p, p", "r => q, p").isValidStep());
        assertFalse(step(Rule.CONTRACTION_RIGHT, "r => q, p, p", "r => p, p").isValidStep());
        assertFalse(step(Rule.CONTRACTION_RIGHT, "r => q, p, p", "s => q, p").isValidStep());
        assertFalse(step(Rule.CONTRACTION_RIGHT, "r => p, p, q", "r => p, q").isValidStep());
    }

    @Test(expected = IllegalStateException.class)
    public void testContractionRightOnSingleFormula() {
        step(Rule.CONTRACTION_RIGHT, "r => p", "r => p").isValidStep();
    }

    @Test
    public void testExchangeLeftAdjacentTransposition() {
        assertTrue(step(Rule.EXCHANGE_LEFT, "p, q, r => s", "q, p, r => s").isValidStep());
        assertTrue(step(Rule.EXCHANGE_LEFT, "p, q, r => s", "p, r, q => s").isValidStep());
    }

    @Test
    public void testExchangeLeftRejectsOtherPermutations() {
        // swaps two formulas that are not adjacent
        assertFalse(step(Rule.EXCHANGE_LEFT, "p, q, r => s", "r, q, p => s").isValidStep());
        // two transpositions
        assertFalse(step(Rule.EXCHANGE_LEFT, "p, q, r => s", "q, r, p => s").isValidStep());
        assertFalse(step(Rule.EXCHANGE_LEFT, "p, q, r => s", "p, q, r => s").isValidStep());
        assertFalse(step(Rule.EXCHANGE_LEFT, "p, q, r => s", "q, p => s").isValidStep());
        assertFalse(step(Rule.EXCHANGE_LEFT, "p, q, r => s", "q, p, r => t").isValidStep());
        assertFalse(step(Rule.EXCHANGE_LEFT, "=> s", "=> s").isValidStep());
    }

    @Test
    public void testExchangeRight() {
        assertTrue(step(Rule.EXCHANGE_RIGHT, "s => p, q, r", "s => p, r, q").isValidStep());
        assertFalse(step(Rule.EXCHANGE_RIGHT, "s => p, q, r", "s => r, q, p").isValidStep());
        assertFalse(step(Rule.EXCHANGE_RIGHT, "s => p, q, r", "t => q, p, r").isValidStep());
    }

    @Test
    public void testMutatingConclusionBreaksStep() {
        String[][] valid = {
                {"WEAKENING_LEFT", "p => p", "q, p => p", "q, p => (~ p)"},
                {"WEAKENING_RIGHT", "p => p", "p => p, q", "(~ p) => p, q"},
                {"CONTRACTION_LEFT", "p, p => q", "p => q", "p => (~ q)"},
                {"CONTRACTION_RIGHT", "q => p, p", "q => p", "(~ q) => p"},
                {"EXCHANGE_LEFT", "p, q => r", "q, p => r", "q, (~ p) => r"},
                {"EXCHANGE_RIGHT", "r => p, q", "r => q, p", "r => (~ q), p"},
        };
        for (String[] c : valid) {
            Rule rule = Rule.valueOf(c[0]);
            assertTrue(c[0], step(rule, c[1], c[2]).isValidStep());
            assertFalse(c[0], step(rule, c[1], c[3]).isValidStep());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPremiseCountMustMatchRule() {
        LK.of(Rule.CUT, axiom("p => p"), sequent("p => p"));
    }
}
