package lk;

import org.junit.Before;
import org.junit.Test;

import static lk.Formulas.axiom;
import static lk.Formulas.sequent;
import static org.junit.Assert.*;

public class ProofRendererTest {

    private ProofRenderer renderer;

    @Before
    public void setUp() {
        renderer = new ProofRenderer();
    }

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }

    @Test
    public void testAxiomIsItsSequent() {
        assertEquals("p ⇒ p", renderer.render(axiom("p => p")));
        assertEquals("⇒ x = x", renderer.render(axiom("=> (= x x)")));
    }

    @Test
    public void testWiderConclusionShiftsPremise() {
        LK proof = LK.of(Rule.WEAKENING_LEFT, axiom("p => p"), sequent("q, p => p"));
        String expected = lines(
                " p ⇒ p       ",
                "---------(wL)",
                "q, p ⇒ p     ");
        assertEquals(expected, renderer.render(proof));
    }

    @Test
    public void testNarrowerConclusionIsCentered() {
        LK proof = LK.of(Rule.CONTRACTION_RIGHT,
                LK.of(Rule.CONTRACTION_LEFT, axiom("p, p => p, p"), sequent("p => p, p")),
                sequent("p => p"));
        String expected = lines(
                "p, p ⇒ p, p     ",
                "------------(cL)",
                " p ⇒ p, p       ",
                " ---------(cR)  ",
                "  p ⇒ p         ");
        assertEquals(expected, renderer.render(proof));
    }

    @Test
    public void testBinaryPremisesSideBySide() {
        LK proof = LK.of(Rule.CUT, axiom("p => p"), axiom("p => p"), sequent("p => p"));
        String expected = lines(
                "p ⇒ p    p ⇒ p      ",
                "---------------(Cut)",
                "    p ⇒ p           ");
        assertEquals(expected, renderer.render(proof));
    }

    @Test
    public void testShorterPremiseIsRaised() {
        LK left = LK.of(Rule.WEAKENING_LEFT, axiom("p => p"), sequent("q, p => p"));
        LK proof = LK.of(Rule.CUT, left, axiom("p => p"), sequent("q, p => p"));
        String[] rendered = renderer.render(proof).split("\n", -1);
        assertEquals(5, rendered.length);
        for (String line : rendered) assertEquals(28, line.codePointCount(0, line.length()));
        assertEquals(" p ⇒ p" + " ".repeat(22), rendered[0]);
        assertEquals("---------(wL)" + " ".repeat(15), rendered[1]);
        assertEquals("q, p ⇒ p" + " ".repeat(9) + "p ⇒ p" + " ".repeat(6), rendered[2]);
        assertEquals("-".repeat(23) + "(Cut)", rendered[3]);
        assertEquals(" ".repeat(7) + "q, p ⇒ p" + " ".repeat(13), rendered[4]);
    }

    @Test
    public void testCustomGap() {
        LK proof = LK.of(Rule.AND_RIGHT, axiom("p => p"), axiom("p => p"), sequent("p => (^ p p)"));
        String rendered = new ProofRenderer(1, ProofRenderer.DEFAULT_MAX_HEIGHT).render(proof);
        assertTrue(rendered, rendered.startsWith("p ⇒ p p ⇒ p"));
        assertTrue(rendered, rendered.contains("(∧R)"));
    }

    @Test
    public void testLabels() {
        assertEquals("(∀L)", Rule.FORALL_LEFT.label());
        assertEquals("(∃R)", Rule.EXISTS_RIGHT.label());
        assertEquals("(→L)", Rule.IMPLIES_LEFT.label());
        assertEquals("(∨R2)", Rule.OR_RIGHT_2.label());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testHeightLimit() {
        LK proof = LK.of(Rule.CONTRACTION_RIGHT,
                LK.of(Rule.CONTRACTION_LEFT, axiom("p, p => p, p"), sequent("p => p, p")),
                sequent("p => p"));
        new ProofRenderer(4, 1).render(proof);
    }
}
