package lk.rules;

import lk.Sequent;

import java.util.List;

public interface InferenceRule {

    /**
     * Checks one inference: whether {@code conclusion} follows from the conclusions of the immediate premises
     * by this rule. Whether the premises are themselves derivable is not examined.
     * An empty antecedent or succedent where the rule needs a principal formula raises
     * {@link IllegalStateException} rather than yielding {@code false}.
     *
     * @param premises the conclusions of the premise derivations, left to right
     * @param conclusion the sequent claimed to follow
     */
    boolean isValid(List<Sequent> premises, Sequent conclusion);
}
