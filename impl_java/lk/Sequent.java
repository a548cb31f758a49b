package lk;

import fol.formula.Formula;
import fol.term.Variable;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * An ordered pair of formula lists, read "antecedent entails succedent". Rules introduce formulas at the
 * front of the antecedent and at the back of the succedent, hence the positional accessors.
 */
public record Sequent(List<Formula> antecedent, List<Formula> succedent) {
    public Sequent {
        antecedent = List.copyOf(antecedent);
        succedent = List.copyOf(succedent);
    }

    public static Sequent of(List<Formula> antecedent, List<Formula> succedent) {
        return new Sequent(antecedent, succedent);
    }

    /**
     * A sequent with an empty antecedent.
     */
    public static Sequent proves(Formula... succedent) {
        return new Sequent(List.of(), Arrays.asList(succedent));
    }

    public Formula antFirst() {
        if (antecedent.isEmpty()) throw new IllegalStateException("Antecedent of " + this + " is empty");
        return antecedent.get(0);
    }

    public List<Formula> antButFirst() {
        if (antecedent.isEmpty()) throw new IllegalStateException("Antecedent of " + this + " is empty");
        return antecedent.subList(1, antecedent.size());
    }

    public Formula sucLast() {
        if (succedent.isEmpty()) throw new IllegalStateException("Succedent of " + this + " is empty");
        return succedent.get(succedent.size() - 1);
    }

    public List<Formula> sucButLast() {
        if (succedent.isEmpty()) throw new IllegalStateException("Succedent of " + this + " is empty");
        return succedent.subList(0, succedent.size() - 1);
    }

    public Set<Formula> subformulas() {
        Set<Formula> out = new HashSet<>();
        for (Formula f : antecedent) out.addAll(f.subformulas());
        for (Formula f : succedent) out.addAll(f.subformulas());
        return out;
    }

    public static Set<Variable> freeVars(Collection<Formula> formulas) {
        Set<Variable> out = new HashSet<>();
        for (Formula f : formulas) out.addAll(f.freeVars());
        return out;
    }

    @Override
    public String toString() {
        String ant = String.join(", ", antecedent.stream().map(Object::toString).toArray(String[]::new));
        String suc = String.join(", ", succedent.stream().map(Object::toString).toArray(String[]::new));
        StringBuilder sb = new StringBuilder(ant);
        if (!ant.isEmpty()) sb.append(' ');
        sb.append('⇒');
        if (!suc.isEmpty()) sb.append(' ').append(suc);
        return sb.toString();
    }
}
