package fol;

import fol.term.Term;
import fol.term.Variable;

import java.util.HashMap;
import java.util.Map;

public class Substitution {
    private final Map<Variable, Term> map;

    public Substitution() {
        this.map = new HashMap<>();
    }

    private Substitution(Map<Variable, Term> map) {
        this.map = map;
    }

    public static Substitution of(Variable var, Term term) {
        Substitution sub = new Substitution();
        sub.put(var, term);
        return sub;
    }

    public Term getOrDefault(Variable var, Term defaultTerm) {
        return map.getOrDefault(var, defaultTerm);
    }

    public void put(Variable var, Term term) {
        map.put(var, term);
    }

    /**
     * Drops the binding of {@code var}, used when descending below a binder of the same variable.
     */
    public Substitution without(Variable var) {
        if (!map.containsKey(var)) return this;
        Map<Variable, Term> newMap = new HashMap<>(map);
        newMap.remove(var);
        return new Substitution(newMap);
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
