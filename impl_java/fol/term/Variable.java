package fol.term;

import fol.NonLogicalSymbol;
import fol.Substitution;

import java.util.HashSet;
import java.util.Set;

public record Variable(String name) implements Term {
    public Variable {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("Variable name must not be empty");
    }

    @Override
    public Term applySub(Substitution substitution) {
        return substitution.getOrDefault(this, this);
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public String toPrefixString() {
        return name;
    }

    @Override
    public Set<Variable> vars() {
        return new HashSet<>(Set.of(this));
    }

    @Override
    public Set<Term> subterms() {
        return new HashSet<>(Set.of(this));
    }

    @Override
    public Set<NonLogicalSymbol> functionSymbols() {
        return new HashSet<>();
    }
}
