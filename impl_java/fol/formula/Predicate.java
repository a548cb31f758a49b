package fol.formula;

import fol.NonLogicalSymbol;
import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record Predicate(String name, List<Term> args) implements Formula {
    public Predicate {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("Predicate name must not be empty");
        args = List.copyOf(args);
    }

    public Predicate(String name, Term... args) {
        this(name, List.of(args));
    }

    public NonLogicalSymbol symbol() {
        return new NonLogicalSymbol(name, args.size());
    }

    @Override
    public Formula applySub(Substitution substitution) {
        List<Term> newArgs = args.stream().map(t -> t.applySub(substitution)).toList();
        return new Predicate(name, newArgs);
    }

    @Override
    public String toString() {
        if (args.isEmpty()) {
            return name;
        }
        return name + "(" + String.join(", ", args.stream().map(Object::toString).toArray(String[]::new)) + ")";
    }

    @Override
    public String toPrefixString() {
        if (args.isEmpty()) return name;
        return "(" + name + " " + String.join(" ", args.stream().map(Term::toPrefixString).toArray(String[]::new)) + ")";
    }

    @Override
    public Set<Variable> freeVars() {
        return args.stream()
                .map(Term::vars)
                .reduce(new HashSet<>(), (set1, set2) -> {
                    set1.addAll(set2);
                    return set1;
                });
    }

    @Override
    public Set<Variable> boundVars() {
        return new HashSet<>();
    }

    @Override
    public Set<Term> subterms() {
        Set<Term> out = new HashSet<>();
        for (Term t : args) out.addAll(t.subterms());
        return out;
    }

    @Override
    public Set<Formula> subformulas() {
        return new HashSet<>(Set.of(this));
    }

    @Override
    public Set<NonLogicalSymbol> functionSymbols() {
        Set<NonLogicalSymbol> out = new HashSet<>();
        for (Term t : args) out.addAll(t.functionSymbols());
        return out;
    }

    @Override
    public Set<NonLogicalSymbol> predicateSymbols() {
        return new HashSet<>(Set.of(symbol()));
    }

    @Override
    public boolean isSubstitutible(Variable var, Term term) {
        return true;
    }
}
