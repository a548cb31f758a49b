package fol.term;

import fol.NonLogicalSymbol;
import fol.Substitution;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * An applied function symbol. A function with no arguments is a constant.
 */
public record Function(String name, List<Term> args) implements Term {
    public Function {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("Function name must not be empty");
        args = List.copyOf(args);
    }

    public Function(String name, Term... args) {
        this(name, List.of(args));
    }

    public NonLogicalSymbol symbol() {
        return new NonLogicalSymbol(name, args.size());
    }

    @Override
    public Term applySub(Substitution substitution) {
        List<Term> newArgs = args.stream().map(t -> t.applySub(substitution)).toList();
        return new Function(name, newArgs);
    }

    @Override
    public String toString() {
        return name + "(" + String.join(", ", args.stream().map(Object::toString).toArray(String[]::new)) + ")";
    }

    @Override
    public String toPrefixString() {
        if (args.isEmpty()) return "(" + name + ")";
        return "(" + name + " " + String.join(" ", args.stream().map(Term::toPrefixString).toArray(String[]::new)) + ")";
    }

    @Override
    public Set<Variable> vars() {
        return args.stream()
                .map(Term::vars)
                .reduce(new HashSet<>(), (set1, set2) -> {
                    set1.addAll(set2);
                    return set1;
                });
    }

    @Override
    public Set<Term> subterms() {
        Set<Term> out = new HashSet<>();
        out.add(this);
        for (Term t : args) out.addAll(t.subterms());
        return out;
    }

    @Override
    public Set<NonLogicalSymbol> functionSymbols() {
        Set<NonLogicalSymbol> out = new HashSet<>();
        out.add(symbol());
        for (Term t : args) out.addAll(t.functionSymbols());
        return out;
    }
}
