package fol;

/**
 * A function or predicate name together with its arity. The same name used at two arities gives two symbols.
 */
public record NonLogicalSymbol(String name, int arity) {
    public NonLogicalSymbol {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("Symbol name must not be empty");
        if (arity < 0) throw new IllegalArgumentException("Negative arity for " + name);
    }

    @Override
    public String toString() {
        return name + "/" + arity;
    }
}
