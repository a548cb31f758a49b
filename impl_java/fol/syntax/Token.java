package fol.syntax;

/**
 * A lexical unit of the prefix syntax. Only {@link Kind#SYMBOL} tokens carry meaningful text.
 */
public record Token(Kind kind, String text) {

    public enum Kind {
        LPAREN, RPAREN, NOT, AND, OR, IMPLIES, EQUAL, FORALL, EXISTS, SYMBOL
    }

    public static final Token LPAREN = new Token(Kind.LPAREN, "(");
    public static final Token RPAREN = new Token(Kind.RPAREN, ")");
    public static final Token NOT = new Token(Kind.NOT, "~");
    public static final Token AND = new Token(Kind.AND, "^");
    public static final Token OR = new Token(Kind.OR, "v");
    public static final Token IMPLIES = new Token(Kind.IMPLIES, ">");
    public static final Token EQUAL = new Token(Kind.EQUAL, "=");
    public static final Token FORALL = new Token(Kind.FORALL, "V");
    public static final Token EXISTS = new Token(Kind.EXISTS, "E");

    public Token {
        if (kind == null || text == null || text.isEmpty()) throw new IllegalArgumentException("Malformed token");
    }

    public static Token symbol(String text) {
        return new Token(Kind.SYMBOL, text);
    }

    @Override
    public String toString() {
        return kind == Kind.SYMBOL ? "Symbol(" + text + ")" : kind.name();
    }
}
