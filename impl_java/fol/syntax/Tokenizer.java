package fol.syntax;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits prefix-syntax text into tokens. Every character either is a token of its own, separates tokens
 * (whitespace) or starts a symbol. A symbol runs until a parenthesis, {@code =}, {@code V}, {@code E} or
 * whitespace, so the connective characters {@code ~ ^ v >} may occur inside a symbol but not at its start.
 */
public final class Tokenizer {

    private Tokenizer() {
    }

    public static List<Token> tokenize(String input) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < input.length()) {
            char c = input.charAt(i);
            Token single = single(c);
            if (single != null) {
                tokens.add(single);
                i++;
            } else if (Character.isWhitespace(c)) {
                i++;
            } else {
                int end = i + 1;
                while (end < input.length() && !endsSymbol(input.charAt(end))) end++;
                tokens.add(Token.symbol(input.substring(i, end)));
                i = end;
            }
        }
        return tokens;
    }

    private static @Nullable Token single(char c) {
        switch (c) {
            case '(': return Token.LPAREN;
            case ')': return Token.RPAREN;
            case '~': return Token.NOT;
            case '^': return Token.AND;
            case 'v': return Token.OR;
            case '>': return Token.IMPLIES;
            case '=': return Token.EQUAL;
            case 'V': return Token.FORALL;
            case 'E': return Token.EXISTS;
            default: return null;
        }
    }

    private static boolean endsSymbol(char c) {
        return c == '(' || c == ')' || c == '=' || c == 'V' || c == 'E' || Character.isWhitespace(c);
    }
}
