package fol.syntax;

import fol.formula.And;
import fol.formula.Equals;
import fol.formula.Exists;
import fol.formula.Forall;
import fol.formula.Formula;
import fol.formula.Implies;
import fol.formula.Not;
import fol.formula.Or;
import fol.formula.Predicate;
import fol.term.Function;
import fol.term.Term;
import fol.term.Variable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Recursive-descent parser for the prefix syntax:
 * <pre>
 * Term    := Symbol | '(' Symbol Term* ')'
 * Formula := '(' ('V' | 'E') Symbol Formula ')'
 *          | '(' '=' Term Term ')'
 *          | '(' '~' Formula ')'
 *          | '(' ('^' | 'v' | '>') Formula Formula ')'
 *          | '(' Symbol Term* ')'
 *          | Symbol
 * </pre>
 * At the top level a predicate may also be written without its parentheses, as {@code p x y}.
 * Instances hold no parse state and can be shared.
 */
public class Parser {
    private static final Logger LOGGER = Logger.getLogger(Parser.class.getName());

    public static final int DEFAULT_MAX_DEPTH = 512;

    private final int maxDepth;

    public Parser() {
        this(DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth deepest nesting of formulas and terms accepted before the input is rejected
     */
    public Parser(int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        this.maxDepth = maxDepth;
    }

    public @NotNull Formula parse(@NotNull String text) throws ParseException {
        return parse(Tokenizer.tokenize(text));
    }

    public @NotNull Formula parse(@NotNull List<Token> tokens) throws ParseException {
        Cursor cursor = new Cursor(tokens);
        Formula formula;
        Token first = cursor.peek();
        if (first != null && first.kind() == Token.Kind.SYMBOL) {
            cursor.next();
            List<Term> args = new ArrayList<>();
            while (!cursor.atEnd()) args.add(cursor.term(1));
            formula = new Predicate(first.text(), args);
        } else {
            formula = cursor.formula(0);
        }
        if (!cursor.atEnd()) {
            throw new ParseException("Trailing input " + cursor.peek(), cursor.pos);
        }
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Parsed " + tokens.size() + " tokens into " + formula);
        }
        return formula;
    }

    public @NotNull Term parseTerm(@NotNull String text) throws ParseException {
        Cursor cursor = new Cursor(Tokenizer.tokenize(text));
        Term term = cursor.term(0);
        if (!cursor.atEnd()) {
            throw new ParseException("Trailing input " + cursor.peek(), cursor.pos);
        }
        return term;
    }

    private final class Cursor {
        private final List<Token> tokens;
        private int pos = 0;

        private Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        private boolean atEnd() {
            return pos >= tokens.size();
        }

        private @Nullable Token peek() {
            return atEnd() ? null : tokens.get(pos);
        }

        private Token next() throws ParseException {
            if (atEnd()) throw new ParseException("Unexpected end of input", pos);
            return tokens.get(pos++);
        }

        private Token expect(Token.Kind kind) throws ParseException {
            Token token = next();
            if (token.kind() != kind) {
                throw new ParseException("Expected " + kind + " but found " + token, pos - 1);
            }
            return token;
        }

        private void checkDepth(int depth) throws ParseException {
            if (depth > maxDepth) throw new ParseException("Nesting deeper than " + maxDepth, pos);
        }

        private Formula formula(int depth) throws ParseException {
            checkDepth(depth);
            Token token = next();
            if (token.kind() == Token.Kind.SYMBOL) {
                return new Predicate(token.text(), List.of());
            }
            if (token.kind() != Token.Kind.LPAREN) {
                throw new ParseException("Expected a formula but found " + token, pos - 1);
            }
            Token head = next();
            Formula formula;
            switch (head.kind()) {
                case FORALL:
                case EXISTS: {
                    Token var = next();
                    if (var.kind() != Token.Kind.SYMBOL) {
                        throw new ParseException("Quantifier must bind a variable symbol, found " + var, pos - 1);
                    }
                    Formula body = formula(depth + 1);
                    formula = head.kind() == Token.Kind.FORALL
                            ? new Forall(new Variable(var.text()), body)
                            : new Exists(new Variable(var.text()), body);
                    break;
                }
                case EQUAL:
                    formula = new Equals(term(depth + 1), term(depth + 1));
                    break;
                case NOT:
                    formula = new Not(formula(depth + 1));
                    break;
                case AND:
                case OR:
                case IMPLIES: {
                    Formula left = formula(depth + 1);
                    Token after = peek();
                    if (after != null && after.kind() == Token.Kind.RPAREN) {
                        throw new ParseException(head.text() + " expects two operands", pos);
                    }
                    Formula right = formula(depth + 1);
                    formula = head.kind() == Token.Kind.AND ? new And(left, right)
                            : head.kind() == Token.Kind.OR ? new Or(left, right)
                            : new Implies(left, right);
                    break;
                }
                case SYMBOL:
                    formula = new Predicate(head.text(), arguments(depth + 1));
                    // arguments consumed the closing parenthesis
                    return formula;
                default:
                    throw new ParseException("Unexpected " + head + " after (", pos - 1);
            }
            expect(Token.Kind.RPAREN);
            return formula;
        }

        private Term term(int depth) throws ParseException {
            checkDepth(depth);
            Token token = next();
            if (token.kind() == Token.Kind.SYMBOL) {
                return new Variable(token.text());
            }
            if (token.kind() != Token.Kind.LPAREN) {
                throw new ParseException("Expected a term but found " + token, pos - 1);
            }
            Token name = expect(Token.Kind.SYMBOL);
            return new Function(name.text(), arguments(depth + 1));
        }

        /**
         * Reads terms up to and including the closing parenthesis.
         */
        private List<Term> arguments(int depth) throws ParseException {
            List<Term> args = new ArrayList<>();
            while (true) {
                Token token = peek();
                if (token == null) throw new ParseException("Unbalanced parenthesis", pos);
                if (token.kind() == Token.Kind.RPAREN) {
                    pos++;
                    return args;
                }
                args.add(term(depth));
            }
        }
    }
}
