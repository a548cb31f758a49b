package fol.syntax;

/**
 * Malformed prefix-syntax input. No partial result accompanies it.
 */
public class ParseException extends Exception {
    private final int position;

    public ParseException(String message, int position) {
        super(message + " at token " + position);
        this.position = position;
    }

    /**
     * @return index of the offending token, or the token count if input ended early
     */
    public int getPosition() {
        return position;
    }
}
