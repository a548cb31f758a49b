package lk.rules;

/**
 * The side of the sequent a structural rule acts on.
 */
public enum Side {
    LEFT, RIGHT
}
