package lk;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lays out a derivation as a text proof tree. Premises stand above a dashed inference line carrying the
 * rule label, the conclusion is centered below it. Binary premises are placed side by side.
 * <pre>
 *  p ⇒ p
 * ---------(wL)
 * q, p ⇒ p
 * </pre>
 * Every line of a rendered block has the same width; trailing padding is kept.
 */
public class ProofRenderer {
    public static final int DEFAULT_GAP = 4;
    public static final int DEFAULT_MAX_HEIGHT = 1024;

    private final int gap;
    private final int maxHeight;

    public ProofRenderer() {
        this(DEFAULT_GAP, DEFAULT_MAX_HEIGHT);
    }

    /**
     * @param gap spaces between the blocks of two premises
     * @param maxHeight tallest derivation, counted in inference steps, that is rendered
     */
    public ProofRenderer(int gap, int maxHeight) {
        if (gap < 0 || maxHeight < 1) throw new IllegalArgumentException("Invalid gap " + gap + " or height " + maxHeight);
        this.gap = gap;
        this.maxHeight = maxHeight;
    }

    public @NotNull String render(@NotNull LK proof) {
        return String.join("\n", block(proof, 0));
    }

    private List<String> block(LK node, int height) {
        if (height > maxHeight) {
            throw new IllegalArgumentException("Derivation is taller than " + maxHeight + " steps");
        }
        String sequent = node.conclusion().toString();
        switch (node.premises().size()) {
            case 0:
                return List.of(sequent);
            case 1: {
                List<String> parent = block(node.premise(), height + 1);
                String last = parent.get(parent.size() - 1);
                int prefix = leadingSpaces(last);
                int body = width(last) - prefix - trailingSpaces(last);
                return join(node, parent, sequent, prefix, body);
            }
            default: {
                List<String> left = block(node.left(), height + 1);
                List<String> right = block(node.right(), height + 1);
                int prefix = leadingSpaces(left.get(left.size() - 1));
                int suffix = trailingSpaces(right.get(right.size() - 1));
                int rows = Math.max(left.size(), right.size());
                left = raise(left, rows);
                right = raise(right, rows);
                List<String> parent = new ArrayList<>(rows);
                String separator = " ".repeat(gap);
                for (int i = 0; i < rows; i++) parent.add(left.get(i) + separator + right.get(i));
                int body = width(parent.get(rows - 1)) - prefix - suffix;
                return join(node, parent, sequent, prefix, body);
            }
        }
    }

    /**
     * Puts the sequent under an inference line below {@code parent}, centered on the body of its last line.
     * A sequent wider than that body pushes the parent block to the right instead.
     */
    private static List<String> join(LK node, List<String> parent, String sequent, int bodyPrefix, int bodyLength) {
        int sequentLength = width(sequent);
        int offset = (bodyLength - sequentLength) / 2 + bodyPrefix;
        List<String> lines = new ArrayList<>(parent.size() + 2);
        if (offset > 0) {
            lines.addAll(parent);
            sequent = " ".repeat(offset) + sequent;
        } else {
            String shift = " ".repeat(-offset);
            for (String line : parent) lines.add(shift + line);
            offset = 0;
        }
        String rule = sequentLength > bodyLength
                ? " ".repeat(offset) + "-".repeat(sequentLength + 1)
                : " ".repeat(bodyPrefix) + "-".repeat(bodyLength + 1);
        lines.add(rule + node.rule().label());
        lines.add(sequent);
        return pad(lines);
    }

    /**
     * Prepends blank lines of the block's width until it is {@code rows} high.
     */
    private static List<String> raise(List<String> block, int rows) {
        if (block.size() >= rows) return block;
        List<String> out = new ArrayList<>(Collections.nCopies(rows - block.size(), " ".repeat(width(block.get(0)))));
        out.addAll(block);
        return out;
    }

    private static List<String> pad(List<String> lines) {
        int max = 0;
        for (String line : lines) max = Math.max(max, width(line));
        List<String> out = new ArrayList<>(lines.size());
        for (String line : lines) out.add(line + " ".repeat(max - width(line)));
        return out;
    }

    private static int width(String line) {
        return line.codePointCount(0, line.length());
    }

    private static int leadingSpaces(String line) {
        int n = 0;
        while (n < line.length() && line.charAt(n) == ' ') n++;
        return n;
    }

    private static int trailingSpaces(String line) {
        int n = 0;
        while (n < line.length() && line.charAt(line.length() - 1 - n) == ' ') n++;
        return n;
    }
}
