package org.humspine.parser.frontend.spines;

import java.util.List;

/**
 * Helpers for spine-path labels.
 * <p>
 * A primary spine is labelled with its track number ({@code "3"}). Splitting a spine labelled {@code p}
 * gives {@code "(p)a"} and {@code "(p)b"}. Merging two sibling halves gives back {@code p}; any other merge
 * joins the labels with spaces. The label is descriptive only; the track number is the first integer in it.
 */
public final class SpinePaths {

    private SpinePaths() {}

    /**
     * @param parent The label of the spine being split.
     * @return The label of the left branch.
     */
    public static String splitLeft(String parent) {
        return "(" + parent + ")a";
    }

    /**
     * @param parent The label of the spine being split.
     * @return The label of the right branch.
     */
    public static String splitRight(String parent) {
        return "(" + parent + ")b";
    }

    /**
     * Computes the label of a column produced by merging the given columns.
     * Only a two-way merge of the two halves of one split collapses back to the parent label.
     *
     * @param labels The labels of the merged columns, left to right; at least one.
     * @return The merged label.
     */
    public static String merge(List<String> labels) {
        if (labels.size() == 2) {
            String left = labels.get(0);
            String right = labels.get(1);
            if (left.length() == right.length()
                    && left.startsWith("(") && left.endsWith(")a")
                    && right.startsWith("(") && right.endsWith(")b")
                    && left.regionMatches(0, right, 0, left.length() - 1)) {
                return left.substring(1, left.length() - 2);
            }
        }
        return String.join(" ", labels);
    }

    /**
     * Extracts the track number of a spine-path label.
     *
     * @param spinePath The label.
     * @return The first integer in the label, or 0 if there is none.
     */
    public static int trackOf(String spinePath) {
        if (spinePath == null) {
            return 0;
        }
        int i = 0;
        int n = spinePath.length();
        while (i < n && !Character.isDigit(spinePath.charAt(i))) i++;
        int value = 0;
        while (i < n && Character.isDigit(spinePath.charAt(i))) {
            value = value * 10 + (spinePath.charAt(i) - '0');
            i++;
        }
        return value;
    }
}
