package core.records;

import core.constants.NodeClass;

/**
 * A point of the board graph. Coordinates are in half steps so secondary nodes, which sit
 * between the primary rows and columns, stay integral.
 *
 * @param id        dense index, 0..n-1, used for occupancy arrays
 * @param nodeClass primary or secondary
 * @param row2      doubled row, 0 at the top
 * @param col2      doubled column, 0 at the left
 * @param label     printable name such as {@code a1} or {@code b2}
 */
public record Node(int id, NodeClass nodeClass, int row2, int col2, String label) {

    public Node {
        if (id < 0) throw new IllegalArgumentException("negative node id " + id);
        if (row2 < 0 || col2 < 0) throw new IllegalArgumentException("negative coordinates for " + label);
    }

    /** File letter from the column, rank number from the row: (row2 4, col2 2) is {@code c5}. */
    public static String labelOf(int row2, int col2) {
        return (char) ('a' + col2) + Integer.toString(row2 + 1);
    }

    @Override
    public String toString() {
        return label;
    }
}
