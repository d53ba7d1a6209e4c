package core.constants;

import core.impl.BoardGraph;
import core.impl.TopologyDefinition;
import core.records.Node;
import core.records.Piece;

/**
 * Registry of the boards a game can be played on. Each graph is built on first use and then
 * shared by every game for the lifetime of the process.
 */
public enum BoardTopology {
    STANDARD("standard", 6, 5);

    private final String id;
    private final int rows, cols;
    private volatile BoardGraph graph;

    BoardTopology(String id, int rows, int cols) {
        this.id = id;
        this.rows = rows;
        this.cols = cols;
    }

    public String id() {
        return id;
    }

    public static BoardTopology byId(String id) {
        for (BoardTopology t : values()) {
            if (t.id.equalsIgnoreCase(id)) return t;
        }
        throw new IllegalArgumentException("Unknown board topology: " + id);
    }

    public BoardGraph graph() {
        BoardGraph g = graph;
        if (g == null) {
            synchronized (this) {
                g = graph;
                if (g == null) {
                    g = BoardGraph.build(TopologyDefinition.grid(id, rows, cols));
                    graph = g;
                }
            }
        }
        return g;
    }

    /**
     * Starting occupancy, indexed by node id. The three rows nearest each side hold that
     * side's warriors; king and prince stand just in front, A's on the right flank and B's
     * mirrored on the left.
     */
    public Piece[] initialOccupancy() {
        BoardGraph g = graph();
        Piece[] cells = new Piece[g.size()];
        int last = g.maxRow2();
        int right = g.maxCol2();

        for (Node n : g.nodes()) {
            if (n.row2() >= last - 2) cells[n.id()] = Piece.of(Rank.WARRIOR, Player.PLAYER_A);
            else if (n.row2() <= 2) cells[n.id()] = Piece.of(Rank.WARRIOR, Player.PLAYER_B);
        }
        cells[g.node(Node.labelOf(last - 4, right)).id()] = Piece.of(Rank.KING, Player.PLAYER_A);
        cells[g.node(Node.labelOf(last - 3, right - 1)).id()] = Piece.of(Rank.PRINCE, Player.PLAYER_A);
        cells[g.node(Node.labelOf(4, 0)).id()] = Piece.of(Rank.KING, Player.PLAYER_B);
        cells[g.node(Node.labelOf(3, 1)).id()] = Piece.of(Rank.PRINCE, Player.PLAYER_B);
        return cells;
    }
}
