package core.impl;

import core.constants.NodeClass;
import core.records.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative description of a board: its nodes and the undirected links between them.
 * {@link BoardGraph#build} validates a definition and derives everything else from it.
 *
 * @param name  identifier used in error messages
 * @param nodes node declarations; declaration order becomes node id order
 * @param edges undirected links between declared labels
 */
public record TopologyDefinition(String name, List<NodeSpec> nodes, List<Edge> edges) {

    public record NodeSpec(String label, NodeClass nodeClass, int row2, int col2) {
        public static NodeSpec at(NodeClass nodeClass, int row2, int col2) {
            return new NodeSpec(Node.labelOf(row2, col2), nodeClass, row2, col2);
        }
    }

    public record Edge(String a, String b) {}

    public TopologyDefinition {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    /**
     * A rectangular Dablo board: {@code rows x cols} primary nodes, linked orthogonally, plus
     * one secondary node in every square linked to the square's four corners. Nodes are
     * declared in reading order, top row first.
     */
    public static TopologyDefinition grid(String name, int rows, int cols) {
        if (rows < 2 || cols < 2) throw new IllegalArgumentException("grid needs at least 2x2 primary nodes");
        List<NodeSpec> nodes = new ArrayList<>();
        List<Edge> edges = new ArrayList<>();

        for (int row2 = 0; row2 <= 2 * (rows - 1); row2++) {
            boolean primaryRow = (row2 & 1) == 0;
            for (int col2 = primaryRow ? 0 : 1; col2 <= 2 * (cols - 1); col2 += 2) {
                nodes.add(NodeSpec.at(primaryRow ? NodeClass.PRIMARY : NodeClass.SECONDARY, row2, col2));
            }
        }

        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                String here = Node.labelOf(2 * r, 2 * c);
                if (c + 1 < cols) edges.add(new Edge(here, Node.labelOf(2 * r, 2 * c + 2)));
                if (r + 1 < rows) edges.add(new Edge(here, Node.labelOf(2 * r + 2, 2 * c)));
            }
        }
        for (int r = 0; r + 1 < rows; r++) {
            for (int c = 0; c + 1 < cols; c++) {
                String centre = Node.labelOf(2 * r + 1, 2 * c + 1);
                edges.add(new Edge(centre, Node.labelOf(2 * r, 2 * c)));
                edges.add(new Edge(centre, Node.labelOf(2 * r, 2 * c + 2)));
                edges.add(new Edge(centre, Node.labelOf(2 * r + 2, 2 * c)));
                edges.add(new Edge(centre, Node.labelOf(2 * r + 2, 2 * c + 2)));
            }
        }
        return new TopologyDefinition(name, nodes, edges);
    }
}
