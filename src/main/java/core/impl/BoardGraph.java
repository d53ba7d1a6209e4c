package core.impl;

import core.constants.NodeClass;
import core.constants.Player;
import core.errors.TopologyException;
import core.records.Node;

import java.util.*;

/**
 * Immutable board: nodes, adjacency, forward adjacency per side and capture landings.
 * All tables are computed once in {@link #build}; afterwards the graph is read-only and
 * safe to share between threads and games.
 */
public final class BoardGraph {

    private static final int NO_NODE = -1;

    private final String name;
    private final List<Node> nodes;
    private final Map<String, Node> byLabel;
    private final List<List<Node>> rows;

    private final int[][] adjacent;      // [node] -> adjacent ids, ascending
    private final int[][][] forward;     // [player][node] -> forward ids, ascending
    private final int[][] landing;       // [from][over] -> landing id or NO_NODE
    private final int maxRow2, maxCol2;
    private final int primaryCount;

    private BoardGraph(String name, List<Node> nodes, int[][] adjacent, int[][] landing) {
        this.name = name;
        this.nodes = List.copyOf(nodes);
        this.adjacent = adjacent;
        this.landing = landing;

        Map<String, Node> labels = new HashMap<>();
        TreeMap<Integer, List<Node>> byRow = new TreeMap<>();
        int mr = 0, mc = 0, prim = 0;
        for (Node n : nodes) {
            labels.put(n.label(), n);
            byRow.computeIfAbsent(n.row2(), k -> new ArrayList<>()).add(n);
            mr = Math.max(mr, n.row2());
            mc = Math.max(mc, n.col2());
            if (n.nodeClass() == NodeClass.PRIMARY) prim++;
        }
        this.byLabel = Map.copyOf(labels);
        List<List<Node>> r = new ArrayList<>();
        for (List<Node> row : byRow.values()) {
            row.sort(Comparator.comparingInt(Node::col2));
            r.add(List.copyOf(row));
        }
        this.rows = List.copyOf(r);
        this.maxRow2 = mr;
        this.maxCol2 = mc;
        this.primaryCount = prim;

        this.forward = new int[Player.values().length][nodes.size()][];
        for (Player p : Player.values()) {
            for (Node n : nodes) {
                forward[p.ordinal()][n.id()] = Arrays.stream(adjacent[n.id()])
                        .filter(to -> p.isForward(n.row2(), nodes.get(to).row2()))
                        .toArray();
            }
        }
    }

    /**
     * Validates {@code def} and builds its graph.
     *
     * @throws TopologyException on an empty board, duplicate labels or coordinates, a link to an
     *         undeclared label, a disconnected node, or a jump whose continuation node is not
     *         linked to the jumped node
     */
    public static BoardGraph build(TopologyDefinition def) {
        String name = def.name();
        if (def.nodes().isEmpty()) throw new TopologyException(name + ": board has no nodes");

        /* ── nodes ───────────────────────────────────────────── */
        List<Node> nodes = new ArrayList<>(def.nodes().size());
        Map<String, Integer> idOf = new HashMap<>();
        Map<Long, Integer> idAt = new HashMap<>();
        for (TopologyDefinition.NodeSpec spec : def.nodes()) {
            int id = nodes.size();
            if (idOf.putIfAbsent(spec.label(), id) != null) {
                throw new TopologyException(name + ": duplicate node label " + spec.label());
            }
            if (idAt.putIfAbsent(key(spec.row2(), spec.col2()), id) != null) {
                throw new TopologyException(name + ": two nodes at (" + spec.row2() + "," + spec.col2() + ")");
            }
            nodes.add(new Node(id, spec.nodeClass(), spec.row2(), spec.col2(), spec.label()));
        }
        int n = nodes.size();

        /* ── links ───────────────────────────────────────────── */
        List<SortedSet<Integer>> links = new ArrayList<>(n);
        for (int i = 0; i < n; i++) links.add(new TreeSet<>());
        for (TopologyDefinition.Edge e : def.edges()) {
            Integer a = idOf.get(e.a());
            Integer b = idOf.get(e.b());
            if (a == null || b == null) {
                throw new TopologyException(name + ": link " + e.a() + "-" + e.b() + " references an undefined node "
                        + (a == null ? e.a() : e.b()));
            }
            if (a.equals(b)) throw new TopologyException(name + ": node " + e.a() + " linked to itself");
            links.get(a).add(b);
            links.get(b).add(a);
        }
        int[][] adjacent = new int[n][];
        for (int i = 0; i < n; i++) {
            adjacent[i] = links.get(i).stream().mapToInt(Integer::intValue).toArray();
        }

        /* ── connectivity ────────────────────────────────────── */
        boolean[] seen = new boolean[n];
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        seen[0] = true;
        queue.add(0);
        while (!queue.isEmpty()) {
            for (int next : adjacent[queue.poll()]) {
                if (!seen[next]) {
                    seen[next] = true;
                    queue.add(next);
                }
            }
        }
        for (int i = 0; i < n; i++) {
            if (!seen[i]) {
                throw new TopologyException(name + ": node " + nodes.get(i).label() + " is not reachable from "
                        + nodes.get(0).label());
            }
        }

        /* ── capture landings ────────────────────────────────── */
        int[][] landing = new int[n][n];
        for (int[] row : landing) Arrays.fill(row, NO_NODE);
        for (int from = 0; from < n; from++) {
            Node f = nodes.get(from);
            for (int over : adjacent[from]) {
                Node o = nodes.get(over);
                Integer to = idAt.get(key(2 * o.row2() - f.row2(), 2 * o.col2() - f.col2()));
                if (to == null) continue;                      // jump would leave the board
                if (!links.get(over).contains(to)) {
                    throw new TopologyException(name + ": jump " + f.label() + " over " + o.label()
                            + " continues to " + nodes.get(to).label() + ", which is not linked to " + o.label());
                }
                landing[from][over] = to;
            }
        }

        return new BoardGraph(name, nodes, adjacent, landing);
    }

    private static long key(int row2, int col2) {
        return ((long) row2 << 32) | (col2 & 0xffffffffL);
    }

    /* ── public queries ──────────────────────────────────────── */

    public String name() {
        return name;
    }

    public List<Node> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public Node node(int id) {
        return nodes.get(id);
    }

    /** @throws IllegalArgumentException if no node carries {@code label} */
    public Node node(String label) {
        Node n = byLabel.get(label);
        if (n == null) throw new IllegalArgumentException("No node " + label + " on board " + name);
        return n;
    }

    public Optional<Node> findNode(String label) {
        return Optional.ofNullable(byLabel.get(label));
    }

    public List<Node> adjacent(Node node) {
        return toNodes(adjacent[node.id()]);
    }

    /** Adjacent nodes a non-capturing move of {@code player} may go to. */
    public List<Node> forward(Node node, Player player) {
        return toNodes(forward[player.ordinal()][node.id()]);
    }

    /** Where a piece on {@code from} lands after jumping the piece on {@code over}, if anywhere. */
    public Optional<Node> captureLanding(Node from, Node over) {
        int to = landing[from.id()][over.id()];
        return to == NO_NODE ? Optional.empty() : Optional.of(nodes.get(to));
    }

    public boolean isAdjacent(Node a, Node b) {
        return Arrays.binarySearch(adjacent[a.id()], b.id()) >= 0;
    }

    public int primaryCount() {
        return primaryCount;
    }

    public int secondaryCount() {
        return nodes.size() - primaryCount;
    }

    /** Nodes grouped by row, top row first, each row left to right. */
    public List<List<Node>> rows() {
        return rows;
    }

    public int maxRow2() {
        return maxRow2;
    }

    public int maxCol2() {
        return maxCol2;
    }

    /** Straight-line distance in whole board units. */
    public static double distance(Node a, Node b) {
        return Math.hypot(a.row2() - b.row2(), a.col2() - b.col2()) / 2.0;
    }

    /* ── raw tables for the generators in this package ───────── */

    int[] adjacentIds(int id) {
        return adjacent[id];
    }

    int[] forwardIds(int id, Player player) {
        return forward[player.ordinal()][id];
    }

    int landingId(int from, int over) {
        return landing[from][over];
    }

    private List<Node> toNodes(int[] ids) {
        List<Node> out = new ArrayList<>(ids.length);
        for (int id : ids) out.add(nodes.get(id));
        return Collections.unmodifiableList(out);
    }

    @Override
    public String toString() {
        return name + " (" + nodes.size() + " nodes)";
    }
}
