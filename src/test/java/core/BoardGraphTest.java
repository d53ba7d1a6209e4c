package core;

import core.constants.BoardTopology;
import core.constants.NodeClass;
import core.constants.Player;
import core.errors.TopologyException;
import core.impl.BoardGraph;
import core.impl.TopologyDefinition;
import core.impl.TopologyDefinition.Edge;
import core.impl.TopologyDefinition.NodeSpec;
import core.records.Node;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class BoardGraphTest {

    private static final BoardGraph BOARD = BoardTopology.STANDARD.graph();

    private static Set<String> labels(List<Node> nodes) {
        return nodes.stream().map(Node::label).collect(Collectors.toSet());
    }

    private static Node n(String label) {
        return BOARD.node(label);
    }

    @Test
    void standardBoardHasThirtyPrimaryAndTwentySecondaryNodes() {
        assertEquals(50, BOARD.size());
        assertEquals(30, BOARD.primaryCount());
        assertEquals(20, BOARD.secondaryCount());
        assertEquals(11, BOARD.rows().size());
        assertSame(BOARD, BoardTopology.byId("standard").graph());
    }

    @Test
    void labelsFollowHalfStepCoordinates() {
        Node a1 = n("a1");
        assertEquals(NodeClass.PRIMARY, a1.nodeClass());
        assertEquals(0, a1.row2());
        assertEquals(0, a1.col2());
        assertEquals(NodeClass.SECONDARY, n("b2").nodeClass());
        assertEquals(NodeClass.PRIMARY, n("i11").nodeClass());
        assertTrue(BOARD.findNode("b1").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> BOARD.node("z99"));
    }

    @Test
    void adjacency() {
        assertEquals(Set.of("c1", "a3", "b2"), labels(BOARD.adjacent(n("a1"))));
        assertEquals(Set.of("a1", "c1", "a3", "c3"), labels(BOARD.adjacent(n("b2"))));
        assertEquals(Set.of("e3", "e7", "c5", "g5", "d4", "f4", "d6", "f6"), labels(BOARD.adjacent(n("e5"))));
    }

    @Test
    void primaryNodesAreNeverDiagonalNeighbours() {
        for (Node a : BOARD.nodes()) {
            for (Node b : BOARD.adjacent(a)) {
                assertTrue(BOARD.isAdjacent(b, a), "adjacency must be symmetric");
                if (a.nodeClass() == NodeClass.PRIMARY && b.nodeClass() == NodeClass.PRIMARY) {
                    assertTrue(a.row2() == b.row2() || a.col2() == b.col2(), a + " - " + b);
                }
                if (a.nodeClass() == NodeClass.SECONDARY) {
                    assertEquals(NodeClass.PRIMARY, b.nodeClass());
                }
            }
        }
    }

    @Test
    void forwardDependsOnSide() {
        assertEquals(Set.of("a7", "b8"), labels(BOARD.forward(n("a9"), Player.PLAYER_A)));
        assertEquals(Set.of("a11", "b10"), labels(BOARD.forward(n("a9"), Player.PLAYER_B)));
        assertTrue(BOARD.forward(n("a1"), Player.PLAYER_A).isEmpty());
    }

    @Test
    void captureLandingContinuesTheLine() {
        assertEquals("c7", BOARD.captureLanding(n("a9"), n("b8")).orElseThrow().label());
        assertEquals("d4", BOARD.captureLanding(n("b2"), n("c3")).orElseThrow().label());
        assertEquals("a5", BOARD.captureLanding(n("a1"), n("a3")).orElseThrow().label());
        assertTrue(BOARD.captureLanding(n("a3"), n("a1")).isEmpty());
    }

    @Test
    void smallGridBuilds() {
        BoardGraph tiny = BoardGraph.build(TopologyDefinition.grid("tiny", 2, 2));
        assertEquals(5, tiny.size());
        assertEquals(1, tiny.secondaryCount());
        assertTrue(tiny.captureLanding(tiny.node("a1"), tiny.node("b2")).isPresent());
    }

    @Test
    void undefinedLabelInLinkIsRejected() {
        TopologyDefinition def = new TopologyDefinition("bad",
                List.of(NodeSpec.at(NodeClass.PRIMARY, 0, 0), NodeSpec.at(NodeClass.PRIMARY, 2, 0)),
                List.of(new Edge("a1", "a3"), new Edge("a1", "z9")));
        TopologyException e = assertThrows(TopologyException.class, () -> BoardGraph.build(def));
        assertTrue(e.getMessage().contains("z9"));
    }

    @Test
    void disconnectedNodeIsRejected() {
        TopologyDefinition def = new TopologyDefinition("bad",
                List.of(NodeSpec.at(NodeClass.PRIMARY, 0, 0), NodeSpec.at(NodeClass.PRIMARY, 2, 0),
                        NodeSpec.at(NodeClass.PRIMARY, 0, 2)),
                List.of(new Edge("a1", "a3")));
        TopologyException e = assertThrows(TopologyException.class, () -> BoardGraph.build(def));
        assertTrue(e.getMessage().contains("c1"));
    }

    @Test
    void duplicateLabelIsRejected() {
        TopologyDefinition def = new TopologyDefinition("bad",
                List.of(NodeSpec.at(NodeClass.PRIMARY, 0, 0), new NodeSpec("a1", NodeClass.PRIMARY, 2, 0)),
                List.of(new Edge("a1", "a1")));
        assertThrows(TopologyException.class, () -> BoardGraph.build(def));
    }

    @Test
    void jumpOntoUnlinkedContinuationIsRejected() {
        // a1 - a3 and a1 - a5 are linked, a3 - a5 is not: jumping a3 from a1 has no landing policy
        TopologyDefinition def = new TopologyDefinition("bad",
                List.of(NodeSpec.at(NodeClass.PRIMARY, 0, 0), NodeSpec.at(NodeClass.PRIMARY, 2, 0),
                        NodeSpec.at(NodeClass.PRIMARY, 4, 0)),
                List.of(new Edge("a1", "a3"), new Edge("a1", "a5")));
        assertThrows(TopologyException.class, () -> BoardGraph.build(def));
    }

    @Test
    void unknownTopologyId() {
        assertThrows(IllegalArgumentException.class, () -> BoardTopology.byId("hexagonal"));
    }
}
