package core.constants;

/** Primary nodes sit on the grid intersections, secondary nodes at the centres of the squares. */
public enum NodeClass {
    PRIMARY,
    SECONDARY
}
