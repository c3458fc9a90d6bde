package tally.core.node;

/**
 * The two kinds of node in a test tree.
 */
public enum NodeKind {
    CASE("TestCase"),
    SUITE("TestSuite");

    private final String displayName;

    NodeKind(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return this.displayName;
    }
}
