package work.lumen.kernel.runtime;

public enum ExecutionStrategy {
    /** Polymorphic executable nodes built by registered handlers. */
    TREE_WALKING,
    /** Statement patterns reduced to the seven canonical instructions. */
    CANONICAL_INSTRUCTIONS
}
