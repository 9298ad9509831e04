package work.lumen.kernel.flow;

/**
 * Control-flow signal travelling alongside a statement result. Loops consume {@link #BREAK} and
 * {@link #CONTINUE}; call boundaries consume {@link #RETURN}.
 */
public enum FlowSignal {
    NONE,
    BREAK,
    CONTINUE,
    RETURN
}
