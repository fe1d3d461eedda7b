package org.dxworks.codeflow.model;

/**
 * A directed control-flow edge. {@code exitcase} is the branch condition (or its negation) that
 * selects this edge, {@code null} for unconditional edges.
 * <p>
 * Links are created and removed only through {@link Block#addExit} and {@link Block#removeExit},
 * which keep the source's exits and the target's predecessors consistent.
 */
public final class Link {

    private final Block source;
    private final Block target;
    private final String exitcase;

    Link(Block source, Block target, String exitcase) {
        this.source = source;
        this.target = target;
        this.exitcase = exitcase;
    }

    public Block getSource() {
        return source;
    }

    public Block getTarget() {
        return target;
    }

    public String getExitcase() {
        return exitcase;
    }

    public boolean isConditional() {
        return exitcase != null;
    }

    @Override
    public String toString() {
        return source.getId() + " -> " + target.getId() + (exitcase == null ? "" : " [" + exitcase + "]");
    }
}
