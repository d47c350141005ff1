package com.agentflow.engine.agent;

/**
 * Accumulates streamed agent output between periodic flushes.
 */
public class OutputBuffer {

    private final StringBuilder output = new StringBuilder();
    private boolean dirty;

    public synchronized void append(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return;
        }
        output.append(chunk);
        dirty = true;
    }

    /**
     * @return the full output if anything was appended since the last call, otherwise null
     */
    public synchronized String takeIfDirty() {
        if (!dirty) {
            return null;
        }
        dirty = false;
        return output.toString();
    }

    public synchronized String contents() {
        return output.toString();
    }
}
