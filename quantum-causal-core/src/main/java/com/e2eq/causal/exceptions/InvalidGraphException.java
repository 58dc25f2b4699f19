package com.e2eq.causal.exceptions;

/**
 * Thrown when an influence map cannot be turned into a signed graph.
 * <p>
 * Typical causes are an edge without a sign attribute, or a sign value that the
 * configured sign convention does not recognise. The offending edge endpoints
 * and raw value are kept so callers can report them.
 * </p>
 */
public class InvalidGraphException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String sourceNode;
    private final String targetNode;
    private final Object rawSign;

    public InvalidGraphException(String sourceNode, String targetNode, Object rawSign) {
        super(buildMessage(sourceNode, targetNode, rawSign));
        this.sourceNode = sourceNode;
        this.targetNode = targetNode;
        this.rawSign = rawSign;
    }

    private static String buildMessage(String sourceNode, String targetNode, Object rawSign) {
        if (rawSign == null) {
            return String.format("Edge '%s' -> '%s' has no sign", sourceNode, targetNode);
        }
        return String.format("Edge '%s' -> '%s' has unrecognised sign '%s'", sourceNode, targetNode, rawSign);
    }

    /**
     * Source node id of the offending edge.
     */
    public String getSourceNode() {
        return sourceNode;
    }

    /**
     * Target node id of the offending edge.
     */
    public String getTargetNode() {
        return targetNode;
    }

    public Object getRawSign() {
        return rawSign;
    }
}
