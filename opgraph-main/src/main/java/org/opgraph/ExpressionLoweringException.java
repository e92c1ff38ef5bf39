package org.opgraph;

/**
 * Raised while lowering a parsed tree into operations: an unexpected node
 * shape, an operator outside the supported set, or a literal zero divisor.
 */
public class ExpressionLoweringException extends OpGraphException {

    private final String nodeDescription;

    public ExpressionLoweringException(ErrorKind kind, String nodeDescription) {
        super(kind, kind.getDescription() + ": " + nodeDescription);
        this.nodeDescription = nodeDescription;
    }

    public ExpressionLoweringException(ErrorKind kind, String message, String nodeDescription) {
        super(kind, message);
        this.nodeDescription = nodeDescription;
    }

    public String getNodeDescription() {
        return nodeDescription;
    }
}
