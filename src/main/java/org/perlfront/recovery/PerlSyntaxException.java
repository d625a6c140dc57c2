package org.perlfront.recovery;

import org.perlfront.astnode.Node;

/**
 * Thrown by grammar rules when the input does not match. Always caught inside the
 * parser and turned into an error node by {@link ErrorRecovery}.
 */
public class PerlSyntaxException extends RuntimeException {
    private final ParseError error;
    private final transient Node partial;

    public PerlSyntaxException(ParseError error) {
        this(error, null);
    }

    /**
     * @param partial the part of the construct that parsed before the failure, or null
     */
    public PerlSyntaxException(ParseError error, Node partial) {
        super(error.getMessage());
        this.error = error;
        this.partial = partial;
    }

    public ParseError getError() {
        return error;
    }

    public Node getPartial() {
        return partial;
    }
}
