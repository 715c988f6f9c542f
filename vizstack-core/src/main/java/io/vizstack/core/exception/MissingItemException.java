package io.vizstack.core.exception;

import java.io.Serial;

/// Thrown when a declared slot was never given a content item.
///
/// Raised for a switch mode, a grid cell or a DAG node that was declared but has no
/// associated item. The subject is the mode, cell or node name.
public class MissingItemException extends AssemblyException {

    @Serial private static final long serialVersionUID = -3021774095515190882L;

    public MissingItemException(String message, String subject) {
        super(message, subject);
    }
}
