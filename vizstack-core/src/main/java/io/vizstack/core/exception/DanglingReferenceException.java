package io.vizstack.core.exception;

import java.io.Serial;

/// Thrown when a DAG node parent, edge endpoint, port or alignment names something undeclared.
public class DanglingReferenceException extends AssemblyException {

    @Serial private static final long serialVersionUID = 6650831287045521374L;

    public DanglingReferenceException(String message, String subject) {
        super(message, subject);
    }
}
