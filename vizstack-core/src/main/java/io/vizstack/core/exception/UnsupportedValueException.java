package io.vizstack.core.exception;

import java.io.Serial;

/// Thrown when a referenced value is neither a fragment assembler nor viewable, and the
/// configured default-view resolver cannot produce a view for it.
///
/// The subject is the runtime class name of the rejected value.
public class UnsupportedValueException extends AssemblyException {

    @Serial private static final long serialVersionUID = -1290453312870458706L;

    public UnsupportedValueException(String message, String subject) {
        super(message, subject);
    }
}
