package io.vizstack.core.exception;

import java.io.Serial;

/// Thrown by the grid-spec parser for empty, ragged or non-rectangular specifications.
///
/// The subject is the offending cell character, or null when the whole specification is
/// rejected (no rows, rows of unequal length).
public class MalformedGridSpecException extends AssemblyException {

    @Serial private static final long serialVersionUID = -7825412069367715520L;

    public MalformedGridSpecException(String message, String subject) {
        super(message, subject);
    }
}
