package io.vizstack.core.exception;

import java.io.Serial;

/// Base class for all failures raised while assembling a view.
///
/// Assembly failures are programmer or configuration errors, never transient conditions.
/// They abort the whole assembly run so that a partial fragment table never reaches a renderer.
/// Every exception names the offending subject: a fragment id, a slot, a mode, a cell, a node,
/// a port or an edge, depending on the subclass.
///
/// @see MissingItemException
/// @see DanglingReferenceException
/// @see MalformedGridSpecException
/// @see UnresolvedFragmentException
/// @see UnsupportedValueException
public class AssemblyException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4417265519238870411L;

    private final String subject;

    /// Creates an exception with a message and the identifier it concerns.
    ///
    /// @param message description of the failure, not null
    /// @param subject identifier of the offending element, may be null when unknown
    public AssemblyException(String message, String subject) {
        super(message);
        this.subject = subject;
    }

    /// Returns the identifier of the element that caused the failure.
    ///
    /// @return offending id, slot or name, or null if not applicable
    public String getSubject() {
        return subject;
    }
}
