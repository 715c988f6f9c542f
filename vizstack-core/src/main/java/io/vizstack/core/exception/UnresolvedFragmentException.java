package io.vizstack.core.exception;

import java.io.Serial;

/// Thrown when assembly finishes with a fragment id that has no resolved fragment.
///
/// Signals a fragment kind that registered a child id through the resolver callback but
/// never returned that child among its references, or a kind that embedded an id the
/// engine never issued. The subject is the unresolved fragment id.
public class UnresolvedFragmentException extends AssemblyException {

    @Serial private static final long serialVersionUID = 1862330075029317144L;

    public UnresolvedFragmentException(String message, String subject) {
        super(message, subject);
    }
}
