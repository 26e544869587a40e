package io.spekcheck.core.error;

/**
 * Abstract parent for precondition failures of derived quantities: asking a path or setup for a
 * value it cannot compute with its current contents. These are never replaced by a default value.
 */
public abstract class ComputationException extends SpekCheckException {

    private static final long serialVersionUID = 1L;

    protected ComputationException(String message, String subject) {
        super(message, subject, Phase.COMPUTATION);
    }
}
