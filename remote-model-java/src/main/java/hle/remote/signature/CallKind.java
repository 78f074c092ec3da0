package hle.remote.signature;

import hle.remote.client.ConfigurationException;

/**
 * Transport call shape of an operation, derived from its input and output arity.
 */
public enum CallKind {
    /** One request, one response. */
    UNARY(Arity.ONE, Arity.ONE),
    /** A sequence of requests, one response. */
    STREAM_IN(Arity.MANY, Arity.ONE),
    /** One request, a sequence of responses. */
    STREAM_OUT(Arity.ONE, Arity.MANY);

    private final Arity inputArity;
    private final Arity outputArity;

    CallKind(Arity inputArity, Arity outputArity) {
        this.inputArity = inputArity;
        this.outputArity = outputArity;
    }

    public Arity getInputArity() {
        return inputArity;
    }

    public Arity getOutputArity() {
        return outputArity;
    }

    /**
     * @throws ConfigurationException for MANY to MANY, which would need a bidirectional stream
     */
    public static CallKind of(Arity inputArity, Arity outputArity) {
        for (CallKind kind : values()) {
            if (kind.inputArity == inputArity && kind.outputArity == outputArity) {
                return kind;
            }
        }
        throw new ConfigurationException(
            "Bidirectional streaming (" + inputArity + " -> " + outputArity + ") is not supported");
    }
}
