package hle.remote.signature;

import java.util.Objects;

/**
 * Arity and value types of one remote operation. Fixed once the signature is built.
 *
 * @param <I> the type of a single input value
 * @param <O> the type of a single output value
 */
public final class OperationShape<I, O> {

    private final Arity inputArity;
    private final Arity outputArity;
    private final Class<I> inputType;
    private final Class<O> outputType;
    private final CallKind callKind;

    private OperationShape(Arity inputArity, Arity outputArity, Class<I> inputType, Class<O> outputType) {
        this.inputArity = Objects.requireNonNull(inputArity, "inputArity cannot be null");
        this.outputArity = Objects.requireNonNull(outputArity, "outputArity cannot be null");
        this.inputType = Objects.requireNonNull(inputType, "inputType cannot be null");
        this.outputType = Objects.requireNonNull(outputType, "outputType cannot be null");
        this.callKind = CallKind.of(inputArity, outputArity);
    }

    public static <I, O> OperationShape<I, O> of(Arity inputArity, Arity outputArity,
                                                 Class<I> inputType, Class<O> outputType) {
        return new OperationShape<>(inputArity, outputArity, inputType, outputType);
    }

    public static <I, O> OperationShape<I, O> unary(Class<I> inputType, Class<O> outputType) {
        return of(Arity.ONE, Arity.ONE, inputType, outputType);
    }

    public static <I, O> OperationShape<I, O> streamIn(Class<I> inputType, Class<O> outputType) {
        return of(Arity.MANY, Arity.ONE, inputType, outputType);
    }

    public static <I, O> OperationShape<I, O> streamOut(Class<I> inputType, Class<O> outputType) {
        return of(Arity.ONE, Arity.MANY, inputType, outputType);
    }

    public Arity getInputArity() {
        return inputArity;
    }

    public Arity getOutputArity() {
        return outputArity;
    }

    public Class<I> getInputType() {
        return inputType;
    }

    public Class<O> getOutputType() {
        return outputType;
    }

    public CallKind getCallKind() {
        return callKind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OperationShape)) {
            return false;
        }
        OperationShape<?, ?> other = (OperationShape<?, ?>) o;
        return inputArity == other.inputArity
                && outputArity == other.outputArity
                && inputType.equals(other.inputType)
                && outputType.equals(other.outputType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputArity, outputArity, inputType, outputType);
    }

    @Override
    public String toString() {
        return String.format("%s(%s%s) -> %s%s", callKind,
                inputType.getSimpleName(), inputArity == Arity.MANY ? "*" : "",
                outputType.getSimpleName(), outputArity == Arity.MANY ? "*" : "");
    }
}
