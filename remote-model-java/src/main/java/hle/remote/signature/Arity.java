package hle.remote.signature;

/**
 * Whether one side of an operation carries a single value or a sequence of values.
 */
public enum Arity {
    ONE,
    MANY
}
