package com.vsharp.vgc.api;

/**
 * Thrown when two connected slots carry different value types, or when a
 * generic group is asked to bind to a type that conflicts with its existing
 * resolution.
 */
public class TypeMismatchException extends IllegalArgumentException {
    private final ValueType expected;
    private final ValueType actual;

    public TypeMismatchException(String message, ValueType expected, ValueType actual) {
        super(message);
        this.expected = expected;
        this.actual = actual;
    }

    public static TypeMismatchException forConnection(Slot from, Slot to) {
        return new TypeMismatchException(
                "Type mismatch: " + from + " -> " + to, to.type(), from.type());
    }

    public ValueType expected() {
        return expected;
    }

    public ValueType actual() {
        return actual;
    }
}
