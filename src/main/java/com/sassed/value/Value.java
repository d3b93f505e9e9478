package com.sassed.value;

import java.util.List;

/**
 * A SassScript value. Only {@code false} and {@code null} are falsy.
 */
public sealed interface Value permits SassNumber, SassColor, SassString, SassBoolean, SassNull, SassList, SassMap {

    default boolean isTruthy() {
        return true;
    }

    /**
     * Name reported by {@code type-of()}.
     */
    String typeName();

    /**
     * This value seen as a list; single values are one-element lists.
     */
    default List<Value> asList() {
        return List.of(this);
    }

    default ListSeparator separator() {
        return ListSeparator.UNDECIDED;
    }
}
