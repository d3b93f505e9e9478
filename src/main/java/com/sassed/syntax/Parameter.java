package com.sassed.syntax;

/**
 * A mixin or function parameter; {@code defaultValue} is null for required parameters.
 */
public record Parameter(String name, Expression defaultValue) {
}
