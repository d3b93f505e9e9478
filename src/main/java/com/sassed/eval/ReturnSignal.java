package com.sassed.eval;

import com.sassed.value.Value;

/**
 * Unwinds a function body at {@code @return}.
 */
final class ReturnSignal extends RuntimeException {
    private final Value value;

    ReturnSignal(Value value) {
        super(null, null, false, false);
        this.value = value;
    }

    Value value() {
        return value;
    }
}
