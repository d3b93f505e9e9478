package com.sassed.function;

import com.sassed.error.EvalException;
import com.sassed.value.SassColor;
import com.sassed.value.SassList;
import com.sassed.value.SassMap;
import com.sassed.value.SassNull;
import com.sassed.value.SassNumber;
import com.sassed.value.SassString;
import com.sassed.value.Value;
import com.sassed.value.ValueFormatter;

import java.util.List;
import java.util.Map;

/**
 * Bound arguments of one built-in call, with typed accessors that report the libsass-style
 * "argument `$x` of `f($x)` must be a ..." error on a type mismatch.
 */
public class Arguments {
    private final BuiltinFunction function;
    private final Map<String, Value> values;
    private final FunctionContext context;

    public Arguments(BuiltinFunction function, Map<String, Value> values, FunctionContext context) {
        this.function = function;
        this.values = values;
        this.context = context;
    }

    public FunctionContext context() {
        return context;
    }

    public Value value(String name) {
        Value value = values.get(name);
        return value != null ? value : SassNull.INSTANCE;
    }

    public boolean isNull(String name) {
        return value(name) instanceof SassNull;
    }

    public SassNumber number(String name) {
        if (value(name) instanceof SassNumber number) {
            return number;
        }
        throw typeError(name, "a number");
    }

    public SassColor color(String name) {
        if (value(name) instanceof SassColor color) {
            return color;
        }
        throw typeError(name, "a color");
    }

    public SassString string(String name) {
        if (value(name) instanceof SassString string) {
            return string;
        }
        throw typeError(name, "a string");
    }

    public SassMap map(String name) {
        Value value = value(name);
        if (value instanceof SassMap map) {
            return map;
        }
        if (value instanceof SassList list && list.items().isEmpty()) {
            return SassMap.EMPTY;
        }
        throw typeError(name, "a map");
    }

    public List<Value> list(String name) {
        return value(name).asList();
    }

    /**
     * A number that must lie within [min, max] in its own units.
     */
    public double inRange(String name, double min, double max) {
        SassNumber number = number(name);
        if (number.value() < min || number.value() > max) {
            throw new EvalException("argument `$" + name + "` of `" + function.signature() + "` must be between "
                    + format(min) + " and " + format(max));
        }
        return number.value();
    }

    public int integer(String name) {
        SassNumber number = number(name);
        if (!number.isInteger()) {
            throw typeError(name, "an integer");
        }
        return number.intValue();
    }

    public ValueFormatter formatter() {
        return context.formatter();
    }

    public EvalException error(String message) {
        return new EvalException(message);
    }

    private EvalException typeError(String name, String expected) {
        return new EvalException("argument `$" + name + "` of `" + function.signature() + "` must be " + expected);
    }

    private static String format(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }
}
