package com.sassed.function;

import com.sassed.error.EvalException;
import com.sassed.value.SassBoolean;
import com.sassed.value.SassNumber;
import com.sassed.value.SassString;
import com.sassed.value.Value;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleUnaryOperator;

final class MathFunctions {

    private MathFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.define("percentage($number)", args -> {
            SassNumber number = args.number("number");
            if (!number.isUnitless()) {
                throw args.error("argument `$number` of `percentage($number)` must be a unitless number");
            }
            return SassNumber.of(number.value() * 100, "%");
        });
        registry.define("round($number)", args -> apply(args, MathFunctions::roundHalfUp));
        registry.define("ceil($number)", args -> apply(args, Math::ceil));
        registry.define("floor($number)", args -> apply(args, Math::floor));
        registry.define("abs($number)", args -> apply(args, Math::abs));

        registry.define("min($numbers...)", args -> extreme(args, -1));
        registry.define("max($numbers...)", args -> extreme(args, 1));

        registry.define("random($limit: null)", args -> {
            if (args.isNull("limit")) {
                return SassNumber.of(ThreadLocalRandom.current().nextDouble());
            }
            int limit = args.integer("limit");
            if (limit < 1) {
                throw args.error("$limit " + limit + " must be greater than or equal to 1 for `random'");
            }
            return SassNumber.of(ThreadLocalRandom.current().nextInt(limit) + 1);
        });

        registry.define("unit($number)", args -> SassString.quoted(args.number("number").unit()));
        registry.define("unitless($number)", args -> SassBoolean.of(args.number("number").isUnitless()));
        registry.define("comparable($number1, $number2)", args ->
                SassBoolean.of(args.number("number1").comparableTo(args.number("number2"))));
    }

    private static Value apply(Arguments args, DoubleUnaryOperator op) {
        SassNumber number = args.number("number");
        return number.withValue(op.applyAsDouble(number.value()));
    }

    private static double roundHalfUp(double value) {
        return Math.floor(value + 0.5);
    }

    private static Value extreme(Arguments args, int direction) {
        List<Value> values = args.list("numbers");
        if (values.isEmpty()) {
            throw args.error("At least one argument must be passed.");
        }
        SassNumber best = null;
        for (Value value : values) {
            if (!(value instanceof SassNumber number)) {
                throw new EvalException(args.formatter().inspect(value) + " is not a number for `"
                        + (direction < 0 ? "min" : "max") + "'");
            }
            if (best == null || Integer.signum(number.compareTo(best)) == direction) {
                best = number;
            }
        }
        return best;
    }
}
