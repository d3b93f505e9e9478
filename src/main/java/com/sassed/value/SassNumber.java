package com.sassed.value;

import com.sassed.error.EvalException;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;

/**
 * A number with numerator and denominator units, e.g. {@code 10px} or {@code 3px/s}.
 */
public record SassNumber(double value, List<String> numerators, List<String> denominators) implements Value {
    private static final double EPSILON = 1e-10;

    public SassNumber {
        numerators = List.copyOf(numerators);
        denominators = List.copyOf(denominators);
    }

    public static SassNumber of(double value) {
        return new SassNumber(value, List.of(), List.of());
    }

    public static SassNumber of(double value, String unit) {
        return unit == null || unit.isEmpty() ? of(value) : new SassNumber(value, List.of(unit), List.of());
    }

    public boolean isUnitless() {
        return numerators.isEmpty() && denominators.isEmpty();
    }

    public boolean hasUnit(String unit) {
        return denominators.isEmpty() && numerators.size() == 1 && numerators.get(0).equalsIgnoreCase(unit);
    }

    public String unit() {
        String unit = String.join("*", numerators);
        if (!denominators.isEmpty()) {
            unit += "/" + String.join("*", denominators);
        }
        return unit;
    }

    public boolean isInteger() {
        return Math.abs(value - Math.rint(value)) < EPSILON;
    }

    public int intValue() {
        return (int) Math.rint(value);
    }

    public SassNumber withValue(double newValue) {
        return new SassNumber(newValue, numerators, denominators);
    }

    public SassNumber plus(SassNumber other) {
        return withValue(value + other.valueIn(this));
    }

    public SassNumber minus(SassNumber other) {
        return withValue(value - other.valueIn(this));
    }

    public SassNumber modulo(SassNumber other) {
        double divisor = other.valueIn(this);
        double result = value % divisor;
        if (result != 0 && (result < 0) != (divisor < 0)) {
            result += divisor;
        }
        return withValue(result);
    }

    public SassNumber times(SassNumber other) {
        MutableList<String> top = Lists.mutable.withAll(numerators).withAll(other.numerators);
        MutableList<String> bottom = Lists.mutable.withAll(denominators).withAll(other.denominators);
        return simplify(value * other.value, top, bottom);
    }

    public SassNumber dividedBy(SassNumber other) {
        MutableList<String> top = Lists.mutable.withAll(numerators).withAll(other.denominators);
        MutableList<String> bottom = Lists.mutable.withAll(denominators).withAll(other.numerators);
        return simplify(value / other.value, top, bottom);
    }

    /**
     * Compares after converting {@code other} into this number's units.
     */
    public int compareTo(SassNumber other) {
        double converted = other.valueIn(this);
        if (Math.abs(value - converted) < EPSILON) {
            return 0;
        }
        return value < converted ? -1 : 1;
    }

    /**
     * This number's magnitude expressed in the units of {@code target}. A unitless side adopts
     * the other side's units.
     */
    public double valueIn(SassNumber target) {
        if (isUnitless() || target.isUnitless()) {
            return value;
        }
        if (numerators.size() == 1 && denominators.isEmpty()
                && target.numerators.size() == 1 && target.denominators.isEmpty()) {
            String from = numerators.get(0);
            String to = target.numerators.get(0);
            if (Units.comparable(from, to)) {
                return value * Units.factor(from, to);
            }
        } else if (unit().equals(target.unit())) {
            return value;
        }
        throw new EvalException("Incompatible units: '" + unit() + "' and '" + target.unit() + "'.");
    }

    public boolean comparableTo(SassNumber other) {
        try {
            valueIn(other);
            return true;
        } catch (EvalException e) {
            return false;
        }
    }

    /**
     * Cancels matching units, converting compatible ones into the numerator's unit.
     */
    private static SassNumber simplify(double value, MutableList<String> top, MutableList<String> bottom) {
        MutableList<String> remaining = Lists.mutable.empty();
        for (String unit : top) {
            int match = bottom.detectIndex(candidate -> Units.comparable(unit, candidate));
            if (match >= 0) {
                value *= Units.factor(unit, bottom.get(match));
                bottom.remove(match);
            } else {
                remaining.add(unit);
            }
        }
        return new SassNumber(value, remaining, bottom);
    }

    @Override
    public String typeName() {
        return "number";
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof SassNumber number)) {
            return false;
        }
        if (isUnitless() != number.isUnitless()) {
            return false;
        }
        return comparableTo(number) && compareTo(number) == 0;
    }

    @Override
    public int hashCode() {
        // Numbers in different but compatible units can be equal, so only unitless ones hash by value.
        return isUnitless() ? Double.hashCode(Math.rint(value * 1e5)) : numerators.size() * 31 + denominators.size();
    }
}
