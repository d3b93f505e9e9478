package com.sassed.value;

import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Conversion factors between compatible CSS units. Each unit maps to its size in the base unit
 * of its dimension (px, deg, s, Hz, dppx).
 */
public final class Units {
    private static final MutableMap<String, Double> FACTORS = Maps.mutable.empty();
    private static final MutableMap<String, String> DIMENSIONS = Maps.mutable.empty();

    static {
        length("px", 1.0);
        length("in", 96.0);
        length("cm", 96.0 / 2.54);
        length("mm", 96.0 / 25.4);
        length("q", 96.0 / 101.6);
        length("pt", 96.0 / 72.0);
        length("pc", 16.0);
        define("angle", "deg", 1.0);
        define("angle", "grad", 0.9);
        define("angle", "rad", 180.0 / Math.PI);
        define("angle", "turn", 360.0);
        define("time", "s", 1.0);
        define("time", "ms", 0.001);
        define("frequency", "hz", 1.0);
        define("frequency", "khz", 1000.0);
        define("resolution", "dppx", 1.0);
        define("resolution", "dpi", 1.0 / 96.0);
        define("resolution", "dpcm", 2.54 / 96.0);
    }

    private Units() {
    }

    private static void length(String unit, double factor) {
        define("length", unit, factor);
    }

    private static void define(String dimension, String unit, double factor) {
        FACTORS.put(unit, factor);
        DIMENSIONS.put(unit, dimension);
    }

    public static boolean comparable(String from, String to) {
        if (from.equalsIgnoreCase(to)) {
            return true;
        }
        String a = DIMENSIONS.get(from.toLowerCase());
        return a != null && a.equals(DIMENSIONS.get(to.toLowerCase()));
    }

    /**
     * How many {@code to} units fit in one {@code from} unit. Callers check {@link #comparable} first.
     */
    public static double factor(String from, String to) {
        if (from.equalsIgnoreCase(to)) {
            return 1.0;
        }
        return FACTORS.get(from.toLowerCase()) / FACTORS.get(to.toLowerCase());
    }
}
