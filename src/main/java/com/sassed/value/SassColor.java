package com.sassed.value;

/**
 * An RGBA color. Channels are kept fractional in [0, 255] and rounded when printed. A color
 * written literally keeps its source text so it prints the way it was written.
 */
public record SassColor(double red, double green, double blue, double alpha, String original) implements Value {

    public SassColor {
        red = clamp(red, 255);
        green = clamp(green, 255);
        blue = clamp(blue, 255);
        alpha = clamp(alpha, 1);
    }

    public static SassColor rgb(double red, double green, double blue) {
        return new SassColor(red, green, blue, 1, null);
    }

    public static SassColor rgba(double red, double green, double blue, double alpha) {
        return new SassColor(red, green, blue, alpha, null);
    }

    /**
     * Parses {@code #rgb}, {@code #rgba}, {@code #rrggbb} or {@code #rrggbbaa}; null when
     * the text is not a hex color.
     */
    public static SassColor parseHex(String text) {
        String hex = text.startsWith("#") ? text.substring(1) : text;
        if (!hex.matches("[0-9a-fA-F]+")) {
            return null;
        }
        return switch (hex.length()) {
            case 3, 4 -> new SassColor(
                    Integer.parseInt(hex.substring(0, 1).repeat(2), 16),
                    Integer.parseInt(hex.substring(1, 2).repeat(2), 16),
                    Integer.parseInt(hex.substring(2, 3).repeat(2), 16),
                    hex.length() == 4 ? Integer.parseInt(hex.substring(3, 4).repeat(2), 16) / 255.0 : 1,
                    text);
            case 6, 8 -> new SassColor(
                    Integer.parseInt(hex.substring(0, 2), 16),
                    Integer.parseInt(hex.substring(2, 4), 16),
                    Integer.parseInt(hex.substring(4, 6), 16),
                    hex.length() == 8 ? Integer.parseInt(hex.substring(6, 8), 16) / 255.0 : 1,
                    text);
            default -> null;
        };
    }

    public static SassColor hsla(double hue, double saturation, double lightness, double alpha) {
        double h = (((hue % 360) + 360) % 360) / 360.0;
        double s = clamp(saturation, 100) / 100.0;
        double l = clamp(lightness, 100) / 100.0;
        double m2 = l <= 0.5 ? l * (s + 1) : l + s - l * s;
        double m1 = l * 2 - m2;
        return new SassColor(
                hueToRgb(m1, m2, h + 1.0 / 3) * 255,
                hueToRgb(m1, m2, h) * 255,
                hueToRgb(m1, m2, h - 1.0 / 3) * 255,
                alpha,
                null);
    }

    private static double hueToRgb(double m1, double m2, double h) {
        if (h < 0) {
            h += 1;
        }
        if (h > 1) {
            h -= 1;
        }
        if (h * 6 < 1) {
            return m1 + (m2 - m1) * h * 6;
        }
        if (h * 2 < 1) {
            return m2;
        }
        if (h * 3 < 2) {
            return m1 + (m2 - m1) * (2.0 / 3 - h) * 6;
        }
        return m1;
    }

    /**
     * Hue in degrees, saturation and lightness in percent.
     */
    public double[] toHsl() {
        double r = red / 255;
        double g = green / 255;
        double b = blue / 255;
        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double delta = max - min;
        double h = 0;
        if (delta != 0) {
            if (max == r) {
                h = 60 * (g - b) / delta;
            } else if (max == g) {
                h = 60 * (b - r) / delta + 120;
            } else {
                h = 60 * (r - g) / delta + 240;
            }
        }
        double l = (max + min) / 2;
        double s;
        if (delta == 0) {
            s = 0;
        } else if (l < 0.5) {
            s = delta / (max + min);
        } else {
            s = delta / (2 - max - min);
        }
        return new double[] {((h % 360) + 360) % 360, s * 100, l * 100};
    }

    public SassColor withAlpha(double newAlpha) {
        return new SassColor(red, green, blue, newAlpha, null);
    }

    /**
     * Applies {@code op} to each of the three channels, keeping alpha.
     */
    public SassColor mapChannels(java.util.function.DoubleBinaryOperator op, double r, double g, double b) {
        return new SassColor(op.applyAsDouble(red, r), op.applyAsDouble(green, g), op.applyAsDouble(blue, b), alpha, null);
    }

    public int redByte() {
        return (int) Math.round(red);
    }

    public int greenByte() {
        return (int) Math.round(green);
    }

    public int blueByte() {
        return (int) Math.round(blue);
    }

    private static double clamp(double value, double max) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Math.max(0, Math.min(max, value));
    }

    @Override
    public String typeName() {
        return "color";
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof SassColor color
                && color.redByte() == redByte()
                && color.greenByte() == greenByte()
                && color.blueByte() == blueByte()
                && Math.abs(color.alpha - alpha) < 1e-6;
    }

    @Override
    public int hashCode() {
        return ((redByte() * 31 + greenByte()) * 31 + blueByte()) * 31 + (int) Math.round(alpha * 1000);
    }
}
