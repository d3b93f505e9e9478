package com.sassed.value;

import com.sassed.error.EvalException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.stream.Collectors;

/**
 * Turns values into CSS text, honouring numeric precision and the compressed style's shorter forms.
 */
public class ValueFormatter {
    public static final int DEFAULT_PRECISION = 5;

    private final int precision;
    private final boolean compressed;

    public ValueFormatter(int precision, boolean compressed) {
        this.precision = precision;
        this.compressed = compressed;
    }

    public ValueFormatter() {
        this(DEFAULT_PRECISION, false);
    }

    /**
     * Text for a declaration value. Maps and numbers with compound units are not CSS.
     */
    public String toCss(Value value) {
        if (value instanceof SassMap) {
            throw new EvalException(inspect(value) + " isn't a valid CSS value.");
        }
        if (value instanceof SassNumber number && (number.numerators().size() > 1 || !number.denominators().isEmpty())) {
            throw new EvalException(inspect(value) + " isn't a valid CSS value.");
        }
        if (value instanceof SassList list) {
            return formatList(list, this::toCss);
        }
        return format(value, true);
    }

    /**
     * Text for {@code #{}}: strings lose their quotes and null becomes empty.
     */
    public String interpolate(Value value) {
        if (value instanceof SassString string) {
            return string.text();
        }
        if (value instanceof SassList list) {
            return formatList(list, this::interpolate);
        }
        if (value instanceof SassMap) {
            return inspect(value);
        }
        return format(value, true);
    }

    /**
     * Debug representation, as printed by {@code @debug} and {@code inspect()}.
     */
    public String inspect(Value value) {
        if (value instanceof SassNull) {
            return "null";
        }
        if (value instanceof SassMap map) {
            return map.entries().entrySet().stream()
                    .map(entry -> inspect(entry.getKey()) + ": " + inspect(entry.getValue()))
                    .collect(Collectors.joining(", ", "(", ")"));
        }
        if (value instanceof SassList list) {
            if (list.items().isEmpty()) {
                return list.bracketed() ? "[]" : "()";
            }
            String joined = list.items().stream()
                    .map(item -> item instanceof SassList nested && !nested.bracketed()
                            && nested.items().size() > 1 && list.separator() != ListSeparator.COMMA
                            ? "(" + inspect(item) + ")" : inspect(item))
                    .collect(Collectors.joining(list.separator().text(false)));
            if (list.bracketed()) {
                return "[" + joined + "]";
            }
            return list.items().size() == 1 && list.separator() == ListSeparator.COMMA ? "(" + joined + ",)" : joined;
        }
        if (value instanceof SassNumber number) {
            return formatNumber(number) + number.unit();
        }
        return format(value, false);
    }

    private String formatList(SassList list, java.util.function.Function<Value, String> itemFormatter) {
        String joined = list.items().stream()
                .filter(item -> !(item instanceof SassNull))
                .map(itemFormatter)
                .filter(text -> !text.isEmpty())
                .collect(Collectors.joining(list.separator().text(compressed)));
        return list.bracketed() ? "[" + joined + "]" : joined;
    }

    private String format(Value value, boolean css) {
        if (value instanceof SassNull) {
            return "";
        }
        if (value instanceof SassBoolean bool) {
            return Boolean.toString(bool.value());
        }
        if (value instanceof SassNumber number) {
            return formatNumber(number) + number.unit();
        }
        if (value instanceof SassColor color) {
            return formatColor(color);
        }
        if (value instanceof SassString string) {
            return string.quoted() ? quote(string.text()) : string.text();
        }
        if (value instanceof SassList list) {
            return formatList(list, item -> format(item, css));
        }
        return inspect(value);
    }

    public String formatNumber(SassNumber number) {
        double value = number.value();
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(precision, RoundingMode.HALF_UP).stripTrailingZeros();
        if (rounded.signum() == 0) {
            return "0";
        }
        String text = rounded.toPlainString();
        if (compressed) {
            if (text.startsWith("0.")) {
                text = text.substring(1);
            } else if (text.startsWith("-0.")) {
                text = "-" + text.substring(2);
            }
        }
        return text;
    }

    public String formatColor(SassColor color) {
        if (color.original() != null) {
            return compressed ? shortenHex(color.original()) : color.original();
        }
        if (color.alpha() < 1) {
            String separator = compressed ? "," : ", ";
            return "rgba(" + color.redByte() + separator + color.greenByte() + separator + color.blueByte()
                    + separator + formatNumber(SassNumber.of(color.alpha())) + ")";
        }
        String hex = String.format("#%02x%02x%02x", color.redByte(), color.greenByte(), color.blueByte());
        return compressed ? shortenHex(hex) : hex;
    }

    private static String shortenHex(String hex) {
        if (hex.length() == 7 && hex.startsWith("#")
                && hex.charAt(1) == hex.charAt(2) && hex.charAt(3) == hex.charAt(4) && hex.charAt(5) == hex.charAt(6)) {
            return "#" + hex.charAt(1) + hex.charAt(3) + hex.charAt(5);
        }
        return hex;
    }

    static String quote(String text) {
        boolean hasDouble = text.indexOf('"') >= 0 && !text.contains("\\\"");
        if (hasDouble && text.indexOf('\'') < 0) {
            return "'" + text + "'";
        }
        return "\"" + text.replaceAll("(?<!\\\\)\"", "\\\\\"") + "\"";
    }

    public boolean compressed() {
        return compressed;
    }

    public int precision() {
        return precision;
    }

    /**
     * Convenience for error messages.
     */
    public static String describe(Value value) {
        return new ValueFormatter().inspect(value);
    }
}
