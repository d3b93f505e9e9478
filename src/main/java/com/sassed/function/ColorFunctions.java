package com.sassed.function;

import com.sassed.value.SassColor;
import com.sassed.value.SassNumber;
import com.sassed.value.SassString;
import com.sassed.value.Value;

final class ColorFunctions {

    private ColorFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.define("rgb($red, $green, $blue)", args -> SassColor.rgb(
                channel(args, "red"), channel(args, "green"), channel(args, "blue")));

        registry.define("rgba($red, $green: null, $blue: null, $alpha: null)", args -> {
            if (args.value("red") instanceof SassColor color) {
                if (args.isNull("green")) {
                    throw args.error("Missing argument $alpha.");
                }
                return color.withAlpha(args.inRange("green", 0, 1));
            }
            if (args.isNull("green") || args.isNull("blue") || args.isNull("alpha")) {
                throw args.error("Missing argument $" + (args.isNull("green") ? "green" : args.isNull("blue") ? "blue" : "alpha") + ".");
            }
            return SassColor.rgba(channel(args, "red"), channel(args, "green"), channel(args, "blue"),
                    args.inRange("alpha", 0, 1));
        });

        registry.define("hsl($hue, $saturation, $lightness)", args -> SassColor.hsla(
                args.number("hue").value(), args.number("saturation").value(), args.number("lightness").value(), 1));

        registry.define("hsla($hue, $saturation, $lightness, $alpha)", args -> SassColor.hsla(
                args.number("hue").value(), args.number("saturation").value(), args.number("lightness").value(),
                args.inRange("alpha", 0, 1)));

        registry.define("red($color)", args -> SassNumber.of(args.color("color").redByte()));
        registry.define("green($color)", args -> SassNumber.of(args.color("color").greenByte()));
        registry.define("blue($color)", args -> SassNumber.of(args.color("color").blueByte()));
        registry.define("hue($color)", args -> SassNumber.of(args.color("color").toHsl()[0], "deg"));
        registry.define("saturation($color)", args -> SassNumber.of(args.color("color").toHsl()[1], "%"));
        registry.define("lightness($color)", args -> SassNumber.of(args.color("color").toHsl()[2], "%"));

        registry.define("alpha($color)", args -> {
            if (args.value("color") instanceof SassString string) {
                return SassString.unquoted("alpha(" + string.text() + ")");
            }
            return SassNumber.of(args.color("color").alpha());
        });
        registry.define("opacity($color)", args -> {
            if (args.value("color") instanceof SassNumber number) {
                return cssFunction(args, "opacity", number);
            }
            return SassNumber.of(args.color("color").alpha());
        });

        registry.define("mix($color1, $color2, $weight: 50%)", args ->
                mix(args.color("color1"), args.color("color2"), args.inRange("weight", 0, 100) / 100));

        registry.define("lighten($color, $amount)", args -> adjustHsl(args, 0, 0, args.inRange("amount", 0, 100)));
        registry.define("darken($color, $amount)", args -> adjustHsl(args, 0, 0, -args.inRange("amount", 0, 100)));
        registry.define("saturate($color, $amount: null)", args -> {
            if (args.value("color") instanceof SassNumber number && args.isNull("amount")) {
                return cssFunction(args, "saturate", number);
            }
            return adjustHsl(args, 0, args.inRange("amount", 0, 100), 0);
        });
        registry.define("desaturate($color, $amount)", args -> adjustHsl(args, 0, -args.inRange("amount", 0, 100), 0));
        registry.define("adjust-hue($color, $degrees)", args -> adjustHsl(args, args.number("degrees").value(), 0, 0));
        registry.define("complement($color)", args -> adjustHsl(args, 180, 0, 0));
        registry.define("grayscale($color)", args -> {
            if (args.value("color") instanceof SassNumber number) {
                return cssFunction(args, "grayscale", number);
            }
            return adjustHsl(args, 0, -100, 0);
        });
        registry.define("invert($color)", args -> {
            if (args.value("color") instanceof SassNumber number) {
                return cssFunction(args, "invert", number);
            }
            SassColor color = args.color("color");
            return new SassColor(255 - color.red(), 255 - color.green(), 255 - color.blue(), color.alpha(), null);
        });

        registry.define("opacify($color, $amount)", args -> fade(args, 1));
        registry.define("fade-in($color, $amount)", args -> fade(args, 1));
        registry.define("transparentize($color, $amount)", args -> fade(args, -1));
        registry.define("fade-out($color, $amount)", args -> fade(args, -1));

        registry.define("adjust-color($color, $red: null, $green: null, $blue: null, $hue: null, $saturation: null, "
                + "$lightness: null, $alpha: null)", ColorFunctions::adjustColor);
        registry.define("scale-color($color, $red: null, $green: null, $blue: null, $saturation: null, "
                + "$lightness: null, $alpha: null)", ColorFunctions::scaleColor);
        registry.define("change-color($color, $red: null, $green: null, $blue: null, $hue: null, $saturation: null, "
                + "$lightness: null, $alpha: null)", ColorFunctions::changeColor);

        registry.define("ie-hex-str($color)", args -> {
            SassColor color = args.color("color");
            return SassString.unquoted(String.format("#%02X%02X%02X%02X", Math.round(color.alpha() * 255),
                    color.redByte(), color.greenByte(), color.blueByte()));
        });
    }

    /**
     * A channel given as 0-255 or as a percentage of 255.
     */
    private static double channel(Arguments args, String name) {
        SassNumber number = args.number(name);
        if (number.hasUnit("%")) {
            return number.value() * 255 / 100;
        }
        return number.value();
    }

    private static Value cssFunction(Arguments args, String name, SassNumber number) {
        return SassString.unquoted(name + "(" + args.formatter().inspect(number) + ")");
    }

    static SassColor mix(SassColor first, SassColor second, double weight) {
        double w = weight * 2 - 1;
        double a = first.alpha() - second.alpha();
        double w1 = ((w * a == -1 ? w : (w + a) / (1 + w * a)) + 1) / 2.0;
        double w2 = 1 - w1;
        return new SassColor(
                first.red() * w1 + second.red() * w2,
                first.green() * w1 + second.green() * w2,
                first.blue() * w1 + second.blue() * w2,
                first.alpha() * weight + second.alpha() * (1 - weight),
                null);
    }

    private static Value adjustHsl(Arguments args, double hue, double saturation, double lightness) {
        SassColor color = args.color("color");
        double[] hsl = color.toHsl();
        return SassColor.hsla(hsl[0] + hue, clampPercent(hsl[1] + saturation), clampPercent(hsl[2] + lightness),
                color.alpha());
    }

    private static Value fade(Arguments args, int direction) {
        SassColor color = args.color("color");
        double amount = args.inRange("amount", 0, 1);
        return color.withAlpha(color.alpha() + direction * amount);
    }

    private static Value adjustColor(Arguments args) {
        SassColor color = args.color("color");
        boolean rgb = !args.isNull("red") || !args.isNull("green") || !args.isNull("blue");
        boolean hsl = !args.isNull("hue") || !args.isNull("saturation") || !args.isNull("lightness");
        if (rgb && hsl) {
            throw args.error("Cannot specify HSL and RGB values for a color at the same time for `adjust-color'");
        }
        double alpha = color.alpha() + optional(args, "alpha", 0);
        if (rgb) {
            return new SassColor(color.red() + optional(args, "red", 0), color.green() + optional(args, "green", 0),
                    color.blue() + optional(args, "blue", 0), alpha, null);
        }
        if (hsl) {
            double[] values = color.toHsl();
            return SassColor.hsla(values[0] + optional(args, "hue", 0),
                    clampPercent(values[1] + optional(args, "saturation", 0)),
                    clampPercent(values[2] + optional(args, "lightness", 0)), alpha);
        }
        return color.withAlpha(alpha);
    }

    private static Value scaleColor(Arguments args) {
        SassColor color = args.color("color");
        boolean rgb = !args.isNull("red") || !args.isNull("green") || !args.isNull("blue");
        boolean hsl = !args.isNull("saturation") || !args.isNull("lightness");
        if (rgb && hsl) {
            throw args.error("Cannot specify HSL and RGB values for a color at the same time for `scale-color'");
        }
        double alpha = scale(color.alpha(), optional(args, "alpha", 0), 1);
        if (rgb) {
            return new SassColor(scale(color.red(), optional(args, "red", 0), 255),
                    scale(color.green(), optional(args, "green", 0), 255),
                    scale(color.blue(), optional(args, "blue", 0), 255), alpha, null);
        }
        if (hsl) {
            double[] values = color.toHsl();
            return SassColor.hsla(values[0], scale(values[1], optional(args, "saturation", 0), 100),
                    scale(values[2], optional(args, "lightness", 0), 100), alpha);
        }
        return color.withAlpha(alpha);
    }

    private static Value changeColor(Arguments args) {
        SassColor color = args.color("color");
        boolean rgb = !args.isNull("red") || !args.isNull("green") || !args.isNull("blue");
        boolean hsl = !args.isNull("hue") || !args.isNull("saturation") || !args.isNull("lightness");
        if (rgb && hsl) {
            throw args.error("Cannot specify HSL and RGB values for a color at the same time for `change-color'");
        }
        double alpha = optional(args, "alpha", color.alpha());
        if (rgb) {
            return new SassColor(optional(args, "red", color.red()), optional(args, "green", color.green()),
                    optional(args, "blue", color.blue()), alpha, null);
        }
        if (hsl) {
            double[] values = color.toHsl();
            return SassColor.hsla(optional(args, "hue", values[0]), optional(args, "saturation", values[1]),
                    optional(args, "lightness", values[2]), alpha);
        }
        return color.withAlpha(alpha);
    }

    /**
     * Moves {@code current} toward {@code max} (or 0 for a negative percentage) by {@code percent}.
     */
    private static double scale(double current, double percent, double max) {
        double factor = percent / 100;
        return factor > 0 ? current + (max - current) * factor : current + current * factor;
    }

    private static double optional(Arguments args, String name, double fallback) {
        return args.isNull(name) ? fallback : args.number(name).value();
    }

    private static double clampPercent(double value) {
        return Math.max(0, Math.min(100, value));
    }
}
