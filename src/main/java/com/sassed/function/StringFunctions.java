package com.sassed.function;

import com.sassed.value.SassNull;
import com.sassed.value.SassNumber;
import com.sassed.value.SassString;
import com.sassed.value.Value;

import java.util.concurrent.atomic.AtomicLong;

final class StringFunctions {
    private static final AtomicLong UNIQUE_IDS = new AtomicLong();

    private StringFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.define("unquote($string)", args -> {
            Value value = args.value("string");
            if (value instanceof SassString string) {
                return SassString.unquoted(string.text());
            }
            return value;
        });
        registry.define("quote($string)", args -> {
            Value value = args.value("string");
            if (value instanceof SassString string) {
                return SassString.quoted(string.text());
            }
            return SassString.quoted(args.formatter().interpolate(value));
        });
        registry.define("str-length($string)", args ->
                SassNumber.of(args.string("string").text().codePointCount(0, args.string("string").text().length())));

        registry.define("str-insert($string, $insert, $index)", args -> {
            SassString string = args.string("string");
            String text = string.text();
            String insert = args.string("insert").text();
            int index = args.integer("index");
            int length = text.length();
            int at;
            if (index > 0) {
                at = Math.min(index - 1, length);
            } else if (index == 0) {
                at = 0;
            } else {
                at = Math.max(length + index + 1, 0);
            }
            return new SassString(text.substring(0, at) + insert + text.substring(at), string.quoted());
        });

        registry.define("str-index($string, $substring)", args -> {
            int index = args.string("string").text().indexOf(args.string("substring").text());
            return index < 0 ? SassNull.INSTANCE : SassNumber.of(index + 1);
        });

        registry.define("str-slice($string, $start-at, $end-at: -1)", args -> {
            SassString string = args.string("string");
            String text = string.text();
            int length = text.length();
            int start = args.integer("start-at");
            int end = args.integer("end-at");
            if (start < 0) {
                start = length + start + 1;
            }
            if (end < 0) {
                end = length + end + 1;
            }
            start = Math.max(start, 1);
            end = Math.min(end, length);
            if (start > end) {
                return new SassString("", string.quoted());
            }
            return new SassString(text.substring(start - 1, end), string.quoted());
        });

        registry.define("to-upper-case($string)", args -> {
            SassString string = args.string("string");
            return new SassString(string.text().toUpperCase(), string.quoted());
        });
        registry.define("to-lower-case($string)", args -> {
            SassString string = args.string("string");
            return new SassString(string.text().toLowerCase(), string.quoted());
        });

        registry.define("unique-id()", args ->
                SassString.unquoted("u" + Long.toString(UNIQUE_IDS.incrementAndGet() + 0x10000000L, 36)));
    }
}
