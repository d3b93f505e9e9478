package com.sassed.function;

import com.sassed.value.ListSeparator;
import com.sassed.value.SassBoolean;
import com.sassed.value.SassList;
import com.sassed.value.SassMap;
import com.sassed.value.SassNull;
import com.sassed.value.SassNumber;
import com.sassed.value.SassString;
import com.sassed.value.Value;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;

final class ListFunctions {

    private ListFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.define("length($list)", args -> SassNumber.of(args.list("list").size()));

        registry.define("nth($list, $n)", args -> {
            List<Value> items = args.list("list");
            return items.get(index(args, items, "n"));
        });

        registry.define("set-nth($list, $n, $value)", args -> {
            Value list = args.value("list");
            MutableList<Value> items = Lists.mutable.withAll(list.asList());
            items.set(index(args, items, "n"), args.value("value"));
            return new SassList(items, list.separator(), list instanceof SassList l && l.bracketed());
        });

        registry.define("join($list1, $list2, $separator: auto, $bracketed: auto)", args -> {
            Value first = args.value("list1");
            Value second = args.value("list2");
            MutableList<Value> items = Lists.mutable.withAll(first.asList()).withAll(second.asList());
            ListSeparator separator = separator(args, first.asList().size() > 1 || first instanceof SassMap
                    ? first.separator() : second.separator());
            boolean bracketed = first instanceof SassList list && list.bracketed();
            if (!(args.value("bracketed") instanceof SassString auto && auto.text().equals("auto"))) {
                bracketed = args.value("bracketed").isTruthy();
            }
            return new SassList(items, separator, bracketed);
        });

        registry.define("append($list, $val, $separator: auto)", args -> {
            Value list = args.value("list");
            MutableList<Value> items = Lists.mutable.withAll(list.asList());
            items.add(args.value("val"));
            return new SassList(items, separator(args, list.separator()), list instanceof SassList l && l.bracketed());
        });

        registry.define("zip($lists...)", args -> {
            List<Value> lists = args.list("lists");
            int shortest = lists.stream().mapToInt(list -> list.asList().size()).min().orElse(0);
            MutableList<Value> zipped = Lists.mutable.empty();
            for (int i = 0; i < shortest; i++) {
                MutableList<Value> row = Lists.mutable.empty();
                for (Value list : lists) {
                    row.add(list.asList().get(i));
                }
                zipped.add(new SassList(row, ListSeparator.SPACE));
            }
            return new SassList(zipped, ListSeparator.COMMA);
        });

        registry.define("index($list, $value)", args -> {
            int index = args.list("list").indexOf(args.value("value"));
            return index < 0 ? SassNull.INSTANCE : SassNumber.of(index + 1);
        });

        registry.define("list-separator($list)", args -> SassString.unquoted(
                args.value("list").separator() == ListSeparator.COMMA ? "comma" : "space"));

        registry.define("is-bracketed($list)", args ->
                SassBoolean.of(args.value("list") instanceof SassList list && list.bracketed()));
    }

    /**
     * Zero-based position for a 1-based (or negative, from the end) Sass index.
     */
    private static int index(Arguments args, List<Value> items, String name) {
        SassNumber n = args.number(name);
        if (!n.isInteger() || n.intValue() == 0) {
            throw args.error("argument `$" + name + "` of `nth($list, $n)` must be a non-zero integer");
        }
        int index = n.intValue();
        if (Math.abs(index) > items.size()) {
            throw args.error("index out of bounds for `nth($list, $n)'");
        }
        return index > 0 ? index - 1 : items.size() + index;
    }

    private static ListSeparator separator(Arguments args, ListSeparator fallback) {
        String name = args.string("separator").text();
        switch (name) {
            case "comma":
                return ListSeparator.COMMA;
            case "space":
                return ListSeparator.SPACE;
            case "auto":
                return fallback == ListSeparator.UNDECIDED ? ListSeparator.SPACE : fallback;
            default:
                throw args.error("Separator name must be space, comma, or auto");
        }
    }
}
