package com.sassed.value;

import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

/**
 * CSS named colors.
 */
public final class ColorNames {
    private static final MutableMap<String, String> NAMES = Maps.mutable.empty();

    static {
        NAMES.put("aliceblue", "f0f8ff");
        NAMES.put("antiquewhite", "faebd7");
        NAMES.put("aqua", "00ffff");
        NAMES.put("aquamarine", "7fffd4");
        NAMES.put("azure", "f0ffff");
        NAMES.put("beige", "f5f5dc");
        NAMES.put("bisque", "ffe4c4");
        NAMES.put("black", "000000");
        NAMES.put("blanchedalmond", "ffebcd");
        NAMES.put("blue", "0000ff");
        NAMES.put("blueviolet", "8a2be2");
        NAMES.put("brown", "a52a2a");
        NAMES.put("burlywood", "deb887");
        NAMES.put("cadetblue", "5f9ea0");
        NAMES.put("chartreuse", "7fff00");
        NAMES.put("chocolate", "d2691e");
        NAMES.put("coral", "ff7f50");
        NAMES.put("cornflowerblue", "6495ed");
        NAMES.put("cornsilk", "fff8dc");
        NAMES.put("crimson", "dc143c");
        NAMES.put("cyan", "00ffff");
        NAMES.put("darkblue", "00008b");
        NAMES.put("darkcyan", "008b8b");
        NAMES.put("darkgoldenrod", "b8860b");
        NAMES.put("darkgray", "a9a9a9");
        NAMES.put("darkgreen", "006400");
        NAMES.put("darkgrey", "a9a9a9");
        NAMES.put("darkkhaki", "bdb76b");
        NAMES.put("darkmagenta", "8b008b");
        NAMES.put("darkolivegreen", "556b2f");
        NAMES.put("darkorange", "ff8c00");
        NAMES.put("darkorchid", "9932cc");
        NAMES.put("darkred", "8b0000");
        NAMES.put("darksalmon", "e9967a");
        NAMES.put("darkseagreen", "8fbc8f");
        NAMES.put("darkslateblue", "483d8b");
        NAMES.put("darkslategray", "2f4f4f");
        NAMES.put("darkslategrey", "2f4f4f");
        NAMES.put("darkturquoise", "00ced1");
        NAMES.put("darkviolet", "9400d3");
        NAMES.put("deeppink", "ff1493");
        NAMES.put("deepskyblue", "00bfff");
        NAMES.put("dimgray", "696969");
        NAMES.put("dimgrey", "696969");
        NAMES.put("dodgerblue", "1e90ff");
        NAMES.put("firebrick", "b22222");
        NAMES.put("floralwhite", "fffaf0");
        NAMES.put("forestgreen", "228b22");
        NAMES.put("fuchsia", "ff00ff");
        NAMES.put("gainsboro", "dcdcdc");
        NAMES.put("ghostwhite", "f8f8ff");
        NAMES.put("gold", "ffd700");
        NAMES.put("goldenrod", "daa520");
        NAMES.put("gray", "808080");
        NAMES.put("green", "008000");
        NAMES.put("greenyellow", "adff2f");
        NAMES.put("grey", "808080");
        NAMES.put("honeydew", "f0fff0");
        NAMES.put("hotpink", "ff69b4");
        NAMES.put("indianred", "cd5c5c");
        NAMES.put("indigo", "4b0082");
        NAMES.put("ivory", "fffff0");
        NAMES.put("khaki", "f0e68c");
        NAMES.put("lavender", "e6e6fa");
        NAMES.put("lavenderblush", "fff0f5");
        NAMES.put("lawngreen", "7cfc00");
        NAMES.put("lemonchiffon", "fffacd");
        NAMES.put("lightblue", "add8e6");
        NAMES.put("lightcoral", "f08080");
        NAMES.put("lightcyan", "e0ffff");
        NAMES.put("lightgoldenrodyellow", "fafad2");
        NAMES.put("lightgray", "d3d3d3");
        NAMES.put("lightgreen", "90ee90");
        NAMES.put("lightgrey", "d3d3d3");
        NAMES.put("lightpink", "ffb6c1");
        NAMES.put("lightsalmon", "ffa07a");
        NAMES.put("lightseagreen", "20b2aa");
        NAMES.put("lightskyblue", "87cefa");
        NAMES.put("lightslategray", "778899");
        NAMES.put("lightslategrey", "778899");
        NAMES.put("lightsteelblue", "b0c4de");
        NAMES.put("lightyellow", "ffffe0");
        NAMES.put("lime", "00ff00");
        NAMES.put("limegreen", "32cd32");
        NAMES.put("linen", "faf0e6");
        NAMES.put("magenta", "ff00ff");
        NAMES.put("maroon", "800000");
        NAMES.put("mediumaquamarine", "66cdaa");
        NAMES.put("mediumblue", "0000cd");
        NAMES.put("mediumorchid", "ba55d3");
        NAMES.put("mediumpurple", "9370db");
        NAMES.put("mediumseagreen", "3cb371");
        NAMES.put("mediumslateblue", "7b68ee");
        NAMES.put("mediumspringgreen", "00fa9a");
        NAMES.put("mediumturquoise", "48d1cc");
        NAMES.put("mediumvioletred", "c71585");
        NAMES.put("midnightblue", "191970");
        NAMES.put("mintcream", "f5fffa");
        NAMES.put("mistyrose", "ffe4e1");
        NAMES.put("moccasin", "ffe4b5");
        NAMES.put("navajowhite", "ffdead");
        NAMES.put("navy", "000080");
        NAMES.put("oldlace", "fdf5e6");
        NAMES.put("olive", "808000");
        NAMES.put("olivedrab", "6b8e23");
        NAMES.put("orange", "ffa500");
        NAMES.put("orangered", "ff4500");
        NAMES.put("orchid", "da70d6");
        NAMES.put("palegoldenrod", "eee8aa");
        NAMES.put("palegreen", "98fb98");
        NAMES.put("paleturquoise", "afeeee");
        NAMES.put("palevioletred", "db7093");
        NAMES.put("papayawhip", "ffefd5");
        NAMES.put("peachpuff", "ffdab9");
        NAMES.put("peru", "cd853f");
        NAMES.put("pink", "ffc0cb");
        NAMES.put("plum", "dda0dd");
        NAMES.put("powderblue", "b0e0e6");
        NAMES.put("purple", "800080");
        NAMES.put("rebeccapurple", "663399");
        NAMES.put("red", "ff0000");
        NAMES.put("rosybrown", "bc8f8f");
        NAMES.put("royalblue", "4169e1");
        NAMES.put("saddlebrown", "8b4513");
        NAMES.put("salmon", "fa8072");
        NAMES.put("sandybrown", "f4a460");
        NAMES.put("seagreen", "2e8b57");
        NAMES.put("seashell", "fff5ee");
        NAMES.put("sienna", "a0522d");
        NAMES.put("silver", "c0c0c0");
        NAMES.put("skyblue", "87ceeb");
        NAMES.put("slateblue", "6a5acd");
        NAMES.put("slategray", "708090");
        NAMES.put("slategrey", "708090");
        NAMES.put("snow", "fffafa");
        NAMES.put("springgreen", "00ff7f");
        NAMES.put("steelblue", "4682b4");
        NAMES.put("tan", "d2b48c");
        NAMES.put("teal", "008080");
        NAMES.put("thistle", "d8bfd8");
        NAMES.put("tomato", "ff6347");
        NAMES.put("turquoise", "40e0d0");
        NAMES.put("violet", "ee82ee");
        NAMES.put("wheat", "f5deb3");
        NAMES.put("white", "ffffff");
        NAMES.put("whitesmoke", "f5f5f5");
        NAMES.put("yellow", "ffff00");
        NAMES.put("yellowgreen", "9acd32");
    }

    private ColorNames() {
    }

    /**
     * The color for a name such as {@code red}, or null when the identifier is not a color.
     */
    public static SassColor lookup(String name) {
        if (name.equalsIgnoreCase("transparent")) {
            return new SassColor(0, 0, 0, 0, name);
        }
        String hex = NAMES.get(name.toLowerCase());
        if (hex == null) {
            return null;
        }
        SassColor color = SassColor.parseHex(hex);
        return new SassColor(color.red(), color.green(), color.blue(), 1, name);
    }
}
