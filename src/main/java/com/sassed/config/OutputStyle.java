package com.sassed.config;

import com.sassed.error.SassRuntimeException;

public enum OutputStyle {
    NESTED,
    EXPANDED,
    COMPACT,
    COMPRESSED;

    public boolean isSupported() {
        return this == NESTED || this == COMPRESSED;
    }

    /**
     * Case-insensitive lookup used by the command line.
     */
    public static OutputStyle parse(String name) {
        for (OutputStyle style : values()) {
            if (style.name().equalsIgnoreCase(name)) {
                return style;
            }
        }
        throw new SassRuntimeException("Unknown output style: " + name);
    }
}
