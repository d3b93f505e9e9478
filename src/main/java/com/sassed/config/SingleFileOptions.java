package com.sassed.config;

import com.sassed.error.SassRuntimeException;

/**
 * Folder compilation into one bundle named {@code name + ".css"}, optionally with a comment
 * before each part naming the file it came from.
 */
public record SingleFileOptions(boolean enabled, String name, Comments comments) {
    public static final SingleFileOptions DISABLED = new SingleFileOptions(false, "style", Comments.DISABLED);

    public SingleFileOptions {
        if (name == null || name.isEmpty()) {
            name = "style";
        }
        if (comments == null) {
            comments = Comments.DISABLED;
        }
    }

    public static SingleFileOptions enabled(String name) {
        return new SingleFileOptions(true, name, Comments.DISABLED);
    }

    public SingleFileOptions withComments(Comments value) {
        return new SingleFileOptions(enabled, name, value);
    }

    public record Comments(boolean enabled, String placeholder, String template) {
        public static final String DEFAULT_PLACEHOLDER = "%{filename}";
        public static final String DEFAULT_TEMPLATE = "Source: %{filename}";
        public static final Comments DISABLED = new Comments(false, DEFAULT_PLACEHOLDER, DEFAULT_TEMPLATE);
        public static final Comments ENABLED = new Comments(true, DEFAULT_PLACEHOLDER, DEFAULT_TEMPLATE);

        public Comments {
            if (placeholder == null || placeholder.isEmpty()) {
                throw new SassRuntimeException("Single file comment placeholder must not be empty");
            }
            if (template == null || !template.contains(placeholder)) {
                throw new SassRuntimeException("Template \"" + template + "\" does not contain the placeholder \""
                        + placeholder + "\"");
            }
        }

        /**
         * The delimiter comment for one bundled file.
         */
        public String render(String fileName) {
            return "/* " + template.replace(placeholder, fileName) + " */";
        }
    }
}
