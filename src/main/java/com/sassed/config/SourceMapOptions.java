package com.sassed.config;

/**
 * Source map settings. {@code file} is the name written into the map's {@code file} field and
 * the url comment; when null it is derived from the output path.
 */
public record SourceMapOptions(boolean enabled, boolean embed, boolean omitUrl, boolean includeContents,
                               String extension, String file) {
    public static final SourceMapOptions DISABLED = new SourceMapOptions(false, false, false, false, ".map", null);

    public SourceMapOptions {
        if (extension == null || extension.isEmpty()) {
            extension = ".map";
        }
    }

    public static SourceMapOptions on() {
        return new SourceMapOptions(true, false, false, false, ".map", null);
    }

    public SourceMapOptions withEmbed(boolean value) {
        return new SourceMapOptions(enabled, value, omitUrl, includeContents, extension, file);
    }

    public SourceMapOptions withOmitUrl(boolean value) {
        return new SourceMapOptions(enabled, embed, value, includeContents, extension, file);
    }

    public SourceMapOptions withIncludeContents(boolean value) {
        return new SourceMapOptions(enabled, embed, omitUrl, value, extension, file);
    }

    public SourceMapOptions withExtension(String value) {
        return new SourceMapOptions(enabled, embed, omitUrl, includeContents, value, file);
    }

    public SourceMapOptions withFile(String value) {
        return new SourceMapOptions(enabled, embed, omitUrl, includeContents, extension, value);
    }
}
