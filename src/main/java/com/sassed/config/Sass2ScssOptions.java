package com.sassed.config;

/**
 * Settings of the indented syntax converter. The prettify level only shapes the text returned by
 * {@code SassCompiler.convertSass2Scss}; compiles always use the {@link PrettifyLevel#FIRST} layout,
 * which keeps every line where it was in the input.
 */
public record Sass2ScssOptions(CommentMode comments, PrettifyLevel prettify) {
    public static final Sass2ScssOptions DEFAULT = new Sass2ScssOptions(CommentMode.KEEP, PrettifyLevel.FIRST);

    public Sass2ScssOptions {
        if (comments == null) {
            comments = CommentMode.KEEP;
        }
        if (prettify == null) {
            prettify = PrettifyLevel.FIRST;
        }
    }

    public Sass2ScssOptions withComments(CommentMode value) {
        return new Sass2ScssOptions(value, prettify);
    }

    public Sass2ScssOptions withPrettify(PrettifyLevel value) {
        return new Sass2ScssOptions(comments, value);
    }

    public enum CommentMode {
        /** Line comments pass through unchanged. */
        KEEP,
        /** All comments are removed. */
        STRIP,
        /** Line comments become block comments so they survive into the CSS. */
        CONVERT
    }

    public enum PrettifyLevel {
        /** Everything on one line. Line comments are written as block comments. */
        ZERO,
        /** Line break after each opening brace; closing braces end the last line of the block. */
        FIRST,
        /** Line break after opening and closing braces, two spaces per nesting level. */
        SECOND,
        /** Like {@link #SECOND}, with each opening brace on its own line. */
        THIRD
    }
}
