package com.sassed.config;

import com.sassed.error.SassRuntimeException;
import com.sassed.value.ValueFormatter;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable compile configuration. Each compile call receives its own snapshot, so a running
 * watcher is never affected by options changed elsewhere.
 */
public final class SassOptions {
    private final OutputStyle style;
    private final int precision;
    private final List<Path> includePaths;
    private final String imagePath;
    private final boolean sourceComments;
    private final boolean indentedSyntax;
    private final SourceMapOptions sourceMap;
    private final ExtensionOptions extensions;
    private final Sass2ScssOptions sass2scss;
    private final SingleFileOptions singleFile;

    private SassOptions(Builder builder) {
        this.style = builder.style;
        this.precision = builder.precision;
        this.includePaths = List.copyOf(builder.includePaths);
        this.imagePath = builder.imagePath;
        this.sourceComments = builder.sourceComments;
        this.indentedSyntax = builder.indentedSyntax;
        this.sourceMap = builder.sourceMap;
        this.extensions = builder.extensions;
        this.sass2scss = builder.sass2scss;
        this.singleFile = builder.singleFile;
    }

    public static SassOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.style = style;
        builder.precision = precision;
        builder.includePaths = includePaths;
        builder.imagePath = imagePath;
        builder.sourceComments = sourceComments;
        builder.indentedSyntax = indentedSyntax;
        builder.sourceMap = sourceMap;
        builder.extensions = extensions;
        builder.sass2scss = sass2scss;
        builder.singleFile = singleFile;
        return builder;
    }

    public OutputStyle style() {
        return style;
    }

    public boolean compressed() {
        return style == OutputStyle.COMPRESSED;
    }

    public int precision() {
        return precision;
    }

    public List<Path> includePaths() {
        return includePaths;
    }

    public String imagePath() {
        return imagePath;
    }

    public boolean sourceComments() {
        return sourceComments;
    }

    public boolean indentedSyntax() {
        return indentedSyntax;
    }

    public SourceMapOptions sourceMap() {
        return sourceMap;
    }

    public ExtensionOptions extensions() {
        return extensions;
    }

    public Sass2ScssOptions sass2scss() {
        return sass2scss;
    }

    public SingleFileOptions singleFile() {
        return singleFile;
    }

    public static final class Builder {
        private OutputStyle style = OutputStyle.NESTED;
        private int precision = ValueFormatter.DEFAULT_PRECISION;
        private List<Path> includePaths = List.of();
        private String imagePath = "";
        private boolean sourceComments;
        private boolean indentedSyntax;
        private SourceMapOptions sourceMap = SourceMapOptions.DISABLED;
        private ExtensionOptions extensions = ExtensionOptions.DEFAULT;
        private Sass2ScssOptions sass2scss = Sass2ScssOptions.DEFAULT;
        private SingleFileOptions singleFile = SingleFileOptions.DISABLED;

        private Builder() {
        }

        public Builder style(OutputStyle value) {
            if (!value.isSupported()) {
                throw new SassRuntimeException("Output style " + value.name().toLowerCase() + " is not supported");
            }
            this.style = value;
            return this;
        }

        public Builder precision(int value) {
            if (value < 0) {
                throw new SassRuntimeException("Precision must not be negative: " + value);
            }
            this.precision = value;
            return this;
        }

        public Builder includePaths(List<Path> value) {
            this.includePaths = List.copyOf(value);
            return this;
        }

        public Builder imagePath(String value) {
            this.imagePath = value == null ? "" : value;
            return this;
        }

        public Builder sourceComments(boolean value) {
            this.sourceComments = value;
            return this;
        }

        public Builder indentedSyntax(boolean value) {
            this.indentedSyntax = value;
            return this;
        }

        public Builder sourceMap(SourceMapOptions value) {
            this.sourceMap = value;
            return this;
        }

        public Builder extensions(ExtensionOptions value) {
            this.extensions = value;
            return this;
        }

        public Builder sass2scss(Sass2ScssOptions value) {
            this.sass2scss = value;
            return this;
        }

        public Builder singleFile(SingleFileOptions value) {
            this.singleFile = value;
            return this;
        }

        public SassOptions build() {
            return new SassOptions(this);
        }
    }
}
