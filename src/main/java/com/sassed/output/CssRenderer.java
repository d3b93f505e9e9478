package com.sassed.output;

import com.sassed.config.SassOptions;
import com.sassed.config.SourceMapOptions;
import com.sassed.css.CssAtRule;
import com.sassed.css.CssComment;
import com.sassed.css.CssDeclaration;
import com.sassed.css.CssNode;
import com.sassed.css.CssRule;
import com.sassed.lexer.SourcePosition;
import com.sassed.value.ValueFormatter;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes resolved CSS nodes in the nested or compressed style, recording source map
 * mappings on the way when maps are enabled.
 */
public class CssRenderer {
    private static final String DEFAULT_FILE = "stdin.css";

    private final SassOptions options;
    private final boolean compressed;
    private final ValueFormatter formatter;

    public CssRenderer(SassOptions options) {
        this.options = options;
        this.compressed = options.compressed();
        this.formatter = new ValueFormatter(options.precision(), compressed);
    }

    /**
     * Tracks the line and column of everything appended so mappings can point into the output.
     */
    private static final class Output {
        private final StringBuilder sb = new StringBuilder(512);
        private final SourceMapBuilder sourceMap;
        private int line;
        private int column;

        private Output(SourceMapBuilder sourceMap) {
            this.sourceMap = sourceMap;
        }

        private Output append(String text) {
            sb.append(text);
            int newline = text.lastIndexOf('\n');
            if (newline < 0) {
                column += text.length();
            } else {
                line += (int) text.chars().filter(c -> c == '\n').count();
                column = text.length() - newline - 1;
            }
            return this;
        }

        private void mark(SourcePosition position) {
            if (sourceMap != null) {
                sourceMap.addMapping(line, column, position);
            }
        }

        private boolean isEmpty() {
            return sb.length() == 0;
        }
    }

    public RenderedCss render(List<CssNode> nodes) {
        return render(nodes, null, Map.of());
    }

    /**
     * @param outputFile where the css will be written, used to name the map; may be null
     * @param sources    contents of sources that are not files on disk, by source name
     */
    public RenderedCss render(List<CssNode> nodes, Path outputFile, Map<String, String> sources) {
        SourceMapOptions mapOptions = options.sourceMap();
        String file = mapOptions.file() != null ? mapOptions.file()
                : outputFile != null ? outputFile.getFileName().toString() : DEFAULT_FILE;
        Path mapDirectory = outputFile != null ? outputFile.toAbsolutePath().getParent() : null;
        SourceMapBuilder sourceMap = mapOptions.enabled() ? new SourceMapBuilder(file, mapDirectory) : null;

        Output out = new Output(sourceMap);
        if (compressed) {
            writeCompressed(nodes, out);
        } else {
            writeNested(nodes, 0, true, out);
        }
        if (!out.isEmpty()) {
            out.append("\n");
        }
        if (sourceMap == null) {
            return new RenderedCss(out.sb.toString(), Optional.empty());
        }

        String json = sourceMap.toJson(mapOptions.includeContents(), sources);
        String css = out.sb.toString();
        if (mapOptions.embed()) {
            String encoded = Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
            css += "/*# sourceMappingURL=data:application/json;base64," + encoded + " */\n";
        } else if (!mapOptions.omitUrl()) {
            css += "/*# sourceMappingURL=" + file + mapOptions.extension() + " */\n";
        }
        return new RenderedCss(css, Optional.of(json));
    }

    // ============================================================
    // Visibility
    // ============================================================

    private boolean isVisible(CssNode node) {
        if (node instanceof CssRule rule) {
            return !rule.isEmpty() && rule.children().anySatisfy(this::isVisible);
        }
        if (node instanceof CssComment comment) {
            return !compressed || comment.isLoud();
        }
        if (node instanceof CssAtRule atRule) {
            return !atRule.hasBody() || atRule.children().anySatisfy(this::isVisible);
        }
        return true;
    }

    /**
     * Nested rules are indented one step under each ancestor that printed its own block.
     */
    private int depth(CssRule rule) {
        CssRule parent = rule.parent();
        if (parent == null) {
            return 0;
        }
        return depth(parent) + (isVisible(parent) && parent.hasDeclarations() ? 1 : 0);
    }

    // ============================================================
    // Nested
    // ============================================================

    private void writeNested(List<CssNode> nodes, int baseIndent, boolean topLevel, Output out) {
        CssNode previous = null;
        for (CssNode node : nodes) {
            if (!isVisible(node)) {
                continue;
            }
            int indent = baseIndent + (node instanceof CssRule rule ? depth(rule) : 0);
            if (previous != null) {
                boolean blankLine = topLevel && indent == 0 && !(previous instanceof CssComment);
                out.append(blankLine ? "\n\n" : "\n");
            }
            previous = node;
            writeNestedNode(node, indent, out);
        }
    }

    private void writeNestedNode(CssNode node, int indent, Output out) {
        String pad = "  ".repeat(indent);
        if (node instanceof CssRule rule) {
            if (options.sourceComments() && rule.position().offset() >= 0) {
                out.append(pad).append("/* line " + rule.position().line() + ", " + rule.position().source() + " */\n");
            }
            out.append(pad);
            out.mark(rule.position());
            out.append(rule.selectorText(false)).append(" {");
            writeNestedChildren(rule.children(), indent + 1, out);
            out.append(" }");
        } else if (node instanceof CssDeclaration declaration) {
            out.append(pad);
            out.mark(declaration.position());
            out.append(declaration.name()).append(": ").append(formatter.toCss(declaration.value()));
            out.append(declaration.important() ? " !important;" : ";");
        } else if (node instanceof CssComment comment) {
            out.append(pad).append(comment.text());
        } else if (node instanceof CssAtRule atRule) {
            out.append(pad);
            out.mark(atRule.position());
            out.append("@").append(atRule.name());
            if (!atRule.prelude().isEmpty()) {
                out.append(" ").append(atRule.prelude());
            }
            if (!atRule.hasBody()) {
                out.append(";");
                return;
            }
            out.append(" {");
            writeNestedChildren(atRule.children(), indent + 1, out);
            out.append(" }");
        }
    }

    private void writeNestedChildren(List<CssNode> children, int indent, Output out) {
        for (CssNode child : children) {
            if (!isVisible(child)) {
                continue;
            }
            out.append("\n");
            writeNestedNode(child, indent + (child instanceof CssRule rule ? depth(rule) : 0), out);
        }
    }

    // ============================================================
    // Compressed
    // ============================================================

    private void writeCompressed(List<CssNode> nodes, Output out) {
        boolean afterDeclaration = false;
        for (CssNode node : nodes) {
            if (!isVisible(node)) {
                continue;
            }
            if (afterDeclaration) {
                out.append(";");
            }
            afterDeclaration = node instanceof CssDeclaration;
            writeCompressedNode(node, out);
        }
    }

    private void writeCompressedNode(CssNode node, Output out) {
        if (node instanceof CssRule rule) {
            out.mark(rule.position());
            String selector = rule.hasRawSelector()
                    ? rule.selectorText(true).replaceAll("\\s*,\\s*", ",")
                    : rule.selectorText(true);
            out.append(selector).append("{");
            writeCompressed(rule.children(), out);
            out.append("}");
        } else if (node instanceof CssDeclaration declaration) {
            out.mark(declaration.position());
            out.append(declaration.name()).append(":").append(formatter.toCss(declaration.value()));
            if (declaration.important()) {
                out.append("!important");
            }
        } else if (node instanceof CssComment comment) {
            out.append(comment.text());
        } else if (node instanceof CssAtRule atRule) {
            out.mark(atRule.position());
            out.append("@").append(atRule.name());
            if (!atRule.prelude().isEmpty()) {
                out.append(" ").append(atRule.prelude());
            }
            if (!atRule.hasBody()) {
                out.append(";");
                return;
            }
            out.append("{");
            writeCompressed(atRule.children(), out);
            out.append("}");
        }
    }
}
