package com.sassed.syntax;

import com.sassed.config.Sass2ScssOptions;
import com.sassed.config.Sass2ScssOptions.CommentMode;
import com.sassed.config.Sass2ScssOptions.PrettifyLevel;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.stack.primitive.MutableIntStack;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.primitive.IntStacks;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites the indented {@code .sass} syntax into SCSS. A line opens a block when the next
 * content line is indented deeper. With the default {@link PrettifyLevel#FIRST} layout closing
 * braces are appended to the last emitted line so that line numbers stay the same as in the input;
 * the other levels re-flow the blocks.
 */
public class IndentedSyntaxConverter {
    private static final Pattern MIXIN = Pattern.compile("=\\s*([\\w-]+)(.*)");
    private static final Pattern INCLUDE = Pattern.compile("\\+\\s*([\\w-]+)(.*)");
    private static final Pattern OLD_PROPERTY = Pattern.compile(":([\\w-]+)\\s+(.*)");

    private final CommentMode commentMode;
    private final PrettifyLevel prettify;

    public IndentedSyntaxConverter(CommentMode commentMode, PrettifyLevel prettify) {
        this.commentMode = commentMode;
        this.prettify = prettify;
    }

    public IndentedSyntaxConverter(Sass2ScssOptions options) {
        this(options.comments(), options.prettify());
    }

    public IndentedSyntaxConverter(CommentMode commentMode) {
        this(commentMode, PrettifyLevel.FIRST);
    }

    public IndentedSyntaxConverter() {
        this(CommentMode.KEEP);
    }

    public String convert(String sass) {
        String[] lines = sass.split("\r?\n", -1);
        Layout layout = prettify == PrettifyLevel.FIRST ? new LinePreservingLayout() : new BlockLayout(prettify);
        CommentMode comments = commentMode == CommentMode.KEEP && prettify == PrettifyLevel.ZERO
                ? CommentMode.CONVERT : commentMode;
        MutableIntStack open = IntStacks.mutable.empty();

        int i = 0;
        while (i < lines.length) {
            String line = lines[i];
            String content = line.strip();
            if (content.isEmpty()) {
                layout.blank();
                i++;
                continue;
            }
            int indent = indentOf(line);
            while (!open.isEmpty() && open.peek() >= indent) {
                open.pop();
                layout.close(open.size());
            }

            String prefix = line.substring(0, indent);
            if (content.startsWith("//") || content.startsWith("/*")) {
                int end = commentEnd(lines, i, indent);
                if (comments == CommentMode.STRIP) {
                    for (int j = i; j < end; j++) {
                        layout.blank();
                    }
                } else {
                    layout.comment(prefix, open.size(), comment(lines, i, end, comments));
                }
                i = end;
                continue;
            }

            String scss = rewrite(content);
            int next = nextContentLine(lines, i + 1);
            if (next >= 0 && indentOf(lines[next]) > indent && !scss.endsWith(",")) {
                layout.open(prefix, open.size(), scss);
                open.push(indent);
            } else if (scss.endsWith(",")) {
                layout.statement(prefix, open.size(), scss);
            } else {
                layout.statement(prefix, open.size(), scss + ";");
            }
            i++;
        }
        while (!open.isEmpty()) {
            open.pop();
            layout.close(open.size());
        }
        return layout.finish();
    }

    private String rewrite(String content) {
        Matcher mixin = MIXIN.matcher(content);
        if (mixin.matches()) {
            return "@mixin " + mixin.group(1) + mixin.group(2);
        }
        Matcher include = INCLUDE.matcher(content);
        if (include.matches()) {
            return "@include " + include.group(1) + include.group(2);
        }
        Matcher property = OLD_PROPERTY.matcher(content);
        if (property.matches()) {
            return property.group(1) + ": " + property.group(2);
        }
        if (content.startsWith("@import ")) {
            return "@import " + quoteImports(content.substring("@import ".length()).strip());
        }
        return content;
    }

    /**
     * The indented syntax allows bare import names; SCSS needs them quoted.
     */
    private static String quoteImports(String targets) {
        if (targets.contains("\"") || targets.contains("'") || targets.startsWith("url(")) {
            return targets;
        }
        MutableList<String> quoted = Lists.mutable.empty();
        for (String target : targets.split(",")) {
            quoted.add("\"" + target.strip() + "\"");
        }
        return String.join(", ", quoted);
    }

    /**
     * A comment runs on for as long as the following lines are indented deeper than its first line.
     */
    private static int commentEnd(String[] lines, int start, int indent) {
        int end = start + 1;
        while (end < lines.length && (lines[end].isBlank() || indentOf(lines[end]) > indent)) {
            end++;
        }
        while (end > start + 1 && lines[end - 1].isBlank()) {
            end--;
        }
        return end;
    }

    private static Comment comment(String[] lines, int start, int end, CommentMode mode) {
        boolean lineComment = lines[start].strip().startsWith("//");
        MutableList<String> body = Lists.mutable.empty();
        if (lineComment && mode == CommentMode.KEEP) {
            for (int i = start; i < end; i++) {
                String text = lines[i].strip();
                body.add(text.startsWith("//") || text.isEmpty() ? text : "// " + text);
            }
            return new Comment(body, true);
        }
        for (int i = start; i < end; i++) {
            String text = lines[i].strip();
            if (i == start) {
                text = lineComment ? "/*" + text.substring(2) : text;
            } else if (lineComment && text.startsWith("//")) {
                text = text.substring(2).strip();
            }
            body.add(i == start ? text : " " + text);
        }
        int last = body.size() - 1;
        if (!body.get(last).endsWith("*/")) {
            body.set(last, body.get(last) + " */");
        }
        return new Comment(body, false);
    }

    private static int nextContentLine(String[] lines, int from) {
        for (int i = from; i < lines.length; i++) {
            if (!lines[i].isBlank()) {
                return i;
            }
        }
        return -1;
    }

    private static int indentOf(String line) {
        int indent = 0;
        while (indent < line.length() && (line.charAt(indent) == ' ' || line.charAt(indent) == '\t')) {
            indent++;
        }
        return indent;
    }

    /**
     * Comment lines without their indentation. Continuation lines of a block comment start with a space.
     */
    private record Comment(MutableList<String> lines, boolean lineComment) {
    }

    private interface Layout {
        void blank();

        void open(String prefix, int depth, String header);

        void statement(String prefix, int depth, String text);

        void comment(String prefix, int depth, Comment comment);

        void close(int depth);

        String finish();
    }

    /**
     * Keeps the input's line structure and indentation so positions in the converted text match the source.
     */
    private static final class LinePreservingLayout implements Layout {
        private final MutableList<String> out = Lists.mutable.empty();
        private boolean lastIsLineComment;

        @Override
        public void blank() {
            out.add("");
        }

        @Override
        public void open(String prefix, int depth, String header) {
            out.add(prefix + header + " {");
            lastIsLineComment = false;
        }

        @Override
        public void statement(String prefix, int depth, String text) {
            out.add(prefix + text);
            lastIsLineComment = false;
        }

        @Override
        public void comment(String prefix, int depth, Comment comment) {
            comment.lines().each(line -> out.add(prefix + line));
            lastIsLineComment = comment.lineComment();
        }

        @Override
        public void close(int depth) {
            int last = out.size() - 1;
            while (last > 0 && out.get(last).isBlank()) {
                last--;
            }
            if (last < 0 || lastIsLineComment) {
                out.add("}");
            } else {
                out.set(last, out.get(last) + " }");
            }
            lastIsLineComment = false;
        }

        @Override
        public String finish() {
            return String.join("\n", out);
        }
    }

    /**
     * Re-indents by nesting depth. Blank lines are dropped.
     */
    private static final class BlockLayout implements Layout {
        private final PrettifyLevel level;
        private final MutableList<String> out = Lists.mutable.empty();

        private BlockLayout(PrettifyLevel level) {
            this.level = level;
        }

        @Override
        public void blank() {
        }

        @Override
        public void open(String prefix, int depth, String header) {
            if (level == PrettifyLevel.THIRD) {
                line(depth, header);
                line(depth, "{");
            } else {
                line(depth, header + " {");
            }
        }

        @Override
        public void statement(String prefix, int depth, String text) {
            line(depth, text);
        }

        @Override
        public void comment(String prefix, int depth, Comment comment) {
            if (level == PrettifyLevel.ZERO) {
                line(depth, comment.lines().collect(String::strip).makeString(" "));
            } else {
                comment.lines().each(text -> line(depth, text));
            }
        }

        @Override
        public void close(int depth) {
            line(depth, "}");
        }

        private void line(int depth, String text) {
            out.add(level == PrettifyLevel.ZERO ? text : "  ".repeat(depth) + text);
        }

        @Override
        public String finish() {
            return String.join(level == PrettifyLevel.ZERO ? " " : "\n", out);
        }
    }
}
