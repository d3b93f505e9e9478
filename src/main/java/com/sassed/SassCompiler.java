package com.sassed;

import com.sassed.config.SassOptions;
import com.sassed.config.SingleFileOptions;
import com.sassed.error.SassRuntimeException;
import com.sassed.eval.DiagnosticSink;
import com.sassed.eval.Evaluator;
import com.sassed.eval.ExpansionResult;
import com.sassed.eval.LoggingDiagnosticSink;
import com.sassed.extend.ExtendResolver;
import com.sassed.output.CssRenderer;
import com.sassed.output.RenderedCss;
import com.sassed.syntax.IndentedSyntaxConverter;
import com.sassed.syntax.Node;
import com.sassed.syntax.Parser;
import com.sassed.watch.DirectoryWatcher;
import com.sassed.watch.WatchListener;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Entry point of the compiler: strings, files and folders in, CSS out. Every call works on its
 * own parse tree and scopes, so one instance may be shared.
 */
public class SassCompiler {
    private static final Logger logger = LoggerFactory.getLogger(SassCompiler.class);
    private static final String STDIN = "stdin";

    private final DiagnosticSink diagnostics;

    public SassCompiler() {
        this(new LoggingDiagnosticSink());
    }

    public SassCompiler(DiagnosticSink diagnostics) {
        this.diagnostics = diagnostics;
    }

    public CompileResult compile(String source, SassOptions options) {
        return compile(source, STDIN, null, options.indentedSyntax(), null, options);
    }

    public CompileResult compileFile(Path input, SassOptions options) {
        return compileFile(input, null, options, false);
    }

    /**
     * Compiles {@code input} into {@code output}, writing the source map beside it when maps are enabled.
     */
    public void compileFile(Path input, Path output, SassOptions options) {
        compileFile(input, output, options, true);
    }

    private CompileResult compileFile(Path input, Path output, SassOptions options, boolean write) {
        checkFile(input);
        Path source = input.toAbsolutePath().normalize();
        String text = read(source);
        boolean indented = options.extensions().isSass(source.getFileName().toString());
        CompileResult result = compile(text, source.toString(), source.getParent(), indented, output, options);
        if (write) {
            logger.debug("Writing {}", output);
            writeString(output, result.css());
            if (result.sourceMap().isPresent()) {
                writeString(output.resolveSibling(output.getFileName() + options.sourceMap().extension()),
                        result.sourceMap().get());
            }
        }
        return result;
    }

    private CompileResult compile(String text, String sourceName, Path baseDir, boolean indented, Path output,
                                  SassOptions options) {
        String scss = indented ? new IndentedSyntaxConverter(options.sass2scss().comments()).convert(text) : text;
        Node.Stylesheet stylesheet = Parser.parse(scss, sourceName);
        ExpansionResult expansion = new Evaluator(options, diagnostics).expand(stylesheet, baseDir);
        ExtendResolver.resolve(expansion.nodes(), expansion.extendGraph());
        RenderedCss rendered = new CssRenderer(options).render(expansion.nodes(), output, Map.of(sourceName, text));
        return new CompileResult(rendered.css(), rendered.sourceMap());
    }

    /**
     * Compiles every top-level sass and scss file of {@code input}, skipping partials. Each file
     * becomes {@code name.css} in {@code output}, or all of them are bundled into one file when
     * single-file output is enabled. Source maps are not written for a bundle.
     */
    public void compileFolder(Path input, Path output, SassOptions options) {
        checkFolders(input, output);
        MutableList<Path> files = sourcesOf(input, options);
        logger.info("Compiling {} file(s) from {} to {}", files.size(), input, output);

        SingleFileOptions singleFile = options.singleFile();
        if (!singleFile.enabled()) {
            for (Path file : files) {
                compileFile(file, output.resolve(cssName(file)), options);
            }
            return;
        }

        SassOptions bundleOptions = options.toBuilder().sourceMap(options.sourceMap().withOmitUrl(true)).build();
        MutableList<String> parts = Lists.mutable.empty();
        for (Path file : files) {
            String css = compileFile(file, bundleOptions).css();
            if (singleFile.comments().enabled()) {
                parts.add(singleFile.comments().render(file.getFileName().toString()) + "\n" + css);
            } else {
                parts.add(css);
            }
        }
        writeString(output.resolve(singleFile.name() + ".css"), parts.makeString("\n"));
    }

    /**
     * The files {@link #compileFolder} compiles, sorted by name.
     */
    public static MutableList<Path> sourcesOf(Path input, SassOptions options) {
        try (Stream<Path> entries = Files.list(input)) {
            return Lists.mutable.fromStream(entries
                    .filter(Files::isRegularFile)
                    .filter(path -> !isPartial(path))
                    .filter(path -> options.extensions().matches(path.getFileName().toString()))
                    .sorted());
        } catch (IOException e) {
            throw new SassRuntimeException("Cannot list directory `" + input + "`", e);
        }
    }

    public static boolean isPartial(Path path) {
        return path.getFileName().toString().startsWith("_");
    }

    public static String cssName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return (dot > 0 ? name.substring(0, dot) : name) + ".css";
    }

    public String convertSass2Scss(String source, SassOptions options) {
        return new IndentedSyntaxConverter(options.sass2scss()).convert(source);
    }

    /**
     * Starts watching {@code input}. The options are captured now; changing them later does not
     * affect the running watcher.
     */
    public DirectoryWatcher watch(Path input, Path output, SassOptions options, WatchListener listener) {
        checkFolders(input, output);
        return DirectoryWatcher.start(this, input, output, options, listener);
    }

    private static void checkFile(Path input) {
        if (!Files.exists(input)) {
            throw new SassRuntimeException("File `" + input + "` does not exist");
        }
        if (!Files.isRegularFile(input)) {
            throw new SassRuntimeException("`" + input + "` is not a file");
        }
    }

    private static void checkFolders(Path input, Path output) {
        if (!Files.exists(input)) {
            throw new SassRuntimeException("Directory `" + input + "` does not exist");
        }
        if (!Files.isDirectory(input)) {
            throw new SassRuntimeException("`" + input + "` is not a directory");
        }
        if (Files.exists(output) && !Files.isDirectory(output)) {
            throw new SassRuntimeException("`" + output + "` is not a directory");
        }
        try {
            Files.createDirectories(output);
        } catch (IOException e) {
            throw new SassRuntimeException("Cannot create directory `" + output + "`", e);
        }
    }

    private static String read(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SassRuntimeException("Cannot read `" + path + "`", e);
        }
    }

    private static void writeString(Path path, String text) {
        try {
            Files.writeString(path, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SassRuntimeException("Cannot write `" + path + "`", e);
        }
    }
}
