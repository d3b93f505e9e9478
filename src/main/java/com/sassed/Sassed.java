package com.sassed;

import com.sassed.config.OutputStyle;
import com.sassed.config.SassOptions;
import com.sassed.config.SingleFileOptions;
import com.sassed.config.SourceMapOptions;
import com.sassed.error.SassException;
import com.sassed.watch.DirectoryWatcher;
import com.sassed.watch.WatchAction;
import com.sassed.watch.WatchListener;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(name = "sassed", mixinStandardHelpOptions = true, version = "1.0",
         description = "Compile Sass and SCSS files, or whole folders, to CSS")
public class Sassed implements Callable<Integer> {
    @Parameters(index = "0", arity = "0..1", description = "Input file or directory")
    private Path input;

    @Parameters(index = "1", arity = "0..1", description = "Output file or directory (default: stdout, or the input directory)")
    private Path output;

    @Option(names = {"-s", "--stdin"}, description = "Read input from stdin")
    private boolean stdin = false;

    @Option(names = {"-t", "--style"}, description = "Output style: nested or compressed")
    private String style = "nested";

    @Option(names = {"-l", "--line-numbers", "--line-comments"}, description = "Emit comments with the source line of each rule")
    private boolean lineComments = false;

    @Option(names = {"-I", "--load-path"}, description = "Add a path for @import lookups")
    private List<Path> loadPaths = new ArrayList<>();

    @Option(names = {"-m", "--sourcemap"}, description = "Write a source map")
    private boolean sourceMap = false;

    @Option(names = {"-M", "--omit-map-comment"}, description = "Do not reference the source map from the CSS")
    private boolean omitMapComment = false;

    @Option(names = {"-E", "--embed-map"}, description = "Embed the source map in the CSS as a data URI")
    private boolean embedMap = false;

    @Option(names = {"-p", "--precision"}, description = "Decimal places of numbers (default: 5)")
    private int precision = 5;

    @Option(names = "--indented", description = "Treat stdin input as indented (.sass) syntax")
    private boolean indented = false;

    @Option(names = {"-w", "--watch"}, description = "Recompile the input directory on every change")
    private boolean watch = false;

    @Option(names = "--single-file", paramLabel = "NAME", description = "Bundle a directory into NAME.css")
    private String singleFile;

    private InputStream in = System.in;
    private PrintStream out = System.out;
    private PrintStream err = System.err;

    public Sassed() {
    }

    Sassed(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Sassed()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        try {
            SassOptions options = buildOptions();
            SassCompiler compiler = new SassCompiler();

            if (stdin) {
                String source = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                emit(compiler.compile(source, options));
                return 0;
            }
            if (input == null) {
                err.println("Error: no input given; pass a file or directory, or use --stdin");
                return 1;
            }

            if (Files.isDirectory(input)) {
                Path target = output != null ? output : input;
                if (watch) {
                    return watch(compiler, target, options);
                }
                compiler.compileFolder(input, target, options);
                return 0;
            }

            if (output != null) {
                compiler.compileFile(input, output, options);
            } else {
                emit(compiler.compileFile(input, options));
            }
            return 0;
        } catch (SassException | IOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    SassOptions buildOptions() {
        SourceMapOptions maps = SourceMapOptions.DISABLED;
        if (sourceMap || embedMap) {
            maps = SourceMapOptions.on().withEmbed(embedMap).withOmitUrl(omitMapComment);
        }
        SassOptions.Builder builder = SassOptions.builder()
                .style(OutputStyle.parse(style))
                .precision(precision)
                .sourceComments(lineComments)
                .includePaths(loadPaths)
                .indentedSyntax(indented)
                .sourceMap(maps);
        if (singleFile != null) {
            builder.singleFile(SingleFileOptions.enabled(singleFile).withComments(SingleFileOptions.Comments.ENABLED));
        }
        return builder.build();
    }

    private void emit(CompileResult result) throws IOException {
        if (output == null) {
            out.print(result.css());
            return;
        }
        Files.writeString(output, result.css(), StandardCharsets.UTF_8);
        if (result.sourceMap().isPresent()) {
            Files.writeString(output.resolveSibling(output.getFileName() + ".map"), result.sourceMap().get(),
                    StandardCharsets.UTF_8);
        }
    }

    private int watch(SassCompiler compiler, Path target, SassOptions options) throws InterruptedException {
        CountDownLatch stopped = new CountDownLatch(1);
        DirectoryWatcher watcher = compiler.watch(input, target, options, new WatchListener() {
            @Override
            public void onCompiled(Path source, Path css) {
                out.println("Compiled " + source + " -> " + css);
            }

            @Override
            public WatchAction onError(Path source, SassException error) {
                err.println("Error: " + error.getMessage());
                return WatchAction.CONTINUE;
            }
        });
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            watcher.close();
            stopped.countDown();
        }));
        out.println("Watching " + input + " (Ctrl-C to stop)");
        stopped.await();
        return 0;
    }
}
