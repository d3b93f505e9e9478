package com.sassed.eval;

import com.sassed.config.SassOptions;
import com.sassed.error.EvalException;
import com.sassed.lexer.SourcePosition;
import com.sassed.syntax.IndentedSyntaxConverter;
import com.sassed.syntax.Node;
import com.sassed.syntax.Parser;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Finds and loads {@code @import}ed stylesheets. {@code "x"} is looked up as {@code x.scss},
 * {@code _x.scss}, {@code x.sass} and {@code _x.sass}, first beside the importing file and
 * then in each include path.
 */
public class ImportResolver {
    private static final Logger logger = LoggerFactory.getLogger(ImportResolver.class);

    private final SassOptions options;

    public ImportResolver(SassOptions options) {
        this.options = options;
    }

    public Path resolve(String url, Path baseDir, SourcePosition position) {
        MutableList<Path> directories = Lists.mutable.empty();
        directories.add(baseDir != null ? baseDir : Paths.get(""));
        directories.addAll(options.includePaths());
        for (Path directory : directories) {
            MutableList<Path> found = Lists.mutable.empty();
            for (String candidate : candidates(url)) {
                Path path = directory.resolve(candidate);
                if (Files.isRegularFile(path)) {
                    found.add(path);
                }
            }
            if (found.size() > 1) {
                throw new EvalException("It's not clear which file to import for '@import \"" + url + "\"'.\n"
                        + "Candidates:\n  " + found.collect(Path::toString).makeString("\n  "), position);
            }
            if (found.size() == 1) {
                return found.getFirst();
            }
        }
        throw new EvalException("File to import not found or unreadable: " + url + ".", position);
    }

    private MutableList<String> candidates(String url) {
        Path path = Paths.get(url);
        String name = path.getFileName().toString();
        String prefix = url.substring(0, url.length() - name.length());
        String sass = options.extensions().sass();
        String scss = options.extensions().scss();
        if (name.endsWith("." + sass) || name.endsWith("." + scss)) {
            return Lists.mutable.with(url, prefix + "_" + name);
        }
        return Lists.mutable.with(
                url + "." + scss, prefix + "_" + name + "." + scss,
                url + "." + sass, prefix + "_" + name + "." + sass);
    }

    public Node.Stylesheet load(Path path, SourcePosition position) {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new EvalException("File to import not found or unreadable: " + path + ".", position);
        }
        logger.debug("Importing {}", path);
        if (options.extensions().isSass(path.getFileName().toString())) {
            text = new IndentedSyntaxConverter(options.sass2scss().comments()).convert(text);
        }
        return Parser.parse(text, path.toString());
    }
}
