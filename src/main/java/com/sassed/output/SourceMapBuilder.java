package com.sassed.output;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.sassed.error.SassRuntimeException;
import com.sassed.lexer.SourcePosition;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Collects generated-to-source mappings while CSS is written and serializes them as a
 * version 3 source map.
 */
public class SourceMapBuilder {
    private static final String BASE64 = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";
    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    private final String file;
    private final Path mapDirectory;
    private final MutableList<String> sources = Lists.mutable.empty();
    private final MutableMap<String, Integer> sourceIndexes = Maps.mutable.empty();
    private final MutableList<Mapping> mappings = Lists.mutable.empty();

    private record Mapping(int generatedLine, int generatedColumn, int source, int line, int column) {
    }

    /**
     * @param file         the css file name written into the map
     * @param mapDirectory directory the map is written to, sources are made relative to it; may be null
     */
    public SourceMapBuilder(String file, Path mapDirectory) {
        this.file = file;
        this.mapDirectory = mapDirectory;
    }

    /**
     * Records that output at the given 0-based line and column came from {@code position}.
     */
    public void addMapping(int generatedLine, int generatedColumn, SourcePosition position) {
        if (position == null || position.offset() < 0) {
            return;
        }
        Integer index = sourceIndexes.get(position.source());
        if (index == null) {
            index = sources.size();
            sources.add(position.source());
            sourceIndexes.put(position.source(), index);
        }
        mappings.add(new Mapping(generatedLine, generatedColumn, index,
                Math.max(0, position.line() - 1), Math.max(0, position.column() - 1)));
    }

    public int size() {
        return mappings.size();
    }

    public String mappings() {
        StringBuilder sb = new StringBuilder();
        int line = 0;
        int previousColumn = 0;
        int previousSource = 0;
        int previousLine = 0;
        int previousSourceColumn = 0;
        boolean firstInLine = true;
        for (Mapping mapping : mappings) {
            while (line < mapping.generatedLine()) {
                sb.append(';');
                line++;
                previousColumn = 0;
                firstInLine = true;
            }
            if (!firstInLine) {
                sb.append(',');
            }
            firstInLine = false;
            encode(sb, mapping.generatedColumn() - previousColumn);
            encode(sb, mapping.source() - previousSource);
            encode(sb, mapping.line() - previousLine);
            encode(sb, mapping.column() - previousSourceColumn);
            previousColumn = mapping.generatedColumn();
            previousSource = mapping.source();
            previousLine = mapping.line();
            previousSourceColumn = mapping.column();
        }
        return sb.toString();
    }

    static void encode(StringBuilder sb, int value) {
        int vlq = value < 0 ? ((-value) << 1) | 1 : value << 1;
        do {
            int digit = vlq & 31;
            vlq >>>= 5;
            if (vlq > 0) {
                digit |= 32;
            }
            sb.append(BASE64.charAt(digit));
        } while (vlq > 0);
    }

    /**
     * Serializes the map. With {@code includeContents}, sources come from {@code knownContents}
     * first and are otherwise read from disk.
     */
    public String toJson(boolean includeContents, Map<String, String> knownContents) {
        StringWriter writer = new StringWriter();
        try (JsonGenerator generator = JSON_FACTORY.createGenerator(writer)) {
            generator.useDefaultPrettyPrinter();
            generator.writeStartObject();
            generator.writeNumberField("version", 3);
            generator.writeStringField("file", file);
            generator.writeArrayFieldStart("sources");
            for (String source : sources) {
                generator.writeString(relativize(source));
            }
            generator.writeEndArray();
            if (includeContents) {
                generator.writeArrayFieldStart("sourcesContent");
                for (String source : sources) {
                    String content = knownContents.get(source);
                    generator.writeString(content != null ? content : read(source));
                }
                generator.writeEndArray();
            }
            generator.writeStringField("mappings", mappings());
            generator.writeArrayFieldStart("names");
            generator.writeEndArray();
            generator.writeEndObject();
        } catch (IOException e) {
            throw new SassRuntimeException("Failed to write source map for " + file, e);
        }
        return writer.toString();
    }

    private String relativize(String source) {
        try {
            Path path = Paths.get(source);
            if (!path.isAbsolute()) {
                return source.replace('\\', '/');
            }
            Path base = mapDirectory != null ? mapDirectory.toAbsolutePath() : Paths.get("").toAbsolutePath();
            return base.normalize().relativize(path.normalize()).toString().replace('\\', '/');
        } catch (IllegalArgumentException e) {
            return source;
        }
    }

    private static String read(String source) {
        try {
            return Files.readString(Paths.get(source), StandardCharsets.UTF_8);
        } catch (IOException | InvalidPathException e) {
            throw new SassRuntimeException("Cannot read source " + source + " for the source map", e);
        }
    }
}
