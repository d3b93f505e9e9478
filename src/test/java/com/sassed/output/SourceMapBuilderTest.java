package com.sassed.output;

import com.sassed.lexer.SourcePosition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SourceMapBuilderTest {

    private static String vlq(int value) {
        StringBuilder sb = new StringBuilder();
        SourceMapBuilder.encode(sb, value);
        return sb.toString();
    }

    private static SourcePosition at(String source, int line, int column) {
        return new SourcePosition(source, line, column, 1);
    }

    // ============================================================
    // VLQ encoding
    // ============================================================

    @Test
    public void testEncodeSmallValues() {
        assertEquals("A", vlq(0));
        assertEquals("C", vlq(1));
        assertEquals("D", vlq(-1));
        assertEquals("e", vlq(15));
    }

    @Test
    public void testEncodeContinuation() {
        assertEquals("gB", vlq(16));
        assertEquals("hB", vlq(-16));
    }

    // ============================================================
    // Mappings
    // ============================================================

    @Test
    public void testMappingsAreDeltaEncoded() {
        SourceMapBuilder builder = new SourceMapBuilder("out.css", null);
        builder.addMapping(0, 0, at("a.scss", 1, 1));
        builder.addMapping(0, 4, at("a.scss", 1, 5));
        builder.addMapping(2, 2, at("a.scss", 2, 3));
        assertEquals("AAAA,IAAI;;EACF", builder.mappings());
    }

    @Test
    public void testSecondSourceGetsNextIndex() {
        SourceMapBuilder builder = new SourceMapBuilder("out.css", null);
        builder.addMapping(0, 0, at("a.scss", 1, 1));
        builder.addMapping(1, 0, at("_b.scss", 1, 1));
        assertEquals("AAAA;ACAA", builder.mappings());
    }

    @Test
    public void testUnknownPositionsAreSkipped() {
        SourceMapBuilder builder = new SourceMapBuilder("out.css", null);
        builder.addMapping(0, 0, SourcePosition.UNKNOWN);
        builder.addMapping(0, 0, null);
        assertEquals(0, builder.size());
        assertEquals("", builder.mappings());
    }

    // ============================================================
    // JSON
    // ============================================================

    @Test
    public void testJsonFields() {
        SourceMapBuilder builder = new SourceMapBuilder("out.css", null);
        builder.addMapping(0, 0, at("a.scss", 1, 1));
        String json = builder.toJson(false, Map.of());
        assertTrue(json.contains("\"version\" : 3"), json);
        assertTrue(json.contains("\"file\" : \"out.css\""), json);
        assertTrue(json.contains("\"a.scss\""), json);
        assertTrue(json.contains("\"mappings\" : \"AAAA\""), json);
        assertFalse(json.contains("sourcesContent"), json);
    }

    @Test
    public void testSourcesAreRelativeToMapDirectory(@TempDir Path dir) {
        Path source = dir.resolve("src").resolve("main.scss").toAbsolutePath();
        SourceMapBuilder builder = new SourceMapBuilder("main.css", dir.resolve("css"));
        builder.addMapping(0, 0, at(source.toString(), 1, 1));
        String json = builder.toJson(false, Map.of());
        assertTrue(json.contains("\"../src/main.scss\""), json);
    }

    @Test
    public void testSourcesContent() {
        SourceMapBuilder builder = new SourceMapBuilder("out.css", null);
        builder.addMapping(0, 0, at("a.scss", 1, 1));
        String json = builder.toJson(true, Map.of("a.scss", "a { b: c; }"));
        assertTrue(json.contains("\"sourcesContent\""), json);
        assertTrue(json.contains("\"a { b: c; }\""), json);
    }
}
