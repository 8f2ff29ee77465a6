package org.tova.compiler.backend;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds a version 3 source map for one generated file. Each mapping ties the start of a generated
 * line to a source position.
 */
public class SourceMapBuilder {

    private static final String BASE64 = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    /**
     * @param generatedLine 0-based line in the generated file.
     * @param sourceLine 1-based source line.
     * @param sourceColumn 1-based source column.
     */
    public record Mapping(int generatedLine, int sourceLine, int sourceColumn) {}

    private final String sourceFile;
    private final List<Mapping> mappings = new ArrayList<>();

    public SourceMapBuilder(String sourceFile) {
        this.sourceFile = sourceFile;
    }

    /**
     * Adds mappings, shifting their generated lines.
     * @param added The mappings.
     * @param lineOffset Lines emitted before the mapped code.
     * @return This builder.
     */
    public SourceMapBuilder addAll(List<Mapping> added, int lineOffset) {
        for (Mapping m : added) {
            mappings.add(new Mapping(m.generatedLine() + lineOffset, m.sourceLine(), m.sourceColumn()));
        }
        return this;
    }

    /**
     * @param generatedFile The name of the generated file.
     * @return The source map JSON.
     */
    public String build(String generatedFile) {
        JsonObject map = new JsonObject();
        map.addProperty("version", 3);
        map.addProperty("file", generatedFile);
        JsonArray sources = new JsonArray();
        sources.add(sourceFile);
        map.add("sources", sources);
        map.add("names", new JsonArray());
        map.addProperty("mappings", encodeMappings());
        return GSON.toJson(map);
    }

    String encodeMappings() {
        List<Mapping> sorted = mappings.stream()
                .filter(m -> m.sourceLine() > 0)
                .sorted(Comparator.comparingInt(Mapping::generatedLine))
                .toList();
        StringBuilder out = new StringBuilder();
        int line = 0;
        int previousSourceLine = 0;
        int previousSourceColumn = 0;
        for (Mapping m : sorted) {
            if (m.generatedLine() < line) continue;
            while (line < m.generatedLine()) {
                out.append(';');
                line++;
            }
            if (out.length() > 0 && out.charAt(out.length() - 1) != ';') continue;
            int sourceLine = m.sourceLine() - 1;
            int sourceColumn = Math.max(0, m.sourceColumn() - 1);
            out.append(vlq(0)).append(vlq(0))
                    .append(vlq(sourceLine - previousSourceLine))
                    .append(vlq(sourceColumn - previousSourceColumn));
            previousSourceLine = sourceLine;
            previousSourceColumn = sourceColumn;
        }
        return out.toString();
    }

    /**
     * @param value A signed integer.
     * @return Its base64 VLQ encoding.
     */
    static String vlq(int value) {
        int vlq = value < 0 ? ((-value) << 1) | 1 : value << 1;
        StringBuilder out = new StringBuilder();
        do {
            int digit = vlq & 31;
            vlq >>>= 5;
            if (vlq > 0) digit |= 32;
            out.append(BASE64.charAt(digit));
        } while (vlq > 0);
        return out.toString();
    }
}
