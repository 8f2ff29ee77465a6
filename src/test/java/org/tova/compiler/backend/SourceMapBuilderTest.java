package org.tova.compiler.backend;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class SourceMapBuilderTest {

    @Test
    @Tag("unit")
    void testVlqEncoding() {
        assertThat(SourceMapBuilder.vlq(0)).isEqualTo("A");
        assertThat(SourceMapBuilder.vlq(1)).isEqualTo("C");
        assertThat(SourceMapBuilder.vlq(-1)).isEqualTo("D");
        assertThat(SourceMapBuilder.vlq(16)).isEqualTo("gB");
    }

    @Test
    @Tag("unit")
    void testMappingsAreRelativeAndOffset() {
        // Arrange
        SourceMapBuilder builder = new SourceMapBuilder("app.tova").addAll(List.of(
                new SourceMapBuilder.Mapping(0, 1, 1),
                new SourceMapBuilder.Mapping(1, 2, 1),
                new SourceMapBuilder.Mapping(3, 5, 3)), 2);

        // Act
        String mappings = builder.encodeMappings();

        // Assert
        assertThat(mappings).isEqualTo(";;AAAA;AACA;;AAGE");
    }

    @Test
    @Tag("unit")
    void testOnlyFirstMappingPerLineIsKept() {
        // Arrange
        SourceMapBuilder builder = new SourceMapBuilder("app.tova").addAll(List.of(
                new SourceMapBuilder.Mapping(0, 1, 1),
                new SourceMapBuilder.Mapping(0, 1, 9)), 0);

        // Act / Assert
        assertThat(builder.encodeMappings()).isEqualTo("AAAA");
        assertThat(builder.build("app.shared.js")).contains("\"file\":\"app.shared.js\"").contains("\"sources\":[\"app.tova\"]");
    }
}
