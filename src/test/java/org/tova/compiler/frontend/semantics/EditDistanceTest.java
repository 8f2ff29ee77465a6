package org.tova.compiler.frontend.semantics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class EditDistanceTest {

    @Test
    @Tag("unit")
    void testLevenshteinDistance() {
        assertThat(EditDistance.levenshtein("kitten", "sitting")).isEqualTo(3);
        assertThat(EditDistance.levenshtein("", "abc")).isEqualTo(3);
        assertThat(EditDistance.levenshtein("same", "same")).isZero();
    }

    @Test
    @Tag("unit")
    void testMaxDistanceGrowsWithNameLength() {
        assertThat(EditDistance.maxDistance("ab")).isEqualTo(2);
        assertThat(EditDistance.maxDistance("a_long_name")).isEqualTo(4);
    }

    @Test
    @Tag("unit")
    void testClosestPrefersCaseOnlyDifference() {
        // Arrange
        List<String> candidates = List.of("username", "userName", "users");

        // Act / Assert
        assertThat(EditDistance.closest("UserName", candidates)).contains("username");
        assertThat(EditDistance.closest("usrname", candidates)).contains("username");
    }

    @Test
    @Tag("unit")
    void testClosestIgnoresFarCandidates() {
        assertThat(EditDistance.closest("xyz", List.of("completely_different"))).isEmpty();
    }
}
