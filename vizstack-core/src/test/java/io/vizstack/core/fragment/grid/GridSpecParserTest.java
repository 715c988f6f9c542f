package io.vizstack.core.fragment.grid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.vizstack.core.exception.AssemblyException;
import io.vizstack.core.exception.MalformedGridSpecException;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("GridSpecParser")
class GridSpecParserTest {

    @Nested
    @DisplayName("valid specifications")
    class Valid {

        @Test
        @DisplayName("parses spanning cells")
        void shouldParseSpanningCells() {
            Map<String, GridCell> cells = GridSpecParser.parse("ABB\nACC\nACC");

            assertThat(cells)
                    .containsExactly(
                            Map.entry("A", new GridCell(0, 0, 1, 3)),
                            Map.entry("B", new GridCell(0, 1, 2, 1)),
                            Map.entry("C", new GridCell(1, 1, 2, 2)));
        }

        @Test
        @DisplayName("ignores whitespace and blank lines")
        void shouldIgnoreWhitespace() {
            String spec = """

                      A A B
                    C D   B
                    """;

            assertThat(GridSpecParser.parse(spec))
                    .containsExactly(
                            Map.entry("A", new GridCell(0, 0, 2, 1)),
                            Map.entry("B", new GridCell(0, 2, 1, 2)),
                            Map.entry("C", new GridCell(1, 0, 1, 1)),
                            Map.entry("D", new GridCell(1, 1, 1, 1)));
        }

        @Test
        @DisplayName("parses offset cells")
        void shouldParseOffsetCells() {
            assertThat(GridSpecParser.parse("AAB\nCDD"))
                    .containsEntry("A", new GridCell(0, 0, 2, 1))
                    .containsEntry("B", new GridCell(0, 2, 1, 1))
                    .containsEntry("C", new GridCell(1, 0, 1, 1))
                    .containsEntry("D", new GridCell(1, 1, 2, 1));
        }

        @Test
        @DisplayName("parses a single column")
        void shouldParseVertical() {
            assertThat(GridSpecParser.parse("A\nB\nC"))
                    .containsEntry("A", new GridCell(0, 0, 1, 1))
                    .containsEntry("B", new GridCell(1, 0, 1, 1))
                    .containsEntry("C", new GridCell(2, 0, 1, 1));
        }

        @Test
        @DisplayName("parses a single row")
        void shouldParseHorizontal() {
            assertThat(GridSpecParser.parse("A B C"))
                    .containsEntry("A", new GridCell(0, 0, 1, 1))
                    .containsEntry("B", new GridCell(0, 1, 1, 1))
                    .containsEntry("C", new GridCell(0, 2, 1, 1));
        }

        @Test
        @DisplayName("accepts | and , as row separators")
        void shouldAcceptAlternativeSeparators() {
            assertThat(GridSpecParser.parse("AB|AC")).isEqualTo(GridSpecParser.parse("AB,AC"));
            assertThat(GridSpecParser.parse("AB|AC"))
                    .containsEntry("A", new GridCell(0, 0, 1, 2))
                    .containsEntry("C", new GridCell(1, 1, 1, 1));
        }

        @Test
        @DisplayName("skips repeated empty markers")
        void shouldSkipEmptyMarkers() {
            assertThat(GridSpecParser.parse("A . B ."))
                    .containsExactly(
                            Map.entry("A", new GridCell(0, 0, 1, 1)),
                            Map.entry("B", new GridCell(0, 2, 1, 1)));
        }
    }

    @Nested
    @DisplayName("malformed specifications")
    class Malformed {

        @Test
        @DisplayName("rejects ragged rows")
        void shouldRejectRaggedRows() {
            assertThatThrownBy(() -> GridSpecParser.parse("AA\nB"))
                    .isInstanceOf(MalformedGridSpecException.class)
                    .hasMessageContaining("rectangular");
        }

        @Test
        @DisplayName("rejects a repeated cell name outside its rectangle")
        void shouldRejectDuplicateName() {
            assertThatThrownBy(() -> GridSpecParser.parse("A B A"))
                    .isInstanceOf(MalformedGridSpecException.class)
                    .extracting(e -> ((AssemblyException) e).getSubject())
                    .isEqualTo("A");
        }

        @Test
        @DisplayName("rejects an L-shaped cell")
        void shouldRejectNonRectangularCell() {
            assertThatThrownBy(() -> GridSpecParser.parse("AA\nAB"))
                    .isInstanceOf(MalformedGridSpecException.class)
                    .hasMessageContaining("cell: A");
        }

        @Test
        @DisplayName("rejects empty and blank input")
        void shouldRejectEmptyInput() {
            assertThatThrownBy(() -> GridSpecParser.parse(""))
                    .isInstanceOf(MalformedGridSpecException.class);
            assertThatThrownBy(() -> GridSpecParser.parse(" \n | , "))
                    .isInstanceOf(MalformedGridSpecException.class);
            assertThatThrownBy(() -> GridSpecParser.parse(null))
                    .isInstanceOf(MalformedGridSpecException.class);
        }
    }
}
