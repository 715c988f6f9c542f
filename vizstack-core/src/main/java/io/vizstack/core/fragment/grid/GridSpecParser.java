package io.vizstack.core.fragment.grid;

import io.vizstack.core.exception.MalformedGridSpecException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/// Parses compact ASCII-art grid specifications into named cells.
///
/// Rows are separated by line breaks, `|` or `,`; all other whitespace is ignored, and rows
/// left empty after stripping are dropped. Each distinct character other than `.` names one
/// cell, which must be a contiguous rectangle of that character. `.` marks an empty position.
///
/// ```
/// "ABB\nACC\nACC"   ->   A {row 0, col 0, 1x3}
///                        B {row 0, col 1, 2x1}
///                        C {row 1, col 1, 2x2}
/// ```
///
/// Sizes read width x height.
///
/// For each position not yet claimed, the cell is found greedily: first extended rightward
/// while the row holds the same character, then downward while every column of that range
/// holds it in the next row. A character met again must lie within its rectangle.
///
/// @implNote Stateless and thread-safe.
public final class GridSpecParser {

    /// Marks a position that belongs to no cell.
    public static final char EMPTY = '.';

    private static final Pattern ROW_SEPARATOR = Pattern.compile("[\\n\\r|,]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private GridSpecParser() {}

    /// Parses a grid specification.
    ///
    /// @param spec the specification string, not null
    /// @return cells keyed by their one-character name, in order of first appearance, never null
    /// @throws MalformedGridSpecException if there are no rows, rows differ in length, or a
    ///     character's positions do not form a single rectangle
    public static Map<String, GridCell> parse(String spec) {
        char[][] grid = toGrid(spec);
        int rows = grid.length;
        int cols = grid[0].length;

        Map<Character, GridCell> bounds = new LinkedHashMap<>();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                char ch = grid[r][c];
                GridCell known = bounds.get(ch);
                if (known != null) {
                    if (!known.contains(r, c)) {
                        throw new MalformedGridSpecException(
                                "Specification string malformed for cell: " + ch,
                                String.valueOf(ch));
                    }
                    continue;
                }
                if (ch == EMPTY) {
                    continue;
                }
                int lastCol = c;
                while (lastCol + 1 < cols && grid[r][lastCol + 1] == ch) {
                    lastCol++;
                }
                int lastRow = r;
                while (lastRow + 1 < rows && rowMatches(grid[lastRow + 1], c, lastCol, ch)) {
                    lastRow++;
                }
                bounds.put(ch, new GridCell(r, c, lastCol - c + 1, lastRow - r + 1));
            }
        }

        Map<String, GridCell> cells = new LinkedHashMap<>();
        bounds.forEach((ch, cell) -> cells.put(String.valueOf(ch), cell));
        return Collections.unmodifiableMap(cells);
    }

    private static boolean rowMatches(char[] row, int from, int to, char ch) {
        for (int c = from; c <= to; c++) {
            if (row[c] != ch) {
                return false;
            }
        }
        return true;
    }

    private static char[][] toGrid(String spec) {
        if (spec == null) {
            throw new MalformedGridSpecException("Specification string must not be null", null);
        }
        List<String> rows = new ArrayList<>();
        for (String raw : ROW_SEPARATOR.split(spec)) {
            String row = WHITESPACE.matcher(raw).replaceAll("");
            if (!row.isEmpty()) {
                rows.add(row);
            }
        }
        if (rows.isEmpty()) {
            throw new MalformedGridSpecException(
                    "Specification string must contain at least one row", null);
        }
        int width = rows.get(0).length();
        for (String row : rows) {
            if (row.length() != width) {
                throw new MalformedGridSpecException(
                        "Specification string must be rectangular, got rows: " + rows, null);
            }
        }
        char[][] grid = new char[rows.size()][];
        for (int r = 0; r < rows.size(); r++) {
            grid[r] = rows.get(r).toCharArray();
        }
        return grid;
    }
}
