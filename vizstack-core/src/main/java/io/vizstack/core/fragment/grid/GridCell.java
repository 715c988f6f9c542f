package io.vizstack.core.fragment.grid;

/// Rectangular region of a grid layout, in zero-based row/column units.
///
/// @param row    top row, must be >= 0
/// @param col    left column, must be >= 0
/// @param width  number of columns spanned, must be >= 1
/// @param height number of rows spanned, must be >= 1
public record GridCell(int row, int col, int width, int height) {

    public GridCell {
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException(
                    "cell position must be non-negative, got row=" + row + ", col=" + col);
        }
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException(
                    "cell size must be positive, got width=" + width + ", height=" + height);
        }
    }

    /// Returns whether the given position lies inside this cell.
    ///
    /// @param r row index
    /// @param c column index
    /// @return true if `(r, c)` is covered by this cell
    public boolean contains(int r, int c) {
        return r >= row && r < row + height && c >= col && c < col + width;
    }
}
