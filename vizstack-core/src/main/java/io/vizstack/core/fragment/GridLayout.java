package io.vizstack.core.fragment;

import io.vizstack.core.exception.MissingItemException;
import io.vizstack.core.fragment.grid.GridCell;
import io.vizstack.core.fragment.grid.GridSpecParser;
import io.vizstack.core.fragment.option.CellSizing;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Arranges items in named cells on a 2D grid. Cells may span several rows and columns.
///
/// Contents: `cells`, keyed by cell name, each `{row, col, width, height, fragmentId}`, and
/// optionally `rowHeight`, `colWidth` and `showLabels`. The item of a cell is resolved under
/// the cell's name as slot.
///
/// Cell geometry comes either from a grid specification string parsed by
/// {@link GridSpecParser}, or from explicit {@link GridCell}s.
///
/// {@snippet :
/// GridLayout grid = GridLayout.of("ABB\nACC\nACC")
///         .item("A", TextPrimitive.of("a"))
///         .item("B", TextPrimitive.of("b"))
///         .item("C", TextPrimitive.of("c"));
/// }
public final class GridLayout extends FragmentAssembler {

    private final Map<String, GridCell> cells = new LinkedHashMap<>();
    private final Map<String, Object> items = new LinkedHashMap<>();
    private CellSizing rowHeight;
    private CellSizing colWidth;
    private Boolean showLabels;

    private GridLayout() {}

    /// Creates a grid without cells.
    ///
    /// @return new grid layout, never null
    public static GridLayout create() {
        return new GridLayout();
    }

    /// Creates a grid whose cells are described by a grid layout string.
    ///
    /// @param spec grid specification, not null
    /// @return new grid layout, never null
    /// @throws io.vizstack.core.exception.MalformedGridSpecException if `spec` is malformed
    public static GridLayout of(String spec) {
        GridLayout grid = new GridLayout();
        grid.cells.putAll(GridSpecParser.parse(spec));
        return grid;
    }

    /// Creates a grid with explicit cells.
    ///
    /// @param cells cell geometry keyed by cell name, not null
    /// @return new grid layout, never null
    public static GridLayout of(Map<String, GridCell> cells) {
        GridLayout grid = new GridLayout();
        cells.forEach(grid::cell);
        return grid;
    }

    /// Declares or replaces a cell.
    ///
    /// @param name cell name, not null
    /// @param cell cell geometry, not null
    /// @return this layout for chaining
    public GridLayout cell(String name, GridCell cell) {
        cells.put(
                Objects.requireNonNull(name, "cell name must not be null"),
                Objects.requireNonNull(cell, "cell must not be null"));
        return this;
    }

    /// Declares or replaces a cell.
    ///
    /// @param name   cell name, not null
    /// @param row    top row
    /// @param col    left column
    /// @param width  columns spanned
    /// @param height rows spanned
    /// @return this layout for chaining
    public GridLayout cell(String name, int row, int col, int width, int height) {
        return cell(name, new GridCell(row, col, width, height));
    }

    /// Declares or replaces a cell together with its item.
    ///
    /// @return this layout for chaining
    public GridLayout cell(String name, int row, int col, int width, int height, Object item) {
        return cell(name, row, col, width, height).item(name, item);
    }

    /// Sets or replaces the item shown in a cell.
    ///
    /// @param name cell name, not null
    /// @param item content of the cell, not null
    /// @return this layout for chaining
    public GridLayout item(String name, Object item) {
        items.put(Objects.requireNonNull(name, "cell name must not be null"), item);
        return this;
    }

    public GridLayout rowHeight(CellSizing rowHeight) {
        this.rowHeight = rowHeight;
        return this;
    }

    public GridLayout colWidth(CellSizing colWidth) {
        this.colWidth = colWidth;
        return this;
    }

    public GridLayout showLabels(Boolean showLabels) {
        this.showLabels = showLabels;
        return this;
    }

    public Map<String, GridCell> getCells() {
        return Collections.unmodifiableMap(cells);
    }

    @Override
    public GridLayout meta(String key, Object value) {
        super.meta(key, value);
        return this;
    }

    @Override
    public FragmentType getFragmentType() {
        return FragmentType.GRID_LAYOUT;
    }

    @Override
    public Assembly assemble(FragmentIdResolver resolver) {
        for (String name : cells.keySet()) {
            if (!items.containsKey(name)) {
                throw new MissingItemException(
                        "No item was provided for cell '" + name + "'", name);
            }
        }
        Map<String, Object> cellContents = new LinkedHashMap<>();
        List<Object> references = new ArrayList<>(cells.size());
        cells.forEach(
                (name, cell) -> {
                    Object item = items.get(name);
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("row", cell.row());
                    entry.put("col", cell.col());
                    entry.put("width", cell.width());
                    entry.put("height", cell.height());
                    entry.put("fragmentId", resolver.getId(item, name));
                    cellContents.put(name, entry);
                    references.add(item);
                });
        Map<String, Object> contents = new LinkedHashMap<>();
        contents.put("cells", cellContents);
        contents.put("rowHeight", wire(rowHeight));
        contents.put("colWidth", wire(colWidth));
        contents.put("showLabels", showLabels);
        return new Assembly(fragment(contents), references);
    }
}
