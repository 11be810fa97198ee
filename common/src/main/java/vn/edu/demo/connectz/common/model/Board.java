package vn.edu.demo.connectz.common.model;

import vn.edu.demo.connectz.common.model.Enums.Player;

import java.util.ArrayList;
import java.util.List;

/**
 * Connect-Z grid stored column by column. Discs only ever get appended to a column,
 * so index 0 of a column is its bottom cell.
 *
 * <p>Cells above a column's current height are empty and read as {@code null}.
 * Illegal drops are the caller's problem: the simulator validates the column and the
 * capacity first, this class only guards against programming errors.
 */
public class Board {
    private final int columns;
    private final int rows;
    private final List<List<Player>> grid;
    private int discCount = 0;

    public Board(int columns, int rows) {
        if (columns < 1 || rows < 1) {
            throw new IllegalArgumentException("Board needs at least one column and one row: " + columns + "x" + rows);
        }
        this.columns = columns;
        this.rows = rows;
        this.grid = new ArrayList<>(columns);
        for (int c = 0; c < columns; c++) {
            grid.add(new ArrayList<>());
        }
    }

    public Board(GameConfig config) {
        this(config.getColumns(), config.getRows());
    }

    public int getColumns() { return columns; }
    public int getRows() { return rows; }
    public int discCount() { return discCount; }

    public boolean inBounds(int x, int y) {
        return x >= 0 && x < columns && y >= 0 && y < rows;
    }

    /** Appends a disc to the 0-based column and returns the row it landed on. */
    public int drop(int column, Player player) {
        if (player == null) throw new NullPointerException("player");
        List<Player> stack = column(column);
        if (stack.size() >= rows) {
            throw new IllegalStateException("Column " + column + " already holds " + rows + " discs");
        }
        stack.add(player);
        discCount++;
        return stack.size() - 1;
    }

    public int height(int column) {
        return column(column).size();
    }

    public boolean isColumnFull(int column) {
        return height(column) >= rows;
    }

    public boolean isFull() {
        return discCount == (long) columns * rows;
    }

    /** Disc at (x, y) counted from the bottom left, or null if that cell is still empty. */
    public Player cellAt(int x, int y) {
        if (!inBounds(x, y)) {
            throw new IndexOutOfBoundsException("Cell (" + x + ", " + y + ") outside " + columns + "x" + rows);
        }
        List<Player> stack = grid.get(x);
        return y < stack.size() ? stack.get(y) : null;
    }

    /** Top row first; '1' and '2' for the players, '.' for empty cells. */
    public String render() {
        StringBuilder sb = new StringBuilder((columns + 1) * rows);
        for (int y = rows - 1; y >= 0; y--) {
            for (int x = 0; x < columns; x++) {
                Player p = cellAt(x, y);
                sb.append(p == null ? '.' : p == Player.FIRST ? '1' : '2');
            }
            if (y > 0) sb.append('\n');
        }
        return sb.toString();
    }

    private List<Player> column(int column) {
        if (column < 0 || column >= columns) {
            throw new IndexOutOfBoundsException("Column " + column + " outside 0.." + (columns - 1));
        }
        return grid.get(column);
    }
}
