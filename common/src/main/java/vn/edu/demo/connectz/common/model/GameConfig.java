package vn.edu.demo.connectz.common.model;

/**
 * Board dimensions and the run length needed to win.
 * Validity is decided by {@link vn.edu.demo.connectz.common.util.GameRules#isValidConfig(int, int, int)}.
 */
public final class GameConfig {
    private final int columns;
    private final int rows;
    private final int runLength;

    public GameConfig(int columns, int rows, int runLength) {
        this.columns = columns;
        this.rows = rows;
        this.runLength = runLength;
    }

    public int getColumns() { return columns; }
    public int getRows() { return rows; }
    public int getRunLength() { return runLength; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameConfig)) return false;
        GameConfig that = (GameConfig) o;
        return columns == that.columns && rows == that.rows && runLength == that.runLength;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * columns + rows) + runLength;
    }

    @Override
    public String toString() {
        return "x=" + columns + " y=" + rows + " z=" + runLength;
    }
}
