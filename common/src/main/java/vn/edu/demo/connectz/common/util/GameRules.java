package vn.edu.demo.connectz.common.util;

import vn.edu.demo.connectz.common.model.Board;
import vn.edu.demo.connectz.common.model.Enums.Player;

import java.util.ArrayList;
import java.util.List;

public final class GameRules {
    private GameRules() {}

    public static boolean isValidConfig(int columns, int rows, int runLength) {
        return Math.min(columns, Math.min(rows, runLength)) >= 1
                && runLength <= Math.max(columns, rows);
    }

    /**
     * Every line a run of {@code z} could lie on: columns bottom to top, rows left to right,
     * then an ascending and a descending diagonal for each start offset
     * {@code 0 <= startX <= X-z}, {@code 0 <= startY <= Y-z}. Empty cells are {@code null}.
     */
    public static List<List<Player>> lines(Board b, int z) {
        int cols = b.getColumns();
        int rows = b.getRows();
        List<List<Player>> lines = new ArrayList<>();

        for (int x = 0; x < cols; x++) {
            lines.add(line(b, x, 0, 0, 1));
        }
        for (int y = 0; y < rows; y++) {
            lines.add(line(b, 0, y, 1, 0));
        }
        for (int x = 0; x <= cols - z; x++) {
            for (int y = 0; y <= rows - z; y++) {
                lines.add(line(b, x, y, 1, 1));
                lines.add(line(b, cols - 1 - x, y, -1, 1));
            }
        }
        return lines;
    }

    /** True once {@code z} consecutive cells belong to {@code p}; anything else resets the count. */
    public static boolean hasRun(List<Player> line, Player p, int z) {
        int run = 0;
        for (Player cell : line) {
            run = cell == p ? run + 1 : 0;
            if (run >= z) return true;
        }
        return false;
    }

    public static boolean hasWon(Board b, Player p, int z) {
        if (p == null) return false;
        for (List<Player> line : lines(b, z)) {
            if (hasRun(line, p, z)) return true;
        }
        return false;
    }

    /**
     * Whether the disc at (x, y) lies on a run of {@code z} for its owner, counted along the
     * four directions through that cell.
     */
    public static boolean isWin(Board b, int x, int y, int z) {
        Player p = b.cellAt(x, y);
        if (p == null) return false;
        return count(b, x, y, 0, 1, p) + count(b, x, y, 0, -1, p) - 1 >= z ||
               count(b, x, y, 1, 0, p) + count(b, x, y, -1, 0, p) - 1 >= z ||
               count(b, x, y, 1, 1, p) + count(b, x, y, -1, -1, p) - 1 >= z ||
               count(b, x, y, 1, -1, p) + count(b, x, y, -1, 1, p) - 1 >= z;
    }

    private static int count(Board b, int x, int y, int dx, int dy, Player p) {
        int cnt = 0;
        int xx = x, yy = y;
        while (b.inBounds(xx, yy) && b.cellAt(xx, yy) == p) {
            cnt++;
            xx += dx; yy += dy;
        }
        return cnt;
    }

    private static List<Player> line(Board b, int x, int y, int dx, int dy) {
        List<Player> cells = new ArrayList<>();
        int xx = x, yy = y;
        while (b.inBounds(xx, yy)) {
            cells.add(b.cellAt(xx, yy));
            xx += dx; yy += dy;
        }
        return cells;
    }
}
