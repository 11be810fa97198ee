package vn.edu.demo.connectz.common.model;

public final class Enums {
    private Enums() {}

    public enum Player {
        FIRST, SECOND;

        /** Player who places the move at the given 0-based index. */
        public static Player at(int moveIndex) {
            if (moveIndex < 0) throw new IllegalArgumentException("Negative move index " + moveIndex);
            return moveIndex % 2 == 0 ? FIRST : SECOND;
        }

        public Player opponent() {
            return this == FIRST ? SECOND : FIRST;
        }
    }

    public enum GameResult {
        DRAW(0), FIRST_WON(1), SECOND_WON(2);

        private final int exitCode;

        GameResult(int exitCode) { this.exitCode = exitCode; }

        public int getExitCode() { return exitCode; }

        public static GameResult wonBy(Player player) {
            return player == Player.FIRST ? FIRST_WON : SECOND_WON;
        }
    }

    // Declared in the order they are detected, last first
    public enum FailureKind {
        MISSING_RESULT(3),
        TOO_MANY_MOVES(4),
        COLUMN_OVERFLOW(5),
        INVALID_COLUMN(6),
        INVALID_CONFIGURATION(7),
        PARSING_PROBLEM(8),
        INPUT_UNREADABLE(9);

        private final int exitCode;

        FailureKind(int exitCode) { this.exitCode = exitCode; }

        public int getExitCode() { return exitCode; }
    }

    public enum GameState { INITIALIZED, IN_PROGRESS, CONCLUDED, FAILED }
}
