package vn.edu.demo.connectz.common.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.edu.demo.connectz.common.model.Board;
import vn.edu.demo.connectz.common.model.Enums.FailureKind;
import vn.edu.demo.connectz.common.model.Enums.GameResult;
import vn.edu.demo.connectz.common.model.Enums.GameState;
import vn.edu.demo.connectz.common.model.Enums.Player;
import vn.edu.demo.connectz.common.model.GameConfig;
import vn.edu.demo.connectz.common.model.GameLog;
import vn.edu.demo.connectz.common.model.Verdict;
import vn.edu.demo.connectz.common.util.GameRules;

import java.util.List;
import java.util.Objects;

/**
 * Replays one game log on a fresh board. Single use: the verdict is computed once
 * and every later {@link #replay()} returns it again.
 */
public class GameSimulator {
    private static final Logger log = LoggerFactory.getLogger(GameSimulator.class);

    private final GameLog gameLog;
    private final GameConfig config;
    private final Board board;

    private GameState state = GameState.INITIALIZED;
    private Verdict verdict;
    private Player winner;  // set by the move that completes a run
    private int movesPlayed = 0;

    public GameSimulator(GameLog gameLog) {
        this.gameLog = Objects.requireNonNull(gameLog, "gameLog");
        this.config = gameLog.getConfig();
        if (!GameRules.isValidConfig(config.getColumns(), config.getRows(), config.getRunLength())) {
            throw new IllegalArgumentException("Illegal game " + config);
        }
        this.board = new Board(config);
    }

    public Verdict replay() {
        if (verdict != null) return verdict;
        state = GameState.IN_PROGRESS;

        List<Integer> moves = gameLog.getMoves();
        for (int i = 0; i < moves.size(); i++) {
            Verdict failure = play(i, moves.get(i));
            if (failure != null) return fail(failure);
        }
        return conclude();
    }

    // Returns the failure for this move, or null once the disc is down
    private Verdict play(int moveIndex, int column) {
        Player player = Player.at(moveIndex);
        int moveNo = moveIndex + 1;

        if (winner != null || board.isFull()) {
            return Verdict.failed(FailureKind.TOO_MANY_MOVES, "There are more moves after end of the game", moveNo);
        }
        if (column < 1 || column > config.getColumns()) {
            return Verdict.failed(FailureKind.INVALID_COLUMN, "Invalid column " + column, moveNo);
        }
        if (board.isColumnFull(column - 1)) {
            return Verdict.failed(FailureKind.COLUMN_OVERFLOW, "Column " + column + " is already full", moveNo);
        }

        int row = board.drop(column - 1, player);
        movesPlayed++;
        if (GameRules.isWin(board, column - 1, row, config.getRunLength())) {
            winner = player;
        }
        if (log.isTraceEnabled()) {
            log.trace("Move {}: {} -> column {} row {}", moveNo, player, column, row + 1);
        }
        return null;
    }

    private Verdict conclude() {
        if (winner != null) {
            return decide(GameResult.wonBy(winner));
        }
        if (board.isFull()) {
            return decide(GameResult.DRAW);
        }
        return fail(Verdict.failed(FailureKind.MISSING_RESULT,
                "No result after all " + movesPlayed + " moves were played"));
    }

    private Verdict decide(GameResult result) {
        state = GameState.CONCLUDED;
        verdict = Verdict.of(result);
        log.debug("Game {} concluded: {}", config, result);
        logBoard();
        return verdict;
    }

    private Verdict fail(Verdict failure) {
        state = GameState.FAILED;
        verdict = failure;
        log.debug("Game {} failed: {}", config, failure);
        logBoard();
        return verdict;
    }

    private void logBoard() {
        if (log.isDebugEnabled()) {
            log.debug("Board after {} moves:\n{}", movesPlayed, board.render());
        }
    }

    public GameState getState() { return state; }
    public Verdict getVerdict() { return verdict; }
    public int getMovesPlayed() { return movesPlayed; }
    public Player getWinner() { return winner; }
    public GameConfig getConfig() { return config; }

    /** Live board; callers must not drop discs on it. */
    public Board getBoard() { return board; }
}
