package vn.edu.demo.connectz.common.model;

import java.util.List;
import java.util.Objects;

public class GameLog {
    private final GameConfig config;
    private final List<Integer> moves; // 1-based columns, in play order

    public GameLog(GameConfig config, List<Integer> moves) {
        this.config = Objects.requireNonNull(config, "config");
        this.moves = List.copyOf(moves);
    }

    public GameConfig getConfig() { return config; }
    public List<Integer> getMoves() { return moves; }
    public int getMoveCount() { return moves.size(); }
}
