package vn.edu.demo.connectz.common.engine;

import vn.edu.demo.connectz.common.model.Enums.FailureKind;
import vn.edu.demo.connectz.common.model.GameConfig;
import vn.edu.demo.connectz.common.model.GameLog;
import vn.edu.demo.connectz.common.model.ParseResult;
import vn.edu.demo.connectz.common.model.Verdict;
import vn.edu.demo.connectz.common.parse.GameLogParser;
import vn.edu.demo.connectz.common.util.GameRules;

import java.io.Reader;
import java.util.List;

/**
 * Parses a game log and replays it. Holds no game state, so one instance can serve
 * any number of games; each call gets its own board.
 */
public class GameValidator {
    private final GameLogParser parser;

    public GameValidator() {
        this(new GameLogParser());
    }

    public GameValidator(GameLogParser parser) {
        this.parser = parser;
    }

    public Verdict validate(Reader reader) {
        return replay(parser.parse(reader));
    }

    public Verdict validate(List<String> lines) {
        return replay(parser.parse(lines));
    }

    public Verdict validate(GameLog gameLog) {
        GameConfig c = gameLog.getConfig();
        if (!GameRules.isValidConfig(c.getColumns(), c.getRows(), c.getRunLength())) {
            return Verdict.failed(FailureKind.INVALID_CONFIGURATION, "Illegal game " + c);
        }
        return new GameSimulator(gameLog).replay();
    }

    private Verdict replay(ParseResult parsed) {
        return parsed.isOk() ? validate(parsed.getLog()) : parsed.getFailure();
    }
}
