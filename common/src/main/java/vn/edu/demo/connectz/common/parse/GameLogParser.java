package vn.edu.demo.connectz.common.parse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.edu.demo.connectz.common.model.Enums.FailureKind;
import vn.edu.demo.connectz.common.model.GameConfig;
import vn.edu.demo.connectz.common.model.GameLog;
import vn.edu.demo.connectz.common.model.ParseResult;
import vn.edu.demo.connectz.common.model.Verdict;
import vn.edu.demo.connectz.common.util.GameRules;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.CharacterCodingException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a game log: the first line holds {@code X Y Z}, every following line one 1-based column.
 * Trailing blank lines are ignored, a blank line with moves after it is malformed.
 */
public class GameLogParser {
    private static final Logger log = LoggerFactory.getLogger(GameLogParser.class);

    public ParseResult parse(Reader reader) {
        List<String> lines = new ArrayList<>();
        try (BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader)) {
            String line;
            while ((line = br.readLine()) != null) {
                lines.add(line);
            }
        } catch (CharacterCodingException e) {
            return parsingProblem("Input is not valid text: " + e);
        } catch (IOException e) {
            log.debug("Reading game log failed", e);
            return ParseResult.failed(Verdict.failed(FailureKind.INPUT_UNREADABLE, "Cannot read input: " + e.getMessage()));
        }
        return parse(lines);
    }

    public ParseResult parse(List<String> lines) {
        if (lines.isEmpty()) {
            return parsingProblem("Missing parameter line");
        }

        String[] params = lines.get(0).trim().split("\\s+");
        if (params.length != 3) {
            return parsingProblem("Expected 3 parameters but got '" + lines.get(0) + "'");
        }
        int[] xyz = new int[3];
        for (int i = 0; i < 3; i++) {
            Integer value = toInt(params[i]);
            if (value == null) {
                return parsingProblem("Parameter '" + params[i] + "' is not an integer");
            }
            xyz[i] = value;
        }

        int last = lines.size() - 1;
        while (last > 0 && lines.get(last).isBlank()) last--;

        List<Integer> moves = new ArrayList<>(last);
        for (int i = 1; i <= last; i++) {
            Integer column = toInt(lines.get(i));
            if (column == null) {
                return parsingProblem("Line " + (i + 1) + " is not a column: '" + lines.get(i) + "'");
            }
            moves.add(column);
        }

        GameConfig config = new GameConfig(xyz[0], xyz[1], xyz[2]);
        if (!GameRules.isValidConfig(xyz[0], xyz[1], xyz[2])) {
            log.debug("Rejected configuration {}", config);
            return ParseResult.failed(Verdict.failed(FailureKind.INVALID_CONFIGURATION, "Illegal game " + config));
        }
        return ParseResult.ok(new GameLog(config, moves));
    }

    private static Integer toInt(String token) {
        try {
            return Integer.parseInt(token.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static ParseResult parsingProblem(String detail) {
        log.debug("Parsing problem: {}", detail);
        return ParseResult.failed(Verdict.failed(FailureKind.PARSING_PROBLEM, detail));
    }
}
