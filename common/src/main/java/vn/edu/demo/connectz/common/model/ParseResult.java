package vn.edu.demo.connectz.common.model;

import java.util.Objects;

/** Either a parsed {@link GameLog} or the failure that stopped parsing. */
public final class ParseResult {
    private final GameLog log;
    private final Verdict failure;

    private ParseResult(GameLog log, Verdict failure) {
        this.log = log;
        this.failure = failure;
    }

    public static ParseResult ok(GameLog log) {
        return new ParseResult(Objects.requireNonNull(log, "log"), null);
    }

    public static ParseResult failed(Verdict failure) {
        if (!failure.isFailure()) {
            throw new IllegalArgumentException("Not a failure verdict: " + failure);
        }
        return new ParseResult(null, failure);
    }

    public boolean isOk() { return log != null; }
    public GameLog getLog() { return log; }
    public Verdict getFailure() { return failure; }
}
