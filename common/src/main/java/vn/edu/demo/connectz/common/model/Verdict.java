package vn.edu.demo.connectz.common.model;

import vn.edu.demo.connectz.common.model.Enums.FailureKind;
import vn.edu.demo.connectz.common.model.Enums.GameResult;

import java.util.Objects;

/**
 * Terminal outcome of validating one game log: exactly one of a {@link GameResult}
 * or a {@link FailureKind}. Failures are reported as values, the engine never throws them.
 */
public final class Verdict {
    private final GameResult result;     // null when failed
    private final FailureKind failure;   // null when the game was decided
    private final String detail;
    private final int moveNo;            // 1-based move that failed, 0 if none

    private Verdict(GameResult result, FailureKind failure, String detail, int moveNo) {
        this.result = result;
        this.failure = failure;
        this.detail = detail;
        this.moveNo = moveNo;
    }

    public static Verdict of(GameResult result) {
        Objects.requireNonNull(result, "result");
        return new Verdict(result, null, result.name(), 0);
    }

    public static Verdict failed(FailureKind failure, String detail) {
        return failed(failure, detail, 0);
    }

    public static Verdict failed(FailureKind failure, String detail, int moveNo) {
        Objects.requireNonNull(failure, "failure");
        return new Verdict(null, failure, detail, moveNo);
    }

    public boolean isDecided() { return result != null; }
    public boolean isFailure() { return failure != null; }

    public GameResult getResult() { return result; }
    public FailureKind getFailure() { return failure; }
    public String getDetail() { return detail; }
    public int getMoveNo() { return moveNo; }

    public int exitCode() {
        return result != null ? result.getExitCode() : failure.getExitCode();
    }

    @Override
    public String toString() {
        if (result != null) return result.name();
        return moveNo > 0
                ? failure + " at move " + moveNo + ": " + detail
                : failure + ": " + detail;
    }
}
