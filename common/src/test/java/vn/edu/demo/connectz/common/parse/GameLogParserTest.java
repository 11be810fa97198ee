package vn.edu.demo.connectz.common.parse;

import org.junit.jupiter.api.Test;
import vn.edu.demo.connectz.common.model.Enums.FailureKind;
import vn.edu.demo.connectz.common.model.GameConfig;
import vn.edu.demo.connectz.common.model.ParseResult;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GameLogParserTest {

    private final GameLogParser parser = new GameLogParser();

    @Test
    void parsesParametersAndMoves() {
        ParseResult result = parser.parse(new StringReader("7 6 4\n1\n2\n7\n"));

        assertThat(result.isOk()).isTrue();
        assertThat(result.getLog().getConfig()).isEqualTo(new GameConfig(7, 6, 4));
        assertThat(result.getLog().getMoves()).containsExactly(1, 2, 7);
    }

    @Test
    void toleratesExtraWhitespaceAndSigns() {
        ParseResult result = parser.parse(List.of("  7\t6   4 ", " 3 ", "+2"));

        assertThat(result.isOk()).isTrue();
        assertThat(result.getLog().getMoves()).containsExactly(3, 2);
    }

    @Test
    void parameterLineAloneIsAGameWithoutMoves() {
        ParseResult result = parser.parse(new StringReader("4 4 3"));

        assertThat(result.isOk()).isTrue();
        assertThat(result.getLog().getMoveCount()).isZero();
    }

    @Test
    void trailingBlankLinesAreIgnored() {
        ParseResult result = parser.parse(List.of("4 4 3", "1", "", "   ", ""));

        assertThat(result.isOk()).isTrue();
        assertThat(result.getLog().getMoves()).containsExactly(1);
    }

    @Test
    void blankLineBetweenMovesIsMalformed() {
        assertFailure(parser.parse(List.of("4 4 3", "1", "", "2")), FailureKind.PARSING_PROBLEM);
    }

    @Test
    void emptyInputIsAParsingProblem() {
        assertFailure(parser.parse(new StringReader("")), FailureKind.PARSING_PROBLEM);
        assertFailure(parser.parse(List.of("")), FailureKind.PARSING_PROBLEM);
    }

    @Test
    void parameterLineNeedsExactlyThreeIntegers() {
        assertFailure(parser.parse(List.of("7 6")), FailureKind.PARSING_PROBLEM);
        assertFailure(parser.parse(List.of("7 6 4 1")), FailureKind.PARSING_PROBLEM);
        assertFailure(parser.parse(List.of("7 six 4")), FailureKind.PARSING_PROBLEM);
        assertFailure(parser.parse(List.of("7.0 6 4")), FailureKind.PARSING_PROBLEM);
    }

    @Test
    void nonIntegerMoveIsAParsingProblem() {
        assertFailure(parser.parse(List.of("7 6 4", "1", "two")), FailureKind.PARSING_PROBLEM);
        assertFailure(parser.parse(List.of("7 6 4", "1.5")), FailureKind.PARSING_PROBLEM);
        assertFailure(parser.parse(List.of("7 6 4", "1 2")), FailureKind.PARSING_PROBLEM);
        assertFailure(parser.parse(List.of("7 6 4", "99999999999")), FailureKind.PARSING_PROBLEM);
    }

    @Test
    void outOfRangeColumnsStillParse() {
        ParseResult result = parser.parse(List.of("7 6 4", "0", "-1", "8"));

        assertThat(result.isOk()).isTrue();
        assertThat(result.getLog().getMoves()).containsExactly(0, -1, 8);
    }

    @Test
    void invalidConfigurationIsRejected() {
        assertFailure(parser.parse(List.of("3 2 4", "1", "2")), FailureKind.INVALID_CONFIGURATION);
        assertFailure(parser.parse(List.of("0 5 1")), FailureKind.INVALID_CONFIGURATION);
        assertFailure(parser.parse(List.of("5 5 0")), FailureKind.INVALID_CONFIGURATION);
        assertFailure(parser.parse(List.of("-2 5 1", "99")), FailureKind.INVALID_CONFIGURATION);
    }

    @Test
    void malformedMoveOutranksInvalidConfiguration() {
        assertFailure(parser.parse(List.of("3 2 4", "x")), FailureKind.PARSING_PROBLEM);
    }

    @Test
    void undecodableBytesAreAParsingProblem() {
        byte[] bytes = {'1', ' ', '1', ' ', '1', '\n', (byte) 0xFF, (byte) 0xFE};
        Reader reader = new InputStreamReader(new ByteArrayInputStream(bytes),
                StandardCharsets.UTF_8.newDecoder().onMalformedInput(CodingErrorAction.REPORT));

        assertFailure(parser.parse(reader), FailureKind.PARSING_PROBLEM);
    }

    @Test
    void readFailureIsReportedAsUnreadableInput() {
        Reader broken = new Reader() {
            @Override
            public int read(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("disk on fire");
            }

            @Override
            public void close() {
            }
        };

        assertFailure(parser.parse(broken), FailureKind.INPUT_UNREADABLE);
    }

    private static void assertFailure(ParseResult result, FailureKind expected) {
        assertThat(result.isOk()).isFalse();
        assertThat(result.getFailure().getFailure()).isEqualTo(expected);
    }
}
