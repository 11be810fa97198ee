package vn.edu.demo.connectz.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.edu.demo.connectz.common.engine.GameValidator;
import vn.edu.demo.connectz.common.model.Enums.FailureKind;
import vn.edu.demo.connectz.common.model.Verdict;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Validates the Connect-Z game log named on the command line. The outcome is reported
 * only through the exit code; see {@link Verdict#exitCode()}.
 */
public class ConnectZMain {
    private static final Logger log = LoggerFactory.getLogger(ConnectZMain.class);

    static final int USAGE_EXIT_CODE = 64;

    private final CliConfig config;
    private final GameValidator validator;

    public ConnectZMain(CliConfig config, GameValidator validator) {
        this.config = config;
        this.validator = validator;
    }

    public static void main(String[] args) {
        System.exit(new ConnectZMain(new CliConfig(), new GameValidator()).run(args, System.out));
    }

    public int run(String[] args, PrintStream out) {
        if (args.length != 1) {
            out.println(config.getProgramName() + ": Provide one input file");
            return USAGE_EXIT_CODE;
        }

        Verdict verdict = validate(args[0]);
        if (verdict.isFailure()) {
            log.debug("{} -> {} (exit {}): {}", args[0], verdict.getFailure(), verdict.exitCode(), verdict.getDetail());
        } else {
            log.debug("{} -> {} (exit {})", args[0], verdict.getResult(), verdict.exitCode());
        }
        return verdict.exitCode();
    }

    Verdict validate(String path) {
        Path file;
        try {
            file = Paths.get(path);
        } catch (InvalidPathException e) {
            log.debug("Bad input path {}", path, e);
            return Verdict.failed(FailureKind.INPUT_UNREADABLE, "Bad path " + path);
        }
        try (Reader reader = Files.newBufferedReader(file, config.getCharset())) {
            return validator.validate(reader);
        } catch (IOException e) {
            log.debug("Cannot open {}", file, e);
            return Verdict.failed(FailureKind.INPUT_UNREADABLE, "Cannot open " + file + ": " + e.getMessage());
        }
    }
}
