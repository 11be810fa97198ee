package vn.edu.demo.connectz.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

public class CliConfig {
    private static final Logger log = LoggerFactory.getLogger(CliConfig.class);

    private final Charset charset;
    private final String programName;

    public CliConfig(Charset charset, String programName) {
        this.charset = charset;
        this.programName = programName;
    }

    // Defaults come from -Dconnectz.charset / -Dconnectz.program
    public CliConfig() {
        this(charsetOrDefault(System.getProperty("connectz.charset")),
             System.getProperty("connectz.program", "connectz"));
    }

    /** Unknown or malformed names fall back to UTF-8 so a typo cannot turn into a game exit code. */
    static Charset charsetOrDefault(String name) {
        if (name == null || name.isBlank()) return StandardCharsets.UTF_8;
        try {
            return Charset.forName(name.strip());
        } catch (IllegalArgumentException e) {
            log.warn("Unknown charset '{}' in connectz.charset, using UTF-8", name);
            return StandardCharsets.UTF_8;
        }
    }

    public Charset getCharset() { return charset; }
    public String getProgramName() { return programName; }
}
