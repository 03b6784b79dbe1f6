package com.sentinel.core.cascade;

import com.sentinel.core.model.CascadeChoice;
import com.sentinel.core.model.ChangeRadiusViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Terminal prompt for human-gated cascades. Accepts {@code 1|2|3} or the choice
 * names ({@code auto-apply}, {@code review-and-halt}, {@code halt}); end of input halts.
 */
@Component
public class ConsoleHumanGate implements HumanGate {

    private static final Logger log = LoggerFactory.getLogger(ConsoleHumanGate.class);

    private final BufferedReader in;
    private final PrintStream out;

    @Autowired
    public ConsoleHumanGate() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public ConsoleHumanGate(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public synchronized CascadeChoice ask(String sentinelTaskId, List<ChangeRadiusViolation> violations) {
        out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [SENTINEL]|@ " + sentinelTaskId + " exceeded its change radius:"));
        for (ChangeRadiusViolation violation : violations) {
            out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(red) -|@ " + violation.describe()));
        }
        while (true) {
            out.println("  1) auto-apply       warn pending tasks and continue the wave");
            out.println("  2) review-and-halt  stop the wave for manual review");
            out.println("  3) halt             stop the wave");
            out.print("Choice [1-3]: ");
            out.flush();

            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read cascade choice for " + sentinelTaskId, e);
            }
            if (line == null) {
                log.warn("Human gate input closed for {}; halting", sentinelTaskId);
                return CascadeChoice.HALT;
            }
            CascadeChoice choice = parse(line);
            if (choice != null) {
                log.info("Human gate choice for {}: {}", sentinelTaskId, choice);
                return choice;
            }
            out.println("Unrecognised choice '" + line.trim() + "'");
        }
    }

    static CascadeChoice parse(String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return switch (value) {
            case "1", "auto-apply" -> CascadeChoice.AUTO_APPLY;
            case "2", "review-and-halt" -> CascadeChoice.REVIEW_AND_HALT;
            case "3", "halt" -> CascadeChoice.HALT;
            default -> null;
        };
    }
}
