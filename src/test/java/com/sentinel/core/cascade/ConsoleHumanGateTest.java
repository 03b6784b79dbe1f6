package com.sentinel.core.cascade;

import com.sentinel.core.model.CascadeChoice;
import com.sentinel.core.model.ChangeRadiusViolation;
import com.sentinel.core.model.RadiusAxis;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleHumanGateTest {

    private static final List<ChangeRadiusViolation> VIOLATIONS = List.of(
            new ChangeRadiusViolation(RadiusAxis.LINES, 200, 150));

    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();

    private ConsoleHumanGate gate(String input) {
        return new ConsoleHumanGate(new BufferedReader(new StringReader(input)),
                new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Numbers and names map to the three choices")
    void parse() {
        assertEquals(CascadeChoice.AUTO_APPLY, ConsoleHumanGate.parse("1"));
        assertEquals(CascadeChoice.REVIEW_AND_HALT, ConsoleHumanGate.parse(" review-and-halt "));
        assertEquals(CascadeChoice.REVIEW_AND_HALT, ConsoleHumanGate.parse("REVIEW_AND_HALT"));
        assertEquals(CascadeChoice.HALT, ConsoleHumanGate.parse("3"));
        assertNull(ConsoleHumanGate.parse("4"));
    }

    @Test
    @DisplayName("Invalid input re-prompts until a valid choice arrives")
    void reprompt() {
        assertEquals(CascadeChoice.AUTO_APPLY, gate("maybe\nauto-apply\n").ask("SENTINEL-T", VIOLATIONS));
        String output = captured.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("lines: observed 200, budget 150"));
        assertTrue(output.contains("Unrecognised choice 'maybe'"));
    }

    @Test
    @DisplayName("End of input halts")
    void endOfInput() {
        assertEquals(CascadeChoice.HALT, gate("").ask("SENTINEL-T", VIOLATIONS));
    }
}
