package ai.repld.repl;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class PrintingMessageCollectorTest {

    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);

    private String printed() {
        return bytes.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Test
    void testRendersLocationAndCaret() {
        var collector = new PrintingMessageCollector(out, MessageRenderer.PLAIN_RELATIVE_PATHS, false);
        var location = new MessageLocation("line2.jsh", 2, 5, 2, 6, "int y");

        collector.report(MessageSeverity.ERROR, "';' expected", location);

        assertEquals("line2.jsh:2:5: error: ';' expected\nint y\n    ^\n", printed());
        assertTrue(collector.hasErrors());
    }

    @Test
    void testVerboseOnlyMessagesAreHiddenByDefault() {
        var collector = new PrintingMessageCollector(out, MessageRenderer.WITHOUT_PATHS, false);
        collector.report(MessageSeverity.OUTPUT, "stdout line");
        collector.report(MessageSeverity.LOGGING, "compiler log");
        collector.report(MessageSeverity.WARNING, "deprecated");

        assertEquals("warning: deprecated\n", printed());
        assertFalse(collector.hasErrors());
    }

    @Test
    void testVerboseShowsEverything() {
        var collector = new PrintingMessageCollector(out, MessageRenderer.WITHOUT_PATHS, true);
        collector.report(MessageSeverity.OUTPUT, "stdout line");
        assertEquals("output: stdout line\n", printed());
    }

    @Test
    void testClearResetsErrorFlag() {
        var collector = new PrintingMessageCollector(out, MessageRenderer.WITHOUT_PATHS, false);
        collector.report(MessageSeverity.ERROR, "bad");
        assertTrue(collector.hasErrors());
        collector.clear();
        assertFalse(collector.hasErrors());
    }
}
