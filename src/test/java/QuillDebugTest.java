import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.quill.debug.Debug;
import com.quill.debug.DebugLevel;
import com.quill.debug.StreamDebugSink;
import com.quill.script.QuillConfig;
import com.quill.script.QuillScript;
import com.quill.script.ScriptConsole;
import com.quill.script.parser.Lexer;
import com.quill.script.parser.Value;

public class QuillDebugTest {

    @AfterEach
    void restoreSilentDebug() {
        Debug.get().setSink(null);
    }

    @Test
    void silentSinkIsInstalledWithoutHostSetup() {
        // no setSink call before these checks
        assertNotNull(Debug.get().getSink());
        assertTrue(Debug.get().isSilent());
        assertDoesNotThrow(() -> Debug.get().e("Test", "dropped"));
    }

    @Test
    void engineRunsWithoutAnySink() {
        assertTrue(Debug.get().isSilent());
        assertEquals(3, new Lexer("1 + 2;").tokenize().size() - 1);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        QuillScript qs = new QuillScript(QuillConfig.defaults(),
                new ScriptConsole(new PrintStream(out, true, StandardCharsets.UTF_8),
                        new BufferedReader(new StringReader(""))));
        assertEquals(Value.number(3), qs.run("1 + 2;"));
    }

    @Test
    void nullSinkRestoresSilence() {
        Debug.get().setSink((level, tag, message, error) -> { });
        assertFalse(Debug.get().isSilent());

        Debug.get().setSink(null);
        assertTrue(Debug.get().isSilent());
        assertNotNull(Debug.get().getSink());
    }

    @Test
    void streamSinkFiltersBelowThreshold() {
        ByteArrayOutputStream log = new ByteArrayOutputStream();
        StreamDebugSink sink = new StreamDebugSink(new PrintStream(log, true, StandardCharsets.UTF_8), DebugLevel.WARN);
        Debug.get().setSink(sink);

        Debug.get().d("Lexer", "hidden");
        Debug.get().w("Files", "shown");

        assertEquals(DebugLevel.WARN, sink.threshold());
        assertEquals("WARN [Files] shown", log.toString(StandardCharsets.UTF_8).trim());
    }

    @Test
    void streamSinkPrintsAttachedError() {
        ByteArrayOutputStream log = new ByteArrayOutputStream();
        StreamDebugSink sink = new StreamDebugSink(new PrintStream(log, true, StandardCharsets.UTF_8), DebugLevel.TRACE);

        sink.log(DebugLevel.ERROR, "Test", "failed", new IllegalStateException("boom"));

        String text = log.toString(StandardCharsets.UTF_8);
        assertTrue(text.startsWith("ERROR [Test] failed"), text);
        assertTrue(text.contains("IllegalStateException: boom"), text);
    }

    @Test
    void streamSinkDefaultsToInfo() {
        StreamDebugSink sink = new StreamDebugSink(new PrintStream(new ByteArrayOutputStream()), null);
        assertEquals(DebugLevel.INFO, sink.threshold());
    }

    @Test
    void debugLevelParsing() {
        assertEquals(DebugLevel.DEBUG, DebugLevel.parse(" Debug "));
        assertTrue(DebugLevel.ERROR.atLeast(DebugLevel.WARN));
        assertFalse(DebugLevel.TRACE.atLeast(DebugLevel.INFO));
        assertThrows(IllegalArgumentException.class, () -> DebugLevel.parse("loud"));
    }
}
