import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.quill.script.errors.ErrorKind;
import com.quill.script.errors.NameError;
import com.quill.script.parser.Environment;
import com.quill.script.parser.Value;

public class QuillEnvironmentTest {

    @Test
    void resolveWalksFromBlockToRoot() {
        Environment env = new Environment();
        env.declare("a", Value.number(1));
        env.declare("shadow", Value.number(10));

        env.pushBlock();
        env.declare("b", Value.number(2));
        env.declare("shadow", Value.number(20)); // inner shadows outer

        // local
        assertEquals(2.0, env.resolve("b").asNumber());
        // parent
        assertEquals(1.0, env.resolve("a").asNumber());
        // shadowing
        assertEquals(20.0, env.resolve("shadow").asNumber());

        env.popBlock();
        assertEquals(10.0, env.resolve("shadow").asNumber());
        assertFalse(env.exists("b"));
    }

    @Test
    void assignUpdatesNearestDeclaringScope_notLocalCopy() {
        Environment env = new Environment();
        env.declare("i", Value.number(0));

        env.pushBlock();
        env.assign("i", Value.number(5));
        assertFalse(env.existsInCurrentScope("i"));
        env.popBlock();

        assertEquals(5.0, env.resolve("i").asNumber());
    }

    @Test
    void assignToShadowLeavesOuterAlone() {
        Environment env = new Environment();
        env.declare("x", Value.string("outer"));
        env.pushBlock();
        env.declare("x", Value.string("inner"));
        env.assign("x", Value.string("changed"));
        env.popBlock();

        assertEquals(Value.string("outer"), env.resolve("x"));
    }

    @Test
    void redeclareInSameScopeFails() {
        Environment env = new Environment();
        env.declare("x", Value.number(1));
        NameError e = assertThrows(NameError.class, () -> env.declare("x", Value.number(2)));
        assertEquals(ErrorKind.NAME, e.kind());
        assertEquals(1.0, env.resolve("x").asNumber());
    }

    @Test
    void assignUndeclaredFails() {
        Environment env = new Environment();
        env.pushBlock();
        assertThrows(NameError.class, () -> env.assign("ghost", Value.nil()));
        assertFalse(env.exists("ghost"));
    }

    @Test
    void resolveUndefinedFails() {
        NameError e = assertThrows(NameError.class, () -> new Environment().resolve("nope"));
        assertTrue(e.detail().contains("nope"));
        assertFalse(e.hasPosition());
    }

    @Test
    void nullValueIsStoredAsNil() {
        Environment env = new Environment();
        env.declare("n", Value.nil());
        assertTrue(env.exists("n"));
        assertTrue(env.resolve("n").isNull());
        assertThrows(IllegalArgumentException.class, () -> env.declare("m", null));
    }

    @Test
    void depthTracksNesting() {
        Environment env = new Environment();
        assertEquals(0, env.depth());
        env.pushBlock();
        env.pushBlock();
        assertEquals(2, env.depth());
        env.popBlock();
        assertEquals(1, env.depth());
        env.popBlock();
        assertEquals(0, env.depth());
    }

    @Test
    void poppingRootIsRejected() {
        assertThrows(IllegalStateException.class, () -> new Environment().popBlock());
    }

    @Test
    void blockDeclarationsAreGoneAfterPop() {
        Environment env = new Environment();
        env.pushBlock();
        env.declare("tmp", Value.bool(true));
        env.popBlock();

        env.pushBlock();
        // a fresh block must not see the previous block's bindings
        assertFalse(env.exists("tmp"));
        env.declare("tmp", Value.bool(false));
        env.popBlock();
    }

    @Test
    void initialBindingsLandInRoot() {
        Map<String, Value> initial = new LinkedHashMap<>();
        initial.put("limit", Value.number(3));
        initial.put("name", Value.string("quill"));
        Environment env = new Environment(initial);

        initial.put("late", Value.nil());

        assertTrue(env.existsInCurrentScope("limit"));
        assertFalse(env.exists("late"));
        assertEquals("quill", env.resolve("name").asString());
    }

    @Test
    void snapshotMergesChainOuterFirst() {
        Environment env = new Environment();
        env.declare("a", Value.number(1));
        env.declare("b", Value.number(2));
        env.pushBlock();
        env.declare("b", Value.number(3));
        env.declare("c", Value.number(4));

        Map<String, Value> snap = env.snapshot();
        assertEquals(List.of("a", "b", "c"), List.copyOf(snap.keySet()));
        assertEquals(Value.number(3), snap.get("b"));
        assertThrows(UnsupportedOperationException.class, () -> snap.put("d", Value.nil()));
    }
}
