package com.ciro.gatemux.web;

import com.ciro.gatemux.ObjectMapperFactory;
import com.ciro.gatemux.exec.ExecRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TerminalParamsTest {

    private static final List<String> SHELL = List.of("/bin/zsh");
    private final ObjectMapper mapper = ObjectMapperFactory.create();

    private static Map<String, Deque<String>> query(String... pairs) {
        Map<String, Deque<String>> q = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            q.computeIfAbsent(pairs[i], k -> new ArrayDeque<>()).add(pairs[i + 1]);
        }
        return q;
    }

    @Test
    void queryWithoutCommandUsesDefault() {
        TerminalParams p = TerminalParams.fromQuery(query(), SHELL);
        assertFalse(p.attach());
        assertEquals(SHELL, p.request().command());
        assertNull(p.request().cols());
    }

    @Test
    void singleCommandValueIsSplitOnSpaces() {
        ExecRequest r = TerminalParams.fromQuery(query("command", "htop -d 5", "cols", "90", "rows", "20", "cwd", "/srv"), SHELL).request();
        assertEquals(List.of("htop", "-d", "5"), r.command());
        assertEquals(90, r.cols());
        assertEquals(20, r.rows());
        assertEquals("/srv", r.cwd());
    }

    @Test
    void repeatedCommandKeepsArgumentsVerbatim() {
        ExecRequest r = TerminalParams.fromQuery(query("command", "echo", "command", "a b"), SHELL).request();
        assertEquals(List.of("echo", "a b"), r.command());
    }

    @Test
    void sessionIdMeansAttach() {
        TerminalParams p = TerminalParams.fromQuery(query("sessionId", "s-1", "command", "ignored"), SHELL);
        assertTrue(p.attach());
        assertEquals("s-1", p.sessionId());
        assertNull(p.request());
    }

    @Test
    void badSizeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TerminalParams.fromQuery(query("cols", "wide"), SHELL));
        assertThrows(IllegalArgumentException.class, () -> TerminalParams.fromQuery(query("rows", "0"), SHELL));
    }

    @Test
    void jsonBody() throws Exception {
        ExecRequest r = TerminalParams.fromJson(
                mapper.readTree("{\"command\":[\"python3\",\"-q\"],\"cwd\":\"/tmp\",\"cols\":80,\"rows\":24}"), SHELL).request();
        assertEquals(List.of("python3", "-q"), r.command());
        assertEquals("/tmp", r.cwd());
        assertEquals(80, r.cols());

        assertEquals(SHELL, TerminalParams.fromJson(mapper.readTree("{\"command\":[]}"), SHELL).request().command());
        assertThrows(IllegalArgumentException.class,
                () -> TerminalParams.fromJson(mapper.readTree("{\"command\":[1,2]}"), SHELL));
        assertThrows(IllegalArgumentException.class,
                () -> TerminalParams.fromJson(mapper.readTree("{\"command\":{}}"), SHELL));
    }
}
