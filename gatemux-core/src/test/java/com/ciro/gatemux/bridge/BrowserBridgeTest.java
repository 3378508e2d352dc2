package com.ciro.gatemux.bridge;

import com.ciro.gatemux.ObjectMapperFactory;
import com.ciro.gatemux.connection.ConnectionState;
import com.ciro.gatemux.connection.ConnectionStatus;
import com.ciro.gatemux.error.SessionNotFoundException;
import com.ciro.gatemux.events.EventFanout;
import com.ciro.gatemux.events.GatewayEvent;
import com.ciro.gatemux.events.Subscriber;
import com.ciro.gatemux.events.Subscription;
import com.ciro.gatemux.events.Topics;
import com.ciro.gatemux.exec.ExecRequest;
import com.ciro.gatemux.exec.ExecSession;
import com.ciro.gatemux.exec.ExecSessionManager;
import com.ciro.gatemux.exec.ExecState;
import com.ciro.gatemux.protocol.ErrorShape;
import com.ciro.gatemux.protocol.RequestFrame;
import com.ciro.gatemux.protocol.ResponseFrame;
import com.ciro.gatemux.rpc.RpcCorrelator;
import com.ciro.gatemux.support.RecordingSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static com.ciro.gatemux.support.Futures.await;
import static com.ciro.gatemux.support.Futures.failureOf;
import static org.junit.jupiter.api.Assertions.*;

class BrowserBridgeTest {

    private static final Duration WAIT = Duration.ofSeconds(3);

    private final ObjectMapper mapper = ObjectMapperFactory.create();
    private final EventFanout fanout = new EventFanout();
    private final BlockingQueue<RequestFrame> sent = new LinkedBlockingQueue<>();
    private final ConnectionStatus status =
            new ConnectionStatus(ConnectionState.OPEN, "ws://gw.test:18789", 0, 0, null, null, 0);

    private ScheduledExecutorService scheduler;
    private ExecutorService sendExecutor;
    private RpcCorrelator rpc;
    private ExecSessionManager exec;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(1);
        sendExecutor = Executors.newCachedThreadPool();
        rpc = new RpcCorrelator(scheduler, Duration.ofSeconds(5));
        rpc.bind(sent::add);
        exec = new ExecSessionManager(rpc, fanout, mapper, Duration.ofSeconds(5), Duration.ofMinutes(30), 64,
                Ticker.systemTicker());
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
        sendExecutor.shutdownNow();
    }

    private BrowserBridge bridge(BridgeSettings settings) {
        return new BrowserBridge(exec, fanout, mapper, () -> status, scheduler, sendExecutor, settings);
    }

    private BrowserBridge bridge() {
        return bridge(BridgeSettings.defaults());
    }

    private RequestFrame expect(String method) throws InterruptedException {
        RequestFrame f = sent.poll(2, TimeUnit.SECONDS);
        assertNotNull(f, "expected a '" + method + "' request");
        assertEquals(method, f.method());
        return f;
    }

    private void reply(RequestFrame req, String json) throws IOException {
        rpc.resolve(ResponseFrame.success(req.id(), mapper.readTree(json)));
    }

    private ExecSession readySession(String execId) throws Exception {
        CompletableFuture<ExecSession> f = exec.create(ExecRequest.of("/bin/zsh"));
        reply(expect("exec"), "{\"execId\":\"" + execId + "\"}");
        return await(f);
    }

    private void output(String execId, String data) throws IOException {
        fanout.publish(new GatewayEvent(Topics.ALL, "exec.output",
                mapper.readTree("{\"execId\":\"" + execId + "\",\"data\":\"" + data + "\"}")));
    }

    private static long count(RecordingSink sink, String event) {
        return sink.events().stream().filter(event::equals).count();
    }

    @Test
    void openTerminalAnnouncesTheSessionThenRelaysOutput() throws Exception {
        BrowserBridge bridge = bridge();
        RecordingSink sink = new RecordingSink();
        BridgeChannel ch = bridge.open(sink);

        CompletableFuture<ExecSession> f = bridge.openTerminal(ch, ExecRequest.of("/bin/zsh"));
        reply(expect("exec"), "{\"execId\":\"e1\"}");
        ExecSession s = await(f);

        output("e1", "$ ");
        sink.awaitMessages(2, WAIT);
        BridgeMessage session = sink.messages().get(0);
        assertEquals(BrowserBridge.SESSION, session.event());
        assertEquals(s.id(), session.data().get("sessionId").asText());
        assertEquals("e1", session.data().get("execId").asText());

        BridgeMessage event = sink.messages().get(1);
        assertEquals(BrowserBridge.EVENT, event.event());
        assertEquals("exec.output", event.data().get("event").asText());
        assertEquals("$ ", event.data().get("payload").get("data").asText());

        CompletableFuture<Void> closing = bridge.closeTerminal(s.id());
        reply(expect("exec.close"), "{}");
        await(closing);

        sink.awaitClosed(WAIT);
        BridgeMessage close = sink.messages().get(2);
        assertEquals(BrowserBridge.CLOSE, close.event());
        assertEquals("closed", close.data().get("reason").asText());
        assertEquals(0, bridge.activeChannels());
    }

    @Test
    void failedCreateSendsErrorThenClose() throws Exception {
        BrowserBridge bridge = bridge();
        RecordingSink sink = new RecordingSink();
        BridgeChannel ch = bridge.open(sink);

        CompletableFuture<ExecSession> f = bridge.openTerminal(ch, ExecRequest.of("/bin/nope"));
        RequestFrame req = expect("exec");
        rpc.resolve(ResponseFrame.failure(req.id(), new ErrorShape("SPAWN_FAILED", "no such file")));
        failureOf(f);

        sink.awaitClosed(WAIT);
        assertEquals(List.of(BrowserBridge.ERROR, BrowserBridge.CLOSE), sink.events());
        assertEquals("GATEWAY_ERROR", sink.messages().get(0).data().get("code").asText());
        assertTrue(sink.messages().get(0).data().get("message").asText().contains("no such file"));
        assertEquals("create-failed", sink.messages().get(1).data().get("reason").asText());
    }

    @Test
    void threeTabsEachSeeEveryEventOnce() throws Exception {
        BrowserBridge bridge = bridge();
        ExecSession s = readySession("e1");
        RecordingSink[] tabs = {new RecordingSink(), new RecordingSink(), new RecordingSink()};
        for (RecordingSink tab : tabs) {
            assertTrue(bridge.attachTerminal(bridge.open(tab), s.id()));
        }

        output("e1", "hi");

        for (RecordingSink tab : tabs) {
            tab.awaitMessages(2, WAIT);
        }
        Thread.sleep(100);
        for (RecordingSink tab : tabs) {
            assertEquals(1, count(tab, BrowserBridge.SESSION));
            assertEquals(1, count(tab, BrowserBridge.EVENT));
        }
    }

    @Test
    void attachToUnknownSessionFails() {
        BrowserBridge bridge = bridge();
        assertFalse(bridge.attachTerminal(bridge.open(new RecordingSink()), "nope"));
    }

    @Test
    void slowTabIsCutWithoutHoldingBackTheOthers() throws Exception {
        BrowserBridge bridge = bridge(BridgeSettings.defaults().withMaxPending(8));
        ExecSession s = readySession("e1");
        RecordingSink slow = new RecordingSink();
        RecordingSink fast = new RecordingSink();
        BridgeChannel slowCh = bridge.open(slow);
        bridge.attachTerminal(slowCh, s.id());
        bridge.attachTerminal(bridge.open(fast), s.id());
        slow.block();

        long t0 = System.nanoTime();
        for (int i = 0; i < 50; i++) output("e1", "line" + i);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

        assertTrue(elapsedMs < 1000, "publishing blocked for " + elapsedMs + "ms");
        fast.awaitMessages(51, WAIT);
        assertFalse(slowCh.isLive());
        slow.release();
    }

    @Test
    void disconnectedTabIsUnsubscribedAndTheTerminalKept() throws Exception {
        BrowserBridge bridge = bridge();
        ExecSession s = readySession("e1");
        BridgeChannel ch = bridge.open(new RecordingSink());
        bridge.attachTerminal(ch, s.id());
        assertEquals(1, fanout.subscriberCount(s.topic()));

        ch.close();

        assertEquals(0, fanout.subscriberCount(s.topic()));
        assertEquals(0, bridge.activeChannels());
        assertEquals(ExecState.READY, s.state());
        assertNull(sent.poll(100, TimeUnit.MILLISECONDS));
    }

    @Test
    void unwatchedTerminalIsClosedWhenPolicySaysSo() throws Exception {
        BrowserBridge bridge = bridge(BridgeSettings.defaults().withTerminalPolicy(TerminalPolicy.CLOSE_WHEN_UNWATCHED));
        ExecSession s = readySession("e1");
        BridgeChannel a = bridge.open(new RecordingSink());
        BridgeChannel b = bridge.open(new RecordingSink());
        bridge.attachTerminal(a, s.id());
        bridge.attachTerminal(b, s.id());

        a.close();
        assertNull(sent.poll(100, TimeUnit.MILLISECONDS));

        b.close();
        assertEquals("e1", expect("exec.close").params().get("id").asText());
    }

    @Test
    void terminalWhoseTabLeftDuringCreateIsClosedOnceItStarts() throws Exception {
        BrowserBridge bridge = bridge(BridgeSettings.defaults().withTerminalPolicy(TerminalPolicy.CLOSE_WHEN_UNWATCHED));
        BridgeChannel ch = bridge.open(new RecordingSink());

        CompletableFuture<ExecSession> f = bridge.openTerminal(ch, ExecRequest.of("/bin/zsh"));
        RequestFrame create = expect("exec");
        ch.close();

        reply(create, "{\"execId\":\"e1\"}");
        assertEquals("e1", expect("exec.close").params().get("id").asText());
        failureOf(f);
        assertEquals(0, exec.size());
    }

    @Test
    void attachRacingAClosePassesTheCloseOn() throws Exception {
        ExecSession[] target = new ExecSession[1];
        EventFanout racing = new EventFanout() {
            @Override
            public Subscription subscribe(String topic, Subscriber subscriber) {
                // el cierre entra justo entre la comprobación de estado y la suscripción
                if (target[0] != null && topic.equals(target[0].topic())) exec.close(target[0]);
                return super.subscribe(topic, subscriber);
            }
        };
        exec = new ExecSessionManager(rpc, racing, mapper, Duration.ofSeconds(5), Duration.ofMinutes(30), 64,
                Ticker.systemTicker());
        BrowserBridge bridge = new BrowserBridge(exec, racing, mapper, () -> status, scheduler, sendExecutor,
                BridgeSettings.defaults());

        CompletableFuture<ExecSession> created = exec.create(ExecRequest.of("/bin/zsh"));
        reply(expect("exec"), "{\"execId\":\"e1\"}");
        target[0] = await(created);

        RecordingSink sink = new RecordingSink();
        assertTrue(bridge.attachTerminal(bridge.open(sink), target[0].id()));
        reply(expect("exec.close"), "{}");

        sink.awaitClosed(WAIT);
        assertEquals(List.of(BrowserBridge.CLOSE), sink.events());
        assertEquals(target[0].id(), sink.messages().get(0).data().get("sessionId").asText());
    }

    @Test
    void idleChannelGetsKeepAlivePings() {
        BrowserBridge bridge = bridge(BridgeSettings.defaults().withKeepAlive(Duration.ofMillis(50)));
        RecordingSink sink = new RecordingSink();
        bridge.open(sink);

        sink.awaitMessages(2, WAIT);
        assertEquals(BrowserBridge.PING, sink.events().get(0));
        assertTrue(sink.messages().get(0).data().get("t").asLong() > 0);
    }

    @Test
    void activityFeedStartsWithStatusThenRelaysEvents() throws Exception {
        BrowserBridge bridge = bridge();
        RecordingSink sink = new RecordingSink();
        bridge.openActivityFeed(bridge.open(sink), List.of());

        fanout.publish(new GatewayEvent(Topics.ALL, "chat", mapper.readTree("{\"text\":\"hola\"}")));
        fanout.publish(new GatewayEvent(Topics.CONNECTION, "status", status.toJson(mapper)));

        sink.awaitMessages(3, WAIT);
        assertEquals(List.of(BrowserBridge.STATUS, BrowserBridge.ACTIVITY, BrowserBridge.STATUS), sink.events());
        assertEquals("open", sink.messages().get(0).data().get("state").asText());
        assertEquals("chat", sink.messages().get(1).data().get("event").asText());
    }

    @Test
    void activityFeedCanBeNarrowedToTopics() throws Exception {
        BrowserBridge bridge = bridge();
        RecordingSink sink = new RecordingSink();
        bridge.openActivityFeed(bridge.open(sink), List.of("agent"));

        fanout.publish(new GatewayEvent("chat", "chat", mapper.createObjectNode()));
        fanout.publish(new GatewayEvent("agent", "agent", mapper.createObjectNode()));

        sink.awaitMessages(2, WAIT);
        Thread.sleep(50);
        assertEquals(List.of(BrowserBridge.STATUS, BrowserBridge.ACTIVITY), sink.events());
        assertEquals("agent", sink.messages().get(1).data().get("event").asText());
    }

    @Test
    void operationsOnUnknownSessionsFail() {
        BrowserBridge bridge = bridge();
        assertInstanceOf(SessionNotFoundException.class, failureOf(bridge.input("nope", "x")));
        assertInstanceOf(SessionNotFoundException.class, failureOf(bridge.resize("nope", 80, 24)));
        assertInstanceOf(SessionNotFoundException.class, failureOf(bridge.closeTerminal("nope")));
    }

    @Test
    void closingTheBridgeClosesEveryChannel() {
        BrowserBridge bridge = bridge();
        RecordingSink a = new RecordingSink();
        RecordingSink b = new RecordingSink();
        bridge.open(a);
        bridge.open(b);

        bridge.close();

        assertFalse(a.isOpen());
        assertFalse(b.isOpen());
        assertEquals(0, bridge.activeChannels());
    }

    @Test
    void socketCommandsMapToExecMethods() throws Exception {
        BrowserBridge bridge = bridge();
        ExecSession s = readySession("e9");

        CompletableFuture<Void> in = bridge.command(s.id(), mapper.readTree("{\"type\":\"input\",\"data\":\"q\"}"));
        RequestFrame write = expect("exec.write");
        assertEquals("q", write.params().get("data").asText());
        reply(write, "{}");
        await(in);

        CompletableFuture<Void> size = bridge.command(s.id(), mapper.readTree("{\"type\":\"resize\",\"cols\":132}"));
        RequestFrame resize = expect("exec.resize");
        assertEquals(132, resize.params().get("cols").asInt());
        assertEquals(24, resize.params().get("rows").asInt());
        reply(resize, "{}");
        await(size);

        assertInstanceOf(IllegalArgumentException.class,
                failureOf(bridge.command(s.id(), mapper.readTree("{\"type\":\"paste\"}"))));
        assertInstanceOf(SessionNotFoundException.class,
                failureOf(bridge.command("nope", mapper.readTree("{\"type\":\"close\"}"))));
    }

    @Test
    void errorMessageCarriesCode() {
        BridgeMessage m = bridge().error(new SessionNotFoundException("s-1"));
        assertEquals(BrowserBridge.ERROR, m.event());
        assertEquals("SESSION_NOT_FOUND", m.data().get("code").asText());
    }
}
