package com.ciro.gatemux.exec;

import com.ciro.gatemux.ObjectMapperFactory;
import com.ciro.gatemux.error.ConnectionLostException;
import com.ciro.gatemux.error.GatewayErrorException;
import com.ciro.gatemux.error.RpcTimeoutException;
import com.ciro.gatemux.error.SessionNotReadyException;
import com.ciro.gatemux.events.EventFanout;
import com.ciro.gatemux.events.GatewayEvent;
import com.ciro.gatemux.events.Topics;
import com.ciro.gatemux.protocol.ErrorShape;
import com.ciro.gatemux.protocol.RequestFrame;
import com.ciro.gatemux.protocol.ResponseFrame;
import com.ciro.gatemux.rpc.RpcCorrelator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static com.ciro.gatemux.support.Futures.await;
import static com.ciro.gatemux.support.Futures.failureOf;
import static org.junit.jupiter.api.Assertions.*;

class ExecSessionManagerTest {

    private final ObjectMapper mapper = ObjectMapperFactory.create();
    private final EventFanout fanout = new EventFanout();
    private final BlockingQueue<RequestFrame> sent = new LinkedBlockingQueue<>();
    private final AtomicLong nanos = new AtomicLong();

    private ScheduledExecutorService scheduler;
    private RpcCorrelator rpc;
    private ExecSessionManager manager;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        rpc = new RpcCorrelator(scheduler, Duration.ofSeconds(5));
        rpc.bind(sent::add);
        manager = new ExecSessionManager(rpc, fanout, mapper, Duration.ofSeconds(5),
                Duration.ofMinutes(10), 16, nanos::get);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private RequestFrame expect(String method) throws InterruptedException {
        RequestFrame f = sent.poll(2, TimeUnit.SECONDS);
        assertNotNull(f, "expected a '" + method + "' request");
        assertEquals(method, f.method());
        return f;
    }

    private void reply(RequestFrame req, String json) throws IOException {
        assertTrue(rpc.resolve(ResponseFrame.success(req.id(), mapper.readTree(json))));
    }

    private ExecSession ready(String execId) throws Exception {
        CompletableFuture<ExecSession> f = manager.create(ExecRequest.of("/bin/zsh"));
        reply(expect("exec"), "{\"execId\":\"" + execId + "\"}");
        return await(f);
    }

    @Test
    void createThenWrite() throws Exception {
        CompletableFuture<ExecSession> f = manager.create(ExecRequest.of("echo", "hi").withSize(80, 24));

        RequestFrame create = expect("exec");
        assertEquals("echo", create.params().get("command").get(0).asText());
        assertTrue(create.params().get("pty").asBoolean());
        assertEquals(0, create.params().get("timeoutMs").asInt());
        assertEquals(80, create.params().get("cols").asInt());
        reply(create, "{\"execId\":\"e1\"}");

        ExecSession s = await(f);
        assertEquals(ExecState.READY, s.state());
        assertEquals("e1", s.execId().orElseThrow());

        CompletableFuture<Void> w = manager.write(s, "hi\n");
        RequestFrame write = expect("exec.write");
        assertEquals("e1", write.params().get("id").asText());
        assertEquals("hi\n", write.params().get("data").asText());
        assertEquals(1, s.pendingWriters());

        reply(write, "{}");
        await(w);
        assertEquals(0, s.pendingWriters());
    }

    @Test
    void writeBeforeReadyFailsWithoutTouchingTheGateway() throws Exception {
        manager.create(ExecRequest.of("/bin/zsh"));
        expect("exec");
        ExecSession creating = manager.list().get(0);

        CompletableFuture<Void> w = manager.write(creating, "x");

        assertInstanceOf(SessionNotReadyException.class, failureOf(w));
        assertNull(sent.poll(100, TimeUnit.MILLISECONDS));
    }

    @Test
    void createThatNeverAnswersTimesOutAndCloses() throws Exception {
        ExecSession s = manager.open(ExecRequest.of("sleep", "100"));
        CompletableFuture<ExecSession> f = manager.start(s, Duration.ofMillis(2000));
        expect("exec");

        assertInstanceOf(RpcTimeoutException.class, failureOf(f));
        assertEquals(ExecState.CLOSED, s.state());
        assertTrue(manager.get(s.id()).isEmpty());
    }

    @Test
    void replyWithoutExecIdIsAFailure() throws Exception {
        ExecSession s = manager.open(ExecRequest.of("/bin/zsh"));
        CompletableFuture<ExecSession> f = manager.start(s);
        reply(expect("exec"), "{\"pty\":true}");

        GatewayErrorException e = assertInstanceOf(GatewayErrorException.class, failureOf(f));
        assertEquals("NO_EXEC_ID", e.error().code());
        assertEquals(ExecState.CLOSED, s.state());
    }

    @Test
    void gatewayRejectionIsReported() throws Exception {
        ExecSession s = manager.open(ExecRequest.of("/bin/zsh"));
        ExecFeed feed = manager.feed(s);
        CompletableFuture<ExecSession> f = manager.start(s);
        RequestFrame req = expect("exec");
        rpc.resolve(ResponseFrame.failure(req.id(), new ErrorShape("DENIED", "exec disabled")));

        GatewayErrorException e = assertInstanceOf(GatewayErrorException.class, failureOf(f));
        assertEquals("DENIED", e.error().code());

        GatewayEvent closed = feed.next(Duration.ofSeconds(1)).orElseThrow();
        assertEquals(ExecEvents.CLOSED, closed.name());
        assertEquals(ExecEvents.REASON_CREATE_FAILED, closed.payload().get("reason").asText());
    }

    @Test
    void execIdIsProbedInOrder() throws Exception {
        CompletableFuture<ExecSession> f = manager.create(ExecRequest.of("/bin/zsh"));
        reply(expect("exec"), "{\"streamId\":\"s9\",\"pid\":42}");
        assertEquals("s9", await(f).execId().orElseThrow());

        CompletableFuture<ExecSession> g = manager.create(ExecRequest.of("/bin/zsh"));
        reply(expect("exec"), "{\"pid\":4242}");
        assertEquals("4242", await(g).execId().orElseThrow());
    }

    @Test
    void startingTwiceIsRejected() throws Exception {
        ExecSession s = manager.open(ExecRequest.of("/bin/zsh"));
        manager.start(s);
        CompletableFuture<ExecSession> again = manager.start(s);

        assertInstanceOf(IllegalStateException.class, failureOf(again));
        expect("exec");
        assertNull(sent.poll(100, TimeUnit.MILLISECONDS));
    }

    @Test
    void closeIsIdempotentAndBestEffort() throws Exception {
        ExecSession s = ready("e1");
        ExecFeed feed = manager.feed(s);

        CompletableFuture<Void> first = manager.close(s);
        CompletableFuture<Void> second = manager.close(s);
        assertTrue(second.isDone());

        RequestFrame close = expect("exec.close");
        assertEquals("e1", close.params().get("id").asText());
        rpc.resolve(ResponseFrame.failure(close.id(), new ErrorShape("NOT_FOUND", "already gone")));

        await(first);
        assertEquals(ExecState.CLOSED, s.state());
        assertTrue(manager.get(s.id()).isEmpty());
        assertNull(sent.poll(100, TimeUnit.MILLISECONDS));

        GatewayEvent closed = feed.next(Duration.ofSeconds(1)).orElseThrow();
        assertEquals(ExecEvents.CLOSED, closed.name());
        assertEquals(ExecEvents.REASON_CLOSED, closed.payload().get("reason").asText());
        assertTrue(feed.isExhausted());

        await(manager.close(s.id()));
        await(manager.close("no-such-session"));
    }

    @Test
    void closingWhileCreatingReleasesTheRemoteProcessLater() throws Exception {
        ExecSession s = manager.open(ExecRequest.of("/bin/zsh"));
        CompletableFuture<ExecSession> f = manager.start(s);
        RequestFrame create = expect("exec");

        await(manager.close(s));
        assertEquals(ExecState.CLOSED, s.state());

        reply(create, "{\"execId\":\"e5\"}");
        assertInstanceOf(SessionNotReadyException.class, failureOf(f));
        assertEquals("e5", expect("exec.close").params().get("id").asText());
    }

    @Test
    void gatewayEventsAreRoutedToTheirSession() throws Exception {
        ExecSession one = ready("e1");
        ExecSession two = ready("e2");
        List<GatewayEvent> gotOne = new CopyOnWriteArrayList<>();
        List<GatewayEvent> gotTwo = new CopyOnWriteArrayList<>();
        manager.subscribe(one, gotOne::add);
        manager.subscribe(two, gotTwo::add);

        JsonNode out = mapper.readTree("{\"execId\":\"e1\",\"data\":\"hello\"}");
        fanout.publish(new GatewayEvent(Topics.ALL, "exec.output", out));
        fanout.publish(new GatewayEvent(Topics.ALL, "exec.output", mapper.readTree("{\"execId\":\"zz\"}")));

        assertEquals(1, gotOne.size());
        assertEquals("exec.output", gotOne.get(0).name());
        assertEquals(one.topic(), gotOne.get(0).topic());
        assertEquals("hello", gotOne.get(0).payload().get("data").asText());
        assertTrue(gotTwo.isEmpty());
    }

    @Test
    void resizeDoesNotWaitForTheGateway() throws Exception {
        ExecSession s = ready("e1");

        CompletableFuture<Void> r = manager.resize(s, 120, 40);

        assertTrue(r.isDone());
        RequestFrame resize = expect("exec.resize");
        assertEquals(120, resize.params().get("cols").asInt());
        assertEquals(40, resize.params().get("rows").asInt());
    }

    @Test
    void connectionLossClosesEverySession() throws Exception {
        ExecSession s = ready("e1");
        ExecFeed feed = manager.feed(s);

        manager.onConnectionLost(new ConnectionLostException("link down"));

        GatewayEvent closed = feed.next(Duration.ofSeconds(1)).orElseThrow();
        assertEquals(ExecEvents.REASON_CONNECTION_LOST, closed.payload().get("reason").asText());
        assertEquals(ExecState.CLOSED, s.state());
        assertEquals(0, manager.size());
        assertInstanceOf(SessionNotReadyException.class, failureOf(manager.write(s, "x")));
    }

    @Test
    void idleSessionsAreEvicted() throws Exception {
        ExecSession s = ready("e1");
        ExecFeed feed = manager.feed(s);

        nanos.addAndGet(Duration.ofMinutes(11).toNanos());
        manager.evictIdle();

        reply(expect("exec.close"), "{}");
        GatewayEvent closed = feed.next(Duration.ofSeconds(1)).orElseThrow();
        assertEquals(ExecEvents.REASON_IDLE, closed.payload().get("reason").asText());
        assertEquals(ExecState.CLOSED, s.state());
    }

    @Test
    void recentlyUsedSessionsSurvive() throws Exception {
        ExecSession s = ready("e1");

        nanos.addAndGet(Duration.ofMinutes(8).toNanos());
        manager.write(s, "ls\n");
        nanos.addAndGet(Duration.ofMinutes(8).toNanos());
        manager.evictIdle();

        assertEquals(ExecState.READY, s.state());
        assertTrue(manager.get(s.id()).isPresent());
    }
}
