package cafe.woden.ircwire.irc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.ircwire.net.IrcConnectionException;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class IrcClientTest {

  private static final IrcClientSettings SETTINGS =
      IrcClientSettings.plain().withQuitGrace(Duration.ofMillis(300));

  private final FakeTransport server = new FakeTransport();
  private IrcClient client;

  @AfterEach
  void tearDown() {
    if (client != null) client.close();
  }

  @Test
  void connectAppliesPlaintextDefaultPort() throws Exception {
    FakeConnector connector = new FakeConnector().then(server);
    client = new IrcClient(SETTINGS, connector);

    client.connect("irc.example.net");

    assertEquals(6667, connector.dialed().get(0).port());
    assertEquals(List.of(false), connector.tlsFlags());
    assertEquals("irc.example.net", client.host());
    assertEquals("irc.example.net:6667", client.serverAddress());
    assertTrue(client.connected());
    assertEquals(ConnectionState.CONNECTED, client.state());
  }

  @Test
  void connectAppliesTlsDefaultPortButKeepsExplicitOne() throws Exception {
    FakeTransport second = new FakeTransport();
    FakeConnector connector = new FakeConnector().then(server).then(second);
    IrcClientSettings tls = SETTINGS.withTls(true);

    client = new IrcClient(tls, connector);
    client.connect("irc.example.net");
    assertEquals(6697, connector.dialed().get(0).port());

    IrcClient other = new IrcClient(tls, connector);
    try {
      other.connect("irc.example.net:7000");
      assertEquals(7000, connector.dialed().get(1).port());
      assertEquals(List.of(true, true), connector.tlsFlags());
    } finally {
      other.close();
    }
  }

  @Test
  void writesAreCrlfTerminatedInSubmissionOrder() throws Exception {
    client = new IrcClient(SETTINGS, new FakeConnector().then(server));
    client.connect("irc.example.net");

    client.write("test");
    client.writef("test %d", 2);
    client.write("already terminated\r\n");

    assertEquals("test\r\n", server.nextWritten(2_000));
    assertEquals("test 2\r\n", server.nextWritten(2_000));
    assertEquals("already terminated\r\n", server.nextWritten(2_000));
  }

  @Test
  void concurrentWritersAndPongsNeverInterleaveAndKeepPerProducerOrder() throws Exception {
    client = new IrcClient(SETTINGS, new FakeConnector().then(server));
    client.connect("irc.example.net");

    int producers = 4;
    int perProducer = 50;
    int pings = 20;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(producers);
    try {
      List<Future<?>> done = new ArrayList<>();
      for (int p = 0; p < producers; p++) {
        int id = p;
        done.add(
            pool.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < perProducer; i++) {
                    if (i % 2 == 0) client.write("PRIVMSG #p" + id + " :" + i);
                    else client.writef("PRIVMSG #p%d :%d", id, i);
                  }
                  return null;
                }));
      }
      start.countDown();
      for (int i = 0; i < pings; i++) {
        server.serverSends("PING :k" + i + "\r\n");
      }
      for (Future<?> f : done) f.get(5, TimeUnit.SECONDS);
    } finally {
      pool.shutdownNow();
    }

    Pattern privmsg = Pattern.compile("PRIVMSG #p(\\d+) :(\\d+)\r\n");
    Pattern pong = Pattern.compile("PONG :k(\\d+)\r\n");
    Map<Integer, Integer> nextPerProducer = new HashMap<>();
    int nextPong = 0;
    int producerLines = 0;
    while (producerLines < producers * perProducer || nextPong < pings) {
      String line = server.nextWritten(2_000);
      assertNotNull(line, "timed out after " + producerLines + " lines and " + nextPong + " pongs");
      Matcher m = privmsg.matcher(line);
      if (m.matches()) {
        int id = Integer.parseInt(m.group(1));
        int expected = nextPerProducer.getOrDefault(id, 0);
        assertEquals(expected, Integer.parseInt(m.group(2)), "order of producer " + id);
        nextPerProducer.put(id, expected + 1);
        producerLines++;
        continue;
      }
      Matcher pm = pong.matcher(line);
      assertTrue(pm.matches(), "torn or unexpected line: " + line);
      assertEquals(nextPong, Integer.parseInt(pm.group(1)));
      nextPong++;
    }
    assertEquals(producers, nextPerProducer.size());
  }

  @Test
  void pingIsAnsweredWithPongAndNotForwarded() throws Exception {
    client = new IrcClient(SETTINGS, new FakeConnector().then(server));
    TestSubscriber<IrcMessage> inbound = client.messages().test();
    client.connect("irc.example.net");

    server.serverSends("CMD\r\nPING :test\r\n:irc.example.net 001 wire :Welcome\r\n");

    assertEquals("PONG :test\r\n", server.nextWritten(2_000));
    inbound.awaitCount(2);
    inbound.assertValueCount(2);
    assertEquals("CMD", inbound.values().get(0).command());
    assertEquals("001", inbound.values().get(1).command());
    assertEquals("wire", inbound.values().get(1).param(0));
    inbound.assertNotComplete();
  }

  @Test
  void malformedLinesAreDroppedWithoutEndingTheSession() throws Exception {
    client = new IrcClient(SETTINGS, new FakeConnector().then(server));
    TestSubscriber<IrcMessage> inbound = client.messages().test();
    client.connect("irc.example.net");

    server.serverSends(":\r\n\r\n:onlyprefix\r\nCMD\r\n");

    inbound.awaitCount(1);
    inbound.assertValueCount(1);
    assertEquals("CMD", inbound.values().get(0).command());
    assertTrue(client.connected());
  }

  @Test
  void registrationGoesOutBeforeLinesQueuedWhileDisconnected() throws Exception {
    IrcClientSettings settings =
        SETTINGS.withIdentity(new IrcIdentity("wire", "wireuser", "Wire Bot", "secret"));
    client = new IrcClient(settings, new FakeConnector().then(server));

    client.write("JOIN #ircwire");
    client.connect("irc.example.net");

    assertEquals("PASS secret\r\n", server.nextWritten(2_000));
    assertEquals("NICK wire\r\n", server.nextWritten(2_000));
    assertEquals("USER wireuser 0 * :Wire Bot\r\n", server.nextWritten(2_000));
    assertEquals("JOIN #ircwire\r\n", server.nextWritten(2_000));
  }

  @Test
  void peerCloseRaisesReconnectSignalExactlyOnceAndKeepsInboundOpen() throws Exception {
    client = new IrcClient(SETTINGS, new FakeConnector().then(server));
    TestSubscriber<IrcMessage> inbound = client.messages().test();
    client.connect("irc.example.net");
    ReconnectSignal signal = client.reconnectSignal();

    server.serverCloses();

    Optional<SessionEnd.ConnectionLost> lost = signal.poll(Duration.ofSeconds(2));
    assertTrue(lost.isPresent());
    assertEquals("read", lost.get().source());
    assertEquals("irc.example.net:6667", lost.get().serverAddress());
    assertFalse(signal.poll(Duration.ofMillis(100)).isPresent());

    awaitState(client, ConnectionState.RECONNECT_PENDING);
    assertFalse(client.connected());
    assertTrue(server.isClosed());
    inbound.assertNotComplete();

    client.quit();
    inbound.awaitDone(1, TimeUnit.SECONDS);
    inbound.assertComplete();
    inbound.assertNoErrors();
  }

  @Test
  void reconnectUsesFreshTransportAndSameInboundStream() throws Exception {
    FakeTransport second = new FakeTransport();
    FakeConnector connector = new FakeConnector().then(server).then(second);
    client = new IrcClient(SETTINGS, connector);
    TestSubscriber<IrcMessage> inbound = client.messages().test();

    client.connect("irc.example.net");
    server.serverSends("FIRST\r\n");
    server.serverCloses();
    assertTrue(client.reconnectSignal().poll(Duration.ofSeconds(2)).isPresent());

    client.connect("irc.example.net");
    assertTrue(client.connected());
    second.serverSends("SECOND\r\n");
    client.write("hello");

    assertEquals("hello\r\n", second.nextWritten(2_000));
    inbound.awaitCount(2);
    assertEquals("FIRST", inbound.values().get(0).command());
    assertEquals("SECOND", inbound.values().get(1).command());
    assertEquals(2, connector.dialed().size());
  }

  @Test
  void writeFailureDiscardsQueuedLinesAndRaisesReconnectSignal() throws Exception {
    client = new IrcClient(SETTINGS, new FakeConnector().then(server));
    server.failWrites();
    client.write("one");
    client.write("two");
    client.write("three");

    client.connect("irc.example.net");

    Optional<SessionEnd.ConnectionLost> lost = client.reconnectSignal().poll(Duration.ofSeconds(2));
    assertTrue(lost.isPresent());
    assertEquals("write", lost.get().source());
    awaitState(client, ConnectionState.RECONNECT_PENDING);
    assertTrue(client.outboundQueue().isEmpty());
    assertTrue(server.allWritten().isEmpty());
  }

  @Test
  void failedDialLeavesClientDisconnected() {
    client =
        new IrcClient(SETTINGS, new FakeConnector().thenFail(IrcConnectionException.Stage.RESOLVE));

    IrcConnectionException e =
        assertThrows(IrcConnectionException.class, () -> client.connect("nowhere.invalid"));

    assertEquals(IrcConnectionException.Stage.RESOLVE, e.stage());
    assertEquals("nowhere.invalid:6667", e.address());
    assertEquals(ConnectionState.DISCONNECTED, client.state());
    assertFalse(client.connected());
  }

  @Test
  void uncheckedConnectorFailureLeavesClientDisconnectedAndReusable() throws Exception {
    FakeConnector connector =
        new FakeConnector()
            .thenThrow(new IllegalArgumentException("timeout can't be negative"))
            .then(server);
    client = new IrcClient(SETTINGS, connector);

    assertThrows(IllegalArgumentException.class, () -> client.connect("irc.example.net"));
    assertEquals(ConnectionState.DISCONNECTED, client.state());
    assertFalse(client.connected());

    client.connect("irc.example.net");

    assertTrue(client.connected());
    assertEquals(2, connector.dialed().size());
  }

  @Test
  void registrationFailureDoesNotRaiseReconnectSignal() throws Exception {
    IrcClientSettings settings = SETTINGS.withIdentity(new IrcIdentity("wire", null, null, null));
    client = new IrcClient(settings, new FakeConnector().then(server));
    server.failWrites();

    IrcConnectionException e =
        assertThrows(IrcConnectionException.class, () -> client.connect("irc.example.net"));

    assertEquals(IrcConnectionException.Stage.REGISTER, e.stage());
    assertFalse(client.reconnectSignal().poll(Duration.ofMillis(200)).isPresent());
    awaitState(client, ConnectionState.DISCONNECTED);
    assertTrue(server.isClosed());
  }

  @Test
  void linesQueuedBeforeFailedRegistrationWaitForTheNextSession() throws Exception {
    IrcClientSettings settings = SETTINGS.withIdentity(new IrcIdentity("wire", null, null, null));
    FakeTransport second = new FakeTransport();
    client = new IrcClient(settings, new FakeConnector().then(server).then(second));
    server.failWrites();
    client.write("JOIN #ircwire");

    assertThrows(IrcConnectionException.class, () -> client.connect("irc.example.net"));
    awaitState(client, ConnectionState.DISCONNECTED);
    assertEquals(List.of("JOIN #ircwire"), List.copyOf(client.outboundQueue()));

    client.connect("irc.example.net");

    assertEquals("NICK wire\r\n", second.nextWritten(2_000));
    assertEquals("USER wire 0 * :wire\r\n", second.nextWritten(2_000));
    assertEquals("JOIN #ircwire\r\n", second.nextWritten(2_000));
  }

  @Test
  void connectDuringAttemptInFlightWaitsForItsOutcome() throws Exception {
    CountDownLatch dialing = new CountDownLatch(1);
    CountDownLatch gate = new CountDownLatch(1);
    FakeConnector connector = new FakeConnector().holdNextDial(dialing, gate).then(server);
    client = new IrcClient(SETTINGS, connector);
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<?> first = pool.submit(() -> connectTo("irc.example.net"));
      assertTrue(dialing.await(2, TimeUnit.SECONDS));
      Future<?> second = pool.submit(() -> connectTo("irc.example.net"));

      assertThrows(TimeoutException.class, () -> second.get(200, TimeUnit.MILLISECONDS));
      gate.countDown();
      first.get(2, TimeUnit.SECONDS);
      second.get(2, TimeUnit.SECONDS);
    } finally {
      pool.shutdownNow();
    }

    assertTrue(client.connected());
    assertEquals(1, connector.dialed().size());
  }

  @Test
  void connectWaitingOnFailedAttemptMakesItsOwn() throws Exception {
    CountDownLatch dialing = new CountDownLatch(1);
    CountDownLatch gate = new CountDownLatch(1);
    FakeConnector connector =
        new FakeConnector()
            .holdNextDial(dialing, gate)
            .thenFail(IrcConnectionException.Stage.DIAL)
            .then(server);
    client = new IrcClient(SETTINGS, connector);
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<?> first = pool.submit(() -> connectTo("irc.example.net"));
      assertTrue(dialing.await(2, TimeUnit.SECONDS));
      Future<?> second = pool.submit(() -> connectTo("irc.example.net"));

      assertThrows(TimeoutException.class, () -> second.get(200, TimeUnit.MILLISECONDS));
      gate.countDown();
      ExecutionException failed =
          assertThrows(ExecutionException.class, () -> first.get(2, TimeUnit.SECONDS));
      assertInstanceOf(IrcConnectionException.class, failed.getCause());
      second.get(2, TimeUnit.SECONDS);
    } finally {
      pool.shutdownNow();
    }

    assertTrue(client.connected());
    assertEquals(2, connector.dialed().size());
  }

  @Test
  void connectWhileConnectedIsIgnored() throws Exception {
    FakeConnector connector = new FakeConnector().then(server);
    client = new IrcClient(SETTINGS, connector);

    client.connect("irc.example.net");
    client.connect("irc.example.net");

    assertEquals(1, connector.dialed().size());
  }

  @Test
  void quitBeforeAnyTrafficClosesInboundEmptyAndPromptly() throws Exception {
    FakeConnector connector = new FakeConnector().then(server);
    client = new IrcClient(SETTINGS, connector);
    TestSubscriber<IrcMessage> inbound = client.messages().test();

    client.quit();

    inbound.awaitDone(100, TimeUnit.MILLISECONDS);
    inbound.assertComplete();
    inbound.assertNoValues();
    inbound.assertNoErrors();
    assertTrue(connector.dialed().isEmpty());
    assertTrue(client.isShutDown());
    assertEquals(ConnectionState.DISCONNECTED, client.state());
  }

  @Test
  void quitSendsNoticeOnceAndEndsTheStreams() throws Exception {
    client = new IrcClient(SETTINGS, new FakeConnector().then(server));
    server.closeOnQuit();
    TestSubscriber<IrcMessage> inbound = client.messages().test();
    TestSubscriber<ConnectionState> states = client.states().test();
    client.connect("irc.example.net");

    client.quit("see you");
    client.quit("again");

    assertTrue(client.awaitTermination(Duration.ofSeconds(2)));
    assertEquals(List.of("QUIT :see you\r\n"), server.allWritten());
    assertFalse(client.reconnectSignal().poll(Duration.ofMillis(50)).isPresent());
    assertFalse(client.connected());

    inbound.awaitDone(1, TimeUnit.SECONDS);
    inbound.assertComplete();
    states.awaitDone(1, TimeUnit.SECONDS);
    states.assertValues(
        ConnectionState.DISCONNECTED,
        ConnectionState.CONNECTING,
        ConnectionState.CONNECTED,
        ConnectionState.CLOSING,
        ConnectionState.DISCONNECTED);
  }

  @Test
  void quitFlushesQueuedLinesThenClosesAfterGrace() throws Exception {
    client = new IrcClient(SETTINGS, new FakeConnector().then(server));
    client.connect("irc.example.net");

    client.write("PRIVMSG #ircwire :last words");
    client.quit();

    assertTrue(client.awaitTermination(Duration.ofSeconds(3)));
    assertEquals(
        List.of("PRIVMSG #ircwire :last words\r\n", "QUIT :Bye\r\n"), server.allWritten());
    assertTrue(server.isOutputShutdown());
    assertTrue(server.isClosed());
  }

  @Test
  void connectAfterShutdownIsRejected() {
    client = new IrcClient(SETTINGS, new FakeConnector().then(server));
    client.quit();

    assertThrows(IllegalStateException.class, () -> client.connect("irc.example.net"));
  }

  @Test
  void writesAfterShutdownAreDropped() {
    client = new IrcClient(SETTINGS, new FakeConnector().then(server));
    client.quit();

    client.write("PRIVMSG #ircwire :too late");

    assertTrue(client.outboundQueue().isEmpty());
  }

  private Void connectTo(String address) throws IrcConnectionException {
    client.connect(address);
    return null;
  }

  static void awaitState(IrcClient client, ConnectionState expected) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
    while (client.state() != expected && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    assertEquals(expected, client.state());
  }
}
