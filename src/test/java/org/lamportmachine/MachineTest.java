package org.lamportmachine;

import org.lamportmachine.config.MachineConfig;
import org.lamportmachine.interfaces.ActionSelector;
import org.lamportmachine.log.EventRecord;
import org.lamportmachine.log.EventType;
import org.lamportmachine.machine.Action;
import org.lamportmachine.machine.Machine;
import org.lamportmachine.machine.MachineStartupException;
import org.lamportmachine.machine.MachineState;
import org.lamportmachine.net.PeerIdentity;
import org.lamportmachine.net.PeerLink;
import org.lamportmachine.util.SimpleRetryExecutor;
import org.lamportmachine.wire.MessageCodec;
import org.lamportmachine.wire.WireMessage;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class MachineTest {

    private static MachineConfig.Builder base() {
        return MachineConfig.builder()
                .id(1)
                .host("127.0.0.1")
                .port(0)
                .ticksPerSecond(20)
                .runTime(Duration.ofMillis(500))
                .connectAttempts(2)
                .connectDelayMs(10);
    }

    private static ActionSelector always(Action action) {
        return () -> action;
    }

    @Test
    void queuedMessagesArePoppedInArrivalOrderAndMerged() {
        RecordingSink sink = new RecordingSink();
        Machine m = new Machine(base().build(), sink, always(Action.INTERNAL), new Random(1));

        m.inboundQueue().push(new WireMessage(7, 2));
        m.inboundQueue().push(new WireMessage(3, 3));
        m.tick();
        m.tick();

        List<EventRecord> r = sink.records();
        assertEquals(2, r.size());
        assertEquals(EventType.RECEIVE, r.get(0).type());
        assertEquals(8, r.get(0).logicalClock(), "max(0,7)+1");
        assertEquals(Integer.valueOf(1), r.get(0).queueLength());
        assertEquals(9, r.get(1).logicalClock(), "max(8,3)+1");
        assertEquals(Integer.valueOf(0), r.get(1).queueLength());
    }

    @Test
    void waitingMessageTakesPriorityOverLocalActivity() {
        RecordingSink sink = new RecordingSink();
        ActionSelector failIfAsked = () -> { throw new AssertionError("selector consulted while queue non-empty"); };
        Machine m = new Machine(base().build(), sink, failIfAsked, new Random(1));

        m.inboundQueue().push(new WireMessage(1, 2));
        m.tick();

        assertEquals(EventType.RECEIVE, sink.last().type());
    }

    @Test
    void localEventsAdvanceClockByExactlyOne() {
        RecordingSink sink = new RecordingSink();
        Machine m = new Machine(base().build(), sink, always(Action.INTERNAL), new Random(1));

        m.tick();
        m.tick();
        m.tick();

        assertEquals(3, m.clockValue());
        assertEquals(List.of(1L, 2L, 3L), sink.records().stream().map(EventRecord::logicalClock).toList());
        assertTrue(sink.records().stream().allMatch(r -> r.type() == EventType.INTERNAL));
    }

    @Test
    void sendWithoutPeersIsStillRecordedAsSend() {
        RecordingSink sink = new RecordingSink();
        Machine m = new Machine(base().build(), sink, always(Action.BROADCAST), new Random(1));

        m.tick();

        assertEquals(EventType.BROADCAST, sink.last().type());
        assertEquals(1, sink.last().logicalClock());
        assertNull(sink.last().note());
    }

    @Test
    void sendCarriesIncrementedClockAndSenderId() throws Exception {
        try (ServerSocket peerServer = new ServerSocket(0)) {
            RecordingSink sink = new RecordingSink();
            MachineConfig config = base().id(4).peer("127.0.0.1", peerServer.getLocalPort()).build();
            Machine m = new Machine(config, sink, always(Action.SEND_ONE), new Random(1));
            m.start();
            try (Socket accepted = peerServer.accept();
                 BufferedReader in = new BufferedReader(
                         new InputStreamReader(accepted.getInputStream(), StandardCharsets.US_ASCII))) {

                m.tick();
                m.tick();

                assertEquals("1:4", in.readLine());
                assertEquals("2:4", in.readLine());
            } finally {
                m.shutdown();
            }
            assertEquals(List.of(EventType.INIT, EventType.SEND_ONE, EventType.SEND_ONE, EventType.SHUTDOWN),
                    sink.records().stream().map(EventRecord::type).toList());
        }
    }

    @Test
    void secondPeerIsTargetOfSendOther() throws Exception {
        try (ServerSocket first = new ServerSocket(0); ServerSocket second = new ServerSocket(0)) {
            MachineConfig config = base()
                    .peer("127.0.0.1", first.getLocalPort())
                    .peer("127.0.0.1", second.getLocalPort())
                    .build();
            Machine m = new Machine(config, new RecordingSink(), always(Action.SEND_OTHER), new Random(1));
            m.start();
            try (Socket a = first.accept(); Socket b = second.accept();
                 BufferedReader inB = new BufferedReader(
                         new InputStreamReader(b.getInputStream(), StandardCharsets.US_ASCII))) {
                m.tick();
                assertEquals("1:1", inB.readLine());
                a.setSoTimeout(200);
                assertThrows(java.net.SocketTimeoutException.class, () -> a.getInputStream().read());
            } finally {
                m.shutdown();
            }
        }
    }

    @Test
    void failedWriteDropsPeerAndIsNotedOnThatSend() throws Exception {
        RecordingSink sink = new RecordingSink();
        try (ServerSocket peerServer = new ServerSocket(0)) {
            int port = peerServer.getLocalPort();
            MachineConfig config = base().peer("127.0.0.1", port).build();
            Machine m = new Machine(config, sink, always(Action.BROADCAST), new Random(1));
            m.start();
            try {
                assertEquals(1, m.activePeers().size());
                Socket accepted = peerServer.accept();
                accepted.setSoLinger(true, 0);
                accepted.close();

                // Early writes may land in the send buffer before the reset is seen
                String expected = "send failed: 127.0.0.1:" + port;
                for (int i = 0; i < 200 && !m.activePeers().isEmpty(); i++) {
                    m.tick();
                    Thread.sleep(5);
                }
                assertTrue(m.activePeers().isEmpty(), "link should be dropped after a failed write");

                List<EventRecord> r = sink.records();
                int failedAt = -1;
                for (int i = 0; i < r.size(); i++) {
                    if (expected.equals(r.get(i).note())) {
                        assertEquals(-1, failedAt, "failure noted more than once");
                        failedAt = i;
                    }
                }
                assertTrue(failedAt > 0, "no record noted the failed send: " + r);
                assertEquals(EventType.BROADCAST, r.get(failedAt).type());

                m.tick();
                m.tick();
                List<EventRecord> after = sink.records().subList(failedAt + 1, sink.records().size());
                assertTrue(after.size() >= 2);
                for (EventRecord e : after) {
                    assertEquals(EventType.BROADCAST, e.type());
                    assertNull(e.note());
                }
                EventRecord last = sink.last();
                assertEquals(r.get(failedAt).logicalClock() + after.size(), last.logicalClock());
            } finally {
                m.shutdown();
            }
        }
    }

    @Test
    void stopRequestCutsPeerDialingShort() throws Exception {
        int deadPort = NetTestUtils.freePort();
        RecordingSink sink = new RecordingSink();
        MachineConfig config = base()
                .peer("127.0.0.1", deadPort)
                .peer("127.0.0.1", deadPort)
                .connectAttempts(1_000)
                .connectDelayMs(1_000)
                .runTime(Duration.ofSeconds(30))
                .build();
        Machine m = new Machine(config, sink, always(Action.INTERNAL), new Random(1));
        Thread loop = new Thread(m::run, "event-loop");
        loop.start();
        Thread.sleep(300);
        assertTrue(sink.records().isEmpty(), "still dialing");

        long stopAt = System.nanoTime();
        m.requestStop();
        loop.join(5_000);

        assertFalse(loop.isAlive());
        assertTrue(System.nanoTime() - stopAt < Duration.ofSeconds(4).toNanos());
        assertTrue(m.activePeers().isEmpty());
        assertEquals(MachineState.TERMINATED, m.state());
        assertEquals(EventType.SHUTDOWN, sink.last().type());
    }

    @Test
    void receiveOrdersAfterTheCausingSend() throws Exception {
        RecordingSink sink = new RecordingSink();
        Machine receiver = new Machine(base().id(2).build(), sink, always(Action.INTERNAL), new Random(1));
        receiver.start();
        try {
            PeerIdentity target = new PeerIdentity("127.0.0.1", receiver.listenPort(), 0);
            try (PeerLink link = PeerLink.connect(target, SimpleRetryExecutor.fixedDelay(1, 0), new MessageCodec())) {
                link.send(41, 9);
            }
            assertTrue(NetTestUtils.await(() -> receiver.inboundQueue().size() == 1, 2_000));

            receiver.tick();

            EventRecord r = sink.last();
            assertEquals(EventType.RECEIVE, r.type());
            assertEquals(42, r.logicalClock());
            assertTrue(r.logicalClock() > 41);
        } finally {
            receiver.shutdown();
        }
    }

    @Test
    void shutdownTwiceRecordsOnce() {
        RecordingSink sink = new RecordingSink();
        Machine m = new Machine(base().build(), sink, always(Action.INTERNAL), new Random(1));
        m.start();
        m.tick();

        m.shutdown();
        m.shutdown();
        m.close();

        assertEquals(1, sink.count(EventType.SHUTDOWN));
        assertEquals(1, sink.last().logicalClock(), "SHUTDOWN reports the clock without advancing it");
        assertEquals(1, sink.closeCount());
        assertEquals(MachineState.TERMINATED, m.state());
    }

    @Test
    void initRecordsChosenTickRate() {
        RecordingSink sink = new RecordingSink();
        MachineConfig config = base().ticksPerSecond(null).maxTicksPerSecond(3).build();
        Machine m = new Machine(config, sink, always(Action.INTERNAL), new Random(5));
        m.start();
        m.shutdown();

        int rate = m.ticksPerSecond();
        assertTrue(rate >= 1 && rate <= 3, "rate " + rate);
        EventRecord init = sink.records().get(0);
        assertEquals(EventType.INIT, init.type());
        assertEquals(0, init.logicalClock());
        assertEquals("ticks=" + rate, init.note());
    }

    @Test
    void occupiedPortIsFatalAtStartup() throws Exception {
        try (ServerSocket taken = new ServerSocket(0)) {
            RecordingSink sink = new RecordingSink();
            Machine m = new Machine(base().port(taken.getLocalPort()).build(), sink,
                    always(Action.INTERNAL), new Random(1));

            assertThrows(MachineStartupException.class, m::start);
            assertEquals(MachineState.TERMINATED, m.state());
            assertTrue(sink.records().isEmpty());
            assertEquals(1, sink.closeCount());
        }
    }

    @Test
    void machineWithoutReachablePeersCompletesItsRun() throws Exception {
        int deadPort = NetTestUtils.freePort();
        RecordingSink sink = new RecordingSink();
        MachineConfig config = base().peer("127.0.0.1", deadPort).runTime(Duration.ofMillis(600)).build();
        Machine m = new Machine(config, sink, () -> Action.values()[new Random().nextInt(4)], new Random(3));

        m.run();

        assertTrue(m.activePeers().isEmpty());
        assertEquals(MachineState.TERMINATED, m.state());
        List<EventRecord> r = sink.records();
        assertEquals(EventType.INIT, r.get(0).type());
        assertEquals(EventType.SHUTDOWN, r.get(r.size() - 1).type());
        assertTrue(r.size() > 3, "expected several ticks, got " + r.size());
        assertEquals(0, sink.count(EventType.RECEIVE));
        for (int i = 1; i < r.size() - 1; i++) {
            assertTrue(r.get(i).type().isLocal());
            assertEquals(r.get(i - 1).logicalClock() + 1, r.get(i).logicalClock());
            assertNull(r.get(i).note());
        }
    }

    @Test
    void ownAddressInPeerListIsSkipped() throws Exception {
        int port = NetTestUtils.freePort();
        RecordingSink sink = new RecordingSink();
        MachineConfig config = base().port(port).peer("127.0.0.1", port).build();
        Machine m = new Machine(config, sink, always(Action.INTERNAL), new Random(1));
        m.start();
        try {
            assertTrue(m.activePeers().isEmpty());
        } finally {
            m.shutdown();
        }
    }

    @Test
    void unexpectedFailureDuringTickIsRecordedAsInternal() {
        RecordingSink sink = new RecordingSink();
        AtomicBoolean thrown = new AtomicBoolean();
        ActionSelector flaky = () -> {
            if (thrown.compareAndSet(false, true)) throw new IllegalStateException("boom");
            return Action.INTERNAL;
        };
        Machine m = new Machine(base().runTime(Duration.ofMillis(300)).build(), sink, flaky, new Random(1));

        m.run();

        List<EventRecord> r = sink.records();
        EventRecord recovered = r.get(1);
        assertEquals(EventType.INTERNAL, recovered.type());
        assertEquals("recovered: boom", recovered.note());
        assertEquals(1, recovered.logicalClock());
        assertEquals(2, r.get(2).logicalClock());
        assertEquals(EventType.SHUTDOWN, r.get(r.size() - 1).type());
    }

    @Test
    void stopRequestEndsRunEarly() throws Exception {
        RecordingSink sink = new RecordingSink();
        Machine m = new Machine(base().runTime(Duration.ofSeconds(30)).build(), sink,
                always(Action.INTERNAL), new Random(1));
        Thread loop = new Thread(m::run, "event-loop");
        long start = System.nanoTime();
        loop.start();
        assertTrue(NetTestUtils.await(() -> sink.count(EventType.INTERNAL) >= 2, 5_000));

        m.requestStop();
        loop.join(5_000);

        assertFalse(loop.isAlive());
        assertTrue(System.nanoTime() - start < Duration.ofSeconds(10).toNanos());
        assertEquals(EventType.SHUTDOWN, sink.last().type());
    }
}
