package org.lamportmachine.machine;

import org.lamportmachine.config.MachineConfig;
import org.lamportmachine.interfaces.ActionSelector;
import org.lamportmachine.interfaces.EventSink;
import org.lamportmachine.interfaces.InboundQueue;
import org.lamportmachine.interfaces.LamportClock;
import org.lamportmachine.interfaces.RetryExecutor;
import org.lamportmachine.log.EventRecord;
import org.lamportmachine.log.EventType;
import org.lamportmachine.log.FileEventLog;
import org.lamportmachine.net.Listener;
import org.lamportmachine.net.PeerIdentity;
import org.lamportmachine.net.PeerLink;
import org.lamportmachine.util.ConfinedLamportClock;
import org.lamportmachine.util.LinkedInboundQueue;
import org.lamportmachine.util.SimpleRetryExecutor;
import org.lamportmachine.util.WeightedActionSelector;
import org.lamportmachine.wire.MessageCodec;
import org.lamportmachine.wire.WireMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * One node of the cluster: owns the Lamport clock, the inbound queue, the outbound
 * peer links, and the event loop that drives them.
 * <p>
 * <b>Threading:</b>
 * <ul>
 *   <li>The thread calling {@link #run()} is the event loop and the only writer of
 *       the clock, the peer link map, and the event sink.</li>
 *   <li>The listener's accept loop and one receive loop per inbound socket run on
 *       their own threads; they reach the event loop only through the inbound queue.</li>
 *   <li>{@link #requestStop()} may be called from any thread and is observed at the
 *       next tick boundary.</li>
 * </ul>
 */
public final class Machine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Machine.class);

    private final MachineConfig config;
    private final LamportClock clock = new ConfinedLamportClock();
    private final InboundQueue inbound = new LinkedInboundQueue();
    private final MessageCodec codec = new MessageCodec();
    private final EventSink events;
    private final ActionSelector selector;
    private final Random random;
    private final RetryExecutor connectPolicy;
    private final int ticksPerSecond;

    // Insertion order follows the configured peer list
    private final Map<PeerIdentity, PeerLink> links = new LinkedHashMap<>();

    private Listener listener;
    private volatile MachineState state = MachineState.INITIALIZING;
    private volatile boolean stopRequested;

    /**
     * @param config   validated settings
     * @param events   destination of event records; closed on shutdown
     * @param selector chooses the local action on idle ticks
     * @param random   source for the tick rate and the SEND(1) target
     */
    public Machine(MachineConfig config, EventSink events, ActionSelector selector, Random random) {
        this.config = config;
        this.events = events;
        this.selector = selector;
        this.random = random;
        this.connectPolicy = new SimpleRetryExecutor(config.connectAttempts(), config.connectDelayMs(),
                config.connectMaxDelayMs(), config.connectJitterMs());
        this.ticksPerSecond = config.ticksPerSecond() != null
                ? config.ticksPerSecond()
                : 1 + random.nextInt(config.maxTicksPerSecond());
    }

    /**
     * Creates a machine that logs to {@code machine_<id>.log} in the configured directory.
     *
     * @throws IOException if the log file cannot be opened
     */
    public static Machine create(MachineConfig config) throws IOException {
        Random random = config.randomSeed() != null ? new Random(config.randomSeed()) : new Random();
        ActionSelector selector = WeightedActionSelector.withInternalProbability(config.internalProbability(), random);
        return new Machine(config, FileEventLog.forMachine(config.logDir(), config.id()), selector, random);
    }

    /* ============================== lifecycle ============================== */

    /**
     * Binds the listener, starts accepting, dials every peer and records INIT.
     *
     * @throws MachineStartupException if the listening socket cannot be bound
     * @throws IllegalStateException   if called more than once
     */
    public synchronized void start() {
        if (state != MachineState.INITIALIZING) {
            throw new IllegalStateException("machine " + config.id() + " already " + state);
        }
        try {
            listener = Listener.bind(config.host(), config.port(), inbound, codec, "m" + config.id());
        } catch (IOException e) {
            state = MachineState.TERMINATED;
            closeEvents();
            throw new MachineStartupException("machine " + config.id() + " cannot listen on "
                    + config.host() + ":" + config.port() + ": " + e.getMessage(), e);
        }
        listener.start();
        connectPeers();

        state = MachineState.RUNNING;
        emit(EventRecord.of(EventType.INIT, clock.get(), "ticks=" + ticksPerSecond));
        log.info("Machine {} running at {} ticks/s with {} of {} peers connected",
                config.id(), ticksPerSecond, links.size(), config.peers().size());
    }

    private void connectPeers() {
        for (PeerIdentity peer : config.peers()) {
            if (stopRequested) {
                log.info("Machine {}: stop requested, not dialing remaining peers", config.id());
                return;
            }
            if (peer.sameAddress(config.host(), listener.localPort())) {
                log.debug("Skipping own address {}", peer);
                continue;
            }
            try {
                links.put(peer, PeerLink.connect(peer, connectPolicy, codec, () -> stopRequested));
            } catch (IOException e) {
                log.warn("Peer {} unreachable after {} attempts, excluded for this run: {}",
                        peer, connectPolicy.maxAttempts(), e.getMessage());
            }
        }
    }

    /**
     * Runs the event loop until the configured run time elapses or a stop is
     * requested, then shuts down. Starts the machine first if needed.
     */
    public void run() {
        if (state == MachineState.INITIALIZING) {
            start();
        }
        if (state != MachineState.RUNNING) {
            throw new IllegalStateException("machine " + config.id() + " is " + state);
        }
        long periodNanos = TimeUnit.SECONDS.toNanos(1) / ticksPerSecond;
        long runNanos = config.runTime().toNanos();
        long startedAt = System.nanoTime();

        while (!stopRequested && System.nanoTime() - startedAt < runNanos) {
            long tickStart = System.nanoTime();
            long before = clock.get();
            try {
                tick();
            } catch (RuntimeException e) {
                recoverTick(before, e);
            }

            long remaining = periodNanos - (System.nanoTime() - tickStart);
            if (remaining > 0) {
                try {
                    TimeUnit.NANOSECONDS.sleep(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.info("Machine {} interrupted, stopping", config.id());
                    stopRequested = true;
                }
            }
        }
        shutdown();
    }

    /**
     * Executes one iteration of the event loop, without the rate-holding sleep.
     * A waiting message always takes priority over local activity.
     */
    public void tick() {
        WireMessage message = inbound.poll();
        if (message != null) {
            long c = clock.tickReceive(message.timestamp());
            emit(EventRecord.receive(c, inbound.size()));
            return;
        }

        Action action = selector.next();
        long c = clock.tickLocal();
        List<PeerIdentity> failed = new ArrayList<>();
        for (PeerLink link : targets(action)) {
            send(link, c, failed);
        }
        String note = failed.isEmpty() ? null : "send failed: " + joinAddresses(failed);
        emit(EventRecord.of(action.eventType(), c, note));
    }

    private List<PeerLink> targets(Action action) {
        List<PeerLink> active = new ArrayList<>(links.values());
        if (active.isEmpty()) {
            return Collections.emptyList();
        }
        return switch (action) {
            case SEND_ONE -> List.of(active.get(random.nextInt(active.size())));
            case SEND_OTHER -> List.of(active.get(1 % active.size()));
            case BROADCAST -> active;
            case INTERNAL -> Collections.emptyList();
        };
    }

    private void send(PeerLink link, long timestamp, List<PeerIdentity> failed) {
        try {
            link.send(timestamp, config.id());
        } catch (IOException e) {
            log.warn("Send to {} failed, dropping link: {}", link.peer(), e.getMessage());
            links.remove(link.peer());
            failed.add(link.peer());
        }
    }

    // An unexpected failure counts as an internal step so the run continues
    private void recoverTick(long clockBefore, RuntimeException e) {
        log.error("Machine {}: unexpected failure during tick, recording it as an internal event",
                config.id(), e);
        long c = clock.get() == clockBefore ? clock.tickLocal() : clock.get();
        String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        emit(EventRecord.of(EventType.INTERNAL, c, "recovered: " + msg.replace('\n', ' ').replace('\r', ' ')));
    }

    /**
     * Asks the event loop to stop at the next tick boundary. Safe from any thread.
     * During startup it also cuts peer dialing short.
     */
    public void requestStop() {
        stopRequested = true;
    }

    /**
     * Records SHUTDOWN, closes every peer link, the listener (ending the accept and
     * receive loops), and the event sink. Idempotent.
     */
    public synchronized void shutdown() {
        if (state == MachineState.SHUTTING_DOWN || state == MachineState.TERMINATED) {
            return;
        }
        state = MachineState.SHUTTING_DOWN;
        emit(EventRecord.of(EventType.SHUTDOWN, clock.get(), null));

        for (PeerLink link : links.values()) {
            link.close();
        }
        links.clear();
        if (listener != null) {
            listener.close();
        }
        closeEvents();
        state = MachineState.TERMINATED;
        log.info("Machine {} finished at L={}", config.id(), clock.get());
    }

    @Override
    public void close() {
        shutdown();
    }

    /* =============================== helpers =============================== */

    private void emit(EventRecord r) {
        try {
            events.append(r);
        } catch (IOException e) {
            log.error("Machine {}: failed to write {} record: {}", config.id(), r.type(), e.getMessage());
        }
    }

    private void closeEvents() {
        try {
            events.close();
        } catch (IOException e) {
            log.warn("Machine {}: failed to close event log: {}", config.id(), e.getMessage());
        }
    }

    private static String joinAddresses(List<PeerIdentity> peers) {
        StringBuilder sb = new StringBuilder();
        for (PeerIdentity p : peers) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(p.address());
        }
        return sb.toString();
    }

    /* ============================== accessors ============================== */

    public int id() {
        return config.id();
    }

    public MachineState state() {
        return state;
    }

    public long clockValue() {
        return clock.get();
    }

    public InboundQueue inboundQueue() {
        return inbound;
    }

    public int ticksPerSecond() {
        return ticksPerSecond;
    }

    /** Peers with an open outbound link, in configuration order. */
    public List<PeerIdentity> activePeers() {
        return List.copyOf(links.keySet());
    }

    /** Bound listening port, or -1 before {@link #start()}. */
    public int listenPort() {
        return listener == null ? -1 : listener.localPort();
    }
}
