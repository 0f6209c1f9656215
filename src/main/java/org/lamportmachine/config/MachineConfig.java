package org.lamportmachine.config;

import org.lamportmachine.net.PeerIdentity;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Validated, immutable settings for one machine.
 * <p>
 * Instances are built with {@link #builder()}; {@link Builder#build()} rejects
 * invalid values with {@link IllegalArgumentException}, so a {@code Machine}
 * never sees an inconsistent configuration.
 * </p>
 */
public final class MachineConfig {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final Duration DEFAULT_RUN_TIME = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_TICKS_PER_SECOND = 6;
    public static final double DEFAULT_INTERNAL_PROBABILITY = 0.7;
    public static final int DEFAULT_CONNECT_ATTEMPTS = 5;
    public static final long DEFAULT_CONNECT_DELAY_MS = 1_000L;

    private final int id;
    private final String host;
    private final int port;
    private final List<PeerIdentity> peers;
    private final Duration runTime;
    private final Integer ticksPerSecond;
    private final int maxTicksPerSecond;
    private final double internalProbability;
    private final int connectAttempts;
    private final long connectDelayMs;
    private final long connectMaxDelayMs;
    private final long connectJitterMs;
    private final Path logDir;
    private final Long randomSeed;

    private MachineConfig(Builder b) {
        this.id = b.id;
        this.host = b.host;
        this.port = b.port;
        this.peers = Collections.unmodifiableList(new ArrayList<>(b.peers));
        this.runTime = b.runTime;
        this.ticksPerSecond = b.ticksPerSecond;
        this.maxTicksPerSecond = b.maxTicksPerSecond;
        this.internalProbability = b.internalProbability;
        this.connectAttempts = b.connectAttempts;
        this.connectDelayMs = b.connectDelayMs;
        this.connectMaxDelayMs = b.connectMaxDelayMs != null ? b.connectMaxDelayMs : b.connectDelayMs;
        this.connectJitterMs = b.connectJitterMs;
        this.logDir = b.logDir;
        this.randomSeed = b.randomSeed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int id() { return id; }

    public String host() { return host; }

    /** Listening port; 0 binds an ephemeral port. */
    public int port() { return port; }

    public List<PeerIdentity> peers() { return peers; }

    public Duration runTime() { return runTime; }

    /** Fixed tick rate, or {@code null} to draw one from {@code 1..maxTicksPerSecond}. */
    public Integer ticksPerSecond() { return ticksPerSecond; }

    public int maxTicksPerSecond() { return maxTicksPerSecond; }

    /** Probability that an idle tick is an internal step rather than a send. */
    public double internalProbability() { return internalProbability; }

    public int connectAttempts() { return connectAttempts; }

    /** Delay before the first redial; later delays double up to {@link #connectMaxDelayMs()}. */
    public long connectDelayMs() { return connectDelayMs; }

    /** Cap of the doubling redial delay; equal to {@link #connectDelayMs()} unless set. */
    public long connectMaxDelayMs() { return connectMaxDelayMs; }

    public long connectJitterMs() { return connectJitterMs; }

    public Path logDir() { return logDir; }

    /** Seed for the machine's random source, or {@code null} for a nondeterministic one. */
    public Long randomSeed() { return randomSeed; }

    @Override
    public String toString() {
        return "MachineConfig{id=" + id + ", listen=" + host + ":" + port + ", peers=" + peers
                + ", runTime=" + runTime + ", ticksPerSecond=" + ticksPerSecond
                + ", maxTicksPerSecond=" + maxTicksPerSecond
                + ", internalProbability=" + internalProbability + '}';
    }

    public static final class Builder {
        private int id;
        private String host = DEFAULT_HOST;
        private int port = -1;
        private final List<PeerIdentity> peers = new ArrayList<>();
        private Duration runTime = DEFAULT_RUN_TIME;
        private Integer ticksPerSecond;
        private int maxTicksPerSecond = DEFAULT_MAX_TICKS_PER_SECOND;
        private double internalProbability = DEFAULT_INTERNAL_PROBABILITY;
        private int connectAttempts = DEFAULT_CONNECT_ATTEMPTS;
        private long connectDelayMs = DEFAULT_CONNECT_DELAY_MS;
        private Long connectMaxDelayMs;
        private long connectJitterMs;
        private Path logDir = Path.of(".");
        private Long randomSeed;

        private Builder() {}

        public Builder id(int id) { this.id = id; return this; }

        public Builder host(String host) { this.host = host; return this; }

        public Builder port(int port) { this.port = port; return this; }

        /** Appends a peer; its ordinal is its position in the list. */
        public Builder peer(String host, int port) {
            peers.add(new PeerIdentity(host, port, peers.size()));
            return this;
        }

        /** Appends every {@code host:port} entry of a comma-separated list. */
        public Builder peers(String hostPortList) {
            for (String entry : parsePeerList(hostPortList)) {
                int colon = entry.lastIndexOf(':');
                peer(entry.substring(0, colon), parsePort(entry.substring(colon + 1), entry));
            }
            return this;
        }

        public Builder runTime(Duration runTime) { this.runTime = runTime; return this; }

        public Builder ticksPerSecond(Integer ticksPerSecond) { this.ticksPerSecond = ticksPerSecond; return this; }

        public Builder maxTicksPerSecond(int max) { this.maxTicksPerSecond = max; return this; }

        public Builder internalProbability(double p) { this.internalProbability = p; return this; }

        public Builder connectAttempts(int attempts) { this.connectAttempts = attempts; return this; }

        public Builder connectDelayMs(long delayMs) { this.connectDelayMs = delayMs; return this; }

        public Builder connectMaxDelayMs(Long maxDelayMs) { this.connectMaxDelayMs = maxDelayMs; return this; }

        public Builder connectJitterMs(long jitterMs) { this.connectJitterMs = jitterMs; return this; }

        public Builder logDir(Path logDir) { this.logDir = logDir; return this; }

        public Builder randomSeed(Long seed) { this.randomSeed = seed; return this; }

        public MachineConfig build() {
            if (id < 1) {
                throw new IllegalArgumentException("machine id must be >= 1: " + id);
            }
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("bind host is required");
            }
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("bind port out of range: " + port);
            }
            Objects.requireNonNull(runTime, "runTime");
            if (runTime.isNegative() || runTime.isZero()) {
                throw new IllegalArgumentException("run time must be positive: " + runTime);
            }
            if (maxTicksPerSecond < 1) {
                throw new IllegalArgumentException("max ticks per second must be >= 1: " + maxTicksPerSecond);
            }
            if (ticksPerSecond != null && ticksPerSecond < 1) {
                throw new IllegalArgumentException("ticks per second must be >= 1: " + ticksPerSecond);
            }
            if (Double.isNaN(internalProbability) || internalProbability < 0.0 || internalProbability > 1.0) {
                throw new IllegalArgumentException("internal probability must be in [0,1]: " + internalProbability);
            }
            if (connectAttempts < 1) {
                throw new IllegalArgumentException("connect attempts must be >= 1: " + connectAttempts);
            }
            if (connectDelayMs < 0) {
                throw new IllegalArgumentException("connect delay must be >= 0: " + connectDelayMs);
            }
            if (connectMaxDelayMs != null && connectMaxDelayMs < connectDelayMs) {
                throw new IllegalArgumentException("connect max delay " + connectMaxDelayMs
                        + " is below the connect delay " + connectDelayMs);
            }
            if (connectJitterMs < 0) {
                throw new IllegalArgumentException("connect jitter must be >= 0: " + connectJitterMs);
            }
            Objects.requireNonNull(logDir, "logDir");
            return new MachineConfig(this);
        }

        private static List<String> parsePeerList(String list) {
            List<String> out = new ArrayList<>();
            if (list == null) return out;
            for (String raw : list.split(",")) {
                String entry = raw.trim();
                if (entry.isEmpty()) continue;
                int colon = entry.lastIndexOf(':');
                if (colon <= 0 || colon == entry.length() - 1) {
                    throw new IllegalArgumentException("peer must be host:port, got '" + entry + "'");
                }
                out.add(entry);
            }
            return out;
        }

        private static int parsePort(String s, String entry) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid port in peer '" + entry + "'", e);
            }
        }
    }
}
