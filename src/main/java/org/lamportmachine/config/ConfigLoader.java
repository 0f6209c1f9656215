package org.lamportmachine.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link MachineConfig} from a JSON file and/or {@code --key=value} arguments.
 * <p>
 * Recognized arguments: {@code --id --host --port --peers --run_time --ticks
 * --max_ticks --internal_prob --connect_attempts --connect_delay_ms
 * --connect_max_delay_ms --connect_jitter_ms --log_dir --seed --config}. When {@code --config=<file>} is given the file is read first
 * and the remaining arguments override it.
 * </p>
 */
public final class ConfigLoader {

    private static final Gson gson = new GsonBuilder().create();

    /** JSON shape of a configuration file; absent fields keep their defaults. */
    static final class JsonConfig {
        Integer id;
        String host;
        Integer port;
        List<String> peers;
        Double runTimeSeconds;
        Integer ticksPerSecond;
        Integer maxTicksPerSecond;
        Double internalProbability;
        Integer connectAttempts;
        Long connectDelayMs;
        Long connectMaxDelayMs;
        Long connectJitterMs;
        String logDir;
        Long seed;
    }

    private ConfigLoader() {}

    /**
     * Reads a JSON configuration file.
     *
     * @throws IOException if the file cannot be read or is not valid JSON
     */
    public static MachineConfig fromJson(Path file) throws IOException {
        MachineConfig.Builder b = MachineConfig.builder();
        apply(readJson(file), b);
        return b.build();
    }

    /**
     * Parses command-line arguments, merging in {@code --config} if present.
     *
     * @throws IOException              if the referenced config file cannot be read
     * @throws IllegalArgumentException on unknown options or invalid values
     */
    public static MachineConfig fromArgs(String[] args) throws IOException {
        Map<String, String> opts = parseOptions(args);
        MachineConfig.Builder b = MachineConfig.builder();

        String configFile = opts.remove("config");
        if (configFile != null) {
            apply(readJson(Path.of(configFile)), b);
        }

        for (Map.Entry<String, String> e : opts.entrySet()) {
            String v = e.getValue();
            switch (e.getKey()) {
                case "id" -> b.id(parseInt(e.getKey(), v));
                case "host" -> b.host(v);
                case "port" -> b.port(parseInt(e.getKey(), v));
                case "peers" -> b.peers(v);
                case "run_time" -> b.runTime(seconds(parseDouble(e.getKey(), v)));
                case "ticks" -> b.ticksPerSecond(parseInt(e.getKey(), v));
                case "max_ticks" -> b.maxTicksPerSecond(parseInt(e.getKey(), v));
                case "internal_prob" -> b.internalProbability(parseDouble(e.getKey(), v));
                case "connect_attempts" -> b.connectAttempts(parseInt(e.getKey(), v));
                case "connect_delay_ms" -> b.connectDelayMs(parseLong(e.getKey(), v));
                case "connect_max_delay_ms" -> b.connectMaxDelayMs(parseLong(e.getKey(), v));
                case "connect_jitter_ms" -> b.connectJitterMs(parseLong(e.getKey(), v));
                case "log_dir" -> b.logDir(Path.of(v));
                case "seed" -> b.randomSeed(parseLong(e.getKey(), v));
                default -> throw new IllegalArgumentException("unknown option --" + e.getKey());
            }
        }
        return b.build();
    }

    static Map<String, String> parseOptions(String[] args) {
        Map<String, String> opts = new LinkedHashMap<>();
        for (String arg : args) {
            if (!arg.startsWith("--") || arg.indexOf('=') < 3) {
                throw new IllegalArgumentException("expected --key=value, got '" + arg + "'");
            }
            int eq = arg.indexOf('=');
            opts.put(arg.substring(2, eq), arg.substring(eq + 1));
        }
        return opts;
    }

    private static JsonConfig readJson(Path file) throws IOException {
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JsonConfig json = gson.fromJson(r, JsonConfig.class);
            if (json == null) {
                throw new IOException("empty configuration file: " + file);
            }
            return json;
        } catch (JsonParseException e) {
            throw new IOException("invalid configuration file " + file + ": " + e.getMessage(), e);
        }
    }

    private static void apply(JsonConfig j, MachineConfig.Builder b) {
        if (j.id != null) b.id(j.id);
        if (j.host != null) b.host(j.host);
        if (j.port != null) b.port(j.port);
        if (j.peers != null) b.peers(String.join(",", j.peers));
        if (j.runTimeSeconds != null) b.runTime(seconds(j.runTimeSeconds));
        if (j.ticksPerSecond != null) b.ticksPerSecond(j.ticksPerSecond);
        if (j.maxTicksPerSecond != null) b.maxTicksPerSecond(j.maxTicksPerSecond);
        if (j.internalProbability != null) b.internalProbability(j.internalProbability);
        if (j.connectAttempts != null) b.connectAttempts(j.connectAttempts);
        if (j.connectDelayMs != null) b.connectDelayMs(j.connectDelayMs);
        if (j.connectMaxDelayMs != null) b.connectMaxDelayMs(j.connectMaxDelayMs);
        if (j.connectJitterMs != null) b.connectJitterMs(j.connectJitterMs);
        if (j.logDir != null) b.logDir(Path.of(j.logDir));
        if (j.seed != null) b.randomSeed(j.seed);
    }

    private static Duration seconds(double s) {
        return Duration.ofMillis(Math.round(s * 1000.0));
    }

    private static int parseInt(String key, String v) {
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + key + " expects an integer, got '" + v + "'", e);
        }
    }

    private static long parseLong(String key, String v) {
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + key + " expects an integer, got '" + v + "'", e);
        }
    }

    private static double parseDouble(String key, String v) {
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + key + " expects a number, got '" + v + "'", e);
        }
    }
}
