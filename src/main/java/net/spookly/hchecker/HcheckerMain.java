package net.spookly.hchecker;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

import net.spookly.hchecker.config.ConfigDefaults;
import net.spookly.hchecker.config.ConfigLoader;
import net.spookly.hchecker.config.ConfigPrinter;
import net.spookly.hchecker.config.ConfigWarnings;
import net.spookly.hchecker.config.HcheckerConfig;
import net.spookly.hchecker.event.CheckerAuditLogger;
import net.spookly.hchecker.event.CheckerEvent;
import net.spookly.hchecker.event.CheckerEventListener;
import net.spookly.hchecker.event.CheckerEventType;
import net.spookly.hchecker.eviction.EvictionListener;
import net.spookly.hchecker.eviction.EvictionNotice;
import net.spookly.hchecker.eviction.ReconnectPolicy;
import net.spookly.hchecker.heartbeat.HeartbeatReporter;
import net.spookly.hchecker.store.RedisCheckerStore;
import net.spookly.hchecker.store.RedisConnectionPool;

/**
 * Standalone entry point for a checker process.
 */
public final class HcheckerMain {
    private static final String DEFAULT_CONFIG = "config/hchecker.yaml";

    private HcheckerMain() {
    }

    /**
     * Boot the checker: clear stale lock metadata, then run heartbeats and the eviction listener.
     */
    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        HcheckerConfig config = ConfigLoader.load(options.configPath);
        emitWarnings(config);
        if (options.printEffectiveConfig) {
            System.out.println(ConfigPrinter.toYaml(config));
            return;
        }
        if (options.dryRun) {
            System.out.println("Config OK (--dry-run).");
            return;
        }

        String checkerId = CheckerIdentity.resolve(config);
        CheckerEventListener eventListener = auditEnabled(config) ? CheckerAuditLogger.INSTANCE : CheckerEventListener.NOOP;
        RedisConnectionPool pool = RedisConnectionPool.fromConfig(config);
        pool.verify();
        RedisCheckerStore store = new RedisCheckerStore(pool);
        System.out.println("hchecker started: id=" + checkerId + " store=" + pool.address());

        // Assumes one checker deployment per store: this also wipes other checkers' locks.
        store.clearLocks();

        HeartbeatReporter heartbeat = new HeartbeatReporter(store, Clock.systemUTC(), checkerId, eventListener);
        heartbeat.start(heartbeatInterval(config));

        EvictionListener evictionListener = null;
        if (evictionEnabled(config)) {
            evictionListener = new EvictionListener(store, ReconnectPolicy.fromConfig(config), checkerId, eventListener);
            String channel = config.eviction == null || config.eviction.channel == null
                    ? ConfigDefaults.EVICTION_CHANNEL
                    : config.eviction.channel;
            evictionListener.listen(channel, line -> reportEviction(line, checkerId, eventListener));
        }

        CountDownLatch latch = new CountDownLatch(1);
        EvictionListener finalEvictionListener = evictionListener;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (finalEvictionListener != null) {
                finalEvictionListener.stop();
            }
            heartbeat.stop();
            store.close();
            latch.countDown();
        }));

        try {
            latch.await();
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    private static void reportEviction(String line, String checkerId, CheckerEventListener eventListener) {
        EvictionNotice notice;
        try {
            notice = EvictionNotice.parse(line);
        } catch (IllegalArgumentException e) {
            System.err.println("Ignoring malformed eviction notice: " + e.getMessage());
            return;
        }
        eventListener.onEvent(CheckerEvent.of(CheckerEventType.EVICTION_RECEIVED, checkerId, notice.backendUrl(),
                notice.frontendKey(), notice.backendPosition()).withDetail("backends=" + notice.totalBackends()));
    }

    private static boolean auditEnabled(HcheckerConfig config) {
        return config.observability == null
                || config.observability.logging == null
                || !Boolean.FALSE.equals(config.observability.logging.auditEvents);
    }

    private static boolean evictionEnabled(HcheckerConfig config) {
        return config.eviction == null || !Boolean.FALSE.equals(config.eviction.enabled);
    }

    private static int heartbeatInterval(HcheckerConfig config) {
        Integer configured = config.checker == null ? null : config.checker.heartbeatIntervalSeconds;
        return ConfigDefaults.orDefault(configured, ConfigDefaults.HEARTBEAT_INTERVAL_SECONDS);
    }

    private static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        if (args == null) {
            return new CliOptions(configPath, dryRun, printEffectiveConfig);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = Paths.get(args[++i]);
                    continue;
                }
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
            }
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig);
    }

    private static void emitWarnings(HcheckerConfig config) {
        for (String warning : ConfigWarnings.collect(config)) {
            System.err.println("Config warning: " + warning);
        }
    }

    private record CliOptions(Path configPath, boolean dryRun, boolean printEffectiveConfig) {
    }
}
