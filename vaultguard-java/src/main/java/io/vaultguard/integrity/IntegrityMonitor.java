package io.vaultguard.integrity;

import io.vaultguard.crypto.CryptoProvider;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic integrity verification of the resources in an {@link IntegrityRegistry}.
 *
 * <p>Each tick hashes every registered resource present under the monitored root and compares it
 * with the expected hash. Resources missing from disk are skipped. A tick with violations moves the
 * status to {@link IntegrityStatus#COMPROMISED}, sets the threat level to the highest severity
 * found and hands the batch to the {@link ViolationResponder}. A clean tick moves it to
 * {@link IntegrityStatus#SECURE} with threat level {@link ThreatLevel#NONE}. A tick that fails moves
 * it to {@link IntegrityStatus#OFFLINE} and the next tick waits for the backoff interval.
 *
 * <p>Ticks are single-flight: the next one is scheduled only after the current one returns.
 *
 * <p>With {@link MonitorOptions#latchCompromise} set, a compromise persists across clean ticks
 * until {@link #acknowledgeCompromise()} is called; the threat level is still recomputed per tick.
 */
public class IntegrityMonitor {

    private static final Logger logger = Logger.getLogger(IntegrityMonitor.class.getName());

    private final IntegrityRegistry registry;
    private final SeverityTable severityTable;
    private final CryptoProvider crypto;
    private final ViolationResponder responder;
    private final MonitorOptions options;
    private final Path monitoredRoot;

    private final Object lifecycleLock = new Object();
    private final Object stateLock = new Object();
    private final ReentrantLock tickLock = new ReentrantLock();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final ExecutorService hashExecutor;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> nextTick;
    private volatile Duration nextDelay;
    private volatile boolean accelerated;

    private volatile MonitorState state = MonitorState.initial();

    private final AtomicLong totalTicks = new AtomicLong();
    private final AtomicLong failedTicks = new AtomicLong();
    private final AtomicLong totalViolations = new AtomicLong();

    private Consumer<StatusChangeEvent> onStatusChange;
    private Consumer<ThreatLevelChangeEvent> onThreatLevelChange;
    private Consumer<ViolationEvent> onViolations;
    private Consumer<Exception> onError;

    public IntegrityMonitor(IntegrityRegistry registry, SeverityTable severityTable,
                            CryptoProvider crypto, ViolationResponder responder, MonitorOptions options) {
        this.registry = registry;
        this.severityTable = severityTable;
        this.crypto = crypto;
        this.responder = responder;
        this.options = options;
        this.monitoredRoot = options.monitoredRoot;
        this.hashExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "integrity-hash");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Load the baseline file, if configured, enter {@link IntegrityStatus#MONITORING} and start
     * the periodic task. Calling this on a running monitor does nothing.
     * @throws IOException if the configured baseline file cannot be loaded
     * @throws IllegalStateException if the monitor has been shut down
     */
    public void initialize() throws IOException {
        synchronized (lifecycleLock) {
            if (cancelled.get()) {
                throw new IllegalStateException("Monitor has been shut down");
            }
            if (scheduler != null) {
                return;
            }
            logger.info("Initializing integrity monitoring of " + monitoredRoot);

            if (options.baselineFile != null && Files.exists(options.baselineFile)) {
                registry.loadBaseline(options.baselineFile);
            }
            logger.fine("Monitoring " + registry.size() + " resources");

            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "integrity-monitor");
                t.setDaemon(true);
                return t;
            });
            updateState(IntegrityStatus.MONITORING, ThreatLevel.NONE, List.of(), state.compromiseLatched());
            scheduleNext(options.initialDelay);
        }
        logger.info("Integrity monitoring active");
    }

    /**
     * Stop the periodic task and move to {@link IntegrityStatus#OFFLINE}. Idempotent.
     * A tick already in progress is interrupted and its result discarded.
     */
    public void shutdown() {
        synchronized (lifecycleLock) {
            if (cancelled.getAndSet(true)) {
                return;
            }
            logger.info("Shutting down integrity monitoring");
            if (nextTick != null) {
                nextTick.cancel(false);
            }
            if (scheduler != null) {
                scheduler.shutdownNow();
            }
            hashExecutor.shutdownNow();
        }
        MonitorState old;
        MonitorState updated;
        synchronized (stateLock) {
            old = state;
            updated = new MonitorState(IntegrityStatus.OFFLINE, old.threatLevel(), old.lastTick(),
                old.lastViolations(), old.compromiseLatched());
            state = updated;
        }
        fireChanges(old, updated);
    }

    /**
     * Run one tick on the calling thread. Waits if a scheduled tick is in progress.
     * @return What the tick observed and when the next scheduled tick will run
     */
    public TickOutcome checkNow() {
        tickLock.lock();
        try {
            return runTick();
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * Release a latched compromise. If the last tick was clean the status becomes SECURE now,
     * otherwise the next clean tick decides.
     * @return true if a latch was released
     */
    public boolean acknowledgeCompromise() {
        MonitorState old;
        MonitorState updated;
        synchronized (stateLock) {
            old = state;
            if (!old.compromiseLatched()) {
                return false;
            }
            IntegrityStatus status = old.status();
            if (status == IntegrityStatus.COMPROMISED && old.lastViolations().isEmpty()) {
                status = IntegrityStatus.SECURE;
            }
            updated = new MonitorState(status, old.threatLevel(), old.lastTick(), old.lastViolations(), false);
            state = updated;
        }
        logger.info("Compromise acknowledged");
        fireChanges(old, updated);
        return true;
    }

    /**
     * Check at the accelerated interval until the next clean tick.
     */
    public void accelerate() {
        if (!accelerated) {
            accelerated = true;
            logger.info("Integrity checks accelerated to every " + options.acceleratedInterval);
        }
    }

    public void restoreInterval() {
        accelerated = false;
    }

    public boolean isAccelerated() {
        return accelerated;
    }

    public Duration currentInterval() {
        return accelerated ? options.acceleratedInterval : options.checkInterval;
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return scheduler != null && !cancelled.get();
        }
    }

    public MonitorState getState() {
        return state;
    }

    public IntegrityStatus getStatus() {
        return state.status();
    }

    public ThreatLevel getThreatLevel() {
        return state.threatLevel();
    }

    /**
     * @return Delay used for the most recently scheduled tick, or null if none has been scheduled
     */
    public Duration getNextDelay() {
        return nextDelay;
    }

    public IntegrityRegistry getRegistry() {
        return registry;
    }

    public MonitorOptions getOptions() {
        return options;
    }

    public MonitorStats stats() {
        return new MonitorStats(totalTicks.get(), failedTicks.get(), totalViolations.get());
    }

    public void setOnStatusChange(Consumer<StatusChangeEvent> listener) { this.onStatusChange = listener; }
    public void setOnThreatLevelChange(Consumer<ThreatLevelChangeEvent> listener) { this.onThreatLevelChange = listener; }
    public void setOnViolations(Consumer<ViolationEvent> listener) { this.onViolations = listener; }
    public void setOnError(Consumer<Exception> listener) { this.onError = listener; }

    // ==================== Tick ====================

    private void scheduledTick() {
        if (cancelled.get()) {
            return;
        }
        Duration delay;
        try {
            delay = checkNow().nextDelay();
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected failure in integrity tick", e);
            delay = options.backoffInterval;
        }
        scheduleNext(delay);
    }

    private void scheduleNext(Duration delay) {
        synchronized (lifecycleLock) {
            if (cancelled.get() || scheduler == null) {
                return;
            }
            nextDelay = delay;
            nextTick = scheduler.schedule(this::scheduledTick, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private TickOutcome runTick() {
        if (cancelled.get()) {
            return new TickOutcome(IntegrityStatus.OFFLINE, state.threatLevel(), List.of(),
                options.backoffInterval, null);
        }
        totalTicks.incrementAndGet();
        List<IntegrityRecord> violations;
        try {
            violations = scan();
        } catch (IOException | InterruptedException | RuntimeException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            failedTicks.incrementAndGet();
            logger.log(Level.SEVERE, "Error during integrity check", e);
            MonitorState current = state;
            updateState(IntegrityStatus.OFFLINE, current.threatLevel(), List.of(), current.compromiseLatched());
            emit(onError, e, "error");
            return new TickOutcome(IntegrityStatus.OFFLINE, current.threatLevel(), List.of(),
                options.backoffInterval, e);
        }

        if (violations.isEmpty()) {
            MonitorState current = state;
            IntegrityStatus status = current.compromiseLatched()
                ? IntegrityStatus.COMPROMISED
                : IntegrityStatus.SECURE;
            updateState(status, ThreatLevel.NONE, List.of(), current.compromiseLatched());
            restoreInterval();
            return new TickOutcome(status, ThreatLevel.NONE, List.of(), currentInterval(), null);
        }

        ThreatLevel level = ThreatLevel.NONE;
        for (IntegrityRecord record : violations) {
            level = ThreatLevel.max(level, record.severity());
        }
        totalViolations.addAndGet(violations.size());
        updateState(IntegrityStatus.COMPROMISED, level, violations, options.latchCompromise);

        if (cancelled.get()) {
            return new TickOutcome(IntegrityStatus.OFFLINE, level, violations, options.backoffInterval, null);
        }
        emit(onViolations, new ViolationEvent(level, violations), "violation");
        try {
            responder.handle(level, violations);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Violation responder failed for " + level + " threat", e);
        }
        return new TickOutcome(IntegrityStatus.COMPROMISED, level, violations, currentInterval(), null);
    }

    private List<IntegrityRecord> scan() throws IOException, InterruptedException {
        List<IntegrityRecord> violations = new ArrayList<>();
        for (Map.Entry<String, String> entry : registry.snapshot().entrySet()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Integrity check interrupted");
            }
            String resource = entry.getKey();
            Path file = monitoredRoot.resolve(resource);
            if (!Files.exists(file)) {
                continue;
            }
            String actual = hashWithTimeout(file);
            if (!actual.equals(entry.getValue())) {
                IntegrityRecord record = new IntegrityRecord(
                    resource,
                    entry.getValue(),
                    actual,
                    System.currentTimeMillis(),
                    severityTable.severityOf(resource)
                );
                violations.add(record);
                logger.warning("INTEGRITY VIOLATION: " + resource
                    + " expected " + record.expectedHash() + ", got " + actual);
            }
        }
        return violations;
    }

    private String hashWithTimeout(Path file) throws IOException, InterruptedException {
        Future<String> future = hashExecutor.submit(() -> {
            try (InputStream in = Files.newInputStream(file)) {
                return crypto.hash(in);
            }
        });
        try {
            return future.get(options.hashTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new IOException("Hashing " + file + " timed out after " + options.hashTimeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IOException("Hashing " + file + " failed", cause);
        }
    }

    // ==================== State ====================

    private void updateState(IntegrityStatus status, ThreatLevel level, List<IntegrityRecord> violations,
                             boolean latched) {
        MonitorState old;
        MonitorState updated;
        synchronized (stateLock) {
            if (cancelled.get() && status != IntegrityStatus.OFFLINE) {
                return;
            }
            old = state;
            updated = new MonitorState(status, level, Instant.now(), List.copyOf(violations), latched);
            state = updated;
        }
        fireChanges(old, updated);
    }

    private void fireChanges(MonitorState old, MonitorState updated) {
        if (old.status() != updated.status()) {
            logger.info("Integrity status " + old.status() + " -> " + updated.status());
            emit(onStatusChange, new StatusChangeEvent(old.status(), updated.status(), Instant.now()), "status change");
        }
        if (old.threatLevel() != updated.threatLevel()) {
            emit(onThreatLevelChange,
                new ThreatLevelChangeEvent(old.threatLevel(), updated.threatLevel(), Instant.now()), "threat level");
        }
    }

    private static <T> void emit(Consumer<T> listener, T event, String kind) {
        if (listener == null) {
            return;
        }
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Integrity " + kind + " listener failed", e);
        }
    }

    public static class MonitorOptions {
        public final Path monitoredRoot;
        public final Duration checkInterval;
        public final Duration backoffInterval;
        public final Duration acceleratedInterval;
        public final Duration initialDelay;
        public final Duration hashTimeout;
        public final Path baselineFile;
        public final boolean latchCompromise;
        public final boolean quarantineOnLockdown;

        private MonitorOptions(Builder builder) {
            this.monitoredRoot = builder.monitoredRoot;
            this.checkInterval = builder.checkInterval;
            this.backoffInterval = builder.backoffInterval != null
                ? builder.backoffInterval
                : builder.checkInterval.multipliedBy(2);
            this.acceleratedInterval = builder.acceleratedInterval;
            this.initialDelay = builder.initialDelay;
            this.hashTimeout = builder.hashTimeout;
            this.baselineFile = builder.baselineFile;
            this.latchCompromise = builder.latchCompromise;
            this.quarantineOnLockdown = builder.quarantineOnLockdown;
        }

        public static MonitorOptions defaults() {
            return builder().build();
        }

        public static MonitorOptions forRoot(Path monitoredRoot) {
            return builder().monitoredRoot(monitoredRoot).build();
        }

        public static Builder builder() {
            return new Builder();
        }

        public static class Builder {
            private Path monitoredRoot = Path.of(System.getProperty("user.home"), ".vaultguard", "protected");
            private Duration checkInterval = Duration.ofSeconds(5);
            private Duration backoffInterval;
            private Duration acceleratedInterval = Duration.ofSeconds(1);
            private Duration initialDelay = Duration.ZERO;
            private Duration hashTimeout = Duration.ofSeconds(30);
            private Path baselineFile;
            private boolean latchCompromise = true;
            private boolean quarantineOnLockdown = true;

            public Builder monitoredRoot(Path root) { this.monitoredRoot = root; return this; }
            public Builder checkInterval(Duration interval) { this.checkInterval = interval; return this; }
            public Builder backoffInterval(Duration interval) { this.backoffInterval = interval; return this; }
            public Builder acceleratedInterval(Duration interval) { this.acceleratedInterval = interval; return this; }
            public Builder initialDelay(Duration delay) { this.initialDelay = delay; return this; }
            public Builder hashTimeout(Duration timeout) { this.hashTimeout = timeout; return this; }
            public Builder baselineFile(Path file) { this.baselineFile = file; return this; }
            public Builder latchCompromise(boolean latch) { this.latchCompromise = latch; return this; }
            public Builder quarantineOnLockdown(boolean quarantine) { this.quarantineOnLockdown = quarantine; return this; }

            public MonitorOptions build() {
                if (checkInterval.isNegative() || checkInterval.isZero()) {
                    throw new IllegalArgumentException("checkInterval must be positive");
                }
                return new MonitorOptions(this);
            }
        }
    }

    public record MonitorState(
        IntegrityStatus status,
        ThreatLevel threatLevel,
        Instant lastTick,
        List<IntegrityRecord> lastViolations,
        boolean compromiseLatched
    ) {
        static MonitorState initial() {
            return new MonitorState(IntegrityStatus.OFFLINE, ThreatLevel.NONE, null, List.of(), false);
        }
    }

    /**
     * @param status Status after the tick
     * @param threatLevel Threat level after the tick
     * @param violations Violations found, empty on a clean or failed tick
     * @param nextDelay Delay before the following scheduled tick
     * @param error Failure that ended the tick, or null
     */
    public record TickOutcome(
        IntegrityStatus status,
        ThreatLevel threatLevel,
        List<IntegrityRecord> violations,
        Duration nextDelay,
        Exception error
    ) {
        public boolean failed() {
            return error != null;
        }
    }

    public record MonitorStats(long totalTicks, long failedTicks, long totalViolations) {}

    public record StatusChangeEvent(IntegrityStatus from, IntegrityStatus to, Instant at) {}
    public record ThreatLevelChangeEvent(ThreatLevel from, ThreatLevel to, Instant at) {}
    public record ViolationEvent(ThreatLevel maxSeverity, List<IntegrityRecord> records) {}
}
