package com.trigger.rule;

import com.trigger.config.ClockConfig;
import com.trigger.config.DispatchConfig;
import com.trigger.config.EngineConfig;
import com.trigger.config.RulesConfig;
import com.trigger.exception.RuleParseException;
import com.trigger.exception.TriggerException;
import com.trigger.value.Value;
import com.trigger.variable.ChangeEvent;
import com.trigger.variable.VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Loads rules and runs them whenever a variable changes.
 * <p>
 * Two long-lived threads run once started: the clock, which publishes the current time
 * and date as variables, and the dispatcher, which takes one change event at a time and
 * starts a rule batch for it. A batch runs every rule in load order on its own thread;
 * batches for different events run concurrently. A failing rule is logged and the batch
 * moves on to the next rule.
 * <p>
 * Every change re-runs every rule. Batches are not limited unless
 * {@link DispatchConfig#maxInFlightBatches()} is set, in which case at most that many run
 * at once and the others wait in the pool's queue. The dispatcher itself never waits for a
 * batch, since a running batch may be blocked handing over a change of its own.
 */
public class RuleManager {

    private static final Logger log = LoggerFactory.getLogger(RuleManager.class);

    public static final String TIME_SECOND = "time:second";
    public static final String TIME_MINUTE = "time:minute";
    public static final String TIME_HOUR = "time:hour";
    public static final String DATE_DAY = "date:day";
    public static final String DATE_MONTH = "date:month";
    public static final String DATE_YEAR = "date:year";

    private final List<Rule> rules;
    private final VariableManager variables;
    private final ClockConfig clockConfig;
    private final DispatchConfig dispatchConfig;
    private final Clock timeSource;

    private final ExecutorService batchPool;
    private volatile ScheduledExecutorService clockScheduler;
    private volatile Thread dispatcher;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final AtomicLong eventsDispatched = new AtomicLong(0);
    private final AtomicLong batchesCompleted = new AtomicLong(0);
    private final AtomicLong ruleFailures = new AtomicLong(0);
    private final AtomicInteger activeBatches = new AtomicInteger(0);

    public RuleManager(EngineConfig config, VariableManager variables) {
        this(loadRules(config.rules(), variables), variables, config.clock(), config.dispatch(),
                Clock.systemDefaultZone());
    }

    public RuleManager(List<Rule> rules, VariableManager variables, ClockConfig clockConfig,
                       DispatchConfig dispatchConfig, Clock timeSource) {
        this.rules = List.copyOf(rules);
        this.variables = Objects.requireNonNull(variables, "variables");
        this.clockConfig = Objects.requireNonNull(clockConfig, "clockConfig");
        this.dispatchConfig = Objects.requireNonNull(dispatchConfig, "dispatchConfig");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");

        AtomicInteger batchThreads = new AtomicInteger(0);
        ThreadFactory batchThreadFactory = r -> {
            Thread t = new Thread(r);
            t.setName("rule-batch-" + batchThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.batchPool = dispatchConfig.isBounded()
                ? Executors.newFixedThreadPool(dispatchConfig.maxInFlightBatches(), batchThreadFactory)
                : Executors.newCachedThreadPool(batchThreadFactory);
    }

    /**
     * Load every rule file of a directory, in file name order.
     * Files that cannot be read or parsed are logged and skipped.
     *
     * @param config    Rule directory and file suffix
     * @param variables Variables the rules are bound to
     * @return Loaded rules
     */
    public static List<Rule> loadRules(RulesConfig config, VariableManager variables) {
        Path directory = Paths.get(config.directory());
        List<Rule> loaded = new ArrayList<>();

        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(config.suffix()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.warn("Cannot list rule directory '{}': {}", directory, e.toString());
            files = List.of();
        }

        for (Path file : files) {
            String name = file.getFileName().toString();
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                loaded.add(Rule.load(name, reader, variables));
            } catch (IOException e) {
                log.warn("error opening '{}': {}", name, e.toString());
            } catch (RuleParseException e) {
                log.warn("error parsing '{}': {}", name, e.getMessage());
            }
        }

        log.info("loaded {} rules from {}", loaded.size(), directory);
        return loaded;
    }

    /**
     * Start the dispatcher and, if enabled, the clock.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("RuleManager already started");
        }

        dispatcher = new Thread(this::dispatchLoop, "rule-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();

        if (clockConfig.enabled()) {
            clockScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "rule-clock");
                t.setDaemon(true);
                return t;
            });
            clockScheduler.scheduleAtFixedRate(this::tick,
                    clockConfig.intervalMillis(), clockConfig.intervalMillis(), TimeUnit.MILLISECONDS);
        }

        log.info("RuleManager started with {} rules (clock: {}, batch limit: {})",
                rules.size(),
                clockConfig.enabled() ? clockConfig.intervalMillis() + "ms" : "off",
                dispatchConfig.isBounded() ? dispatchConfig.maxInFlightBatches() : "none");
    }

    /**
     * Run every rule once, in order, on the calling thread.
     *
     * @return Number of rules that failed
     */
    public int runAll() {
        int failures = 0;
        for (Rule rule : rules) {
            try {
                rule.run();
            } catch (RuntimeException e) {
                failures++;
                ruleFailures.incrementAndGet();
                log.warn("error in '{}': {}", rule.getName(), e.getMessage());
            } catch (StackOverflowError e) {
                failures++;
                ruleFailures.incrementAndGet();
                log.warn("error in '{}': stack overflow", rule.getName());
            }
        }
        return failures;
    }

    /**
     * Publish the time and date of {@code now} as variables.
     */
    void publishTime(ZonedDateTime now) {
        publish(TIME_SECOND, now.getSecond());
        publish(TIME_MINUTE, now.getMinute());
        publish(TIME_HOUR, now.getHour());
        publish(DATE_DAY, now.getDayOfMonth());
        publish(DATE_MONTH, now.getMonthValue());
        publish(DATE_YEAR, now.getYear());
    }

    private void tick() {
        if (shutdown.get()) {
            return;
        }
        publishTime(ZonedDateTime.now(timeSource));
    }

    private void publish(String name, long value) {
        try {
            variables.set(name, Value.of(value));
        } catch (TriggerException e) {
            log.warn("Failed to publish '{}': {}", name, e.getMessage());
        }
    }

    private void dispatchLoop() {
        while (!shutdown.get()) {
            try {
                ChangeEvent event = variables.takeChange();
                eventsDispatched.incrementAndGet();
                log.debug("Dispatching rule batch for '{}' = {}", event.name(), event.value());
                submitBatch(event);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("Rule dispatcher stopped");
    }

    private void submitBatch(ChangeEvent event) {
        try {
            batchPool.execute(() -> {
                activeBatches.incrementAndGet();
                try {
                    runAll();
                    batchesCompleted.incrementAndGet();
                } finally {
                    activeBatches.decrementAndGet();
                }
            });
        } catch (RuntimeException e) {
            log.warn("Rule batch for '{}' rejected: {}", event.name(), e.getMessage());
        }
    }

    /**
     * Stop the clock and the dispatcher. Batches already running are allowed to finish;
     * changes they make are no longer delivered.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down RuleManager");
        if (clockScheduler != null) {
            clockScheduler.shutdownNow();
        }
        if (dispatcher != null) {
            dispatcher.interrupt();
        }
        variables.stopDelivery();
        batchPool.shutdown();
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return batchPool.awaitTermination(timeout, unit);
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public List<Rule> getRules() {
        return rules;
    }

    /**
     * Get statistics.
     */
    public RuleManagerStats getStats() {
        return new RuleManagerStats(
                rules.size(),
                eventsDispatched.get(),
                batchesCompleted.get(),
                ruleFailures.get(),
                activeBatches.get()
        );
    }

    /**
     * Dispatch statistics.
     */
    public record RuleManagerStats(
            int rules,
            long eventsDispatched,
            long batchesCompleted,
            long ruleFailures,
            int activeBatches
    ) {}
}
