package com.prediction.market.options_market.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.prediction.market.options_market.entity.PricePoint;
import com.prediction.market.options_market.export.PricePointRecorder;

import lombok.extern.slf4j.Slf4j;

/**
 * Stochastic generator of the underlying price path.
 *
 * The binary outcome is drawn once, at construction, and the path is biased
 * toward it (95 for YES, 5 for NO) after the threshold point. Points are
 * produced either by explicit steps or by a single background worker, and
 * every point is pushed to the subscribed {@link PriceSink}s synchronously
 * and in subscription order.
 *
 * All mutable state is guarded by one fair lock. Control calls
 * (start/pause/resume/stop/reset) are safe from any thread; {@link #stop()}
 * returns only after the worker has exited and the run has been finalized.
 */
@Slf4j
public class MarketSimulationEngine {

    public static final double YES_TARGET_PRICE = 95.0;
    public static final double NO_TARGET_PRICE = 5.0;

    private static final Duration SIMULATED_STEP = Duration.ofMinutes(5);
    private static final long STOP_JOIN_TIMEOUT_MS = 2000;
    private static final double TERMINAL_PULL = 0.4;

    private final SimulationSettings settings;
    private final int totalPoints;
    private final double initialPrice;
    private final int thresholdPoint;
    private final boolean resolvedOutcome;
    private final double targetPrice;
    private final Random random;
    private final Clock clock;
    private final PricePointRecorder recorder;

    private final List<PriceSink> sinks = new CopyOnWriteArrayList<>();

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition signal = lock.newCondition();

    // guarded by lock
    private SimulationState state = SimulationState.STOPPED;
    private final List<PricePoint> history = new ArrayList<>();
    private PricePoint currentPoint;
    private int currentIndex;
    private double currentPrice;
    private double previousMovement;
    private Instant startTime;
    private Duration timeInterval = Duration.ofSeconds(1);
    private boolean stopRequested;
    private boolean runFinished;
    private boolean halted;
    private ExecutorService worker;
    private Future<?> loop;
    private Thread workerThread;

    public MarketSimulationEngine(SimulationSettings settings) {
        this(settings, new Random(), Clock.systemUTC(), null);
    }

    /**
     * @param recorder optional export of every point, null to disable
     */
    public MarketSimulationEngine(SimulationSettings settings, Random random, Clock clock,
            PricePointRecorder recorder) {
        settings.validate();
        this.settings = settings;
        this.random = random;
        this.clock = clock;
        this.recorder = recorder;
        this.totalPoints = settings.getTotalPoints();
        this.initialPrice = settings.clampedInitialPrice();
        this.thresholdPoint = (int) (totalPoints * settings.getThresholdFraction());
        this.resolvedOutcome = settings.getForcedOutcome() != null
                ? settings.getForcedOutcome()
                : random.nextBoolean();
        this.targetPrice = resolvedOutcome ? YES_TARGET_PRICE : NO_TARGET_PRICE;
        this.currentPrice = initialPrice;
        this.startTime = clock.instant();

        log.info("Market simulation initialized: outcome={}, thresholdPoint={}, totalPoints={}",
                resolvedOutcome ? "YES" : "NO", thresholdPoint, totalPoints);
    }

    // ===== Subscription =====

    public void subscribe(PriceSink sink) {
        sinks.add(sink);
    }

    public boolean unsubscribe(PriceSink sink) {
        return sinks.remove(sink);
    }

    // ===== Lifecycle =====

    /**
     * Starts a run. MANUAL leaves the engine PAUSED waiting for {@link #step()};
     * AUTO starts the background worker.
     *
     * @return false when a run is active, completed or halted (reset first)
     */
    public boolean start(Duration interval, SimulationMode mode) {
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be >= 0: " + interval);
        }
        lock.lock();
        try {
            if (state.isActive()) {
                log.warn("Simulation already running (state={})", state);
                return false;
            }
            if (state == SimulationState.COMPLETED || halted) {
                log.warn("Simulation already finished (state={}), reset before starting again", state);
                return false;
            }

            timeInterval = interval;
            stopRequested = false;
            runFinished = false;
            if (recorder != null) {
                recorder.open(resolvedOutcome, totalPoints);
            }

            if (mode == SimulationMode.AUTO) {
                state = SimulationState.RUNNING;
                worker = Executors.newSingleThreadExecutor(r -> {
                    Thread thread = new Thread(r, "market-simulation");
                    thread.setDaemon(true);
                    return thread;
                });
                loop = worker.submit(this::runLoop);
                log.info("Simulation started in AUTO mode (interval={}ms)", interval.toMillis());
            } else {
                state = SimulationState.PAUSED;
                log.info("Simulation started in MANUAL mode");
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean pause() {
        lock.lock();
        try {
            if (state != SimulationState.RUNNING) {
                log.debug("Pause ignored in state {}", state);
                return false;
            }
            state = SimulationState.PAUSED;
            signal.signalAll();
            log.info("Simulation paused at point {}", currentIndex);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean resume() {
        lock.lock();
        try {
            if (state != SimulationState.PAUSED) {
                log.debug("Resume ignored in state {}", state);
                return false;
            }
            state = SimulationState.RUNNING;
            signal.signalAll();
            log.info("Simulation resumed at point {}", currentIndex);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Halts the run, waits for the worker to exit, applies the terminal price
     * adjustment and closes the export.
     *
     * @return false when no run was active
     */
    public boolean stop() {
        Future<?> running;
        ExecutorService executor;
        boolean calledFromWorker;
        lock.lock();
        try {
            if (!state.isActive()) {
                log.debug("Stop ignored in state {}", state);
                return false;
            }
            stopRequested = true;
            signal.signalAll();
            running = loop;
            executor = worker;
            calledFromWorker = Thread.currentThread() == workerThread;
        } finally {
            lock.unlock();
        }

        if (running != null && !calledFromWorker) {
            awaitLoopExit(running);
        }
        if (executor != null) {
            if (calledFromWorker) {
                executor.shutdown();
            } else {
                executor.shutdownNow();
            }
        }

        lock.lock();
        try {
            finishRun();
            worker = null;
            loop = null;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops any active run and rewinds to the first point. The committed
     * outcome is kept.
     */
    public void reset() {
        stop();
        lock.lock();
        try {
            history.clear();
            currentPoint = null;
            currentIndex = 0;
            currentPrice = initialPrice;
            previousMovement = 0.0;
            state = SimulationState.STOPPED;
            halted = false;
            runFinished = false;
            worker = null;
            loop = null;
            startTime = clock.instant();
            log.info("Simulation reset to beginning");
        } finally {
            lock.unlock();
        }
    }

    // ===== Generation =====

    /**
     * Manual step; allowed in every state except COMPLETED.
     */
    public Optional<PricePoint> step() {
        lock.lock();
        try {
            if (state == SimulationState.COMPLETED) {
                return Optional.empty();
            }
            return generateNext();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Produces the next point, or completes the run when all points exist.
     */
    public Optional<PricePoint> generateNext() {
        lock.lock();
        try {
            if (currentIndex >= totalPoints) {
                state = SimulationState.COMPLETED;
                finishRun();
                return Optional.empty();
            }
            return Optional.of(emitNext());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clamped movement for the step at {@code index} from {@code price}.
     */
    double nextMovement(double price, int index, double lastMovement) {
        double movement;
        if (index < thresholdPoint) {
            double momentum = 0.2 * lastMovement;
            double noise = random.nextGaussian() * settings.getVolatility();
            double weakSignal = 0.01 * (targetPrice - price) / 100.0;
            movement = momentum + noise + weakSignal;
        } else {
            double trendWindow = totalPoints - thresholdPoint;
            double progress = (index - thresholdPoint) / trendWindow;
            double baseTrend = settings.getTrendStrength() * (targetPrice - price) / 100.0;
            double progressiveTrend = baseTrend * (0.1 + 0.9 * progress);
            double remaining = (totalPoints - index) / trendWindow;
            double scaledVolatility = settings.getVolatility() * (0.75 + 0.25 * remaining);
            double noise = random.nextGaussian() * scaledVolatility;
            movement = progressiveTrend + noise + 0.15 * lastMovement;
        }
        double max = settings.getMaxMovementPerStep();
        return Math.max(-max, Math.min(max, movement));
    }

    /**
     * Moves {@code price} by {@code movement}, damping moves that would land
     * past the warning zone and clamping to the hard bounds of the phase.
     */
    static double applySoftBounds(double price, double movement, boolean preThreshold) {
        double comfortLow = preThreshold ? 12.0 : 5.0;
        double comfortHigh = preThreshold ? 88.0 : 95.0;
        double warningLow = preThreshold ? 8.0 : 2.0;
        double warningHigh = preThreshold ? 92.0 : 98.0;

        double newPrice = price + movement;
        if (newPrice < warningLow) {
            double dampening = Math.min(0.6, (comfortLow - newPrice) * 0.1);
            newPrice = price + movement * (1 - dampening);
        } else if (newPrice > warningHigh) {
            double dampening = Math.min(0.6, (newPrice - comfortHigh) * 0.1);
            newPrice = price + movement * (1 - dampening);
        }

        if (preThreshold) {
            return Math.max(5.0, Math.min(95.0, newPrice));
        }
        return Math.max(1.0, Math.min(99.0, newPrice));
    }

    private PricePoint emitNext() {
        int index = currentIndex;
        double movement = 0.0;
        if (index > 0) {
            movement = nextMovement(currentPrice, index, previousMovement);
            currentPrice = applySoftBounds(currentPrice, movement, index < thresholdPoint);
            previousMovement = movement;
        }

        double magnitude = Math.abs(movement);
        int baseVolume = 50 + random.nextInt(151);
        int volume = (int) (baseVolume * (1.0 + magnitude * 0.5));
        double baseSpread = 0.5 + (random.nextDouble() * 0.4 - 0.2);
        double spread = Math.max(0.1, baseSpread + magnitude * 0.1);

        PricePoint point = PricePoint.builder()
                .sequenceIndex(index)
                .timestamp(startTime.plus(SIMULATED_STEP.multipliedBy(index)))
                .price(currentPrice)
                .movement(movement)
                .volume(volume)
                .bidAskSpread(spread)
                .resolvedOutcome(resolvedOutcome)
                .build();

        history.add(point);
        currentPoint = point;
        if (recorder != null) {
            recorder.record(point);
        }
        notifySinks(point);
        currentIndex++;
        return point;
    }

    private void notifySinks(PricePoint point) {
        for (PriceSink sink : sinks) {
            try {
                sink.onPrice(point);
            } catch (RuntimeException e) {
                log.error("Price sink {} failed on point {}", sink, point.getSequenceIndex(), e);
            }
        }
    }

    private void runLoop() {
        lock.lock();
        try {
            workerThread = Thread.currentThread();
            while (true) {
                while (state == SimulationState.PAUSED && !stopRequested) {
                    signal.await();
                }
                if (stopRequested || runFinished || currentIndex >= totalPoints
                        || state != SimulationState.RUNNING) {
                    break;
                }
                emitNext();
                if (!awaitNextTick()) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Simulation worker interrupted at point {}", currentIndex);
        } finally {
            try {
                finishRun();
            } finally {
                workerThread = null;
                lock.unlock();
            }
        }
    }

    /**
     * Waits one interval, waking early on stop. Releases the lock while waiting;
     * a zero interval still hands the fair lock to queued callers between points.
     *
     * @return false when a stop was requested
     */
    private boolean awaitNextTick() throws InterruptedException {
        long remaining = timeInterval.toNanos();
        if (remaining <= 0) {
            lock.unlock();
            try {
                Thread.yield();
            } finally {
                lock.lock();
            }
            return !stopRequested;
        }
        while (!stopRequested && remaining > 0) {
            remaining = signal.awaitNanos(remaining);
        }
        return !stopRequested;
    }

    private void awaitLoopExit(Future<?> running) {
        try {
            running.get(STOP_JOIN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Simulation worker did not exit within {}ms, cancelling", STOP_JOIN_TIMEOUT_MS);
            running.cancel(true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the simulation worker to exit");
        } catch (ExecutionException e) {
            log.error("Simulation worker failed", e.getCause());
        } catch (CancellationException e) {
            log.debug("Simulation worker was already cancelled");
        }
    }

    /**
     * Ends the current run once: sets the final state, pulls the last point
     * toward the target and closes the export. Lock must be held.
     */
    private void finishRun() {
        if (runFinished) {
            return;
        }
        runFinished = true;

        if (currentIndex >= totalPoints) {
            state = SimulationState.COMPLETED;
            log.info("Simulation completed after {} points", currentIndex);
        } else {
            state = SimulationState.STOPPED;
            halted = true;
            log.info("Simulation stopped at point {}", currentIndex);
        }

        applyTerminalAdjustment();
        if (recorder != null) {
            recorder.close();
        }
        if (worker != null) {
            worker.shutdown();
        }
        signal.signalAll();
    }

    private void applyTerminalAdjustment() {
        if (history.isEmpty()) {
            return;
        }
        double adjusted = currentPrice + (targetPrice - currentPrice) * TERMINAL_PULL;
        currentPrice = Math.max(2.0, Math.min(98.0, adjusted));

        int last = history.size() - 1;
        PricePoint adjustedPoint = history.get(last).toBuilder().price(currentPrice).build();
        history.set(last, adjustedPoint);
        currentPoint = adjustedPoint;
        log.info("Final price adjusted toward {}: {}", targetPrice, String.format("%.2f", currentPrice));
    }

    // ===== Queries =====

    public SimulationState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public double getCurrentPrice() {
        lock.lock();
        try {
            return currentPrice;
        } finally {
            lock.unlock();
        }
    }

    public Optional<PricePoint> getCurrentPoint() {
        lock.lock();
        try {
            return Optional.ofNullable(currentPoint);
        } finally {
            lock.unlock();
        }
    }

    public List<PricePoint> getHistory() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    public List<PricePoint> getRecentHistory(int count) {
        lock.lock();
        try {
            int from = Math.max(0, history.size() - Math.max(0, count));
            return List.copyOf(history.subList(from, history.size()));
        } finally {
            lock.unlock();
        }
    }

    public SimulationStats getStats() {
        lock.lock();
        try {
            return SimulationStats.builder()
                    .state(state)
                    .currentPoint(currentIndex)
                    .totalPoints(totalPoints)
                    .progressPercent(currentIndex * 100.0 / totalPoints)
                    .currentPrice(currentPrice)
                    .targetResolution(resolvedOutcome ? "YES" : "NO")
                    .trending(currentIndex >= thresholdPoint)
                    .timeInterval(timeInterval)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public int getTotalPoints() {
        return totalPoints;
    }

    public int getThresholdPoint() {
        return thresholdPoint;
    }

    public boolean getResolvedOutcome() {
        return resolvedOutcome;
    }

    public double getTargetPrice() {
        return targetPrice;
    }
}
