package org.teamelites.swarm.evolution;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.teamelites.swarm.api.NicheDescriptor;
import org.teamelites.swarm.spi.CollaboratorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the evolution engine in the background: one cycle per interval, each cycle making sure
 * the archive exists and then running one generation.
 * <p>
 * A cycle that fails is logged and retried at the next interval. {@link #stop()} interrupts the
 * wait between cycles; a generation in flight is allowed to finish within the shutdown timeout.
 */
public class EvolutionService {

    private static final Logger log = LoggerFactory.getLogger(EvolutionService.class);

    public enum State {
        STOPPED,
        RUNNING,
        ERROR
    }

    private final EvolutionEngine engine;
    private final List<NicheDescriptor> niches;
    private final Duration interval;
    private final Duration shutdownTimeout;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicLong cyclesRun = new AtomicLong();
    private volatile boolean inGeneration;
    private Thread serviceThread;

    public EvolutionService(EvolutionEngine engine, EvolutionConfig config) {
        this(engine, config.niches(), config.interval(), Duration.ofSeconds(30));
    }

    EvolutionService(EvolutionEngine engine, List<NicheDescriptor> niches, Duration interval,
                     Duration shutdownTimeout) {
        this.engine = engine;
        this.niches = List.copyOf(niches);
        this.interval = interval;
        this.shutdownTimeout = shutdownTimeout;
    }

    public synchronized void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException("Cannot start evolution service in state " + currentState.get());
        }
        stopRequested.set(false);
        serviceThread = new Thread(this::runService, "evolution-service");
        serviceThread.setDaemon(true);
        serviceThread.start();
        log.info("Evolution service started: {} niches, interval {}", niches.size(), interval);
    }

    public synchronized void stop() {
        if (currentState.get() != State.RUNNING) {
            throw new IllegalStateException("Cannot stop evolution service in state " + currentState.get());
        }
        stopRequested.set(true);
        if (!inGeneration) {
            serviceThread.interrupt();
        }
        try {
            serviceThread.join(shutdownTimeout.toMillis());
            if (serviceThread.isAlive()) {
                log.warn("Evolution service did not stop within {}, forcing interrupt", shutdownTimeout);
                serviceThread.interrupt();
                serviceThread.join(1000);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for evolution service shutdown");
        }
        if (serviceThread.isAlive()) {
            log.error("Evolution service thread did not terminate, setting ERROR state");
            currentState.set(State.ERROR);
            return;
        }
        currentState.set(State.STOPPED);
        log.debug("Evolution service stopped");
    }

    private void runService() {
        try {
            while (!stopRequested.get()) {
                runCycle();
                if (stopRequested.get()) {
                    break;
                }
                Thread.sleep(interval.toMillis());
            }
        } catch (InterruptedException e) {
            log.debug("Evolution service interrupted, shutting down");
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs one cycle on the calling thread.
     *
     * @return the generation report, {@link GenerationReport#EMPTY} if the cycle failed.
     */
    GenerationReport runCycle() {
        inGeneration = true;
        try {
            engine.initializeArchive(niches);
            return engine.runGeneration(niches);
        } catch (CollaboratorException e) {
            log.warn("Archive initialization failed, retrying next cycle: {}", e.getMessage());
            return GenerationReport.EMPTY;
        } catch (RuntimeException e) {
            log.error("Generation failed with {}: {}", e.getClass().getSimpleName(), e.getMessage());
            log.debug("Exception details:", e);
            return GenerationReport.EMPTY;
        } finally {
            inGeneration = false;
            cyclesRun.incrementAndGet();
        }
    }

    public State getCurrentState() {
        return currentState.get();
    }

    /**
     * @return number of completed cycles, failed ones included.
     */
    public long getCyclesRun() {
        return cyclesRun.get();
    }
}
