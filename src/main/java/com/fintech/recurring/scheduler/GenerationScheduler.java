package com.fintech.recurring.scheduler;

import com.fintech.recurring.dto.GenerationResult;
import com.fintech.recurring.exception.GenerationInProgressException;
import com.fintech.recurring.service.MovementGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Background loop that runs a generation pass once at startup and then at a fixed delay.
 * <p>
 * Passes never overlap: the next one is scheduled only after the previous one returned.
 * Stopping cancels future passes but lets a pass in flight finish.
 * <p>
 * Default: every 12 hours
 */
@Component
@Slf4j
public class GenerationScheduler implements SmartLifecycle {

    enum State {
        RUNNING,
        STOPPED
    }

    private final MovementGenerator movementGenerator;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final boolean schedulerEnabled;
    private final Duration interval;

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);
    private volatile ScheduledFuture<?> scheduledPasses;

    public GenerationScheduler(MovementGenerator movementGenerator,
                               @Qualifier("generationTaskScheduler") TaskScheduler taskScheduler,
                               Clock clock,
                               @Value("${recurring.scheduler.enabled:true}") boolean schedulerEnabled,
                               @Value("${recurring.scheduler.interval:PT12H}") Duration interval) {
        this.movementGenerator = movementGenerator;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.schedulerEnabled = schedulerEnabled;
        this.interval = interval;
    }

    @Override
    public void start() {
        if (!schedulerEnabled) {
            log.info("Generation scheduler is disabled");
            return;
        }
        if (!state.compareAndSet(State.STOPPED, State.RUNNING)) {
            log.debug("Generation scheduler already running");
            return;
        }

        scheduledPasses = taskScheduler.scheduleWithFixedDelay(this::runScheduledPass, clock.instant(), interval);
        log.info("Generation scheduler started, interval {}", interval);
    }

    /**
     * Idempotent. A pass in flight is not interrupted.
     */
    @Override
    public void stop() {
        if (!state.compareAndSet(State.RUNNING, State.STOPPED)) {
            return;
        }

        ScheduledFuture<?> passes = scheduledPasses;
        if (passes != null) {
            passes.cancel(false);
        }
        scheduledPasses = null;
        log.info("Generation scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    void runScheduledPass() {
        if (state.get() != State.RUNNING) {
            log.debug("Scheduler is stopped, skipping generation pass");
            return;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        log.debug("Starting scheduled generation pass at {}", now);

        try {
            GenerationResult result = movementGenerator.processPending(now);
            logResult(result);
        } catch (GenerationInProgressException e) {
            log.warn("Generation pass skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled generation pass failed with unexpected error", e);
        }
    }

    private void logResult(GenerationResult result) {
        if (result.getTotalProcessed() == 0) {
            log.debug("No templates due for generation");
        } else if (result.getErrors() > 0) {
            log.warn("Generation pass completed in {}ms with errors: {} processed, {} generated, {} errors",
                    result.getDurationMs(), result.getTotalProcessed(), result.getGenerated(), result.getErrors());
        } else {
            log.info("Generation pass completed in {}ms: {} processed, {} generated",
                    result.getDurationMs(), result.getTotalProcessed(), result.getGenerated());
        }
    }
}
