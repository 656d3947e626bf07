package com.logsampler.core;

import com.google.common.base.Preconditions;
import com.logsampler.facility.CheckedEntry;
import com.logsampler.facility.Facility;
import com.logsampler.model.CounterMode;
import com.logsampler.model.Field;
import com.logsampler.model.Level;
import com.logsampler.model.LogEntry;
import com.logsampler.model.SamplingDecision;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Facility decorator that samples entries by message text.
 *
 * <p>Every enabled entry increments its message's count. The first
 * {@link SamplingPolicy#getFirst() first} occurrences are passed to the
 * wrapped facility, after that only every
 * {@link SamplingPolicy#getThereafter() thereafter}-th one is; the rest are
 * dropped silently. The occurrence that first exceeds the burst allowance arms
 * a one-shot reset of the message's count, fired {@link SamplingPolicy#getTick()
 * tick} later on the reset scheduler.
 *
 * <p>Samplers derived through {@link #with(List)} share their parent's counter
 * and policy; fields never take part in the sampling key.
 */
@Slf4j
public class Sampler implements Facility {
    private final Facility wrapped;
    @Getter
    private final SamplingPolicy policy;
    @Getter
    private final MessageCounter counter;
    private final TaskScheduler resetScheduler;
    @Nullable
    private final SamplingListener listener;

    /**
     * @param facility       facility to forward sampled entries to
     * @param policy         sampling rule
     * @param counterMode      counter to create when {@code counter} is not given
     * @param shardedWidth     slot count of a created sharded counter, defaults to {@value ShardedMessageCounter#DEFAULT_WIDTH}
     * @param shardedGroupSize slots per lock of a created sharded counter, defaults to {@value ShardedMessageCounter#DEFAULT_GROUP_SIZE}
     * @param counter          counter to use, overrides {@code counterMode}
     * @param resetScheduler scheduler for count resets, defaults to a shared daemon scheduler
     * @param listener       optional callback for every decision
     */
    @Builder
    private Sampler(Facility facility,
                    SamplingPolicy policy,
                    CounterMode counterMode,
                    Integer shardedWidth,
                    Integer shardedGroupSize,
                    MessageCounter counter,
                    TaskScheduler resetScheduler,
                    SamplingListener listener) {
        this.wrapped = Preconditions.checkNotNull(facility, "facility");
        this.policy = Preconditions.checkNotNull(policy, "policy");
        this.counter = counter != null ? counter : MessageCounter.create(
                Preconditions.checkNotNull(counterMode, "counterMode"),
                shardedWidth != null ? shardedWidth : ShardedMessageCounter.DEFAULT_WIDTH,
                shardedGroupSize != null ? shardedGroupSize : ShardedMessageCounter.DEFAULT_GROUP_SIZE);
        this.resetScheduler = resetScheduler != null ? resetScheduler : SharedResetScheduler.INSTANCE;
        this.listener = listener;
        log.info("Sampling log entries with policy {} on {}", policy, this.counter.getClass().getSimpleName());
    }

    private Sampler(Facility wrapped, Sampler parent) {
        this.wrapped = wrapped;
        this.policy = parent.policy;
        this.counter = parent.counter;
        this.resetScheduler = parent.resetScheduler;
        this.listener = parent.listener;
    }

    /**
     * Sample entries of {@code facility} with an exact per-message counter.
     *
     * @throws IllegalArgumentException if {@code tick} is not positive,
     *                                  {@code first} is negative or
     *                                  {@code thereafter} is less than one
     */
    public static Sampler sample(Facility facility, Duration tick, int first, int thereafter) {
        return Sampler.builder()
                .facility(facility)
                .policy(new SamplingPolicy(tick, first, thereafter))
                .counterMode(CounterMode.EXACT)
                .build();
    }

    @Override
    public boolean enabled(Level level) {
        return wrapped.enabled(level);
    }

    @Override
    public Facility with(List<Field> fields) {
        return new Sampler(wrapped.with(fields), this);
    }

    @Override
    @Nullable
    public CheckedEntry check(LogEntry entry, @Nullable CheckedEntry checked) {
        if (!wrapped.enabled(entry.getLevel())) {
            return checked;
        }

        String key = entry.getMessage();
        long count = counter.increment(key);
        if (policy.armsReset(count)) {
            scheduleReset(key);
        }

        SamplingDecision decision = policy.decide(count);
        if (listener != null) {
            listener.onDecision(entry, decision);
        }
        if (decision == SamplingDecision.DROP) {
            return checked;
        }
        return wrapped.check(entry, checked);
    }

    @Override
    public void write(LogEntry entry, List<Field> fields) {
        wrapped.write(entry, fields);
    }

    private void scheduleReset(String key) {
        try {
            resetScheduler.schedule(() -> resetCount(key), Instant.now().plus(policy.getTick()));
        } catch (TaskRejectedException e) {
            // a throttled key always needs a reset
            log.warn("Reset scheduler rejected task, resetting count immediately for message: {}", key, e);
            counter.reset(key);
        }
    }

    private void resetCount(String key) {
        counter.reset(key);
        log.trace("Reset sampling count for message: {}", key);
    }

    private static final class SharedResetScheduler {
        static final ThreadPoolTaskScheduler INSTANCE = create();

        private static ThreadPoolTaskScheduler create() {
            ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
            scheduler.setPoolSize(1);
            scheduler.setDaemon(true);
            scheduler.setThreadNamePrefix("log-sampler-reset-");
            scheduler.initialize();
            return scheduler;
        }
    }
}
