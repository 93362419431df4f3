package audio.silent;

import audio.AbstractSoundPlayer;
import com.google.errorprone.annotations.ThreadSafe;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Sound player that runs the full playback state machine without rendering audio. Buffering and
 * fades take real time on the shared scheduler, and the output level they would produce is
 * available from {@link #getEffectiveVolume()}.
 *
 * <p>Every command invalidates the scheduled work of the previous one, so a late timer never
 * overrides a newer command.
 */
@ThreadSafe
@Slf4j
public class SilentSoundPlayer extends AbstractSoundPlayer {

    static final long RAMP_STEP_MILLIS = 20;

    private final ScheduledExecutorService scheduler;
    private final Duration bufferingDelay;

    // Guarded by lock
    private long generation;
    private ScheduledFuture<?> pendingTask;

    private volatile float effectiveVolume;

    public SilentSoundPlayer(
            @NonNull String soundId,
            @NonNull ScheduledExecutorService scheduler,
            @NonNull Duration bufferingDelay) {
        super(soundId);
        this.scheduler = scheduler;
        this.bufferingDelay = bufferingDelay;
    }

    /** Output level right now, including any fade in progress. */
    public float getEffectiveVolume() {
        return effectiveVolume;
    }

    @Override
    public void play() {
        lock.lock();
        try {
            State state = getState();
            if (state == State.STOPPED || state == State.BUFFERING || state == State.PLAYING) {
                return;
            }

            long gen = invalidatePendingTask();
            transitionTo(State.BUFFERING);
            pendingTask =
                    scheduler.schedule(
                            () -> onBuffered(gen),
                            bufferingDelay.toMillis(),
                            TimeUnit.MILLISECONDS);
        } finally {
            lock.unlock();
        }
        dispatchPendingStates();
    }

    @Override
    public void pause(boolean immediate) {
        lock.lock();
        try {
            State state = getState();
            if (state == State.PAUSED || state == State.STOPPING || state == State.STOPPED) {
                return;
            }
            if (state == State.PAUSING && !immediate) {
                return;
            }

            invalidatePendingTask();
            if (immediate || fadeOutDuration.isZero() || state == State.BUFFERING) {
                effectiveVolume = 0F;
                transitionTo(State.PAUSED);
            } else {
                transitionTo(State.PAUSING);
                startRamp(false, fadeOutDuration, State.PAUSED);
            }
        } finally {
            lock.unlock();
        }
        dispatchPendingStates();
    }

    @Override
    public void stop(boolean immediate) {
        lock.lock();
        try {
            State state = getState();
            if (state == State.STOPPED) {
                return;
            }
            if (state == State.STOPPING && !immediate) {
                return;
            }

            invalidatePendingTask();
            boolean audible = state == State.PLAYING || state == State.PAUSING;
            if (immediate || fadeOutDuration.isZero() || !audible) {
                effectiveVolume = 0F;
                transitionTo(State.STOPPED);
            } else {
                transitionTo(State.STOPPING);
                startRamp(false, fadeOutDuration, State.STOPPED);
            }
        } finally {
            lock.unlock();
        }
        dispatchPendingStates();
    }

    @Override
    public void setVolume(float volume) {
        lock.lock();
        try {
            super.setVolume(volume);
            if (getState() == State.PLAYING && pendingTask == null) {
                effectiveVolume = volume;
            }
        } finally {
            lock.unlock();
        }
    }

    private void onBuffered(long gen) {
        lock.lock();
        try {
            if (gen != generation || getState() != State.BUFFERING) {
                return;
            }

            pendingTask = null;
            transitionTo(State.PLAYING);
            startRamp(true, fadeInDuration, null);
        } finally {
            lock.unlock();
        }
        dispatchPendingStates();
    }

    /**
     * Ramps the output level towards the player volume (fade-in) or silence (fade-out), then moves
     * to {@code completeState} if one is given. Must be called with the lock held.
     */
    private void startRamp(boolean fadeIn, Duration duration, State completeState) {
        if (duration.isZero()) {
            effectiveVolume = fadeIn ? volume : 0F;
            if (completeState != null) {
                transitionTo(completeState);
            }
            return;
        }

        long gen = generation;
        float from = effectiveVolume;
        long startNanos = System.nanoTime();
        long totalNanos = duration.toNanos();
        log.trace("{}: fading {} over {}", soundId, fadeIn ? "in" : "out", duration);
        pendingTask =
                scheduler.scheduleAtFixedRate(
                        () -> rampStep(gen, fadeIn, from, startNanos, totalNanos, completeState),
                        0,
                        RAMP_STEP_MILLIS,
                        TimeUnit.MILLISECONDS);
    }

    private void rampStep(
            long gen,
            boolean fadeIn,
            float from,
            long startNanos,
            long totalNanos,
            State completeState) {
        lock.lock();
        try {
            if (gen != generation) {
                return;
            }

            float target = fadeIn ? volume : 0F;
            float progress = Math.min(1F, (System.nanoTime() - startNanos) / (float) totalNanos);
            effectiveVolume = from + (target - from) * progress;
            if (progress >= 1F) {
                invalidatePendingTask();
                if (completeState != null) {
                    transitionTo(completeState);
                }
            }
        } finally {
            lock.unlock();
        }
        dispatchPendingStates();
    }

    /** Cancels scheduled work and returns the new generation. Must be called with the lock held. */
    private long invalidatePendingTask() {
        generation++;
        if (pendingTask != null) {
            pendingTask.cancel(false);
            pendingTask = null;
        }
        return generation;
    }
}
