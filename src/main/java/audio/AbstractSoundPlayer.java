package audio;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.locks.ReentrantLock;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for {@link SoundPlayer} implementations. Holds the shared settings and the current
 * state, and notifies the state change listener only when the state actually changes.
 *
 * <p>Subclasses mutate state through {@link #transitionTo(SoundPlayer.State)} while holding {@link
 * #lock}, and must call {@link #dispatchPendingStates()} after releasing it so the listener never
 * runs under the player lock. Transitions are delivered one at a time, in order, by whichever
 * thread is currently dispatching.
 */
@Slf4j
public abstract class AbstractSoundPlayer implements SoundPlayer {

    protected final ReentrantLock lock = new ReentrantLock();
    protected final String soundId;

    private volatile State state = State.PAUSED;
    private volatile StateChangeListener stateChangeListener;
    private final Queue<State> pendingNotifications = new ArrayDeque<>();
    private boolean dispatching;

    protected volatile float volume = 1F;
    protected volatile Duration fadeInDuration = Duration.ZERO;
    protected volatile Duration fadeOutDuration = Duration.ZERO;
    protected volatile boolean premiumSegmentsEnabled;
    protected volatile String audioBitrate = AudioBitrates.DEFAULT;
    protected volatile AudioAttributes audioAttributes = AudioAttributes.DEFAULT;

    protected AbstractSoundPlayer(@NonNull String soundId) {
        this.soundId = soundId;
    }

    public String getSoundId() {
        return soundId;
    }

    @Override
    public State getState() {
        return state;
    }

    public float getVolume() {
        return volume;
    }

    public Duration getFadeInDuration() {
        return fadeInDuration;
    }

    public Duration getFadeOutDuration() {
        return fadeOutDuration;
    }

    public boolean isPremiumSegmentsEnabled() {
        return premiumSegmentsEnabled;
    }

    public String getAudioBitrate() {
        return audioBitrate;
    }

    public AudioAttributes getAudioAttributes() {
        return audioAttributes;
    }

    @Override
    public void setVolume(float volume) {
        this.volume = volume;
    }

    @Override
    public void setFadeInDuration(@NonNull Duration duration) {
        this.fadeInDuration = duration;
    }

    @Override
    public void setFadeOutDuration(@NonNull Duration duration) {
        this.fadeOutDuration = duration;
    }

    @Override
    public void setPremiumSegmentsEnabled(boolean enabled) {
        this.premiumSegmentsEnabled = enabled;
    }

    @Override
    public void setAudioBitrate(@NonNull String bitrate) {
        this.audioBitrate = bitrate;
    }

    @Override
    public void setAudioAttributes(@NonNull AudioAttributes attributes) {
        this.audioAttributes = attributes;
    }

    @Override
    public void setStateChangeListener(StateChangeListener listener) {
        this.stateChangeListener = listener;
    }

    /**
     * Moves to {@code newState}. Must be called with {@link #lock} held. The listener is notified
     * by the next {@link #dispatchPendingStates()} call.
     *
     * @return false if the player was already in {@code newState}
     */
    protected boolean transitionTo(@NonNull State newState) {
        State oldState = state;
        if (oldState == newState) {
            return false;
        }
        log.trace("{}: {} -> {}", soundId, oldState, newState);
        state = newState;
        pendingNotifications.add(newState);
        return true;
    }

    /**
     * Delivers queued transitions to the listener. Must be called without {@link #lock} held. If
     * another call is already delivering (including a reentrant call from inside the listener), the
     * queued transitions are left to it.
     */
    protected void dispatchPendingStates() {
        lock.lock();
        try {
            if (dispatching) {
                return;
            }
            dispatching = true;
        } finally {
            lock.unlock();
        }

        try {
            while (true) {
                State next;
                lock.lock();
                try {
                    next = pendingNotifications.poll();
                    if (next == null) {
                        dispatching = false;
                        return;
                    }
                } finally {
                    lock.unlock();
                }

                StateChangeListener listener = stateChangeListener;
                if (listener != null) {
                    listener.onStateChange(next);
                }
            }
        } catch (RuntimeException e) {
            lock.lock();
            try {
                dispatching = false;
            } finally {
                lock.unlock();
            }
            throw e;
        }
    }
}
