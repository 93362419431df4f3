package audio;

import java.time.Duration;
import lombok.NonNull;

/**
 * Playback handle for a single sound. Implementations own their decode and render pipeline and
 * report every state transition through the registered {@link StateChangeListener}, possibly from
 * their own threads.
 *
 * <p>State machine:
 *
 * <pre>
 * PAUSED -> BUFFERING (play)
 * BUFFERING -> PLAYING (ready)
 * BUFFERING/PLAYING -> PAUSING (pause with fade-out)
 * BUFFERING/PLAYING/PAUSING -> PAUSED (pause finished, or immediate pause)
 * PAUSING/STOPPING -> BUFFERING (play while fading out)
 * any except STOPPED -> STOPPING (stop with fade-out)
 * any -> STOPPED (stop finished, or immediate stop)
 * </pre>
 *
 * <p>A freshly built player starts in {@link State#PAUSED}. {@link State#STOPPED} is terminal: a
 * stopped player is never played again.
 */
public interface SoundPlayer {

    enum State {
        STOPPED,
        BUFFERING,
        PLAYING,
        PAUSING,
        PAUSED,
        STOPPING
    }

    State getState();

    /** Starts or resumes playback, fading in if a fade-in duration is set. */
    void play();

    /**
     * @param immediate skip the fade-out and pause right away
     */
    void pause(boolean immediate);

    /**
     * @param immediate skip the fade-out and stop right away
     */
    void stop(boolean immediate);

    /**
     * Sets the output volume of this player.
     *
     * @param volume effective volume in [0, 1], already scaled by any global multiplier
     */
    void setVolume(float volume);

    void setFadeInDuration(@NonNull Duration duration);

    void setFadeOutDuration(@NonNull Duration duration);

    void setPremiumSegmentsEnabled(boolean enabled);

    /**
     * @param bitrate one of {@link AudioBitrates#ALL}; other values are passed to the streaming
     *     layer as-is
     */
    void setAudioBitrate(@NonNull String bitrate);

    void setAudioAttributes(@NonNull AudioAttributes attributes);

    /** Replaces the state change listener. Pass {@code null} to detach. */
    void setStateChangeListener(StateChangeListener listener);

    /** Receives state transitions of a {@link SoundPlayer}, in the order they happen. */
    @FunctionalInterface
    interface StateChangeListener {
        void onStateChange(@NonNull State state);
    }

    /** Creates {@link SoundPlayer} instances for sound ids. */
    @FunctionalInterface
    interface Factory {
        SoundPlayer buildPlayer(@NonNull String soundId);
    }
}
