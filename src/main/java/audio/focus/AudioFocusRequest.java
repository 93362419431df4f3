package audio.focus;

import audio.AudioAttributes;
import lombok.NonNull;

/**
 * A single holder's claim on audio focus. The same instance must be passed to {@link
 * AudioFocusArbiter#abandonFocus(AudioFocusRequest)} to release it; requests are compared by
 * identity.
 */
public final class AudioFocusRequest {

    private final AudioAttributes attributes;
    private final FocusGain gain;
    private final FocusChangeListener listener;

    public AudioFocusRequest(
            @NonNull AudioAttributes attributes,
            @NonNull FocusGain gain,
            @NonNull FocusChangeListener listener) {
        this.attributes = attributes;
        this.gain = gain;
        this.listener = listener;
    }

    public AudioAttributes getAttributes() {
        return attributes;
    }

    public FocusGain getGain() {
        return gain;
    }

    public FocusChangeListener getListener() {
        return listener;
    }

    @Override
    public String toString() {
        return "AudioFocusRequest[" + gain + ", " + attributes.usage() + "]";
    }

    /** Receives focus changes for a granted request. */
    @FunctionalInterface
    public interface FocusChangeListener {
        void onFocusChange(@NonNull FocusChange change);
    }
}
