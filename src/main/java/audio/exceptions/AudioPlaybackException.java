package audio.exceptions;

import lombok.NonNull;

/** Thrown when a sound player cannot be set up or driven for playback. */
public class AudioPlaybackException extends AudioException {

    public AudioPlaybackException(@NonNull String message) {
        super(message);
    }
}
