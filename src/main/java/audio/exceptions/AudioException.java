package audio.exceptions;

import lombok.NonNull;

/** Base exception for sound playback errors. */
public class AudioException extends RuntimeException {

    public AudioException(@NonNull String message) {
        super(message);
    }
}
