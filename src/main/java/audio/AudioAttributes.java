package audio;

import lombok.NonNull;

/**
 * Describes how the platform should route and arbitrate a sound's output.
 *
 * @param usage why the sound is played
 * @param contentType what kind of content is played
 * @param stream legacy output stream the sound is mixed into
 */
public record AudioAttributes(
        @NonNull Usage usage, @NonNull ContentType contentType, @NonNull Stream stream) {

    /** Playback on the music stream. */
    public static final AudioAttributes DEFAULT =
            new AudioAttributes(Usage.MEDIA, ContentType.MOVIE, Stream.MUSIC);

    /** Playback on the alarm stream, audible while media is muted. */
    public static final AudioAttributes ALARM =
            new AudioAttributes(Usage.ALARM, ContentType.MOVIE, Stream.ALARM);

    public enum Usage {
        MEDIA,
        ALARM
    }

    public enum ContentType {
        MUSIC,
        MOVIE,
        SPEECH
    }

    public enum Stream {
        MUSIC,
        ALARM
    }
}
