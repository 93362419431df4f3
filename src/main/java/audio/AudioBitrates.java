package audio;

import java.util.Set;

/** Bitrates understood by the sound streaming layer. */
public final class AudioBitrates {

    public static final String KBPS_128 = "128k";
    public static final String KBPS_192 = "192k";
    public static final String KBPS_256 = "256k";
    public static final String KBPS_320 = "320k";

    public static final String DEFAULT = KBPS_128;

    public static final Set<String> ALL = Set.of(KBPS_128, KBPS_192, KBPS_256, KBPS_320);

    private AudioBitrates() {}

    public static boolean isKnown(String bitrate) {
        return bitrate != null && ALL.contains(bitrate);
    }
}
