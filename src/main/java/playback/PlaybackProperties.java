package playback;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** Externalized playback defaults applied to the sound player manager at startup. */
@ConfigurationProperties(prefix = "noice.playback")
public record PlaybackProperties(
        @DefaultValue("1s") Duration fadeInDuration,
        @DefaultValue("1s") Duration fadeOutDuration,
        @DefaultValue("false") boolean premiumSegmentsEnabled,
        @DefaultValue("128k") String audioBitrate,
        @DefaultValue("false") boolean alarmAudioStream,
        @DefaultValue("true") boolean audioFocusManagementEnabled,
        @DefaultValue("1.0") float volume,
        @DefaultValue("250ms") Duration bufferingDelay) {}
