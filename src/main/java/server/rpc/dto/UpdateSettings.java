package server.rpc.dto;

/** Settings to change; {@code null} fields are left as they are. */
public record UpdateSettings(
        Long fadeInMillis,
        Long fadeOutMillis,
        Boolean premiumSegmentsEnabled,
        String audioBitrate,
        Boolean alarmAudioStream,
        Boolean audioFocusManagementEnabled) {}
