package server.rpc.dto;

import playback.SoundPlayerManager;

public record PlaybackStateChanged(SoundPlayerManager.State state) {}
