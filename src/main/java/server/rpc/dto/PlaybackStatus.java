package server.rpc.dto;

import playback.SoundPlayerManager;

public record PlaybackStatus(SoundPlayerManager.State state, float volume) {}
