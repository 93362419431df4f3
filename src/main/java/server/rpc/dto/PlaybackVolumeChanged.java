package server.rpc.dto;

public record PlaybackVolumeChanged(float volume) {}
