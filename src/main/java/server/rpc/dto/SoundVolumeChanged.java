package server.rpc.dto;

public record SoundVolumeChanged(String soundId, float volume) {}
