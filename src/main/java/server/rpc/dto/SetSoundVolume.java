package server.rpc.dto;

public record SetSoundVolume(String soundId, float volume) {}
