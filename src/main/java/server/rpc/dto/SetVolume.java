package server.rpc.dto;

public record SetVolume(float volume) {}
