package server.rpc.dto;

public record PlaySound(String soundId) {}
