package server.rpc.dto;

import java.util.Map;

/** Sound ids mapped to their volumes. */
public record PlayPreset(Map<String, Float> sounds) {}
