package server.rpc.dto;

import java.util.Map;

public record CurrentPreset(Map<String, Float> sounds) {}
