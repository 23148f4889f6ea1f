package com.synapse.x.dto.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthState {
    OK("ok"),
    DEGRADED("degraded"),
    DOWN("down");

    private final String wireValue;

    HealthState(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
