package com.universe.manager.commandcenter.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AlertPriority {
    @JsonProperty("Critical") CRITICAL,
    @JsonProperty("High") HIGH,
    @JsonProperty("Medium") MEDIUM,
    @JsonProperty("Low") LOW,
    @JsonProperty("Info") INFO
}
