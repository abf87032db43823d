package com.sandkev.scrobbler.legacy;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum EventType {
    @JsonProperty("started") STARTED,
    @JsonProperty("completed") COMPLETED
}
