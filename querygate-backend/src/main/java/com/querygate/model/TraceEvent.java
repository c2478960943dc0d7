package com.querygate.model;

import lombok.Value;

@Value
public class TraceEvent {
    String name;
    double durationMillis;
    String text;

    public TraceEvent(String name, double durationMillis) {
        this(name, durationMillis, null);
    }

    public TraceEvent(String name, double durationMillis, String text) {
        this.name = name;
        this.durationMillis = durationMillis;
        this.text = text;
    }
}
