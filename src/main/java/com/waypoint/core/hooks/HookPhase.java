package com.waypoint.core.hooks;

public enum HookPhase {
    PRE("pre"),
    POST("post");

    private final String prefix;

    HookPhase(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
