package com.browserswarm.orchestration.api;

@FunctionalInterface
public interface SwarmEventListener {

    SwarmEventListener NONE = (type, payload) -> { };

    void onEvent(String type, Object payload);
}
