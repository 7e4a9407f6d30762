package io.github.drompincen.mockjira.protocol.api;

public record TransitionRequest(TransitionRef transition) {

    public record TransitionRef(String id) {}

    public String transitionId() {
        return transition != null ? transition.id() : null;
    }
}
