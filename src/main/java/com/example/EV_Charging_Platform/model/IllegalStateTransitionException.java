package com.example.EV_Charging_Platform.model;

public class IllegalStateTransitionException extends IllegalStateException {

    private final Session.State from;
    private final Session.State to;

    public IllegalStateTransitionException(String sessionId, Session.State from, Session.State to) {
        super(String.format("Session %s cannot move from %s to %s", sessionId, from, to));
        this.from = from;
        this.to = to;
    }

    public Session.State getFrom() { return from; }
    public Session.State getTo() { return to; }
}
