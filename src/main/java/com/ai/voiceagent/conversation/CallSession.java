package com.ai.voiceagent.conversation;

import com.ai.voiceagent.utils.CallDirection;
import com.ai.voiceagent.utils.ConversationState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-call state owned by the call state machine. Mutators are synchronized so that webhooks for
 * the same call are applied one at a time.
 */
public class CallSession {

    private final String callSid;
    private final String fromNumber;
    private final CallDirection direction;
    private final Instant createdAt;
    private final List<CallTurn> turns = new ArrayList<>();

    private ConversationState state = ConversationState.GREETING;
    private Instant lastActivityAt;

    public CallSession(String callSid, String fromNumber, CallDirection direction, Instant now) {
        this.callSid = callSid;
        this.fromNumber = fromNumber;
        this.direction = direction != null ? direction : CallDirection.INBOUND;
        this.createdAt = now;
        this.lastActivityAt = now;
    }

    public String getCallSid() {
        return callSid;
    }

    public String getFromNumber() {
        return fromNumber;
    }

    public CallDirection getDirection() {
        return direction;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized ConversationState getState() {
        return state;
    }

    public synchronized boolean isEnded() {
        return state == ConversationState.ENDED;
    }

    public synchronized Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public synchronized List<CallTurn> getTurns() {
        return Collections.unmodifiableList(new ArrayList<>(turns));
    }

    /**
     * Moves to the given state. ENDED is terminal: once reached, later transitions are ignored.
     *
     * @return true if the state was changed
     */
    public synchronized boolean transition(ConversationState newState, Instant now) {
        lastActivityAt = now;
        if (state == ConversationState.ENDED) {
            return false;
        }
        state = newState;
        return true;
    }

    public synchronized void recordTurn(String userText, String agentText, Instant now) {
        turns.add(new CallTurn(userText, agentText));
        lastActivityAt = now;
    }

    public synchronized void touch(Instant now) {
        lastActivityAt = now;
    }
}
