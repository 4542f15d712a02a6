package com.ai.voiceagent.dto;

import com.ai.voiceagent.utils.ConversationState;

import java.util.Collections;
import java.util.List;

/**
 * Instructions for one webhook response plus the call state after the transition.
 */
public final class VoiceReply {

    private final String callSid;
    private final ConversationState state;
    private final List<VoiceInstruction> instructions;

    public VoiceReply(String callSid, ConversationState state, List<VoiceInstruction> instructions) {
        this.callSid = callSid;
        this.state = state;
        this.instructions = instructions == null ? Collections.emptyList() : List.copyOf(instructions);
    }

    public String getCallSid() {
        return callSid;
    }

    public ConversationState getState() {
        return state;
    }

    public List<VoiceInstruction> getInstructions() {
        return instructions;
    }

    public boolean endsCall() {
        return instructions.stream().anyMatch(i -> i.getType() == VoiceInstruction.Type.HANGUP);
    }
}
