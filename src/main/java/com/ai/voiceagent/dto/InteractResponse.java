package com.ai.voiceagent.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InteractResponse {

    private String status;

    @JsonProperty("user_input")
    private String userInput;

    @JsonProperty("agent_reply")
    private String agentReply;

    private boolean spoken;
}
