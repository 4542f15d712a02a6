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
public class CallResponse {

    private String status;

    private String message;

    @JsonProperty("call_sid")
    private String callSid;
}
