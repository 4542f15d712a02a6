package com.ai.voiceagent.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class TextInput {

    private String text;

    /** Optional chat session; requests without one share the default session. */
    @JsonProperty("session_id")
    private String sessionId;
}
