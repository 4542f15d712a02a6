package com.ai.voiceagent.conversation;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * One exchange on a phone call: what the caller said and what the agent answered.
 */
@Getter
@ToString
@AllArgsConstructor
public final class CallTurn {

    private final String user;
    private final String agent;
}
