package com.ai.voiceagent.conversation;

import com.ai.voiceagent.utils.TurnRole;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
public final class ConversationTurn {

    private final TurnRole role;
    private final String content;

    public ConversationTurn(TurnRole role, String content) {
        this.role = role;
        this.content = content != null ? content : "";
    }

    public static ConversationTurn user(String content) {
        return new ConversationTurn(TurnRole.USER, content);
    }

    public static ConversationTurn agent(String content) {
        return new ConversationTurn(TurnRole.AGENT, content);
    }
}
