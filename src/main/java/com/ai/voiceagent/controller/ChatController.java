package com.ai.voiceagent.controller;

import com.ai.voiceagent.dto.AudioResponse;
import com.ai.voiceagent.dto.ChatResponse;
import com.ai.voiceagent.dto.InteractResponse;
import com.ai.voiceagent.dto.StatusResponse;
import com.ai.voiceagent.dto.TextInput;
import com.ai.voiceagent.service.ConversationOrchestrator;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Web chat and local speech endpoints. Blank text is answered with the canned
 * "didn't catch that" reply rather than an error.
 */
@RestController
public class ChatController {

    private final ConversationOrchestrator orchestrator;

    public ChatController(ConversationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/chat")
    public ChatResponse chat(@RequestBody TextInput request) {
        return orchestrator.chat(request.getSessionId(), request.getText());
    }

    @PostMapping("/process")
    public ChatResponse process(@RequestBody TextInput request) {
        return orchestrator.chat(request.getSessionId(), request.getText());
    }

    @PostMapping("/interact")
    public InteractResponse interact(@RequestBody TextInput request) {
        return orchestrator.interact(request.getSessionId(), request.getText());
    }

    @PostMapping("/speak")
    public StatusResponse speak(@RequestBody TextInput request) {
        return orchestrator.speak(request.getText());
    }

    @PostMapping("/listen")
    public AudioResponse listen() {
        return orchestrator.listen();
    }

    @PostMapping("/reset")
    public StatusResponse reset(@RequestBody(required = false) TextInput request) {
        return orchestrator.reset(request != null ? request.getSessionId() : null);
    }
}
