package com.ai.voiceagent.controller;

import com.ai.voiceagent.dto.HealthResponse;
import com.ai.voiceagent.service.ConversationOrchestrator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final ConversationOrchestrator orchestrator;

    @Value("${agent.name:Aria}")
    private String agentName = "Aria";

    @Value("${agent.version:2.0.0}")
    private String version = "2.0.0";

    public HealthController(ConversationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/")
    public HealthResponse root() {
        return HealthResponse.builder()
                .status("success")
                .message(agentName + " Voice Agent API is running")
                .version(version)
                .build();
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return HealthResponse.builder()
                .status("healthy")
                .service(agentName + " Voice Agent")
                .version(version)
                .features(orchestrator.features())
                .activeCalls(orchestrator.activeCalls())
                .build();
    }

    @GetMapping("/info")
    public Map<String, Object> info() {
        Map<String, String> web = new LinkedHashMap<>();
        web.put("GET /", "Health check");
        web.put("GET /health", "Feature status");
        web.put("POST /chat", "Chat with the agent");
        web.put("POST /process", "Chat with the agent");
        web.put("POST /interact", "Chat and speak the reply");
        web.put("POST /listen", "Speech recognition");
        web.put("POST /speak", "Text-to-speech");
        web.put("POST /reset", "Reset a chat session");

        Map<String, String> phone = new LinkedHashMap<>();
        phone.put("POST /twilio/voice", "Handle incoming calls");
        phone.put("POST /twilio/gather", "Process speech input");
        phone.put("POST /twilio/continue-call", "Keep listening");
        phone.put("POST /twilio/call", "Make outbound call");
        phone.put("POST /twilio/outbound", "Outbound call answered");

        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("Web API", web);
        endpoints.put("Twilio Phone", phone);

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", agentName + " Voice Agent API");
        info.put("version", version);
        info.put("description", "Voice agent with Twilio phone integration");
        info.put("endpoints", endpoints);
        return info;
    }
}
