package com.ai.voiceagent.controller;

import com.ai.voiceagent.dto.CallRequest;
import com.ai.voiceagent.dto.CallResponse;
import com.ai.voiceagent.service.CallStateService;
import com.ai.voiceagent.service.ConversationOrchestrator;
import com.ai.voiceagent.service.TwilioService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Twilio voice webhooks. Every webhook answers with TwiML, even when handling fails internally.
 */
@RestController
@RequestMapping("/twilio")
public class VoiceController {

    private static final Logger log = LoggerFactory.getLogger(VoiceController.class);

    private static final String UNKNOWN_CALL_PREFIX = "unknown-";

    private final ConversationOrchestrator orchestrator;
    private final TwilioService twilioService;

    public VoiceController(ConversationOrchestrator orchestrator, TwilioService twilioService) {
        this.orchestrator = orchestrator;
        this.twilioService = twilioService;
    }

    @RequestMapping(value = "/voice", method = {RequestMethod.GET, RequestMethod.POST}, produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> incoming(@RequestParam(required = false) Map<String, String> params) {
        String callSid = callSid(params);
        String from = param(params, "From");
        log.info("Incoming call | callSid={} from={}", callSid, from);
        return ResponseEntity.ok(orchestrator.incomingCall(callSid, from));
    }

    @RequestMapping(value = "/gather", method = {RequestMethod.GET, RequestMethod.POST}, produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> gather(@RequestParam(required = false) Map<String, String> params) {
        return ResponseEntity.ok(orchestrator.gatheredSpeech(callSid(params), param(params, "SpeechResult")));
    }

    /**
     * After the agent has spoken and the follow-up prompt went unanswered: listen again without
     * replaying the greeting.
     */
    @RequestMapping(value = "/continue-call", method = {RequestMethod.GET, RequestMethod.POST}, produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> continueCall(@RequestParam(required = false) Map<String, String> params) {
        return ResponseEntity.ok(orchestrator.continueCall(callSid(params)));
    }

    @RequestMapping(value = "/outbound", method = {RequestMethod.GET, RequestMethod.POST}, produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> outbound(@RequestParam(required = false) Map<String, String> params) {
        String callSid = callSid(params);
        log.info("Outbound call answered | callSid={}", callSid);
        return ResponseEntity.ok(orchestrator.outboundAnswered(callSid));
    }

    @RequestMapping(value = "/outbound-timeout", method = {RequestMethod.GET, RequestMethod.POST}, produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> outboundTimeout(@RequestParam(required = false) Map<String, String> params) {
        return ResponseEntity.ok(orchestrator.outboundTimeout(callSid(params)));
    }

    @PostMapping(value = "/call", consumes = MediaType.APPLICATION_JSON_VALUE)
    public CallResponse call(@RequestBody CallRequest request) {
        return orchestrator.placeCall(request.getToNumber());
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("client_configured", twilioService.isConfigured());
        status.put("phone_number", twilioService.getPhoneNumber());
        status.put("webhook_url", twilioService.webhookUrl(CallStateService.VOICE_PATH));
        return status;
    }

    /** Requests without a CallSid each get a throwaway id. */
    private static String callSid(Map<String, String> params) {
        String sid = param(params, "CallSid");
        if (StringUtils.hasText(sid)) {
            return sid;
        }
        String generated = UNKNOWN_CALL_PREFIX + UUID.randomUUID();
        log.warn("Webhook without CallSid; using {}", generated);
        return generated;
    }

    private static String param(Map<String, String> params, String name) {
        return params != null ? params.getOrDefault(name, "") : "";
    }
}
