package com.ai.voiceagent.service;

import com.ai.voiceagent.conversation.TranscriptionResult;
import com.ai.voiceagent.dto.AudioResponse;
import com.ai.voiceagent.dto.CallResponse;
import com.ai.voiceagent.dto.ChatResponse;
import com.ai.voiceagent.dto.InteractResponse;
import com.ai.voiceagent.dto.StatusResponse;
import com.ai.voiceagent.dto.VoiceReply;
import com.ai.voiceagent.exception.EmptyInputException;
import com.ai.voiceagent.exception.ErrorCode;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Single entry point for both the web API and the Twilio webhooks. Web chat goes straight to the
 * fallback chain; phone traffic goes through the call state machine. Slow speech I/O runs on the
 * agent worker pool and is awaited here.
 */
@Service
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    public static final String DEFAULT_SESSION = "default";

    private final CompletionFallbackService completionFallbackService;
    private final ConversationStore conversationStore;
    private final CallStateService callStateService;
    private final TwimlRenderer twimlRenderer;
    private final TwilioService twilioService;
    private final SttService sttService;
    private final TtsService ttsService;
    private final CompletionClient completionClient;
    private final Executor executor;
    private final Duration speechTimeout;

    public ConversationOrchestrator(CompletionFallbackService completionFallbackService,
                                    ConversationStore conversationStore,
                                    CallStateService callStateService,
                                    TwimlRenderer twimlRenderer,
                                    TwilioService twilioService,
                                    SttService sttService,
                                    TtsService ttsService,
                                    CompletionClient completionClient,
                                    @Qualifier("agentTaskExecutor") Executor executor,
                                    @Value("${agent.speech.timeout:60s}") Duration speechTimeout) {
        this.completionFallbackService = completionFallbackService;
        this.conversationStore = conversationStore;
        this.callStateService = callStateService;
        this.twimlRenderer = twimlRenderer;
        this.twilioService = twilioService;
        this.sttService = sttService;
        this.ttsService = ttsService;
        this.completionClient = completionClient;
        this.executor = executor;
        this.speechTimeout = speechTimeout;
    }

    // ---- web ----

    public ChatResponse chat(String sessionId, String text) {
        String input = text != null ? text : "";
        String reply = completionFallbackService.respond(session(sessionId), input);
        return ChatResponse.builder()
                .userInput(input)
                .agentReply(StringUtils.isNotBlank(reply) ? reply : "I couldn't generate a response")
                .status("success")
                .build();
    }

    public InteractResponse interact(String sessionId, String text) {
        ChatResponse chat = chat(sessionId, text);
        boolean spoken = runOnWorker(() -> ttsService.speak(chat.getAgentReply()), ex -> false);
        return InteractResponse.builder()
                .status("success")
                .userInput(chat.getUserInput())
                .agentReply(chat.getAgentReply())
                .spoken(spoken)
                .build();
    }

    public StatusResponse speak(String text) {
        if (StringUtils.isBlank(text)) {
            return StatusResponse.error("Text cannot be empty", ErrorCode.EMPTY_INPUT.getDefaultMessage());
        }
        boolean spoken = runOnWorker(() -> ttsService.speak(text), ex -> false);
        return spoken
                ? StatusResponse.success("Text spoken successfully")
                : StatusResponse.error("TTS failed", ErrorCode.SYNTHESIS_ERROR.getDefaultMessage());
    }

    public AudioResponse listen() {
        TranscriptionResult result = runOnWorker(sttService::transcribe, ex -> TranscriptionResult.backendError());
        if (result.isRecognized()) {
            return AudioResponse.builder().status("success").recognizedText(result.getText()).build();
        }
        return AudioResponse.builder().status("error").error(result.getError().getDefaultMessage()).build();
    }

    public StatusResponse reset(String sessionId) {
        conversationStore.reset(session(sessionId));
        return StatusResponse.success("Conversation reset");
    }

    public Map<String, Boolean> features() {
        Map<String, Boolean> features = new LinkedHashMap<>();
        features.put("completion_ai", completionClient.isAvailable());
        features.put("twilio", twilioService.isConfigured());
        features.put("speech_recognition", sttService.isAvailable());
        features.put("text_to_speech", ttsService.isAvailable());
        return features;
    }

    public int activeCalls() {
        return callStateService.getSessionCount();
    }

    // ---- telephony ----

    public String incomingCall(String callSid, String fromNumber) {
        return handleWebhook(callSid, "incoming", () -> callStateService.onIncomingCall(callSid, fromNumber));
    }

    public String gatheredSpeech(String callSid, String speech) {
        log.info("[{}] Caller said: {}", callSid, speech);
        return handleWebhook(callSid, "gather", () -> callStateService.onGatheredSpeech(callSid, speech));
    }

    public String continueCall(String callSid) {
        return handleWebhook(callSid, "continue", () -> callStateService.onContinue(callSid));
    }

    public String outboundAnswered(String callSid) {
        return handleWebhook(callSid, "outbound", () -> callStateService.onCallAnswered(callSid));
    }

    public String outboundTimeout(String callSid) {
        return handleWebhook(callSid, "outbound-timeout", () -> callStateService.onOutboundTimeout(callSid));
    }

    public CallResponse placeCall(String toNumber) {
        if (StringUtils.isBlank(toNumber)) {
            throw new EmptyInputException("Phone number");
        }
        String callSid = twilioService.placeCall(toNumber.trim(), CallStateService.OUTBOUND_PATH);
        return CallResponse.builder()
                .status("success")
                .message("Call initiated to " + toNumber.trim())
                .callSid(callSid)
                .build();
    }

    private String handleWebhook(String callSid, String event, Supplier<VoiceReply> transition) {
        VoiceReply reply;
        try {
            reply = transition.get();
        } catch (RuntimeException e) {
            log.error("[{}] {} webhook failed; sending apology", callSid, event, e);
            reply = callStateService.errorReply(callSid);
        }
        log.debug("[{}] {} -> {} {}", callSid, event, reply.getState(), reply.getInstructions());
        try {
            return twimlRenderer.render(reply);
        } catch (RuntimeException e) {
            log.error("[{}] Failed to render {} reply", callSid, event, e);
            return TwimlRenderer.FALLBACK_TWIML;
        }
    }

    private <T> T runOnWorker(Supplier<T> task, Function<Throwable, T> onFailure) {
        CompletableFuture<T> future = null;
        try {
            future = CompletableFuture.supplyAsync(task, executor);
            return future.get(speechTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Worker task did not finish within {} ms", speechTimeout.toMillis());
            return onFailure.apply(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return onFailure.apply(e);
        } catch (ExecutionException e) {
            log.error("Worker task failed", e.getCause());
            return onFailure.apply(e.getCause());
        } catch (RuntimeException e) {
            log.error("Worker task could not be scheduled", e);
            return onFailure.apply(e);
        }
    }

    private static String session(String sessionId) {
        return StringUtils.isNotBlank(sessionId) ? sessionId.trim() : DEFAULT_SESSION;
    }
}
