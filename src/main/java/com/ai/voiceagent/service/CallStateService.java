package com.ai.voiceagent.service;

import com.ai.voiceagent.component.ResponsePhrases;
import com.ai.voiceagent.conversation.CallSession;
import com.ai.voiceagent.dto.VoiceInstruction;
import com.ai.voiceagent.dto.VoiceReply;
import com.ai.voiceagent.utils.CallDirection;
import com.ai.voiceagent.utils.ConversationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * Per-call state machine: GREETING → GATHERING → ENDED. Each webhook maps to one transition and
 * returns the instructions Twilio should execute next. Transitions never throw.
 */
@Service
public class CallStateService {

    private static final Logger log = LoggerFactory.getLogger(CallStateService.class);

    public static final String VOICE_PATH = "/twilio/voice";
    public static final String GATHER_PATH = "/twilio/gather";
    public static final String CONTINUE_PATH = "/twilio/continue-call";
    public static final String OUTBOUND_PATH = "/twilio/outbound";
    public static final String OUTBOUND_TIMEOUT_PATH = "/twilio/outbound-timeout";

    private static final Pattern TERMINATION = Pattern.compile("\\b(goodbye|bye|quit|exit|hang up)\\b");

    private final Map<String, CallSession> sessions = new ConcurrentHashMap<>();

    private final CompletionFallbackService completionFallbackService;
    private final ConversationStore conversationStore;
    private final ResponsePhrases phrases;
    private final Clock clock;

    @Value("${voice.call-session.idle-ttl:0s}")
    private Duration idleTtl = Duration.ZERO;

    public CallStateService(CompletionFallbackService completionFallbackService,
                            ConversationStore conversationStore,
                            ResponsePhrases phrases,
                            Clock clock) {
        this.completionFallbackService = completionFallbackService;
        this.conversationStore = conversationStore;
        this.phrases = phrases;
        this.clock = clock;
    }

    /**
     * A caller dialed in, or Twilio came back after the gather heard nothing. A first contact starts
     * a fresh history; a repeat visit re-greets without resetting anything.
     */
    public VoiceReply onIncomingCall(String callSid, String fromNumber) {
        return greet(callSid, fromNumber, CallDirection.INBOUND);
    }

    /** An outbound call was picked up. Silence on this call ends it instead of looping. */
    public VoiceReply onCallAnswered(String callSid) {
        return greet(callSid, null, CallDirection.OUTBOUND);
    }

    public VoiceReply onGatheredSpeech(String callSid, String speech) {
        CallSession session = getOrAdopt(callSid, CallDirection.INBOUND);
        synchronized (session) {
            if (session.isEnded()) {
                return endedReply(session);
            }
            String text = speech != null ? speech.trim() : "";
            Instant now = clock.instant();

            if (isTermination(text)) {
                String farewell = phrases.phoneFarewell();
                session.recordTurn(text, farewell, now);
                session.transition(ConversationState.ENDED, now);
                log.info("[{}] Caller ended the conversation -> hanging up", callSid);
                return reply(session, VoiceInstruction.say(farewell), VoiceInstruction.hangup());
            }

            String answer = completionFallbackService.respond(callSid, text);
            session.recordTurn(text, answer, clock.instant());
            session.transition(ConversationState.GATHERING, clock.instant());
            return reply(session,
                    VoiceInstruction.say(answer),
                    VoiceInstruction.gather(GATHER_PATH),
                    VoiceInstruction.say(phrases.anythingElse()),
                    VoiceInstruction.redirect(CONTINUE_PATH));
        }
    }

    /** Re-request input after the follow-up prompt went unanswered. Does not re-greet. */
    public VoiceReply onContinue(String callSid) {
        CallSession session = getOrAdopt(callSid, CallDirection.INBOUND);
        synchronized (session) {
            if (session.isEnded()) {
                return endedReply(session);
            }
            session.touch(clock.instant());
            return reply(session, VoiceInstruction.gather(GATHER_PATH), VoiceInstruction.redirect(CONTINUE_PATH));
        }
    }

    public VoiceReply onOutboundTimeout(String callSid) {
        CallSession session = getOrAdopt(callSid, CallDirection.OUTBOUND);
        synchronized (session) {
            session.transition(ConversationState.ENDED, clock.instant());
            log.info("[{}] No response on outbound call -> hanging up", callSid);
            return reply(session, VoiceInstruction.say(phrases.outboundNoResponse()), VoiceInstruction.hangup());
        }
    }

    /**
     * Last-resort instructions when a webhook failed internally, so the caller is never left on a
     * dead line.
     */
    public VoiceReply errorReply(String callSid) {
        CallSession session = callSid != null ? sessions.get(callSid) : null;
        if (session != null) {
            session.transition(ConversationState.ENDED, clock.instant());
        }
        return new VoiceReply(callSid, ConversationState.ENDED,
                List.of(VoiceInstruction.say(phrases.phoneApology()), VoiceInstruction.hangup()));
    }

    public Optional<CallSession> getSession(String callSid) {
        return callSid == null ? Optional.empty() : Optional.ofNullable(sessions.get(callSid));
    }

    public int getSessionCount() {
        return sessions.size();
    }

    public boolean isTermination(String speech) {
        return speech != null && TERMINATION.matcher(IntentClassifier.normalize(speech)).find();
    }

    /**
     * Drops sessions idle for longer than {@code voice.call-session.idle-ttl}. A zero TTL keeps
     * every session for the lifetime of the process.
     */
    @Scheduled(fixedDelayString = "${voice.call-session.eviction-interval-ms:60000}")
    public void evictIdleSessions() {
        if (idleTtl == null || idleTtl.isZero() || idleTtl.isNegative()) {
            return;
        }
        Instant cutoff = clock.instant().minus(idleTtl);
        int before = sessions.size();
        sessions.entrySet().removeIf(e -> {
            if (e.getValue().getLastActivityAt().isBefore(cutoff)) {
                conversationStore.reset(e.getKey());
                return true;
            }
            return false;
        });
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.info("Evicted {} idle call session(s)", evicted);
        }
    }

    void setIdleTtl(Duration idleTtl) {
        this.idleTtl = idleTtl;
    }

    private VoiceReply greet(String callSid, String fromNumber, CallDirection direction) {
        AtomicBoolean created = new AtomicBoolean(false);
        CallSession session = sessions.computeIfAbsent(callSid, id -> {
            created.set(true);
            return new CallSession(id, fromNumber, direction, clock.instant());
        });

        synchronized (session) {
            if (session.isEnded()) {
                return endedReply(session);
            }
            if (created.get()) {
                conversationStore.reset(callSid);
                log.info("[{}] {} call started | from={}", callSid, direction, fromNumber);
            } else {
                log.info("[{}] No input heard -> greeting again", callSid);
            }

            boolean outbound = session.getDirection() == CallDirection.OUTBOUND;
            String greeting = outbound ? phrases.outboundGreeting() : phrases.phoneGreeting();
            session.transition(ConversationState.GATHERING, clock.instant());
            if (outbound) {
                return reply(session,
                        VoiceInstruction.say(greeting),
                        VoiceInstruction.gather(GATHER_PATH),
                        VoiceInstruction.redirect(OUTBOUND_TIMEOUT_PATH));
            }
            return reply(session,
                    VoiceInstruction.say(greeting),
                    VoiceInstruction.gather(GATHER_PATH),
                    VoiceInstruction.say(phrases.didNotHearAnything()),
                    VoiceInstruction.redirect(VOICE_PATH));
        }
    }

    private CallSession getOrAdopt(String callSid, CallDirection direction) {
        return sessions.computeIfAbsent(callSid, id -> {
            log.info("[{}] Adopting unknown call session", id);
            CallSession adopted = new CallSession(id, null, direction, clock.instant());
            adopted.transition(ConversationState.GATHERING, clock.instant());
            return adopted;
        });
    }

    private VoiceReply endedReply(CallSession session) {
        return reply(session, VoiceInstruction.say(phrases.phoneFarewell()), VoiceInstruction.hangup());
    }

    private VoiceReply reply(CallSession session, VoiceInstruction... instructions) {
        return new VoiceReply(session.getCallSid(), session.getState(), List.of(instructions));
    }
}
