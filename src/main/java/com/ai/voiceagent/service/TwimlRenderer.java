package com.ai.voiceagent.service;

import com.ai.voiceagent.dto.VoiceInstruction;
import com.ai.voiceagent.dto.VoiceReply;
import com.twilio.http.HttpMethod;
import com.twilio.twiml.TwiMLException;
import com.twilio.twiml.VoiceResponse;
import com.twilio.twiml.voice.Gather;
import com.twilio.twiml.voice.Hangup;
import com.twilio.twiml.voice.Redirect;
import com.twilio.twiml.voice.Say;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Renders state machine instructions as TwiML. Callback paths are made absolute with
 * {@code twilio.base-url} when it is set; otherwise Twilio resolves them against the webhook URL.
 */
@Service
public class TwimlRenderer {

    private static final Logger log = LoggerFactory.getLogger(TwimlRenderer.class);

    /** Minimal valid document used if the builder ever fails. */
    public static final String FALLBACK_TWIML = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<Response><Say>Sorry, something went wrong. Goodbye!</Say><Hangup/></Response>";

    @Value("${twilio.base-url:}")
    private String baseUrl;

    @Value("${twilio.voice:Polly.Joanna}")
    private String voice;

    @Value("${twilio.language:en-US}")
    private String language;

    public String render(VoiceReply reply) {
        VoiceResponse.Builder response = new VoiceResponse.Builder();
        for (VoiceInstruction instruction : reply.getInstructions()) {
            switch (instruction.getType()) {
                case SAY:
                    response.say(say(instruction.getText()));
                    break;
                case GATHER:
                    response.gather(new Gather.Builder()
                            .inputs(Gather.Input.SPEECH)
                            .action(absolute(instruction.getPath()))
                            .method(HttpMethod.POST)
                            .speechTimeout("auto")
                            .language(gatherLanguage())
                            .build());
                    break;
                case REDIRECT:
                    response.redirect(new Redirect.Builder(absolute(instruction.getPath()))
                            .method(HttpMethod.POST)
                            .build());
                    break;
                case HANGUP:
                    response.hangup(new Hangup.Builder().build());
                    break;
                default:
                    break;
            }
        }
        try {
            return response.build().toXml();
        } catch (TwiMLException e) {
            log.error("[{}] Failed to render TwiML", reply.getCallSid(), e);
            return FALLBACK_TWIML;
        }
    }

    String absolute(String path) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return path;
        }
        return baseUrl.trim().replaceAll("/$", "") + path;
    }

    void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    private Say say(String text) {
        return new Say.Builder(text)
                .voice(resolve(voice, Say.Voice.values(), Say.Voice.POLLY_JOANNA))
                .language(resolve(language, Say.Language.values(), Say.Language.EN_US))
                .build();
    }

    private Gather.Language gatherLanguage() {
        return resolve(language, Gather.Language.values(), Gather.Language.EN_US);
    }

    /** TwiML enums render as their attribute value, e.g. {@code Polly.Joanna} or {@code en-US}. */
    static <E extends Enum<E>> E resolve(String configured, E[] values, E fallback) {
        if (configured == null || configured.isBlank()) {
            return fallback;
        }
        String wanted = configured.trim();
        for (E value : values) {
            if (value.toString().equalsIgnoreCase(wanted)) {
                return value;
            }
        }
        log.warn("Unsupported TwiML setting '{}', using {}", wanted, fallback);
        return fallback;
    }
}
