package com.ai.voiceagent.service;

import com.ai.voiceagent.component.MicrophoneCapture;
import com.ai.voiceagent.conversation.TranscriptionResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import javax.sound.sampled.LineUnavailableException;
import java.time.Duration;
import java.util.Optional;

/**
 * Speech-to-text: captures one phrase from the microphone and transcribes it with a
 * Whisper-compatible endpoint. Failures come back as a {@link TranscriptionResult}, never as an
 * exception.
 */
@Service
public class SttService {

    private static final Logger log = LoggerFactory.getLogger(SttService.class);

    private final RestTemplateBuilder builder;
    private final MicrophoneCapture microphone;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private RestTemplate restTemplate;

    @Value("${stt.api-key:${completion.api-key:${GROQ_API_KEY:}}}")
    private String apiKey;

    @Value("${stt.url:https://api.groq.com/openai/v1/audio/transcriptions}")
    private String url;

    @Value("${stt.model:whisper-large-v3}")
    private String model;

    @Value("${stt.connect-timeout:10s}")
    private Duration connectTimeout;

    @Value("${stt.read-timeout:30s}")
    private Duration readTimeout;

    @Value("${stt.max-retries:2}")
    private int maxRetries;

    public SttService(RestTemplateBuilder builder, MicrophoneCapture microphone) {
        this.builder = builder;
        this.microphone = microphone;
    }

    @PostConstruct
    void init() {
        this.restTemplate = builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }

    public boolean isAvailable() {
        return StringUtils.isNotBlank(apiKey);
    }

    public TranscriptionResult transcribe() {
        if (!isAvailable()) {
            log.error("Speech-to-text API key is not set");
            return TranscriptionResult.backendError();
        }

        if (!microphone.isMicrophoneAvailable()) {
            log.error("No microphone line supports 16 kHz mono capture");
            return TranscriptionResult.backendError();
        }

        Optional<byte[]> audio;
        try {
            audio = microphone.capturePhrase();
        } catch (LineUnavailableException e) {
            log.error("Microphone unavailable", e);
            return TranscriptionResult.backendError();
        } catch (Exception e) {
            log.error("Audio capture failed", e);
            return TranscriptionResult.backendError();
        }

        if (audio.isEmpty()) {
            log.warn("No audio detected");
            return TranscriptionResult.noAudio();
        }
        return transcribe(audio.get());
    }

    /**
     * Transcribe a WAV recording.
     */
    public TranscriptionResult transcribe(byte[] wavAudio) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setBearerAuth(apiKey.trim());
            headers.setContentType(MediaType.MULTIPART_FORM_DATA);

            MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
            form.add("model", model);
            form.add("response_format", "json");
            form.add("file", new ByteArrayResource(wavAudio) {
                @Override
                public String getFilename() {
                    return "audio.wav";
                }
            });

            HttpEntity<MultiValueMap<String, Object>> request = new HttpEntity<>(form, headers);

            ResponseEntity<String> response = null;
            for (int attempt = 1; attempt <= Math.max(1, maxRetries); attempt++) {
                try {
                    response = restTemplate.postForEntity(url, request, String.class);
                    break;
                } catch (ResourceAccessException e) {
                    if (attempt >= maxRetries) {
                        throw e;
                    }
                    log.warn("STT attempt {}/{} failed, retrying: {}", attempt, maxRetries, e.getMessage());
                }
            }
            if (response == null) {
                return TranscriptionResult.backendError();
            }

            JsonNode node = objectMapper.readTree(response.getBody());
            String text = node.path("text").asText("").trim();
            if (text.isEmpty()) {
                log.warn("Could not understand audio");
                return TranscriptionResult.unintelligible();
            }
            log.info("Recognized: {}", text);
            return TranscriptionResult.recognized(text);

        } catch (HttpClientErrorException.Unauthorized e) {
            log.error("Speech-to-text API returned 401 Unauthorized. Check stt.api-key");
            return TranscriptionResult.backendError();
        } catch (Exception ex) {
            log.error("Failed to transcribe audio", ex);
            return TranscriptionResult.backendError();
        }
    }
}
