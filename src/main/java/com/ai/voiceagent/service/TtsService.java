package com.ai.voiceagent.service;

import com.ai.voiceagent.component.AudioPlayer;
import com.ai.voiceagent.exception.SynthesisException;
import jakarta.annotation.PostConstruct;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Text-to-speech: renders text with an OpenAI-compatible speech endpoint and plays it locally.
 */
@Service
public class TtsService {

    private static final Logger log = LoggerFactory.getLogger(TtsService.class);

    private final RestTemplateBuilder builder;
    private final AudioPlayer audioPlayer;

    private RestTemplate restTemplate;

    @Value("${tts.api-key:${OPENAI_API_KEY:}}")
    private String apiKey;

    @Value("${tts.url:https://api.openai.com/v1/audio/speech}")
    private String url;

    @Value("${tts.model:tts-1}")
    private String model;

    @Value("${tts.voice:alloy}")
    private String voice;

    @Value("${tts.speed:1.0}")
    private double speed;

    @Value("${tts.read-timeout:30s}")
    private Duration readTimeout;

    public TtsService(RestTemplateBuilder builder, AudioPlayer audioPlayer) {
        this.builder = builder;
        this.audioPlayer = audioPlayer;
    }

    @PostConstruct
    void init() {
        this.restTemplate = builder.setReadTimeout(readTimeout).build();
    }

    public boolean isAvailable() {
        return StringUtils.isNotBlank(apiKey);
    }

    /**
     * Speak {@code text} aloud.
     *
     * @return true once playback finished; false on blank text or any synthesis failure
     */
    public boolean speak(String text) {
        if (StringUtils.isBlank(text)) {
            return false;
        }
        try {
            byte[] audio = synthesize(text);
            audioPlayer.play(audio);
            log.info("Spoke: {}", text);
            return true;
        } catch (SynthesisException e) {
            log.error("Speak error: {}", e.getMessage(), e);
            return false;
        }
    }

    byte[] synthesize(String text) {
        if (!isAvailable()) {
            throw new SynthesisException("Text-to-speech API key is not set");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey.trim());
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.ALL));

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("voice", voice);
        body.put("input", text);
        body.put("response_format", "wav");
        body.put("speed", speed);

        try {
            ResponseEntity<byte[]> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), byte[].class);
            byte[] audio = response.getBody();
            if (audio == null || audio.length == 0) {
                throw new SynthesisException("Speech endpoint returned no audio");
            }
            return audio;
        } catch (RestClientException e) {
            throw new SynthesisException("Speech request failed", e);
        }
    }
}
