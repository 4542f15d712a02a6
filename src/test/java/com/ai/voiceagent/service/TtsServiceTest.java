package com.ai.voiceagent.service;

import com.ai.voiceagent.component.AudioPlayer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@ExtendWith(MockitoExtension.class)
class TtsServiceTest {

    private static final String URL = "https://tts.example.com/audio/speech";

    @Mock
    private AudioPlayer audioPlayer;

    private MockServerRestTemplateCustomizer customizer;
    private TtsService service;

    @BeforeEach
    void setUp() {
        customizer = new MockServerRestTemplateCustomizer();
        service = new TtsService(new RestTemplateBuilder(customizer), audioPlayer);
        ReflectionTestUtils.setField(service, "apiKey", "tts-key");
        ReflectionTestUtils.setField(service, "url", URL);
        ReflectionTestUtils.setField(service, "model", "tts-1");
        ReflectionTestUtils.setField(service, "voice", "alloy");
        ReflectionTestUtils.setField(service, "speed", 1.0);
        ReflectionTestUtils.setField(service, "readTimeout", Duration.ofSeconds(30));
        service.init();
    }

    @Test
    void synthesizedAudioIsPlayed() {
        byte[] audio = {1, 2, 3, 4};
        customizer.getServer().expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.input").value("Hello there"))
                .andExpect(jsonPath("$.response_format").value("wav"))
                .andRespond(withSuccess(audio, MediaType.parseMediaType("audio/wav")));

        assertThat(service.speak("Hello there")).isTrue();
        verify(audioPlayer).play(audio);
    }

    @Test
    void backendFailureIsReportedAsNotSpoken() {
        customizer.getServer().expect(requestTo(URL)).andRespond(withServerError());

        assertThat(service.speak("Hello there")).isFalse();
        verify(audioPlayer, never()).play(any());
    }

    @Test
    void blankTextIsNotSpoken() {
        assertThat(service.speak("  ")).isFalse();
        verify(audioPlayer, never()).play(any());
    }

    @Test
    void missingKeyIsReportedAsNotSpoken() {
        ReflectionTestUtils.setField(service, "apiKey", null);

        assertThat(service.isAvailable()).isFalse();
        assertThat(service.speak("Hello there")).isFalse();
    }
}
