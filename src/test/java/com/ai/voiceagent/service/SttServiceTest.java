package com.ai.voiceagent.service;

import com.ai.voiceagent.component.MicrophoneCapture;
import com.ai.voiceagent.conversation.TranscriptionResult;
import com.ai.voiceagent.exception.ErrorCode;
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

import javax.sound.sampled.LineUnavailableException;
import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withUnauthorizedRequest;

@ExtendWith(MockitoExtension.class)
class SttServiceTest {

    private static final String URL = "https://stt.example.com/audio/transcriptions";
    private static final byte[] WAV = {82, 73, 70, 70, 0, 0, 0, 0};

    @Mock
    private MicrophoneCapture microphone;

    private MockServerRestTemplateCustomizer customizer;
    private SttService service;

    @BeforeEach
    void setUp() {
        customizer = new MockServerRestTemplateCustomizer();
        service = new SttService(new RestTemplateBuilder(customizer), microphone);
        ReflectionTestUtils.setField(service, "apiKey", "stt-key");
        ReflectionTestUtils.setField(service, "url", URL);
        ReflectionTestUtils.setField(service, "model", "whisper-large-v3");
        ReflectionTestUtils.setField(service, "connectTimeout", Duration.ofSeconds(10));
        ReflectionTestUtils.setField(service, "readTimeout", Duration.ofSeconds(30));
        ReflectionTestUtils.setField(service, "maxRetries", 2);
        service.init();
    }

    @Test
    void recognizedTextIsReturned() {
        customizer.getServer().expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer stt-key"))
                .andRespond(withSuccess("{\"text\":\" what time is it \"}", MediaType.APPLICATION_JSON));

        TranscriptionResult result = service.transcribe(WAV);

        assertThat(result.isRecognized()).isTrue();
        assertThat(result.getText()).isEqualTo("what time is it");
    }

    @Test
    void emptyTranscriptIsUnintelligible() {
        customizer.getServer().expect(requestTo(URL))
                .andRespond(withSuccess("{\"text\":\"\"}", MediaType.APPLICATION_JSON));

        assertThat(service.transcribe(WAV).getError()).isEqualTo(ErrorCode.UNINTELLIGIBLE_AUDIO);
    }

    @Test
    void rejectedKeyIsABackendError() {
        customizer.getServer().expect(requestTo(URL)).andRespond(withUnauthorizedRequest());

        assertThat(service.transcribe(WAV).getError()).isEqualTo(ErrorCode.RECOGNITION_BACKEND_ERROR);
    }

    @Test
    void silenceIsNoAudio() throws Exception {
        when(microphone.isMicrophoneAvailable()).thenReturn(true);
        when(microphone.capturePhrase()).thenReturn(Optional.empty());

        assertThat(service.transcribe().getError()).isEqualTo(ErrorCode.NO_AUDIO_DETECTED);
    }

    @Test
    void missingMicrophoneIsABackendError() throws Exception {
        when(microphone.isMicrophoneAvailable()).thenReturn(false);

        assertThat(service.transcribe().getError()).isEqualTo(ErrorCode.RECOGNITION_BACKEND_ERROR);
        verify(microphone, never()).capturePhrase();
    }

    @Test
    void busyMicrophoneIsABackendError() throws Exception {
        when(microphone.isMicrophoneAvailable()).thenReturn(true);
        when(microphone.capturePhrase()).thenThrow(new LineUnavailableException("line in use"));

        assertThat(service.transcribe().getError()).isEqualTo(ErrorCode.RECOGNITION_BACKEND_ERROR);
    }

    @Test
    void missingKeySkipsTheMicrophone() throws Exception {
        ReflectionTestUtils.setField(service, "apiKey", "");

        assertThat(service.isAvailable()).isFalse();
        assertThat(service.transcribe().getError()).isEqualTo(ErrorCode.RECOGNITION_BACKEND_ERROR);
        verify(microphone, never()).capturePhrase();
    }
}
