package com.ai.voiceagent.component;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.TargetDataLine;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Records one spoken phrase from the default input device as 16 kHz mono PCM WAV. Waits up to the
 * listen timeout for speech to start, then records until the phrase limit or a trailing pause.
 */
@Component
public class MicrophoneCapture {

    private static final Logger log = LoggerFactory.getLogger(MicrophoneCapture.class);

    private static final float SAMPLE_RATE = 16000f;
    private static final int CHUNK_MILLIS = 50;

    /** 16 kHz, 16-bit signed, mono, little-endian. */
    private static final AudioFormat PCM_FORMAT = new AudioFormat(SAMPLE_RATE, 16, 1, true, false);

    @Value("${stt.listen-timeout:5s}")
    private Duration listenTimeout;

    @Value("${stt.phrase-time-limit:5s}")
    private Duration phraseTimeLimit;

    @Value("${stt.pause-threshold:500ms}")
    private Duration pauseThreshold;

    @Value("${stt.energy-threshold:3000}")
    private int energyThreshold;

    public boolean isMicrophoneAvailable() {
        try {
            return AudioSystem.isLineSupported(new DataLine.Info(TargetDataLine.class, PCM_FORMAT));
        } catch (RuntimeException e) {
            return false;
        }
    }

    /**
     * @return WAV bytes of the captured phrase, or empty when no speech started before the timeout
     * @throws LineUnavailableException if the microphone cannot be opened
     * @throws IOException if the recording cannot be encoded
     */
    public Optional<byte[]> capturePhrase() throws LineUnavailableException, IOException {
        int bytesPerChunk = (int) (SAMPLE_RATE * 2 * CHUNK_MILLIS / 1000);
        byte[] chunk = new byte[bytesPerChunk];
        ByteArrayOutputStream pcm = new ByteArrayOutputStream();

        TargetDataLine line = AudioSystem.getTargetDataLine(PCM_FORMAT);
        try {
            line.open(PCM_FORMAT);
            line.start();
            log.info("Listening...");

            long waitedMillis = 0;
            long recordedMillis = 0;
            long silentMillis = 0;
            boolean speaking = false;

            while (true) {
                int read = line.read(chunk, 0, chunk.length);
                if (read <= 0) {
                    break;
                }
                boolean loud = rms(chunk, read) >= energyThreshold;

                if (!speaking) {
                    waitedMillis += CHUNK_MILLIS;
                    if (loud) {
                        speaking = true;
                    } else if (waitedMillis >= listenTimeout.toMillis()) {
                        return Optional.empty();
                    } else {
                        continue;
                    }
                }

                pcm.write(chunk, 0, read);
                recordedMillis += CHUNK_MILLIS;
                silentMillis = loud ? 0 : silentMillis + CHUNK_MILLIS;
                if (recordedMillis >= phraseTimeLimit.toMillis() || silentMillis >= pauseThreshold.toMillis()) {
                    break;
                }
            }
        } finally {
            line.stop();
            line.close();
        }

        if (pcm.size() == 0) {
            return Optional.empty();
        }
        return Optional.of(toWav(pcm.toByteArray()));
    }

    static byte[] toWav(byte[] pcm) throws IOException {
        long frames = pcm.length / PCM_FORMAT.getFrameSize();
        try (
                AudioInputStream stream = new AudioInputStream(new ByteArrayInputStream(pcm), PCM_FORMAT, frames);
                ByteArrayOutputStream wav = new ByteArrayOutputStream()
        ) {
            AudioSystem.write(stream, AudioFileFormat.Type.WAVE, wav);
            return wav.toByteArray();
        }
    }

    static double rms(byte[] buffer, int length) {
        int samples = length / 2;
        if (samples == 0) return 0;
        double sum = 0;
        for (int i = 0; i + 1 < length; i += 2) {
            int sample = (short) ((buffer[i + 1] << 8) | (buffer[i] & 0xff));
            sum += (double) sample * sample;
        }
        return Math.sqrt(sum / samples);
    }
}
