package com.ai.voiceagent.component;

import com.ai.voiceagent.exception.SynthesisException;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.Clip;
import javax.sound.sampled.LineEvent;
import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Plays WAV audio on the default output device and blocks until playback finishes.
 */
@Component
public class AudioPlayer {

    private static final long PLAYBACK_MARGIN_MILLIS = 2000;

    public void play(byte[] wavAudio) {
        if (wavAudio == null || wavAudio.length == 0) {
            throw new SynthesisException("No audio to play");
        }
        CountDownLatch done = new CountDownLatch(1);
        try (AudioInputStream stream = AudioSystem.getAudioInputStream(new BufferedInputStream(new ByteArrayInputStream(wavAudio)));
             Clip clip = AudioSystem.getClip()) {
            clip.addLineListener(event -> {
                if (event.getType() == LineEvent.Type.STOP) {
                    done.countDown();
                }
            });
            clip.open(stream);
            clip.start();
            long timeoutMillis = playbackTimeoutMillis(clip.getMicrosecondLength());
            if (!done.await(timeoutMillis, TimeUnit.MILLISECONDS)) {
                clip.stop();
                throw new SynthesisException("Playback did not finish within " + timeoutMillis + " ms");
            }
        } catch (SynthesisException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SynthesisException("Playback interrupted", e);
        } catch (Exception e) {
            throw new SynthesisException("Audio playback failed", e);
        }
    }

    /** Clip length plus a fixed margin; clips of unknown length get the margin only. */
    static long playbackTimeoutMillis(long clipMicros) {
        return Math.max(0, clipMicros) / 1000 + PLAYBACK_MARGIN_MILLIS;
    }
}
