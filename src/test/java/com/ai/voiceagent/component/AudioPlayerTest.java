package com.ai.voiceagent.component;

import com.ai.voiceagent.exception.SynthesisException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioPlayerTest {

    @Test
    void playbackWaitIsBoundedByClipLength() {
        assertThat(AudioPlayer.playbackTimeoutMillis(3_000_000)).isEqualTo(5000);
        assertThat(AudioPlayer.playbackTimeoutMillis(-1)).isEqualTo(2000);
    }

    @Test
    void emptyAudioIsRejected() {
        AudioPlayer player = new AudioPlayer();

        assertThatThrownBy(() -> player.play(new byte[0])).isInstanceOf(SynthesisException.class);
        assertThatThrownBy(() -> player.play(null)).isInstanceOf(SynthesisException.class);
    }
}
