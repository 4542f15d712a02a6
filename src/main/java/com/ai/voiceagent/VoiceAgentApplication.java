package com.ai.voiceagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VoiceAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceAgentApplication.class, args);
    }
}
