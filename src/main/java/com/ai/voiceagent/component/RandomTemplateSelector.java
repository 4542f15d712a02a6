package com.ai.voiceagent.component;

import com.ai.voiceagent.service.TemplateSelector;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/** Uniform random choice among variants. */
@Component
public class RandomTemplateSelector implements TemplateSelector {

    @Override
    public String choose(List<String> variants) {
        if (variants == null || variants.isEmpty()) {
            return "";
        }
        return variants.get(ThreadLocalRandom.current().nextInt(variants.size()));
    }
}
