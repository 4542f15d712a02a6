package com.ai.voiceagent.service;

import java.util.List;

/**
 * Picks one reply template among several variants.
 */
@FunctionalInterface
public interface TemplateSelector {

    String choose(List<String> variants);
}
