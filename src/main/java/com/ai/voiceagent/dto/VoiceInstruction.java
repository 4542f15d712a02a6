package com.ai.voiceagent.dto;

import java.util.Objects;

/**
 * One telephony instruction emitted by the call state machine. Transport-neutral; rendered to TwiML
 * by the webhook layer.
 */
public final class VoiceInstruction {

    public enum Type {
        SAY,
        GATHER,
        REDIRECT,
        HANGUP
    }

    private final Type type;
    private final String text;
    private final String path;

    private VoiceInstruction(Type type, String text, String path) {
        this.type = type;
        this.text = text;
        this.path = path;
    }

    public static VoiceInstruction say(String text) {
        return new VoiceInstruction(Type.SAY, text, null);
    }

    /** Request speech input; the result is posted to {@code actionPath}. */
    public static VoiceInstruction gather(String actionPath) {
        return new VoiceInstruction(Type.GATHER, null, actionPath);
    }

    public static VoiceInstruction redirect(String path) {
        return new VoiceInstruction(Type.REDIRECT, null, path);
    }

    public static VoiceInstruction hangup() {
        return new VoiceInstruction(Type.HANGUP, null, null);
    }

    public Type getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public String getPath() {
        return path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VoiceInstruction)) return false;
        VoiceInstruction that = (VoiceInstruction) o;
        return type == that.type && Objects.equals(text, that.text) && Objects.equals(path, that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, path);
    }

    @Override
    public String toString() {
        switch (type) {
            case SAY: return "Say(" + text + ")";
            case GATHER: return "Gather(" + path + ")";
            case REDIRECT: return "Redirect(" + path + ")";
            default: return "Hangup";
        }
    }
}
