package com.ai.voiceagent.exception;

public class EmptyInputException extends AgentException {

    public EmptyInputException(String field) {
        super(ErrorCode.EMPTY_INPUT, field + " cannot be empty");
    }

    @Override
    public String getUserMessage() {
        return getMessage();
    }
}
