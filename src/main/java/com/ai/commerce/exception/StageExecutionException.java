package com.ai.commerce.exception;

public class StageExecutionException extends RuntimeException {

    private final String stage;

    public StageExecutionException(String stage, Throwable cause) {
        super("System error in " + stage, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
