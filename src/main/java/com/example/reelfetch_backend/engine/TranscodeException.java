package com.example.reelfetch_backend.engine;

public class TranscodeException extends Exception {
    private final String processOutput;

    public TranscodeException(String message, String processOutput) {
        super(message);
        this.processOutput = processOutput;
    }

    public TranscodeException(String message, Throwable cause) {
        super(message, cause);
        this.processOutput = null;
    }

    public String getProcessOutput() {
        return processOutput;
    }
}
