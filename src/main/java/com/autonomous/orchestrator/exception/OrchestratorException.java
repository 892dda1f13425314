package com.autonomous.orchestrator.exception;

import lombok.Getter;

@Getter
public class OrchestratorException extends RuntimeException {

    private final ErrorCode code;
    private final String details;

    public OrchestratorException(ErrorCode code) {
        this(code, null, null);
    }

    public OrchestratorException(ErrorCode code, String details) {
        this(code, details, null);
    }

    public OrchestratorException(ErrorCode code, String details, Throwable cause) {
        super(details != null ? code.getMessage() + ": " + details : code.getMessage(), cause);
        this.code = code;
        this.details = details;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }

    public String toUserMessage() {
        StringBuilder msg = new StringBuilder();
        msg.append("*Error ").append(code.name()).append("*: ").append(code.getMessage());
        if (details != null && !details.isBlank()) {
            msg.append("\n\n").append(details);
        }
        msg.append("\n\n_Hint_: ").append(code.getHint());
        return msg.toString();
    }
}
