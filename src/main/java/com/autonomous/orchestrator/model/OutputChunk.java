package com.autonomous.orchestrator.model;

import lombok.Value;

@Value
public class OutputChunk {
    LogStream stream;
    String text;

    public static OutputChunk stdout(String text) {
        return new OutputChunk(LogStream.STDOUT, text);
    }

    public static OutputChunk stderr(String text) {
        return new OutputChunk(LogStream.STDERR, text);
    }
}
