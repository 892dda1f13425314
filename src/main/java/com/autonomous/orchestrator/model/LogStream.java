package com.autonomous.orchestrator.model;

public enum LogStream {
    STDOUT("stdout"),
    STDERR("stderr"),
    ORCHESTRATOR("orchestrator");

    private final String fileName;

    LogStream(String fileName) {
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }

    public static LogStream fromName(String name) {
        for (LogStream stream : values()) {
            if (stream.fileName.equalsIgnoreCase(name) || stream.name().equalsIgnoreCase(name)) {
                return stream;
            }
        }
        throw new IllegalArgumentException("Unknown log stream: " + name);
    }
}
