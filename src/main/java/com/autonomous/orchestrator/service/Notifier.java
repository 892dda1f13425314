package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.ChatContext;

/**
 * Delivers a message to the chat conversation a session was requested from.
 */
public interface Notifier {

    void send(ChatContext context, String message);
}
