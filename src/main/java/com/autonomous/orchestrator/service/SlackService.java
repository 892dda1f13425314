package com.autonomous.orchestrator.service;

import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Thin wrapper over the Slack Web API for posting messages.
 */
@Slf4j
@Service
public class SlackService {

    @Value("${slack.bot.token:}")
    private String slackBotToken;

    private final Slack slack = Slack.getInstance();

    public boolean isConfigured() {
        return slackBotToken != null && !slackBotToken.isBlank();
    }

    /**
     * Posts a message to a channel and returns the message timestamp,
     * which can be used to start a thread.
     */
    public String postMessage(String channel, String message) {
        return post(ChatPostMessageRequest.builder()
            .channel(channel)
            .text(message)
            .build());
    }

    /**
     * Posts a message as a reply in an existing thread.
     */
    public String postMessageInThread(String channel, String threadTs, String message) {
        return post(ChatPostMessageRequest.builder()
            .channel(channel)
            .threadTs(threadTs)
            .text(message)
            .build());
    }

    private String post(ChatPostMessageRequest request) {
        try {
            MethodsClient methods = slack.methods(slackBotToken);
            ChatPostMessageResponse response = methods.chatPostMessage(request);

            if (!response.isOk()) {
                throw new IllegalStateException("Slack rejected message to " + request.getChannel()
                    + ": " + response.getError());
            }
            return response.getTs();
        } catch (IOException e) {
            throw new UncheckedIOException("Slack unreachable", e);
        } catch (SlackApiException e) {
            throw new IllegalStateException("Slack API error: " + e.getMessage(), e);
        }
    }
}
