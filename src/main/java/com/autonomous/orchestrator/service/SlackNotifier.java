package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.ChatContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Posts into the requesting Slack thread, or the channel when the request
 * did not come from a thread.
 */
@Slf4j
@Service
public class SlackNotifier implements Notifier {

    private final SlackService slackService;

    public SlackNotifier(SlackService slackService) {
        this.slackService = slackService;
    }

    @Override
    public void send(ChatContext context, String message) {
        if (!slackService.isConfigured()) {
            log.debug("No Slack token, dropping message for {}", context.getChannelId());
            return;
        }
        if (context.getThreadTs() != null) {
            slackService.postMessageInThread(context.getChannelId(), context.getThreadTs(), message);
        } else {
            slackService.postMessage(context.getChannelId(), message);
        }
    }
}
