package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.model.ChatContext;
import com.autonomous.orchestrator.service.CommandService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/slack")
public class SlackController {

    @Autowired
    private CommandService commandService;

    @PostMapping("/slash-commands")
    public ResponseEntity<?> handleSlashCommand(@RequestParam Map<String, String> params) {
        String command = params.getOrDefault("command", "");
        String[] args = splitArgs(params.getOrDefault("text", ""));
        String userId = params.get("user_id");
        String channelId = params.get("channel_id");

        log.debug("Slash command {} from {} in {}", command, userId, channelId);

        String response = switch (command) {
            case "/sprint-run" -> handleRun(args, userId, channelId);
            case "/sprint-status" -> commandService.status(arg(args, 0));
            case "/sprint-resume" -> args.length >= 1
                ? commandService.resume(args[0]) : usage("/sprint-resume <session-id>");
            case "/sprint-abort" -> args.length >= 1
                ? commandService.abort(args[0]) : usage("/sprint-abort <session-id>");
            case "/sprint-projects" -> commandService.projects();
            case "/sprint-history" -> commandService.history(arg(args, 0));
            case "/sprint-logs" -> handleLogs(args);
            case "/sprint-help" -> commandService.help();
            default -> "Unknown command: " + command + "\n\n" + commandService.help();
        };

        return ResponseEntity.ok(Map.of(
            "response_type", "in_channel",
            "text", response
        ));
    }

    private String handleRun(String[] args, String userId, String channelId) {
        if (args.length < 2) {
            return usage("/sprint-run <project> <sprint> [branch]");
        }
        ChatContext context = ChatContext.builder()
            .platform("slack")
            .channelId(channelId)
            .userId(userId)
            .build();
        return commandService.run(args[0], normalizeUnit(args[1]), arg(args, 2), userId, context);
    }

    private String handleLogs(String[] args) {
        if (args.length < 1) {
            return usage("/sprint-logs <session-id> [lines]");
        }
        Integer lines = null;
        if (args.length > 1) {
            try {
                lines = Integer.parseInt(args[1]);
            } catch (NumberFormatException e) {
                return usage("/sprint-logs <session-id> [lines]");
            }
        }
        return commandService.logs(args[0], lines);
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }

    // "sprint-3" and "3" name the same unit.
    static String normalizeUnit(String unit) {
        return unit.toLowerCase().startsWith("sprint-") ? unit.substring("sprint-".length()) : unit;
    }

    private static String usage(String syntax) {
        return "Usage: `" + syntax + "`";
    }

    private static String arg(String[] args, int index) {
        return args.length > index ? args[index] : null;
    }

    private static String[] splitArgs(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
    }
}
