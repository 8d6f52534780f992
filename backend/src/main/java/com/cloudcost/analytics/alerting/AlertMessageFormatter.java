package com.cloudcost.analytics.alerting;

import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders alert content for the email and chat channels.
 */
@Component
public class AlertMessageFormatter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'");

    public String toHtml(AlertMessage message) {
        String metadata = message.metadata().entrySet().stream()
                .map(e -> String.format("<p><strong>%s:</strong> %s</p>",
                        HtmlUtils.htmlEscape(e.getKey()), HtmlUtils.htmlEscape(e.getValue())))
                .collect(Collectors.joining());

        return String.format("""
                <div style="font-family: Arial, sans-serif; max-width: 600px; margin: 0 auto;">
                  <h2 style="color: %s;">%s</h2>
                  <p>%s</p>
                  %s
                  <p style="color: #666; font-size: 12px;">Sent on %s</p>
                </div>
                """,
                message.severity().getDisplayColor(),
                HtmlUtils.htmlEscape(message.title()),
                HtmlUtils.htmlEscape(message.body()),
                metadata,
                formatTimestamp(message));
    }

    /**
     * Slack Block Kit blocks: header, message section and a severity/timestamp context line.
     */
    public List<Map<String, Object>> toChatBlocks(AlertMessage message) {
        return List.of(
                Map.of("type", "header",
                        "text", Map.of("type", "plain_text", "text", message.title())),
                Map.of("type", "section",
                        "text", Map.of("type", "mrkdwn", "text", message.body())),
                Map.of("type", "context",
                        "elements", List.of(
                                Map.of("type", "mrkdwn", "text", "Severity: " + message.severity().name()),
                                Map.of("type", "mrkdwn", "text", "Sent on " + formatTimestamp(message))
                        ))
        );
    }

    private String formatTimestamp(AlertMessage message) {
        return message.createdAt() == null ? "" : TIMESTAMP.format(message.createdAt());
    }
}
