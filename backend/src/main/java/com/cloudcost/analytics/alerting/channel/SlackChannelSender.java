package com.cloudcost.analytics.alerting.channel;

import com.cloudcost.analytics.alerting.AlertMessage;
import com.cloudcost.analytics.alerting.AlertMessageFormatter;
import com.cloudcost.analytics.alerting.ChannelSender;
import com.cloudcost.analytics.domain.model.NotificationChannel;
import com.cloudcost.analytics.error.DeliveryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Posts alerts to a Slack channel through the {@code chat.postMessage} Web API.
 *
 * Slack answers HTTP 200 even for rejected messages; {@code "ok": false} in the body
 * is treated as a delivery failure.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlackChannelSender implements ChannelSender {

    private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final AlertMessageFormatter formatter;

    @Value("${analytics.alerting.slack.token:}")
    private String botToken = "";

    @Value("${analytics.alerting.slack.api-url:https://slack.com/api/chat.postMessage}")
    private String apiUrl = "https://slack.com/api/chat.postMessage";

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.CHAT;
    }

    @Override
    public void send(String target, AlertMessage message) {
        if (botToken == null || botToken.isBlank()) {
            throw new DeliveryException(channel(), "Slack bot token is not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(botToken);
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> payload = Map.of(
                "channel", target,
                "text", message.body(),
                "blocks", formatter.toChatBlocks(message)
        );

        Map<String, Object> response;
        try {
            response = restTemplate.exchange(apiUrl, HttpMethod.POST, new HttpEntity<>(payload, headers), RESPONSE_TYPE)
                    .getBody();
        } catch (RestClientException e) {
            throw new DeliveryException(channel(), "Slack API call failed for channel " + target, e);
        }

        if (response == null || !Boolean.TRUE.equals(response.get("ok"))) {
            Object error = response == null ? "empty response" : response.get("error");
            throw new DeliveryException(channel(), "Slack rejected message for channel " + target + ": " + error);
        }
        log.info("Slack message posted to {} for alert {}", target, message.alertId());
    }
}
