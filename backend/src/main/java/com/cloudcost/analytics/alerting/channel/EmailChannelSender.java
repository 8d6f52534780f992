package com.cloudcost.analytics.alerting.channel;

import com.cloudcost.analytics.alerting.AlertMessage;
import com.cloudcost.analytics.alerting.AlertMessageFormatter;
import com.cloudcost.analytics.alerting.ChannelSender;
import com.cloudcost.analytics.domain.model.NotificationChannel;
import com.cloudcost.analytics.error.DeliveryException;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * Sends alerts as multipart (plain text + HTML) email over SMTP.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmailChannelSender implements ChannelSender {

    private final JavaMailSender mailSender;
    private final AlertMessageFormatter formatter;

    @Value("${analytics.alerting.email.from:alerts@cloudcost-analytics.local}")
    private String fromAddress = "alerts@cloudcost-analytics.local";

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.EMAIL;
    }

    @Override
    public void send(String target, AlertMessage message) {
        try {
            MimeMessage mime = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mime, true, "UTF-8");
            helper.setFrom(fromAddress);
            helper.setTo(target);
            helper.setSubject(message.title());
            helper.setText(message.body(), formatter.toHtml(message));

            mailSender.send(mime);
            log.info("Alert email sent to {} for alert {}", target, message.alertId());
        } catch (MessagingException | MailException e) {
            throw new DeliveryException(channel(), "Failed to send alert email to " + target, e);
        }
    }
}
