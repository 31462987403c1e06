package com.macrointel.ingest.alert;

import com.macrointel.ingest.config.MacroIngestProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Sends alerts and digests over SMTP using Spring's {@link JavaMailSender}.
 * The sender is optional: without {@code spring.mail.host} no bean exists and delivery fails softly.
 */
@Slf4j
@Component
public class EmailAlertHandler implements AlertHandler {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final MacroIngestProperties.Alerts.Email config;
    private final DigestFormatter formatter;

    public EmailAlertHandler(ObjectProvider<JavaMailSender> mailSender,
                             MacroIngestProperties properties,
                             DigestFormatter formatter) {
        this.mailSender = mailSender;
        this.config = properties.getAlerts().getEmail();
        this.formatter = formatter;
    }

    @Override
    public String name() {
        return "email";
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public boolean sendAlert(Alert alert) {
        if (!config.isEnabled()) {
            log.debug("Email handler disabled, skipping alert {}", alert.getRuleName());
            return true;
        }
        String subject = config.getSubjectPrefix() + " [" + alert.getSeverity().name() + "] " + alert.getRuleName();
        boolean sent = send(subject, formatter.formatAlert(alert), formatter.formatAlertHtml(alert));
        if (sent) log.info("Alert email sent: {}", alert.getRuleName());
        return sent;
    }

    @Override
    public boolean sendDigest(List<Alert> alerts, DigestSummary summary) {
        if (!config.isEnabled()) {
            log.debug("Email handler disabled, skipping digest");
            return true;
        }
        if (alerts.isEmpty()) {
            log.debug("No alerts to send in digest");
            return true;
        }
        String subject = config.getSubjectPrefix() + " Daily Digest " + summary.date() + " - " + alerts.size() + " Alerts";
        boolean sent = send(subject,
                formatter.formatDigest(alerts, summary),
                formatter.formatDigestHtml(alerts, summary));
        if (sent) log.info("Daily digest sent with {} alerts", alerts.size());
        return sent;
    }

    private boolean send(String subject, String text, String html) {
        List<String> recipients = config.getToAddresses();
        if (recipients == null || recipients.isEmpty()) {
            log.warn("No email recipients configured");
            return false;
        }
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            log.warn("Email alerts enabled but no mail sender is configured (spring.mail.host)");
            return false;
        }

        try {
            MimeMessage message = sender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
            helper.setFrom(config.getFromAddress());
            helper.setTo(recipients.toArray(String[]::new));
            helper.setSubject(subject);
            helper.setText(text, html);
            sender.send(message);
            return true;
        } catch (MessagingException | MailException e) {
            log.error("Failed to send email '{}': {}", subject, e.getMessage());
            return false;
        }
    }
}
