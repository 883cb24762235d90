package com.xbleey.marketreport.notify;

import com.xbleey.marketreport.config.NotificationProperties;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Properties;

/**
 * Plain text report mail over an SMTPS session.
 */
public class SmtpEmailChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(SmtpEmailChannel.class);

    private final NotificationProperties.Email properties;
    private final JavaMailSender mailSender;

    public SmtpEmailChannel(NotificationProperties.Email properties, JavaMailSender mailSender) {
        this.properties = properties;
        this.mailSender = mailSender;
    }

    public static JavaMailSenderImpl mailSenderFor(NotificationProperties.Email properties, Duration timeout) {
        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setProtocol("smtps");
        sender.setHost(properties.getSmtpServer());
        sender.setPort(properties.getSmtpPort());
        sender.setUsername(properties.getUsername());
        sender.setPassword(properties.getPassword());
        sender.setDefaultEncoding(StandardCharsets.UTF_8.name());
        String timeoutMillis = Long.toString(timeout.toMillis());
        Properties javaMail = new Properties();
        javaMail.put("mail.smtps.auth", "true");
        javaMail.put("mail.smtps.connectiontimeout", timeoutMillis);
        javaMail.put("mail.smtps.timeout", timeoutMillis);
        javaMail.put("mail.smtps.writetimeout", timeoutMillis);
        sender.setJavaMailProperties(javaMail);
        return sender;
    }

    @Override
    public String name() {
        return "email";
    }

    @Override
    public boolean isConfigured() {
        return hasText(properties.getSmtpServer())
                && hasText(properties.getUsername())
                && hasText(properties.getPassword())
                && hasText(properties.resolvedFromEmail())
                && hasText(properties.getToEmail());
    }

    @Override
    public boolean send(String title, String content) {
        if (!isConfigured() || mailSender == null) {
            log.warn("Skip email notification: smtp configuration incomplete");
            return false;
        }
        try {
            MimeMessage mimeMessage = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, false, StandardCharsets.UTF_8.name());
            helper.setFrom(properties.resolvedFromEmail().trim());
            helper.setTo(recipients());
            helper.setSubject(title);
            helper.setText(content, false);
            mailSender.send(mimeMessage);
            log.info("email notification sent to {}", properties.getToEmail());
            return true;
        } catch (Exception ex) {
            log.warn("email notification failed", ex);
            return false;
        }
    }

    private String[] recipients() {
        return Arrays.stream(properties.getToEmail().split("[,;]"))
                .map(String::trim)
                .filter(address -> !address.isEmpty())
                .toArray(String[]::new);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
