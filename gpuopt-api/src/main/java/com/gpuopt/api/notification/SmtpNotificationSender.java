package com.gpuopt.api.notification;

import com.gpuopt.application.ports.NotificationSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.Objects;

/**
 * Plain-text email delivery through Spring's {@link JavaMailSender}.
 * Failures propagate; the dispatcher logs them.
 */
public class SmtpNotificationSender implements NotificationSender {

  private static final Logger log = LoggerFactory.getLogger(SmtpNotificationSender.class);

  private final JavaMailSender mailSender;
  private final String from;

  public SmtpNotificationSender(JavaMailSender mailSender, String from) {
    this.mailSender = Objects.requireNonNull(mailSender, "mailSender");
    this.from = Objects.requireNonNull(from, "from");
  }

  @Override
  public void send(String to, String subject, String body) {
    SimpleMailMessage message = new SimpleMailMessage();
    message.setFrom(from);
    message.setTo(to);
    message.setSubject(subject);
    message.setText(body);
    mailSender.send(message);
    log.info("Email sent: to={} subject={}", to, subject);
  }
}
