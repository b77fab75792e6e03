package personal.clinic.appointment.scheduling.adapter.out.mail;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;
import personal.clinic.appointment.scheduling.application.port.out.NotificationSender;
import personal.clinic.appointment.scheduling.domain.model.ConfirmationNotice;
import personal.clinic.appointment.scheduling.domain.model.NotificationStatus;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

/**
 * Mail Notification Adapter
 * JavaMailSender로 예약 확정 메일을 보낸다 (text + HTML).
 * <p>
 * spring.mail.host 설정이 없으면 JavaMailSender Bean이 없으므로 SKIPPED로 처리한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MailNotificationAdapter implements NotificationSender {

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final NotificationProperties properties;

    @Override
    public NotificationStatus sendConfirmation(ConfirmationNotice notice) {
        if (notice.recipient() == null || notice.recipient().isBlank()) {
            log.debug("No recipient email, skipping: reservationId={}", notice.reservationId());
            return NotificationStatus.SKIPPED;
        }

        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (!properties.isEnabled() || mailSender == null) {
            log.warn("Mail transport not configured, skipping: reservationId={}", notice.reservationId());
            return NotificationStatus.SKIPPED;
        }

        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
            helper.setFrom(properties.getFromAddress());
            helper.setTo(notice.recipient());
            helper.setSubject(subject(notice));
            helper.setText(plainBody(notice), htmlBody(notice));

            mailSender.send(message);
            log.info("Confirmation mail sent: reservationId={}, recipient={}",
                    notice.reservationId(), notice.recipient());
            return NotificationStatus.SENT;

        } catch (MessagingException | MailException e) {
            log.error("Confirmation mail failed: reservationId={}", notice.reservationId(), e);
            return NotificationStatus.FAILED;
        }
    }

    static String subject(ConfirmationNotice notice) {
        return String.format("Appointment Confirmed: Dr. %s on %s", notice.doctorName(), notice.date());
    }

    static String plainBody(ConfirmationNotice notice) {
        StringBuilder body = new StringBuilder()
                .append("Dear ").append(notice.patientName()).append(",\n\n")
                .append("Your appointment has been confirmed.\n\n")
                .append("Appointment ID : ").append(notice.reservationId()).append('\n')
                .append("Doctor         : Dr. ").append(notice.doctorName()).append('\n')
                .append("Specialty      : ").append(orDash(notice.specialty())).append('\n')
                .append("Date           : ").append(notice.date()).append('\n')
                .append("Time           : ").append(notice.timeLabel()).append('\n')
                .append("Type           : ").append(notice.appointmentType()).append('\n')
                .append("Reason         : ").append(notice.reason()).append('\n')
                .append("Fee            : ").append(fee(notice.consultationFee())).append('\n');
        if (notice.calendarLink() != null) {
            body.append("Calendar       : ").append(notice.calendarLink()).append('\n');
        }
        return body.append('\n')
                .append("Please arrive 10 minutes early. You will receive a reminder 24 hours before.\n")
                .toString();
    }

    static String htmlBody(ConfirmationNotice notice) {
        StringBuilder html = new StringBuilder()
                .append("<h2>Appointment Confirmed</h2>")
                .append("<p>Dear ").append(escape(notice.patientName())).append(",</p>")
                .append("<table cellpadding=\"4\" style=\"font-family:Arial,Helvetica,sans-serif;\">")
                .append(row("Appointment ID", notice.reservationId()))
                .append(row("Doctor", "Dr. " + notice.doctorName()))
                .append(row("Specialty", orDash(notice.specialty())))
                .append(row("Date", notice.date().toString()))
                .append(row("Time", notice.timeLabel()))
                .append(row("Type", notice.appointmentType()))
                .append(row("Reason", notice.reason()))
                .append(row("Fee", fee(notice.consultationFee())))
                .append("</table>");
        if (notice.calendarLink() != null) {
            html.append("<p><a href=\"").append(escape(notice.calendarLink())).append("\">View in calendar</a></p>");
        }
        return html.append("<p>Please arrive 10 minutes early. You will receive a reminder 24 hours before.</p>")
                .toString();
    }

    private static String row(String label, String value) {
        return "<tr><td><strong>" + label + "</strong></td><td>" + escape(value) + "</td></tr>";
    }

    private static String escape(String value) {
        return HtmlUtils.htmlEscape(orDash(value));
    }

    private static String fee(BigDecimal fee) {
        return fee == null ? "-" : fee.toPlainString();
    }

    private static String orDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}
