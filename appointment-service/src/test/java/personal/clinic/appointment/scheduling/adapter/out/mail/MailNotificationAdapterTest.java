package personal.clinic.appointment.scheduling.adapter.out.mail;

import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import personal.clinic.appointment.scheduling.domain.model.ConfirmationNotice;
import personal.clinic.appointment.scheduling.domain.model.NotificationStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("MailNotificationAdapter 단위 테스트")
class MailNotificationAdapterTest {

    @Mock
    private ObjectProvider<JavaMailSender> mailSenderProvider;
    @Mock
    private JavaMailSender mailSender;

    private NotificationProperties properties;
    private MailNotificationAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new NotificationProperties();
        properties.setFromAddress("clinic@example.com");
        adapter = new MailNotificationAdapter(mailSenderProvider, properties);
    }

    @Test
    @DisplayName("확정 메일을 보내고 SENT를 반환한다")
    void sendConfirmation_Sent() throws Exception {
        // given
        given(mailSenderProvider.getIfAvailable()).willReturn(mailSender);
        given(mailSender.createMimeMessage()).willReturn(new MimeMessage(Session.getInstance(new Properties())));

        // when
        NotificationStatus status = adapter.sendConfirmation(notice("ravi@example.com"));

        // then
        assertThat(status).isEqualTo(NotificationStatus.SENT);
        ArgumentCaptor<MimeMessage> sent = ArgumentCaptor.forClass(MimeMessage.class);
        verify(mailSender).send(sent.capture());
        assertThat(sent.getValue().getSubject()).isEqualTo("Appointment Confirmed: Dr. Anjali Mehta on 2030-01-07");
        assertThat(sent.getValue().getAllRecipients()[0].toString()).isEqualTo("ravi@example.com");
    }

    @Test
    @DisplayName("수신자 이메일이 없으면 SKIPPED")
    void sendConfirmation_NoRecipient() {
        // when
        NotificationStatus status = adapter.sendConfirmation(notice(null));

        // then
        assertThat(status).isEqualTo(NotificationStatus.SKIPPED);
        verifyNoInteractions(mailSenderProvider);
    }

    @Test
    @DisplayName("메일 서버 설정이 없으면 SKIPPED")
    void sendConfirmation_NoMailSender() {
        // given
        given(mailSenderProvider.getIfAvailable()).willReturn(null);

        // when & then
        assertThat(adapter.sendConfirmation(notice("ravi@example.com"))).isEqualTo(NotificationStatus.SKIPPED);
    }

    @Test
    @DisplayName("전송 실패 시 FAILED를 반환하고 예외를 던지지 않는다")
    void sendConfirmation_Failed() {
        // given
        given(mailSenderProvider.getIfAvailable()).willReturn(mailSender);
        given(mailSender.createMimeMessage()).willReturn(new MimeMessage(Session.getInstance(new Properties())));
        willThrow(new MailSendException("SMTP unavailable")).given(mailSender).send(any(MimeMessage.class));

        // when & then
        assertThat(adapter.sendConfirmation(notice("ravi@example.com"))).isEqualTo(NotificationStatus.FAILED);
    }

    @Test
    @DisplayName("본문에 예약 정보를 담고 HTML은 이스케이프한다")
    void bodiesContainAppointmentDetails() {
        // given
        ConfirmationNotice notice = notice("ravi@example.com");

        // when
        String plain = MailNotificationAdapter.plainBody(notice);
        String html = MailNotificationAdapter.htmlBody(notice);

        // then
        assertThat(plain).contains("A-12345678", "09:00 AM - 09:30 AM", "Cardiology", "800");
        assertThat(html).contains("<td>A-12345678</td>", "chest pain &amp; fatigue");
    }

    private static ConfirmationNotice notice(String recipient) {
        return new ConfirmationNotice(recipient, "A-12345678", "Ravi Kumar", "Anjali Mehta", "Cardiology",
                LocalDate.of(2030, 1, 7), "09:00 AM - 09:30 AM", "In-Person", "chest pain & fatigue",
                new BigDecimal("800"), null);
    }
}
