package personal.clinic.appointment.scheduling.application.port.out;

import personal.clinic.appointment.scheduling.domain.model.ConfirmationNotice;
import personal.clinic.appointment.scheduling.domain.model.NotificationStatus;

/**
 * Notification Sender (Output Port)
 * 예약 확정 알림 발송
 */
public interface NotificationSender {

    /**
     * 확정 알림 발송
     *
     * @return SENT, 수신자/발송 수단이 없으면 SKIPPED, 실패 시 FAILED
     */
    NotificationStatus sendConfirmation(ConfirmationNotice notice);
}
