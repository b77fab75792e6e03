package personal.clinic.appointment.scheduling.domain.model;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * 외부 캘린더에 생성할 진료 일정
 *
 * @param attendeeEmails 참석자 이메일 (의사, 환자)
 */
public record CalendarEvent(
        String summary,
        String description,
        OffsetDateTime start,
        OffsetDateTime end,
        String timeZone,
        List<String> attendeeEmails) {

    public CalendarEvent {
        attendeeEmails = attendeeEmails == null ? List.of() : List.copyOf(attendeeEmails);
    }
}
