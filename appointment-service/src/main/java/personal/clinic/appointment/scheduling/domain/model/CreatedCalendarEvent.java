package personal.clinic.appointment.scheduling.domain.model;

/**
 * 캘린더 이벤트 생성 결과
 *
 * @param eventId  외부 이벤트 ID
 * @param htmlLink 캘린더에서 일정을 여는 링크 (없을 수 있음)
 */
public record CreatedCalendarEvent(String eventId, String htmlLink) {
}
