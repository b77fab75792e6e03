package personal.clinic.appointment.scheduling.application.port.out;

import personal.clinic.appointment.scheduling.domain.model.CalendarEvent;
import personal.clinic.appointment.scheduling.domain.model.CreatedCalendarEvent;
import personal.clinic.appointment.scheduling.domain.model.TimeInterval;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Calendar Client (Output Port)
 * 의사의 외부 캘린더 (바쁜 시간 조회, 진료 일정 생성/삭제)
 */
public interface CalendarClient {

    /**
     * 캘린더 연동이 설정되어 있는지 여부
     * 설정되지 않은 경우 동기화는 SKIPPED로 처리된다.
     */
    boolean isConfigured();

    /**
     * 바쁜 시간 조회
     * 호출 실패 시 빈 목록으로 대체될 수 있다.
     */
    List<TimeInterval> queryBusyPeriods(String calendarId, OffsetDateTime timeMin, OffsetDateTime timeMax);

    /**
     * 진료 일정 생성
     *
     * @throws personal.clinic.appointment.scheduling.domain.exception.CalendarUnavailableException 생성 실패 시
     */
    CreatedCalendarEvent createEvent(String calendarId, CalendarEvent event);

    /**
     * 진료 일정 삭제 (이미 삭제된 일정은 성공으로 간주)
     */
    void deleteEvent(String calendarId, String eventId);
}
