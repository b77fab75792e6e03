package personal.clinic.appointment.scheduling.adapter.out.calendar;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import personal.clinic.appointment.scheduling.adapter.out.calendar.GoogleCalendarPayloads.Attendee;
import personal.clinic.appointment.scheduling.adapter.out.calendar.GoogleCalendarPayloads.BusyRange;
import personal.clinic.appointment.scheduling.adapter.out.calendar.GoogleCalendarPayloads.CalendarBusy;
import personal.clinic.appointment.scheduling.adapter.out.calendar.GoogleCalendarPayloads.CalendarItem;
import personal.clinic.appointment.scheduling.adapter.out.calendar.GoogleCalendarPayloads.EventDateTime;
import personal.clinic.appointment.scheduling.adapter.out.calendar.GoogleCalendarPayloads.EventRequest;
import personal.clinic.appointment.scheduling.adapter.out.calendar.GoogleCalendarPayloads.EventResponse;
import personal.clinic.appointment.scheduling.adapter.out.calendar.GoogleCalendarPayloads.FreeBusyRequest;
import personal.clinic.appointment.scheduling.adapter.out.calendar.GoogleCalendarPayloads.FreeBusyResponse;
import personal.clinic.appointment.scheduling.adapter.out.calendar.GoogleCalendarPayloads.ReminderOverride;
import personal.clinic.appointment.scheduling.adapter.out.calendar.GoogleCalendarPayloads.Reminders;
import personal.clinic.appointment.scheduling.application.port.out.CalendarClient;
import personal.clinic.appointment.scheduling.domain.exception.CalendarUnavailableException;
import personal.clinic.appointment.scheduling.domain.model.CalendarEvent;
import personal.clinic.appointment.scheduling.domain.model.CreatedCalendarEvent;
import personal.clinic.appointment.scheduling.domain.model.TimeInterval;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Google Calendar REST Client Adapter
 * Google Calendar v3 API와 HTTP 통신하는 구현체 (RestClient 사용)
 * <p>
 * - freeBusy: Circuit Breaker + Retry, 실패 시 Fallback으로 빈 목록 반환
 * - events.insert: Circuit Breaker만 적용 (재시도 시 일정 중복 생성 위험)
 * - events.delete: Circuit Breaker + Retry, 404/410은 이미 삭제된 것으로 간주
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GoogleCalendarRestClientAdapter implements CalendarClient {

    private static final DateTimeFormatter RFC3339 = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final int EMAIL_REMINDER_MINUTES = 24 * 60;
    private static final int POPUP_REMINDER_MINUTES = 30;

    private final RestClient googleCalendarRestClient;
    private final GoogleCalendarProperties properties;

    @Override
    public boolean isConfigured() {
        return properties.isConfigured();
    }

    @Override
    @CircuitBreaker(name = "googleCalendar", fallbackMethod = "queryBusyPeriodsFallback")
    @Retry(name = "googleCalendar")
    public List<TimeInterval> queryBusyPeriods(String calendarId, OffsetDateTime timeMin, OffsetDateTime timeMax) {
        log.debug("Querying busy periods: calendarId={}, timeMin={}, timeMax={}", calendarId, timeMin, timeMax);

        FreeBusyRequest request = new FreeBusyRequest(
                RFC3339.format(timeMin), RFC3339.format(timeMax), List.of(new CalendarItem(calendarId)));

        FreeBusyResponse response = googleCalendarRestClient.post()
                .uri("/calendar/v3/freeBusy")
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    log.error("Calendar freeBusy failed: calendarId={}, status={}", calendarId, res.getStatusCode());
                    throw new CalendarUnavailableException(
                            String.format("freeBusy failed: calendarId=%s, status=%s", calendarId, res.getStatusCode()));
                })
                .body(FreeBusyResponse.class);

        if (response == null || response.calendars() == null) {
            return List.of();
        }
        CalendarBusy calendar = response.calendars().get(calendarId);
        if (calendar == null) {
            return List.of();
        }
        if (calendar.errors() != null && !calendar.errors().isEmpty()) {
            log.warn("Calendar freeBusy returned errors: calendarId={}, errors={}", calendarId, calendar.errors());
            return List.of();
        }
        return toIntervals(calendarId, calendar.busy());
    }

    /**
     * Fallback 메서드
     * Circuit Open 또는 호출 실패 시 "바쁜 시간 없음"으로 처리 (가용성 우선)
     */
    private List<TimeInterval> queryBusyPeriodsFallback(String calendarId, OffsetDateTime timeMin,
                                                        OffsetDateTime timeMax, Exception e) {
        log.warn("Calendar busy lookup degraded to empty: calendarId={}, error={}",
                calendarId, e.getClass().getSimpleName(), e);
        return List.of();
    }

    @Override
    @CircuitBreaker(name = "googleCalendar")
    public CreatedCalendarEvent createEvent(String calendarId, CalendarEvent event) {
        log.debug("Creating calendar event: calendarId={}, summary={}", calendarId, event.summary());

        EventResponse response = googleCalendarRestClient.post()
                .uri("/calendar/v3/calendars/{calendarId}/events?sendUpdates={sendUpdates}", calendarId, "all")
                .contentType(MediaType.APPLICATION_JSON)
                .body(toEventRequest(event))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    log.error("Calendar event insert failed: calendarId={}, status={}", calendarId, res.getStatusCode());
                    throw new CalendarUnavailableException(
                            String.format("events.insert failed: calendarId=%s, status=%s",
                                    calendarId, res.getStatusCode()));
                })
                .body(EventResponse.class);

        if (response == null || response.id() == null) {
            throw new CalendarUnavailableException(
                    String.format("events.insert returned no event id: calendarId=%s", calendarId));
        }

        log.debug("Calendar event created: calendarId={}, eventId={}", calendarId, response.id());
        return new CreatedCalendarEvent(response.id(), response.htmlLink());
    }

    @Override
    @CircuitBreaker(name = "googleCalendar")
    @Retry(name = "googleCalendar")
    public void deleteEvent(String calendarId, String eventId) {
        googleCalendarRestClient.delete()
                .uri("/calendar/v3/calendars/{calendarId}/events/{eventId}", calendarId, eventId)
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value()
                        || status.value() == HttpStatus.GONE.value(), (req, res) ->
                        log.info("Calendar event already removed: calendarId={}, eventId={}", calendarId, eventId))
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw new CalendarUnavailableException(
                            String.format("events.delete failed: calendarId=%s, eventId=%s, status=%s",
                                    calendarId, eventId, res.getStatusCode()));
                })
                .toBodilessEntity();
    }

    private List<TimeInterval> toIntervals(String calendarId, List<BusyRange> ranges) {
        if (ranges == null) {
            return List.of();
        }
        List<TimeInterval> intervals = new ArrayList<>();
        for (BusyRange range : ranges) {
            if (range == null || range.start() == null || range.end() == null) {
                log.warn("Ignoring busy range without bounds: calendarId={}, range={}", calendarId, range);
                continue;
            }
            try {
                OffsetDateTime start = OffsetDateTime.parse(range.start());
                OffsetDateTime end = OffsetDateTime.parse(range.end());
                if (start.isBefore(end)) {
                    intervals.add(TimeInterval.of(start, end));
                }
            } catch (DateTimeParseException e) {
                log.warn("Ignoring malformed busy range: calendarId={}, range={}", calendarId, range);
            }
        }
        return List.copyOf(intervals);
    }

    private EventRequest toEventRequest(CalendarEvent event) {
        return new EventRequest(
                event.summary(),
                event.description(),
                new EventDateTime(RFC3339.format(event.start()), event.timeZone()),
                new EventDateTime(RFC3339.format(event.end()), event.timeZone()),
                event.attendeeEmails().stream().map(Attendee::new).toList(),
                new Reminders(false, List.of(
                        new ReminderOverride("email", EMAIL_REMINDER_MINUTES),
                        new ReminderOverride("popup", POPUP_REMINDER_MINUTES))));
    }
}
