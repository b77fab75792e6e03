package personal.clinic.appointment.scheduling.adapter.out.calendar;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Google Calendar v3 요청/응답 DTO
 */
final class GoogleCalendarPayloads {

    private GoogleCalendarPayloads() {
    }

    record FreeBusyRequest(String timeMin, String timeMax, List<CalendarItem> items) {
    }

    record CalendarItem(String id) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FreeBusyResponse(Map<String, CalendarBusy> calendars) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CalendarBusy(List<BusyRange> busy, List<Map<String, Object>> errors) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BusyRange(String start, String end) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record EventRequest(
            String summary,
            String description,
            EventDateTime start,
            EventDateTime end,
            List<Attendee> attendees,
            Reminders reminders) {
    }

    record EventDateTime(String dateTime, String timeZone) {
    }

    record Attendee(String email) {
    }

    record Reminders(boolean useDefault, List<ReminderOverride> overrides) {
    }

    record ReminderOverride(String method, int minutes) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EventResponse(String id, String htmlLink) {
    }
}
