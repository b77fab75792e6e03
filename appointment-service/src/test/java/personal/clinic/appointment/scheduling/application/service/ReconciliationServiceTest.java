package personal.clinic.appointment.scheduling.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.clinic.appointment.scheduling.application.port.out.CalendarClient;
import personal.clinic.appointment.scheduling.application.port.out.NotificationSender;
import personal.clinic.appointment.scheduling.domain.exception.CalendarUnavailableException;
import personal.clinic.appointment.scheduling.domain.model.CalendarEvent;
import personal.clinic.appointment.scheduling.domain.model.ConfirmationNotice;
import personal.clinic.appointment.scheduling.domain.model.CreatedCalendarEvent;
import personal.clinic.appointment.scheduling.domain.model.ExternalSyncStatus;
import personal.clinic.appointment.scheduling.domain.model.NotificationStatus;
import personal.clinic.appointment.scheduling.domain.model.Patient;
import personal.clinic.appointment.scheduling.domain.model.Reservation;
import personal.clinic.appointment.scheduling.domain.model.ReservationStatus;
import personal.clinic.appointment.scheduling.support.InMemorySchedulingStore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.CALENDAR_ID;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.at;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.confirmed;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.doctor;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.interval;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.patient;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.reservation;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.schedulingProperties;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReconciliationService 단위 테스트")
class ReconciliationServiceTest {

    private static final String RESERVATION_ID = "A-5e5e5e5e";

    @Mock
    private CalendarClient calendarClient;
    @Mock
    private NotificationSender notificationSender;

    private InMemorySchedulingStore store;
    private ReconciliationService reconciliationService;

    @BeforeEach
    void setUp() {
        store = new InMemorySchedulingStore();
        store.save(patient());
        store.save(confirmed(RESERVATION_ID, interval(9, 0, 9, 30)));
        reconciliationService = new ReconciliationService(
                schedulingProperties(), store, store, store, calendarClient, notificationSender);
    }

    @Test
    @DisplayName("캘린더 일정 생성 후 SYNCED, 확정 메일 발송 후 SENT를 기록한다")
    void reconcile_SyncsCalendarAndNotifies() {
        // given
        store.save(doctor(CALENDAR_ID));
        given(calendarClient.isConfigured()).willReturn(true);
        given(calendarClient.createEvent(eq(CALENDAR_ID), any()))
                .willReturn(new CreatedCalendarEvent("evt-1", "https://calendar.google.com/event?eid=evt-1"));
        given(notificationSender.sendConfirmation(any())).willReturn(NotificationStatus.SENT);

        // when
        reconciliationService.reconcileBooked(RESERVATION_ID);

        // then
        Reservation reconciled = store.findByReservationId(RESERVATION_ID).orElseThrow();
        assertThat(reconciled.externalSyncStatus()).isEqualTo(ExternalSyncStatus.SYNCED);
        assertThat(reconciled.externalEventId()).isEqualTo("evt-1");
        assertThat(reconciled.notificationStatus()).isEqualTo(NotificationStatus.SENT);
        assertThat(reconciled.status()).isEqualTo(ReservationStatus.CONFIRMED);

        ArgumentCaptor<CalendarEvent> event = ArgumentCaptor.forClass(CalendarEvent.class);
        verify(calendarClient).createEvent(eq(CALENDAR_ID), event.capture());
        assertThat(event.getValue().summary()).isEqualTo("In-Person - Ravi Kumar");
        assertThat(event.getValue().start()).isEqualTo(at(9, 0));
        assertThat(event.getValue().timeZone()).isEqualTo("Asia/Kolkata");
        assertThat(event.getValue().attendeeEmails())
                .containsExactly("anjali.mehta@clinic.local", "ravi@example.com");
        assertThat(event.getValue().description()).contains("Appointment ID   : " + RESERVATION_ID);

        ArgumentCaptor<ConfirmationNotice> notice = ArgumentCaptor.forClass(ConfirmationNotice.class);
        verify(notificationSender).sendConfirmation(notice.capture());
        assertThat(notice.getValue().recipient()).isEqualTo("ravi@example.com");
        assertThat(notice.getValue().timeLabel()).isEqualTo("09:00 AM - 09:30 AM");
        assertThat(notice.getValue().calendarLink()).contains("evt-1");
    }

    @Test
    @DisplayName("같은 이벤트가 다시 전달되어도 캘린더와 메일은 한 번만 처리된다")
    void reconcile_IsIdempotentOnRedelivery() {
        // given
        store.save(doctor(CALENDAR_ID));
        given(calendarClient.isConfigured()).willReturn(true);
        given(calendarClient.createEvent(eq(CALENDAR_ID), any())).willReturn(new CreatedCalendarEvent("evt-1", null));
        given(notificationSender.sendConfirmation(any())).willReturn(NotificationStatus.SENT);

        // when
        reconciliationService.reconcileBooked(RESERVATION_ID);
        reconciliationService.reconcileBooked(RESERVATION_ID);

        // then
        verify(calendarClient, times(1)).createEvent(any(), any());
        verify(notificationSender, times(1)).sendConfirmation(any());
    }

    @Test
    @DisplayName("캘린더 동기화가 실패해도 FAILED만 기록하고 메일은 보낸다")
    void reconcile_CalendarFailureDoesNotBlockNotification() {
        // given
        store.save(doctor(CALENDAR_ID));
        given(calendarClient.isConfigured()).willReturn(true);
        given(calendarClient.createEvent(eq(CALENDAR_ID), any()))
                .willThrow(new CalendarUnavailableException("events.insert failed"));
        given(notificationSender.sendConfirmation(any())).willReturn(NotificationStatus.SENT);

        // when
        reconciliationService.reconcileBooked(RESERVATION_ID);

        // then
        Reservation reconciled = store.findByReservationId(RESERVATION_ID).orElseThrow();
        assertThat(reconciled.externalSyncStatus()).isEqualTo(ExternalSyncStatus.FAILED);
        assertThat(reconciled.notificationStatus()).isEqualTo(NotificationStatus.SENT);
        assertThat(reconciled.status()).isEqualTo(ReservationStatus.CONFIRMED);
    }

    @Test
    @DisplayName("캘린더 연동이 없으면 SKIPPED")
    void reconcile_SkipsWhenCalendarNotConfigured() {
        // given
        store.save(doctor(null));
        given(notificationSender.sendConfirmation(any())).willReturn(NotificationStatus.SENT);

        // when
        reconciliationService.reconcileBooked(RESERVATION_ID);

        // then
        assertThat(store.findByReservationId(RESERVATION_ID).orElseThrow().externalSyncStatus())
                .isEqualTo(ExternalSyncStatus.SKIPPED);
        verify(calendarClient, never()).createEvent(any(), any());
    }

    @Test
    @DisplayName("이메일이 없는 환자는 알림을 SKIPPED로 기록한다")
    void reconcile_SkipsNotificationWithoutEmail() {
        // given
        store.save(doctor(null));
        store.save(new Patient(1L, patient().patientId(), "Ravi Kumar", null, "+91-9876543210"));

        // when
        reconciliationService.reconcileBooked(RESERVATION_ID);

        // then
        assertThat(store.findByReservationId(RESERVATION_ID).orElseThrow().notificationStatus())
                .isEqualTo(NotificationStatus.SKIPPED);
        verifyNoInteractions(notificationSender);
    }

    @Test
    @DisplayName("취소된 예약의 캘린더 일정을 삭제한다")
    void withdraw_DeletesSyncedEvent() {
        // given
        store.save(doctor(CALENDAR_ID));
        Reservation cancelled = reservation("A-cccccccc", interval(10, 0, 10, 30), ReservationStatus.CANCELLED);
        store.save(cancelled);
        store.recordCalendarSync("A-cccccccc", ExternalSyncStatus.SYNCED, "evt-9");
        given(calendarClient.isConfigured()).willReturn(true);

        // when
        reconciliationService.withdrawCancelled("A-cccccccc");

        // then
        verify(calendarClient).deleteEvent(CALENDAR_ID, "evt-9");
    }

    @Test
    @DisplayName("확정 상태이거나 동기화된 일정이 없으면 삭제하지 않는다")
    void withdraw_IgnoresUnsyncedOrActive() {
        // when
        reconciliationService.withdrawCancelled(RESERVATION_ID);
        reconciliationService.withdrawCancelled("A-unknown0");

        // then
        verifyNoInteractions(calendarClient);
    }
}
