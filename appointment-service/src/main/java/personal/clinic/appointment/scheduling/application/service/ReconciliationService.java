package personal.clinic.appointment.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.clinic.appointment.scheduling.application.config.SchedulingProperties;
import personal.clinic.appointment.scheduling.application.port.in.ReconcileReservationUseCase;
import personal.clinic.appointment.scheduling.application.port.out.CalendarClient;
import personal.clinic.appointment.scheduling.application.port.out.DoctorRepository;
import personal.clinic.appointment.scheduling.application.port.out.NotificationSender;
import personal.clinic.appointment.scheduling.application.port.out.PatientRepository;
import personal.clinic.appointment.scheduling.application.port.out.ReservationRepository;
import personal.clinic.appointment.scheduling.domain.model.CalendarEvent;
import personal.clinic.appointment.scheduling.domain.model.ConfirmationNotice;
import personal.clinic.appointment.scheduling.domain.model.CreatedCalendarEvent;
import personal.clinic.appointment.scheduling.domain.model.Doctor;
import personal.clinic.appointment.scheduling.domain.model.ExternalSyncStatus;
import personal.clinic.appointment.scheduling.domain.model.NotificationStatus;
import personal.clinic.appointment.scheduling.domain.model.Patient;
import personal.clinic.appointment.scheduling.domain.model.Reservation;
import personal.clinic.appointment.scheduling.domain.model.Slot;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reconciliation Service
 * 예약 확정 이후 캘린더 동기화와 확정 알림을 순서대로 한 번씩 수행한다.
 * <p>
 * 두 단계는 서로 독립적이며 한쪽의 실패가 다른 쪽 실행을 막지 않는다.
 * 결과는 externalSyncStatus / notificationStatus에 기록되고 예약 상태는 바뀌지 않는다.
 * 상태 기록은 PENDING일 때만 반영되므로 같은 이벤트가 다시 전달되어도 중복 처리되지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationService implements ReconcileReservationUseCase {

    private final SchedulingProperties schedulingProperties;
    private final ReservationRepository reservationRepository;
    private final DoctorRepository doctorRepository;
    private final PatientRepository patientRepository;
    private final CalendarClient calendarClient;
    private final NotificationSender notificationSender;

    @Override
    public void reconcileBooked(String reservationId) {
        Optional<Reservation> found = reservationRepository.findByReservationId(reservationId);
        if (found.isEmpty()) {
            log.warn("Reservation not found for reconciliation: reservationId={}", reservationId);
            return;
        }

        Reservation reservation = found.get();
        Doctor doctor = doctorRepository.findByDoctorId(reservation.doctorId()).orElse(null);
        Patient patient = patientRepository.findByPatientId(reservation.patientId()).orElse(null);

        CreatedCalendarEvent calendarEvent = null;
        if (reservation.awaitsCalendarSync()) {
            calendarEvent = syncCalendar(reservation, doctor, patient);
        }
        if (reservation.awaitsNotification()) {
            notifyPatient(reservation, doctor, patient, calendarEvent);
        }
    }

    @Override
    public void withdrawCancelled(String reservationId) {
        Reservation reservation = reservationRepository.findByReservationId(reservationId).orElse(null);
        if (reservation == null || !reservation.isCancelled() || reservation.externalEventId() == null) {
            log.debug("Nothing to withdraw from calendar: reservationId={}", reservationId);
            return;
        }

        Doctor doctor = doctorRepository.findByDoctorId(reservation.doctorId()).orElse(null);
        if (doctor == null || !doctor.hasCalendar() || !calendarClient.isConfigured()) {
            return;
        }

        try {
            calendarClient.deleteEvent(doctor.calendarId(), reservation.externalEventId());
            log.info("Calendar event withdrawn: reservationId={}, eventId={}",
                    reservationId, reservation.externalEventId());
        } catch (Exception e) {
            log.error("Failed to withdraw calendar event: reservationId={}, eventId={}",
                    reservationId, reservation.externalEventId(), e);
        }
    }

    private CreatedCalendarEvent syncCalendar(Reservation reservation, Doctor doctor, Patient patient) {
        if (reservation.isCancelled() || doctor == null || !doctor.hasCalendar() || !calendarClient.isConfigured()) {
            recordCalendarSync(reservation, ExternalSyncStatus.SKIPPED, null);
            return null;
        }

        try {
            CreatedCalendarEvent created = calendarClient.createEvent(
                    doctor.calendarId(), buildCalendarEvent(reservation, doctor, patient));
            recordCalendarSync(reservation, ExternalSyncStatus.SYNCED, created.eventId());
            return created;
        } catch (Exception e) {
            log.error("Calendar sync failed: reservationId={}, calendarId={}",
                    reservation.reservationId(), doctor.calendarId(), e);
            recordCalendarSync(reservation, ExternalSyncStatus.FAILED, null);
            return null;
        }
    }

    private void notifyPatient(Reservation reservation, Doctor doctor, Patient patient,
                               CreatedCalendarEvent calendarEvent) {
        if (reservation.isCancelled() || doctor == null || patient == null || !patient.hasEmail()) {
            recordNotification(reservation, NotificationStatus.SKIPPED);
            return;
        }

        NotificationStatus status;
        try {
            status = notificationSender.sendConfirmation(buildNotice(reservation, doctor, patient, calendarEvent));
        } catch (Exception e) {
            log.error("Confirmation notification failed: reservationId={}", reservation.reservationId(), e);
            status = NotificationStatus.FAILED;
        }
        recordNotification(reservation, status);
    }

    private void recordCalendarSync(Reservation reservation, ExternalSyncStatus status, String eventId) {
        boolean recorded = reservationRepository.recordCalendarSync(reservation.reservationId(), status, eventId);
        if (recorded) {
            log.info("Calendar sync recorded: reservationId={}, status={}, eventId={}",
                    reservation.reservationId(), status, eventId);
        } else {
            log.debug("Calendar sync already recorded: reservationId={}", reservation.reservationId());
        }
    }

    private void recordNotification(Reservation reservation, NotificationStatus status) {
        boolean recorded = reservationRepository.recordNotification(reservation.reservationId(), status);
        if (recorded) {
            log.info("Notification recorded: reservationId={}, status={}", reservation.reservationId(), status);
        } else {
            log.debug("Notification already recorded: reservationId={}", reservation.reservationId());
        }
    }

    private CalendarEvent buildCalendarEvent(Reservation reservation, Doctor doctor, Patient patient) {
        ZoneOffset offset = schedulingProperties.offset();
        String patientName = patient != null ? patient.name() : reservation.patientId();

        List<String> attendees = new ArrayList<>();
        if (doctor.email() != null && !doctor.email().isBlank()) {
            attendees.add(doctor.email());
        }
        if (patient != null && patient.hasEmail()) {
            attendees.add(patient.email());
        }

        return new CalendarEvent(
                reservation.metadata().appointmentType() + " - " + patientName,
                describe(reservation, patient),
                reservation.interval().startAt(offset),
                reservation.interval().endAt(offset),
                doctor.timezoneOr(schedulingProperties.defaultTimezone()),
                attendees);
    }

    private String describe(Reservation reservation, Patient patient) {
        return String.join("\n",
                "Patient Name     : " + valueOrDash(patient != null ? patient.name() : null),
                "Patient Email    : " + valueOrDash(patient != null ? patient.email() : null),
                "Patient Phone    : " + valueOrDash(patient != null ? patient.phone() : null),
                "Patient ID       : " + reservation.patientId(),
                "Appointment ID   : " + reservation.reservationId(),
                "Appointment Type : " + reservation.metadata().appointmentType(),
                "Payment Status   : " + reservation.paymentStatus(),
                "Reason / Symptoms: " + reservation.metadata().reason(),
                "Booking Time     : " + reservation.createdAt());
    }

    private ConfirmationNotice buildNotice(Reservation reservation, Doctor doctor, Patient patient,
                                           CreatedCalendarEvent calendarEvent) {
        ZoneOffset offset = schedulingProperties.offset();
        OffsetDateTime startAt = reservation.interval().startAt(offset);
        Slot slot = new Slot(startAt, reservation.interval().endAt(offset));

        return new ConfirmationNotice(
                patient.email(),
                reservation.reservationId(),
                patient.name(),
                doctor.name(),
                doctor.specialty(),
                startAt.toLocalDate(),
                slot.label(),
                reservation.metadata().appointmentType(),
                reservation.metadata().reason(),
                doctor.consultationFee(),
                calendarEvent != null ? calendarEvent.htmlLink() : null);
    }

    private static String valueOrDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}
