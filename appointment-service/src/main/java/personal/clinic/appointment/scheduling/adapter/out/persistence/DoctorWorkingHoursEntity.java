package personal.clinic.appointment.scheduling.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.clinic.appointment.scheduling.domain.model.WorkingWindow;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * Doctor Working Hours JPA Entity
 * day_of_week: 1(월) ~ 7(일)
 */
@Entity
@Table(name = "doctor_working_hours",
        uniqueConstraints = @UniqueConstraint(name = "uk_doctor_day", columnNames = {"doctor_pk", "day_of_week"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DoctorWorkingHoursEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "doctor_pk", nullable = false)
    private DoctorEntity doctor;

    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    @Column(nullable = false)
    private boolean available;

    @Column(name = "start_time")
    private LocalTime startTime;

    @Column(name = "end_time")
    private LocalTime endTime;

    static DoctorWorkingHoursEntity of(DoctorEntity doctor, DayOfWeek day, WorkingWindow window) {
        DoctorWorkingHoursEntity entity = new DoctorWorkingHoursEntity();
        entity.doctor = doctor;
        entity.dayOfWeek = day.getValue();
        entity.available = window.available();
        entity.startTime = window.start();
        entity.endTime = window.end();
        return entity;
    }

    DayOfWeek dayOfWeek() {
        return DayOfWeek.of(dayOfWeek);
    }

    WorkingWindow toWindow() {
        return available ? WorkingWindow.of(startTime, endTime) : WorkingWindow.closed();
    }
}
