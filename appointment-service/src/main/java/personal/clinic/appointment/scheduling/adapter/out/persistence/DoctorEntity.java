package personal.clinic.appointment.scheduling.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.clinic.appointment.scheduling.domain.model.Doctor;
import personal.clinic.appointment.scheduling.domain.model.WorkingWindow;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Doctor JPA Entity
 * 의사 테이블 매핑 (요일별 진료 시간은 doctor_working_hours)
 */
@Entity
@Table(name = "doctors",
        uniqueConstraints = @UniqueConstraint(name = "uk_doctor_id", columnNames = "doctor_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DoctorEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "doctor_id", nullable = false, length = 40)
    private String doctorId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 120)
    private String email;

    @Column(length = 30)
    private String phone;

    @Column(length = 80)
    private String specialty;

    @Column(length = 120)
    private String qualification;

    @Column(name = "experience_years")
    private Integer experienceYears;

    @Column(name = "consultation_fee", precision = 10, scale = 2)
    private BigDecimal consultationFee;

    private Double rating;

    @Column(name = "calendar_id", length = 200)
    private String calendarId;

    @Column(length = 60)
    private String timezone;

    @Column(nullable = false)
    private boolean active;

    @OneToMany(mappedBy = "doctor", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<DoctorWorkingHoursEntity> workingHours = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static DoctorEntity fromDomain(Doctor doctor) {
        DoctorEntity entity = new DoctorEntity();
        entity.id = doctor.id();
        entity.doctorId = doctor.doctorId();
        entity.name = doctor.name();
        entity.email = doctor.email();
        entity.phone = doctor.phone();
        entity.specialty = doctor.specialty();
        entity.qualification = doctor.qualification();
        entity.experienceYears = doctor.experienceYears();
        entity.consultationFee = doctor.consultationFee();
        entity.rating = doctor.rating();
        entity.calendarId = doctor.calendarId();
        entity.timezone = doctor.timezone();
        entity.active = doctor.active();
        doctor.weeklyAvailability().forEach((day, window) ->
                entity.workingHours.add(DoctorWorkingHoursEntity.of(entity, day, window)));
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    /**
     * 도메인 모델로 변환 (workingHours 지연 로딩 - 트랜잭션 안에서 호출)
     */
    public Doctor toDomain() {
        Map<DayOfWeek, WorkingWindow> weekly = new EnumMap<>(DayOfWeek.class);
        for (DoctorWorkingHoursEntity hours : workingHours) {
            weekly.put(hours.dayOfWeek(), hours.toWindow());
        }
        return new Doctor(id, doctorId, name, email, phone, specialty, qualification, experienceYears,
                consultationFee, rating, calendarId, timezone, active, weekly);
    }
}
