package personal.clinic.appointment.scheduling.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.clinic.appointment.scheduling.domain.model.Patient;

import java.time.LocalDateTime;

/**
 * Patient JPA Entity
 */
@Entity
@Table(name = "patients",
        uniqueConstraints = @UniqueConstraint(name = "uk_patient_id", columnNames = "patient_id"),
        indexes = {
                @Index(name = "idx_patient_email", columnList = "email"),
                @Index(name = "idx_patient_phone", columnList = "phone")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PatientEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "patient_id", nullable = false, length = 20)
    private String patientId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 120)
    private String email;

    @Column(length = 30)
    private String phone;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public static PatientEntity fromDomain(Patient patient) {
        PatientEntity entity = new PatientEntity();
        entity.id = patient.id();
        entity.patientId = patient.patientId();
        entity.name = patient.name();
        entity.email = patient.email();
        entity.phone = patient.phone();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public Patient toDomain() {
        return new Patient(id, patientId, name, email, phone);
    }
}
