package personal.clinic.appointment.scheduling.domain.model;

import personal.clinic.appointment.scheduling.domain.exception.PatientContactRequiredException;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.util.UUID;

/**
 * Patient Domain Model
 * 이메일 또는 전화번호 중 하나는 반드시 있어야 한다.
 */
public record Patient(
        Long id,
        String patientId,
        String name,
        String email,
        String phone) {

    public Patient {
        if (patientId == null || patientId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Patient ID cannot be blank");
        }
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Patient name cannot be blank");
        }
        email = blankToNull(email);
        phone = blankToNull(phone);
        if (email == null && phone == null) {
            throw new PatientContactRequiredException();
        }
    }

    /**
     * 신규 환자 등록 (P-xxxxxxxx 형식 ID 발급)
     */
    public static Patient register(String name, String email, String phone) {
        return new Patient(null, "P-" + UUID.randomUUID().toString().substring(0, 8), name.trim(), email, phone);
    }

    /**
     * 재방문 환자 정보 갱신
     * 전달된 값만 덮어쓰고 비어 있는 값은 기존 정보를 유지한다.
     */
    public Patient updateContact(String newName, String newEmail, String newPhone) {
        return new Patient(
                id,
                patientId,
                blankToNull(newName) != null ? newName.trim() : name,
                blankToNull(newEmail) != null ? newEmail : email,
                blankToNull(newPhone) != null ? newPhone : phone);
    }

    public boolean hasEmail() {
        return email != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
