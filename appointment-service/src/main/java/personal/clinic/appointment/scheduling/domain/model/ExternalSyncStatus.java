package personal.clinic.appointment.scheduling.domain.model;

/**
 * 외부 캘린더 동기화 상태
 * PENDING에서만 SYNCED/FAILED/SKIPPED로 한 번 전이한다.
 */
public enum ExternalSyncStatus {
    PENDING,
    SYNCED,
    FAILED,
    SKIPPED
}
