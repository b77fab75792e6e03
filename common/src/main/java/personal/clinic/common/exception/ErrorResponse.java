package personal.clinic.common.exception;

import java.time.LocalDateTime;

/**
 * 에러 응답 포맷
 *
 * @param result    항상 "error"
 * @param code      ErrorCode 식별자 (예: S004)
 * @param message   클라이언트에 노출할 메시지
 * @param timestamp 에러 발생 시각
 */
public record ErrorResponse(
        String result,
        String code,
        String message,
        LocalDateTime timestamp
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse("error", errorCode.getCode(), message, LocalDateTime.now());
    }
}
