package personal.clinic.common.exception;

import lombok.Getter;

/**
 * 비즈니스 규칙 위반 예외의 최상위 타입
 * ErrorCode로 HTTP 상태와 클라이언트 메시지를 결정하고, 예외 메시지에는 진단용 상세 정보를 담는다.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail, Throwable cause) {
        super(detail, cause);
        this.errorCode = errorCode;
    }
}
