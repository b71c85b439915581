package net.openhours.core.error;

/** 가용성 엔진이 호출자에게 돌려주는 차단형(blocking) 오류의 공통 부모 */
public abstract class AvailabilityException extends RuntimeException {
    protected AvailabilityException(String message) {
        super(message);
    }

    protected AvailabilityException(String message, Throwable cause) {
        super(message, cause);
    }

    /** 기계 판독용 코드 (예: "validation_error", "overlap_conflict") */
    public abstract String code();
}
