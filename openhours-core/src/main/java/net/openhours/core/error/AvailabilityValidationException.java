package net.openhours.core.error;

/** 잘못된 입력 (정렬 안 된/역전된 윈도우, 주 범위 밖 날짜 등). 저장 전에 동기적으로 실패한다. */
public class AvailabilityValidationException extends AvailabilityException {
    public AvailabilityValidationException(String message) {
        super(message);
    }

    public AvailabilityValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() { return "validation_error"; }
}
