package net.openhours.core.model;

import java.time.LocalDate;

/** 부킹 승인 검사 결과. "불가"는 예외가 아니라 이 값으로 돌려준다 */
public record AdmissionResult(boolean available, Reason reason, LocalDate date, String detail) {
    public enum Reason {
        AVAILABLE,
        OUTSIDE_AVAILABILITY,
        BLACKOUT
    }

    public static AdmissionResult available(LocalDate date) {
        return new AdmissionResult(true, Reason.AVAILABLE, date, null);
    }

    public static AdmissionResult unavailable(LocalDate date, Reason reason, String detail) {
        return new AdmissionResult(false, reason, date, detail);
    }
}
