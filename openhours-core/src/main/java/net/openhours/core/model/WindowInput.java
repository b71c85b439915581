package net.openhours.core.model;

/** wire 포맷 그대로의 윈도우 ("HH:MM:SS"). 엔진이 파싱/정규화한다 */
public record WindowInput(String startTime, String endTime) {
    public static WindowInput of(String startTime, String endTime) {
        return new WindowInput(startTime, endTime);
    }

    public static WindowInput of(Window w) {
        return new WindowInput(w.start(), w.end());
    }
}
