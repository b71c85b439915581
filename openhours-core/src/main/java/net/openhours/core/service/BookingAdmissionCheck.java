package net.openhours.core.service;

import net.openhours.core.bits.BitCodec;
import net.openhours.core.bits.DayBits;
import net.openhours.core.error.AvailabilityValidationException;
import net.openhours.core.model.AdmissionResult;
import net.openhours.core.model.AdmissionResult.Reason;
import net.openhours.core.model.Window;
import net.openhours.core.spi.BlackoutRepository;
import net.openhours.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 부킹 생성 직전의 동기 승인 검사 (읽기 전용).
 *
 * <p>요청 구간을 슬롯 mask 로 바꿔 그날 비트에 전부 포함되는지 본다.
 * end 가 start 보다 이르면 자정을 넘는 요청으로 보고 다음 날 앞쪽 슬롯까지 요구한다.
 */
public final class BookingAdmissionCheck {
    private static final Logger log = LoggerFactory.getLogger(BookingAdmissionCheck.class);

    private final AvailabilityEngine engine;
    private final BlackoutRepository blackouts;   // nullable
    private final TxRunner tx;

    public BookingAdmissionCheck(AvailabilityEngine engine, BlackoutRepository blackouts, TxRunner tx) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.blackouts = blackouts;
        this.tx = Objects.requireNonNull(tx, "tx");
    }

    /** wire 포맷 ("HH:MM:SS") 요청 */
    public AdmissionResult validate(String instructorId, LocalDate date, String startTime, String endTime)
            throws Exception {
        int start = Window.parseMinute(startTime, false);
        int end = Window.parseMinute(endTime, true);
        return check(instructorId, date, start, end);
    }

    public AdmissionResult validate(String instructorId, LocalDate date, LocalTime start, LocalTime end)
            throws Exception {
        if (start == null || end == null) {
            throw new AvailabilityValidationException("start and end time are required");
        }
        return check(instructorId, date, minuteOf(start), minuteOf(end));
    }

    private AdmissionResult check(String instructorId, LocalDate date, int start, int end) throws Exception {
        if (instructorId == null || instructorId.isBlank()) {
            throw new AvailabilityValidationException("instructorId is required");
        }
        if (date == null) {
            throw new AvailabilityValidationException("date is required");
        }
        if (start == end) {
            throw new AvailabilityValidationException("start and end time must differ: " + Window.text(start));
        }
        // 00:00 종료 = 그날의 끝
        if (end == 0) end = Window.END_OF_DAY;

        List<Segment> segments = new ArrayList<>(2);
        if (end > start) {
            segments.add(new Segment(date, start, end));
        } else {
            segments.add(new Segment(date, start, Window.END_OF_DAY));
            segments.add(new Segment(date.plusDays(1), 0, end));
        }

        for (Segment seg : segments) {
            if (isBlackout(instructorId, seg.date())) {
                log.debug("admission rejected: blackout instructor={} date={}", instructorId, seg.date());
                return AdmissionResult.unavailable(seg.date(), Reason.BLACKOUT, "blackout date " + seg.date());
            }
            long required = BitCodec.slotRange(seg.start(), seg.end());
            DayBits bits = engine.getDayBits(instructorId, seg.date(), true);
            if (!BitCodec.containsAll(bits, required)) {
                String detail = seg.date() + " " + Window.text(seg.start()) + "-" + Window.text(seg.end())
                        + " is not fully available";
                log.debug("admission rejected: instructor={} {}", instructorId, detail);
                return AdmissionResult.unavailable(seg.date(), Reason.OUTSIDE_AVAILABILITY, detail);
            }
        }
        return AdmissionResult.available(date);
    }

    private boolean isBlackout(String instructorId, LocalDate date) throws Exception {
        if (blackouts == null) return false;
        return tx.required(() -> blackouts.find(instructorId, date)).isPresent();
    }

    private static int minuteOf(LocalTime t) {
        if (t.getSecond() != 0 || t.getNano() != 0) {
            throw new AvailabilityValidationException("seconds are not supported: " + t);
        }
        return t.getHour() * 60 + t.getMinute();
    }

    private record Segment(LocalDate date, int start, int end) {}
}
