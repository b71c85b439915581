package net.openhours.core.service;

import net.openhours.core.bits.BitCodec;
import net.openhours.core.error.AvailabilityValidationException;
import net.openhours.core.model.SaveWeekRequest;
import net.openhours.core.model.SaveWeekResult;
import net.openhours.core.model.WeekBits;
import net.openhours.core.model.WindowInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 주 복사 / 패턴 반복 적용. 둘 다 엔진의 저장 경로를 그대로 타며 (주당 1 트랜잭션),
 * clampCopyToFuture 가 켜져 있으면 과거 대상 날짜는 건너뛴다.
 */
public final class WeekOperationService {
    private static final Logger log = LoggerFactory.getLogger(WeekOperationService.class);

    /** 패턴 적용 최대 범위 */
    static final int MAX_PATTERN_DAYS = 366;

    private final AvailabilityEngine engine;

    public WeekOperationService(AvailabilityEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /** 대상 주를 원본 주의 비트로 통째로 교체 (원본에서 빈 날은 대상에서도 비워진다) */
    public SaveWeekResult copyWeek(String instructorId, LocalDate fromWeek, LocalDate toWeek,
                                   String baseVersion, String actorId) throws Exception {
        AvailabilityEngine.requireWeekStart(fromWeek);
        AvailabilityEngine.requireWeekStart(toWeek);
        if (fromWeek.equals(toWeek)) {
            throw new AvailabilityValidationException("source and target week are the same: " + fromWeek);
        }

        WeekBits source = engine.getWeekBits(instructorId, fromWeek, true);
        SaveWeekRequest.Builder req = SaveWeekRequest.builder(instructorId, toWeek)
                .clearExisting(true)
                .baseVersion(baseVersion)
                .actor(actorId);
        for (int i = 0; i < WeekBits.DAYS; i++) {
            LocalDate target = toWeek.plusDays(i);
            req.emptyDay(target).windows(target, inputsOf(source, fromWeek.plusDays(i)));
        }

        SaveWeekResult result = engine.save(req.build(), engine.config().clampCopyToFuture());
        log.info("Copied week instructor={} {} -> {} days={} skipped={}",
                instructorId, fromWeek, toWeek, result.daysWritten(), result.skippedDates().size());
        return result;
    }

    /**
     * 원본 주의 요일별 윈도우를 [startDate, endDate] 범위에 반복 적용.
     * 범위 안의 날짜만 교체하며 주마다 하나의 원자적 저장이 일어난다.
     */
    public List<SaveWeekResult> applyPatternToRange(String instructorId, LocalDate sourceWeek,
                                                    LocalDate startDate, LocalDate endDate,
                                                    String actorId) throws Exception {
        AvailabilityEngine.requireWeekStart(sourceWeek);
        if (startDate == null || endDate == null || endDate.isBefore(startDate)) {
            throw new AvailabilityValidationException("invalid range " + startDate + ".." + endDate);
        }
        if (ChronoUnit.DAYS.between(startDate, endDate) >= MAX_PATTERN_DAYS) {
            throw new AvailabilityValidationException("pattern range exceeds " + MAX_PATTERN_DAYS + " days");
        }

        WeekBits source = engine.getWeekBits(instructorId, sourceWeek, true);
        boolean clamp = engine.config().clampCopyToFuture();
        List<SaveWeekResult> results = new ArrayList<>();

        for (LocalDate week = WeekBits.mondayOf(startDate); !week.isAfter(endDate); week = week.plusWeeks(1)) {
            SaveWeekRequest.Builder req = SaveWeekRequest.builder(instructorId, week)
                    .override(true)
                    .actor(actorId);
            for (int i = 0; i < WeekBits.DAYS; i++) {
                LocalDate target = week.plusDays(i);
                if (target.isBefore(startDate) || target.isAfter(endDate)) continue;
                req.clearDate(target)
                        .emptyDay(target)
                        .windows(target, inputsOf(source, sourceWeek.plusDays(i)));
            }
            results.add(engine.save(req.build(), clamp));
        }

        log.info("Applied pattern instructor={} source={} range={}..{} weeks={}",
                instructorId, sourceWeek, startDate, endDate, results.size());
        return results;
    }

    private static List<WindowInput> inputsOf(WeekBits source, LocalDate date) {
        return BitCodec.decode(source.day(date)).stream().map(WindowInput::of).toList();
    }
}
