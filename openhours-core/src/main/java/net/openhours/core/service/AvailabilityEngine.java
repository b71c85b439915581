package net.openhours.core.service;

import net.openhours.core.bits.BitCodec;
import net.openhours.core.bits.DayBits;
import net.openhours.core.config.EngineConfig;
import net.openhours.core.error.AvailabilityValidationException;
import net.openhours.core.error.VersionConflictException;
import net.openhours.core.model.AuditRecord;
import net.openhours.core.model.BlackoutDate;
import net.openhours.core.model.DayAvailability;
import net.openhours.core.model.OutboxEvent;
import net.openhours.core.model.SaveWeekRequest;
import net.openhours.core.model.SaveWeekResult;
import net.openhours.core.model.WeekAvailability;
import net.openhours.core.model.WeekBits;
import net.openhours.core.model.WeekSlots;
import net.openhours.core.model.Window;
import net.openhours.core.model.WindowInput;
import net.openhours.core.spi.AuditRepository;
import net.openhours.core.spi.AvailabilityCache;
import net.openhours.core.spi.BlackoutRepository;
import net.openhours.core.spi.Clock;
import net.openhours.core.spi.DayStore;
import net.openhours.core.spi.InstructorZoneResolver;
import net.openhours.core.spi.OutboxRepository;
import net.openhours.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * 주 단위 가용성 읽기/쓰기 오케스트레이션.
 *
 * <p>쓰기 순서: 정규화 → 과거 편집 가드레일 → 겹침 검사 → 버전(OCC) 비교 → 병합/교체
 * → 단일 트랜잭션 upsert + 감사 + outbox → (커밋 후) 캐시 무효화/재워밍.
 * 잠금은 쓰지 않는다. 동시 작성자 중 진 쪽은 {@link VersionConflictException} 을 받고 재시도한다.
 */
public final class AvailabilityEngine {
    private static final Logger log = LoggerFactory.getLogger(AvailabilityEngine.class);

    static final int MAX_SUMMARY_DAYS = 366;

    private final DayStore store;
    private final TxRunner tx;
    private final Clock clock;
    private final EngineConfig config;
    private final CacheGuard cache;
    private final PastEditGuard guard;
    private final AuditRepository audits;        // nullable
    private final OutboxRepository outbox;
    private final BlackoutRepository blackouts;  // nullable

    public AvailabilityEngine(DayStore store,
                              TxRunner tx,
                              Clock clock,
                              InstructorZoneResolver zones,
                              EngineConfig config,
                              AvailabilityCache cache,
                              AuditRepository audits,
                              OutboxRepository outbox,
                              BlackoutRepository blackouts) {
        this.store = Objects.requireNonNull(store, "store");
        this.tx = Objects.requireNonNull(tx, "tx");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.config = Objects.requireNonNull(config, "config");
        this.outbox = Objects.requireNonNull(outbox, "outbox");
        this.guard = new PastEditGuard(config, clock, Objects.requireNonNull(zones, "zones"));
        this.cache = new CacheGuard(cache);
        this.audits = audits;
        this.blackouts = blackouts;
        if (cache == null) {
            log.warn("AvailabilityEngine initialized WITHOUT cache");
        }
    }

    public EngineConfig config() { return config; }

    PastEditGuard guard() { return guard; }

    // ===================== read path =====================

    /** 합성 주간 캐시 → 날짜별 캐시 → 저장소. 캐시 오류는 miss 로 취급. 항상 7일 */
    public WeekBits getWeekBits(String instructorId, LocalDate weekStart, boolean useCache) throws Exception {
        requireWeekStart(weekStart);
        if (useCache && cache.enabled()) {
            var week = cache.getWeek(instructorId, weekStart);
            if (week.isPresent()) return week.get();

            Map<LocalDate, DayBits> days = new LinkedHashMap<>();
            for (int i = 0; i < WeekBits.DAYS; i++) {
                LocalDate d = weekStart.plusDays(i);
                var day = cache.getDay(instructorId, d);
                if (day.isEmpty()) break;
                days.put(d, day.get());
            }
            if (days.size() == WeekBits.DAYS) {
                WeekBits assembled = WeekBits.of(weekStart, days);
                cache.putWeek(instructorId, assembled, ttlFor(weekStart));
                return assembled;
            }
        }

        WeekBits fromStore = tx.required(() -> store.getWeek(instructorId, weekStart));
        if (useCache) {
            cache.putWeek(instructorId, fromStore, ttlFor(weekStart));
        }
        return fromStore;
    }

    /** 단일 날짜 비트 (부킹 승인 검사용). 주간 캐시 → 날짜 캐시 → 저장소 */
    public DayBits getDayBits(String instructorId, LocalDate date, boolean useCache) throws Exception {
        LocalDate weekStart = WeekBits.mondayOf(date);
        if (useCache && cache.enabled()) {
            var week = cache.getWeek(instructorId, weekStart);
            if (week.isPresent()) return week.get().day(date);
            var day = cache.getDay(instructorId, date);
            if (day.isPresent()) return day.get();
        }
        DayBits bits = tx.required(() -> store.getDay(instructorId, date))
                .map(DayAvailability::bits)
                .orElse(DayBits.EMPTY);
        if (useCache) {
            cache.putDay(instructorId, date, bits, ttlFor(weekStart));
        }
        return bits;
    }

    /**
     * 달력용 요약: [start, end] 구간에서 가용 윈도우가 있는 날짜 → 윈도우 수.
     * 비어 있는 날은 빠진다. 캐시를 거치지 않고 저장소를 주 단위로 읽는다.
     */
    public Map<LocalDate, Integer> getAvailabilitySummary(String instructorId, LocalDate start, LocalDate end)
            throws Exception {
        if (instructorId == null || instructorId.isBlank()) {
            throw new AvailabilityValidationException("instructorId is required");
        }
        if (start == null || end == null) throw new AvailabilityValidationException("start and end are required");
        if (end.isBefore(start)) throw new AvailabilityValidationException("end " + end + " is before start " + start);
        if (start.plusDays(MAX_SUMMARY_DAYS).isBefore(end)) {
            throw new AvailabilityValidationException("summary range exceeds " + MAX_SUMMARY_DAYS + " days");
        }

        List<WeekBits> weeks = tx.required(() -> {
            List<WeekBits> read = new ArrayList<>();
            for (LocalDate monday = WeekBits.mondayOf(start); !monday.isAfter(end); monday = monday.plusWeeks(1)) {
                read.add(store.getWeek(instructorId, monday));
            }
            return read;
        });

        Map<LocalDate, Integer> summary = new TreeMap<>();
        for (WeekBits week : weeks) {
            week.asMap().forEach((date, bits) -> {
                if (bits.isEmpty() || date.isBefore(start) || date.isAfter(end)) return;
                summary.put(date, BitCodec.decode(bits).size());
            });
        }
        return Collections.unmodifiableMap(summary);
    }

    public String computeWeekVersion(WeekBits week) {
        return WeekVersions.compute(week);
    }

    public WeekAvailability getWeekAvailability(String instructorId, LocalDate weekStart) throws Exception {
        WeekBits week = getWeekBits(instructorId, weekStart, true);
        return toView(instructorId, week);
    }

    public WeekSlots getWeekAvailabilityWithSlots(String instructorId, LocalDate weekStart) throws Exception {
        WeekBits week = getWeekBits(instructorId, weekStart, true);
        Map<LocalDate, List<Window>> slots = new LinkedHashMap<>();
        week.asMap().forEach((date, bits) -> {
            List<Window> list = new ArrayList<>(bits.cardinality());
            for (int i = 0; i < DayBits.SLOTS_PER_DAY; i++) {
                if (bits.isSet(i)) {
                    list.add(new Window(i * DayBits.SLOT_MINUTES, (i + 1) * DayBits.SLOT_MINUTES));
                }
            }
            slots.put(date, List.copyOf(list));
        });
        return new WeekSlots(toView(instructorId, week), Collections.unmodifiableMap(slots));
    }

    // ===================== write path =====================

    public SaveWeekResult saveWeekBits(SaveWeekRequest req) throws Exception {
        return save(req, false);
    }

    /** 단일 날짜 추가: 병합 모드, 토큰 없이 (override) 같은 검증 경로를 탄다 */
    public SaveWeekResult addForDate(String instructorId, LocalDate date, List<WindowInput> windows, String actorId)
            throws Exception {
        if (windows == null || windows.isEmpty()) {
            throw new AvailabilityValidationException("at least one window is required for " + date);
        }
        SaveWeekRequest req = SaveWeekRequest.builder(instructorId, WeekBits.mondayOf(date))
                .windows(date, windows)
                .override(true)
                .actor(actorId)
                .build();
        return save(req, false);
    }

    /**
     * @param clampToToday 복사/패턴 경로: 과거 대상 날짜는 정책과 무관하게 건너뜀
     */
    SaveWeekResult save(SaveWeekRequest req, boolean clampToToday) throws Exception {
        final String instructorId = req.instructorId();
        final LocalDate weekStart = requireWeekStart(req.weekStart());

        // 1) 정규화 (저장 전에 동기 실패)
        Map<LocalDate, List<Window>> submitted = normalize(req);
        if (!req.override() && config.requireBaseVersion() && isBlank(req.baseVersion())) {
            throw new AvailabilityValidationException("baseVersion is required unless override is set");
        }

        // 2) 가드레일 (강사 로컬 오늘 기준)
        final LocalDate today = guard.localToday(instructorId);
        Map<LocalDate, List<Window>> accepted = new TreeMap<>();
        List<LocalDate> skipped = new ArrayList<>();
        int skippedForbidden = 0;
        int skippedWindow = 0;
        for (var e : submitted.entrySet()) {
            switch (guard.check(e.getKey(), today, clampToToday)) {
                case ALLOW -> accepted.put(e.getKey(), e.getValue());
                case SKIP_FORBIDDEN -> { skippedForbidden++; skipped.add(e.getKey()); }
                case SKIP_WINDOW -> { skippedWindow++; skipped.add(e.getKey()); }
            }
        }
        if (!skipped.isEmpty()) {
            log.warn("Skipping past dates for instructor={} week={}: {} (today={})",
                    instructorId, weekStart, skipped, today);
        }
        if (accepted.isEmpty()) {
            String current = computeWeekVersion(getWeekBits(instructorId, weekStart, false));
            return SaveWeekResult.nothingWritten(weekStart, current, skippedForbidden, skippedWindow, skipped);
        }

        // 3) ~ 6) 하나의 트랜잭션
        Committed c = tx.required(() -> {
            WeekBits before = store.getWeek(instructorId, weekStart);
            Set<LocalDate> blackoutDays = blackoutDates(instructorId, weekStart);

            // 3) 겹침
            for (var e : accepted.entrySet()) {
                LocalDate d = e.getKey();
                List<Window> ws = e.getValue();
                OverlapDetector.checkIncoming(d, ws);
                if (blackoutDays.contains(d)) OverlapDetector.checkBlackout(d, ws);
                if (!ws.isEmpty() && !req.replaces(d) && !req.ignoreExistingOverlap()) {
                    OverlapDetector.checkAgainstExisting(d, ws, before.day(d));
                }
            }

            // 4) 동시성 토큰
            String currentVersion = WeekVersions.compute(before);
            checkVersion(req, currentVersion);

            // 5) 병합 vs 교체
            Map<LocalDate, DayBits> writes = new LinkedHashMap<>();
            WeekBits after = before;
            for (var e : accepted.entrySet()) {
                LocalDate d = e.getKey();
                List<Window> ws = e.getValue();
                DayBits incoming = BitCodec.encode(ws, config.slotMinutes());
                DayBits next = (ws.isEmpty() || req.replaces(d))
                        ? incoming
                        : BitCodec.union(before.day(d), incoming);
                writes.put(d, next);
                after = after.with(d, next);
            }

            // 6) 저장 + 감사 + outbox (원자적)
            int rows = store.upsertWeek(instructorId, weekStart, writes);
            String newVersion = WeekVersions.compute(after);
            List<LocalDate> dates = List.copyOf(writes.keySet());
            appendAudit(AuditRecord.ACTION_WEEK_SAVED, instructorId, req.actorId(), weekStart, dates, before, after);
            enqueueWeekSaved(instructorId, weekStart, dates, newVersion, today);
            return new Committed(after, rows, newVersion, dates);
        });

        // 커밋 후: 캐시 무효화 + best-effort 재워밍
        refreshCache(instructorId, weekStart, c.after());

        log.info("Saved week instructor={} week={} days={} rows={} version={} skipped={}",
                instructorId, weekStart, c.dates().size(), c.rows(), shortVersion(c.version()), skipped.size());
        return new SaveWeekResult(weekStart, c.dates().size(), c.rows(), c.version(),
                skippedForbidden, skippedWindow, c.dates(), skipped);
    }

    // ===================== helpers (package) =====================

    /** 블랙아웃 서비스가 같은 트랜잭션 안에서 감사 기록을 남길 때 사용 */
    void appendAudit(String action, String instructorId, String actorId, LocalDate weekStart,
                     List<LocalDate> dates, WeekBits before, WeekBits after) throws Exception {
        if (!config.auditEnabled() || audits == null) return;
        audits.append(new AuditRecord(
                UUID.randomUUID().toString(),
                clock.now(),
                instructorId,
                actorId,
                action,
                weekStart,
                dates,
                snapshot(before, dates),
                snapshot(after, dates)
        ));
    }

    void refreshCache(String instructorId, LocalDate weekStart, WeekBits computed) {
        if (!cache.enabled()) return;
        cache.invalidateWeek(instructorId, weekStart, computed.dates());
        WeekBits warm;
        try {
            warm = tx.required(() -> store.getWeek(instructorId, weekStart));
        } catch (Exception e) {
            log.warn("Cache re-warm read failed for instructor={} week={}, using computed bits: {}",
                    instructorId, weekStart, e.toString());
            warm = computed;
        }
        cache.putWeek(instructorId, warm, ttlFor(weekStart));
    }

    static LocalDate requireWeekStart(LocalDate weekStart) {
        if (weekStart == null) throw new AvailabilityValidationException("weekStart is required");
        if (weekStart.getDayOfWeek() != DayOfWeek.MONDAY) {
            throw new AvailabilityValidationException("weekStart must be a Monday: " + weekStart);
        }
        return weekStart;
    }

    // ===================== private =====================

    private Map<LocalDate, List<Window>> normalize(SaveWeekRequest req) {
        LocalDate weekStart = req.weekStart();
        LocalDate weekEnd = weekStart.plusDays(WeekBits.DAYS - 1);
        Map<LocalDate, List<Window>> out = new TreeMap<>();
        for (var e : req.windowsByDay().entrySet()) {
            LocalDate d = e.getKey();
            if (d == null) throw new AvailabilityValidationException("date is required");
            if (d.isBefore(weekStart) || d.isAfter(weekEnd)) {
                throw new AvailabilityValidationException(d + " is outside week " + weekStart + ".." + weekEnd);
            }
            List<Window> ws = new ArrayList<>(e.getValue().size());
            for (WindowInput in : e.getValue()) {
                if (in == null) throw new AvailabilityValidationException("null window on " + d);
                Window w = Window.parse(in.startTime(), in.endTime());
                BitCodec.checkAligned(w, config.slotMinutes());
                ws.add(w);
            }
            Collections.sort(ws);
            out.put(d, List.copyOf(ws));
        }
        // 날짜 단위 교체 대상인데 윈도우가 없으면 "빈 날" 로 취급
        for (LocalDate d : req.clearDates()) {
            if (d.isBefore(weekStart) || d.isAfter(weekEnd)) {
                throw new AvailabilityValidationException("clear date " + d + " is outside week " + weekStart);
            }
            out.putIfAbsent(d, List.of());
        }
        return out;
    }

    private void checkVersion(SaveWeekRequest req, String currentVersion) {
        if (req.override()) return;
        if (isBlank(req.baseVersion())) return;   // 토큰 없음: requireBaseVersion 은 정규화 단계에서 검사
        if (!WeekVersions.matches(req.baseVersion(), currentVersion)) {
            throw new VersionConflictException(req.baseVersion(), currentVersion);
        }
    }

    void enqueueWeekSaved(String instructorId, LocalDate weekStart, List<LocalDate> dates,
                                  String version, LocalDate today) throws Exception {
        if (config.suppressPastEvents() && dates.stream().allMatch(d -> d.isBefore(today))) {
            log.debug("Suppressing outbox event for past-only dates {} instructor={}", dates, instructorId);
            return;
        }
        outbox.enqueue(new OutboxEvent(
                UUID.randomUUID().toString(),
                OutboxEvent.WEEK_SAVED,
                instructorId,
                weekStart,
                dates,
                version,
                clock.now()
        ));
    }

    private Set<LocalDate> blackoutDates(String instructorId, LocalDate weekStart) throws Exception {
        if (blackouts == null) return Set.of();
        Set<LocalDate> out = new HashSet<>();
        for (BlackoutDate b : blackouts.findBetween(instructorId, weekStart, weekStart.plusDays(WeekBits.DAYS - 1))) {
            out.add(b.date());
        }
        return out;
    }

    private WeekAvailability toView(String instructorId, WeekBits week) {
        Map<LocalDate, List<Window>> days = new LinkedHashMap<>();
        week.asMap().forEach((date, bits) -> days.put(date, List.copyOf(BitCodec.decode(bits))));
        return new WeekAvailability(instructorId, week.weekStart(), computeWeekVersion(week),
                Collections.unmodifiableMap(days));
    }

    private static Map<LocalDate, List<Window>> snapshot(WeekBits week, List<LocalDate> dates) {
        Map<LocalDate, List<Window>> m = new LinkedHashMap<>();
        for (LocalDate d : dates) m.put(d, List.copyOf(BitCodec.decode(week.day(d))));
        return m;
    }

    /** 지난 주는 warm TTL, 이번 주/미래 주는 hot TTL (타임존 차이를 하루 여유로 흡수) */
    private Duration ttlFor(LocalDate weekStart) {
        LocalDate utcToday = clock.now().atZone(ZoneOffset.UTC).toLocalDate();
        boolean past = weekStart.plusDays(WeekBits.DAYS).isBefore(utcToday);
        return past ? config.warmTtl() : config.hotTtl();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String shortVersion(String v) {
        return v.length() > 12 ? v.substring(0, 12) : v;
    }

    private record Committed(WeekBits after, int rows, String version, List<LocalDate> dates) {}
}
