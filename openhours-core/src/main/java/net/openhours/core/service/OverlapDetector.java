package net.openhours.core.service;

import net.openhours.core.bits.BitCodec;
import net.openhours.core.bits.DayBits;
import net.openhours.core.error.OverlapConflictException;
import net.openhours.core.model.Window;

import java.time.LocalDate;
import java.util.List;

/**
 * 하루 단위 겹침 검사.
 * - 신규끼리: 제출 순서와 무관하게 정렬 후 전 쌍 비교
 * - 신규 vs 저장분: 저장 비트를 디코드한 윈도우와 비교. 디코드된 윈도우와 정확히 같은 윈도우만
 *   "변경 없음" (부분 구간은 비트를 공유하므로 충돌)
 * - 블랙아웃 날짜: 하루 전체 구간과 충돌
 */
final class OverlapDetector {
    private OverlapDetector() {}

    static void checkIncoming(LocalDate date, List<Window> sortedIncoming) {
        for (int i = 0; i < sortedIncoming.size(); i++) {
            Window a = sortedIncoming.get(i);
            for (int j = i + 1; j < sortedIncoming.size(); j++) {
                Window b = sortedIncoming.get(j);
                if (a.intersects(b)) throw new OverlapConflictException(date, a, b);
            }
        }
    }

    static void checkAgainstExisting(LocalDate date, List<Window> incoming, DayBits persisted) {
        if (persisted.isEmpty()) return;
        List<Window> existing = BitCodec.decode(persisted);
        for (Window w : incoming) {
            if (existing.contains(w)) continue;
            for (Window e : existing) {
                if (w.intersects(e)) throw new OverlapConflictException(date, w, e);
            }
        }
    }

    static void checkBlackout(LocalDate date, List<Window> incoming) {
        if (!incoming.isEmpty()) {
            throw new OverlapConflictException(date, incoming.get(0), Window.wholeDay());
        }
    }
}
