package net.openhours.core.bits;

import net.openhours.core.error.AvailabilityValidationException;
import net.openhours.core.model.Window;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 윈도우 ↔ 비트 벡터 변환과 비트 연산 (순수 함수).
 * 비트 순서는 {@link DayBits} 주석 참고.
 */
public final class BitCodec {
    private BitCodec() {}

    /** 반시간 격자 정렬 + 상호 비중첩 윈도우들을 비트로 */
    public static DayBits encode(Collection<Window> windows) {
        return encode(windows, DayBits.SLOT_MINUTES);
    }

    /**
     * @param gridMinutes 허용 정렬 단위 (30의 배수, 1440의 약수)
     */
    public static DayBits encode(Collection<Window> windows, int gridMinutes) {
        checkGrid(gridMinutes);
        long acc = 0;
        for (Window w : windows) {
            checkAligned(w, gridMinutes);
            long m = mask(w);
            if ((acc & m) != 0) {
                throw new AvailabilityValidationException("windows overlap at " + w.display());
            }
            acc |= m;
        }
        return DayBits.of(acc);
    }

    /** 연속된 set 비트를 최소 개수의 윈도우로 합친다. 마지막 슬롯까지 이어지면 end = 24:00:00 */
    public static List<Window> decode(DayBits bits) {
        List<Window> out = new ArrayList<>();
        if (bits == null || bits.isEmpty()) return out;
        long v = bits.value();
        int slot = 0;
        while (slot < DayBits.SLOTS_PER_DAY) {
            if ((v & (1L << slot)) == 0) { slot++; continue; }
            int runStart = slot;
            while (slot < DayBits.SLOTS_PER_DAY && (v & (1L << slot)) != 0) slot++;
            out.add(new Window(runStart * DayBits.SLOT_MINUTES, slot * DayBits.SLOT_MINUTES));
        }
        return out;
    }

    /** 단일 윈도우의 슬롯 mask. 반시간 정렬 필수 */
    public static long mask(Window w) {
        checkAligned(w, DayBits.SLOT_MINUTES);
        int from = w.startMinute() / DayBits.SLOT_MINUTES;
        int to = w.endMinute() / DayBits.SLOT_MINUTES;   // exclusive, 24:00 → 48
        return rangeMask(from, to);
    }

    /**
     * 임의 분 단위 구간을 덮는 슬롯 mask (start 내림, end 올림).
     * 부킹 승인 검사처럼 반시간 정렬을 강제하지 않는 쪽에서 사용.
     */
    public static long slotRange(int startMinute, int endMinute) {
        if (startMinute < 0 || endMinute > Window.END_OF_DAY || endMinute <= startMinute) {
            throw new AvailabilityValidationException("invalid interval " + startMinute + "-" + endMinute);
        }
        int from = startMinute / DayBits.SLOT_MINUTES;
        int to = (endMinute + DayBits.SLOT_MINUTES - 1) / DayBits.SLOT_MINUTES;
        return rangeMask(from, to);
    }

    public static boolean overlap(DayBits a, DayBits b) {
        return (a.value() & b.value()) != 0;
    }

    public static DayBits union(DayBits a, DayBits b) {
        return DayBits.of(a.value() | b.value());
    }

    public static DayBits intersect(DayBits a, DayBits b) {
        return DayBits.of(a.value() & b.value());
    }

    /** a 에서 b 의 비트를 지운다 (a AND NOT b) */
    public static DayBits clear(DayBits a, DayBits b) {
        return DayBits.of(a.value() & ~b.value());
    }

    public static boolean containsAll(DayBits bits, long requiredMask) {
        return (bits.value() & requiredMask) == requiredMask;
    }

    public static void checkAligned(Window w, int gridMinutes) {
        if (w.startMinute() % gridMinutes != 0 || w.endMinute() % gridMinutes != 0) {
            throw new AvailabilityValidationException(
                    "window " + w.display() + " is not aligned to " + gridMinutes + "-minute slots");
        }
    }

    public static void checkGrid(int gridMinutes) {
        if (gridMinutes < DayBits.SLOT_MINUTES
                || gridMinutes % DayBits.SLOT_MINUTES != 0
                || Window.END_OF_DAY % gridMinutes != 0) {
            throw new IllegalArgumentException("unsupported slot granularity: " + gridMinutes + " min");
        }
    }

    private static long rangeMask(int fromSlot, int toSlotExclusive) {
        if (toSlotExclusive <= fromSlot) return 0;
        long upper = toSlotExclusive >= 64 ? -1L : (1L << toSlotExclusive) - 1;
        long lower = (1L << fromSlot) - 1;
        return upper & ~lower;
    }
}
