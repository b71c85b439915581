package net.openhours.core.bits;

import java.util.HexFormat;

/**
 * 하루 48개 반시간 슬롯의 비트 벡터 (불변).
 *
 * <p>비트 순서 (encode/decode/overlap/주간 버전 해시 공통):
 * <ul>
 *   <li>slot {@code i} (0..47) = 강사 로컬 시각 {@code [i*30min, (i+1)*30min)}</li>
 *   <li>메모리: {@code long}의 bit {@code i}, 즉 mask {@code 1L << i}</li>
 *   <li>저장: 6 bytes little-endian, slot {@code 8k+j} = {@code byte[k] & (1 << j)}</li>
 * </ul>
 */
public final class DayBits {
    public static final int SLOT_MINUTES = 30;
    public static final int SLOTS_PER_DAY = 48;
    public static final int BYTES = SLOTS_PER_DAY / 8;

    private static final long MASK = (1L << SLOTS_PER_DAY) - 1;

    public static final DayBits EMPTY = new DayBits(0L);
    public static final DayBits FULL = new DayBits(MASK);

    private final long value;

    private DayBits(long value) {
        this.value = value;
    }

    public static DayBits of(long value) {
        if ((value & ~MASK) != 0) {
            throw new IllegalArgumentException("bits beyond slot " + (SLOTS_PER_DAY - 1) + ": " + Long.toHexString(value));
        }
        return value == 0 ? EMPTY : new DayBits(value);
    }

    /** 6-byte little-endian payload → bits. null/empty payload means an empty day. */
    public static DayBits fromBytes(byte[] raw) {
        if (raw == null || raw.length == 0) return EMPTY;
        if (raw.length != BYTES) {
            throw new IllegalArgumentException("expected " + BYTES + " bytes, got " + raw.length);
        }
        long v = 0;
        for (int k = 0; k < BYTES; k++) {
            v |= (raw[k] & 0xFFL) << (8 * k);
        }
        return of(v);
    }

    public byte[] toBytes() {
        byte[] out = new byte[BYTES];
        for (int k = 0; k < BYTES; k++) {
            out[k] = (byte) (value >>> (8 * k));
        }
        return out;
    }

    public long value() { return value; }

    public boolean isEmpty() { return value == 0; }

    public boolean isSet(int slot) {
        checkSlot(slot);
        return (value & (1L << slot)) != 0;
    }

    public int cardinality() { return Long.bitCount(value); }

    public String toHex() { return HexFormat.of().formatHex(toBytes()); }

    static void checkSlot(int slot) {
        if (slot < 0 || slot >= SLOTS_PER_DAY) {
            throw new IndexOutOfBoundsException("slot " + slot);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DayBits other && other.value == value;
    }

    @Override
    public int hashCode() { return Long.hashCode(value); }

    @Override
    public String toString() { return "DayBits{" + toHex() + "}"; }
}
