package net.openhours.core.bits;

import net.openhours.core.error.AvailabilityValidationException;
import net.openhours.core.model.Window;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BitCodecTest {

    private static Window w(String start, String end) {
        return Window.parse(start, end);
    }

    @Test
    void encode_setsHalfHourSlots_startInclusive_endExclusive() {
        DayBits bits = BitCodec.encode(List.of(w("09:00:00", "12:00:00")));

        assertEquals(6, bits.cardinality());
        assertTrue(bits.isSet(18));
        assertTrue(bits.isSet(23));
        assertThat(bits.isSet(17)).isFalse();
        assertThat(bits.isSet(24)).isFalse();
    }

    @Test
    void endOfDaySentinel_mapsToFinalBit_andDecodesBack() {
        List<Window> in = List.of(w("00:00:00", "01:00:00"), w("22:30:00", "24:00:00"));

        DayBits bits = BitCodec.encode(in);
        assertTrue(bits.isSet(DayBits.SLOTS_PER_DAY - 1));
        assertTrue(bits.isSet(0));

        List<Window> out = BitCodec.decode(bits);
        assertEquals(in, out);
        assertEquals("24:00:00", out.get(1).end());
    }

    @Test
    void decode_coalescesAdjacentWindows_inOrder() {
        DayBits bits = BitCodec.encode(List.of(
                w("14:00:00", "15:00:00"), w("10:00:00", "11:00:00"), w("09:00:00", "10:00:00")));

        assertThat(BitCodec.decode(bits))
                .containsExactly(w("09:00:00", "11:00:00"), w("14:00:00", "15:00:00"));
    }

    @Test
    void decode_emptyBits_isEmptyList() {
        assertThat(BitCodec.decode(DayBits.EMPTY)).isEmpty();
        assertThat(BitCodec.decode(null)).isEmpty();
    }

    @Test
    void encode_rejectsMisalignedAndOverlapping() {
        assertThrows(AvailabilityValidationException.class,
                () -> BitCodec.encode(List.of(w("09:15:00", "10:00:00"))));
        assertThrows(AvailabilityValidationException.class,
                () -> BitCodec.encode(List.of(w("09:00:00", "11:00:00"), w("10:30:00", "12:00:00"))));
    }

    @Test
    void encode_withCoarserGrid_rejectsHalfHourBoundaries() {
        assertThat(BitCodec.encode(List.of(w("09:00:00", "11:00:00")), 60).cardinality()).isEqualTo(4);
        assertThrows(AvailabilityValidationException.class,
                () -> BitCodec.encode(List.of(w("09:30:00", "11:00:00")), 60));
    }

    @Test
    void checkGrid_acceptsOnlyMultiplesOf30DividingTheDay() {
        BitCodec.checkGrid(30);
        BitCodec.checkGrid(60);
        BitCodec.checkGrid(90);
        assertThrows(IllegalArgumentException.class, () -> BitCodec.checkGrid(15));
        assertThrows(IllegalArgumentException.class, () -> BitCodec.checkGrid(45));
        assertThrows(IllegalArgumentException.class, () -> BitCodec.checkGrid(420));
    }

    @Test
    void encode_isPure() {
        List<Window> in = List.of(w("08:00:00", "09:30:00"), w("20:00:00", "24:00:00"));
        assertEquals(BitCodec.encode(in), BitCodec.encode(in));
    }

    @Test
    void slotRange_floorsStart_ceilsEnd() {
        assertEquals(1L << 19, BitCodec.slotRange(570, 600));           // 09:30-10:00
        assertEquals(0b111L << 18, BitCodec.slotRange(545, 610));       // 09:05-10:10 → 09:00-10:30
        assertEquals(1L << 47, BitCodec.slotRange(1430, 1440));         // 23:50-24:00
        assertThatThrownBy(() -> BitCodec.slotRange(600, 600))
                .isInstanceOf(AvailabilityValidationException.class);
    }

    @Test
    void bitwiseHelpers() {
        DayBits a = BitCodec.encode(List.of(w("09:00:00", "11:00:00")));
        DayBits b = BitCodec.encode(List.of(w("10:00:00", "12:00:00")));
        DayBits c = BitCodec.encode(List.of(w("13:00:00", "14:00:00")));

        assertTrue(BitCodec.overlap(a, b));
        assertThat(BitCodec.overlap(a, c)).isFalse();
        assertThat(BitCodec.decode(BitCodec.union(a, b))).containsExactly(w("09:00:00", "12:00:00"));
        assertThat(BitCodec.decode(BitCodec.intersect(a, b))).containsExactly(w("10:00:00", "11:00:00"));
        assertThat(BitCodec.decode(BitCodec.clear(a, b))).containsExactly(w("09:00:00", "10:00:00"));
        assertTrue(BitCodec.containsAll(a, BitCodec.slotRange(570, 630)));
        assertThat(BitCodec.containsAll(a, BitCodec.slotRange(630, 690))).isFalse();
    }
}
