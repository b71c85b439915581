package net.openhours.core.service;

import net.openhours.core.bits.BitCodec;
import net.openhours.core.error.AvailabilityValidationException;
import net.openhours.core.model.AdmissionResult;
import net.openhours.core.model.AdmissionResult.Reason;
import net.openhours.core.model.BlackoutDate;
import net.openhours.core.model.Window;
import net.openhours.core.testing.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static net.openhours.core.testing.EngineFixture.INSTRUCTOR;
import static net.openhours.core.testing.EngineFixture.NEXT_MONDAY;
import static net.openhours.core.testing.EngineFixture.NOW;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BookingAdmissionCheckTest {

    static final LocalDate TUE = NEXT_MONDAY.plusDays(1);
    static final LocalDate WED = NEXT_MONDAY.plusDays(2);

    EngineFixture f;

    @BeforeEach
    void setUp() {
        f = EngineFixture.create();
    }

    private void open(LocalDate date, String start, String end) {
        f.store.put(INSTRUCTOR, date, BitCodec.encode(List.of(Window.parse(start, end))));
    }

    @Test
    void noRow_isOutsideAvailability() throws Exception {
        AdmissionResult r = f.admission.validate(INSTRUCTOR, TUE, "09:00:00", "10:00:00");

        assertFalse(r.available());
        assertEquals(Reason.OUTSIDE_AVAILABILITY, r.reason());
        assertEquals(TUE, r.date());
    }

    @Test
    void partiallyCovered_isRejected() throws Exception {
        open(TUE, "09:00:00", "10:00:00");

        assertTrue(f.admission.validate(INSTRUCTOR, TUE, "09:00:00", "10:00:00").available());
        assertFalse(f.admission.validate(INSTRUCTOR, TUE, "09:30:00", "10:30:00").available());
    }

    @Test
    void unalignedRequest_needsEveryTouchedSlot() throws Exception {
        open(TUE, "09:00:00", "09:30:00");
        assertFalse(f.admission.validate(INSTRUCTOR, TUE, "09:10:00", "09:50:00").available());

        open(TUE, "09:00:00", "10:00:00");
        assertTrue(f.admission.validate(INSTRUCTOR, TUE, "09:10:00", "09:50:00").available());
    }

    @Test
    void endOfDay_bySentinelOrMidnight() throws Exception {
        open(TUE, "23:00:00", "24:00:00");

        assertTrue(f.admission.validate(INSTRUCTOR, TUE, "23:00:00", "24:00:00").available());
        assertTrue(f.admission.validate(INSTRUCTOR, TUE, "23:30:00", "00:00:00").available());
        assertTrue(f.admission.validate(INSTRUCTOR, TUE, LocalTime.of(23, 0), LocalTime.MIDNIGHT).available());
    }

    @Test
    void midnightCrossing_requiresNextDayLeadingSlots() throws Exception {
        open(TUE, "22:00:00", "24:00:00");

        AdmissionResult missingNextDay = f.admission.validate(INSTRUCTOR, TUE, "23:00:00", "00:30:00");
        assertFalse(missingNextDay.available());
        assertEquals(WED, missingNextDay.date());

        open(WED, "00:00:00", "01:00:00");
        assertTrue(f.admission.validate(INSTRUCTOR, TUE, "23:00:00", "00:30:00").available());
    }

    @Test
    void blackoutDate_answersBlackout() throws Exception {
        open(TUE, "09:00:00", "12:00:00");
        f.blackouts.insert(BlackoutDate.ofNew("b-1", INSTRUCTOR, TUE, "conference", NOW));

        AdmissionResult r = f.admission.validate(INSTRUCTOR, TUE, "09:00:00", "10:00:00");
        assertFalse(r.available());
        assertEquals(Reason.BLACKOUT, r.reason());
    }

    @Test
    void midnightCrossing_intoBlackout_answersBlackoutOnNextDay() throws Exception {
        open(TUE, "22:00:00", "24:00:00");
        open(WED, "00:00:00", "01:00:00");
        f.blackouts.insert(BlackoutDate.ofNew("b-2", INSTRUCTOR, WED, null, NOW));

        AdmissionResult r = f.admission.validate(INSTRUCTOR, TUE, "23:00:00", "00:30:00");
        assertEquals(Reason.BLACKOUT, r.reason());
        assertEquals(WED, r.date());
    }

    @Test
    void malformedRequest_throws() {
        assertThrows(AvailabilityValidationException.class,
                () -> f.admission.validate(INSTRUCTOR, TUE, (String) null, "10:00:00"));
        assertThrows(AvailabilityValidationException.class,
                () -> f.admission.validate(INSTRUCTOR, TUE, " ", "10:00:00"));
        assertThrows(AvailabilityValidationException.class,
                () -> f.admission.validate(INSTRUCTOR, TUE, "ten", "11:00:00"));
        assertThrows(AvailabilityValidationException.class,
                () -> f.admission.validate(INSTRUCTOR, TUE, "10:00:00", "10:00:00"));
        assertThrows(AvailabilityValidationException.class,
                () -> f.admission.validate(INSTRUCTOR, TUE, "24:00:00", "10:00:00"));
        assertThrows(AvailabilityValidationException.class,
                () -> f.admission.validate(INSTRUCTOR, null, "09:00:00", "10:00:00"));
        assertThrows(AvailabilityValidationException.class,
                () -> f.admission.validate("", TUE, "09:00:00", "10:00:00"));
    }

    @Test
    void check_performsNoWrites() throws Exception {
        open(TUE, "09:00:00", "10:00:00");
        f.admission.validate(INSTRUCTOR, TUE, "09:00:00", "10:00:00");

        assertEquals(0, f.store.upsertCalls.get());
        assertTrue(f.outbox.events.isEmpty());
    }
}
