package com.sensorstream.service;

import com.sensorstream.TestReadings;
import com.sensorstream.config.EngineProperties;
import com.sensorstream.model.Metric;
import com.sensorstream.model.RejectionReason;
import com.sensorstream.model.ValidatedReading;
import com.sensorstream.model.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for ReadingValidator.
 *
 * Tests cover:
 * 1. Well-formed reading passes unchanged
 * 2. Missing metric → MISSING_FIELD
 * 3. Missing or blank machine_id → MISSING_FIELD
 * 4. Non-numeric metric → TYPE_ERROR
 * 5. Numeric strings are coerced
 * 6. Out-of-range values only raise range_warning
 * 7. Absent timestamp defaults to ingestion time
 * 8. Unknown fields are carried through
 * 9. Non-finite values → TYPE_ERROR
 * 10. Decimal timestamp strings → TYPE_ERROR
 * 11. Timestamps beyond Instant's range → TYPE_ERROR
 */
class ReadingValidatorTest {

    private ReadingValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ReadingValidator(new EngineProperties(), TestReadings.CLOCK);
    }

    /**
     * Test 1: In-range reading → valid, no warning
     */
    @Test
    void testWellFormedReadingIsValid() {
        ValidationResult result = validator.validate(TestReadings.raw("M-001", 1705312800L, 70.0, 1.2, 100.0));

        assertTrue(result.isValid());
        ValidatedReading reading = result.reading();
        assertEquals("M-001", reading.getMachineId());
        assertEquals(1705312800L, reading.getTimestamp());
        assertEquals(70.0, reading.getTemperature());
        assertEquals(1.2, reading.getVibration());
        assertEquals(100.0, reading.getPressure());
        assertFalse(reading.isRangeWarning());
        assertTrue(reading.getOutOfRangeMetrics().isEmpty());
    }

    /**
     * Test 2: {machine_id, temperature, vibration} without pressure → MISSING_FIELD(pressure)
     */
    @Test
    void testMissingPressureIsRejected() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("machine_id", "M-001");
        raw.put("temperature", 70.0);
        raw.put("vibration", 1.0);

        ValidationResult result = validator.validate(raw);

        assertFalse(result.isValid());
        RejectionReason reason = result.rejection();
        assertEquals(RejectionReason.Type.MISSING_FIELD, reason.type());
        assertEquals("pressure", reason.field());
        assertEquals("MISSING_FIELD: pressure", reason.message());
    }

    /**
     * Test 3: machine_id absent, null or blank → MISSING_FIELD(machine_id)
     */
    @Test
    void testMissingMachineIdIsRejected() {
        Map<String, Object> absent = TestReadings.raw("M-001", 1L, 70.0, 1.0, 100.0);
        absent.remove("machine_id");
        Map<String, Object> blank = TestReadings.raw("  ", 1L, 70.0, 1.0, 100.0);
        Map<String, Object> nullId = TestReadings.raw(null, 1L, 70.0, 1.0, 100.0);

        for (Map<String, Object> raw : List.of(absent, blank, nullId)) {
            ValidationResult result = validator.validate(raw);
            assertFalse(result.isValid());
            assertEquals(RejectionReason.Type.MISSING_FIELD, result.rejection().type());
            assertEquals("machine_id", result.rejection().field());
        }
        assertFalse(validator.validate(null).isValid());
    }

    /**
     * Test 4: Strings, booleans, nulls and objects in metric fields → TYPE_ERROR
     */
    @Test
    void testNonNumericMetricIsTypeError() {
        List<Object> badValues = List.of("hot", true, Map.of("value", 1));
        for (Object bad : badValues) {
            ValidationResult result = validator.validate(TestReadings.raw("M-001", 1L, 70.0, bad, 100.0));
            assertFalse(result.isValid(), "expected rejection for " + bad);
            assertEquals(RejectionReason.Type.TYPE_ERROR, result.rejection().type());
            assertEquals("vibration", result.rejection().field());
            assertTrue(result.rejection().message().startsWith("TYPE_ERROR: vibration"));
        }

        ValidationResult nullValue = validator.validate(TestReadings.raw("M-001", 1L, null, 1.0, 100.0));
        assertEquals(RejectionReason.Type.TYPE_ERROR, nullValue.rejection().type());
        assertEquals("temperature", nullValue.rejection().field());
    }

    /**
     * Test 5: "72.5" is accepted as 72.5; integer JSON numbers are widened
     */
    @Test
    void testNumericStringsAreCoerced() {
        ValidationResult result = validator.validate(TestReadings.raw("M-001", 1L, "72.5", 2, " 120 "));

        assertTrue(result.isValid());
        assertEquals(72.5, result.reading().getTemperature());
        assertEquals(2.0, result.reading().getVibration());
        assertEquals(120.0, result.reading().getPressure());
    }

    /**
     * Test 6: temperature 250 → valid with range_warning, never rejected
     */
    @Test
    void testOutOfRangeRaisesWarningOnly() {
        ValidationResult result = validator.validate(TestReadings.raw("M-001", 1L, 250.0, -0.5, 100.0));

        assertTrue(result.isValid());
        assertTrue(result.reading().isRangeWarning());
        assertEquals(List.of(Metric.TEMPERATURE, Metric.VIBRATION), result.reading().getOutOfRangeMetrics());
    }

    /**
     * Test 7: No timestamp → clock time in epoch seconds
     */
    @Test
    void testAbsentTimestampDefaultsToNow() {
        Map<String, Object> raw = TestReadings.raw("M-001", 0L, 70.0, 1.0, 100.0);
        raw.remove("timestamp");

        ValidationResult result = validator.validate(raw);

        assertTrue(result.isValid());
        assertEquals(TestReadings.NOW.getEpochSecond(), result.reading().getTimestamp());
    }

    /**
     * Test 8: Unknown fields survive validation for the outbound record
     */
    @Test
    void testUnknownFieldsAreKept() {
        Map<String, Object> raw = TestReadings.raw("M-001", 1L, 70.0, 1.0, 100.0);
        raw.put("site", "plant-7");

        ValidationResult result = validator.validate(raw);

        assertEquals(Map.of("site", "plant-7"), result.reading().getAttributes());
    }

    /**
     * Test 9: NaN and Infinity cannot be aggregated → TYPE_ERROR
     */
    @Test
    void testNonFiniteMetricIsTypeError() {
        ValidationResult nan = validator.validate(TestReadings.raw("M-001", 1L, Double.NaN, 1.0, 100.0));
        ValidationResult inf = validator.validate(TestReadings.raw("M-001", 1L, 70.0, 1.0, "Infinity"));

        assertEquals(RejectionReason.Type.TYPE_ERROR, nan.rejection().type());
        assertEquals(RejectionReason.Type.TYPE_ERROR, inf.rejection().type());
        assertEquals("pressure", inf.rejection().field());
    }

    /**
     * Test 10: "1705312800.9" cannot convert to an integer → TYPE_ERROR; "1705312800" and 1705312800.9 pass
     */
    @Test
    void testDecimalTimestampStringIsTypeError() {
        Map<String, Object> decimal = TestReadings.raw("M-001", 0L, 70.0, 1.0, 100.0);
        decimal.put("timestamp", "1705312800.9");
        Map<String, Object> integral = TestReadings.raw("M-001", 0L, 70.0, 1.0, 100.0);
        integral.put("timestamp", " 1705312800 ");
        Map<String, Object> number = TestReadings.raw("M-001", 0L, 70.0, 1.0, 100.0);
        number.put("timestamp", 1705312800.9);

        ValidationResult rejected = validator.validate(decimal);
        assertFalse(rejected.isValid());
        assertEquals(RejectionReason.Type.TYPE_ERROR, rejected.rejection().type());
        assertEquals("timestamp", rejected.rejection().field());

        assertEquals(1705312800L, validator.validate(integral).reading().getTimestamp());
        assertEquals(1705312800L, validator.validate(number).reading().getTimestamp());
    }

    /**
     * Test 11: Long.MAX_VALUE / Long.MIN_VALUE → TYPE_ERROR
     */
    @Test
    void testTimestampOutsideInstantRangeIsTypeError() {
        ValidationResult tooLate = validator.validate(TestReadings.raw("M-001", Long.MAX_VALUE, 70.0, 1.0, 100.0));
        ValidationResult tooEarly = validator.validate(TestReadings.raw("M-001", Long.MIN_VALUE, 70.0, 1.0, 100.0));

        assertEquals(RejectionReason.Type.TYPE_ERROR, tooLate.rejection().type());
        assertEquals("timestamp", tooLate.rejection().field());
        assertEquals(RejectionReason.Type.TYPE_ERROR, tooEarly.rejection().type());
    }
}
