package work.pollochang.match.image.core;

import org.junit.jupiter.api.Test;
import work.pollochang.match.image.exception.ValidationException;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MatchConfigTest {

    @Test
    void testDefaults() {
        MatchConfig config = MatchConfig.defaults();

        assertTrue(config.searchMultipleScales());
        assertEquals(List.of(1.0, 0.9, 0.8, 0.7, 0.6, 0.5), config.scaleSteps());
        assertFalse(config.useGrayscale());
        assertEquals(0.8, config.confidence());
        assertEquals(100, config.limit());
        assertDoesNotThrow(config::validate);
    }

    @Test
    void testEffectiveScales() {
        assertEquals(List.of(1.0), MatchConfig.defaults().withSearchMultipleScales(false).effectiveScales());
        assertEquals(List.of(2.0, 1.0), MatchConfig.defaults().withScaleSteps(List.of(2.0, 1.0)).effectiveScales());
    }

    /**
     * 超出範圍的欄位
     */
    @Test
    void testValidate_OutOfRange_ShouldThrowValidationException() {
        MatchConfig config = MatchConfig.defaults();

        assertThrows(ValidationException.class, () -> config.withConfidence(1.01).validate());
        assertThrows(ValidationException.class, () -> config.withConfidence(-0.1).validate());
        assertThrows(ValidationException.class, () -> config.withConfidence(Double.NaN).validate());
        assertThrows(ValidationException.class, () -> config.withLimit(0).validate());
        assertThrows(ValidationException.class, () -> config.withScaleSteps(List.of()).validate());
        assertThrows(ValidationException.class, () -> config.withScaleSteps(List.of(1.0, 0.0)).validate());
        assertThrows(ValidationException.class, () -> config.withScaleSteps(List.of(-0.5)).validate());
        assertThrows(ValidationException.class, () -> config.withScaleSteps(List.of(Double.POSITIVE_INFINITY)).validate());
        assertThrows(ValidationException.class, () -> config.withScaleSteps(Arrays.asList(1.0, null)).validate());
    }

    /**
     * 邊界值合法
     */
    @Test
    void testValidate_Boundaries() {
        MatchConfig config = MatchConfig.defaults();

        assertDoesNotThrow(() -> config.withConfidence(0.0).validate());
        assertDoesNotThrow(() -> config.withConfidence(1.0).validate());
        assertDoesNotThrow(() -> config.withLimit(1).validate());
        assertDoesNotThrow(() -> config.withSearchMultipleScales(false).withScaleSteps(List.of()).validate());
    }

    @Test
    void testScaleSteps_ShouldBeCopied() {
        List<Double> steps = new java.util.ArrayList<>(List.of(1.0, 0.5));
        MatchConfig config = MatchConfig.defaults().withScaleSteps(steps);
        steps.add(0.25);

        assertEquals(List.of(1.0, 0.5), config.scaleSteps());
        assertThrows(UnsupportedOperationException.class, () -> config.scaleSteps().add(0.1));
        assertEquals(MatchConfig.DEFAULT_SCALE_STEPS, MatchConfig.defaults().withScaleSteps(null).scaleSteps());
    }
}
