package com.afipvision.core.image;

import com.afipvision.app.Config;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityTierTest {

    @Test
    void tiersAreMonotonic() {
        ComplexityTier prev = ComplexityTier.SIMPLE;
        for (int i = 0; i <= 100; i++) {
            ComplexityTier t = ComplexityTier.of(i / 100.0, 0.3, 0.6);
            assertTrue(t.ordinal() >= prev.ordinal(), "at " + i);
            prev = t;
        }
        assertEquals(ComplexityTier.SIMPLE, ComplexityTier.of(0.29, 0.3, 0.6));
        assertEquals(ComplexityTier.MEDIUM, ComplexityTier.of(0.3, 0.3, 0.6));
        assertEquals(ComplexityTier.COMPLEX, ComplexityTier.of(0.6, 0.3, 0.6));
    }

    @Test
    void scoreIsClampedAndUnreadableIsMedium() {
        Config.ComplexityConf cfg = Config.defaults().complexity();
        assertEquals(1.0, ComplexityScore.of(1.7, cfg).value());
        assertEquals(0.0, ComplexityScore.of(-0.2, cfg).value());
        assertEquals(ComplexityTier.MEDIUM, ComplexityScore.unreadable(cfg).tier());
        assertThrows(IllegalArgumentException.class, () -> new ComplexityScore(1.1, ComplexityTier.COMPLEX));
    }
}
