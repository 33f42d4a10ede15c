package com.vidnyan.rpax;

import com.vidnyan.rpax.domain.pseudocode.PseudocodeExpander;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RpaxPropertiesTest {

    @Test
    void init_ShouldApplyDefaults() {
        // Arrange
        RpaxProperties properties = new RpaxProperties();

        // Act
        properties.init();

        // Assert
        assertTrue(properties.getScan().getExcludePatterns().contains(".local/**"));
        assertFalse(properties.getInvocation().getDynamicIndicators().isEmpty());
        assertTrue(properties.getPseudocode().isGenerateExpanded());
        assertEquals(3, properties.getPseudocode().getMaxExpansionDepth());
        assertEquals(PseudocodeExpander.CycleHandling.DETECT_AND_MARK, properties.getPseudocode().getCycleHandling());
        assertTrue(properties.getExplain().isEmpty());
    }

    @Test
    void init_ShouldRejectExpansionDepthOutOfRange() {
        RpaxProperties tooDeep = new RpaxProperties();
        tooDeep.getPseudocode().setMaxExpansionDepth(11);
        RpaxProperties negative = new RpaxProperties();
        negative.getPseudocode().setMaxExpansionDepth(-1);

        assertThrows(IllegalArgumentException.class, tooDeep::init);
        assertThrows(IllegalArgumentException.class, negative::init);
    }

    @Test
    void init_ShouldAcceptExpansionDepthBounds() {
        RpaxProperties none = new RpaxProperties();
        none.getPseudocode().setMaxExpansionDepth(0);
        RpaxProperties deepest = new RpaxProperties();
        deepest.getPseudocode().setMaxExpansionDepth(10);

        assertDoesNotThrow(none::init);
        assertDoesNotThrow(deepest::init);
    }
}
