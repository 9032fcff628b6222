package com.ivamare.hostbridge.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class UpdatePriorityTest {

    @ParameterizedTest
    @EnumSource(UpdatePriority.class)
    void fromValueShouldReturnCorrectEnum(UpdatePriority priority) {
        assertEquals(priority, UpdatePriority.fromValue(priority.getValue()));
    }

    @Test
    void fromValueShouldDefaultToNormal() {
        assertEquals(UpdatePriority.NORMAL, UpdatePriority.fromValue(null));
        assertEquals(UpdatePriority.NORMAL, UpdatePriority.fromValue(" "));
    }

    @Test
    void fromValueShouldThrowForUnknownValue() {
        assertThrows(IllegalArgumentException.class, () -> UpdatePriority.fromValue("urgent"));
    }

    @Test
    void shouldBeDeclaredInDeliveryOrder() {
        assertArrayEquals(
            new UpdatePriority[] {UpdatePriority.HIGH, UpdatePriority.NORMAL, UpdatePriority.LOW},
            UpdatePriority.values()
        );
    }
}
