package com.ivamare.hostbridge.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class ListChangeKindTest {

    @ParameterizedTest
    @EnumSource(ListChangeKind.class)
    void fromValueShouldReturnCorrectEnum(ListChangeKind kind) {
        assertEquals(kind, ListChangeKind.fromValue(kind.getValue()));
    }

    @ParameterizedTest
    @EnumSource(ListChangeKind.class)
    void updateTypeShouldCarryListPrefix(ListChangeKind kind) {
        assertEquals("list_" + kind.getValue(), kind.updateType().toString());
    }

    @Test
    void fromValueShouldThrowForUnknownValue() {
        assertThrows(IllegalArgumentException.class, () -> ListChangeKind.fromValue("move"));
    }
}
