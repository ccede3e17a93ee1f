package com.vidnyan.wdllint.domain.model.type;

import org.junit.jupiter.api.Test;

import static com.vidnyan.wdllint.domain.model.type.Types.*;
import static org.junit.jupiter.api.Assertions.*;

class WdlTypeTest {

    @Test
    void toString_ShouldRenderWdlSyntax() {
        assertEquals("Int", integer().toString());
        assertEquals("String?", optional(string()).toString());
        assertEquals("Array[File]+", nonemptyArray(file()).toString());
        assertEquals("Map[String,Array[Int?]]", map(string(), array(optional(integer()))).toString());
        assertEquals("Pair[Float,Boolean]?", optional(pair(floating(), bool())).toString());
        assertEquals("Sample", struct("Sample").toString());
    }

    @Test
    void equals_ShouldDistinguishQuantifiers() {
        assertEquals(array(integer()), array(integer()));
        assertNotEquals(array(integer()), nonemptyArray(integer()));
        assertNotEquals(integer(), optional(integer()));
        assertEquals(array(any()), new ArrayType(new AnyType(false), false, false));
    }

    @Test
    void coerces_ShouldFollowPrimitiveConversions() {
        assertTrue(integer().coerces(floating(), true));
        assertTrue(integer().coerces(string(), true));
        assertTrue(floating().coerces(string(), true));
        assertTrue(string().coerces(file(), true));
        assertTrue(file().coerces(string(), true));
        assertFalse(floating().coerces(integer(), true));
        assertFalse(bool().coerces(integer(), true));
        assertFalse(string().coerces(integer(), true));
    }

    @Test
    void coerces_ShouldPromoteToArray() {
        assertTrue(integer().coerces(array(integer()), true));
        assertTrue(file().coerces(array(string()), true));
        assertFalse(bool().coerces(array(integer()), true));
    }

    @Test
    void coerces_ShouldCheckQuantifierOnlyWhenAsked() {
        // Arrange
        WdlType maybeInt = optional(integer());

        // Act & Assert
        assertFalse(maybeInt.coerces(integer(), true));
        assertTrue(maybeInt.coerces(integer(), false));
        assertTrue(maybeInt.coerces(optional(integer()), true));
        assertTrue(integer().coerces(optional(integer()), true));
        assertFalse(array(optional(string())).coerces(array(string()), true));
    }

    @Test
    void coerces_ShouldRecurseIntoCompoundTypes() {
        assertTrue(map(string(), integer()).coerces(map(string(), floating()), true));
        assertFalse(map(string(), floating()).coerces(map(string(), integer()), true));
        assertTrue(pair(integer(), string()).coerces(pair(floating(), file()), true));
        assertFalse(pair(integer(), string()).coerces(map(integer(), string()), true));
        assertTrue(struct("A").coerces(struct("A"), true));
        assertFalse(struct("A").coerces(struct("B"), true));
    }

    @Test
    void coerces_ShouldAlwaysAllowAny() {
        assertTrue(any().coerces(integer(), true));
        assertTrue(optional(any()).coerces(integer(), true));
        assertTrue(integer().coerces(any(), true));
    }
}
