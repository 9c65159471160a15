package com.jslowering.codegen;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static com.jslowering.testing.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class UniqueIdentifierGeneratorTest {

    @Test
    void testGeneratesIncreasingNames() {
        UniqueIdentifierGenerator generator = new UniqueIdentifierGenerator();

        assertEquals("$__0", generator.generateUniqueIdentifier());
        assertEquals("$__1", generator.generateUniqueIdentifier());
        assertEquals("$__2", generator.generateUniqueIdentifier());
    }

    @Test
    void testSkipsReservedNames() {
        UniqueIdentifierGenerator generator = new UniqueIdentifierGenerator("t", Set.of("t0", "t2"));

        assertEquals("t1", generator.generateUniqueIdentifier());
        assertEquals("t3", generator.generateUniqueIdentifier());
    }

    @Test
    void testForTreeAvoidsSourceNames() {
        UniqueIdentifierGenerator generator = UniqueIdentifierGenerator.forTree(program(
            var("$__0", num(1)),
            function("f", stmt(call("$__1")))));

        assertEquals("$__2", generator.generateUniqueIdentifier());
    }

    @Test
    void testNamesNeverRepeat() {
        UniqueIdentifierGenerator generator = new UniqueIdentifierGenerator();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            assertTrue(seen.add(generator.generateUniqueIdentifier()));
        }
    }

    @Test
    void testEmptyPrefixIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new UniqueIdentifierGenerator("", Set.of()));
    }
}
