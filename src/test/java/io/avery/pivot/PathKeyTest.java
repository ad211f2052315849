/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.avery.pivot;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class PathKeyTest {
    @Test
    void testEqualPathsFromDifferentConstruction() {
        PathKey built = PathKey.ROOT.child("East").child(2023);
        assertEquals(PathKey.of("East", 2023), built);
        assertEquals(PathKey.of(Arrays.asList("East", 2023)), built);
        assertEquals(PathKey.of("East", 2023).hashCode(), built.hashCode());
        assertEquals(2, built.depth());
        assertEquals(2023, built.last());
        assertEquals(Arrays.asList("East", 2023), built.values());
    }

    @Test
    void testKeysThatPrintAlikeAreDistinct() {
        PathKey number = PathKey.of(10);
        PathKey string = PathKey.of("10");
        assertNotEquals(number, string);
        assertEquals(number.toString(), string.toString());
    }

    @Test
    void testJoinedForm() {
        assertEquals("East|Boston|2023", PathKey.of("East", "Boston", 2023).toString());
        assertEquals("East||2023", PathKey.of("East", null, 2023).toString());
        assertEquals("", PathKey.ROOT.toString());
    }

    @Test
    void testRoot() {
        assertSame(PathKey.ROOT, PathKey.of());
        assertEquals(0, PathKey.ROOT.depth());
        assertThrows(NoSuchElementException.class, PathKey.ROOT::last);
    }

    @Test
    void testChildDoesNotChangeParent() {
        PathKey parent = PathKey.of("East");
        parent.child("Boston");
        assertEquals(1, parent.depth());
        assertThrows(UnsupportedOperationException.class, () -> parent.values().set(0, "West"));
    }
}
