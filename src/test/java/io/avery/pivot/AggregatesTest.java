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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AggregatesTest {
    private static final Field<Object[]> KEY = new Field<>("Key", row -> row[0]);

    private static List<Object[]> rows(Object... values) {
        List<Object[]> rows = new ArrayList<>();
        for (Object value : values)
            rows.add(new Object[]{ value });
        return rows;
    }

    private static Measure<Object[]> measure(Aggregate aggregate) {
        return new Measure<>("Value", row -> row[0], aggregate);
    }

    private static Object eval(Aggregate aggregate, Object... values) {
        return Aggregates.evaluate(rows(values), measure(aggregate));
    }

    @Test
    void testNullOnEmpty() {
        for (Aggregate aggregate : Aggregate.values())
            assertNull(Aggregates.evaluate(Collections.<Object[]>emptyList(), measure(aggregate)), aggregate.name());
    }

    @Test
    void testNumericAggregates() {
        assertEquals(35L, eval(Aggregate.SUM, 10, 20, 5));
        assertEquals(35.0 / 3, eval(Aggregate.AVERAGE, 10, 20, 5));
        assertEquals(3L, eval(Aggregate.COUNT, 10, 20, 5));
        assertEquals(5, eval(Aggregate.MIN, 10, 20, 5));
        assertEquals(20, eval(Aggregate.MAX, 10, 20, 5));
        assertEquals(10, eval(Aggregate.FIRST, 10, 20, 5));
        assertEquals(5, eval(Aggregate.LAST, 10, 20, 5));
    }

    @Test
    void testNonNumericFallbacks() {
        List<Sale> sales = Sale.sample();
        Measure<Sale> city = new Measure<>("City", Sale::getCity);
        assertEquals(7L, Aggregates.evaluate(sales, city));
        assertEquals(7L, Aggregates.evaluate(sales, new Measure<>("City", Sale::getCity, Aggregate.AVERAGE)));
        assertEquals(7L, Aggregates.evaluate(sales, new Measure<>("City", Sale::getCity, Aggregate.COUNT)));
        assertSame(sales.get(0), Aggregates.evaluate(sales, new Measure<>("City", Sale::getCity, Aggregate.MIN)));
        assertSame(sales.get(6), Aggregates.evaluate(sales, new Measure<>("City", Sale::getCity, Aggregate.MAX)));
        assertEquals("Boston", Aggregates.evaluate(sales, new Measure<>("City", Sale::getCity, Aggregate.FIRST)));
        assertEquals("Boston", Aggregates.evaluate(sales, new Measure<>("City", Sale::getCity, Aggregate.LAST)));
    }

    @Test
    void testMixedValuesAreNotNumeric() {
        assertEquals(3L, eval(Aggregate.SUM, 1, "two", 3));
    }

    @Test
    void testNarrowIntegersAreWidened() {
        short big = 30000;
        List<Sale> sales = Arrays.asList(new Sale("East", "Boston", 2023, 1, big),
                                         new Sale("East", "Boston", 2023, 1, big),
                                         new Sale("East", "Boston", 2023, 1, big));
        Measure<Sale> quantity = new Measure<>("Quantity", Sale::getQuantity);
        assertEquals(90000L, Aggregates.evaluate(sales, quantity));
        assertEquals(30000.0, Aggregates.evaluate(sales, new Measure<>("Quantity", Sale::getQuantity,
                                                                         Aggregate.AVERAGE)));
        assertEquals(big, Aggregates.evaluate(sales, new Measure<>("Quantity", Sale::getQuantity, Aggregate.MAX)));
        assertEquals(256L, eval(Aggregate.SUM, (byte) 127, (byte) 127, (byte) 2));
    }

    @Test
    void testOverflowIsNull() {
        assertNull(eval(Aggregate.SUM, Long.MAX_VALUE, 1L));
    }

    @Test
    void testNullValuesAreSkipped() {
        assertEquals(10L, eval(Aggregate.SUM, null, 4, 6));
        assertEquals(5.0, eval(Aggregate.AVERAGE, null, 4, 6));
        assertEquals(4, eval(Aggregate.MIN, null, 4, 6));
        assertEquals(6, eval(Aggregate.MAX, 4, null, 6));
        assertEquals(3L, eval(Aggregate.COUNT, null, 4, 6));
        assertNull(eval(Aggregate.FIRST, null, 4, 6));
    }

    @Test
    void testAllNullValues() {
        // Nothing to infer a type from.
        assertEquals(2L, eval(Aggregate.SUM, null, null));

        Measure<Object[]> sum = measure(Aggregate.SUM).withValueType(Integer.class);
        assertEquals(0L, Aggregates.evaluate(rows(null, null), sum));
        assertNull(Aggregates.evaluate(rows(null, null), measure(Aggregate.AVERAGE).withValueType(Integer.class)));
        assertNull(Aggregates.evaluate(rows(null, null), measure(Aggregate.MIN).withValueType(Integer.class)));
        assertEquals(0.0, Aggregates.evaluate(rows(null, null), measure(Aggregate.SUM).withValueType(double.class)));
    }

    @Test
    void testDeclaredValueType() {
        Measure<Object[]> numeric = measure(Aggregate.SUM).withValueType(Integer.class);
        assertNull(Aggregates.evaluate(rows("a", "b"), numeric));

        Measure<Object[]> text = measure(Aggregate.SUM).withValueType(String.class);
        assertEquals(2L, Aggregates.evaluate(rows(1, 2), text));
    }

    @Test
    void testFloatingAndExactArithmetic() {
        assertEquals(3.5, eval(Aggregate.SUM, 1, 2.5));
        assertEquals(0, new BigDecimal("3.30").compareTo((BigDecimal) eval(Aggregate.SUM, new BigDecimal("1.10"),
                                                                            new BigDecimal("2.20"))));
        assertEquals(0, new BigDecimal("1.5").compareTo((BigDecimal) eval(Aggregate.AVERAGE, new BigDecimal("1"),
                                                                           new BigDecimal("2"))));
        assertEquals(BigInteger.valueOf(7), eval(Aggregate.SUM, BigInteger.valueOf(3), 4));
        assertEquals(0, new BigDecimal("3.5").compareTo((BigDecimal) eval(Aggregate.SUM, BigInteger.ONE, 2.5)));
        assertEquals(new BigDecimal("2.5"), eval(Aggregate.MAX, 1, new BigDecimal("2.5"), 2.0));
    }

    @Test
    void testFailureIsNull() {
        Measure<Sale> broken = new Measure<>("Broken", sale -> {
            throw new IllegalStateException("no such property");
        });
        assertNull(Aggregates.evaluate(Sale.sample(), broken));
        assertEquals(149L, Aggregates.evaluate(Sale.sample(), Sale.SUM_AMOUNT));
    }

    @Test
    void testEvaluateOnPath() {
        List<Sale> sales = Sale.sample();
        List<Field<Sale>> fields = Arrays.asList(Sale.REGION, Sale.CITY);
        assertEquals(42L, Aggregates.evaluate(sales, fields, Collections.singletonList("East"), Sale.SUM_AMOUNT));
        assertEquals(35L, Aggregates.evaluate(sales, fields, Arrays.asList("East", "Boston"), Sale.SUM_AMOUNT));
        assertEquals(149L, Aggregates.evaluate(sales, fields, Collections.emptyList(), Sale.SUM_AMOUNT));
        assertNull(Aggregates.evaluate(sales, fields, Collections.singletonList("east"), Sale.SUM_AMOUNT));
        assertNull(Aggregates.evaluate(sales, fields, Arrays.asList("West", "Boston"), Sale.SUM_AMOUNT));
    }

    @Test
    void testEvaluateOnPathUsesNativeEquality() {
        List<Object[]> data = rows(10, "10", 10L);
        Measure<Object[]> count = measure(Aggregate.COUNT);
        List<Field<Object[]>> fields = Collections.singletonList(KEY);
        assertEquals(1L, Aggregates.evaluate(data, fields, Collections.singletonList(10), count));
        assertEquals(1L, Aggregates.evaluate(data, fields, Collections.singletonList("10"), count));
    }

    @Test
    void testEvaluateOnPathWithFailingFieldIsNull() {
        Field<Sale> broken = new Field<>("Broken", sale -> {
            throw new IllegalStateException("no such property");
        });
        assertNull(Aggregates.evaluate(Sale.sample(), Collections.singletonList(broken),
                                       Collections.singletonList("East"), Sale.SUM_AMOUNT));
    }
}
