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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates {@link Measure measures} over sets of items.
 */
public class Aggregates {
    private static final Logger LOGGER = LoggerFactory.getLogger(Aggregates.class);

    private Aggregates() {} // Prevent instantiation

    /**
     * The arithmetic used to reduce a set of numbers. Integral values of every width reduce as {@code long}, so
     * narrow types cannot overflow in a sum.
     */
    private enum Kind {
        LONG,
        BIG_INTEGER,
        DOUBLE,
        BIG_DECIMAL
    }

    /**
     * Returns the result of applying the measure's aggregate to the given items, or {@code null} if there are no
     * items.
     *
     * <p>The result depends on whether the measure's values are numeric:
     *
     * <table>
     *     <caption>Aggregate results</caption>
     *     <tr><th>Aggregate</th><th>Numeric</th><th>Non-numeric</th></tr>
     *     <tr><td>SUM</td><td>sum of values</td><td>item count</td></tr>
     *     <tr><td>AVERAGE</td><td>mean of values</td><td>item count</td></tr>
     *     <tr><td>COUNT</td><td>item count</td><td>item count</td></tr>
     *     <tr><td>MIN</td><td>smallest value</td><td>first item</td></tr>
     *     <tr><td>MAX</td><td>largest value</td><td>last item</td></tr>
     *     <tr><td>FIRST</td><td>first item's value</td><td>first item's value</td></tr>
     *     <tr><td>LAST</td><td>last item's value</td><td>last item's value</td></tr>
     * </table>
     *
     * <p>Values are numeric if the measure declares a numeric value type, or, when it declares none, if every non-null
     * value is a {@code Number} and there is at least one. Numeric aggregates skip {@code null} values. Integral sums are
     * {@code Long}, integral and floating averages are {@code Double}, and {@code BigInteger} or {@code BigDecimal}
     * values reduce exactly. Counts are {@code Long}.
     *
     * <p>If the measure's selector or the arithmetic fails, the failure is logged and the result is {@code null}.
     *
     * @param items the items
     * @param measure the measure
     * @return the aggregate result, or {@code null}
     * @param <T> the item type
     */
    public static <T> Object evaluate(List<T> items, Measure<T> measure) {
        if (items.isEmpty())
            return null;
        try {
            return apply(items, measure);
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to evaluate {} over {} items: {}", measure, items.size(), e.toString());
            return null;
        }
    }

    /**
     * Evaluates the measure over the items whose keys on the given fields equal the given path.
     *
     * @param items the items
     * @param fields the fields the path values correspond to
     * @param path the group keys to match, in field order
     * @param measure the measure
     * @return the aggregate result, or {@code null} if no item matches
     * @param <T> the item type
     */
    public static <T> Object evaluate(List<T> items, List<Field<T>> fields, List<?> path, Measure<T> measure) {
        List<T> matched;
        try {
            matched = Utils.filter(items, fields, path);
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to select items on path {} for {}: {}", path, measure, e.toString());
            return null;
        }
        return evaluate(matched, measure);
    }

    private static <T> Object apply(List<T> items, Measure<T> measure) {
        switch (measure.aggregate()) {
            case COUNT:
                return count(items);
            case FIRST:
                return measure.get(items.get(0));
            case LAST:
                return measure.get(items.get(items.size() - 1));
            default:
                break;
        }

        List<Object> values = new ArrayList<>(items.size());
        for (T item : items)
            values.add(measure.get(item));
        if (!isNumeric(measure.valueType(), values))
            return fallback(items, measure.aggregate());

        List<Number> numbers = new ArrayList<>(values.size());
        for (Object value : values)
            if (value != null)
                numbers.add((Number) value);
        Kind kind = kindOf(numbers, measure.valueType());

        switch (measure.aggregate()) {
            case AVERAGE:
                return average(numbers, kind);
            case MIN:
                return extreme(numbers, kind, -1);
            case MAX:
                return extreme(numbers, kind, 1);
            case SUM:
            default:
                return sum(numbers, kind);
        }
    }

    private static <T> Object fallback(List<T> items, Aggregate aggregate) {
        switch (aggregate) {
            case MIN:
                return items.get(0);
            case MAX:
                return items.get(items.size() - 1);
            case SUM:
            case AVERAGE:
            default:
                return count(items);
        }
    }

    private static Long count(List<?> items) {
        return (long) items.size();
    }

    static boolean isNumeric(Class<?> valueType, List<?> values) {
        if (valueType != null)
            return isNumericType(valueType);
        boolean sawNumber = false;
        for (Object value : values) {
            if (value == null)
                continue;
            if (!(value instanceof Number))
                return false;
            sawNumber = true;
        }
        return sawNumber;
    }

    private static boolean isNumericType(Class<?> type) {
        if (type.isPrimitive())
            return type != boolean.class && type != char.class && type != void.class;
        return Number.class.isAssignableFrom(type);
    }

    private static Kind kindOf(List<Number> numbers, Class<?> valueType) {
        boolean sawBigInteger = false;
        boolean sawFloating = false;
        boolean sawBigDecimal = false;
        if (numbers.isEmpty() && valueType != null) {
            Kind kind = kindOf(valueType);
            sawBigInteger = kind == Kind.BIG_INTEGER;
            sawFloating = kind == Kind.DOUBLE;
            sawBigDecimal = kind == Kind.BIG_DECIMAL;
        }
        for (Number number : numbers) {
            switch (kindOf(number.getClass())) {
                case BIG_INTEGER: sawBigInteger = true; break;
                case DOUBLE: sawFloating = true; break;
                case BIG_DECIMAL: sawBigDecimal = true; break;
                default: break;
            }
        }
        if (sawBigDecimal || (sawBigInteger && sawFloating))
            return Kind.BIG_DECIMAL;
        if (sawFloating)
            return Kind.DOUBLE;
        if (sawBigInteger)
            return Kind.BIG_INTEGER;
        return Kind.LONG;
    }

    private static Kind kindOf(Class<?> type) {
        if (type == Long.class || type == Integer.class || type == Short.class || type == Byte.class
            || type == long.class || type == int.class || type == short.class || type == byte.class)
            return Kind.LONG;
        if (type == BigInteger.class)
            return Kind.BIG_INTEGER;
        if (type == BigDecimal.class)
            return Kind.BIG_DECIMAL;
        return Kind.DOUBLE;
    }

    private static Object sum(List<Number> numbers, Kind kind) {
        switch (kind) {
            case LONG: {
                long sum = 0;
                for (Number number : numbers)
                    sum = Math.addExact(sum, number.longValue());
                return sum;
            }
            case DOUBLE: {
                double sum = 0;
                for (Number number : numbers)
                    sum += number.doubleValue();
                return sum;
            }
            case BIG_INTEGER: {
                BigInteger sum = BigInteger.ZERO;
                for (Number number : numbers)
                    sum = sum.add(toBigInteger(number));
                return sum;
            }
            case BIG_DECIMAL:
            default: {
                BigDecimal sum = BigDecimal.ZERO;
                for (Number number : numbers)
                    sum = sum.add(toBigDecimal(number));
                return sum;
            }
        }
    }

    private static Object average(List<Number> numbers, Kind kind) {
        if (numbers.isEmpty())
            return null;
        Object sum = sum(numbers, kind);
        int count = numbers.size();
        switch (kind) {
            case LONG:
                return (double) (Long) sum / count;
            case DOUBLE:
                return (Double) sum / count;
            case BIG_INTEGER:
                return new BigDecimal((BigInteger) sum).divide(BigDecimal.valueOf(count), MathContext.DECIMAL128);
            case BIG_DECIMAL:
            default:
                return ((BigDecimal) sum).divide(BigDecimal.valueOf(count), MathContext.DECIMAL128);
        }
    }

    /**
     * The original value of the smallest (sign -1) or largest (sign 1) number. Ties keep the earlier number.
     */
    private static Number extreme(List<Number> numbers, Kind kind, int sign) {
        Number best = null;
        for (Number number : numbers)
            if (best == null || sign * compare(number, best, kind) > 0)
                best = number;
        return best;
    }

    private static int compare(Number a, Number b, Kind kind) {
        switch (kind) {
            case LONG:
                return Long.compare(a.longValue(), b.longValue());
            case DOUBLE:
                return Double.compare(a.doubleValue(), b.doubleValue());
            case BIG_INTEGER:
                return toBigInteger(a).compareTo(toBigInteger(b));
            case BIG_DECIMAL:
            default:
                return toBigDecimal(a).compareTo(toBigDecimal(b));
        }
    }

    private static BigInteger toBigInteger(Number number) {
        if (number instanceof BigInteger)
            return (BigInteger) number;
        return BigInteger.valueOf(number.longValue());
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal)
            return (BigDecimal) number;
        if (number instanceof BigInteger)
            return new BigDecimal((BigInteger) number);
        if (kindOf(number.getClass()) == Kind.LONG)
            return BigDecimal.valueOf(number.longValue());
        return BigDecimal.valueOf(number.doubleValue());
    }
}
