package org.safeformat.operators.format;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.safeformat.runtime.FormatArgument;

import java.math.BigDecimal;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.safeformat.operators.format.TemplateFormatterTest.render;

public class FormatNumericRendererTest {

    @ParameterizedTest(name = "{0} with {1} -> ''{2}''")
    @CsvSource(delimiter = '|', value = {
            "{0}       | 0           | 0",
            "{0}       | 42          | 42",
            "{0}       | -42         | -42",
            "{0:d}     | 42          | 42",
            "{0:+}     | 3           | +3",
            "{0:+d}    | 0           | +0",
            "{0:+05d}  | -3          | -0003",
            "{0:+05d}  | 3           | +0003",
            "{0:5}     | 42          | '   42'",
            "{0:5}     | -42         | '  -42'",
            "{0:+5}    | 42          | '  +42'",
            "{0:05}    | 42          | 00042",
            "{0:05}    | -42         | -0042",
            "{0:1}     | 12345       | 12345",
            "{0:x}     | 255         | ff",
            "{0:X}     | 48879       | BEEF",
            "{0:#x}    | 255         | 0xff",
            "{0:#X}    | 255         | 0XFF",
            "{0:#8x}   | 255         | '    0xff'",
            "{0:#08x}  | 255         | 0x0000ff",
            "{0:08x}   | 255         | 000000ff",
            "{0:+x}    | 255         | ff",
            "{0:o}     | 8           | 10",
            "{0:#o}    | 8           | 10",
            "{0:x}     | -1          | ffffffff",
            "{0:o}     | -1          | 37777777777",
            "{0:x}     | 0           | 0",
            "{0:#x}    | 0           | 0x0",
            "{0}       | -2147483648 | -2147483648",
    })
    void testIntFormatting(String template, int value, String expected) {
        assertEquals(expected, render(template, FormatArgument.ofInt(value)));
    }

    @Test
    void testWideIntegers() {
        assertEquals("-9223372036854775808", render("{0}", FormatArgument.ofLong(Long.MIN_VALUE)));
        assertEquals("9223372036854775807", render("{0}", FormatArgument.ofLong(Long.MAX_VALUE)));
        assertEquals("ffffffffffffffff", render("{0:x}", FormatArgument.ofLong(-1)));
        assertEquals("+12", render("{0:+}", FormatArgument.ofLong(12)));
    }

    @Test
    void testUnsignedIntegers() {
        assertEquals("4294967295", render("{0}", FormatArgument.ofUnsigned(-1)));
        assertEquals("ffffffff", render("{0:x}", FormatArgument.ofUnsigned(-1)));
        assertEquals("18446744073709551615", render("{0}", FormatArgument.ofUnsignedLong(-1)));
        assertEquals("0x000000ff", render("{0:#010x}", FormatArgument.ofUnsignedLong(255)));
    }

    @Test
    void testPointer() {
        assertEquals("0xff", render("{0}", FormatArgument.ofPointer(0xff)));
        assertEquals("0xff", render("{0:p}", FormatArgument.ofPointer(0xff)));
        assertEquals("0x0", render("{0}", FormatArgument.ofPointer(0)));
        assertEquals("    0xff", render("{0:8}", FormatArgument.ofPointer(0xff)));
        assertEquals("0xffffffffffffffff", render("{0}", FormatArgument.ofPointer(-1)));
    }

    @Test
    void testPointerWidthBelowNaturalSize() {
        // Width shorter than the prefix plus digits must not truncate
        assertEquals("0xabc", render("{0:3}", FormatArgument.ofPointer(0xabc)));
        assertEquals("0xabc", render("{0:5}", FormatArgument.ofPointer(0xabc)));
        assertEquals(" 0xabc", render("{0:6}", FormatArgument.ofPointer(0xabc)));
    }

    @Test
    void testPointerToObject() {
        Object value = new Object();
        String expected = "0x" + Integer.toHexString(System.identityHashCode(value));
        assertEquals(expected, render("{0}", FormatArgument.pointerTo(value)));
    }

    @ParameterizedTest(name = "{0} with {1} -> ''{2}''")
    @CsvSource(delimiter = '|', value = {
            "{0}         | 1.5       | 1.5",
            "{0}         | 100000    | 100000",
            "{0}         | 0.0001    | 0.0001",
            "{0}         | 1e10      | 1e+10",
            "{0:G}       | 1e-10     | 1E-10",
            "{0:.2f}     | 1.23      | 1.23",
            "{0:.2f}     | 3.14159   | 3.14",
            "{0:f}       | 3.14      | 3.140000",
            "{0:F}       | 2.5       | 2.500000",
            "{0:+f}      | 3.14      | +3.140000",
            "{0:+f}      | -3.14     | -3.140000",
            "{0:e}       | 12345.678 | 1.234568e+04",
            "{0:E}       | 12345.678 | 1.234568E+04",
            "{0:10.3f}   | 3.14159   | '     3.142'",
            "{0:010.3f}  | -3.14159  | -00003.142",
            "{0:+08.2f}  | 1.5       | +0001.50",
            "{0:3.2f}    | 123.456   | 123.46",
            "{0}         | 5e-324    | 4.94066e-324",
            "{0:.2f}     | 2.675     | 2.67",
            "{0:.20f}    | 0.1       | 0.10000000000000000555",
            "{0}         | 999999.5  | 1e+06",
            "{0}         | 123456.7  | 123457",
            "{0:f}       | -0.0      | -0.000000",
    })
    void testDoubleFormatting(String template, double value, String expected) {
        assertEquals(expected, render(template, FormatArgument.ofDouble(value)));
    }

    static Stream<Arguments> provideSpecialValues() {
        return Stream.of(
                Arguments.of("{0}", Double.NaN, "nan"),
                Arguments.of("{0:F}", Double.NaN, "NAN"),
                Arguments.of("{0}", Double.POSITIVE_INFINITY, "inf"),
                Arguments.of("{0}", Double.NEGATIVE_INFINITY, "-inf"),
                Arguments.of("{0:+}", Double.POSITIVE_INFINITY, "+inf"),
                Arguments.of("{0:E}", Double.NEGATIVE_INFINITY, "-INF"),
                Arguments.of("{0:06}", Double.NEGATIVE_INFINITY, "  -inf"),
                Arguments.of("{0:5.2f}", Double.NaN, "  nan")
        );
    }

    @ParameterizedTest(name = "{0} with {1}")
    @MethodSource("provideSpecialValues")
    void testSpecialValuesAreSpacePadded(String template, double value, String expected) {
        assertEquals(expected, render(template, FormatArgument.ofDouble(value)));
    }

    @Test
    void testExtendedPrecisionIsKept() {
        assertEquals("0.10000000000000000000",
                render("{0:.20f}", FormatArgument.ofExtended(new BigDecimal("0.1"))));
        assertEquals("1.000000000000000000001",
                render("{0:.21f}", FormatArgument.ofExtended(new BigDecimal("1.000000000000000000001"))));
        assertEquals("+2.50", render("{0:+.2f}", FormatArgument.ofExtended(new BigDecimal("2.5"))));
        assertEquals("2.5", render("{0}", FormatArgument.ofExtended(new BigDecimal("2.5"))));
    }

    @Test
    void testRemoveTrailingZeros() {
        assertEquals("1.5", FormatNumericRenderer.removeTrailingZeros("1.50000"));
        assertEquals("2", FormatNumericRenderer.removeTrailingZeros("2.00000"));
        assertEquals("1e+10", FormatNumericRenderer.removeTrailingZeros("1.00000e+10"));
        assertEquals("1.25E-05", FormatNumericRenderer.removeTrailingZeros("1.25000E-05"));
        assertEquals("100", FormatNumericRenderer.removeTrailingZeros("100"));
    }

    @Test
    void testWidenExponent() {
        assertEquals("1.5e+04", FormatNumericRenderer.widenExponent("1.5e+4"));
        assertEquals("1E-05", FormatNumericRenderer.widenExponent("1E-5"));
        assertEquals("1.5e+10", FormatNumericRenderer.widenExponent("1.5e+10"));
        assertEquals("2.5", FormatNumericRenderer.widenExponent("2.5"));
    }

    @Test
    void testWideConversionGrowsBuffer() {
        String result = render("{0:.400f}", FormatArgument.ofDouble(1));
        assertEquals(402, result.length());
        assertTrue(result.startsWith("1.000"));
    }
}
