package org.safeformat.operators.format;

/**
 * A parsed placeholder: {@code '{' index [':' ['+'] ['#'] ['0'] [width] ['.' precision] [type]] '}'}.
 */
public class FormatSpecifier {
    public int startPos;                // offset of the opening brace

    public int argumentIndex;           // 0-based
    public boolean plusFlag;
    public boolean hexPrefixFlag;
    public boolean zeroFlag;
    public int width;                   // 0 if not specified
    public int precision = -1;          // -1 if not specified
    public char conversionChar;         // 0 if not specified

    public boolean hasConversion() {
        return conversionChar != 0;
    }
}
