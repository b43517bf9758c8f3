package com.winevt.resources.windows;

/**
 * Converts message strings from the Windows resource compiler (wrc) placeholder syntax
 * to positional format syntax.
 *
 * <ul>
 *   <li>{@code %1} .. {@code %99} become {@code {0}} .. {@code {98}}; a printf style
 *       suffix such as {@code %1!s!} is dropped</li>
 *   <li>{@code %n} becomes a newline, {@code %r} a carriage return, {@code %t} a tab,
 *       {@code %b} a space</li>
 *   <li>{@code %%}, {@code %.} and {@code %!} become the escaped character</li>
 *   <li>{@code %0} ends the message</li>
 *   <li>literal braces are doubled</li>
 * </ul>
 */
public final class MessageStringFormatter {

    private MessageStringFormatter() {
        // utility class
    }

    /**
     * Formats a wrc message string in positional format.
     *
     * @param messageString the message string, may be null
     * @return the converted string, or null if the input is null
     */
    public static String formatInPositionalFormat(String messageString) {
        if (messageString == null) {
            return null;
        }

        StringBuilder result = new StringBuilder(messageString.length() + 8);
        int length = messageString.length();
        int index = 0;

        while (index < length) {
            char c = messageString.charAt(index);
            if (c == '{' || c == '}') {
                result.append(c).append(c);
                index++;
                continue;
            }
            if (c != '%' || index + 1 >= length) {
                result.append(c);
                index++;
                continue;
            }

            char next = messageString.charAt(index + 1);
            if (Character.isDigit(next)) {
                int end = index + 2;
                if (end < length && Character.isDigit(messageString.charAt(end))) {
                    end++;
                }
                int number = Integer.parseInt(messageString.substring(index + 1, end));
                if (number == 0) {
                    break;
                }
                result.append('{').append(number - 1).append('}');
                index = skipPrintfSpecification(messageString, end);
                continue;
            }

            switch (next) {
                case 'n' -> result.append('\n');
                case 'r' -> result.append('\r');
                case 't' -> result.append('\t');
                case 'b' -> result.append(' ');
                case '%', '.', '!' -> result.append(next);
                default -> result.append(c).append(next);
            }
            index += 2;
        }
        return result.toString();
    }

    private static int skipPrintfSpecification(String messageString, int index) {
        if (index < messageString.length() && messageString.charAt(index) == '!') {
            int closing = messageString.indexOf('!', index + 1);
            if (closing > 0) {
                return closing + 1;
            }
        }
        return index;
    }
}
