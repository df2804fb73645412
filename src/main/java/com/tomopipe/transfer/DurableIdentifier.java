package com.tomopipe.transfer;

import java.time.LocalDate;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Archive identifiers of the form {@code <initials><yyyy-MM-dd>-<nnn>}, for example
 * {@code mm2024-07-25-003}.
 */
public final class DurableIdentifier {
    private static final Pattern SEQUENCE = Pattern.compile("-(\\d{3,})$");

    private DurableIdentifier() {
    }

    /**
     * Lower-case first letters of each word of the operator name.
     */
    public static String initials(String operator) {
        StringBuilder initials = new StringBuilder();
        for (String word : operator.strip().split("\\s+")) {
            if (!word.isEmpty()) {
                initials.append(word.charAt(0));
            }
        }
        return initials.toString().toLowerCase(Locale.ROOT);
    }

    public static String prefix(String initials, LocalDate date) {
        return initials + date;
    }

    public static String format(String initials, LocalDate date, int sequence) {
        return prefix(initials, date) + "-" + String.format(Locale.ROOT, "%03d", sequence);
    }

    /**
     * Sequence number of an identifier with the given prefix, or 0 when it has none.
     */
    public static int sequenceOf(String identifier, String prefix) {
        if (!identifier.startsWith(prefix + "-")) {
            return 0;
        }
        Matcher matcher = SEQUENCE.matcher(identifier);
        return matcher.find() && matcher.start() == prefix.length() ? Integer.parseInt(matcher.group(1)) : 0;
    }
}
