package com.acme.rmq.cli.output;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

public final class OutputUtilities {
    private static final long KB = 1024;
    private static final long MB = KB * 1024;
    private static final long GB = MB * 1024;

    private OutputUtilities() {
    }

    /** {@code 512 bytes}, {@code 1.5 KB}, {@code 2 MB}, ... rounded to two decimals. */
    public static String toSizeString(long bytes) {
        if (bytes >= GB) {
            return scaled(bytes, GB) + " GB";
        }
        if (bytes >= MB) {
            return scaled(bytes, MB) + " MB";
        }
        if (bytes >= KB) {
            return scaled(bytes, KB) + " KB";
        }
        return bytes + " bytes";
    }

    private static String scaled(long bytes, long unit) {
        return BigDecimal.valueOf(bytes)
                .divide(BigDecimal.valueOf(unit), 2, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
    }

    public static String messageCountString(long count) {
        return count + (count == 1 ? " message" : " messages");
    }

    /** {@code 1h 2m 3s 45ms}; units above milliseconds are omitted when zero. */
    public static String elapsedString(Duration elapsed) {
        StringBuilder sb = new StringBuilder();
        if (elapsed.toDaysPart() > 0) {
            sb.append(elapsed.toDaysPart()).append("d ");
        }
        if (elapsed.toHoursPart() > 0) {
            sb.append(elapsed.toHoursPart()).append("h ");
        }
        if (elapsed.toMinutesPart() > 0) {
            sb.append(elapsed.toMinutesPart()).append("m ");
        }
        if (elapsed.toSecondsPart() > 0) {
            sb.append(elapsed.toSecondsPart()).append("s ");
        }
        sb.append(elapsed.toMillisPart()).append("ms");
        return sb.toString();
    }
}
