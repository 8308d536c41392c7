package de.unibi.cebitec.corpus.sync.util;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

public final class ByteSizes {

    private ByteSizes() {
    }

    public static String format(long bytes) {
        return format(bytes, "");
    }

    public static String format(long bytes, String suffix) {
        DecimalFormat f = new DecimalFormat("#0.00", DecimalFormatSymbols.getInstance(Locale.ROOT));
        if (bytes > 1e12) {
            return f.format(bytes / 1e12) + "TB" + suffix;
        }
        if (bytes > 1e9) {
            return f.format(bytes / 1e9) + "GB" + suffix;
        }
        if (bytes > 1e6) {
            return f.format(bytes / 1e6) + "MB" + suffix;
        }
        if (bytes > 1e3) {
            return f.format(bytes / 1e3) + "KB" + suffix;
        }
        return bytes + "B" + suffix;
    }

    /**
     * Average throughput over {@code millis}, {@code "unknown"} for runs shorter than a second.
     */
    public static String rate(long bytes, long millis) {
        long seconds = millis / 1000;
        if (seconds == 0) {
            return "unknown";
        }
        return format(bytes / seconds, "/s");
    }
}
