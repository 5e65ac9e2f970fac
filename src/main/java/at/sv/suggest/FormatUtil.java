package at.sv.suggest;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.Locale;

public final class FormatUtil {
    private FormatUtil() {
    }

    /**
     * Formats a confidence in [0, 1] as whole percent, e.g. {@code 0.857} as {@code 86%}. Exact halves round to
     * the even percent, {@code 0.725} is {@code 72%}.
     */
    public static String formatPercent(double confidence) {
        return new BigDecimal(confidence * 100.0).setScale(0, RoundingMode.HALF_EVEN).toPlainString() + "%";
    }

    public static String formatHour(int hour) {
        return String.format(Locale.ROOT, "%02d:00", hour);
    }

    /**
     * Formats the given hours with at most one decimal and without trailing zeros, e.g. {@code 2.0} as {@code 2} and
     * {@code 1.5} as {@code 1.5}.
     */
    public static String formatHours(double hours) {
        double roundedOneDecimal = Math.round(hours * 10.0) / 10.0;
        if (Math.abs(roundedOneDecimal - Math.rint(roundedOneDecimal)) < 0.0001) {
            return String.valueOf((long) Math.rint(roundedOneDecimal));
        }
        return String.format(Locale.ROOT, "%.1f", roundedOneDecimal);
    }

    /**
     * @param dayOfWeek zero based weekday, 0 = Monday
     * @return the English day name, e.g. {@code Monday}
     */
    public static String formatDayOfWeek(int dayOfWeek) {
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            return "day";
        }
        return DayOfWeek.of(dayOfWeek + 1).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }
}
