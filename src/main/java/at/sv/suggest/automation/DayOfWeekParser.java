package at.sv.suggest.automation;

import java.time.DayOfWeek;
import java.util.Locale;

public final class DayOfWeekParser {

    private DayOfWeekParser() {
    }

    public static DayOfWeek parseDay(String day) {
        switch (day.trim().toLowerCase(Locale.ENGLISH)) {
            case "mo":
            case "mon":
            case "monday":
                return DayOfWeek.MONDAY;
            case "tu":
            case "tue":
            case "tuesday":
                return DayOfWeek.TUESDAY;
            case "we":
            case "wed":
            case "wednesday":
                return DayOfWeek.WEDNESDAY;
            case "th":
            case "thu":
            case "thursday":
                return DayOfWeek.THURSDAY;
            case "fr":
            case "fri":
            case "friday":
                return DayOfWeek.FRIDAY;
            case "sa":
            case "sat":
            case "saturday":
                return DayOfWeek.SATURDAY;
            case "su":
            case "sun":
            case "sunday":
                return DayOfWeek.SUNDAY;
            default:
                throw new InvalidTemplateException("Unknown day parameter '" + day + "'. Please check your spelling. " +
                        "Supported values (case insensitive): [Mo|Mon|Monday, Tu|Tue|Tuesday, We|Wed|Wednesday, " +
                        "Th|Thu|Thursday, Fr|Fri|Friday, Sa|Sat|Saturday, Su|Sun|Sunday]");
        }
    }
}
