package at.sv.suggest.automation;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;

import static java.time.DayOfWeek.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DayOfWeekParserTest {

    private void parse(String input, DayOfWeek expected) {
        assertThat("Day of week differs for '" + input + "'.", DayOfWeekParser.parseDay(input), is(expected));
    }

    @Test
    void canParseShortNames() {
        parse("Mo", MONDAY);
        parse("Tu", TUESDAY);
        parse("We", WEDNESDAY);
        parse("Th", THURSDAY);
        parse("Fr", FRIDAY);
        parse("Sa", SATURDAY);
        parse("Su", SUNDAY);
    }

    @Test
    void canParseThreeLetterNames() {
        parse("mon", MONDAY);
        parse("Sun", SUNDAY);
    }

    @Test
    void canParseFullNames_caseInsensitive_trimmed() {
        parse("Wednesday", WEDNESDAY);
        parse(" SATURDAY ", SATURDAY);
    }

    @Test
    void unknownDay_exception() {
        assertThrows(InvalidTemplateException.class, () -> parse("Mx", MONDAY));
    }
}
