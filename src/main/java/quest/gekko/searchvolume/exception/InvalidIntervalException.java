package quest.gekko.searchvolume.exception;

import java.time.LocalDate;

/**
 * A date interval whose start lies after its end.
 */
public class InvalidIntervalException extends RuntimeException {

    public InvalidIntervalException(final LocalDate start, final LocalDate end) {
        super("Interval start " + start + " is after end " + end);
    }
}
