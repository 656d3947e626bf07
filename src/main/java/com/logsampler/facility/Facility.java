package com.logsampler.facility;

import com.logsampler.model.Field;
import com.logsampler.model.Level;
import com.logsampler.model.LogEntry;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * A destination for log entries: a level filter plus a sink.
 * Implementations must be safe for concurrent use.
 */
public interface Facility {
    /**
     * Whether entries at the given level would be logged at all
     */
    boolean enabled(Level level);

    /**
     * Decide whether this facility wants the entry. A facility that does adds
     * itself to the accumulator and returns it; one that does not returns the
     * accumulator unchanged.
     *
     * @param entry   the entry being logged
     * @param checked accumulator from previous facilities, may be null
     * @return the accumulator, possibly newly created
     */
    @Nullable
    CheckedEntry check(LogEntry entry, @Nullable CheckedEntry checked);

    /**
     * Derive a facility that attaches the given context to every entry it writes
     */
    Facility with(List<Field> fields);

    /**
     * Write an entry that an earlier {@link #check} accepted
     */
    void write(LogEntry entry, List<Field> fields);
}
