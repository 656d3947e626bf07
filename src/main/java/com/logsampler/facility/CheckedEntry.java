package com.logsampler.facility;

import com.logsampler.model.Field;
import com.logsampler.model.LogEntry;
import lombok.Getter;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates the facilities that agreed to log an entry during
 * {@link Facility#check}. Not thread-safe; one instance belongs to one log call.
 */
public final class CheckedEntry {
    @Getter
    private final LogEntry entry;
    private final List<Facility> facilities = new ArrayList<>(2);

    private CheckedEntry(LogEntry entry) {
        this.entry = entry;
    }

    /**
     * Add a facility to the accumulator, creating it on first use
     */
    public static CheckedEntry add(@Nullable CheckedEntry checked, LogEntry entry, Facility facility) {
        CheckedEntry target = checked != null ? checked : new CheckedEntry(entry);
        target.facilities.add(facility);
        return target;
    }

    public List<Facility> getFacilities() {
        return Collections.unmodifiableList(facilities);
    }

    /**
     * Write the entry to every facility that accepted it
     */
    public void write(List<Field> fields) {
        for (Facility facility : facilities) {
            facility.write(entry, fields);
        }
    }
}
