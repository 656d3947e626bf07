package com.logsampler.facility;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.logsampler.model.Field;
import com.logsampler.model.Level;
import com.logsampler.model.LogEntry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Facility that writes entries to an SLF4J logger, appending context and
 * call-site fields as a JSON object after the message.
 */
@Slf4j
public class Slf4jFacility implements Facility {
    private final Logger target;
    private final Level minimumLevel;
    private final ImmutableList<Field> context;
    private final ObjectMapper objectMapper;

    public Slf4jFacility(String loggerName, Level minimumLevel, ObjectMapper objectMapper) {
        this(LoggerFactory.getLogger(loggerName), minimumLevel, ImmutableList.of(), objectMapper);
    }

    public Slf4jFacility(Logger target, Level minimumLevel, ObjectMapper objectMapper) {
        this(target, minimumLevel, ImmutableList.of(), objectMapper);
    }

    private Slf4jFacility(Logger target, Level minimumLevel, ImmutableList<Field> context, ObjectMapper objectMapper) {
        this.target = Preconditions.checkNotNull(target, "target");
        this.minimumLevel = Preconditions.checkNotNull(minimumLevel, "minimumLevel");
        this.context = context;
        this.objectMapper = Preconditions.checkNotNull(objectMapper, "objectMapper");
    }

    @Override
    public boolean enabled(Level level) {
        if (!level.isAtLeast(minimumLevel)) {
            return false;
        }
        switch (level) {
            case DEBUG:
                return target.isDebugEnabled();
            case INFO:
                return target.isInfoEnabled();
            case WARN:
                return target.isWarnEnabled();
            default:
                return target.isErrorEnabled();
        }
    }

    @Override
    @Nullable
    public CheckedEntry check(LogEntry entry, @Nullable CheckedEntry checked) {
        if (enabled(entry.getLevel())) {
            return CheckedEntry.add(checked, entry, this);
        }
        return checked;
    }

    @Override
    public Facility with(List<Field> fields) {
        ImmutableList<Field> combined = ImmutableList.<Field>builder()
                .addAll(context)
                .addAll(fields)
                .build();
        return new Slf4jFacility(target, minimumLevel, combined, objectMapper);
    }

    @Override
    public void write(LogEntry entry, List<Field> fields) {
        String line = render(entry.getMessage(), fields);
        switch (entry.getLevel()) {
            case DEBUG:
                target.debug(line);
                break;
            case INFO:
                target.info(line);
                break;
            case WARN:
                target.warn(line);
                break;
            default:
                target.error(line);
                break;
        }
    }

    /**
     * Render the message followed by context and call-site fields
     */
    private String render(String message, List<Field> fields) {
        if (context.isEmpty() && fields.isEmpty()) {
            return message;
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (Field field : context) {
            values.put(field.getKey(), field.getValue());
        }
        for (Field field : fields) {
            values.put(field.getKey(), field.getValue());
        }
        try {
            return message + " " + objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            log.debug("Falling back to plain field rendering for message: {}", message, e);
            return message + " " + values;
        }
    }
}
