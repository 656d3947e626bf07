package com.logsampler.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsampler.facility.CheckedEntry;
import com.logsampler.facility.Facility;
import com.logsampler.facility.Slf4jFacility;
import com.logsampler.model.Field;
import com.logsampler.model.Level;
import com.logsampler.model.LogEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.slf4j.Logger;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class Slf4jFacilityTest {

    @Mock
    private Logger logger;

    private Slf4jFacility facility;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(logger.isDebugEnabled()).thenReturn(true);
        when(logger.isInfoEnabled()).thenReturn(true);
        when(logger.isWarnEnabled()).thenReturn(true);
        when(logger.isErrorEnabled()).thenReturn(true);
        facility = new Slf4jFacility(logger, Level.INFO, new ObjectMapper());
    }

    @Test
    void testMinimumLevelFiltersEntries() {
        assertFalse(facility.enabled(Level.DEBUG));
        assertTrue(facility.enabled(Level.INFO));
        assertTrue(facility.enabled(Level.ERROR));

        when(logger.isWarnEnabled()).thenReturn(false);
        assertFalse(facility.enabled(Level.WARN));
    }

    @Test
    void testCheckAddsItselfWhenEnabled() {
        assertNull(facility.check(LogEntry.of(Level.DEBUG, "noise"), null));

        CheckedEntry checked = facility.check(LogEntry.of(Level.INFO, "signal"), null);
        assertNotNull(checked);
        assertEquals(List.of(facility), checked.getFacilities());
        assertEquals("signal", checked.getEntry().getMessage());
    }

    @Test
    void testWritePlainMessage() {
        facility.write(LogEntry.of(Level.WARN, "disk almost full"), List.of());

        verify(logger).warn("disk almost full");
    }

    @Test
    void testWriteRendersContextAndFieldsAsJson() {
        Facility scoped = facility.with(List.of(Field.of("service", "api")));

        CheckedEntry checked = scoped.check(LogEntry.of(Level.INFO, "upstream timeout"), null);
        assertNotNull(checked);
        checked.write(List.of(Field.of("attempt", 3)));

        verify(logger).info("upstream timeout {\"service\":\"api\",\"attempt\":3}");
    }

    @Test
    void testUnserializableFieldFallsBackToPlainRendering() {
        facility.write(LogEntry.of(Level.ERROR, "bad field"), List.of(Field.of("payload", new Object())));

        ArgumentCaptor<String> line = ArgumentCaptor.forClass(String.class);
        verify(logger).error(line.capture());
        assertTrue(line.getValue().startsWith("bad field {payload=java.lang.Object@"), line.getValue());
    }
}
