package com.docqueue.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for typed metadata parsing in processors.
 */
public class BaseProcessorTest {

    static class Options {
        String mode;
        int pages;
    }

    private final BaseProcessor processor = new BaseProcessor("probe") {
        @Override
        public void process(ProcessingContext context) {
        }
    };

    @Test
    public void testParsesMetadata() throws ProcessingException {
        Options options = processor.fromMetadata("{\"mode\":\"fast\",\"pages\":3,\"extra\":true}", Options.class);

        assertEquals("fast", options.mode);
        assertEquals(3, options.pages);
    }

    @Test
    public void testBlankMetadataIsNull() throws ProcessingException {
        assertNull(processor.fromMetadata("  ", Options.class));
        assertNull(processor.fromMetadata(null, Options.class));
    }

    @Test
    public void testMalformedMetadata() {
        ProcessingException e = assertThrows(ProcessingException.class,
                () -> processor.fromMetadata("{\"mode\":", Options.class));

        assertEquals("invalid_metadata", e.getCode());
    }

    @Test
    public void testNameAndToString() {
        assertEquals("probe", processor.getName());
        assertTrue(processor.toString().contains("probe"));
    }
}
