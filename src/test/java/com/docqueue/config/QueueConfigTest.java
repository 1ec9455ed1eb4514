package com.docqueue.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class QueueConfigTest {

    @Test
    public void testDefaults() {
        QueueConfig config = new QueueConfig(new Properties());

        assertEquals(Paths.get("./queue"), config.getRoot());
        assertEquals(8080, config.getHttpPort());
        assertEquals("127.0.0.1", config.getHttpBind());
        assertNull(config.getHttpToken());
        assertEquals(4, config.getWorkers());
        assertEquals(1000, config.getPollIntervalMillis());
        assertEquals(4096, config.getMaxPathLength());
    }

    @Test
    public void testClasspathDefaultsMatchBuiltIns() {
        QueueConfig config = QueueConfig.load(new Properties(), Map.of());

        assertEquals(8080, config.getHttpPort());
        assertNull(config.getHttpToken(), "an empty token disables auth");
    }

    /**
     * Environment variables win over system properties, which win over the
     * classpath file.
     */
    @Test
    public void testLayering() {
        Properties system = new Properties();
        system.setProperty(QueueConfig.ROOT, "/srv/from-property");
        system.setProperty(QueueConfig.HTTP_PORT, "9000");
        system.setProperty(QueueConfig.WORKERS, "2");
        system.setProperty("unrelated.key", "ignored");

        QueueConfig config = QueueConfig.load(system, Map.of(
                "DOCQUEUE_ROOT", "/srv/from-env",
                "JOB_QUEUE_TOKEN", " s3cret ",
                "DOCQUEUE_BIND", ""));

        assertEquals(Paths.get("/srv/from-env"), config.getRoot());
        assertEquals(9000, config.getHttpPort());
        assertEquals(2, config.getWorkers());
        assertEquals("s3cret", config.getHttpToken());
        assertEquals("127.0.0.1", config.getHttpBind(), "empty variables are ignored");
    }

    @Test
    public void testMalformedNumberRejected() {
        Properties properties = new Properties();
        properties.setProperty(QueueConfig.HTTP_PORT, "eighty");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new QueueConfig(properties));
        assertTrue(e.getMessage().contains(QueueConfig.HTTP_PORT));
    }

    @Test
    public void testOutOfRangeRejected() {
        Properties properties = new Properties();
        properties.setProperty(QueueConfig.WORKERS, "0");

        assertThrows(IllegalArgumentException.class, () -> new QueueConfig(properties));
    }
}
