package me.golemcore.monitor;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.*;

class MonitorApplicationTest {

    @Test
    void shouldBeSpringBootApplicationWithPropertiesScan() {
        assertTrue(MonitorApplication.class.isAnnotationPresent(SpringBootApplication.class));
        assertTrue(MonitorApplication.class.isAnnotationPresent(ConfigurationPropertiesScan.class));
    }
}
