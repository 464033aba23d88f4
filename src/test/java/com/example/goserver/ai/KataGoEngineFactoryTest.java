package com.example.goserver.ai;

import com.example.goserver.config.GoServerProperties;
import com.example.goserver.model.domain.AiLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KataGoEngineFactoryTest {

    private GoServerProperties properties;
    private KataGoEngineFactory factory;

    @BeforeEach
    void setUp() {
        properties = new GoServerProperties();
        factory = new KataGoEngineFactory(properties);
    }

    @Test
    void testCommandCarriesLevelLimits() {
        assertEquals(List.of("katago", "gtp", "-override-config", "maxVisits=50,maxTime=1.0,numSearchThreads=1"),
                factory.command(AiLevel.EASY));
        assertEquals("maxVisits=400,maxTime=8.0,numSearchThreads=2", factory.command(AiLevel.PRO).get(3));
    }

    @Test
    void testConfiguredArgumentsComeFirst() {
        properties.getAi().setCommand("/opt/katago/katago");
        properties.getAi().setArgs(List.of("gtp", "-model", "model.bin.gz", "-config", "gtp.cfg"));

        List<String> command = factory.command(AiLevel.HARD);

        assertEquals("/opt/katago/katago", command.get(0));
        assertEquals("gtp.cfg", command.get(5));
        assertEquals("-override-config", command.get(6));
    }

    @Test
    void testMissingExecutableIsUnavailable() {
        properties.getAi().setCommand("/nonexistent/katago-binary");

        assertThrows(AiUnavailableException.class, () -> factory.acquire(AiLevel.NORMAL));
    }
}
