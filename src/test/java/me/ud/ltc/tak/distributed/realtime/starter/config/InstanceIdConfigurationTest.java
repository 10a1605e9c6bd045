package me.ud.ltc.tak.distributed.realtime.starter.config;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

/**
 * Instance ID Configuration Test
 *
 * @author takltc
 */
public class InstanceIdConfigurationTest {

    private static final String PROPERTY = "realtime.instance.id";

    private String previous;

    @BeforeEach
    public void setUp() {
        previous = System.getProperty(PROPERTY);
        System.clearProperty(PROPERTY);
    }

    @AfterEach
    public void tearDown() {
        if (previous != null) {
            System.setProperty(PROPERTY, previous);
        } else {
            System.clearProperty(PROPERTY);
        }
    }

    @Test
    public void testGeneratedIdsAreUniquePerProcess() {
        MockEnvironment environment = new MockEnvironment().withProperty("server.port", "0");

        String first = new InstanceIdConfiguration().realtimeInstanceId(environment);
        String second = new InstanceIdConfiguration().realtimeInstanceId(environment);

        assertNotEquals(first, second, "Two processes with the same host and port must not share an ID");
    }

    @Test
    public void testGeneratedIdKeepsHostAndPort() {
        String instanceId = new InstanceIdConfiguration().realtimeInstanceId(new MockEnvironment());

        if (!instanceId.startsWith("instance-")) {
            String[] parts = instanceId.split(":");
            assertEquals("8080", parts[parts.length - 2], "Port should default to 8080");
            assertEquals(8, parts[parts.length - 1].length(), "Random suffix should follow the port");
        }
    }

    @Test
    public void testSystemPropertyWins() {
        System.setProperty(PROPERTY, "node-a");

        assertEquals("node-a", new InstanceIdConfiguration().realtimeInstanceId(new MockEnvironment()));
    }
}
