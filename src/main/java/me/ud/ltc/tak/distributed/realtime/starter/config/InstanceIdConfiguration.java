package me.ud.ltc.tak.distributed.realtime.starter.config;

import java.net.InetAddress;
import java.util.UUID;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import lombok.extern.slf4j.Slf4j;

/**
 * Instance ID configuration, used to tag events published by this process. Generated IDs end with a random
 * suffix so that two processes on one host, or with the same port, never share an ID.
 *
 * @author takltc
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class InstanceIdConfiguration {

    /**
     * Get the instance ID of this process
     *
     * @param environment Spring environment
     * @return Instance ID
     */
    @Bean
    @ConditionalOnMissingBean(name = "realtimeInstanceId")
    public String realtimeInstanceId(Environment environment) {
        // Prioritize the explicitly configured instance ID
        String instanceId = System.getProperty("realtime.instance.id");
        if (instanceId != null && !instanceId.isEmpty()) {
            log.info("Using instance ID set by system property: {}", instanceId);
            return instanceId;
        }

        try {
            String hostName = InetAddress.getLocalHost().getHostName();
            String port = environment.getProperty("server.port", "8080");
            String generatedId = hostName + ":" + port + ":" + processSuffix();
            log.info("Generated instance ID: {}", generatedId);
            return generatedId;
        } catch (Exception e) {
            log.warn("Unable to get host information, using UUID to generate instance ID", e);
            String uuidId = "instance-" + UUID.randomUUID();
            log.info("Using UUID to generate instance ID: {}", uuidId);
            return uuidId;
        }
    }

    static String processSuffix() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
