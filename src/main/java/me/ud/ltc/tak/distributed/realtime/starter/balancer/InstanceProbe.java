package me.ud.ltc.tak.distributed.realtime.starter.balancer;

/**
 * Liveness probe of a backing store instance; returning normally means healthy
 *
 * @author takltc
 */
@FunctionalInterface
public interface InstanceProbe {

    void probe(BackendInstance instance) throws Exception;
}
