package me.ud.ltc.tak.distributed.realtime.starter.service;

import java.util.Collection;
import java.util.Set;

/**
 * Validates the roles a client claims. Authentication is outside this library.
 *
 * @author takltc
 */
public interface RoleResolver {

    Set<String> resolveRoles(String userId, Collection<String> claimedRoles);
}
