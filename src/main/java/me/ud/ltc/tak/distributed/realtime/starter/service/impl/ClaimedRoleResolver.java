package me.ud.ltc.tak.distributed.realtime.starter.service.impl;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import me.ud.ltc.tak.distributed.realtime.starter.service.RoleResolver;

/**
 * Trusts the roles claimed by the client. Replace with a resolver backed by the identity provider when clients
 * are not trusted.
 *
 * @author takltc
 */
public class ClaimedRoleResolver implements RoleResolver {

    @Override
    public Set<String> resolveRoles(String userId, Collection<String> claimedRoles) {
        if (claimedRoles == null || claimedRoles.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> roles = new LinkedHashSet<>();
        for (String role : claimedRoles) {
            if (role != null && !role.trim().isEmpty()) {
                roles.add(role.trim());
            }
        }
        return roles;
    }
}
