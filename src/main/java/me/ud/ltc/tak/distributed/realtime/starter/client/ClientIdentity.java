package me.ud.ltc.tak.distributed.realtime.starter.client;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import lombok.Value;

/**
 * Identity a client presents to the push and polling endpoints
 *
 * @author takltc
 */
@Value
public class ClientIdentity {

    String userId;

    Set<String> roles;

    public ClientIdentity(String userId, Collection<String> roles) {
        this.userId = userId;
        this.roles = roles == null ? Collections.emptySet()
            : Collections.unmodifiableSet(new LinkedHashSet<>(roles));
    }

    public static ClientIdentity of(String userId, String... roles) {
        return new ClientIdentity(userId, Arrays.asList(roles));
    }
}
