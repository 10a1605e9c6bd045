package me.ud.ltc.tak.distributed.realtime.starter.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Target filter of an event. An empty filter means the event is broadcast to every recipient.
 *
 * @author takltc
 */
@Getter
@ToString
@EqualsAndHashCode
public final class EventTargets {

    private static final EventTargets BROADCAST = new EventTargets(null, null);

    private final Set<String> userIds;
    private final Set<String> roles;

    @JsonCreator
    public EventTargets(@JsonProperty("userIds") Collection<String> userIds,
        @JsonProperty("roles") Collection<String> roles) {
        this.userIds = copyOf(userIds);
        this.roles = copyOf(roles);
    }

    public static EventTargets broadcast() {
        return BROADCAST;
    }

    public static EventTargets users(String... userIds) {
        return new EventTargets(Arrays.asList(userIds), null);
    }

    public static EventTargets roles(String... roles) {
        return new EventTargets(null, Arrays.asList(roles));
    }

    public static EventTargets of(Collection<String> userIds, Collection<String> roles) {
        return new EventTargets(userIds, roles);
    }

    @JsonIgnore
    public boolean isBroadcast() {
        return userIds.isEmpty() && roles.isEmpty();
    }

    /**
     * Check whether a recipient identified by user id and roles is addressed by this filter
     *
     * @param userId Recipient user ID
     * @param recipientRoles Recipient roles
     * @return Whether the recipient matches
     */
    public boolean matches(String userId, Collection<String> recipientRoles) {
        if (isBroadcast()) {
            return true;
        }
        if (userId != null && userIds.contains(userId)) {
            return true;
        }
        if (recipientRoles != null) {
            for (String role : recipientRoles) {
                if (roles.contains(role)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static Set<String> copyOf(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> copy = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isEmpty()) {
                copy.add(value);
            }
        }
        return Collections.unmodifiableSet(copy);
    }
}
