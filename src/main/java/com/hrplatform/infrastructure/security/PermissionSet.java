package com.hrplatform.infrastructure.security;

import com.hrplatform.domain.model.Permission;
import lombok.EqualsAndHashCode;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable set of permission grants held by a caller.
 *
 * <p>A grant is one of:
 * <ul>
 *   <li>{@code *}: every permission</li>
 *   <li>{@code <resource>.*}: every action on a known resource</li>
 *   <li>the code of a {@link Permission}</li>
 * </ul>
 * Any other string is rejected on construction, so a typo in a role table or a stored user
 * grant surfaces immediately instead of silently never matching.
 *
 * @since 1.0.0
 */
@EqualsAndHashCode
public final class PermissionSet {

    public static final String WILDCARD = "*";
    static final String RESOURCE_WILDCARD_SUFFIX = ".*";

    private static final PermissionSet EMPTY = new PermissionSet(Set.of());

    private final Set<String> grants;

    private PermissionSet(Set<String> grants) {
        this.grants = grants;
    }

    public static PermissionSet empty() {
        return EMPTY;
    }

    public static PermissionSet everything() {
        return new PermissionSet(Set.of(WILDCARD));
    }

    public static PermissionSet of(Permission... permissions) {
        return new PermissionSet(Arrays.stream(permissions)
            .map(Permission::getCode)
            .collect(Collectors.toUnmodifiableSet()));
    }

    /**
     * Parse raw grant strings.
     *
     * @throws IllegalArgumentException if any grant is not a valid grant string
     */
    public static PermissionSet parse(Collection<String> rawGrants) {
        if (rawGrants == null || rawGrants.isEmpty()) {
            return EMPTY;
        }
        for (String grant : rawGrants) {
            if (!isValidGrant(grant)) {
                throw new IllegalArgumentException("Unknown permission grant: " + grant);
            }
        }
        return new PermissionSet(Set.copyOf(rawGrants));
    }

    public static boolean isValidGrant(String grant) {
        if (grant == null || grant.isEmpty()) {
            return false;
        }
        if (WILDCARD.equals(grant)) {
            return true;
        }
        if (grant.endsWith(RESOURCE_WILDCARD_SUFFIX)) {
            return Permission.isKnownResource(
                grant.substring(0, grant.length() - RESOURCE_WILDCARD_SUFFIX.length()));
        }
        return Permission.fromCode(grant).isPresent();
    }

    public PermissionSet union(PermissionSet other) {
        if (other == null || other.grants.isEmpty()) {
            return this;
        }
        if (grants.isEmpty()) {
            return other;
        }
        Set<String> merged = new TreeSet<>(grants);
        merged.addAll(other.grants);
        return new PermissionSet(Set.copyOf(merged));
    }

    public boolean allows(Permission permission) {
        return permission != null && PermissionCatalog.matches(permission.getCode(), grants);
    }

    public boolean allowsAny(Permission... permissions) {
        for (Permission permission : permissions) {
            if (allows(permission)) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return grants.isEmpty();
    }

    public Set<String> asStrings() {
        return Collections.unmodifiableSet(grants);
    }

    @Override
    public String toString() {
        return new TreeSet<>(grants).toString();
    }
}
