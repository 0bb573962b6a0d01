package com.mlops_lifecycle.enumeration;

import java.util.Arrays;

/**
 * How a registry version is chosen for promotion when the training record does not name a run.
 */
public enum VersionSelectionPolicyEnum {
    /** Numerically greatest version. */
    HIGHEST_VERSION,
    /** Whatever the registry lists first; depends on registry ordering. */
    FIRST_LISTED;

    public static VersionSelectionPolicyEnum fromConfig(String value) {
        return Arrays.stream(values())
                .filter(policy -> policy.name().equalsIgnoreCase(value.trim().replace('-', '_')))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown version selection policy: " + value));
    }
}
