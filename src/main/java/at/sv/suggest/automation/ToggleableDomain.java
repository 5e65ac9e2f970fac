package at.sv.suggest.automation;

import java.util.Locale;

/**
 * Domains that support the {@code turn_on} and {@code turn_off} services.
 */
public enum ToggleableDomain {
    LIGHT,
    SWITCH,
    FAN,
    COVER;

    public static ToggleableDomain fromDomain(String domain) {
        for (ToggleableDomain type : ToggleableDomain.values()) {
            if (type.name().equals(domain.toUpperCase(Locale.ROOT))) {
                return type;
            }
        }
        return null;
    }

    public static boolean isToggleable(String domain) {
        return fromDomain(domain) != null;
    }
}
