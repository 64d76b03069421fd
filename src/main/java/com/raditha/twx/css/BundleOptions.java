package com.raditha.twx.css;

import java.util.Map;

/**
 * @param disableReset    leave out the preflight base styles
 * @param selectorAliases class name to alias used as the rule selector; empty when not obfuscating
 */
public record BundleOptions(boolean disableReset, Map<String, String> selectorAliases) {

    public BundleOptions {
        selectorAliases = selectorAliases == null ? Map.of() : Map.copyOf(selectorAliases);
    }

    public static BundleOptions defaults() {
        return new BundleOptions(false, Map.of());
    }
}
