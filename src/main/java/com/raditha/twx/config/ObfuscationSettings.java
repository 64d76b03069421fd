package com.raditha.twx.config;

import com.raditha.twx.obfuscation.ObfuscationMapper;

/**
 * Class-name obfuscation settings.
 *
 * @param enabled whether aliases replace class names
 * @param prefix  alias prefix, a valid CSS identifier start
 * @param seed    hashing seed; the same seed always yields the same aliases
 */
public record ObfuscationSettings(boolean enabled, String prefix, long seed) {

    public ObfuscationSettings {
        if (prefix == null || prefix.isEmpty()) {
            prefix = ObfuscationMapper.DEFAULT_PREFIX;
        }
        if (!ObfuscationMapper.isValidPrefix(prefix)) {
            throw new IllegalArgumentException("obfuscation.prefix must be a valid CSS identifier start: " + prefix);
        }
    }

    public static ObfuscationSettings disabled() {
        return new ObfuscationSettings(false, ObfuscationMapper.DEFAULT_PREFIX, ObfuscationMapper.DEFAULT_SEED);
    }

    public ObfuscationSettings withEnabled(boolean value) {
        return new ObfuscationSettings(value, prefix, seed);
    }

    public ObfuscationMapper toMapper() {
        return new ObfuscationMapper(seed, prefix);
    }
}
