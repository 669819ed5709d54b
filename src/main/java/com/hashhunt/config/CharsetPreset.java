package com.hashhunt.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Locale;

/**
 * Built-in character sets, addressable by the numeric id used in target files.
 */
public enum CharsetPreset {

    DIGITS(1, "0123456789"),
    UPPER_ALNUM(2, "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ"),
    ALNUM(3, "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ"),
    PRINTABLE(4, "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ"
                 + "!@#$%^&*()-_=+[]{}|;:\",.<>?/~`");

    private static final Logger log = LoggerFactory.getLogger(CharsetPreset.class);

    private final int id;
    private final String symbols;

    CharsetPreset(int id, String symbols) {
        this.id = id;
        this.symbols = symbols;
    }

    /**
     * Looks up a preset by id. Unknown ids fall back to {@link #DIGITS}.
     *
     * @param id preset id (1-4)
     * @return the preset
     */
    public static CharsetPreset fromId(int id) {
        for (CharsetPreset preset : values()) {
            if (preset.id == id) {
                return preset;
            }
        }
        log.warn("Unknown charset id {}, falling back to {} ({})", id, DIGITS, DIGITS.symbols);
        return DIGITS;
    }

    /**
     * Looks up a preset by name, case-insensitive, with '-' accepted for '_'
     * ("alnum", "upper-alnum"). A numeric name is treated as an id.
     *
     * @param name preset name or id
     * @return the preset
     * @throws ConfigurationException if no preset has that name
     */
    public static CharsetPreset fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Charset preset name cannot be empty");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.length() <= 9 && normalized.chars().allMatch(Character::isDigit)) {
            return fromId(Integer.parseInt(normalized));
        }
        for (CharsetPreset preset : values()) {
            if (preset.name().equals(normalized)) {
                return preset;
            }
        }
        throw new ConfigurationException(String.format(
            "Unknown charset preset '%s' (expected one of %s)", name, Arrays.toString(values())));
    }

    public int getId() {
        return id;
    }

    public String getSymbols() {
        return symbols;
    }
}
