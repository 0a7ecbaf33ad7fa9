package ru.oparin.drawer.util;

import lombok.experimental.UtilityClass;

/**
 * Маскирование секретов для вывода в логи и админский API.
 */
@UtilityClass
public class SecretMasker {

    private static final int VISIBLE_PREFIX = 8;
    private static final int VISIBLE_SUFFIX = 4;

    /**
     * Замаскировать секрет: первые 8 символов + "..." + последние 4.
     * Короткие значения маскируются полностью.
     *
     * @param secret исходное значение
     * @return замаскированное значение
     */
    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "";
        }
        if (secret.length() <= VISIBLE_PREFIX + VISIBLE_SUFFIX) {
            return "*".repeat(Math.min(secret.length(), VISIBLE_PREFIX));
        }
        return secret.substring(0, VISIBLE_PREFIX) + "..." + secret.substring(secret.length() - VISIBLE_SUFFIX);
    }
}
