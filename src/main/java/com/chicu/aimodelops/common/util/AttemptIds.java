package com.chicu.aimodelops.common.util;

import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.UUID;

@UtilityClass
public class AttemptIds {

    private static final String VERSION_PREFIX = "v";
    private static final int VERSION_DIGITS = 6;

    /**
     * Идентификатор попытки переобучения (32 символа hex, без '-').
     */
    public static String newAttemptId() {
        return UUID.randomUUID().toString()
                .replace("-", "")
                .toLowerCase(Locale.ROOT);
    }

    /**
     * v000001, v000002 ... — нули слева, чтобы лексикографический порядок совпадал с числовым.
     */
    public static String versionId(long number) {
        if (number <= 0) {
            throw new IllegalArgumentException("version number must be > 0: " + number);
        }
        return VERSION_PREFIX + String.format(Locale.ROOT, "%0" + VERSION_DIGITS + "d", number);
    }

    /**
     * Обратное преобразование. Для чужих/битых id возвращает 0.
     */
    public static long versionNumber(String versionId) {
        if (versionId == null || !versionId.startsWith(VERSION_PREFIX)) return 0L;
        try {
            return Long.parseLong(versionId.substring(VERSION_PREFIX.length()));
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
