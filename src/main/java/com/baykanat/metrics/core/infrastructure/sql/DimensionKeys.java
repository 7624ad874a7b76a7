package com.baykanat.metrics.core.infrastructure.sql;

import com.baykanat.metrics.core.domain.exception.MetricsValidationException;

import java.util.Collection;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Dimension key allow-list ve JSON alan çıkarma ifadesi. SQL'e gömülen her dimension key buradan geçer.
 */
public final class DimensionKeys {

    private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9_]+$");
    private static final Set<String> RESERVED_OUTPUT_KEYS = Set.of("bucket", "entityId", "value");

    private DimensionKeys() {
    }

    public static boolean isValid(String key) {
        return key != null && KEY_PATTERN.matcher(key).matches();
    }

    /** Geçersizse MetricsValidationException. */
    public static String requireValid(String key) {
        if (!isValid(key)) {
            throw new MetricsValidationException("Invalid dimension key: " + key);
        }
        return key;
    }

    /** groupBy key'leri: allow-list + çıktı satırındaki sabit alanlarla çakışmama. */
    public static void requireGroupByKeys(Collection<String> keys) {
        for (String key : keys) {
            requireValid(key);
            if (RESERVED_OUTPUT_KEYS.contains(key)) {
                throw new MetricsValidationException("groupBy key '" + key + "' is reserved");
            }
        }
    }

    /** {@code (dimensions ->> 'key')}; key doğrulandıktan sonra gömülür. */
    public static String extract(String key) {
        return "(dimensions ->> '" + requireValid(key) + "')";
    }
}
