package com.baykanat.metrics.core.infrastructure.sql;

import java.util.List;

/**
 * "last" için tek rank-and-filter yardımcısı: partition başına date DESC, id DESC sıralamasında ilk satır.
 * Dönen SQL, rn=1 satırlarını seçen tam bir SELECT'tir; çağıran taraf alt sorgu olarak sarabilir.
 */
public final class LatestPointSql {

    private LatestPointSql() {
    }

    /**
     * @param projection   iç SELECT kolonları (ör. "entity_id, value")
     * @param whereClause  {@link PointFilterSql#where} çıktısı (boş olabilir)
     * @param partitionBy  partition ifadeleri; boşsa tüm aralık tek partition
     */
    public static String latestRows(String projection, String whereClause, List<String> partitionBy) {
        StringBuilder over = new StringBuilder();
        if (!partitionBy.isEmpty()) {
            over.append("PARTITION BY ").append(String.join(", ", partitionBy)).append(' ');
        }
        over.append("ORDER BY date DESC, id DESC");

        return "SELECT * FROM (SELECT " + projection
                + ", row_number() OVER (" + over + ") AS rn FROM metric_points"
                + whereClause
                + ") ranked WHERE ranked.rn = 1";
    }
}
