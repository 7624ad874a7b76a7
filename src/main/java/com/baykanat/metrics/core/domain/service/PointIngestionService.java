package com.baykanat.metrics.core.domain.service;

import com.baykanat.metrics.core.api.dto.IngestPointsResponse;
import com.baykanat.metrics.core.api.dto.MetricPointRequest;
import com.baykanat.metrics.core.config.AppProperties;
import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.baykanat.metrics.core.domain.mapper.MetricPointMapper;
import com.baykanat.metrics.core.domain.model.Granularity;
import com.baykanat.metrics.core.domain.model.MetricPoint;
import com.baykanat.metrics.core.domain.model.Timestamps;
import com.baykanat.metrics.core.infrastructure.persistence.MetricPointJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Point ingest: bozuk point'leri atla, aynı kimliği son gelenle birleştir, chunk chunk upsert et.
 * Chunk'lar tek transaction'da değil; yarıda kalan istek tekrar gönderilebilir (upsert idempotent).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PointIngestionService {

    private static final BigDecimal VALUE_LIMIT = new BigDecimal("9999999999999999.99995");

    private final MetricPointJdbcRepository pointRepository;
    private final DimensionHasher dimensionHasher;
    private final MetricPointMapper pointMapper;
    private final AppProperties appProperties;

    /** HTTP yolu: hiç geçerli point yoksa validasyon hatası. */
    public IngestPointsResponse ingest(List<MetricPointRequest> requests) {
        List<MetricPoint> points = toValidPoints(requests);
        if (points.isEmpty()) {
            throw new MetricsValidationException("No valid points provided");
        }
        upsert(points);
        return IngestPointsResponse.builder()
                .received(requests.size())
                .ingested(points.size())
                .build();
    }

    /** Kafka yolu: boş batch hata değil. Yazılan geçerli point sayısını döner. */
    public int ingestBatch(List<MetricPointRequest> requests) {
        List<MetricPoint> points = toValidPoints(requests);
        if (points.isEmpty()) {
            return 0;
        }
        upsert(points);
        return points.size();
    }

    private List<MetricPoint> toValidPoints(List<MetricPointRequest> requests) {
        List<MetricPoint> points = new ArrayList<>(requests.size());
        for (MetricPointRequest request : requests) {
            toPoint(request).ifPresent(points::add);
        }
        int dropped = requests.size() - points.size();
        if (dropped > 0) {
            log.warn("Dropped {} malformed points out of {}", dropped, requests.size());
        }
        return points;
    }

    private void upsert(List<MetricPoint> points) {
        // Aynı statement'ta aynı kimlik iki kez olursa ON CONFLICT hata verir; son gelen kazanır
        Map<List<Object>, MetricPoint> keyToPoint = new LinkedHashMap<>();
        for (MetricPoint point : points) {
            keyToPoint.put(point.identityKey(), point);
        }
        if (keyToPoint.size() < points.size()) {
            log.debug("Collapsed {} duplicate points within request", points.size() - keyToPoint.size());
        }

        List<MetricPoint> unique = new ArrayList<>(keyToPoint.values());
        int chunkSize = Math.max(1, appProperties.getIngest().getChunkSize());
        int written = 0;
        for (int from = 0; from < unique.size(); from += chunkSize) {
            List<MetricPoint> chunk = unique.subList(from, Math.min(from + chunkSize, unique.size()));
            written += pointRepository.upsertChunk(chunk);
            log.debug("Upserted chunk of {} points ({}/{})", chunk.size(), written, unique.size());
        }
        log.info("Ingested {} points ({} unique rows upserted)", points.size(), written);
    }

    /** Zorunlu alanlar, parse edilebilir ve kolona sığan değer, geçerli tarih ve granularity; aksi halde boş. */
    Optional<MetricPoint> toPoint(MetricPointRequest request) {
        if (request == null
                || isBlank(request.getEntityKind())
                || isBlank(request.getEntityId())
                || isBlank(request.getMetricKey())
                || isBlank(request.getDataSourceId())) {
            return Optional.empty();
        }
        Optional<Instant> date = Timestamps.tryParse(request.getDate());
        if (date.isEmpty()) {
            return Optional.empty();
        }
        Optional<Granularity> granularity = isBlank(request.getGranularity())
                ? Optional.of(Granularity.DAILY)
                : Granularity.parse(request.getGranularity());
        if (granularity.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal value = parseValue(request.getValue());
        if (value == null) {
            return Optional.empty();
        }

        MetricPoint point = pointMapper.toMetricPoint(request, date.get(), granularity.get(), value,
                dimensionHasher.hash(request.getDimensions()));
        point.setId("mp_" + UUID.randomUUID());
        return Optional.of(point);
    }

    private static BigDecimal parseValue(String raw) {
        if (isBlank(raw)) {
            return null;
        }
        BigDecimal value;
        try {
            value = new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
        // NUMERIC(20, 4): 4 haneye yuvarlandığında 16 tam haneyi aşan değer kolona sığmaz
        return value.abs().compareTo(VALUE_LIMIT) < 0 ? value : null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
