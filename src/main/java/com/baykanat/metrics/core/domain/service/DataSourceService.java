package com.baykanat.metrics.core.domain.service;

import com.baykanat.metrics.core.api.dto.DataSourceRequest;
import com.baykanat.metrics.core.api.dto.DataSourceResponse;
import com.baykanat.metrics.core.domain.exception.ConflictException;
import com.baykanat.metrics.core.domain.mapper.DataSourceMapper;
import com.baykanat.metrics.core.domain.model.DataSource;
import com.baykanat.metrics.core.infrastructure.persistence.DataSourceJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DataSourceService {

    private final DataSourceJdbcRepository dataSourceRepository;
    private final DataSourceMapper dataSourceMapper;

    public DataSourceResponse create(DataSourceRequest request) {
        String id = MetricQueryParser.trimToNull(request.getId());
        DataSource dataSource = dataSourceMapper.toDataSource(request);
        dataSource.setId(id != null ? id : "ds_" + UUID.randomUUID());
        try {
            dataSourceRepository.insert(dataSource);
        } catch (DuplicateKeyException e) {
            throw new ConflictException("Data source already exists: " + dataSource.getId());
        }
        log.info("Data source created: id={}, connectorKey={}", dataSource.getId(), dataSource.getConnectorKey());
        return dataSourceMapper.toResponse(dataSourceRepository.findById(dataSource.getId()).orElse(dataSource));
    }

    public List<DataSourceResponse> list(String entityKind, String entityId) {
        return dataSourceMapper.toResponses(dataSourceRepository.list(
                MetricQueryParser.trimToNull(entityKind), MetricQueryParser.trimToNull(entityId)));
    }
}
