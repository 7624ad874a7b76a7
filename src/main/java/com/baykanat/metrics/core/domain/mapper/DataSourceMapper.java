package com.baykanat.metrics.core.domain.mapper;

import com.baykanat.metrics.core.api.dto.DataSourceRequest;
import com.baykanat.metrics.core.api.dto.DataSourceResponse;
import com.baykanat.metrics.core.domain.model.DataSource;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

@Mapper(componentModel = "spring")
public interface DataSourceMapper {

    /** id servis katmanında atanır. */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "enabled", constant = "true")
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    DataSource toDataSource(DataSourceRequest request);

    DataSourceResponse toResponse(DataSource dataSource);

    List<DataSourceResponse> toResponses(List<DataSource> dataSources);
}
