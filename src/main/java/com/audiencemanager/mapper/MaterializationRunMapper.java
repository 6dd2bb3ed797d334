package com.audiencemanager.mapper;

import com.audiencemanager.domain.model.MaterializationRun;
import com.audiencemanager.entity.MaterializationRunEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper for run history. Field names match across layers, so no explicit
 * {@code @Mapping} annotations are needed.
 */
@Mapper
public interface MaterializationRunMapper {

    MaterializationRun toDomain(MaterializationRunEntity entity);

    MaterializationRunEntity toEntity(MaterializationRun domain);

    List<MaterializationRun> toDomainList(List<MaterializationRunEntity> entities);
}
