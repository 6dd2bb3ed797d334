package com.audiencemanager.mapper;

import com.audiencemanager.domain.model.Segment;
import com.audiencemanager.entity.SegmentEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the Segment domain model and SegmentEntity.
 * {@code dependsOn} is stored as a JSON list of rule ids.
 */
@Mapper
public interface SegmentMapper {

    @Mapping(source = "dependsOn", target = "dependsOn", qualifiedByName = "idsToJson")
    SegmentEntity toEntity(Segment segment);

    @Mapping(source = "dependsOn", target = "dependsOn", qualifiedByName = "jsonToIds")
    Segment toDomain(SegmentEntity entity);

    List<Segment> toDomainList(List<SegmentEntity> entities);

    @Named("idsToJson")
    default String idsToJson(List<Long> ids) {
        return JsonHelper.writeRuleIds(ids);
    }

    @Named("jsonToIds")
    default List<Long> jsonToIds(String json) {
        return JsonHelper.readRuleIds(json);
    }
}
