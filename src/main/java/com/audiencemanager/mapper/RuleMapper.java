package com.audiencemanager.mapper;

import com.audiencemanager.domain.model.Condition;
import com.audiencemanager.domain.model.Rule;
import com.audiencemanager.entity.RuleEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the Rule domain model and RuleEntity.
 *
 * <p>Both condition lists and the dependency ids are stored as JSON strings in the
 * entity. A null dependency list stays null so base rules remain distinguishable from
 * composite ones.
 */
@Mapper
public interface RuleMapper {

    @Mapping(source = "conditions", target = "conditions", qualifiedByName = "conditionsToJson")
    @Mapping(source = "declaredConditions", target = "declaredConditions", qualifiedByName = "conditionsToJson")
    @Mapping(source = "dependencies", target = "dependencies", qualifiedByName = "idsToJson")
    RuleEntity toEntity(Rule rule);

    @Mapping(source = "conditions", target = "conditions", qualifiedByName = "jsonToConditions")
    @Mapping(source = "declaredConditions", target = "declaredConditions", qualifiedByName = "jsonToConditions")
    @Mapping(source = "dependencies", target = "dependencies", qualifiedByName = "jsonToIds")
    Rule toDomain(RuleEntity entity);

    List<Rule> toDomainList(List<RuleEntity> entities);

    @Named("conditionsToJson")
    default String conditionsToJson(List<Condition> conditions) {
        return JsonHelper.writeConditions(conditions);
    }

    @Named("jsonToConditions")
    default List<Condition> jsonToConditions(String json) {
        return JsonHelper.readConditions(json);
    }

    @Named("idsToJson")
    default String idsToJson(List<Long> ids) {
        return JsonHelper.writeRuleIds(ids);
    }

    @Named("jsonToIds")
    default List<Long> jsonToIds(String json) {
        return JsonHelper.readRuleIds(json);
    }
}
