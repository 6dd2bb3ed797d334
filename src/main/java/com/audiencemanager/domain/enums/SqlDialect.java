package com.audiencemanager.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * SQL dialect of the warehouse the compiled queries run against.
 * Only the distinct string aggregation differs between supported dialects.
 */
@Getter
@RequiredArgsConstructor
public enum SqlDialect {
    MYSQL("GROUP_CONCAT(DISTINCT %s)"),
    SQLITE("GROUP_CONCAT(DISTINCT %s)"),
    H2("LISTAGG(DISTINCT %s, ',')");

    private final String distinctConcatTemplate;

    public String distinctConcat(String column) {
        return String.format(distinctConcatTemplate, column);
    }
}
