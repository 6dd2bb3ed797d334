package com.audiencemanager.api.dto.response;

import com.audiencemanager.domain.model.SegmentRow;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** First rows of a segment's output table, in user id order. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SampleDataResponse {

    private Long segmentId;
    private String tableName;
    private List<String> columns;
    private List<SegmentRow> rows;
    private int rowCount;
}
