package com.audiencemanager.exception;

import java.util.Map;

/** A rule or segment id the catalog has no record of. */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                resourceType + " " + identifier + " does not exist",
                Map.of("resource", resourceType, "id", identifier),
                null);
    }

    public static ResourceNotFoundException rule(Long ruleId) {
        return new ResourceNotFoundException("Rule", String.valueOf(ruleId));
    }

    public static ResourceNotFoundException segment(Long segmentId) {
        return new ResourceNotFoundException("Segment", String.valueOf(segmentId));
    }

    public static ResourceNotFoundException segmentOfRule(Long ruleId) {
        return new ResourceNotFoundException("Segment for rule", String.valueOf(ruleId));
    }
}
