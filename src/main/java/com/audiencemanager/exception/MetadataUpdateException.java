package com.audiencemanager.exception;

/**
 * The output table was written but the catalog row could not be updated afterwards.
 * The table may already hold the new data while the catalog still shows the old
 * row count and refresh timestamp.
 */
public class MetadataUpdateException extends MaterializationException {

    public MetadataUpdateException(Long ruleId, String message, Throwable cause) {
        super(ErrorCode.METADATA_UPDATE_FAILED, ruleId, message, cause);
    }
}
