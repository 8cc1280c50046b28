package com.voxpop.backend.services.campaign;

/**
 * Answers whether the campaign subsystem still targets a segment or tag. Only campaigns that are
 * scheduled or running count; drafts and finished campaigns do not block deletion.
 */
public interface CampaignReferenceChecker {

    boolean isSegmentReferenced(Long segmentId);

    boolean isTagReferenced(Long tagId);
}
