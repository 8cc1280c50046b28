package com.voxpop.backend.services.campaign;

import com.voxpop.backend.repositories.CampaignAudienceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class JpaCampaignReferenceChecker implements CampaignReferenceChecker {

    static final List<String> ACTIVE_STATUSES = List.of("scheduled", "running");

    private final CampaignAudienceRepository campaignAudienceRepository;

    @Override
    @Transactional(readOnly = true)
    public boolean isSegmentReferenced(Long segmentId) {
        return campaignAudienceRepository.existsByTargetSegmentIdAndStatusIn(segmentId, ACTIVE_STATUSES);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isTagReferenced(Long tagId) {
        return campaignAudienceRepository.existsByTargetTagIdAndStatusIn(tagId, ACTIVE_STATUSES);
    }
}
