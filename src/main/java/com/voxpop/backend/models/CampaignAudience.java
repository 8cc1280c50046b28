package com.voxpop.backend.models;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.util.HashSet;
import java.util.Set;

/**
 * Read-only view of the audience columns of campaigns, which belong to the campaign subsystem.
 * Only used to answer whether a segment or tag is still targeted.
 */
@Entity
@Immutable
@Table(name = "campaigns")
@Getter
@NoArgsConstructor
public class CampaignAudience {

    @Id
    private Long id;

    private String name;

    // draft, scheduled, running, paused, completed, cancelled
    private String status;

    @Column(name = "target_segment_id")
    private Long targetSegmentId;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "campaign_target_tags", joinColumns = @JoinColumn(name = "campaign_id"))
    @Column(name = "tag_id")
    private Set<Long> targetTagIds = new HashSet<>();
}
