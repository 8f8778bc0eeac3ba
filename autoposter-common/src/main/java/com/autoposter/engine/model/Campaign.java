package com.autoposter.engine.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Data
@NoArgsConstructor
@Table(name = "campaigns", indexes = {
    @Index(name = "idx_campaign_status", columnList = "status")
})
public class Campaign {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    private String name;

    @Enumerated(EnumType.STRING)
    private CampaignStatus status = CampaignStatus.DRAFT;

    @ElementCollection
    @CollectionTable(name = "campaign_videos", joinColumns = @JoinColumn(name = "campaign_id"))
    @OrderColumn(name = "position")
    @Column(name = "video_path", length = 500)
    private List<String> videoPaths = new ArrayList<>();

    @Size(max = 2200)
    @Column(length = 2200)
    private String captionTemplate;

    @Embedded
    private AccountSelection accountSelection = AccountSelection.all();

    @Embedded
    private CampaignSchedule schedule;

    private int maxRetries = 3;

    // Seeds account sampling and slot jitter; the campaign id is used when absent
    private Long randomSeed;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant startedAt;
    private Instant completedAt;

    public Campaign(String name, List<String> videoPaths, String captionTemplate,
                    AccountSelection accountSelection, CampaignSchedule schedule) {
        this.name = name;
        this.videoPaths = new ArrayList<>(videoPaths);
        this.captionTemplate = captionTemplate;
        this.accountSelection = accountSelection;
        this.schedule = schedule;
    }
}
