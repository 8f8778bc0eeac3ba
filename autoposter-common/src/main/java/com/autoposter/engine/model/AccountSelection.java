package com.autoposter.engine.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.JoinColumn;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * How a campaign resolves its account pool when it is started.
 * <p>
 * {@code sampleSize} is only read for {@link SelectionStrategy#RANDOM} and {@code accountIds}
 * only for {@link SelectionStrategy#SPECIFIC}. The filters narrow ALL and RANDOM.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Embeddable
public class AccountSelection {

    @Enumerated(EnumType.STRING)
    @Column(name = "selection_strategy")
    private SelectionStrategy strategy = SelectionStrategy.ALL;

    @Column(name = "selection_sample_size")
    private Integer sampleSize;

    @ElementCollection
    @CollectionTable(name = "campaign_selected_accounts", joinColumns = @JoinColumn(name = "campaign_id"))
    @Column(name = "account_id")
    private List<Long> accountIds = new ArrayList<>();

    // Filters
    @Column(name = "filter_proxy_id")
    private Long proxyId;

    @Column(name = "max_accounts")
    private Integer maxAccounts;

    public static AccountSelection all() {
        return new AccountSelection(SelectionStrategy.ALL, null, new ArrayList<>(), null, null);
    }

    public static AccountSelection random(int sampleSize) {
        return new AccountSelection(SelectionStrategy.RANDOM, sampleSize, new ArrayList<>(), null, null);
    }

    public static AccountSelection specific(List<Long> accountIds) {
        return new AccountSelection(SelectionStrategy.SPECIFIC, null, new ArrayList<>(accountIds), null, null);
    }
}
