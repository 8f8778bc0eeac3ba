package com.autoposter.engine.service;

import com.autoposter.engine.exception.ConfigurationException;
import com.autoposter.engine.model.Account;
import com.autoposter.engine.model.AccountSelection;
import com.autoposter.engine.model.AccountStatus;
import com.autoposter.engine.model.Campaign;
import com.autoposter.engine.model.CampaignSchedule;
import com.autoposter.engine.model.SelectionStrategy;
import com.autoposter.engine.model.UploadJob;
import com.autoposter.engine.repository.AccountRepository;
import com.autoposter.engine.repository.UploadJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Expands a campaign into its upload jobs.
 * <p>
 * All validation happens before anything is written, and the jobs are stored with a single
 * {@code saveAll} in one transaction, so a run creates the whole job set or nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignPlannerService {

    private final AccountRepository accountRepository;
    private final UploadJobRepository jobRepository;
    private final ResourceAllocator allocator;
    private final Clock clock;

    @Transactional
    public List<UploadJob> plan(Campaign campaign) {
        List<String> videos = campaign.getVideoPaths();
        if (videos == null || videos.isEmpty()) {
            throw new ConfigurationException("Campaign " + campaign.getId() + " has no videos");
        }
        CampaignSchedule schedule = campaign.getSchedule();
        validateSchedule(schedule);

        Random random = new Random(seedOf(campaign));
        List<Account> accounts = resolveAccounts(campaign, random);

        int pairs = Math.max(videos.size(), accounts.size());
        long intervalMillis = schedule.windowLength().toMillis() / pairs;
        Instant now = clock.instant();

        List<UploadJob> jobs = new ArrayList<>(pairs);
        for (int i = 0; i < pairs; i++) {
            Account account = accounts.get(i % accounts.size());
            String video = videos.get(i % videos.size());
            Instant scheduledAt = slot(schedule, i, intervalMillis, random);
            String caption = CaptionRenderer.render(campaign.getCaptionTemplate(), i + 1, account.getUsername(), video);

            UploadJob job = new UploadJob(campaign.getId(), account.getId(), account.getProxyId(), video, caption,
                    scheduledAt, campaign.getMaxRetries());
            job.setCreatedAt(now);
            job.setUpdatedAt(now);
            jobs.add(job);
        }

        List<UploadJob> saved = jobRepository.saveAll(jobs);
        log.info("Planned {} jobs for campaign {} across {} accounts and {} videos",
                saved.size(), campaign.getId(), accounts.size(), videos.size());
        return saved;
    }

    /**
     * Resolves the ordered account list the campaign posts from.
     */
    public List<Account> resolveAccounts(Campaign campaign, Random random) {
        AccountSelection selection = campaign.getAccountSelection() == null
                ? AccountSelection.all() : campaign.getAccountSelection();
        SelectionStrategy strategy = selection.getStrategy() == null ? SelectionStrategy.ALL : selection.getStrategy();

        List<Account> accounts;
        switch (strategy) {
            case SPECIFIC:
                accounts = resolveSpecific(selection);
                break;
            case RANDOM:
                accounts = sample(eligible(campaign, selection), selection.getSampleSize(), random);
                break;
            default:
                accounts = eligible(campaign, selection);
                break;
        }

        if (selection.getMaxAccounts() != null && selection.getMaxAccounts() > 0
                && accounts.size() > selection.getMaxAccounts()) {
            accounts = new ArrayList<>(accounts.subList(0, selection.getMaxAccounts()));
        }
        if (accounts.isEmpty()) {
            throw new ConfigurationException("No eligible accounts for campaign " + campaign.getId());
        }
        return accounts;
    }

    private List<Account> eligible(Campaign campaign, AccountSelection selection) {
        List<Account> active = selection.getProxyId() == null
                ? accountRepository.findByStatusOrderByIdAsc(AccountStatus.ACTIVE)
                : accountRepository.findByStatusAndProxyIdOrderByIdAsc(AccountStatus.ACTIVE, selection.getProxyId());

        // Accounts leased by another campaign's running job are left to that campaign
        return active.stream()
                .filter(a -> !allocator.isLeasedByOtherCampaign(a.getId(), campaign.getId()))
                .collect(Collectors.toList());
    }

    private List<Account> sample(List<Account> eligible, Integer sampleSize, Random random) {
        if (sampleSize == null || sampleSize <= 0) {
            throw new ConfigurationException("RANDOM selection needs a positive sample size, got " + sampleSize);
        }
        if (sampleSize > eligible.size()) {
            log.warn("Requested {} random accounts but only {} are eligible", sampleSize, eligible.size());
        }
        List<Account> shuffled = new ArrayList<>(eligible);
        Collections.shuffle(shuffled, random);
        List<Account> picked = new ArrayList<>(shuffled.subList(0, Math.min(sampleSize, shuffled.size())));
        picked.sort(Comparator.comparing(Account::getId));
        return picked;
    }

    private List<Account> resolveSpecific(AccountSelection selection) {
        List<Long> ids = selection.getAccountIds() == null ? List.of() : new ArrayList<>(new LinkedHashSet<>(selection.getAccountIds()));
        if (ids.isEmpty()) {
            throw new ConfigurationException("SPECIFIC selection lists no accounts");
        }
        Map<Long, Account> found = accountRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(Account::getId, Function.identity()));

        List<Long> missing = ids.stream().filter(id -> !found.containsKey(id)).collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Accounts not found: " + missing);
        }
        List<Long> inactive = ids.stream().filter(id -> !found.get(id).isActive()).collect(Collectors.toList());
        if (!inactive.isEmpty()) {
            throw new ConfigurationException("Accounts not active: " + inactive);
        }
        return ids.stream().map(found::get).collect(Collectors.toList());
    }

    private void validateSchedule(CampaignSchedule schedule) {
        if (schedule == null || schedule.getStartTime() == null || schedule.getEndTime() == null) {
            throw new ConfigurationException("Campaign schedule needs a start and end time");
        }
        if (schedule.windowLength().isNegative() || schedule.windowLength().isZero()) {
            throw new ConfigurationException("Schedule window must end after it starts");
        }
        if (schedule.getDelayMinSeconds() < 0 || schedule.getDelayMinSeconds() > schedule.getDelayMaxSeconds()) {
            throw new ConfigurationException("Invalid delay range " + schedule.getDelayMinSeconds()
                    + ".." + schedule.getDelayMaxSeconds());
        }
    }

    private Instant slot(CampaignSchedule schedule, int index, long intervalMillis, Random random) {
        long minMillis = schedule.getDelayMinSeconds() * 1000L;
        long spreadMillis = (schedule.getDelayMaxSeconds() - schedule.getDelayMinSeconds()) * 1000L;
        long delayMillis = minMillis + Math.round(random.nextDouble() * spreadMillis);

        Instant at = schedule.getStartTime().plusMillis(index * intervalMillis + delayMillis);
        return at.isAfter(schedule.getEndTime()) ? schedule.getEndTime() : at;
    }

    private long seedOf(Campaign campaign) {
        if (campaign.getRandomSeed() != null) {
            return campaign.getRandomSeed();
        }
        return campaign.getId() == null ? 0L : campaign.getId();
    }
}
