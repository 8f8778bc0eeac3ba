package com.autoposter.jobs.config;

import com.autoposter.engine.service.AccountVerificationService;
import com.autoposter.engine.service.CampaignService;
import com.autoposter.engine.service.ProxyHealthService;
import jakarta.annotation.PostConstruct;
import org.jobrunr.scheduling.JobScheduler;
import org.jobrunr.scheduling.cron.Cron;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Recurring maintenance outside the dispatch loop: proxy health, account logins and
 * campaign completion.
 */
@Configuration
public class JobConfig {

    static final String PROXY_SWEEP = "proxy-health-sweep";
    static final String ACCOUNT_SWEEP = "account-verification-sweep";
    static final String CAMPAIGN_RECONCILE = "campaign-completion-reconcile";

    private final JobScheduler jobScheduler;
    private final ProxyHealthService proxyHealthService;
    private final AccountVerificationService accountVerificationService;
    private final CampaignService campaignService;
    private final String proxyCheckCron;
    private final String accountTestCron;
    private final String campaignReconcileCron;

    public JobConfig(JobScheduler jobScheduler,
                     ProxyHealthService proxyHealthService,
                     AccountVerificationService accountVerificationService,
                     CampaignService campaignService,
                     @Value("${proxy-check.cron:*/15 * * * *}") String proxyCheckCron,
                     @Value("${account-test.cron:0 */6 * * *}") String accountTestCron,
                     @Value("${campaign-reconcile.cron:}") String campaignReconcileCron) {
        this.jobScheduler = jobScheduler;
        this.proxyHealthService = proxyHealthService;
        this.accountVerificationService = accountVerificationService;
        this.campaignService = campaignService;
        this.proxyCheckCron = proxyCheckCron;
        this.accountTestCron = accountTestCron;
        this.campaignReconcileCron = campaignReconcileCron.isBlank() ? Cron.minutely() : campaignReconcileCron;
    }

    @PostConstruct
    public void scheduleRecurrently() {
        jobScheduler.scheduleRecurrently(PROXY_SWEEP, proxyCheckCron, proxyHealthService::checkAllProxies);
        jobScheduler.scheduleRecurrently(ACCOUNT_SWEEP, accountTestCron, accountVerificationService::verifyAll);
        jobScheduler.scheduleRecurrently(CAMPAIGN_RECONCILE, campaignReconcileCron, campaignService::reconcileRunningCampaigns);
    }
}
