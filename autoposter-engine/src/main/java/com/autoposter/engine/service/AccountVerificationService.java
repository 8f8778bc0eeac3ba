package com.autoposter.engine.service;

import com.autoposter.engine.client.UploadClient;
import com.autoposter.engine.exception.RateLimitExceededException;
import com.autoposter.engine.exception.ResourceNotFoundException;
import com.autoposter.engine.model.Account;
import com.autoposter.engine.model.AccountStatus;
import com.autoposter.engine.model.TaskCategory;
import com.autoposter.engine.repository.AccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class AccountVerificationService {

    private final AccountRepository accountRepository;
    private final UploadClient uploadClient;
    private final TaskRateLimiter rateLimiter;

    /**
     * Tests the account's login. Valid accounts become ACTIVE, the others INACTIVE;
     * banned accounts are left alone.
     */
    public Account verify(Long accountId) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));
        if (!rateLimiter.tryConsume(TaskCategory.ACCOUNT_TEST)) {
            throw new RateLimitExceededException(TaskCategory.ACCOUNT_TEST);
        }
        return runVerification(account);
    }

    public int verifyAll() {
        int verified = 0;
        int deferred = 0;
        for (Account account : accountRepository.findAll()) {
            if (account.getStatus() == AccountStatus.BANNED) {
                continue;
            }
            if (!rateLimiter.tryConsume(TaskCategory.ACCOUNT_TEST)) {
                deferred++;
                continue;
            }
            runVerification(account);
            verified++;
        }
        log.info("Account verification sweep: {} verified, {} deferred", verified, deferred);
        return verified;
    }

    private Account runVerification(Account account) {
        if (account.getStatus() == AccountStatus.BANNED) {
            return account;
        }
        boolean valid;
        try {
            valid = uploadClient.testAuthentication(account.getId());
        } catch (RuntimeException e) {
            log.warn("Authentication test for account {} failed: {}", account.getId(), e.getMessage());
            valid = false;
        }
        AccountStatus status = valid ? AccountStatus.ACTIVE : AccountStatus.INACTIVE;
        if (status != account.getStatus()) {
            log.info("Account {} {} -> {}", account.getUsername(), account.getStatus(), status);
            account.setStatus(status);
            return accountRepository.save(account);
        }
        return account;
    }
}
