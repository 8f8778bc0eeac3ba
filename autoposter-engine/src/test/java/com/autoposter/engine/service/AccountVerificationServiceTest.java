package com.autoposter.engine.service;

import com.autoposter.engine.client.UploadClient;
import com.autoposter.engine.exception.RateLimitExceededException;
import com.autoposter.engine.model.Account;
import com.autoposter.engine.model.AccountStatus;
import com.autoposter.engine.model.TaskCategory;
import com.autoposter.engine.repository.AccountRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AccountVerificationServiceTest {

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private UploadClient uploadClient;

    @Test
    void testFailedLoginDeactivatesAccount() {
        Account account = new Account(1L, "creator1", AccountStatus.ACTIVE, null);
        when(accountRepository.findById(1L)).thenReturn(Optional.of(account));
        when(uploadClient.testAuthentication(1L)).thenReturn(false);
        when(accountRepository.save(account)).thenReturn(account);

        Account verified = service(5).verify(1L);

        assertThat(verified.getStatus()).isEqualTo(AccountStatus.INACTIVE);
    }

    @Test
    void testUnchangedAccountIsNotSaved() {
        Account account = new Account(1L, "creator1", AccountStatus.ACTIVE, null);
        when(accountRepository.findById(1L)).thenReturn(Optional.of(account));
        when(uploadClient.testAuthentication(1L)).thenReturn(true);

        service(5).verify(1L);

        verify(accountRepository, never()).save(any(Account.class));
    }

    @Test
    void testClientErrorCountsAsInvalid() {
        Account account = new Account(1L, "creator1", AccountStatus.NEEDS_CAPTCHA, null);
        when(accountRepository.findById(1L)).thenReturn(Optional.of(account));
        when(uploadClient.testAuthentication(1L)).thenThrow(new IllegalStateException("timeout"));
        when(accountRepository.save(account)).thenReturn(account);

        assertThat(service(5).verify(1L).getStatus()).isEqualTo(AccountStatus.INACTIVE);
    }

    @Test
    void testVerifyBeyondBudgetIsRejected() {
        when(accountRepository.findById(1L)).thenReturn(Optional.of(new Account(1L, "creator1", AccountStatus.ACTIVE, null)));
        when(uploadClient.testAuthentication(1L)).thenReturn(true);
        AccountVerificationService service = service(1);
        service.verify(1L);

        assertThatThrownBy(() -> service.verify(1L)).isInstanceOf(RateLimitExceededException.class);
        verify(uploadClient, times(1)).testAuthentication(anyLong());
    }

    @Test
    void testSweepLeavesBannedAccountsAlone() {
        Account banned = new Account(1L, "creator1", AccountStatus.BANNED, null);
        Account inactive = new Account(2L, "creator2", AccountStatus.INACTIVE, null);
        when(accountRepository.findAll()).thenReturn(List.of(banned, inactive));
        when(uploadClient.testAuthentication(2L)).thenReturn(true);
        when(accountRepository.save(inactive)).thenReturn(inactive);

        int verified = service(5).verifyAll();

        assertThat(verified).isEqualTo(1);
        assertThat(banned.getStatus()).isEqualTo(AccountStatus.BANNED);
        assertThat(inactive.getStatus()).isEqualTo(AccountStatus.ACTIVE);
    }

    private AccountVerificationService service(long testsPerMinute) {
        return new AccountVerificationService(accountRepository, uploadClient,
                TaskRateLimiter.perMinute(Map.of(TaskCategory.ACCOUNT_TEST, testsPerMinute)));
    }
}
