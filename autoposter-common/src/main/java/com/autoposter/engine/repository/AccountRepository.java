package com.autoposter.engine.repository;

import com.autoposter.engine.model.Account;
import com.autoposter.engine.model.AccountStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AccountRepository extends JpaRepository<Account, Long> {
    List<Account> findByStatusOrderByIdAsc(AccountStatus status);
    List<Account> findByStatusAndProxyIdOrderByIdAsc(AccountStatus status, Long proxyId);
}
