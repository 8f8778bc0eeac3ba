package com.autoposter.engine.repository;

import com.autoposter.engine.model.Proxy;
import com.autoposter.engine.model.ProxyStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProxyRepository extends JpaRepository<Proxy, Long> {
    List<Proxy> findByStatus(ProxyStatus status);
}
