package com.autoposter.engine.client;

import com.autoposter.engine.model.Proxy;

public interface ProxyHealthChecker {

    ProxyCheckResult check(Proxy proxy);
}
