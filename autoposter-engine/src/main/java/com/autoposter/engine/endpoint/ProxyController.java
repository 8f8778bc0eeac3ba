package com.autoposter.engine.endpoint;

import com.autoposter.engine.client.ProxyCheckResult;
import com.autoposter.engine.dto.ApiResponse;
import com.autoposter.engine.service.ProxyHealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/proxies")
@RequiredArgsConstructor
public class ProxyController {

    private final ProxyHealthService proxyHealthService;

    @PostMapping("/{id}/check")
    public ResponseEntity<ApiResponse<ProxyCheckResult>> check(@PathVariable Long id) {
        ProxyCheckResult result = proxyHealthService.checkProxy(id);
        return ResponseEntity.ok(ApiResponse.ok("Proxy is " + result.getStatus(), result));
    }

    @GetMapping("/{id}/check")
    public ResponseEntity<ApiResponse<ProxyCheckResult>> lastCheck(@PathVariable Long id) {
        return proxyHealthService.lastResult(id)
                .map(result -> ResponseEntity.ok(ApiResponse.ok(result)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
