package com.aiinpocket.gmtracker.controller;

import com.aiinpocket.gmtracker.model.dto.AdminResetRequest;
import com.aiinpocket.gmtracker.model.dto.ResetResult;
import com.aiinpocket.gmtracker.model.enums.ResetScope;
import com.aiinpocket.gmtracker.service.AdminResetService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 管理端點。由 {@link com.aiinpocket.gmtracker.security.AdminApiKeyFilter} 驗證 Bearer 金鑰後才會進入。
 */
@RestController
@RequestMapping("/api/gamification/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminResetController {

    private final AdminResetService adminResetService;

    @PostMapping("/reset")
    public Map<String, Object> reset(@RequestBody(required = false) AdminResetRequest body) {
        if (body == null || body.scope() == null || body.scope().isBlank()) {
            throw new IllegalArgumentException("缺少重置範圍 scope");
        }
        ResetScope scope = ResetScope.fromValue(body.scope());
        log.warn("[管理重置] 收到重置請求: scope={}", scope.getValue());
        ResetResult result = adminResetService.adminReset(scope);
        return Map.of("success", true, "deleted", result.deleted());
    }
}
