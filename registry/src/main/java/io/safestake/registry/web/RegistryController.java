package io.safestake.registry.web;

import io.safestake.registry.account.ComplianceRecord;
import io.safestake.registry.compliance.ComplianceRegistryService;
import io.safestake.registry.compliance.ComplianceView;
import jakarta.validation.Valid;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/registry/users")
public class RegistryController {

    private final ComplianceRegistryService registryService;

    public RegistryController(ComplianceRegistryService registryService) {
        this.registryService = registryService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> register(@Valid @RequestBody RegisterUserRequest request) {
        ComplianceRecord record = registryService.registerUser(
            request.accountId(),
            HexFormat.of().parseHex(request.signature())
        );
        return success(record.getAccountId());
    }

    @PutMapping("/{accountId}/limits")
    public Map<String, Object> setLimits(@PathVariable String accountId, @Valid @RequestBody SetLimitsRequest request) {
        ComplianceRecord record = registryService.setLimits(accountId, request.dailyLimit(), request.monthlyLimit());
        Map<String, Object> body = success(accountId);
        body.put("dailyLimit", record.getDailyLimit());
        body.put("monthlyLimit", record.getMonthlyLimit());
        return body;
    }

    @GetMapping("/{accountId}/eligibility")
    public EligibilityResponse eligibility(
        @PathVariable String accountId,
        @RequestParam("amount") long amount
    ) {
        return EligibilityResponse.of(accountId, registryService.checkEligibility(accountId, amount));
    }

    @PostMapping("/{accountId}/transactions")
    public Map<String, Object> recordTransaction(
        @PathVariable String accountId,
        @Valid @RequestBody RecordTransactionRequest request
    ) {
        ComplianceRecord record = registryService.recordTransaction(accountId, request.amount(), request.platformId());
        Map<String, Object> body = success(accountId);
        body.put("dailySpent", record.getDailySpent());
        body.put("monthlySpent", record.getMonthlySpent());
        return body;
    }

    @PostMapping("/{accountId}/self-exclusion")
    public Map<String, Object> selfExclude(@PathVariable String accountId, @Valid @RequestBody SelfExcludeRequest request) {
        ComplianceRecord record = registryService.selfExclude(accountId, request.durationDays());
        Map<String, Object> body = success(accountId);
        body.put("selfExcludedUntil", record.getSelfExcludedUntil());
        return body;
    }

    @PostMapping("/{accountId}/cooldown")
    public Map<String, Object> cooldown(@PathVariable String accountId, @Valid @RequestBody CooldownRequest request) {
        ComplianceRecord record = registryService.startCooldown(accountId, request.durationHours());
        Map<String, Object> body = success(accountId);
        body.put("cooldownUntil", record.getCooldownUntil());
        return body;
    }

    @GetMapping("/{accountId}")
    public ComplianceView record(@PathVariable String accountId) {
        return registryService.getRecord(accountId);
    }

    private static Map<String, Object> success(String accountId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("accountId", accountId);
        return body;
    }
}
