package com.flagship.pledge_compliance.compliance;

import com.flagship.pledge_compliance.compliance.dto.LimitCheckRequest;
import com.flagship.pledge_compliance.compliance.dto.LimitCheckResponse;
import com.flagship.pledge_compliance.compliance.dto.LimitSummaryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Advisory limit queries. Pledge creation re-validates on the server.
 */
@RestController
@RequestMapping("/api/donors/{donorId}/limits")
@RequiredArgsConstructor
public class LimitController {

    private final LimitQueryService limitQueryService;

    @GetMapping
    public ResponseEntity<LimitSummaryResponse> getLimits(
            @PathVariable("donorId") UUID donorId,
            @RequestParam(name = "politicianId", required = false) String politicianId,
            @RequestParam(name = "stagedAmount", required = false) BigDecimal stagedAmount) {
        return ResponseEntity.ok(limitQueryService.limits(donorId, politicianId, stagedAmount));
    }

    @PostMapping("/check")
    public ResponseEntity<LimitCheckResponse> check(@PathVariable("donorId") UUID donorId,
                                                    @Valid @RequestBody LimitCheckRequest request) {
        return ResponseEntity.ok(limitQueryService.check(
                donorId, request.getAmount(), request.getPoliticianId()));
    }
}
