package com.flagship.pledge_compliance.donor;

import com.flagship.pledge_compliance.donor.dto.DonorResponse;
import com.flagship.pledge_compliance.donor.dto.PromoteTierRequest;
import com.flagship.pledge_compliance.donor.dto.RegisterDonorRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for donor registration and tier promotion.
 */
@RestController
@RequestMapping("/api/donors")
@RequiredArgsConstructor
@Slf4j
public class DonorController {

    private final DonorService donorService;

    @PostMapping
    public ResponseEntity<DonorResponse> register(@Valid @RequestBody RegisterDonorRequest request) {
        Donor donor = donorService.register(request.toDonor());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(DonorResponse.from(donor, donorService.effectiveTier(donor)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DonorResponse> getDonor(@PathVariable("id") UUID id) {
        Donor donor = donorService.getDonor(id);
        return ResponseEntity.ok(DonorResponse.from(donor, donorService.effectiveTier(donor)));
    }

    /**
     * Applies a completed verification form. Never demotes.
     */
    @PostMapping("/{id}/tier")
    public ResponseEntity<DonorResponse> promoteTier(@PathVariable("id") UUID id,
                                                     @Valid @RequestBody PromoteTierRequest request) {
        Donor donor = donorService.promoteTier(id, request.getFormTier());
        return ResponseEntity.ok(DonorResponse.from(donor, donorService.effectiveTier(donor)));
    }
}
