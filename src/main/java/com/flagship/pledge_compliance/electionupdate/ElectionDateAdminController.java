package com.flagship.pledge_compliance.electionupdate;

import com.flagship.pledge_compliance.electionupdate.dto.ElectionDatesRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

@RestController
@RequestMapping("/api/admin/elections")
@RequiredArgsConstructor
@Slf4j
public class ElectionDateAdminController {

    private final ElectionDateChangeService electionDateChangeService;

    /**
     * Replaces a state's published dates and notifies donors the change affects.
     */
    @PutMapping("/{state}/dates")
    public ResponseEntity<ElectionDateChangeSummary> updateDates(@PathVariable("state") String state,
                                                                 @RequestBody ElectionDatesRequest request) {
        if (!state.matches("^[A-Za-z]{2}$")) {
            throw new IllegalArgumentException("State must be a 2-letter code");
        }
        String normalized = state.toUpperCase(Locale.ROOT);
        log.info("Election dates update requested for {}", normalized);
        return ResponseEntity.ok(electionDateChangeService.updateElectionDates(request.toElectionDates(normalized)));
    }
}
