package com.flagship.pledge_compliance.election;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

@RestController
@RequestMapping("/api/elections")
@RequiredArgsConstructor
public class ElectionController {

    private final ElectionCycleService electionCycleService;

    /**
     * Current cycle for a state. {@code source} tells whether published or fallback dates were used.
     */
    @GetMapping("/{state}/cycle")
    public ResponseEntity<ElectionCycle> getCycle(@PathVariable("state") String state) {
        if (!state.matches("^[A-Za-z]{2}$")) {
            throw new IllegalArgumentException("State must be a 2-letter code");
        }
        return ResponseEntity.ok(electionCycleService.currentCycle(state.toUpperCase(Locale.ROOT)));
    }
}
