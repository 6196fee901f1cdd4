package com.vybescope.api.controller;

import com.vybescope.alert.CycleType;
import com.vybescope.alert.PollCycle;
import com.vybescope.alert.PollScheduler;
import com.vybescope.alert.config.PollSchedule;
import com.vybescope.api.dto.CycleStatusResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Cycle status and runtime suspend/resume.
 */
@RestController
@RequestMapping("/api/v1/cycles")
@RequiredArgsConstructor
public class CycleController {

    private final PollScheduler pollScheduler;
    private final PollSchedule pollSchedule;

    @GetMapping
    public List<CycleStatusResponse> list() {
        return pollScheduler.cycles().stream()
                .map(this::toResponse)
                .toList();
    }

    @PostMapping("/{cycle}/suspend")
    public CycleStatusResponse suspend(@PathVariable CycleType cycle) {
        return toResponse(pollScheduler.suspend(cycle));
    }

    @PostMapping("/{cycle}/resume")
    public CycleStatusResponse resume(@PathVariable CycleType cycle) {
        return toResponse(pollScheduler.resume(cycle));
    }

    private CycleStatusResponse toResponse(PollCycle cycle) {
        return CycleStatusResponse.from(cycle, pollSchedule.settingsFor(cycle.type()).interval().toSeconds());
    }
}
