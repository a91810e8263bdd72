package com.zzf.koda.controller;

import com.zzf.koda.core.agent.Phase;
import com.zzf.koda.core.agent.TaskSnapshot;
import com.zzf.koda.core.change.ApplyResult;
import com.zzf.koda.core.error.InvalidRequestException;
import com.zzf.koda.session.ChangeSetView;
import com.zzf.koda.session.TaskSessionService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TaskController {

    private final TaskSessionService tasks;

    @Data
    public static class ApprovalRequest {
        private Boolean approved;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/tasks/{id}")
    public TaskSnapshot task(@PathVariable("id") String id) {
        return tasks.snapshot(id);
    }

    @GetMapping("/tasks/{id}/changes")
    public ChangeSetView changes(@PathVariable("id") String id) {
        return tasks.changes(id);
    }

    @PostMapping("/tasks/{id}/approval")
    public Map<String, Object> approval(@PathVariable("id") String id, @RequestBody ApprovalRequest request) {
        if (request == null || request.getApproved() == null) {
            throw new InvalidRequestException("'approved' is required");
        }
        ApplyResult result = tasks.decide(id, request.getApproved());
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("phase", tasks.snapshot(id).getPhase());
        response.put("applied", result.getApplied());
        response.put("failed", result.getFailed());
        return response;
    }

    @PostMapping("/tasks/{id}/cancel")
    public Map<String, Object> cancel(@PathVariable("id") String id) {
        Phase phase = tasks.cancel(id);
        return Map.of("phase", phase);
    }
}
