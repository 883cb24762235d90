package com.xbleey.marketreport.controller;

import com.xbleey.marketreport.enums.AnalysisType;
import com.xbleey.marketreport.model.TaskStatus;
import com.xbleey.marketreport.schedule.DailyReportScheduler;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/tasks")
public class ReportTaskController {

    private final DailyReportScheduler scheduler;

    public ReportTaskController(DailyReportScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping
    public List<TaskStatus> listTasks() {
        return scheduler.statuses();
    }

    /**
     * Runs a task immediately. The daily marker is left untouched, so the scheduled run still happens.
     */
    @PostMapping("/{taskId}/run")
    public Map<String, Object> runTask(
            @PathVariable("taskId") String taskId,
            @RequestParam(value = "analysis", required = false) List<String> analysis
    ) {
        List<AnalysisType> analysisTypes = new ArrayList<>();
        if (analysis != null) {
            try {
                for (String code : analysis) {
                    analysisTypes.add(AnalysisType.fromCode(code));
                }
            } catch (IllegalArgumentException ex) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
            }
        }
        boolean produced;
        try {
            produced = scheduler.runNow(taskId, analysisTypes);
        } catch (NoSuchElementException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("taskId", taskId);
        response.put("produced", produced);
        response.put("state", scheduler.stateOf(taskId));
        return response;
    }
}
