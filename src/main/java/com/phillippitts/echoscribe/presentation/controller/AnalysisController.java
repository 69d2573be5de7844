package com.phillippitts.echoscribe.presentation.controller;

import com.phillippitts.echoscribe.domain.ActionItemsResult;
import com.phillippitts.echoscribe.domain.AnalysisRequest;
import com.phillippitts.echoscribe.domain.AnalysisResult;
import com.phillippitts.echoscribe.domain.SentimentResult;
import com.phillippitts.echoscribe.domain.SummaryResult;
import com.phillippitts.echoscribe.service.analysis.AnalysisService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Meeting-analysis endpoints. Errors are mapped to HTTP responses by
 * {@link com.phillippitts.echoscribe.presentation.exception.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/analysis")
class AnalysisController {

    private final AnalysisService analysisService;

    AnalysisController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/analyze")
    ResponseEntity<AnalysisResult> analyze(@RequestBody AnalysisRequest request) {
        return ResponseEntity.ok(analysisService.analyze(request));
    }

    @PostMapping("/summary")
    ResponseEntity<SummaryResult> summary(@RequestBody AnalysisRequest request) {
        return ResponseEntity.ok(analysisService.summarize(request));
    }

    @PostMapping("/sentiment")
    ResponseEntity<SentimentResult> sentiment(@RequestBody AnalysisRequest request) {
        return ResponseEntity.ok(analysisService.analyzeSentiment(request));
    }

    @PostMapping("/action-items")
    ResponseEntity<ActionItemsResult> actionItems(@RequestBody AnalysisRequest request) {
        return ResponseEntity.ok(analysisService.extractActionItems(request));
    }
}
