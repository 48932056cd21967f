package com.promptoptimizer.interfaces.api.analysis;

import com.promptoptimizer.application.analysis.FormattedPrompt;
import com.promptoptimizer.application.analysis.ModelComparison;
import com.promptoptimizer.application.analysis.PromptAnalysisAppService;
import com.promptoptimizer.application.analysis.TokenReport;
import com.promptoptimizer.domain.optimization.model.ModelInfo;
import com.promptoptimizer.domain.optimization.model.OptimizationSuggestions;
import com.promptoptimizer.interfaces.api.dto.ModelFormatResponse;
import com.promptoptimizer.interfaces.api.dto.TextAnalysisRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/analysis")
@RequiredArgsConstructor
public class AnalysisController {

    private final PromptAnalysisAppService analysisAppService;

    @PostMapping("/tokens")
    public ResponseEntity<TokenReport> tokens(@Valid @RequestBody TextAnalysisRequest request) {
        return ResponseEntity.ok(analysisAppService.analyzeTokens(request.text(), request.model()));
    }

    @PostMapping("/suggestions")
    public ResponseEntity<OptimizationSuggestions> suggestions(@Valid @RequestBody TextAnalysisRequest request) {
        return ResponseEntity.ok(analysisAppService.suggest(request.text(), request.model()));
    }

    @PostMapping("/compare")
    public ResponseEntity<List<ModelComparison>> compare(@Valid @RequestBody TextAnalysisRequest request) {
        return ResponseEntity.ok(analysisAppService.compareModels(request.text()));
    }

    @PostMapping("/model-format")
    public ResponseEntity<ModelFormatResponse> modelFormat(@Valid @RequestBody TextAnalysisRequest request) {
        FormattedPrompt formatted = analysisAppService.formatForModel(
                request.text(), request.model(), request.modelParams());
        return ResponseEntity.ok(new ModelFormatResponse(
                formatted.model(),
                formatted.originalText(),
                formatted.formattedText(),
                formatted.originalTokens(),
                formatted.formattedTokens()));
    }

    @GetMapping("/models")
    public ResponseEntity<List<ModelInfo>> models() {
        return ResponseEntity.ok(analysisAppService.listModels());
    }
}
