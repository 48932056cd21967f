package com.promptoptimizer.interfaces.api.optimization;

import com.promptoptimizer.application.optimization.OptimizationAppService;
import com.promptoptimizer.domain.optimization.model.OptimizationResult;
import com.promptoptimizer.domain.optimization.model.StrategyMetadata;
import com.promptoptimizer.interfaces.api.dto.BatchOptimizeRequest;
import com.promptoptimizer.interfaces.api.dto.OptimizeRequest;
import com.promptoptimizer.interfaces.api.dto.OptimizeResponse;
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
@RequestMapping("/api/v1/optimize")
@RequiredArgsConstructor
public class OptimizationController {

    private final OptimizationAppService optimizationAppService;

    @PostMapping
    public ResponseEntity<OptimizeResponse> optimize(@Valid @RequestBody OptimizeRequest request) {
        OptimizationResult result = optimizationAppService.optimize(
                request.prompt(),
                request.model(),
                request.strategies(),
                request.threshold(),
                request.aggressive(),
                request.preserveStructure(),
                request.targetReduction());

        return ResponseEntity.ok(OptimizeResponse.from(result));
    }

    @PostMapping("/batch")
    public ResponseEntity<List<OptimizeResponse>> batchOptimize(@Valid @RequestBody BatchOptimizeRequest request) {
        List<OptimizationResult> results = optimizationAppService.batchOptimize(
                request.prompts(),
                request.model(),
                request.strategies(),
                request.threshold(),
                request.aggressive(),
                request.preserveStructure(),
                request.targetReduction());

        return ResponseEntity.ok(results.stream().map(OptimizeResponse::from).toList());
    }

    @GetMapping("/strategies")
    public ResponseEntity<List<StrategyMetadata>> strategies() {
        return ResponseEntity.ok(optimizationAppService.availableStrategies());
    }
}
