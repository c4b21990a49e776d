package com.svcdebug.analyzer.controller;

import com.svcdebug.analyzer.model.AnalysisResult;
import com.svcdebug.analyzer.model.AnalyzeRequest;
import com.svcdebug.analyzer.service.AnalysisException;
import com.svcdebug.analyzer.service.AnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/analyze")
@Slf4j
@RequiredArgsConstructor
public class AnalyzeController {

    private final AnalysisService analysisService;

    /**
     * 结构化结果：关联组 + 统计 + 时间线，异常列表 + 汇总 + 文本摘要。
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public AnalysisResult analyze(@RequestBody AnalyzeRequest request) {
        log.info("收到分析请求: service={}, window={}, log={}, trace={}, capture={}, other={}",
                request.getServiceId(), request.getTimeWindowMs(),
                sizeOf(request.getLog()), sizeOf(request.getTrace()),
                sizeOf(request.getCapture()), sizeOf(request.getOther()));
        return analysisService.analyze(request);
    }

    /**
     * 只要异常的纯文本摘要，给报告生成方直接拼接。
     */
    @PostMapping(value = "/digest", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.TEXT_PLAIN_VALUE + ";charset=UTF-8")
    public String digest(@RequestBody AnalyzeRequest request) {
        return analysisService.analyze(request).getAnomalyDigest();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.warn("拒绝分析请求: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", "bad_request", "message", e.getMessage()));
    }

    @ExceptionHandler(AnalysisException.class)
    public ResponseEntity<Map<String, String>> analysisFailed(AnalysisException e) {
        log.error("Analysis failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", "analysis_failed", "message", e.getMessage()));
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
