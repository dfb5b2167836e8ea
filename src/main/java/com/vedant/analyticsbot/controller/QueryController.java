package com.vedant.analyticsbot.controller;

import com.vedant.analyticsbot.dto.NLQueryRequestDTO;
import com.vedant.analyticsbot.dto.NLQueryResponseDTO;
import com.vedant.analyticsbot.dto.PipelineResult;
import com.vedant.analyticsbot.entity.QueryHistory;
import com.vedant.analyticsbot.service.AnalyticsChatService;
import com.vedant.analyticsbot.service.SequentialPipelineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.servlet.http.HttpServletRequest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/query")
public class QueryController {

    private static final Logger log = LoggerFactory.getLogger(QueryController.class);

    private final AnalyticsChatService chatService;

    public QueryController(AnalyticsChatService chatService) {
        this.chatService = chatService;
    }

    @PostMapping("/nl")
    public ResponseEntity<NLQueryResponseDTO> nlQuery(@RequestBody NLQueryRequestDTO req, HttpServletRequest request) {
        try {
            String sessionId = request.getSession().getId();
            PipelineResult result = chatService.answer(req.getNlQuery(), sessionId);
            // a failed pipeline is still a well-formed answer
            return ResponseEntity.ok(NLQueryResponseDTO.from(result));
        } catch (IllegalArgumentException ex) {
            NLQueryResponseDTO dto = new NLQueryResponseDTO();
            dto.setMessage(ex.getMessage());
            return ResponseEntity.badRequest().body(dto);
        } catch (Exception ex) {
            log.error("Query request failed", ex);
            NLQueryResponseDTO dto = new NLQueryResponseDTO();
            dto.setMessage("Execution error: " + ex.getMessage());
            return ResponseEntity.status(500).body(dto);
        }
    }

    @GetMapping("/history")
    public ResponseEntity<List<Map<String, Object>>> getHistory(HttpServletRequest request) {
        String sessionId = request.getSession().getId();
        List<Map<String, Object>> out = new ArrayList<>();
        for (QueryHistory h : chatService.recentHistory(sessionId)) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("nlQuery", h.getNlQuery());
            m.put("sql", h.getGeneratedSql());
            m.put("responseType", h.getResponseType());
            m.put("success", h.isSuccess());
            m.put("rowCount", h.getRowCount());
            m.put("executedAt", h.getExecutedAt());
            out.add(m);
        }
        return ResponseEntity.ok(out);
    }

    @GetMapping("/health")
    public ResponseEntity<SequentialPipelineService.HealthReport> health() {
        SequentialPipelineService.HealthReport report = chatService.health();
        return report.healthy() ? ResponseEntity.ok(report) : ResponseEntity.status(503).body(report);
    }
}
