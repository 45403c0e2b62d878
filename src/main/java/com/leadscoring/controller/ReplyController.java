package com.leadscoring.controller;

import com.leadscoring.classifier.ReplyClassification;
import com.leadscoring.classifier.ReplyClassifier;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ad-hoc reply classification, e.g. for replies pasted in by sales. Stores nothing.
 *
 * POST /api/replies/classify
 * { "content": "Sounds good, can we schedule a call next week?" }
 */
@RestController
@RequestMapping("/api/replies")
@RequiredArgsConstructor
public class ReplyController {

    private final ReplyClassifier replyClassifier;

    @PostMapping("/classify")
    public ResponseEntity<ReplyClassification> classify(@RequestBody ClassifyRequest request) {
        return ResponseEntity.ok(replyClassifier.classify(request.getContent()));
    }

    @Data
    public static class ClassifyRequest {
        private String content;
    }
}
