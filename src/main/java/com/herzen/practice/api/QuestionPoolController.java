package com.herzen.practice.api;

import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.DifficultyFilter;
import com.herzen.practice.domain.DomainModels.Item;
import com.herzen.practice.domain.DomainModels.ItemFilter;
import com.herzen.practice.pool.PoolModels;
import com.herzen.practice.pool.QuestionPoolService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/pool/{courseId}")
public class QuestionPoolController {
    private final QuestionPoolService poolService;

    public QuestionPoolController(QuestionPoolService poolService) {
        this.poolService = poolService;
    }

    @PostMapping("/{type}")
    public ResponseEntity<PoolModels.RegistrationResult> register(@PathVariable String courseId,
                                                                  @PathVariable String type,
                                                                  @RequestBody List<PoolModels.ItemDraft> drafts) {
        return ResponseEntity.ok(poolService.registerItems(courseId, ContentType.fromLabel(type), drafts));
    }

    @GetMapping("/{type}")
    public ResponseEntity<List<Item>> items(@PathVariable String courseId,
                                            @PathVariable String type,
                                            @RequestParam(required = false) List<String> weeks,
                                            @RequestParam(required = false) String difficulty) {
        ItemFilter filter = new ItemFilter(courseId, ContentType.fromLabel(type), weeks, DifficultyFilter.fromLabel(difficulty));
        return ResponseEntity.ok(poolService.fetchItems(filter));
    }

    @DeleteMapping
    public ResponseEntity<Void> removeCourse(@PathVariable String courseId) {
        poolService.removeCourse(courseId);
        return ResponseEntity.noContent().build();
    }
}
