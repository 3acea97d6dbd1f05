package org.pgstudio.kernel.api;

import org.pgstudio.kernel.history.HistoryEntry;
import org.pgstudio.kernel.history.InMemoryQueryHistory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Objects;

@RestController
@RequestMapping("/api/v1/history")
public class HistoryApiController {

    private final InMemoryQueryHistory history;

    public HistoryApiController(InMemoryQueryHistory history) {
        this.history = Objects.requireNonNull(history);
    }

    @GetMapping
    public List<HistoryEntry> recent(@RequestParam(value = "limit", required = false) Integer limit) {
        return limit == null ? history.recent() : history.recent(limit);
    }

    @DeleteMapping
    public ResponseEntity<Void> clear() {
        history.clear();
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        return history.delete(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }
}
