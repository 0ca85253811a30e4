package com.github.spud.primus.interfaces.rest;

import com.github.spud.primus.domain.sandbox.JournalEntrySummary;
import com.github.spud.primus.domain.sandbox.SandboxJournal;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Captain's Log 日志 Api，仅沙箱模式可用。这里不打日志
 */
@RestController
@RequestMapping("/sandbox/journal")
@RequiredArgsConstructor
public class SandboxController {

  private final SandboxJournal journal;

  @PostMapping
  public Mono<ResponseEntity<JournalEntrySummary>> add(@Valid @RequestBody JournalRequestDto request) {
    return Mono.fromCallable(() -> ResponseEntity.status(HttpStatus.CREATED)
        .body(journal.add(request.getText())))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping
  public Mono<ResponseEntity<List<JournalEntrySummary>>> list(
    @RequestParam(name = "limit", defaultValue = "20") int limit
  ) {
    return Mono.fromCallable(() -> ResponseEntity.ok(journal.list(limit)));
  }

  @GetMapping("/{entryId}")
  public Mono<ResponseEntity<JournalTextResponse>> read(@PathVariable String entryId) {
    return Mono.fromCallable(() -> ResponseEntity.ok(
        new JournalTextResponse(entryId, journal.read(entryId))))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @DeleteMapping
  public Mono<ResponseEntity<Integer>> clear() {
    return Mono.fromCallable(() -> ResponseEntity.ok(journal.clear()))
      .subscribeOn(Schedulers.boundedElastic());
  }

  // ===== DTOs =====

  @Data
  public static class JournalRequestDto {

    @NotBlank
    private String text;
  }

  @Data
  @AllArgsConstructor
  public static class JournalTextResponse {

    private String id;
    private String text;
  }
}
