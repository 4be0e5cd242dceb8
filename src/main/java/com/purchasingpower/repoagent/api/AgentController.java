package com.purchasingpower.repoagent.api;

import com.purchasingpower.repoagent.model.AgentResponse;
import com.purchasingpower.repoagent.model.FileModification;
import com.purchasingpower.repoagent.model.GeneratedCodeWithTests;
import com.purchasingpower.repoagent.service.RepositoryAgentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Agent workflows over the active repository. Results are proposals; nothing is written back.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/agent")
@RequiredArgsConstructor
public class AgentController {

    private final RepositoryAgentService agentService;

    @PostMapping("/analyze")
    public TextResponse analyze(@Valid @RequestBody AnalyzeRequest request) {
        return new TextResponse(agentService.analyze(request.getPrompt(), request.getFilePath(), request.getModel()).block());
    }

    @PostMapping("/generate")
    public TextResponse generate(@Valid @RequestBody GenerateRequest request) {
        return new TextResponse(agentService.generate(request.getPrompt(), request.getLanguage(), request.getModel()).block());
    }

    /**
     * Streams generated text as {@code chunk} events, then one {@code complete} event.
     * Failures end the stream with an {@code error} event.
     *
     * POST /api/v1/agent/generate/stream
     */
    @PostMapping(value = "/generate/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter generateStream(@Valid @RequestBody GenerateRequest request) {
        SseEmitter emitter = new SseEmitter(0L);

        agentService.generateStream(request.getPrompt(), request.getLanguage(), request.getModel(),
                        chunk -> send(emitter, "chunk", Map.of("content", chunk)),
                        full -> send(emitter, "complete", Map.of("length", full.length())))
                .subscribe(
                        full -> emitter.complete(),
                        error -> {
                            log.warn("Generation stream failed: {}", error.getMessage());
                            try {
                                emitter.send(SseEmitter.event().name("error").data(Map.of("message", String.valueOf(error.getMessage()))));
                                emitter.complete();
                            } catch (IOException | IllegalStateException e) {
                                emitter.completeWithError(error);
                            }
                        });

        return emitter;
    }

    @PostMapping("/edit")
    public FileModification edit(@Valid @RequestBody EditRequest request) {
        return agentService.edit(request.getFilePath(), request.getInstruction(), request.getModel()).block();
    }

    @PostMapping("/create")
    public FileModification create(@Valid @RequestBody CreateFileRequest request) {
        return agentService.create(request.getDirectory(), request.getFileName(), request.getDescription(), request.getModel())
                .block();
    }

    @PostMapping("/solve")
    public AgentResponse solve(@Valid @RequestBody TaskRequest request) {
        return agentService.solve(request.getDescription(), request.getModel()).block();
    }

    @PostMapping("/autonomous")
    public AgentResponse autonomous(@Valid @RequestBody TaskRequest request) {
        return agentService.autonomousModify(request.getDescription(), request.getModel()).block();
    }

    @PostMapping("/search")
    public SearchResponse search(@Valid @RequestBody TaskRequest request) {
        return new SearchResponse(agentService.search(request.getDescription(), request.getModel()).block());
    }

    @PostMapping("/generate-with-tests")
    public GeneratedCodeWithTests generateWithTests(@Valid @RequestBody GenerateRequest request) {
        return agentService.generateWithTests(request.getPrompt(), request.getLanguage(), request.getModel()).block();
    }

    private void send(SseEmitter emitter, String event, Object data) {
        try {
            emitter.send(SseEmitter.event().name(event).data(data));
        } catch (IOException e) {
            throw new UncheckedIOException("Client disconnected from generation stream", e);
        }
    }
}
