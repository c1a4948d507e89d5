package dev.relaygate.controller;

import dev.relaygate.dto.request.BatchRequest;
import dev.relaygate.dto.request.ChatRequest;
import dev.relaygate.dto.response.BatchResponse;
import dev.relaygate.dto.response.ChatResponse;
import dev.relaygate.dto.response.ProviderSummary;
import dev.relaygate.domain.valueobject.AiRequest;
import dev.relaygate.service.GatewayService;
import dev.relaygate.service.ProviderOverviewService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

import java.util.List;
import java.util.Map;

/**
 * AI gateway entry points. Chat completes asynchronously; if the client goes away or the
 * async request times out, the provider call or queued job is cancelled.
 */
@RestController
@RequestMapping("/v1/ai")
public class AiController {

    private static final Logger log = LoggerFactory.getLogger(AiController.class);

    private final GatewayService gateway;
    private final ProviderOverviewService providers;

    public AiController(GatewayService gateway, ProviderOverviewService providers) {
        this.gateway = gateway;
        this.providers = providers;
    }

    @PostMapping("/chat")
    public DeferredResult<ChatResponse> chat(@Valid @RequestBody ChatRequest body) {
        AiRequest request = body.toAiRequest();
        GatewayService.ChatExecution execution = gateway.chat(request);
        DeferredResult<ChatResponse> deferred = new DeferredResult<>();
        deferred.onTimeout(() -> {
            log.warn("Chat {} timed out waiting for the provider; cancelling", request.id());
            execution.canceller().run();
        });
        deferred.onError(error -> {
            log.info("Chat {} aborted by client: {}", request.id(), error.getMessage());
            execution.canceller().run();
        });
        execution.result().whenComplete((result, error) -> {
            if (error == null) deferred.setResult(ChatResponse.from(result));
            else deferred.setErrorResult(GatewayService.unwrap(error));
        });
        return deferred;
    }

    @PostMapping("/batch")
    public BatchResponse batch(@Valid @RequestBody BatchRequest body) {
        List<AiRequest> requests = body.requests().stream().map(ChatRequest::toAiRequest).toList();
        return BatchResponse.from(gateway.processBatch(requests));
    }

    @GetMapping("/providers")
    public Map<String, Object> providers() {
        List<ProviderSummary> list = providers.listProviders();
        return Map.of("success", true, "providers", list, "count", list.size());
    }
}
