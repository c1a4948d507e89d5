package dev.relaygate.dto.request;

import dev.relaygate.domain.enums.JobPriority;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/** Direct enqueue: the caller names the provider, no routing or budget charge applies. */
public record QueueJobRequest(@NotBlank String provider, String model, JobPriority priority,
                              @NotEmpty List<@Valid ChatRequest> requests) {
}
