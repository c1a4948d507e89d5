package dev.relaygate.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record BatchRequest(@NotEmpty @Size(max = 100) List<@Valid ChatRequest> requests) {
}
