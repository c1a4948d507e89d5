package dev.relaygate.infrastructure.ai;

import dev.relaygate.domain.enums.ModelSpeed;

import java.math.BigDecimal;
import java.util.List;

public record ModelSpec(String provider, String name, BigDecimal costPer1kTokens, double accuracy,
                        ModelSpeed speed, List<String> capabilities) {

    public boolean supports(String capability) {
        return capability == null || capabilities.contains(capability);
    }
}
