package dev.relaygate.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.relaygate.service.GatewayService.BatchItem;
import dev.relaygate.service.GatewayService.BatchResult;

import java.util.List;

public record BatchResponse(boolean success, @JsonProperty("batch_id") String batchId, List<Item> results,
                            @JsonProperty("total_processed") int totalProcessed, int successful, int failed) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Item(int index, boolean success, ChatResponse.ChatData data,
                       @JsonProperty("routing_info") ChatResponse.RoutingInfo routingInfo, Error error) {

        static Item from(BatchItem item) {
            if (item.success()) {
                return new Item(item.index(), true, ChatResponse.ChatData.from(item.result()),
                        ChatResponse.RoutingInfo.from(item.result().routing()), null);
            }
            return new Item(item.index(), false, null, null, new Error(item.error(), item.type(), item.status()));
        }
    }

    public record Error(String message, String type, Integer status) {}

    public static BatchResponse from(BatchResult result) {
        return new BatchResponse(true, result.batchId(), result.results().stream().map(Item::from).toList(),
                result.totalProcessed(), result.successful(), result.failed());
    }
}
