package com.acme.rmq.cli.output;

import com.acme.rmq.retrieval.core.ErrorInfo;
import com.acme.rmq.retrieval.model.RetrievalResult;
import com.acme.rmq.retrieval.model.StopReason;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Locale;

/** JSON document printed at the end of a run. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RetrievalSummary(
        @JsonProperty("status") String status,
        @JsonProperty("queue") String queue,
        @JsonProperty("finished_at") Instant finishedAt,
        @JsonProperty("result") Result result,
        @JsonProperty("error") ErrorInfo error) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Result(
            @JsonProperty("messages_received") long messagesReceived,
            @JsonProperty("messages_processed") long messagesProcessed,
            @JsonProperty("messages_skipped") long messagesSkipped,
            @JsonProperty("duration_ms") double durationMs,
            @JsonProperty("duration") String duration,
            @JsonProperty("ack_mode") String ackMode,
            @JsonProperty("retrieval_mode") String retrievalMode,
            @JsonProperty("stop_reason") String stopReason,
            @JsonProperty("cancellation_reason") String cancellationReason,
            @JsonProperty("messages_per_second") double messagesPerSecond,
            @JsonProperty("total_size_bytes") long totalSizeBytes,
            @JsonProperty("total_size") String totalSize) {
    }

    public static RetrievalSummary success(RetrievalResult result, Instant finishedAt) {
        Result details = new Result(
                result.messagesReceived(),
                result.messagesProcessed(),
                result.messagesSkipped(),
                result.elapsed().toNanos() / 1_000_000.0,
                OutputUtilities.elapsedString(result.elapsed()),
                result.ackMode().label(),
                result.retrievalMode(),
                result.stopReason().name().toLowerCase(Locale.ROOT),
                cancellationReason(result.stopReason()),
                result.messagesPerSecond(),
                result.totalBytes(),
                OutputUtilities.toSizeString(result.totalBytes()));
        return new RetrievalSummary("success", result.queue(), finishedAt, details, null);
    }

    public static RetrievalSummary failure(String queue, ErrorInfo error, Instant finishedAt) {
        return new RetrievalSummary("error", queue, finishedAt, null, error);
    }

    private static String cancellationReason(StopReason reason) {
        return switch (reason) {
            case USER_CANCELLED, BROKER_CANCELLED, CHANNEL_CLOSED, OUTPUT_FAILED -> reason.description();
            case NONE, COUNT_REACHED, QUEUE_EMPTY -> null;
        };
    }
}
