package com.flamingo.ai.docpipeline.service.summarization;

import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.exception.ProcessingCancelledException;
import com.flamingo.ai.docpipeline.exception.SummarizationException;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * {@link SummarizationClient} backed by a LangChain4j {@link ChatModel}.
 *
 * <p>The model call runs on the {@code summarizationExecutor} so the caller's timeout can be
 * enforced regardless of the HTTP client's own settings; the call is cancelled when it elapses.
 * Input longer than {@code pipeline.summarization.max-input-chars} is cut to the longest prefix
 * that fits.
 */
@Service
@Slf4j
public class LangChain4jSummarizationClient implements SummarizationClient {

  static final String SYSTEM_PROMPT =
      """
      You are a document summarization expert. Generate a concise summary of the provided
      document content. Capture the main topics, key arguments, and essential information.
      Write in paragraph form. Do not use markdown headers or bullet points. Do not start
      with "This document" or "The document".
      """;

  private final ChatModel chatModel;
  private final ExecutorService summarizationExecutor;
  private final MeterRegistry meterRegistry;
  private final int maxInputChars;

  public LangChain4jSummarizationClient(
      ChatModel chatModel,
      @Qualifier("summarizationExecutor") ExecutorService summarizationExecutor,
      MeterRegistry meterRegistry,
      PipelineConfig pipelineConfig) {
    this.chatModel = chatModel;
    this.summarizationExecutor = summarizationExecutor;
    this.meterRegistry = meterRegistry;
    this.maxInputChars = pipelineConfig.getSummarization().getMaxInputChars();
  }

  @Override
  @Timed(value = "document.summarize", description = "Time to summarize a document")
  @CircuitBreaker(name = "summarizer", fallbackMethod = "summarizeFallback")
  public SummaryResult summarize(String text, SummarizationOptions options) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Text to summarize must not be blank");
    }

    String input = truncate(text, maxInputChars);
    boolean truncated = input.length() < text.length();
    if (truncated) {
      log.warn(
          "Input too long for summarization, truncating from {} chars to {} chars",
          text.length(),
          input.length());
      meterRegistry.counter("summarization.truncated").increment();
    }

    ChatRequest request =
        ChatRequest.builder()
            .messages(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(input))
            .modelName(options.modelId())
            .maxOutputTokens(options.maxTokens())
            .build();

    log.debug("Calling model {} with {} chars", options.modelId(), input.length());
    String summary = callWithTimeout(request, options);
    if (summary == null || summary.isBlank()) {
      meterRegistry.counter("summarization.failure", "reason", "invalid_response").increment();
      throw new SummarizationException(
          SummarizationException.Reason.INVALID_RESPONSE, "Model returned an empty summary");
    }

    meterRegistry.counter("summarization.success").increment();
    return new SummaryResult(
        summary.strip(), options.modelId(), truncated, input.length(), text.length());
  }

  /**
   * Fallback named by {@code @CircuitBreaker} on {@link #summarize}. Reports an open circuit as the
   * remote being unavailable; other failures pass through.
   */
  private SummaryResult summarizeFallback(
      String text, SummarizationOptions options, CallNotPermittedException e) {
    log.warn("Summarizer circuit is open, not calling model: {}", e.getMessage());
    meterRegistry.counter("summarization.failure", "reason", "circuit_open").increment();
    throw new SummarizationException(
        SummarizationException.Reason.REMOTE_UNAVAILABLE,
        "Summarization service unavailable: too many recent failures",
        e);
  }

  private String callWithTimeout(ChatRequest request, SummarizationOptions options) {
    Future<ChatResponse> future;
    try {
      future = summarizationExecutor.submit(() -> chatModel.chat(request));
    } catch (RejectedExecutionException e) {
      throw new SummarizationException(
          SummarizationException.Reason.REMOTE_UNAVAILABLE,
          "Summarization service unavailable: no capacity to send request",
          e);
    }

    try {
      ChatResponse response = future.get(options.timeout().toMillis(), TimeUnit.MILLISECONDS);
      if (response == null || response.aiMessage() == null) {
        return null;
      }
      return response.aiMessage().text();
    } catch (TimeoutException e) {
      future.cancel(true);
      meterRegistry.counter("summarization.failure", "reason", "timeout").increment();
      throw new SummarizationException(
          SummarizationException.Reason.REMOTE_UNAVAILABLE,
          "Summarization service unavailable: no response within "
              + options.timeout().toSeconds()
              + "s",
          e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new ProcessingCancelledException("summarization", e);
    } catch (ExecutionException e) {
      throw translate(e.getCause() != null ? e.getCause() : e);
    }
  }

  /** Maps a model-side failure to the summarization error taxonomy. */
  SummarizationException translate(Throwable cause) {
    SummarizationException mapped;
    if (cause instanceof SummarizationException se) {
      mapped = se;
    } else if (cause instanceof RateLimitException) {
      mapped =
          new SummarizationException(
              SummarizationException.Reason.RATE_LIMITED,
              "Summarization rate limited: " + cause.getMessage(),
              cause);
    } else if (cause instanceof AuthenticationException) {
      mapped =
          new SummarizationException(
              SummarizationException.Reason.AUTH_ERROR,
              "Summarization authentication failed: " + cause.getMessage(),
              cause);
    } else if (cause instanceof InvalidRequestException) {
      mapped =
          new SummarizationException(
              SummarizationException.Reason.INVALID_RESPONSE,
              "Summarization request rejected: " + cause.getMessage(),
              cause);
    } else {
      mapped =
          new SummarizationException(
              SummarizationException.Reason.REMOTE_UNAVAILABLE,
              "Summarization service unavailable: " + cause.getMessage(),
              cause);
    }
    log.error("Summarization failed ({}): {}", mapped.getReason(), cause.getMessage());
    meterRegistry
        .counter("summarization.failure", "reason", mapped.getReason().name().toLowerCase())
        .increment();
    return mapped;
  }

  /**
   * Returns the longest prefix of {@code text} no longer than {@code maxChars}, never ending
   * between the two halves of a surrogate pair.
   */
  static String truncate(String text, int maxChars) {
    if (text.length() <= maxChars) {
      return text;
    }
    int end = maxChars;
    if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
      end--;
    }
    return text.substring(0, end);
  }
}
