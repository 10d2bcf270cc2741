package com.task.formfill.service.classify;

import com.task.formfill.model.Candidate;
import com.task.formfill.service.ProcessingException;
import com.theokanning.openai.OpenAiHttpException;
import com.theokanning.openai.completion.chat.ChatCompletionChoice;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatCompletionResult;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Direct OpenAI chat-completions client. Rate-limit responses (HTTP 429) are retried with
 * a fixed back-off schedule; every other error propagates.
 */
@Service
@ConditionalOnProperty(name = "formfill.classification.provider", havingValue = "openai")
public class OpenAiClassificationProvider implements ClassificationProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiClassificationProvider.class);
    private static final long[] BACKOFFS_MS = {1200, 2000, 4000, 8000, 16000};

    private final OpenAiService llm;
    private final Tracer tracer;
    private final String openaiModel;
    private final double temperature;
    private final ClassificationResponseParser parser = new ClassificationResponseParser();
    private final Sleeper sleeper;

    public OpenAiClassificationProvider(
            OpenAiService llm,
            Tracer tracer,
            @Value("${openai.model:gpt-4o}") String openaiModel,
            @Value("${openai.temperature:0.1}") double temperature
    ) {
        this(llm, tracer, openaiModel, temperature, Thread::sleep);
    }

    OpenAiClassificationProvider(OpenAiService llm, Tracer tracer, String openaiModel, double temperature, Sleeper sleeper) {
        this.llm = llm;
        this.tracer = tracer;
        this.openaiModel = openaiModel;
        this.temperature = temperature;
        this.sleeper = sleeper;
    }

    @Override
    public String name() {
        return "openai";
    }

    @Override
    public List<ClassificationEntry> classify(List<Candidate> batch) throws Exception {
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(openaiModel)
                .messages(List.of(
                        new ChatMessage("system", ClassificationPrompt.system()),
                        new ChatMessage("user", ClassificationPrompt.user(batch))
                ))
                .maxTokens(3000)
                .temperature(temperature)
                .build();

        Span llmSpan = tracer.spanBuilder("llm.classify")
                .setAttribute("batch.size", batch.size())
                .setAttribute("langfuse.observation.model", openaiModel)
                .startSpan();
        try {
            String content = runWith429Retry(() -> {
                ChatCompletionResult result = llm.createChatCompletion(request);
                if (result.getChoices() != null && !result.getChoices().isEmpty()) {
                    ChatCompletionChoice choice = result.getChoices().get(0);
                    return choice.getMessage().getContent();
                }
                return null;
            });
            return parser.parse(content);
        } catch (Exception ex) {
            llmSpan.setAttribute("error", true);
            llmSpan.setAttribute("error.message", String.valueOf(ex.getMessage()));
            throw ex;
        } finally {
            llmSpan.end();
        }
    }

    private <T> T runWith429Retry(SupplierWithException<T> task) throws Exception {
        int attempt = 0;
        while (true) {
            try {
                return task.get();
            } catch (OpenAiHttpException ex) {
                if (ex.statusCode != 429 || attempt >= BACKOFFS_MS.length - 1) throw ex;
                long wait = BACKOFFS_MS[attempt];
                log.warn("Rate limited by OpenAI, retrying in {} ms ({}/{})", wait, attempt + 1, BACKOFFS_MS.length);
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw ProcessingException.provider("Interrupted while waiting to retry OpenAI request", ie);
                }
                attempt++;
            }
        }
    }

    @FunctionalInterface
    private interface SupplierWithException<T> {
        T get() throws Exception;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
