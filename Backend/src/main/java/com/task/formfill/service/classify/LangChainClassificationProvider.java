package com.task.formfill.service.classify;

import com.task.formfill.model.Candidate;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

@Service
@ConditionalOnProperty(name = "formfill.classification.provider", havingValue = "langchain", matchIfMissing = true)
public class LangChainClassificationProvider implements ClassificationProvider {

    private static final Logger log = LoggerFactory.getLogger(LangChainClassificationProvider.class);
    private static final int TRACE_LIMIT = 10000;

    private final ChatModel chatModel;
    private final Tracer tracer;
    private final String modelName;
    private final ClassificationResponseParser parser = new ClassificationResponseParser();

    public LangChainClassificationProvider(
            ChatModel chatModel,
            Tracer tracer,
            @Value("${openai.model:gpt-4o}") String modelName
    ) {
        this.chatModel = chatModel;
        this.tracer = tracer;
        this.modelName = modelName;
    }

    @Override
    public String name() {
        return "langchain";
    }

    @Override
    public List<ClassificationEntry> classify(List<Candidate> batch) throws Exception {
        String systemPrompt = ClassificationPrompt.system();
        String userPrompt = ClassificationPrompt.user(batch);

        List<ChatMessage> messages = Arrays.asList(
                new SystemMessage(systemPrompt),
                new UserMessage(userPrompt)
        );

        Span llmSpan = tracer.spanBuilder("llm.classify")
                .setAttribute("batch.size", batch.size())
                .startSpan();

        try (Scope ignored = llmSpan.makeCurrent()) {
            llmSpan.setAttribute("langfuse.observation.type", "generation");
            llmSpan.setAttribute("langfuse.observation.model", modelName);
            llmSpan.setAttribute("langfuse.observation.input", truncate(systemPrompt + "\n\n" + userPrompt));

            ChatResponse response = chatModel.chat(messages);
            String responseText = response.aiMessage().text();

            llmSpan.setAttribute("langfuse.observation.output", truncate(responseText == null ? "" : responseText));
            if (response.tokenUsage() != null) {
                llmSpan.setAttribute("langfuse.observation.usage.input", nullToZero(response.tokenUsage().inputTokenCount()));
                llmSpan.setAttribute("langfuse.observation.usage.output", nullToZero(response.tokenUsage().outputTokenCount()));
            }

            return parser.parse(responseText);
        } catch (Exception ex) {
            llmSpan.setAttribute("error", true);
            llmSpan.setAttribute("error.message", String.valueOf(ex.getMessage()));
            log.error("LangChain classification call failed: {}", ex.getMessage());
            throw ex;
        } finally {
            llmSpan.end();
        }
    }

    private static String truncate(String s) {
        return s.length() > TRACE_LIMIT ? s.substring(0, TRACE_LIMIT) + "... (truncated)" : s;
    }

    private static long nullToZero(Integer count) {
        return count == null ? 0 : count;
    }
}
