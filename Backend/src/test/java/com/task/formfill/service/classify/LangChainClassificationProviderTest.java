package com.task.formfill.service.classify;

import com.task.formfill.model.BoundingBox;
import com.task.formfill.model.Candidate;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class LangChainClassificationProviderTest {

    @Mock
    private ChatModel chatModel;

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    private LangChainClassificationProvider provider;

    private final List<Candidate> batch = List.of(
            new Candidate("c1", "Patient Name", 0.9, new BoundingBox(1, 0.1, 0.2, 0.2, 0.02), List.of("Date of Birth")));

    @BeforeEach
    public void setUp() {
        lenient().when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        lenient().when(spanBuilder.setAttribute(anyString(), anyString())).thenReturn(spanBuilder);
        lenient().when(spanBuilder.setAttribute(anyString(), anyLong())).thenReturn(spanBuilder);
        lenient().when(spanBuilder.startSpan()).thenReturn(span);

        provider = new LangChainClassificationProvider(chatModel, tracer, "gpt-4o");
    }

    @Test
    public void classifiesBatchFromModelJson() throws Exception {
        String json = """
                {"fields": [{"id": "c1", "key": "patient_name", "label": "Patient Name", "type": "text",
                  "required": true, "confidence": 0.9, "suggestions": []}]}
                """;
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder().aiMessage(AiMessage.from(json)).build());

        List<ClassificationEntry> entries = provider.classify(batch);

        assertEquals(1, entries.size());
        assertEquals("patient_name", entries.get(0).key());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(chatModel).chat(captor.capture());
        assertEquals(2, captor.getValue().size());
        String prompt = ((UserMessage) captor.getValue().get(1)).singleText();
        assertTrue(prompt.contains("ID: c1"));
        assertTrue(prompt.contains("Nearby: [Date of Birth]"));
        verify(span).end();
    }

    @Test
    public void invalidJsonPropagatesAndMarksSpan() {
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("Sorry, I can't")).build());

        assertThrows(Exception.class, () -> provider.classify(batch));
        verify(span).setAttribute("error", true);
        verify(span).end();
    }
}
