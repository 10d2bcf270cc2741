package com.task.formfill.service.classify;

import com.task.formfill.model.Candidate;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Prompt text shared by every chat-based classification provider.
 */
public final class ClassificationPrompt {

    private ClassificationPrompt() {
    }

    public static String system() {
        return """
                You are an expert at analyzing form documents and identifying form fields.
                Convert the detected text elements into classified form fields and return VALID JSON ONLY.

                REQUIRED JSON STRUCTURE:
                {
                  "fields": [
                    {
                      "id": string (the ID of the text element, copied exactly),
                      "key": string (snake_case semantic key, e.g. "patient_name", "date_of_birth"),
                      "label": string (human-readable label, e.g. "Patient Name"),
                      "type": one of "text","checkbox","radio","select","date","signature","number","email","phone","address",
                      "required": boolean,
                      "confidence": number between 0 and 1,
                      "suggestions": [string]
                    }
                  ]
                }

                FIELD TYPES:
                - text: general text input (names, descriptions)
                - number: numeric values (SSN, amounts)
                - email: email addresses
                - phone: phone numbers
                - date: dates (birth dates, appointment dates)
                - checkbox: yes/no or selection boxes
                - radio: multiple choice selections
                - select: dropdown selections
                - signature: signature fields
                - address: full address fields

                RULES:
                1. Use the nearby text of each element to understand its purpose
                2. Mark fields as required if they appear essential (name, date, signature)
                3. Assign higher confidence to clear, unambiguous text
                4. Propose value suggestions where helpful
                5. Return ONLY valid JSON with no markdown, explanations, or extra text
                """;
    }

    public static String user(List<Candidate> batch) {
        String list = IntStream.range(0, batch.size())
                .mapToObj(i -> line(i + 1, batch.get(i)))
                .collect(Collectors.joining("\n"));

        return "Analyze the following text elements extracted from a form document and classify them as form fields:\n\n"
                + list
                + "\n\nConsider the context from nearby text, common form patterns (name, address, date, signature),"
                + " position relationships, and whether each element is a label, a value, or an instruction.";
    }

    private static String line(int n, Candidate c) {
        StringBuilder sb = new StringBuilder();
        sb.append(n).append(". ID: ").append(c.id())
                .append(", Text: \"").append(c.rawText()).append('"');
        if (c.bbox() != null) {
            sb.append(String.format(Locale.ROOT, ", Position: (%.3f, %.3f)", c.bbox().x(), c.bbox().y()));
        }
        if (!c.nearbyText().isEmpty()) {
            sb.append(", Nearby: [").append(String.join(", ", c.nearbyText())).append(']');
        }
        return sb.toString();
    }
}
