package com.example.datalake.docqa.service;

import com.example.datalake.docqa.exception.GenerationUnavailableException;
import com.example.datalake.docqa.model.RankedPassage;
import dev.langchain4j.model.chat.ChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Grounded answer generation. The model is told to answer only from the passages and to reply
 * with {@link #NO_ANSWER} otherwise.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerGenerator {

    public static final String NO_ANSWER = "I don't have enough information to answer that question.";
    private static final String NO_ANSWER_MARKER = "I don't have enough information";

    private static final String PASSAGE_SEPARATOR = "\n\n---\n\n";

    private final ChatModel chatModel;

    public String answer(String question, List<RankedPassage> passages) {
        List<String> context = passages == null ? List.of() : passages.stream()
                .filter(Objects::nonNull)
                .map(RankedPassage::content)
                .filter(c -> c != null && !c.isBlank())
                .toList();
        if (context.isEmpty()) {
            log.debug("No passages for question, skipping model call");
            return NO_ANSWER;
        }

        String prompt = buildPrompt(question, context);
        String answer;
        try {
            answer = chatModel.chat(prompt);
        } catch (RuntimeException e) {
            log.warn("Answer generation failed – {}", e.getMessage());
            throw new GenerationUnavailableException("Failed to generate answer", e);
        }
        if (answer == null || answer.isBlank()) {
            return NO_ANSWER;
        }
        return answer.trim();
    }

    public static boolean isNoAnswer(String answer) {
        return answer == null || answer.contains(NO_ANSWER_MARKER);
    }

    static String buildPrompt(String question, List<String> context) {
        return """
                You are a helpful AI assistant. Answer the question based ONLY on the provided context. \
                If the answer cannot be found in the context, say "%s"

                Context:
                %s

                Question: %s

                Answer:""".formatted(NO_ANSWER, context.stream().collect(Collectors.joining(PASSAGE_SEPARATOR)), question);
    }
}
