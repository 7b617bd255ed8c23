package com.tumorboard.llm;

import com.tumorboard.llm.completion.ChatMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssessmentPromptsTest {

    @Test
    void promptIsDeterministicAndEmbedsInputs() {
        String first = AssessmentPrompts.buildUserPrompt("EGFR", "L858R", "NSCLC", "Evidence for EGFR L858R:");
        String second = AssessmentPrompts.buildUserPrompt("EGFR", "L858R", "NSCLC", "Evidence for EGFR L858R:");
        assertEquals(first, second);
        assertTrue(first.contains("Gene: EGFR"));
        assertTrue(first.contains("Variant: L858R"));
        assertTrue(first.contains("Tumor Type: NSCLC"));
        assertTrue(first.contains("Evidence for EGFR L858R:"));
    }

    @Test
    void blankGeneOrVariantIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> AssessmentPrompts.buildUserPrompt(" ", "V600E", "x", ""));
        assertThrows(IllegalArgumentException.class, () -> AssessmentPrompts.buildUserPrompt("BRAF", null, "x", ""));
    }

    @Test
    void messagesStartWithSystemPrompt() {
        List<ChatMessage> messages = AssessmentPrompts.buildMessages("BRAF", "V600E", "Melanoma", null);
        assertEquals(2, messages.size());
        assertEquals(AssessmentPrompts.SYSTEM_PROMPT, messages.get(0).getContent());
        assertTrue(messages.get(1).getContent().contains("No evidence found in databases."));
        assertTrue(AssessmentPrompts.SYSTEM_PROMPT.contains("Tier I"));
    }
}
