package com.openforge.memkeep.tool.builtin;

import com.openforge.memkeep.gateway.EmailTransport;
import com.openforge.memkeep.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MessagingToolsTest {

    @Mock EmailTransport transport;

    @Test
    void emailSplitsIntoRecipientSubjectAndBody() {
        when(transport.send(any())).thenReturn("<abc@mail>");

        String result = new EmailTool(transport).execute("ana@example.org | Trip | See you | at noon");

        assertThat(result).isEqualTo("Email sent to ana@example.org with subject \"Trip\". Message ID: <abc@mail>");
        verify(transport).send(new EmailTransport.EmailMessage("ana@example.org", "Trip", "See you | at noon"));
    }

    @Test
    void malformedEmailShowsFormat() {
        assertThat(new EmailTool(transport).execute("ana@example.org | no body")).startsWith("Email format:");
        verifyNoInteractions(transport);
    }

    @Test
    void timeIsRenderedInUsEnglish() {
        TimeTool tool = new TimeTool(MutableClock.startingAt("2025-03-01T14:05:09Z"));

        assertThat(tool.execute("")).startsWith("Current date and time: Saturday, March 1, 2025 at 2:05:09 PM");
    }
}
