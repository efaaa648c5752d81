package com.openforge.memkeep.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StreamManagerTest {

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    private StreamManager newStream(int contextCap) {
        return new StreamManager(new StreamProperties(contextCap, 0.85, 12, 3, 15,
                dir.resolve("stream.json").toString(), dir.resolve("snapshot.txt").toString(), true), objectMapper);
    }

    @Test
    void tokenEstimateIsCeilingOfQuarterLength() {
        assertThat(StreamManager.estimateTokens("")).isZero();
        assertThat(StreamManager.estimateTokens("abc")).isEqualTo(1);
        assertThat(StreamManager.estimateTokens("abcd")).isEqualTo(1);
        assertThat(StreamManager.estimateTokens("abcde")).isEqualTo(2);
        assertThat(StreamManager.estimateTokens(null)).isZero();
    }

    @Test
    void estimateIsSumOverTurns() {
        StreamManager stream = newStream(64000);
        stream.append(ConversationTurn.user("abcde"), ConversationTurn.assistant("abcd"));

        assertThat(stream.estimateTokens()).isEqualTo(3);
    }

    @Test
    void budgetTripsAboveEightyFivePercentOfCap() {
        StreamManager stream = newStream(100);
        // 85 tokens is exactly the threshold, not over it
        stream.append(ConversationTurn.user("x".repeat(340)));
        assertThat(stream.isOverBudget()).isFalse();

        stream.append(ConversationTurn.user("y"));
        assertThat(stream.isOverBudget()).isTrue();
        assertThat(stream.isOverBudget(1000)).isFalse();
    }

    @Test
    void recentReturnsTailInOrder() {
        StreamManager stream = newStream(64000);
        for (int i = 0; i < 5; i++) {
            stream.append(ConversationTurn.user("m" + i));
        }

        assertThat(stream.recent(2)).extracting(ConversationTurn::text).containsExactly("m3", "m4");
        assertThat(stream.recent(50)).hasSize(5);
        assertThat(stream.recent(0)).isEmpty();
    }

    @Test
    void survivesRestartThroughStreamFile() {
        StreamManager first = newStream(64000);
        first.append(ConversationTurn.user("I like hiking"), ConversationTurn.assistant("Noted."));

        StreamManager second = newStream(64000);

        assertThat(second.snapshot()).containsExactly(
                ConversationTurn.user("I like hiking"), ConversationTurn.assistant("Noted."));
    }

    @Test
    void corruptStreamFileStartsEmpty() throws Exception {
        Files.writeString(dir.resolve("stream.json"), "{not json");

        StreamManager stream = newStream(64000);

        assertThat(stream.size()).isZero();
    }

    @Test
    void replaceAndClearArePersisted() {
        StreamManager stream = newStream(64000);
        stream.append(ConversationTurn.user("a"), ConversationTurn.user("b"));
        stream.replace(List.of(ConversationTurn.system("summary")));

        assertThat(newStream(64000).snapshot()).containsExactly(ConversationTurn.system("summary"));

        stream.clear();
        assertThat(newStream(64000).size()).isZero();
    }
}
