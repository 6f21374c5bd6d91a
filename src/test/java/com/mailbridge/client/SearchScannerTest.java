package com.mailbridge.client;

import com.mailbridge.config.MailBridgeProperties;
import com.mailbridge.domain.MailMessage;
import com.mailbridge.domain.SearchField;
import com.mailbridge.domain.SearchPage;
import com.mailbridge.domain.SearchRequest;
import com.mailbridge.exception.ErrorKind;
import com.mailbridge.exception.MailBridgeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SearchScanner unit tests
 */
class SearchScannerTest {

    private MailBridgeProperties properties;
    private SearchScanner scanner;

    /** ids 30..1, every third id has "invoice" in the subject */
    private final List<String> ids = IntStream.iterate(30, i -> i >= 1, i -> i - 1)
            .mapToObj(String::valueOf)
            .collect(Collectors.toList());

    private final List<String> loaded = new ArrayList<>();

    private final Function<String, MailMessage> loader = id -> {
        loaded.add(id);
        int n = Integer.parseInt(id);
        return MailMessage.builder()
                .id(id)
                .sender("sender" + n + "@example.com")
                .subject(n % 3 == 0 ? "Invoice " + n : "Hello " + n)
                .body("body")
                .build();
    };

    @BeforeEach
    void setUp() {
        properties = new MailBridgeProperties();
        scanner = new SearchScanner(properties);
    }

    @Test
    @DisplayName("First page returns up to pageSize matches in id order")
    void testFirstPage() {
        SearchPage page = scanner.scan(ids, request(3, null), loader);

        assertThat(page.getMessages()).extracting(MailMessage::getId).containsExactly("30", "27", "24");
        assertThat(page.getLastId()).isEqualTo("24");
        assertThat(page.isHasMore()).isTrue();
        assertThat(page.getScanned()).isEqualTo(7);
    }

    @Test
    @DisplayName("Following the cursor covers every match exactly once")
    void testPaginationCoverage() {
        Set<String> seen = new HashSet<>();
        List<String> order = new ArrayList<>();
        String cursor = null;
        int pages = 0;
        SearchPage page;
        do {
            page = scanner.scan(ids, request(4, cursor), loader);
            for (MailMessage message : page.getMessages()) {
                assertThat(seen.add(message.getId())).as("duplicate " + message.getId()).isTrue();
                order.add(message.getId());
            }
            cursor = page.getLastId();
            pages++;
        } while (page.isHasMore() && pages < 20);

        assertThat(order).containsExactly("30", "27", "24", "21", "18", "15", "12", "9", "6", "3");
        assertThat(loaded).doesNotHaveDuplicates();
        assertThat(loaded).hasSize(30);
    }

    @Test
    @DisplayName("A page scans at most pageSize * scanBudgetFactor messages")
    void testScanBudget() {
        properties.getSearch().setScanBudgetFactor(2);

        SearchPage page = scanner.scan(ids, request(2, null).toBuilder().keywords("nomatch").build(), loader);

        assertThat(page.getMessages()).isEmpty();
        assertThat(page.getScanned()).isEqualTo(4);
        assertThat(page.getLastId()).isEqualTo("27");
        assertThat(page.isHasMore()).isTrue();
    }

    @Test
    @DisplayName("hasMore is false once the list is exhausted")
    void testExhausted() {
        SearchPage page = scanner.scan(ids, request(5, "2"), loader);

        assertThat(page.getMessages()).isEmpty();
        assertThat(page.getScanned()).isEqualTo(1);
        assertThat(page.getLastId()).isEqualTo("1");
        assertThat(page.isHasMore()).isFalse();
    }

    @Test
    @DisplayName("Messages that fail to load are counted as scanned and skipped")
    void testDecodeFailureSkipped() {
        Function<String, MailMessage> flaky = id -> {
            if ("30".equals(id)) {
                throw new MailBridgeException(ErrorKind.DECODE_FAILURE, "broken");
            }
            return loader.apply(id);
        };

        SearchPage page = scanner.scan(ids, request(1, null), flaky);

        assertThat(page.getMessages()).extracting(MailMessage::getId).containsExactly("27");
        assertThat(page.getScanned()).isEqualTo(4);
    }

    @Test
    @DisplayName("An unknown cursor restarts from the head")
    void testUnknownCursor() {
        SearchPage page = scanner.scan(ids, request(1, "999"), loader);

        assertThat(page.getMessages()).extracting(MailMessage::getId).containsExactly("30");
    }

    @Test
    @DisplayName("Blank keywords produce an empty page without loading anything")
    void testBlankKeywords() {
        SearchPage page = scanner.scan(ids, request(5, null).toBuilder().keywords("   ").build(), loader);

        assertThat(page.getMessages()).isEmpty();
        assertThat(page.isHasMore()).isFalse();
        assertThat(loaded).isEmpty();
    }

    private static SearchRequest request(int pageSize, String lastId) {
        return SearchRequest.builder()
                .keywords("invoice")
                .field(SearchField.SUBJECT)
                .pageSize(pageSize)
                .lastId(lastId)
                .build();
    }
}
