package cull.email.app.service;

import cull.email.app.entity.MailboxLabel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MarkerLabelCacheTest {

    private static final String PREFIX = "cull-gmail/processed/";

    @Mock
    private GmailApiService gmailApiService;

    private MarkerLabelCache cache;

    @BeforeEach
    void setUp() {
        cache = new MarkerLabelCache(gmailApiService);
    }

    @Test
    void seed_ShouldKeepOnlyMarkerLabels() {
        // When
        cache.seed(List.of(
            new MailboxLabel("INBOX", "INBOX"),
            new MailboxLabel(PREFIX + "rule-1", "Label_9"),
            new MailboxLabel("news", "Label_2")), PREFIX);

        // Then
        assertEquals(1, cache.size());
        assertEquals(Optional.of("Label_9"), cache.find(PREFIX + "rule-1"));
        assertEquals(Optional.empty(), cache.find("news"));
    }

    @Test
    void resolve_WhenUnknown_ShouldCreateOnceAndCache() throws IOException {
        // Given
        when(gmailApiService.ensureLabel(PREFIX + "rule-2")).thenReturn("Label_20");

        // When
        String first = cache.resolve(PREFIX + "rule-2");
        String second = cache.resolve(PREFIX + "rule-2");

        // Then
        assertEquals("Label_20", first);
        assertEquals("Label_20", second);
        verify(gmailApiService, times(1)).ensureLabel(PREFIX + "rule-2");
    }

    @Test
    void resolve_WhenSeeded_ShouldNotCallGmail() throws IOException {
        // Given
        cache.seed(List.of(new MailboxLabel(PREFIX + "rule-1", "Label_9")), PREFIX);

        // When & Then
        assertEquals("Label_9", cache.resolve(PREFIX + "rule-1"));
        verifyNoInteractions(gmailApiService);
    }

    @Test
    void resolve_WhenCreationFails_ShouldThrowIOExceptionAndNotCache() throws IOException {
        // Given
        when(gmailApiService.ensureLabel(PREFIX + "rule-3")).thenThrow(new IOException("quota"));

        // When & Then
        IOException exception = assertThrows(IOException.class, () -> cache.resolve(PREFIX + "rule-3"));
        assertEquals("quota", exception.getMessage());
        assertEquals(0, cache.size());
    }
}
