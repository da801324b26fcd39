package de.bsommerfeld.threadline.engine;

import de.bsommerfeld.threadline.cache.CacheSnapshot;
import de.bsommerfeld.threadline.core.domain.ConversationThread;
import de.bsommerfeld.threadline.core.domain.PostFact;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Case-insensitive search over conversations: a thread matches if the query
 * occurs in a participant handle, in the root post's text, or in the cached
 * text of any of its replies.
 */
public final class ConversationFilter {

    private ConversationFilter() {
    }

    public static List<ConversationThread> filter(List<ConversationThread> threads, String query,
            CacheSnapshot snapshot) {
        if (query == null || query.isBlank()) {
            return threads;
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return threads.stream()
                .filter(thread -> matches(thread, needle, snapshot))
                .collect(Collectors.toList());
    }

    private static boolean matches(ConversationThread thread, String needle, CacheSnapshot snapshot) {
        boolean participantMatch = thread.participantHandles().stream()
                .anyMatch(handle -> contains(handle, needle));
        if (participantMatch) {
            return true;
        }
        if (thread.rootPost() != null && contains(thread.rootPost().content(), needle)) {
            return true;
        }
        return thread.replies().stream()
                .map(reply -> snapshot.get(reply.uri()).map(PostFact::content).orElse(null))
                .anyMatch(text -> contains(text, needle));
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
