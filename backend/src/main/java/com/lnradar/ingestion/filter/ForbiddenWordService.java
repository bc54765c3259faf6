package com.lnradar.ingestion.filter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Runtime additions to the forbidden-word set. New words apply to future memos; stored memos change only when
 * a re-sanitization pass is requested.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ForbiddenWordService {

    private final ForbiddenWordRegistry registry;
    private final MemoResanitizer memoResanitizer;

    /**
     * @return true if the word was new
     */
    public boolean addWord(String word, boolean resanitizeStored) {
        boolean added = registry.add(word);
        if (added) {
            log.info("Forbidden word added ({} total)", registry.snapshot().size());
        }
        if (resanitizeStored) {
            memoResanitizer.resanitizeAsync();
        }
        return added;
    }

    public Set<String> words() {
        return registry.snapshot();
    }
}
