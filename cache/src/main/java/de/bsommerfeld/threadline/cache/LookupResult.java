package de.bsommerfeld.threadline.cache;

import com.google.common.collect.ImmutableList;
import de.bsommerfeld.threadline.core.domain.PostFact;

import java.util.List;

/**
 * Result of {@link PostFactCache#lookup}.
 *
 * @param found   cached facts
 * @param missing requested URIs with no cached fact
 */
public record LookupResult(List<PostFact> found, List<String> missing) {

    public LookupResult {
        found = ImmutableList.copyOf(found);
        missing = ImmutableList.copyOf(missing);
    }

    public boolean isComplete() {
        return missing.isEmpty();
    }
}
