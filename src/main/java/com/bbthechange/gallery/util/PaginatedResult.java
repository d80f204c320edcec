package com.bbthechange.gallery.util;

import java.util.List;

/**
 * One page of repository results plus the opaque token for the next page.
 *
 * @param <T> item type
 */
public class PaginatedResult<T> {

    private final List<T> results;
    private final String nextToken;

    public PaginatedResult(List<T> results, String nextToken) {
        this.results = results;
        this.nextToken = nextToken;
    }

    public List<T> getResults() {
        return results;
    }

    /**
     * @return token for the next page, or null on the last page
     */
    public String getNextToken() {
        return nextToken;
    }

    public boolean hasMore() {
        return nextToken != null;
    }

    public int size() {
        return results != null ? results.size() : 0;
    }
}
