package com.openforge.memkeep.gateway;

import java.util.List;

public interface WebSearchClient {

    List<SearchResult> search(String query);

    record SearchResult(String title, String body, String url) {}
}
