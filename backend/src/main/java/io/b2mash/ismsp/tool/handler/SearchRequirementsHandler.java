package io.b2mash.ismsp.tool.handler;

import io.b2mash.ismsp.search.KeywordSearch;
import io.b2mash.ismsp.tool.ToolHandler;
import io.b2mash.ismsp.tool.ToolOperation;
import io.b2mash.ismsp.tool.ToolRequests.SearchRequirements;
import io.b2mash.ismsp.tool.ToolResponses.SearchResult;
import org.springframework.stereotype.Component;

@Component
public class SearchRequirementsHandler implements ToolHandler<SearchRequirements> {

  private final KeywordSearch keywordSearch;

  public SearchRequirementsHandler(KeywordSearch keywordSearch) {
    this.keywordSearch = keywordSearch;
  }

  @Override
  public ToolOperation operation() {
    return ToolOperation.SEARCH_REQUIREMENTS;
  }

  @Override
  public Class<SearchRequirements> requestType() {
    return SearchRequirements.class;
  }

  @Override
  public SearchResult handle(SearchRequirements request) {
    var matches = keywordSearch.search(request.keyword());
    return new SearchResult(request.keyword(), matches.size(), matches);
  }
}
