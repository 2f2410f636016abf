package com.novelvision.visualization.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Catalog collaborator: page and book lookups before job creation, page write-back after
 * completion.
 */
public interface CatalogClient {
  Optional<PageInfo> getPage(String pageId);

  Optional<BookVisualizationSettings> getBookVisualizationSettings(String bookId);

  /** Pages of a book in reading order; page content is not included. */
  List<PageInfo> getBookPages(String bookId);

  void setPageVisualization(
      String bookId,
      String chapterId,
      String pageId,
      String imageUrl,
      String thumbnailUrl,
      String jobId);
}
