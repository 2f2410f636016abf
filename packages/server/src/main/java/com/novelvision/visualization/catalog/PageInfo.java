package com.novelvision.visualization.catalog;

/** Catalog view of a page. {@code content} may be {@code null} in page listings. */
public record PageInfo(
    String pageId,
    String bookId,
    String chapterId,
    int pageNumber,
    String content,
    boolean visualizationPoint,
    boolean hasVisualization) {}
