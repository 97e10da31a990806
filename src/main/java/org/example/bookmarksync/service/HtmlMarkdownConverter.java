package org.example.bookmarksync.service;

/**
 * Converts crawled page HTML into Markdown for the content snapshot section.
 * Implementations may throw; callers treat a failure as "no snapshot".
 */
public interface HtmlMarkdownConverter {

    String convert(String html);
}
