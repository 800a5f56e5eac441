package com.naagi.ragflow.tools;

import java.util.List;

/**
 * Picks the document category a question should be searched in.
 */
public interface CategoryRouter {

    /**
     * @param question            the user question
     * @param availableCategories categories that currently have documents
     * @param conversationContext short summary of the last turns, may be empty
     */
    CategoryDecision route(String question, List<String> availableCategories, String conversationContext);
}
