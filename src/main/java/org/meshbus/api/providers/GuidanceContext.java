package org.meshbus.api.providers;

import java.util.Map;

/**
 * Context of a free-form guidance question.
 *
 * @param thoughtId     The thought that raised the question.
 * @param taskId        The task the thought belongs to.
 * @param question      The question asked.
 * @param domainContext Additional key/value hints for the authority.
 */
public record GuidanceContext(String thoughtId, String taskId, String question, Map<String, String> domainContext) {

    public GuidanceContext {
        domainContext = domainContext == null ? Map.of() : Map.copyOf(domainContext);
    }
}
