package com.github.dimitryivaniuta.agentgateway.agent.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.agentgateway.agent.UpstreamFailureException;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for reading upstream JSON bodies.
 */
final class ProviderResponses {

    private ProviderResponses() {
    }

    /**
     * Integer-valued fields of a usage object; nested objects are skipped. Null when absent.
     */
    static Map<String, Integer> usage(JsonNode usage) {
        if (usage == null || !usage.isObject()) return null;
        Map<String, Integer> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = usage.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getValue().canConvertToInt()) {
                out.put(e.getKey(), e.getValue().intValue());
            }
        }
        return out.isEmpty() ? null : out;
    }

    static String requireText(String agent, JsonNode node, String what) {
        if (node == null || !node.isTextual()) {
            throw UpstreamFailureException.malformed(agent, "missing " + what);
        }
        return node.asText();
    }
}
