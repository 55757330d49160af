package com.geochat.routing.service;

import com.geochat.routing.model.DomainConfig;
import com.geochat.routing.model.DomainConfig.EntityAlias;
import com.geochat.routing.model.RecognizedEntity;
import com.geochat.routing.text.QueryText;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds brand and place names in a query. Matching is whole-token and case-insensitive;
 * the longest alias wins where aliases overlap, and every alias resolves to its
 * entity's canonical id.
 */
@Component
public class EntityRecognizer {

    public List<RecognizedEntity> recognize(QueryText text, DomainConfig config) {
        boolean[] claimed = new boolean[text.size()];
        List<RecognizedEntity> found = new ArrayList<>();
        // aliases are sorted longest first
        for (EntityAlias alias : config.getEntityAliases()) {
            int length = alias.getTokens().size();
            for (int start : text.occurrences(alias.getTokens())) {
                if (isClaimed(claimed, start, length)) {
                    continue;
                }
                for (int i = start; i < start + length; i++) {
                    claimed[i] = true;
                }
                QueryText.Token first = text.getTokens().get(start);
                QueryText.Token last = text.getTokens().get(start + length - 1);
                found.add(new RecognizedEntity(
                        alias.getEntity().getId(),
                        alias.getEntity().getType(),
                        text.span(start, start + length - 1),
                        alias.getEntity().getCode(),
                        first.getStart(),
                        last.getEnd()));
            }
        }
        found.sort((a, b) -> Integer.compare(a.getStart(), b.getStart()));
        return found;
    }

    /**
     * First occurrence of each canonical entity, in text order.
     */
    public List<RecognizedEntity> distinct(List<RecognizedEntity> entities) {
        Map<String, RecognizedEntity> byId = new LinkedHashMap<>();
        for (RecognizedEntity entity : entities) {
            byId.putIfAbsent(entity.getCanonicalId(), entity);
        }
        return new ArrayList<>(byId.values());
    }

    private static boolean isClaimed(boolean[] claimed, int start, int length) {
        for (int i = start; i < start + length; i++) {
            if (claimed[i]) {
                return true;
            }
        }
        return false;
    }
}
