/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Stepwise.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.stepwise.parser;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazy, memoizing decoder of {@link RawEntity} records. Each id is tokenized at most once per winning writer: the
 * first decoded value inserted for an id is the one every caller sees.
 *
 * @author hal.hildebrand
 */
public class EntityDecoder {

    private final String                       content;
    private final Map<EntityId, DecodedEntity> cache = new ConcurrentHashMap<>();

    public EntityDecoder(String content) {
        this.content = content;
    }

    public int cacheSize() {
        return cache.size();
    }

    public void clearCache() {
        cache.clear();
    }

    /**
     * @return the decoded form of {@code raw}, from the cache when already decoded
     * @throws StepException.Syntax attributed to the raw entity's id
     */
    public DecodedEntity decode(RawEntity raw) {
        var cached = cache.get(raw.id());
        if (cached != null) {
            return cached;
        }
        var decoded = decodeUncached(raw);
        var existing = cache.putIfAbsent(raw.id(), decoded);
        return existing != null ? existing : decoded;
    }

    public boolean isCached(EntityId id) {
        return cache.containsKey(id);
    }

    private DecodedEntity decodeUncached(RawEntity raw) {
        try {
            var tokens = StepTokenizer.tokenize(content, raw.argStart(), raw.argEnd());
            return new DecodedEntity(raw.id(), raw.typeName(), AttributeValue.ofAll(tokens));
        } catch (StepException.Syntax e) {
            throw new StepException.Syntax(e.getOffset(), raw.id(), e.getDetail(), e);
        }
    }
}
