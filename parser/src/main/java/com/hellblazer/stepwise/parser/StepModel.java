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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The entity store of one file: raw records by id, a type index built while scanning, and the lazy decode cache.
 * The id and type maps are populated once before the model is published and are read only afterwards.
 *
 * @author hal.hildebrand
 */
public class StepModel implements EntityResolver {
    private static final Logger log = LoggerFactory.getLogger(StepModel.class);

    private final String                      content;
    private final Map<EntityId, RawEntity>    rawEntities;
    private final Map<String, List<EntityId>> typeIndex;
    private final EntityDecoder               decoder;

    private StepModel(String content, Map<EntityId, RawEntity> rawEntities, Map<String, List<EntityId>> typeIndex) {
        this.content = content;
        this.rawEntities = Collections.unmodifiableMap(rawEntities);
        this.typeIndex = Collections.unmodifiableMap(typeIndex);
        this.decoder = new EntityDecoder(content);
    }

    /**
     * Scan {@code content} completely, failing on the first malformed record.
     */
    public static StepModel scan(String content) {
        return scan(new StepScanner(content), content, e -> {
            throw e;
        });
    }

    /**
     * Scan to the end of the DATA section. Structural errors go to {@code onError}, which may rethrow to abort; when
     * it returns, scanning resumes with the next record. A duplicate id keeps the first record.
     */
    public static StepModel scan(StepScanner scanner, String content, Consumer<StepException> onError) {
        var raw = new LinkedHashMap<EntityId, RawEntity>();
        var types = new HashMap<String, List<EntityId>>();
        while (true) {
            Optional<RawEntity> next;
            try {
                next = scanner.next();
            } catch (StepException.MalformedRecord e) {
                onError.accept(e);
                continue;
            }
            if (next.isEmpty()) {
                break;
            }
            var entity = next.get();
            if (raw.putIfAbsent(entity.id(), entity) != null) {
                log.warn("Duplicate entity {} at offset {}, keeping the first definition", entity.id(),
                         entity.offset());
                onError.accept(new StepException.MalformedRecord(entity.offset(),
                                                                 entity.id() + "=" + entity.typeName(),
                                                                 "duplicate entity id"));
                continue;
            }
            types.computeIfAbsent(entity.typeName(), t -> new ArrayList<>()).add(entity.id());
        }
        types.replaceAll((t, ids) -> List.copyOf(ids));
        log.debug("Scanned {} entities of {} types", raw.size(), types.size());
        return new StepModel(content, raw, types);
    }

    @Override
    public Collection<EntityId> allIds() {
        return rawEntities.keySet();
    }

    @Override
    public boolean contains(EntityId id) {
        return rawEntities.containsKey(id);
    }

    public String getContent() {
        return content;
    }

    public EntityDecoder getDecoder() {
        return decoder;
    }

    @Override
    public int entityCount() {
        return rawEntities.size();
    }

    @Override
    public List<EntityId> findByTypeName(String typeName) {
        return typeIndex.getOrDefault(typeName, List.of());
    }

    @Override
    public Optional<DecodedEntity> get(EntityId id) {
        var raw = rawEntities.get(id);
        if (raw == null) {
            return Optional.empty();
        }
        return Optional.of(decoder.decode(raw));
    }

    /**
     * Decode {@code ids} ahead of use. Ids not in the file and entities that fail to decode are skipped.
     */
    public void preload(Collection<EntityId> ids) {
        ids.parallelStream().map(rawEntities::get).filter(r -> r != null).forEach(r -> {
            try {
                decoder.decode(r);
            } catch (StepException.Syntax e) {
                log.debug("Preload skipped {}: {}", r.id(), e.getMessage());
            }
        });
    }

    public Optional<RawEntity> raw(EntityId id) {
        return Optional.ofNullable(rawEntities.get(id));
    }

    /**
     * @return the undecoded argument list of an entity, parentheses included
     */
    public Optional<String> rawArguments(EntityId id) {
        return raw(id).map(r -> r.arguments(content));
    }

    /**
     * @return the number of entities of each type
     */
    public Map<String, Integer> typeCounts() {
        var counts = new HashMap<String, Integer>();
        typeIndex.forEach((type, ids) -> counts.put(type, ids.size()));
        return counts;
    }

    @Override
    public Optional<String> typeName(EntityId id) {
        return raw(id).map(RawEntity::typeName);
    }
}
