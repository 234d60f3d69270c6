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
package com.hellblazer.stepwise.parser.properties;

import com.hellblazer.stepwise.parser.AttributeValue;
import com.hellblazer.stepwise.parser.DecodedEntity;
import com.hellblazer.stepwise.parser.EntityId;
import com.hellblazer.stepwise.parser.EntityResolver;
import com.hellblazer.stepwise.parser.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Property sets and quantities attached to elements through IFCRELDEFINESBYPROPERTIES, plus the common IfcRoot and
 * IfcElement attributes.
 * <p>
 * The relationship index is built once in the constructor; property values are decoded on each query.
 *
 * @author hal.hildebrand
 */
public class PropertyReader {
    private static final Logger log = LoggerFactory.getLogger(PropertyReader.class);

    private final EntityResolver                resolver;
    private final Map<EntityId, List<EntityId>> propertySets = new HashMap<>();
    private final Map<EntityId, List<EntityId>> quantitySets = new HashMap<>();

    public PropertyReader(EntityResolver resolver) {
        this.resolver = resolver;
        for (var relId : resolver.findByTypeName("IFCRELDEFINESBYPROPERTIES")) {
            var rel = decode(relId);
            if (rel == null) {
                continue;
            }
            var definition = rel.getRef(5);
            if (definition.isEmpty()) {
                continue;
            }
            var target = switch (resolver.typeName(definition.get()).orElse("")) {
                case "IFCPROPERTYSET" -> propertySets;
                case "IFCELEMENTQUANTITY" -> quantitySets;
                default -> null;
            };
            if (target == null) {
                continue;
            }
            for (var related : rel.getRefs(4)) {
                target.computeIfAbsent(related, k -> new ArrayList<>()).add(definition.get());
            }
        }
        log.debug("Indexed property sets for {} and quantities for {} entities", propertySets.size(),
                  quantitySets.size());
    }

    /**
     * Floats print with up to six decimals, trailing zeros removed.
     */
    static String formatNumber(double value) {
        var text = String.format(Locale.ROOT, "%.6f", value);
        if (text.indexOf('.') >= 0) {
            int end = text.length();
            while (text.charAt(end - 1) == '0') {
                end--;
            }
            if (text.charAt(end - 1) == '.') {
                end--;
            }
            text = text.substring(0, end);
        }
        return "-0".equals(text) ? "0" : text;
    }

    static String formatValue(AttributeValue value) {
        if (value instanceof AttributeValue.StringValue s) {
            return s.value();
        } else if (value instanceof AttributeValue.IntegerValue i) {
            return Long.toString(i.value());
        } else if (value instanceof AttributeValue.FloatValue f) {
            return formatNumber(f.value());
        } else if (value instanceof AttributeValue.EnumValue e) {
            return e.asBoolean().map(String::valueOf).orElse(e.name());
        } else if (value instanceof AttributeValue.TypedValue t && !t.args().isEmpty()) {
            return formatValue(t.args().get(0));
        } else if (value instanceof AttributeValue.ListValue list) {
            return list.items().stream().map(PropertyReader::formatValue).collect(Collectors.joining(", "));
        } else if (value.isNull()) {
            return "";
        }
        return value.toString();
    }

    public Optional<String> description(EntityId id) {
        return stringAttribute(id, 3);
    }

    /**
     * @return ids of every element with at least one property set or quantity set
     */
    public List<EntityId> elementsWithProperties() {
        var ids = new ArrayList<EntityId>(propertySets.keySet());
        for (var id : quantitySets.keySet()) {
            if (!propertySets.containsKey(id)) {
                ids.add(id);
            }
        }
        ids.sort(null);
        return ids;
    }

    public Optional<String> globalId(EntityId id) {
        return stringAttribute(id, 0);
    }

    public Optional<String> name(EntityId id) {
        return stringAttribute(id, 2);
    }

    public Optional<String> objectType(EntityId id) {
        return stringAttribute(id, 4);
    }

    /**
     * @return the first property named {@code name} across the element's property sets
     */
    public Optional<Property> property(EntityId id, String name) {
        for (var set : propertySets(id)) {
            var found = set.get(name);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Property sets of an element in relationship order. Sets without any readable property are omitted.
     */
    public List<PropertySet> propertySets(EntityId id) {
        var result = new ArrayList<PropertySet>();
        for (var setId : propertySets.getOrDefault(id, List.of())) {
            var set = decode(setId);
            if (set == null) {
                continue;
            }
            var properties = new ArrayList<Property>();
            for (var propId : set.getRefs(4)) {
                var prop = decode(propId);
                if (prop != null) {
                    readProperty(prop).ifPresent(properties::add);
                }
            }
            if (!properties.isEmpty()) {
                result.add(new PropertySet(set.getString(2).orElse("Unknown"), properties));
            }
        }
        return result;
    }

    public List<Quantity> quantities(EntityId id) {
        var result = new ArrayList<Quantity>();
        for (var setId : quantitySets.getOrDefault(id, List.of())) {
            var set = decode(setId);
            if (set == null) {
                continue;
            }
            for (var quantityId : set.getRefs(5)) {
                var quantity = decode(quantityId);
                if (quantity != null) {
                    readQuantity(quantity).ifPresent(result::add);
                }
            }
        }
        return result;
    }

    public Optional<Quantity> quantity(EntityId id, String name) {
        return quantities(id).stream().filter(q -> q.name().equals(name)).findFirst();
    }

    public Optional<String> tag(EntityId id) {
        return stringAttribute(id, 7);
    }

    private DecodedEntity decode(EntityId id) {
        try {
            return resolver.get(id).orElse(null);
        } catch (StepException.Syntax e) {
            log.warn("Skipping property entity {}: {}", id, e.getMessage());
            return null;
        }
    }

    private Optional<Property> readProperty(DecodedEntity prop) {
        var name = prop.getString(0);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        switch (prop.getTypeName()) {
            case "IFCPROPERTYSINGLEVALUE": {
                var value = prop.get(2);
                if (value.isEmpty()) {
                    return Optional.empty();
                }
                var unit = prop.getRef(3).flatMap(this::unitName).orElse("");
                return Optional.of(new Property(name.get(), formatValue(value.get()), unit));
            }
            case "IFCPROPERTYENUMERATEDVALUE":
            case "IFCPROPERTYLISTVALUE":
                return prop.getList(2)
                           .map(values -> new Property(name.get(), formatValue(new AttributeValue.ListValue(values))));
            case "IFCPROPERTYBOUNDEDVALUE": {
                var upper = prop.get(2).filter(v -> !v.isNull()).map(PropertyReader::formatValue);
                var lower = prop.get(3).filter(v -> !v.isNull()).map(PropertyReader::formatValue);
                String value;
                if (lower.isPresent() && upper.isPresent()) {
                    value = lower.get() + " - " + upper.get();
                } else if (lower.isPresent()) {
                    value = ">= " + lower.get();
                } else if (upper.isPresent()) {
                    value = "<= " + upper.get();
                } else {
                    return Optional.empty();
                }
                return Optional.of(new Property(name.get(), value));
            }
            default:
                log.debug("Unsupported property type {} on {}", prop.getTypeName(), prop.getId());
                return Optional.empty();
        }
    }

    private Optional<Quantity> readQuantity(DecodedEntity quantity) {
        var name = quantity.getString(0).orElse("");
        var type = QuantityType.fromTypeName(quantity.getTypeName());
        if (type.isPresent()) {
            var value = quantity.getFloat(3);
            if (value.isEmpty()) {
                log.debug("Quantity {} has no value", quantity.getId());
                return Optional.empty();
            }
            return Optional.of(new Quantity(name, value.getAsDouble(), type.get()));
        }
        var attributes = quantity.getAttributes();
        for (int i = 3; i < attributes.size(); i++) {
            var value = attributes.get(i).asDouble();
            if (value.isPresent()) {
                return Optional.of(new Quantity(name, value.getAsDouble(), QuantityType.UNTYPED));
            }
        }
        log.warn("Quantity {} of type {} has no numeric value", quantity.getId(), quantity.getTypeName());
        return Optional.empty();
    }

    private Optional<String> stringAttribute(EntityId id, int index) {
        var entity = decode(id);
        return entity == null ? Optional.empty() : entity.getString(index);
    }

    private Optional<String> unitName(EntityId unitId) {
        var unit = decode(unitId);
        if (unit == null) {
            return Optional.empty();
        }
        if (unit.isType("IFCSIUNIT")) {
            var name = unit.getEnum(3);
            if (name.isEmpty()) {
                return Optional.empty();
            }
            var prefix = switch (unit.getEnum(2).orElse("")) {
                case "MILLI" -> "m";
                case "CENTI" -> "c";
                case "KILO" -> "k";
                default -> "";
            };
            var symbol = switch (name.get()) {
                case "METRE" -> "m";
                case "SQUARE_METRE" -> "m²";
                case "CUBIC_METRE" -> "m³";
                case "GRAM" -> "g";
                case "SECOND" -> "s";
                case "KELVIN" -> "K";
                case "AMPERE" -> "A";
                default -> name.get();
            };
            return Optional.of(prefix + symbol);
        } else if (unit.isType("IFCCONVERSIONBASEDUNIT")) {
            return unit.getString(2);
        }
        return Optional.empty();
    }
}
