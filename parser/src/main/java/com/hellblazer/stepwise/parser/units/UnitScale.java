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
package com.hellblazer.stepwise.parser.units;

import com.hellblazer.stepwise.parser.AttributeValue;
import com.hellblazer.stepwise.parser.DecodedEntity;
import com.hellblazer.stepwise.parser.EntityResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Length unit of a model, as the factor converting file units to metres.
 * <p>
 * Follows IFCPROJECT.UnitsInContext (8) to the IFCUNITASSIGNMENT unit list (0) and takes the first LENGTHUNIT, an
 * IFCSIUNIT(*, .LENGTHUNIT., prefix, .METRE.) or an IFCCONVERSIONBASEDUNIT whose factor is an
 * IFCMEASUREWITHUNIT(value, unit). Anything missing yields 1.0.
 *
 * @author hal.hildebrand
 */
public final class UnitScale {
    private static final Logger log = LoggerFactory.getLogger(UnitScale.class);

    public static final double DEFAULT = 1.0;

    private static final Map<String, Double> SI_PREFIXES = Map.ofEntries(Map.entry("EXA", 1e18),
                                                                         Map.entry("PETA", 1e15),
                                                                         Map.entry("TERA", 1e12),
                                                                         Map.entry("GIGA", 1e9),
                                                                         Map.entry("MEGA", 1e6),
                                                                         Map.entry("KILO", 1e3),
                                                                         Map.entry("HECTO", 1e2),
                                                                         Map.entry("DECA", 1e1),
                                                                         Map.entry("DECI", 1e-1),
                                                                         Map.entry("CENTI", 1e-2),
                                                                         Map.entry("MILLI", 1e-3),
                                                                         Map.entry("MICRO", 1e-6),
                                                                         Map.entry("NANO", 1e-9),
                                                                         Map.entry("PICO", 1e-12),
                                                                         Map.entry("FEMTO", 1e-15),
                                                                         Map.entry("ATTO", 1e-18));

    private static final int MAX_CONVERSION_DEPTH = 8;

    private UnitScale() {
    }

    /**
     * @return metres per file length unit
     */
    public static double extract(EntityResolver resolver) {
        var projects = resolver.findByTypeName("IFCPROJECT");
        if (projects.isEmpty()) {
            return DEFAULT;
        }
        var assignment = resolver.get(projects.get(0))
                                 .flatMap(project -> project.getRef(8))
                                 .flatMap(resolver::get);
        if (assignment.isEmpty()) {
            return DEFAULT;
        }
        for (var unitRef : assignment.get().getRefs(0)) {
            var scale = resolver.get(unitRef).flatMap(unit -> lengthScale(unit, resolver, 0));
            if (scale.isPresent()) {
                log.debug("Length unit {} scales by {}", unitRef, scale.get());
                return scale.get();
            }
        }
        return DEFAULT;
    }

    /**
     * @return the scale factor of an SI prefix name such as {@code MILLI}, 1.0 for unknown names
     */
    public static double prefixScale(String prefix) {
        return SI_PREFIXES.getOrDefault(prefix, 1.0);
    }

    private static Optional<Double> conversionScale(DecodedEntity unit, EntityResolver resolver, int depth) {
        if (depth >= MAX_CONVERSION_DEPTH) {
            return Optional.empty();
        }
        var factor = unit.getRef(3).flatMap(resolver::get).filter(f -> f.isType("IFCMEASUREWITHUNIT"));
        if (factor.isEmpty()) {
            return Optional.empty();
        }
        var value = factor.get().getFloat(0);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        var base = factor.get()
                         .getRef(1)
                         .flatMap(resolver::get)
                         .flatMap(b -> lengthScale(b, resolver, depth + 1))
                         .orElse(DEFAULT);
        return Optional.of(value.getAsDouble() * base);
    }

    private static Optional<Double> lengthScale(DecodedEntity unit, EntityResolver resolver, int depth) {
        if (!"LENGTHUNIT".equals(unit.getEnum(1).orElse(null))) {
            return Optional.empty();
        }
        return switch (unit.getTypeName()) {
            case "IFCSIUNIT" -> siScale(unit);
            case "IFCCONVERSIONBASEDUNIT" -> conversionScale(unit, resolver, depth);
            default -> Optional.empty();
        };
    }

    private static Optional<Double> siScale(DecodedEntity unit) {
        if (!"METRE".equals(unit.getEnum(3).orElse(null))) {
            return Optional.empty();
        }
        var prefix = unit.get(2).flatMap(AttributeValue::asEnum).map(UnitScale::prefixScale).orElse(1.0);
        return Optional.of(prefix);
    }
}
